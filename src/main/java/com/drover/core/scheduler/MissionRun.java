package com.drover.core.scheduler;

import com.drover.core.agents.Agent;
import com.drover.core.agents.RoutingException;
import com.drover.core.escalation.EscalationProperties;
import com.drover.core.events.DroverEvent;
import com.drover.core.logging.MdcContext;
import com.drover.core.model.AgentMessage;
import com.drover.core.model.Escalation;
import com.drover.core.model.MessageKeys;
import com.drover.core.model.MessageType;
import com.drover.core.model.Mission;
import com.drover.core.model.MissionStatus;
import com.drover.core.model.PlanTask;
import com.drover.core.model.Task;
import com.drover.core.model.TaskResult;
import com.drover.core.model.TaskStatus;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

/**
 * One mission's coordinator.
 * <p>
 * The coordinator thread is the only writer of the mission's task map. Workers, timers and
 * escalation resolutions talk to it through {@link #signals}; readers only ever see the
 * immutable {@link Mission} published after each step.
 */
final class MissionRun implements MissionHandle, Runnable {

    private static final Logger log = LoggerFactory.getLogger(MissionRun.class);

    static final String CANCELLED = "cancelled";

    private interface Signal {}

    private record ReplyDelivered() implements Signal {}

    private record DispatchFailed(String messageId, String error, boolean admissionRejected) implements Signal {}

    private record TimedOut(String messageId) implements Signal {}

    private record RetryDue(String taskId) implements Signal {}

    private record EscalationResolved(String taskId, Escalation escalation) implements Signal {}

    private record Wakeup() implements Signal {}

    private record InFlight(String taskId, String agentId, long startedMs, ScheduledFuture<?> timer) {}

    private final MissionScheduler scheduler;
    private final String missionId;
    private final String address;
    private final boolean synthesize;
    private final boolean allowPartial;
    private final Duration taskTimeout;
    private final AdmissionPolicy admissionPolicy;
    private final Instant createdAt = Instant.now();

    private final BlockingQueue<Signal> signals = new LinkedBlockingQueue<>();
    private final CompletableFuture<Mission> completion = new CompletableFuture<>();

    // coordinator-thread state
    private final LinkedHashMap<String, Task> tasks = new LinkedHashMap<>();
    private final LinkedHashMap<String, TaskResult> results = new LinkedHashMap<>();
    private final Map<String, InFlight> inFlight = new HashMap<>();
    private final Map<String, Integer> rejections = new HashMap<>();
    private final Set<String> awaitingEscalation = new HashSet<>();
    private MissionStatus status = MissionStatus.PENDING;
    private String synthesis;
    private Instant completedAt;
    private boolean cancelObserved;
    private int skippedCount;

    private volatile boolean cancelRequested;
    private volatile Mission snapshot;

    MissionRun(MissionScheduler scheduler, String missionId, List<Task> plan, boolean synthesize,
               boolean allowPartial, Duration taskTimeout, AdmissionPolicy admissionPolicy) {
        this.scheduler = scheduler;
        this.missionId = missionId;
        this.address = "scheduler:" + missionId;
        this.synthesize = synthesize;
        this.allowPartial = allowPartial;
        this.taskTimeout = taskTimeout == null || taskTimeout.isZero() || taskTimeout.isNegative() ? null : taskTimeout;
        this.admissionPolicy = admissionPolicy;
        for (Task task : plan) {
            tasks.put(task.id(), task.withStatus(TaskStatus.PENDING));
        }
        publishSnapshot();
    }

    @Override
    public String missionId() {
        return missionId;
    }

    /** Bus address replies to this mission's task messages are sent to. */
    String address() {
        return address;
    }

    @Override
    public Mission snapshot() {
        return snapshot;
    }

    @Override
    public CompletableFuture<Mission> completion() {
        return completion;
    }

    @Override
    public Mission await(Duration timeout) {
        try {
            return completion.get(timeout.toMillis(), TimeUnit.MILLISECONDS);
        } catch (TimeoutException e) {
            return snapshot;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return snapshot;
        } catch (ExecutionException e) {
            log.error("Mission {} completed exceptionally: {}", missionId, e.getCause().getMessage());
            return snapshot;
        }
    }

    @Override
    public void cancel() {
        cancelRequested = true;
        signals.offer(new Wakeup());
    }

    // --- called from worker threads ---

    void replyDelivered() {
        if (completion.isDone()) {
            discardLateReplies();
            return;
        }
        signals.offer(new ReplyDelivered());
    }

    void dispatchFailed(String messageId, String error, boolean admissionRejected) {
        signals.offer(new DispatchFailed(messageId, error, admissionRejected));
    }

    // --- coordinator ---

    @Override
    public void run() {
        MdcContext.setMission(missionId);
        try {
            status = MissionStatus.RUNNING;
            log.info("Mission {} started with {} task(s)", missionId, tasks.size());
            coordinate();
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            log.warn("Coordinator for mission {} interrupted", missionId);
            cancelObserved = true;
            abandon("interrupted");
        } catch (RuntimeException e) {
            log.error("Coordinator for mission {} failed: {}", missionId, e.getMessage(), e);
            abandon("coordinator error: " + e.getMessage());
        } finally {
            finish();
            MdcContext.clear();
        }
    }

    private void coordinate() throws InterruptedException {
        while (true) {
            if (cancelRequested && !cancelObserved) {
                observeCancel();
            }
            boolean changed = promote();
            if (!cancelObserved) {
                changed |= dispatchReady();
            }
            if (changed) {
                continue;
            }
            publishSnapshot();
            if (!hasUnfinished()) {
                return;
            }
            handle(signals.take());
        }
    }

    /**
     * PENDING tasks become READY once their dependencies are DONE, or SKIPPED when one of them
     * can no longer succeed.
     */
    private boolean promote() {
        boolean changed = false;
        for (Task task : List.copyOf(tasks.values())) {
            if (task.status() != TaskStatus.PENDING || awaitingEscalation.contains(task.id())) {
                continue;
            }
            Optional<Task> blocker = DependencyGraph.blockingDependency(task, tasks);
            if (blocker.isPresent()) {
                Task dep = blocker.get();
                skip(task, "dependency %s %s".formatted(dep.id(), dep.status().name().toLowerCase()));
                changed = true;
            } else if (DependencyGraph.isReady(task, tasks)) {
                tasks.put(task.id(), task.withStatus(TaskStatus.READY));
                changed = true;
            }
        }
        return changed;
    }

    private boolean dispatchReady() {
        boolean any = false;
        for (Task task : List.copyOf(tasks.values())) {
            if (task.status() == TaskStatus.READY) {
                dispatch(task);
                any = true;
            }
        }
        return any;
    }

    private void dispatch(Task task) {
        Agent agent;
        try {
            agent = scheduler.agentRegistry().routeTask(task);
        } catch (RoutingException e) {
            fail(task, null, e.getMessage(), 0);
            return;
        }

        if (task.needsEscalation()) {
            escalate(task, "Task %s is flagged as beyond what %s can handle locally".formatted(task.id(), agent.agentId()),
                    priorFindings());
            return;
        }

        var payload = new LinkedHashMap<String, Object>();
        payload.put(MessageKeys.TASK_ID, task.id());
        payload.put(MessageKeys.ACTION, PlanTask.SECURITY_CAPABILITY.equals(task.capability())
                ? MessageKeys.ACTION_SECURITY : MessageKeys.ACTION_EXECUTION);
        payload.put(MessageKeys.TOOLS_NEEDED, task.toolsNeeded());
        payload.put(MessageKeys.DEPENDS_ON, List.copyOf(task.dependsOn()));
        if (task.capability() != null) {
            payload.put(MessageKeys.CAPABILITY, task.capability());
        }
        AgentMessage message = scheduler.bus().send(AgentMessage.create(MessageType.TASK, address, agent.agentId(),
                missionId, task.description(), payload));

        tasks.put(task.id(), task.withStatus(TaskStatus.RUNNING));
        ScheduledFuture<?> timer = taskTimeout == null ? null
                : scheduler.timers().schedule(() -> signals.offer(new TimedOut(message.id())),
                        taskTimeout.toMillis(), TimeUnit.MILLISECONDS);
        inFlight.put(message.id(), new InFlight(task.id(), agent.agentId(), System.currentTimeMillis(), timer));

        log.info("Dispatching task {} to {}: {}", task.id(), agent.agentId(), task.description());
        publish("task.started", task.id(), Map.of("agent", agent.agentId(), "description", task.description()));
        scheduler.runOnWorker(agent);
    }

    private void handle(Signal signal) {
        if (signal instanceof ReplyDelivered) {
            scheduler.bus().poll(address).ifPresent(this::handleReply);
        } else if (signal instanceof DispatchFailed failed) {
            handleDispatchFailure(failed);
        } else if (signal instanceof TimedOut timedOut) {
            InFlight flight = inFlight.remove(timedOut.messageId());
            if (flight != null) {
                fail(tasks.get(flight.taskId()), flight.agentId(),
                        "timed out after %d ms".formatted(taskTimeout.toMillis()), elapsed(flight));
            }
        } else if (signal instanceof RetryDue retry) {
            Task task = tasks.get(retry.taskId());
            if (task.status() != TaskStatus.RUNNING) {
                return;
            }
            if (cancelObserved) {
                skip(task, CANCELLED);
            } else {
                dispatch(task);
            }
        } else if (signal instanceof EscalationResolved resolved) {
            handleResolution(resolved.taskId(), resolved.escalation());
        }
    }

    private void handleReply(AgentMessage reply) {
        InFlight flight = inFlight.remove(reply.parentId());
        if (flight == null) {
            log.debug("Ignoring late reply {} to message {}", reply.id(), reply.parentId());
            return;
        }
        cancelTimer(flight);
        Task task = tasks.get(flight.taskId());

        if (reply.type() == MessageType.ESCALATION_REQUEST) {
            scheduler.recordTask(flight.agentId(), "escalated", elapsed(flight));
            if (cancelObserved) {
                skip(task, CANCELLED);
            } else {
                escalate(task, reply.content(), reply.payloadString(MessageKeys.FINDINGS));
            }
        } else if (reply.type() == MessageType.RESULT) {
            if (reply.payloadFlag(MessageKeys.ERROR)) {
                fail(task, flight.agentId(), reply.content(), elapsed(flight));
            } else {
                complete(task, flight.agentId(), reply.content(), elapsed(flight));
            }
        } else {
            fail(task, flight.agentId(), "unexpected reply type " + reply.type(), elapsed(flight));
        }
    }

    private void handleDispatchFailure(DispatchFailed failed) {
        InFlight flight = inFlight.remove(failed.messageId());
        if (flight == null) {
            return;
        }
        cancelTimer(flight);
        Task task = tasks.get(flight.taskId());
        if (!failed.admissionRejected()) {
            fail(task, flight.agentId(), failed.error(), elapsed(flight));
            return;
        }

        scheduler.recordAdmissionRejected(flight.agentId());
        int attempts = rejections.merge(task.id(), 1, Integer::sum);
        if (!cancelObserved && admissionPolicy.allowsRetry(attempts)) {
            Duration delay = admissionPolicy.delayAfter(attempts);
            log.info("Task {} not admitted ({}), retry {} of {} in {} ms", task.id(), failed.error(), attempts,
                    admissionPolicy.maxAttempts() - 1, delay.toMillis());
            scheduler.timers().schedule(() -> signals.offer(new RetryDue(task.id())),
                    delay.toMillis(), TimeUnit.MILLISECONDS);
        } else {
            fail(task, flight.agentId(), "%s (after %d attempt(s))".formatted(failed.error(), attempts),
                    elapsed(flight));
        }
    }

    private void escalate(Task task, String reason, String findings) {
        var escalations = scheduler.escalations();
        if (escalations == null) {
            fail(task, null, "escalation needed but no escalation service is configured: " + reason, 0);
            return;
        }
        tasks.put(task.id(), task.withStatus(TaskStatus.PENDING));
        awaitingEscalation.add(task.id());
        escalations.requestEscalation(missionId, task.id(), reason, findings,
                escalation -> signals.offer(new EscalationResolved(task.id(), escalation)));
    }

    private void handleResolution(String taskId, Escalation escalation) {
        if (!awaitingEscalation.remove(taskId)) {
            return;
        }
        Task task = tasks.get(taskId);
        if (task.status() != TaskStatus.PENDING) {
            return;
        }
        String target = escalation.chosenTarget();
        if (EscalationProperties.USER_TARGET.equals(target)) {
            String output = "Handed to user: " + escalation.reason();
            if (escalation.findingsSoFar() != null && !escalation.findingsSoFar().isBlank()) {
                output += "\n\nFindings so far:\n" + escalation.findingsSoFar();
            }
            complete(task, EscalationProperties.USER_TARGET, output, 0);
            return;
        }
        Optional<String> redirect = scheduler.escalations().redirectAgent(target);
        if (redirect.isPresent()) {
            log.info("Task {} redirected to {} after escalation {}", taskId, redirect.get(), escalation.id());
            tasks.put(taskId, task.redirectTo(redirect.get()));
        } else {
            fail(task, null, "escalation target %s cannot take the task".formatted(target), 0);
        }
    }

    private void observeCancel() {
        cancelObserved = true;
        log.info("Mission {} cancellation observed, {} task(s) still running", missionId, inFlight.size());
        Set<String> running = new HashSet<>();
        inFlight.values().forEach(f -> running.add(f.taskId()));
        for (Task task : List.copyOf(tasks.values())) {
            boolean undispatched = task.status() == TaskStatus.PENDING || task.status() == TaskStatus.READY;
            boolean backingOff = task.status() == TaskStatus.RUNNING && !running.contains(task.id());
            if (undispatched || backingOff) {
                skip(task, CANCELLED);
            }
        }
        awaitingEscalation.clear();
        if (scheduler.escalations() != null) {
            scheduler.escalations().discardForMission(missionId);
        }
    }

    /** Ends every unfinished task after the coordinator itself gave up. */
    private void abandon(String reason) {
        for (Task task : List.copyOf(tasks.values())) {
            if (task.status() == TaskStatus.RUNNING) {
                fail(task, null, reason, 0);
            } else if (!task.status().isTerminal()) {
                skip(task, reason);
            }
        }
        inFlight.values().forEach(this::cancelTimer);
        inFlight.clear();
    }

    private void complete(Task task, String agentId, String output, long elapsedMs) {
        tasks.put(task.id(), task.withResult(TaskStatus.DONE, output));
        results.put(task.id(), TaskResult.done(task.id(), agentId, output));
        scheduler.recordTask(agentId, "done", elapsedMs);
        log.info("Task {} done by {} in {} ms", task.id(), agentId, elapsedMs);
        publish("task.completed", task.id(), Map.of("agent", String.valueOf(agentId), "elapsed_ms", elapsedMs));
    }

    private void fail(Task task, String agentId, String error, long elapsedMs) {
        String reason = error == null || error.isBlank() ? "unknown error" : error;
        tasks.put(task.id(), task.withResult(TaskStatus.FAILED, reason));
        results.put(task.id(), TaskResult.failed(task.id(), agentId, reason));
        if (agentId != null) {
            scheduler.recordTask(agentId, "failed", elapsedMs);
        }
        int dependents = DependencyGraph.dependentsOf(task.id(), tasks).size();
        log.warn("Task {} failed ({}); {} dependent task(s) will be skipped", task.id(), reason, dependents);
        publish("task.failed", task.id(), Map.of("agent", String.valueOf(agentId), "error", reason));
    }

    private void skip(Task task, String reason) {
        tasks.put(task.id(), task.withResult(TaskStatus.SKIPPED, reason));
        results.put(task.id(), TaskResult.skipped(task.id(), reason));
        skippedCount++;
        log.debug("Task {} skipped: {}", task.id(), reason);
        publish("task.skipped", task.id(), Map.of("reason", reason));
    }

    private void finish() {
        long done = tasks.values().stream().filter(t -> t.status() == TaskStatus.DONE).count();
        if (cancelObserved) {
            status = MissionStatus.CANCELLED;
        } else if (done == tasks.size()) {
            status = MissionStatus.COMPLETED;
        } else if (done > 0 && allowPartial) {
            status = MissionStatus.PARTIAL;
        } else {
            status = MissionStatus.FAILED;
        }
        completedAt = Instant.now();
        publishSnapshot();

        if (synthesize && status != MissionStatus.CANCELLED && done > 0 && scheduler.synthesizer() != null) {
            try {
                synthesis = scheduler.synthesizer().synthesize(snapshot);
            } catch (RuntimeException e) {
                log.error("Synthesis for mission {} failed: {}", missionId, e.getMessage(), e);
                synthesis = ResultSynthesizer.concatenate(snapshot);
            }
            publishSnapshot();
        }

        log.info("Mission {} finished {}: {} done, {} failed, {} skipped", missionId, status, done,
                snapshot.countByStatus(TaskStatus.FAILED), skippedCount);
        scheduler.missionFinished(this, skippedCount);
        publish("mission.completed", null, Map.of("status", status.name(), "done", done,
                "failed", snapshot.countByStatus(TaskStatus.FAILED), "skipped", skippedCount));
        completion.complete(snapshot);
        discardLateReplies();
    }

    // Runs after completion, so any reply sent later finds the mission done and lands here too.
    private void discardLateReplies() {
        for (AgentMessage late : scheduler.bus().removeQueue(address)) {
            log.debug("Ignoring late reply {} from {} to finished mission {}", late.id(), late.sender(), missionId);
        }
    }

    private boolean hasUnfinished() {
        return tasks.values().stream().anyMatch(t -> !t.status().isTerminal());
    }

    private String priorFindings() {
        return scheduler.workspace() == null ? "" : scheduler.workspace().missionSummary(missionId);
    }

    private void publishSnapshot() {
        snapshot = new Mission(missionId, new ArrayList<>(tasks.values()), status, results, synthesis, createdAt,
                completedAt);
    }

    private void publish(String type, String taskId, Map<String, Object> payload) {
        scheduler.eventBus().publish(DroverEvent.of(type, missionId, taskId, payload));
    }

    private void cancelTimer(InFlight flight) {
        if (flight.timer() != null) {
            flight.timer().cancel(false);
        }
    }

    private static long elapsed(InFlight flight) {
        return System.currentTimeMillis() - flight.startedMs();
    }
}
