package com.drover.core.scheduler;

import com.drover.core.agents.Agent;
import com.drover.core.agents.AgentRegistry;
import com.drover.core.bus.MessageBus;
import com.drover.core.escalation.EscalationService;
import com.drover.core.events.DroverEvent;
import com.drover.core.events.EventBus;
import com.drover.core.inference.AdmissionRejectedException;
import com.drover.core.logging.MdcContext;
import com.drover.core.metrics.DroverMetrics;
import com.drover.core.model.AgentMessage;
import com.drover.core.model.MessageKeys;
import com.drover.core.model.Mission;
import com.drover.core.model.PlanTask;
import com.drover.core.model.Task;
import com.drover.core.workspace.SharedWorkspace;
import jakarta.annotation.PreDestroy;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Service;

import java.time.Duration;
import java.util.ArrayList;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Runs missions: validates each plan, then hands it to its own coordinator thread.
 * <p>
 * Agent calls run on a bounded worker pool shared by every mission. A worker takes the next
 * TASK message from the agent's bus queue, runs the agent and sends the reply back on the bus to
 * the coordinator of the mission the message belongs to.
 */
@Service
public class MissionScheduler {

    private static final Logger log = LoggerFactory.getLogger(MissionScheduler.class);

    private final SchedulerProperties properties;
    private final AgentRegistry agentRegistry;
    private final MessageBus bus;
    private final EventBus eventBus;
    private final EscalationService escalations;
    private final ResultSynthesizer synthesizer;
    private final SharedWorkspace workspace;
    private final DroverMetrics metrics;

    private final ExecutorService workers;
    private final ExecutorService coordinators;
    private final ScheduledExecutorService timers;

    private final LinkedHashMap<String, MissionRun> missions = new LinkedHashMap<>();

    public MissionScheduler(SchedulerProperties properties, AgentRegistry agentRegistry, MessageBus bus,
                            EventBus eventBus,
                            @Autowired(required = false) EscalationService escalations,
                            @Autowired(required = false) ResultSynthesizer synthesizer,
                            @Autowired(required = false) SharedWorkspace workspace,
                            @Autowired(required = false) DroverMetrics metrics) {
        this.properties = properties;
        this.agentRegistry = agentRegistry;
        this.bus = bus;
        this.eventBus = eventBus;
        this.escalations = escalations;
        this.synthesizer = synthesizer;
        this.workspace = workspace;
        this.metrics = metrics;
        this.workers = Executors.newFixedThreadPool(Math.max(1, properties.getWorkerThreads()), named("drover-worker"));
        this.coordinators = Executors.newCachedThreadPool(named("drover-mission"));
        this.timers = Executors.newSingleThreadScheduledExecutor(named("drover-timer"));
    }

    public MissionHandle submit(String missionId, List<PlanTask> plan) {
        return submit(missionId, plan, MissionOptions.defaults());
    }

    /**
     * Validates the plan and starts the mission.
     *
     * @param missionId id to use, or null to generate one
     * @throws InvalidPlanException         on duplicate ids, unknown dependencies or a reused mission id
     * @throws TaskDependencyCycleException if the dependencies form a cycle
     */
    public MissionHandle submit(String missionId, List<PlanTask> plan, MissionOptions options) {
        List<Task> tasks = PlanTask.normalize(plan).stream().map(PlanTask::toTask).toList();
        return submitTasks(missionId, tasks, options);
    }

    public MissionHandle submitTasks(String missionId, List<Task> tasks, MissionOptions options) {
        String id = missionId == null || missionId.isBlank() ? UUID.randomUUID().toString().substring(0, 12) : missionId;
        MissionOptions opts = options == null ? MissionOptions.defaults() : options;
        DependencyGraph.validate(tasks);

        boolean allowPartial = opts.allowPartial() != null ? opts.allowPartial() : properties.isAllowPartial();
        Duration timeout = opts.taskTimeout() != null ? opts.taskTimeout() : properties.getTaskTimeout();
        var run = new MissionRun(this, id, tasks, opts.synthesize(), allowPartial, timeout,
                properties.admissionPolicy());
        synchronized (missions) {
            if (missions.containsKey(id)) {
                throw new InvalidPlanException("Mission already exists: " + id);
            }
            missions.put(id, run);
        }

        if (metrics != null) {
            metrics.recordMissionSize(tasks.size());
        }
        eventBus.publish(DroverEvent.of("mission.created", id, null,
                Map.of("task_count", tasks.size(), "synthesize", opts.synthesize())));
        log.info("Mission {} submitted ({} tasks, synthesize={}, allowPartial={})", id, tasks.size(),
                opts.synthesize(), allowPartial);
        coordinators.execute(run);
        return run;
    }

    /**
     * Requests cooperative cancellation.
     *
     * @return false if the mission is unknown or already finished
     */
    public boolean cancel(String missionId) {
        Optional<MissionRun> run = run(missionId);
        if (run.isEmpty() || run.get().isDone()) {
            return false;
        }
        log.info("Cancelling mission {}", missionId);
        run.get().cancel();
        return true;
    }

    /**
     * @throws IllegalArgumentException if the mission is unknown
     */
    public Mission await(String missionId, Duration timeout) {
        return run(missionId)
                .orElseThrow(() -> new IllegalArgumentException("Unknown mission: " + missionId))
                .await(timeout);
    }

    public Optional<Mission> get(String missionId) {
        return run(missionId).map(MissionRun::snapshot);
    }

    public Optional<MissionHandle> handle(String missionId) {
        return run(missionId).map(MissionHandle.class::cast);
    }

    /** Snapshots in submission order. */
    public List<Mission> list() {
        synchronized (missions) {
            var snapshots = new ArrayList<Mission>(missions.size());
            missions.values().forEach(r -> snapshots.add(r.snapshot()));
            return snapshots;
        }
    }

    @PreDestroy
    public void shutdown() {
        List<MissionRun> running;
        synchronized (missions) {
            running = missions.values().stream().filter(r -> !r.isDone()).toList();
        }
        running.forEach(MissionRun::cancel);
        workers.shutdownNow();
        coordinators.shutdownNow();
        timers.shutdownNow();
    }

    private Optional<MissionRun> run(String missionId) {
        synchronized (missions) {
            return Optional.ofNullable(missions.get(missionId));
        }
    }

    // --- collaborators for MissionRun ---

    AgentRegistry agentRegistry() {
        return agentRegistry;
    }

    MessageBus bus() {
        return bus;
    }

    EventBus eventBus() {
        return eventBus;
    }

    EscalationService escalations() {
        return escalations;
    }

    ResultSynthesizer synthesizer() {
        return synthesizer;
    }

    SharedWorkspace workspace() {
        return workspace;
    }

    ScheduledExecutorService timers() {
        return timers;
    }

    void runOnWorker(Agent agent) {
        workers.execute(() -> work(agent));
    }

    /**
     * Takes the agent's next queued message; it may belong to a different mission than the one
     * that scheduled this worker, so the outcome is routed by the message's own mission id.
     */
    private void work(Agent agent) {
        Optional<AgentMessage> next = bus.poll(agent.agentId());
        if (next.isEmpty()) {
            log.warn("Worker found no queued message for agent {}", agent.agentId());
            return;
        }
        AgentMessage message = next.get();
        Optional<MissionRun> owner = run(message.missionId());
        MdcContext.setTask(message.missionId(), message.payloadString(MessageKeys.TASK_ID), agent.agentId());
        try {
            AgentMessage reply = agent.run(message);
            bus.send(reply);
            if (owner.isPresent()) {
                owner.get().replyDelivered();
            } else if (!bus.removeQueue(reply.recipient()).isEmpty()) {
                log.debug("Dropped reply {} for evicted mission {}", reply.id(), message.missionId());
            }
        } catch (AdmissionRejectedException e) {
            owner.ifPresent(r -> r.dispatchFailed(message.id(), e.getMessage(), true));
        } catch (RuntimeException e) {
            log.error("Agent {} crashed on message {}: {}", agent.agentId(), message.id(), e.getMessage(), e);
            owner.ifPresent(r -> r.dispatchFailed(message.id(), e.getMessage(), false));
        } finally {
            MdcContext.clear();
        }
    }

    void recordTask(String agentId, String outcome, long elapsedMs) {
        if (metrics != null && agentId != null) {
            metrics.recordTaskExecution(agentId, outcome, elapsedMs);
        }
    }

    void recordAdmissionRejected(String agentId) {
        if (metrics != null) {
            metrics.recordAdmissionRejected(agentRegistry.get(agentId).map(Agent::modelKey).orElse(agentId));
        }
    }

    void missionFinished(MissionRun finished, int skipped) {
        if (metrics != null) {
            metrics.recordMissionResult(finished.snapshot().status().name());
            metrics.recordSkippedTasks(skipped);
        }
        synchronized (missions) {
            long done = missions.values().stream().filter(r -> r == finished || r.isDone()).count();
            Iterator<MissionRun> it = missions.values().iterator();
            while (done > properties.getMaxMissions() && it.hasNext()) {
                MissionRun eldest = it.next();
                if (eldest != finished && eldest.isDone()) {
                    it.remove();
                    done--;
                    log.debug("Evicted finished mission {}", eldest.missionId());
                }
            }
        }
    }

    private static ThreadFactory named(String prefix) {
        var counter = new AtomicInteger();
        return r -> {
            Thread t = new Thread(r, prefix + "-" + counter.incrementAndGet());
            t.setDaemon(true);
            return t;
        };
    }
}
