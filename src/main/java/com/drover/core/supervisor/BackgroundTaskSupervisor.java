package com.drover.core.supervisor;

import com.drover.core.agents.AgentRegistry;
import com.drover.core.agents.PlanResult;
import com.drover.core.agents.PlannerAgent;
import com.drover.core.events.DroverEvent;
import com.drover.core.events.EventBus;
import com.drover.core.inference.AdmissionRejectedException;
import com.drover.core.logging.MdcContext;
import com.drover.core.model.BackgroundTask;
import com.drover.core.model.BackgroundTaskStatus;
import com.drover.core.model.Mission;
import com.drover.core.model.MissionStatus;
import com.drover.core.model.PlanTask;
import com.drover.core.model.ProgressEntry;
import com.drover.core.model.TaskStatus;
import com.drover.core.scheduler.InvalidPlanException;
import com.drover.core.scheduler.MissionHandle;
import com.drover.core.scheduler.MissionOptions;
import com.drover.core.scheduler.MissionScheduler;
import com.drover.core.scheduler.ResultSynthesizer;
import jakarta.annotation.PreDestroy;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Runs a request as a cancellable, pollable background job backed by one mission.
 * <p>
 * {@link #start} returns at once; planning and execution happen on a supervisor thread. A task
 * leaves {@code running} exactly once. Callers only ever get snapshots.
 */
@Service
public class BackgroundTaskSupervisor {

    private static final Logger log = LoggerFactory.getLogger(BackgroundTaskSupervisor.class);

    public static final String MISSION_PREFIX = "bg-";

    private final MissionScheduler scheduler;
    private final AgentRegistry agentRegistry;
    private final EventBus eventBus;
    private final SupervisorProperties properties;
    private final ExecutorService runner;

    private final LinkedHashMap<String, Entry> tasks = new LinkedHashMap<>();

    public BackgroundTaskSupervisor(MissionScheduler scheduler, AgentRegistry agentRegistry, EventBus eventBus,
                                    SupervisorProperties properties) {
        this.scheduler = scheduler;
        this.agentRegistry = agentRegistry;
        this.eventBus = eventBus;
        this.properties = properties;
        var counter = new AtomicInteger();
        this.runner = Executors.newCachedThreadPool(r -> {
            Thread t = new Thread(r, "drover-bgtask-" + counter.incrementAndGet());
            t.setDaemon(true);
            return t;
        });
    }

    /**
     * Starts a background task.
     *
     * @param plan tasks to run; empty or null to have the planner (or the default agent) decide
     * @return snapshot with status {@code running}
     */
    public BackgroundTask start(String description, List<PlanTask> plan) {
        String id = UUID.randomUUID().toString().substring(0, 12);
        var entry = new Entry(id, description, plan == null ? List.of() : PlanTask.normalize(plan));
        BackgroundTask started;
        synchronized (tasks) {
            tasks.put(id, entry);
            entry.append("Task started", "init");
            started = entry.snapshot();
        }
        log.info("Background task {} started: {}", id, description);
        publishUpdate(entry, BackgroundTaskStatus.RUNNING);
        runner.execute(() -> execute(entry));
        return started;
    }

    /**
     * Appends a progress entry.
     *
     * @return false if the task is unknown
     */
    public boolean log(String taskId, String message, String step) {
        synchronized (tasks) {
            Entry entry = tasks.get(taskId);
            if (entry == null) {
                return false;
            }
            entry.append(message, step);
        }
        return true;
    }

    public boolean log(String taskId, String message) {
        return log(taskId, message, null);
    }

    /**
     * Cancels a running task and its mission.
     *
     * @return false for unknown or already finished tasks
     */
    public boolean cancel(String taskId) {
        Entry entry;
        String missionId;
        synchronized (tasks) {
            entry = tasks.get(taskId);
            if (entry == null || entry.status.isTerminal()) {
                return false;
            }
            entry.status = BackgroundTaskStatus.CANCELLED;
            entry.append("Task cancelled", "cancelled");
            missionId = entry.missionId;
        }
        log.info("Background task {} cancelled", taskId);
        if (missionId != null) {
            scheduler.cancel(missionId);
        }
        publishUpdate(entry, BackgroundTaskStatus.CANCELLED);
        evict();
        return true;
    }

    public Optional<BackgroundTask> get(String taskId) {
        synchronized (tasks) {
            Entry entry = tasks.get(taskId);
            return entry == null ? Optional.empty() : Optional.of(entry.snapshot());
        }
    }

    public List<BackgroundTask> list() {
        synchronized (tasks) {
            return tasks.values().stream().map(Entry::snapshot).toList();
        }
    }

    @PreDestroy
    public void shutdown() {
        runner.shutdownNow();
    }

    private void execute(Entry entry) {
        String missionId = MISSION_PREFIX + entry.id;
        MdcContext.setMission(missionId);
        try {
            List<PlanTask> plan = entry.initialPlan.isEmpty() ? planFor(entry) : entry.initialPlan;
            synchronized (tasks) {
                if (entry.status.isTerminal()) {
                    return;
                }
                entry.plan = plan;
                entry.missionId = missionId;
            }

            MissionHandle handle = scheduler.submit(missionId, plan,
                    MissionOptions.defaults().withSynthesis(plan.size() > 1));
            log(entry.id, "Submitted mission %s (%d tasks)".formatted(missionId, plan.size()), "execution");
            if (isCancelled(entry)) {
                scheduler.cancel(missionId);
            }

            Mission mission = handle.await(properties.getMissionTimeout());
            if (!handle.isDone()) {
                scheduler.cancel(missionId);
                transition(entry, BackgroundTaskStatus.FAILED,
                        "Mission timed out after " + properties.getMissionTimeout(), "Task failed: mission timed out");
                return;
            }
            finish(entry, mission);
        } catch (InvalidPlanException e) {
            transition(entry, BackgroundTaskStatus.FAILED, "Invalid plan: " + e.getMessage(),
                    "Task failed: " + e.getMessage());
        } catch (RuntimeException e) {
            log.error("Background task {} failed: {}", entry.id, e.getMessage(), e);
            transition(entry, BackgroundTaskStatus.FAILED, "Error: " + e.getMessage(), "Task failed: " + e.getMessage());
        } finally {
            MdcContext.clear();
            evict();
        }
    }

    private List<PlanTask> planFor(Entry entry) {
        Optional<PlannerAgent> planner = agentRegistry.firstOfType(PlannerAgent.class);
        if (planner.isPresent()) {
            log(entry.id, "Planning task decomposition", PlannerAgent.PLANNING);
            try {
                PlanResult result = planner.get().plan(entry.description, agentRegistry.all());
                if (!result.tasks().isEmpty()) {
                    log(entry.id, "Plan: %d subtasks".formatted(result.tasks().size()), PlannerAgent.PLANNING);
                    return result.tasks();
                }
                if (result.needsEscalation()) {
                    log(entry.id, "Planner flagged the request for escalation: " + result.reason(), PlannerAgent.PLANNING);
                    return List.of(singleTask(entry.description, true));
                }
                log(entry.id, "Planner returned no tasks, using a single task", PlannerAgent.PLANNING);
            } catch (AdmissionRejectedException e) {
                log(entry.id, "Planner busy (" + e.getMessage() + "), using a single task", PlannerAgent.PLANNING);
            }
        }
        return List.of(singleTask(entry.description, false));
    }

    private PlanTask singleTask(String description, boolean needsEscalation) {
        return new PlanTask("t1", agentRegistry.defaultAgentId(), description, true, List.of(), false,
                needsEscalation, null);
    }

    private void finish(Entry entry, Mission mission) {
        if (mission.status() == MissionStatus.CANCELLED) {
            String partial = ResultSynthesizer.tagged(mission);
            transition(entry, BackgroundTaskStatus.CANCELLED, partial, "Task cancelled");
            attachLateResult(entry, partial);
            return;
        }
        if (mission.status() == MissionStatus.FAILED) {
            String result = "Mission failed (%d done, %d failed, %d skipped)%s%s".formatted(
                    mission.countByStatus(TaskStatus.DONE), mission.countByStatus(TaskStatus.FAILED),
                    mission.countByStatus(TaskStatus.SKIPPED), ResultSynthesizer.RESULT_SEPARATOR,
                    ResultSynthesizer.tagged(mission));
            transition(entry, BackgroundTaskStatus.FAILED, result, "Task failed: " + firstError(mission));
            return;
        }
        String result = mission.synthesis();
        if (result == null || result.isBlank()) {
            result = ResultSynthesizer.concatenate(mission);
        }
        if (result.isBlank()) {
            result = "No results.";
        }
        if (mission.status() == MissionStatus.PARTIAL) {
            result = result + ResultSynthesizer.RESULT_SEPARATOR + ResultSynthesizer.taggedUnfinished(mission);
        }
        transition(entry, BackgroundTaskStatus.COMPLETED, result, "Task completed");
    }

    private static String firstError(Mission mission) {
        return mission.results().values().stream()
                .filter(r -> r.status() == TaskStatus.FAILED)
                .map(r -> r.taskId() + ": " + r.error())
                .findFirst()
                .orElse("no task completed");
    }

    /** A task cancelled by the caller is already terminal; its mission's partial results arrive afterwards. */
    private void attachLateResult(Entry entry, String result) {
        synchronized (tasks) {
            if (entry.result != null) {
                return;
            }
            entry.result = result;
            entry.updatedAt = Instant.now();
        }
        log.debug("Attached partial results to cancelled background task {}", entry.id);
    }

    private void transition(Entry entry, BackgroundTaskStatus status, String result, String message) {
        synchronized (tasks) {
            if (entry.status.isTerminal()) {
                return;
            }
            entry.status = status;
            entry.result = result;
            entry.append(message, status == BackgroundTaskStatus.COMPLETED ? "done" : "error");
        }
        log.info("Background task {} finished {}", entry.id, status);
        publishUpdate(entry, status);
    }

    private boolean isCancelled(Entry entry) {
        synchronized (tasks) {
            return entry.status == BackgroundTaskStatus.CANCELLED;
        }
    }

    private void publishUpdate(Entry entry, BackgroundTaskStatus status) {
        eventBus.publish(DroverEvent.of("bgtask.updated", MISSION_PREFIX + entry.id, null,
                Map.of("task_id", entry.id, "status", status.name().toLowerCase())));
    }

    /** Drops the least recently updated finished tasks beyond the cap. */
    private void evict() {
        synchronized (tasks) {
            List<Entry> terminal = tasks.values().stream()
                    .filter(e -> e.status.isTerminal())
                    .sorted(Comparator.comparing(e -> e.updatedAt))
                    .toList();
            for (int i = 0; i < terminal.size() - properties.getMaxTasks(); i++) {
                tasks.remove(terminal.get(i).id);
                log.debug("Evicted background task {}", terminal.get(i).id);
            }
        }
    }

    /** Mutable task state, guarded by the {@code tasks} monitor. */
    private static final class Entry {
        final String id;
        final String description;
        final List<PlanTask> initialPlan;
        final Instant createdAt = Instant.now();
        final List<ProgressEntry> progress = new ArrayList<>();
        BackgroundTaskStatus status = BackgroundTaskStatus.RUNNING;
        List<PlanTask> plan;
        String result;
        String missionId;
        Instant updatedAt = createdAt;

        Entry(String id, String description, List<PlanTask> initialPlan) {
            this.id = id;
            this.description = description;
            this.initialPlan = initialPlan;
            this.plan = initialPlan;
        }

        void append(String message, String step) {
            updatedAt = Instant.now();
            progress.add(new ProgressEntry(updatedAt, step, message));
        }

        BackgroundTask snapshot() {
            return new BackgroundTask(id, description, status, plan, progress, result, createdAt, updatedAt);
        }
    }
}
