package com.drover.core.jobs;

import com.drover.core.model.BackgroundTask;
import com.drover.core.model.PlanTask;
import com.drover.core.supervisor.BackgroundTaskSupervisor;
import jakarta.annotation.PostConstruct;
import jakarta.annotation.PreDestroy;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Instant;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;

/**
 * Keeps jobs that start background tasks on a schedule: once at a given time, every N seconds,
 * or on a cron expression.
 * <p>
 * A ticker checks for due jobs every {@code drover.jobs.tick-interval} and hands each one to
 * {@link BackgroundTaskSupervisor#start}. A due job runs once per tick however many runs it
 * missed. Jobs live in memory only.
 */
@Service
public class ScheduledJobService {

    private static final Logger log = LoggerFactory.getLogger(ScheduledJobService.class);

    private final BackgroundTaskSupervisor supervisor;
    private final JobProperties properties;
    private final Clock clock;

    private final Map<String, ScheduledJob> jobs = new LinkedHashMap<>();
    private ScheduledExecutorService ticker;

    @Autowired
    public ScheduledJobService(BackgroundTaskSupervisor supervisor, JobProperties properties) {
        this(supervisor, properties, Clock.systemUTC());
    }

    ScheduledJobService(BackgroundTaskSupervisor supervisor, JobProperties properties, Clock clock) {
        this.supervisor = supervisor;
        this.properties = properties;
        this.clock = clock;
    }

    @PostConstruct
    public void start() {
        if (!properties.isEnabled()) {
            log.info("Scheduled jobs disabled");
            return;
        }
        ticker = Executors.newSingleThreadScheduledExecutor(r -> {
            Thread t = new Thread(r, "drover-jobs");
            t.setDaemon(true);
            return t;
        });
        ticker.scheduleWithFixedDelay(this::tickSafely, properties.getInitialDelay().toMillis(),
                properties.getTickInterval().toMillis(), TimeUnit.MILLISECONDS);
        log.debug("Job ticker started, every {}", properties.getTickInterval());
    }

    @PreDestroy
    public void shutdown() {
        if (ticker != null) {
            ticker.shutdownNow();
        }
    }

    /**
     * Creates an enabled job.
     *
     * @param plan explicit plan for every run; null or empty to let the planner decide
     * @throws IllegalArgumentException if the schedule value does not fit its type
     */
    public ScheduledJob createJob(String description, ScheduleType type, String value, List<PlanTask> plan) {
        if (type == null) {
            throw new IllegalArgumentException("Schedule type is required");
        }
        Schedules.validate(type, value);
        Instant now = clock.instant();
        var job = new ScheduledJob("job_" + UUID.randomUUID().toString().replace("-", "").substring(0, 12),
                description == null || description.isBlank() ? "Scheduled job" : description,
                type, value.strip(), plan, true, null, Schedules.first(type, value, now), now, 0, null);
        synchronized (jobs) {
            jobs.put(job.id(), job);
        }
        log.info("Job {} created ({} {}), next run {}", job.id(), type, job.scheduleValue(), job.nextRun());
        return job;
    }

    /** All jobs, soonest due first; jobs with no next run come last. */
    public List<ScheduledJob> listJobs() {
        synchronized (jobs) {
            return jobs.values().stream()
                    .sorted(Comparator.comparing(ScheduledJob::nextRun, Comparator.nullsLast(Comparator.naturalOrder())))
                    .toList();
        }
    }

    public Optional<ScheduledJob> getJob(String jobId) {
        synchronized (jobs) {
            return Optional.ofNullable(jobs.get(jobId));
        }
    }

    public boolean deleteJob(String jobId) {
        boolean removed;
        synchronized (jobs) {
            removed = jobs.remove(jobId) != null;
        }
        if (removed) {
            log.info("Job {} deleted", jobId);
        }
        return removed;
    }

    /**
     * Applies a partial update. A schedule change recomputes the next run.
     *
     * @return the updated job, or empty if the id is unknown
     * @throws IllegalArgumentException if the new schedule is invalid
     */
    public Optional<ScheduledJob> updateJob(String jobId, JobUpdate update) {
        ScheduledJob updated;
        synchronized (jobs) {
            ScheduledJob job = jobs.get(jobId);
            if (job == null) {
                return Optional.empty();
            }
            ScheduleType type = update.scheduleType() != null ? update.scheduleType() : job.scheduleType();
            String value = update.scheduleValue() != null ? update.scheduleValue().strip() : job.scheduleValue();
            Instant nextRun = job.nextRun();
            if (update.changesSchedule()) {
                Schedules.validate(type, value);
                nextRun = Schedules.first(type, value, clock.instant());
            }
            updated = new ScheduledJob(job.id(),
                    update.description() != null ? update.description() : job.description(),
                    type, value,
                    update.plan() != null ? update.plan() : job.plan(),
                    update.enabled() != null ? update.enabled() : job.enabled(),
                    job.lastRun(), nextRun, job.createdAt(), job.runCount(), job.lastTaskId());
            jobs.put(jobId, updated);
        }
        log.info("Job {} updated, enabled={} next run {}", jobId, updated.enabled(), updated.nextRun());
        return Optional.of(updated);
    }

    /**
     * Dispatches every enabled job whose next run has come.
     *
     * @return number of jobs dispatched
     */
    public int tick() {
        Instant now = clock.instant();
        List<ScheduledJob> due;
        synchronized (jobs) {
            due = jobs.values().stream()
                    .filter(j -> j.enabled() && j.nextRun() != null && !j.nextRun().isAfter(now))
                    .sorted(Comparator.comparing(ScheduledJob::nextRun))
                    .toList();
        }
        for (ScheduledJob job : due) {
            String taskId = dispatch(job);
            synchronized (jobs) {
                ScheduledJob current = jobs.get(job.id());
                if (current == null) {
                    continue;
                }
                Instant nextRun = Schedules.next(current.scheduleType(), current.scheduleValue(), now);
                jobs.put(job.id(), new ScheduledJob(current.id(), current.description(), current.scheduleType(),
                        current.scheduleValue(), current.plan(), current.enabled() && nextRun != null, now, nextRun,
                        current.createdAt(), current.runCount() + 1, taskId != null ? taskId : current.lastTaskId()));
            }
        }
        return due.size();
    }

    private String dispatch(ScheduledJob job) {
        log.info("Dispatching job {} '{}'", job.id(), job.description());
        try {
            BackgroundTask task = supervisor.start(job.description(), job.plan());
            return task.id();
        } catch (RuntimeException e) {
            log.error("Job {} dispatch failed: {}", job.id(), e.getMessage(), e);
            return null;
        }
    }

    private void tickSafely() {
        try {
            tick();
        } catch (RuntimeException e) {
            log.error("Job tick failed: {}", e.getMessage(), e);
        }
    }
}
