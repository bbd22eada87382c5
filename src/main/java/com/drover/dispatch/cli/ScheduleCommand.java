package com.drover.dispatch.cli;

import com.drover.core.jobs.ScheduleType;
import com.drover.core.jobs.ScheduledJob;
import com.drover.core.jobs.ScheduledJobService;
import com.drover.core.json.WireFormat;
import com.drover.core.model.BackgroundTask;
import com.drover.core.model.PlanTask;
import com.drover.core.supervisor.BackgroundTaskSupervisor;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.springframework.stereotype.Component;
import picocli.CommandLine.ArgGroup;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;
import picocli.CommandLine.Parameters;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Iterator;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Optional;
import java.util.Set;

/**
 * CLI command: drover schedule "&lt;request&gt;" --every 300 | --cron "0 * * * *" | --at 2026-01-01T09:00:00Z
 * <p>
 * Keeps the process alive, running the request as a background task on the schedule and printing
 * each run's result, until the job has no runs left, {@code --runs} is reached, or the process is
 * interrupted. The job is removed on exit.
 */
@Command(name = "schedule", mixinStandardHelpOptions = true, description = "Run a request on a schedule")
@Component
public class ScheduleCommand implements Runnable {

    @Parameters(index = "0", description = "Natural language request")
    private String request;

    @ArgGroup(exclusive = true, multiplicity = "1")
    private When when;

    static class When {
        @Option(names = "--every", description = "Interval: seconds or an ISO-8601 duration such as PT15M")
        String every;

        @Option(names = "--cron", description = "Cron expression, five or six fields, evaluated in UTC")
        String cron;

        @Option(names = "--at", description = "Run once at this ISO-8601 time")
        String at;
    }

    @Option(names = {"--plan", "-p"}, description = "JSON plan used for every run instead of planning")
    private Path planFile;

    @Option(names = "--runs", description = "Stop after this many runs (default: until the schedule ends)",
            defaultValue = "0")
    private int runs;

    @Option(names = {"--quiet", "-q"}, description = "Only print run results")
    private boolean quiet;

    private final ScheduledJobService jobs;
    private final BackgroundTaskSupervisor supervisor;
    private final ObjectMapper objectMapper;

    public ScheduleCommand(ScheduledJobService jobs, BackgroundTaskSupervisor supervisor, ObjectMapper objectMapper) {
        this.jobs = jobs;
        this.supervisor = supervisor;
        this.objectMapper = objectMapper;
    }

    @Override
    public void run() {
        ConsoleOutput.printBanner();
        List<PlanTask> plan = List.of();
        if (planFile != null) {
            try {
                plan = WireFormat.parsePlan(objectMapper, Files.readString(planFile));
            } catch (IOException e) {
                ConsoleOutput.error("Cannot read plan " + planFile + ": " + e.getMessage());
                return;
            } catch (IllegalArgumentException e) {
                ConsoleOutput.error(e.getMessage());
                return;
            }
        }

        ScheduledJob job;
        try {
            if (when.every != null) {
                job = jobs.createJob(request, ScheduleType.INTERVAL, when.every, plan);
            } else if (when.cron != null) {
                job = jobs.createJob(request, ScheduleType.CRON, when.cron, plan);
            } else {
                job = jobs.createJob(request, ScheduleType.ONCE, when.at, plan);
            }
        } catch (IllegalArgumentException e) {
            ConsoleOutput.error("Invalid schedule: " + e.getMessage());
            return;
        }
        ConsoleOutput.info("Job %s scheduled, first run at %s".formatted(job.id(), job.nextRun()));

        try {
            follow(job.id());
        } finally {
            jobs.deleteJob(job.id());
        }
    }

    private void follow(String jobId) {
        Set<String> running = new LinkedHashSet<>();
        String lastTaskId = null;
        int seenRuns = 0;
        int settled = 0;
        while (true) {
            Optional<ScheduledJob> current = jobs.getJob(jobId);
            if (current.isEmpty()) {
                ConsoleOutput.info("Job " + jobId + " was deleted");
                return;
            }
            ScheduledJob job = current.get();
            if (job.runCount() > seenRuns) {
                int newRuns = job.runCount() - seenRuns;
                if (job.lastTaskId() != null && !job.lastTaskId().equals(lastTaskId)) {
                    lastTaskId = job.lastTaskId();
                    running.add(lastTaskId);
                    newRuns--;
                    if (!quiet) {
                        ConsoleOutput.info("Run %d started as task %s".formatted(job.runCount(), lastTaskId));
                    }
                }
                if (newRuns > 0) {
                    ConsoleOutput.error(newRuns + " run(s) could not be started");
                    settled += newRuns;
                }
                seenRuns = job.runCount();
            }

            for (Iterator<String> it = running.iterator(); it.hasNext(); ) {
                Optional<BackgroundTask> task = supervisor.get(it.next());
                if (task.isEmpty() || task.get().status().isTerminal()) {
                    it.remove();
                    settled++;
                    task.ifPresent(ScheduleCommand::report);
                }
            }

            boolean scheduleOver = !job.enabled() || job.nextRun() == null;
            if (runs > 0 && settled >= runs || scheduleOver && running.isEmpty() && settled >= seenRuns) {
                return;
            }
            try {
                Thread.sleep(250);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                running.forEach(supervisor::cancel);
                return;
            }
        }
    }

    private static void report(BackgroundTask task) {
        switch (task.status()) {
            case COMPLETED -> ConsoleOutput.success("Task " + task.id() + " completed");
            case CANCELLED -> ConsoleOutput.info("Task " + task.id() + " cancelled");
            default -> ConsoleOutput.error("Task " + task.id() + " failed");
        }
        if (task.result() != null && !task.result().isBlank()) {
            System.out.println(task.result());
        }
    }
}
