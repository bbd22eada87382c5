package com.drover.core.jobs;

import com.drover.core.model.BackgroundTask;
import com.drover.core.model.BackgroundTaskStatus;
import com.drover.core.model.PlanTask;
import com.drover.core.supervisor.BackgroundTaskSupervisor;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneId;
import java.time.ZoneOffset;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.anyList;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

class ScheduledJobServiceTest {

    private static final Instant START = Instant.parse("2026-03-02T09:58:30Z");

    private BackgroundTaskSupervisor supervisor;
    private MovableClock clock;
    private ScheduledJobService service;

    @BeforeEach
    void setUp() {
        supervisor = mock(BackgroundTaskSupervisor.class);
        when(supervisor.start(anyString(), anyList())).thenAnswer(inv -> new BackgroundTask("bg1",
                inv.getArgument(0), BackgroundTaskStatus.RUNNING, inv.getArgument(1), null, null, START, START));
        clock = new MovableClock(START);
        service = new ScheduledJobService(supervisor, new JobProperties(), clock);
    }

    @Nested
    @DisplayName("createJob")
    class Create {

        @Test
        @DisplayName("an interval job is first due one interval from now")
        void interval() {
            ScheduledJob job = service.createJob("check the logs", ScheduleType.INTERVAL, "300", null);

            assertTrue(job.id().startsWith("job_"));
            assertTrue(job.enabled());
            assertEquals(START.plusSeconds(300), job.nextRun());
            assertEquals(0, job.runCount());
            assertEquals(List.of(), job.plan());
        }

        @Test
        @DisplayName("a five-field cron expression is evaluated in UTC")
        void cron() {
            ScheduledJob job = service.createJob("nightly audit", ScheduleType.CRON, "0 10 * * *", null);

            assertEquals(Instant.parse("2026-03-02T10:00:00Z"), job.nextRun());
        }

        @Test
        @DisplayName("a one-shot job is due at its time")
        void once() {
            ScheduledJob job = service.createJob("remind me", ScheduleType.ONCE, "2026-03-02T12:00:00+02:00", null);

            assertEquals(Instant.parse("2026-03-02T10:00:00Z"), job.nextRun());
        }

        @Test
        @DisplayName("schedule values that do not fit the type are rejected")
        void invalid() {
            assertThrows(IllegalArgumentException.class,
                    () -> service.createJob("x", ScheduleType.INTERVAL, "soon", null));
            assertThrows(IllegalArgumentException.class,
                    () -> service.createJob("x", ScheduleType.INTERVAL, "0", null));
            assertThrows(IllegalArgumentException.class,
                    () -> service.createJob("x", ScheduleType.CRON, "every day", null));
            assertThrows(IllegalArgumentException.class,
                    () -> service.createJob("x", ScheduleType.ONCE, "tomorrow", null));
            assertThrows(IllegalArgumentException.class, () -> service.createJob("x", null, "60", null));
            assertTrue(service.listJobs().isEmpty());
        }
    }

    @Nested
    @DisplayName("tick")
    class Tick {

        @Test
        @DisplayName("nothing is dispatched before a job is due")
        void notDue() {
            service.createJob("check the logs", ScheduleType.INTERVAL, "60", null);

            assertEquals(0, service.tick());
            verify(supervisor, never()).start(anyString(), anyList());
        }

        @Test
        @DisplayName("a due interval job starts a background task and moves its next run")
        void intervalRuns() {
            var plan = List.of(PlanTask.of("t1", "worker", "grep errors", null));
            ScheduledJob job = service.createJob("check the logs", ScheduleType.INTERVAL, "60", plan);

            clock.advance(Duration.ofSeconds(61));
            assertEquals(1, service.tick());

            verify(supervisor).start("check the logs", plan);
            ScheduledJob after = service.getJob(job.id()).orElseThrow();
            assertEquals(1, after.runCount());
            assertEquals(clock.instant(), after.lastRun());
            assertEquals(clock.instant().plusSeconds(60), after.nextRun());
            assertEquals("bg1", after.lastTaskId());
            assertTrue(after.enabled());
        }

        @Test
        @DisplayName("a job that missed several runs is dispatched once per tick")
        void missedRuns() {
            service.createJob("check the logs", ScheduleType.INTERVAL, "60", null);

            clock.advance(Duration.ofMinutes(10));
            assertEquals(1, service.tick());
            assertEquals(0, service.tick());
        }

        @Test
        @DisplayName("a one-shot job runs once and then disables itself")
        void onceRunsOnce() {
            ScheduledJob job = service.createJob("remind me", ScheduleType.ONCE, "2026-03-02T10:00:00Z", null);

            clock.advance(Duration.ofMinutes(2));
            assertEquals(1, service.tick());
            clock.advance(Duration.ofMinutes(2));
            assertEquals(0, service.tick());

            ScheduledJob after = service.getJob(job.id()).orElseThrow();
            assertFalse(after.enabled());
            assertNull(after.nextRun());
            assertEquals(1, after.runCount());
            verify(supervisor, times(1)).start(eq("remind me"), anyList());
        }

        @Test
        @DisplayName("a cron job moves to its next matching time")
        void cronRuns() {
            ScheduledJob job = service.createJob("hourly sweep", ScheduleType.CRON, "0 * * * *", null);

            clock.advance(Duration.ofSeconds(90));
            assertEquals(1, service.tick());

            assertEquals(Instant.parse("2026-03-02T11:00:00Z"), service.getJob(job.id()).orElseThrow().nextRun());
        }

        @Test
        @DisplayName("a failed dispatch is logged and the job still advances")
        void dispatchFails() {
            when(supervisor.start(anyString(), anyList())).thenThrow(new IllegalStateException("shutting down"));
            ScheduledJob job = service.createJob("check the logs", ScheduleType.INTERVAL, "60", null);

            clock.advance(Duration.ofSeconds(60));
            assertEquals(1, service.tick());

            ScheduledJob after = service.getJob(job.id()).orElseThrow();
            assertEquals(1, after.runCount());
            assertNull(after.lastTaskId());
        }

        @Test
        @DisplayName("disabled jobs are skipped")
        void disabled() {
            ScheduledJob job = service.createJob("check the logs", ScheduleType.INTERVAL, "60", null);
            service.updateJob(job.id(), JobUpdate.enabled(false));

            clock.advance(Duration.ofMinutes(5));
            assertEquals(0, service.tick());
        }
    }

    @Nested
    @DisplayName("list, update and delete")
    class Manage {

        @Test
        @DisplayName("jobs are listed soonest first")
        void listOrder() {
            ScheduledJob later = service.createJob("later", ScheduleType.INTERVAL, "3600", null);
            ScheduledJob sooner = service.createJob("sooner", ScheduleType.INTERVAL, "60", null);

            assertEquals(List.of(sooner.id(), later.id()), service.listJobs().stream().map(ScheduledJob::id).toList());
        }

        @Test
        @DisplayName("changing the schedule recomputes the next run")
        void reschedule() {
            ScheduledJob job = service.createJob("check the logs", ScheduleType.INTERVAL, "60", null);

            ScheduledJob updated = service.updateJob(job.id(), JobUpdate.schedule(ScheduleType.INTERVAL, "PT2H"))
                    .orElseThrow();

            assertEquals(START.plus(Duration.ofHours(2)), updated.nextRun());
            assertEquals("check the logs", updated.description());
            assertTrue(updated.enabled());
        }

        @Test
        @DisplayName("a description-only update keeps the schedule")
        void describe() {
            ScheduledJob job = service.createJob("check the logs", ScheduleType.INTERVAL, "60", null);

            ScheduledJob updated = service.updateJob(job.id(), new JobUpdate("check the error logs", null, null, null, null))
                    .orElseThrow();

            assertEquals("check the error logs", updated.description());
            assertEquals(job.nextRun(), updated.nextRun());
        }

        @Test
        @DisplayName("an invalid new schedule is rejected and the job is unchanged")
        void invalidUpdate() {
            ScheduledJob job = service.createJob("check the logs", ScheduleType.INTERVAL, "60", null);

            assertThrows(IllegalArgumentException.class,
                    () -> service.updateJob(job.id(), JobUpdate.schedule(ScheduleType.CRON, "whenever")));
            assertEquals(job, service.getJob(job.id()).orElseThrow());
        }

        @Test
        @DisplayName("unknown ids are reported, not created")
        void unknown() {
            assertTrue(service.updateJob("job_missing", JobUpdate.enabled(false)).isEmpty());
            assertFalse(service.deleteJob("job_missing"));
        }

        @Test
        @DisplayName("a deleted job is never dispatched")
        void delete() {
            ScheduledJob job = service.createJob("check the logs", ScheduleType.INTERVAL, "60", null);

            assertTrue(service.deleteJob(job.id()));
            clock.advance(Duration.ofMinutes(5));

            assertEquals(0, service.tick());
            assertTrue(service.getJob(job.id()).isEmpty());
        }
    }

    private static final class MovableClock extends Clock {
        private Instant now;

        MovableClock(Instant now) {
            this.now = now;
        }

        void advance(Duration by) {
            now = now.plus(by);
        }

        @Override
        public ZoneId getZone() {
            return ZoneOffset.UTC;
        }

        @Override
        public Clock withZone(ZoneId zone) {
            return this;
        }

        @Override
        public Instant instant() {
            return now;
        }
    }
}
