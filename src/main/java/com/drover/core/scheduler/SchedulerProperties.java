package com.drover.core.scheduler;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

import java.time.Duration;

/**
 * Mission execution settings bound from {@code drover.scheduler.*}.
 */
@Component
@ConfigurationProperties(prefix = "drover.scheduler")
public class SchedulerProperties {

    /** Size of the worker pool that runs agent calls, shared by all missions. */
    private int workerThreads = 4;
    /** Per-task limit; zero or unset means none. */
    private Duration taskTimeout;
    private boolean allowPartial = true;
    /** Finished missions kept for inspection before the oldest are dropped. */
    private int maxMissions = 100;
    private Admission admission = new Admission();

    public int getWorkerThreads() {
        return workerThreads;
    }

    public void setWorkerThreads(int workerThreads) {
        this.workerThreads = workerThreads;
    }

    public Duration getTaskTimeout() {
        return taskTimeout;
    }

    public void setTaskTimeout(Duration taskTimeout) {
        this.taskTimeout = taskTimeout;
    }

    public boolean isAllowPartial() {
        return allowPartial;
    }

    public void setAllowPartial(boolean allowPartial) {
        this.allowPartial = allowPartial;
    }

    public int getMaxMissions() {
        return maxMissions;
    }

    public void setMaxMissions(int maxMissions) {
        this.maxMissions = maxMissions;
    }

    public Admission getAdmission() {
        return admission;
    }

    public void setAdmission(Admission admission) {
        this.admission = admission;
    }

    public AdmissionPolicy admissionPolicy() {
        return new AdmissionPolicy(admission.getMode(), admission.getMaxAttempts(), admission.getBackoff());
    }

    public static class Admission {
        private AdmissionPolicy.Mode mode = AdmissionPolicy.Mode.RETRY;
        private int maxAttempts = 3;
        private Duration backoff = Duration.ofMillis(500);

        public AdmissionPolicy.Mode getMode() {
            return mode;
        }

        public void setMode(AdmissionPolicy.Mode mode) {
            this.mode = mode;
        }

        public int getMaxAttempts() {
            return maxAttempts;
        }

        public void setMaxAttempts(int maxAttempts) {
            this.maxAttempts = maxAttempts;
        }

        public Duration getBackoff() {
            return backoff;
        }

        public void setBackoff(Duration backoff) {
            this.backoff = backoff;
        }
    }
}
