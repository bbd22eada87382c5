package com.drover.core.scheduler;

import java.time.Duration;

/**
 * What the scheduler does when a task's model has no free slot.
 *
 * @param mode        fail the task at once, or retry it
 * @param maxAttempts total dispatch attempts under {@link Mode#RETRY}, including the first
 * @param backoff     delay before the first retry; grows linearly with each attempt
 */
public record AdmissionPolicy(Mode mode, int maxAttempts, Duration backoff) {

    public enum Mode { FAIL_FAST, RETRY }

    public AdmissionPolicy {
        mode = mode == null ? Mode.FAIL_FAST : mode;
        maxAttempts = Math.max(1, maxAttempts);
        backoff = backoff == null ? Duration.ZERO : backoff;
    }

    public static AdmissionPolicy failFast() {
        return new AdmissionPolicy(Mode.FAIL_FAST, 1, Duration.ZERO);
    }

    public static AdmissionPolicy retry(int maxAttempts, Duration backoff) {
        return new AdmissionPolicy(Mode.RETRY, maxAttempts, backoff);
    }

    /**
     * @param attempts dispatch attempts already rejected
     */
    public boolean allowsRetry(int attempts) {
        return mode == Mode.RETRY && attempts < maxAttempts;
    }

    public Duration delayAfter(int attempts) {
        return backoff.multipliedBy(Math.max(1, attempts));
    }
}
