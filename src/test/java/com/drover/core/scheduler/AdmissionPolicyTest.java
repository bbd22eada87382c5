package com.drover.core.scheduler;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Duration;

import static org.junit.jupiter.api.Assertions.*;

class AdmissionPolicyTest {

    @Test
    @DisplayName("fail-fast never retries")
    void failFast() {
        AdmissionPolicy policy = AdmissionPolicy.failFast();
        assertFalse(policy.allowsRetry(1));
        assertEquals(1, policy.maxAttempts());
    }

    @Test
    @DisplayName("retry allows attempts up to the limit with linear backoff")
    void retry() {
        AdmissionPolicy policy = AdmissionPolicy.retry(3, Duration.ofMillis(100));
        assertTrue(policy.allowsRetry(1));
        assertTrue(policy.allowsRetry(2));
        assertFalse(policy.allowsRetry(3));
        assertEquals(Duration.ofMillis(100), policy.delayAfter(1));
        assertEquals(Duration.ofMillis(200), policy.delayAfter(2));
    }

    @Test
    @DisplayName("missing values fall back to safe defaults")
    void defaults() {
        AdmissionPolicy policy = new AdmissionPolicy(null, 0, null);
        assertEquals(AdmissionPolicy.Mode.FAIL_FAST, policy.mode());
        assertEquals(1, policy.maxAttempts());
        assertEquals(Duration.ZERO, policy.delayAfter(0));
    }

    @Test
    @DisplayName("scheduler properties default to retrying")
    void propertiesDefault() {
        AdmissionPolicy policy = new SchedulerProperties().admissionPolicy();
        assertEquals(AdmissionPolicy.Mode.RETRY, policy.mode());
        assertEquals(3, policy.maxAttempts());
    }
}
