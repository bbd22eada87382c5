package com.drover.core.jobs;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

import java.time.Duration;

/**
 * Scheduled job settings bound from {@code drover.jobs.*}.
 */
@Component
@ConfigurationProperties(prefix = "drover.jobs")
public class JobProperties {

    /** Whether due jobs are dispatched automatically. */
    private boolean enabled = true;
    private Duration tickInterval = Duration.ofSeconds(30);
    private Duration initialDelay = Duration.ofSeconds(10);

    public boolean isEnabled() {
        return enabled;
    }

    public void setEnabled(boolean enabled) {
        this.enabled = enabled;
    }

    public Duration getTickInterval() {
        return tickInterval;
    }

    public void setTickInterval(Duration tickInterval) {
        this.tickInterval = tickInterval;
    }

    public Duration getInitialDelay() {
        return initialDelay;
    }

    public void setInitialDelay(Duration initialDelay) {
        this.initialDelay = initialDelay;
    }
}
