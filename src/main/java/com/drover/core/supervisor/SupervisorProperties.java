package com.drover.core.supervisor;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

import java.time.Duration;

/**
 * Background task settings bound from {@code drover.supervisor.*}.
 */
@Component
@ConfigurationProperties(prefix = "drover.supervisor")
public class SupervisorProperties {

    /** Finished tasks kept before the least recently updated are dropped. */
    private int maxTasks = 100;
    /** How long a background task's mission may run before it is cancelled. */
    private Duration missionTimeout = Duration.ofMinutes(20);

    public int getMaxTasks() {
        return maxTasks;
    }

    public void setMaxTasks(int maxTasks) {
        this.maxTasks = maxTasks;
    }

    public Duration getMissionTimeout() {
        return missionTimeout;
    }

    public void setMissionTimeout(Duration missionTimeout) {
        this.missionTimeout = missionTimeout;
    }
}
