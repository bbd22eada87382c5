package com.drover.core.scheduler;

import java.time.Duration;

/**
 * Per-mission execution switches. Null fields fall back to {@link SchedulerProperties}.
 *
 * @param synthesize   run one extra completion over the results to produce a final answer
 * @param allowPartial report PARTIAL instead of FAILED when some tasks succeeded
 * @param taskTimeout  wall-clock limit per task (nullable)
 */
public record MissionOptions(boolean synthesize, Boolean allowPartial, Duration taskTimeout) {

    public static MissionOptions defaults() {
        return new MissionOptions(false, null, null);
    }

    public static MissionOptions synthesized() {
        return new MissionOptions(true, null, null);
    }

    public MissionOptions withSynthesis(boolean enabled) {
        return new MissionOptions(enabled, allowPartial, taskTimeout);
    }

    public MissionOptions withAllowPartial(boolean enabled) {
        return new MissionOptions(synthesize, enabled, taskTimeout);
    }

    public MissionOptions withTaskTimeout(Duration timeout) {
        return new MissionOptions(synthesize, allowPartial, timeout);
    }
}
