package com.drover.core.scheduler;

import com.drover.core.model.Mission;

import java.time.Duration;
import java.util.concurrent.CompletableFuture;

/**
 * Caller's view of a submitted mission.
 */
public interface MissionHandle {

    String missionId();

    /** Current immutable snapshot. */
    Mission snapshot();

    /**
     * Blocks until the mission is finished or the timeout elapses.
     *
     * @return the final snapshot, or the current one on timeout
     */
    Mission await(Duration timeout);

    /** Completes with the final snapshot. */
    CompletableFuture<Mission> completion();

    void cancel();

    default boolean isDone() {
        return completion().isDone();
    }
}
