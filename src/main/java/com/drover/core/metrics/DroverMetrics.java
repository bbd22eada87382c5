package com.drover.core.metrics;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.DistributionSummary;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import org.springframework.stereotype.Service;

import java.time.Duration;

/**
 * Centralised Micrometer metrics for mission execution and inference admission.
 */
@Service
public class DroverMetrics {

    private final MeterRegistry registry;

    public DroverMetrics(MeterRegistry registry) {
        this.registry = registry;
    }

    public void recordMissionResult(String status) {
        Counter.builder("drover.missions.total")
                .tag("status", status)
                .register(registry)
                .increment();
    }

    public void recordTaskExecution(String agentId, String outcome, long ms) {
        Timer.builder("drover.task.duration")
                .tag("agent", agentId)
                .tag("outcome", outcome)
                .register(registry)
                .record(Duration.ofMillis(ms));
    }

    public void recordSkippedTasks(int count) {
        if (count == 0) return;
        Counter.builder("drover.tasks.skipped")
                .register(registry)
                .increment(count);
    }

    /**
     * Counts calls turned away because the model had no free slot.
     *
     * @param modelKey model key that was at capacity
     */
    public void recordAdmissionRejected(String modelKey) {
        Counter.builder("drover.admission.rejections")
                .description("Inference calls rejected because every slot was in use")
                .tag("model", modelKey)
                .register(registry)
                .increment();
    }

    public void incrementEscalations(String outcome) {
        Counter.builder("drover.escalations.total")
                .tag("outcome", outcome)
                .register(registry)
                .increment();
    }

    public void recordMissionSize(int taskCount) {
        DistributionSummary.builder("drover.mission.task_count")
                .description("Number of tasks per submitted mission")
                .register(registry)
                .record(taskCount);
    }

    public void recordSynthesis(boolean degraded) {
        Counter.builder("drover.synthesis.total")
                .tag("degraded", String.valueOf(degraded))
                .register(registry)
                .increment();
    }
}
