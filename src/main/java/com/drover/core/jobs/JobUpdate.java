package com.drover.core.jobs;

import com.drover.core.model.PlanTask;

import java.util.List;

/**
 * Partial update of a scheduled job. Null fields are left unchanged.
 */
public record JobUpdate(
    String description,
    ScheduleType scheduleType,
    String scheduleValue,
    Boolean enabled,
    List<PlanTask> plan
) {

    public static JobUpdate enabled(boolean enabled) {
        return new JobUpdate(null, null, null, enabled, null);
    }

    public static JobUpdate schedule(ScheduleType type, String value) {
        return new JobUpdate(null, type, value, null, null);
    }

    boolean changesSchedule() {
        return scheduleType != null || scheduleValue != null;
    }
}
