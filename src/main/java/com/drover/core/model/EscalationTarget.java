package com.drover.core.model;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * A selectable way of handling an escalated task.
 *
 * @param key         stable identifier passed back on resolution
 * @param label       short human label
 * @param description what choosing it implies
 * @param memoryCost  local memory cost in GB (0 for external or manual handling)
 * @param available   whether it can currently be chosen
 */
public record EscalationTarget(
    String key,
    String label,
    String description,
    @JsonProperty("memory_cost") double memoryCost,
    boolean available
) {
}
