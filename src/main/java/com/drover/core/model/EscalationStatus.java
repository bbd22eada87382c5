package com.drover.core.model;

import com.fasterxml.jackson.annotation.JsonProperty;

public enum EscalationStatus {
    @JsonProperty("pending") PENDING,
    @JsonProperty("resolved") RESOLVED,
    /** The waiting branch went away before anyone chose a target. */
    @JsonProperty("discarded") DISCARDED
}
