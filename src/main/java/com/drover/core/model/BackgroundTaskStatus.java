package com.drover.core.model;

import com.fasterxml.jackson.annotation.JsonProperty;

public enum BackgroundTaskStatus {
    @JsonProperty("running") RUNNING,
    @JsonProperty("completed") COMPLETED,
    @JsonProperty("failed") FAILED,
    @JsonProperty("cancelled") CANCELLED;

    public boolean isTerminal() {
        return this != RUNNING;
    }
}
