package com.drover.core.model;

public enum MissionStatus {
    PENDING,
    RUNNING,
    COMPLETED,
    FAILED,
    PARTIAL,
    CANCELLED;

    public boolean isTerminal() {
        return this != PENDING && this != RUNNING;
    }
}
