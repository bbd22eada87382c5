package com.drover.core.model;

/**
 * Lifecycle of a task inside a mission graph.
 */
public enum TaskStatus {
    PENDING,
    READY,
    RUNNING,
    DONE,
    FAILED,
    SKIPPED;

    public boolean isTerminal() {
        return this == DONE || this == FAILED || this == SKIPPED;
    }

    /** Terminal states that block every dependent task. */
    public boolean blocksDependents() {
        return this == FAILED || this == SKIPPED;
    }
}
