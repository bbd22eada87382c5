package com.drover.core.model;

public enum AgentState {
    IDLE,
    RUNNING,
    ERROR,
    SUSPENDED
}
