package com.drover.core.model;

public enum Priority {
    LOW,
    NORMAL,
    HIGH,
    CRITICAL
}
