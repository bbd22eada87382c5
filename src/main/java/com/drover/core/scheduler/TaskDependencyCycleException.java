package com.drover.core.scheduler;

import java.util.List;

/**
 * Thrown when a plan's dependency relation contains a cycle.
 */
public class TaskDependencyCycleException extends InvalidPlanException {

    private final List<String> cycle;

    public TaskDependencyCycleException(List<String> cycle) {
        super("Dependency cycle between tasks: " + String.join(" -> ", cycle));
        this.cycle = List.copyOf(cycle);
    }

    /** Task ids along the cycle, first id repeated at the end. */
    public List<String> getCycle() {
        return cycle;
    }
}
