package com.drover.core.scheduler;

import com.drover.core.model.Task;
import com.drover.core.model.TaskStatus;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Validation and readiness rules for a mission's task graph.
 */
public final class DependencyGraph {

    private DependencyGraph() {}

    /**
     * Checks ids, dependency references and acyclicity.
     *
     * @return the tasks keyed by id, in plan order
     * @throws InvalidPlanException         on a duplicate id or a dependency on an unknown task
     * @throws TaskDependencyCycleException if the dependencies form a cycle
     */
    public static Map<String, Task> validate(List<Task> tasks) {
        var byId = new LinkedHashMap<String, Task>();
        for (Task task : tasks) {
            if (task.id() == null || task.id().isBlank()) {
                throw new InvalidPlanException("Task without id in plan");
            }
            if (byId.putIfAbsent(task.id(), task) != null) {
                throw new InvalidPlanException("Duplicate task id: " + task.id());
            }
        }
        for (Task task : tasks) {
            for (String dep : task.dependsOn()) {
                if (!byId.containsKey(dep)) {
                    throw new InvalidPlanException("Task %s depends on unknown task %s".formatted(task.id(), dep));
                }
            }
        }

        var state = new HashMap<String, Integer>();
        for (String id : byId.keySet()) {
            if (!state.containsKey(id)) {
                visit(id, byId, state, new ArrayList<>());
            }
        }
        return byId;
    }

    // 1 = on the current path, 2 = finished
    private static void visit(String id, Map<String, Task> byId, Map<String, Integer> state, List<String> path) {
        state.put(id, 1);
        path.add(id);
        for (String dep : byId.get(id).dependsOn()) {
            Integer depState = state.get(dep);
            if (depState == null) {
                visit(dep, byId, state, path);
            } else if (depState == 1) {
                var cycle = new ArrayList<>(path.subList(path.indexOf(dep), path.size()));
                cycle.add(dep);
                throw new TaskDependencyCycleException(cycle);
            }
        }
        path.remove(path.size() - 1);
        state.put(id, 2);
    }

    /**
     * A PENDING task is ready once every dependency is DONE.
     */
    public static boolean isReady(Task task, Map<String, Task> tasks) {
        if (task.status() != TaskStatus.PENDING) {
            return false;
        }
        for (String dep : task.dependsOn()) {
            if (tasks.get(dep).status() != TaskStatus.DONE) {
                return false;
            }
        }
        return true;
    }

    /**
     * The first dependency that can no longer succeed, if any.
     */
    public static Optional<Task> blockingDependency(Task task, Map<String, Task> tasks) {
        return task.dependsOn().stream()
                .map(tasks::get)
                .filter(dep -> dep.status().blocksDependents())
                .findFirst();
    }

    /**
     * Ids of every task that transitively depends on {@code rootId}.
     */
    public static Set<String> dependentsOf(String rootId, Map<String, Task> tasks) {
        var found = new HashSet<String>();
        boolean grew = true;
        while (grew) {
            grew = false;
            for (Task task : tasks.values()) {
                if (found.contains(task.id())) continue;
                for (String dep : task.dependsOn()) {
                    if (dep.equals(rootId) || found.contains(dep)) {
                        found.add(task.id());
                        grew = true;
                        break;
                    }
                }
            }
        }
        return found;
    }
}
