package com.newsroom.core.scheduler;

import com.newsroom.core.model.Task;
import com.newsroom.core.model.TaskDependency;

import java.util.ArrayList;
import java.util.Collection;
import java.util.EnumMap;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * In-memory task collections partitioned by lifecycle state, plus a reverse dependency index.
 * <p>
 * {@link #put(Task)} places a task in the partition implied by its status and removes it from
 * any other, so a task id is held by exactly one partition at any time. Not thread-safe: the
 * owning {@link Scheduler} serializes access.
 */
class TaskStore {

    enum Partition {
        PENDING,
        RUNNING,
        COMPLETED,
        FAILED,
        CANCELLED
    }

    private final Map<Partition, LinkedHashMap<String, Task>> partitions = new EnumMap<>(Partition.class);
    private final Map<String, Partition> location = new HashMap<>();
    private final Map<String, Set<String>> dependents = new HashMap<>();

    TaskStore() {
        for (Partition p : Partition.values()) {
            partitions.put(p, new LinkedHashMap<>());
        }
    }

    static Partition partitionFor(Task task) {
        return switch (task.status()) {
            case PENDING, RETRYING -> Partition.PENDING;
            case SCHEDULED, RUNNING -> Partition.RUNNING;
            case COMPLETED -> Partition.COMPLETED;
            case FAILED -> Partition.FAILED;
            case CANCELLED -> Partition.CANCELLED;
        };
    }

    void put(Task task) {
        Partition target = partitionFor(task);
        Partition current = location.get(task.id());
        if (current == null) {
            for (TaskDependency dep : task.dependencies()) {
                dependents.computeIfAbsent(dep.taskId(), k -> new LinkedHashSet<>()).add(task.id());
            }
        } else if (current != target) {
            partitions.get(current).remove(task.id());
        }
        partitions.get(target).put(task.id(), task);
        location.put(task.id(), target);
    }

    boolean contains(String id) {
        return location.containsKey(id);
    }

    Optional<Task> find(String id) {
        Partition p = location.get(id);
        return p == null ? Optional.empty() : Optional.of(partitions.get(p).get(id));
    }

    Partition partitionOf(String id) {
        return location.get(id);
    }

    Collection<Task> tasksIn(Partition partition) {
        return partitions.get(partition).values();
    }

    int count(Partition partition) {
        return partitions.get(partition).size();
    }

    Set<String> dependentsOf(String id) {
        return dependents.getOrDefault(id, Set.of());
    }

    List<Task> all() {
        var all = new ArrayList<Task>();
        for (var p : partitions.values()) {
            all.addAll(p.values());
        }
        return all;
    }
}
