package com.Unthinkable.TaskAssigner.engine.model;

import java.time.LocalDate;
import java.util.Collections;
import java.util.SortedSet;
import java.util.TreeSet;

/**
 * An assigned task with its dependency edges. {@code dependencies} only ever holds positions
 * lower than {@code position}.
 */
public record FinalTask(int position, AssignedTask assigned, SortedSet<Integer> dependencies) {

    public FinalTask {
        if (assigned == null) {
            throw new IllegalArgumentException("assigned task is required");
        }
        SortedSet<Integer> deps = new TreeSet<>(dependencies == null ? Collections.emptySortedSet() : dependencies);
        for (Integer d : deps) {
            if (d < 0 || d >= position) {
                throw new IllegalArgumentException("Dependency " + d + " is not a prior task of " + position);
            }
        }
        dependencies = Collections.unmodifiableSortedSet(deps);
    }

    public String description() {
        return assigned.candidate().description();
    }

    public Priority priority() {
        return assigned.candidate().priority();
    }

    public LocalDate deadline() {
        return assigned.candidate().deadline();
    }

    public String assigneeName() {
        return assigned.assigneeName();
    }

    public String reasoning() {
        return assigned.reasoning();
    }
}
