package com.Unthinkable.TaskAssigner.engine.model;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Output of one run: the final tasks with their decision records (same order), the roster as
 * it stands after the run, and the per-person workload increments to persist.
 */
public record PipelineResult(
        List<FinalTask> tasks,
        List<DecisionRecord> decisions,
        List<Person> finalRoster,
        Map<String, Integer> workloadDeltas,
        RunSummary summary
) {

    public PipelineResult {
        tasks = tasks == null ? List.of() : List.copyOf(tasks);
        decisions = decisions == null ? List.of() : List.copyOf(decisions);
        finalRoster = finalRoster == null ? List.of() : List.copyOf(finalRoster);
        workloadDeltas = workloadDeltas == null ? Map.of() : new LinkedHashMap<>(workloadDeltas);
    }
}
