package com.Unthinkable.TaskAssigner.engine.model;

/**
 * Provenance of every decision taken for one task, for audit display.
 *
 * @param position           position of the task in the run's output
 * @param sourceSegmentIndex segment the task came from
 * @param detectedBy         rule that admitted the segment
 * @param prioritySource     {@code "advisory"} when the hint was used, otherwise {@code "heuristic"}
 * @param deadlinePhrase     phrase the deadline was resolved from, or {@code null}
 * @param assignment         assignment rule, score and per-member scores
 * @param dependencyCue      cue word that produced a dependency edge, or {@code null}
 * @param advisoryConsulted  whether a non-empty advisory suggestion existed for the segment
 */
public record DecisionRecord(
        int position,
        int sourceSegmentIndex,
        CandidateTask.DetectionSource detectedBy,
        String prioritySource,
        String deadlinePhrase,
        AssignmentDecision assignment,
        String dependencyCue,
        boolean advisoryConsulted
) {
}
