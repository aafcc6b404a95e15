package com.Unthinkable.TaskAssigner.engine.model;

import java.time.LocalDate;
import java.util.List;
import java.util.Map;

/**
 * Everything one run needs. {@code advisory} is keyed by segment index and may be empty.
 */
public record PipelineInput(
        List<Segment> segments,
        LocalDate referenceDate,
        List<Person> roster,
        Map<Integer, AdvisorySuggestion> advisory
) {

    public PipelineInput {
        if (referenceDate == null) {
            throw new IllegalArgumentException("referenceDate is required");
        }
        segments = segments == null ? List.of() : List.copyOf(segments);
        roster = roster == null ? List.of() : List.copyOf(roster);
        advisory = advisory == null ? Map.of() : Map.copyOf(advisory);
    }

    public static PipelineInput heuristicOnly(List<Segment> segments, LocalDate referenceDate, List<Person> roster) {
        return new PipelineInput(segments, referenceDate, roster, Map.of());
    }

    public AdvisorySuggestion advisoryFor(int segmentIndex) {
        return advisory.getOrDefault(segmentIndex, AdvisorySuggestion.empty());
    }
}
