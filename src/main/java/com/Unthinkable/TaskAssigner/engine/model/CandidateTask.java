package com.Unthinkable.TaskAssigner.engine.model;

import java.time.LocalDate;
import java.util.List;

/**
 * A segment that passed detection, before assignment.
 *
 * @param sourceSegmentIndex index of the segment this task came from, unique within one run
 * @param description        task text, already truncated to the configured maximum length
 * @param priority           never null
 * @param deadline           resolved due date, or {@code null} when none was found or resolvable
 * @param context            surrounding-segment window
 * @param mentionedNames     person names found in the segment, in order of appearance
 * @param detectedBy         which rule admitted the segment
 * @param advisory           the advisory suggestion consulted, {@link AdvisorySuggestion#empty()} if none
 */
public record CandidateTask(
        int sourceSegmentIndex,
        String description,
        Priority priority,
        LocalDate deadline,
        String context,
        List<String> mentionedNames,
        DetectionSource detectedBy,
        AdvisorySuggestion advisory
) {

    public CandidateTask {
        if (priority == null) {
            throw new IllegalArgumentException("priority is required");
        }
        description = description == null ? "" : description;
        context = context == null ? "" : context;
        mentionedNames = mentionedNames == null ? List.of() : List.copyOf(mentionedNames);
        detectedBy = detectedBy == null ? DetectionSource.HEURISTIC : detectedBy;
        advisory = advisory == null ? AdvisorySuggestion.empty() : advisory;
    }

    public enum DetectionSource {
        HEURISTIC, ADVISORY
    }
}
