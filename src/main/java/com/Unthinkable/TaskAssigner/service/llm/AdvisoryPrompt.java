package com.Unthinkable.TaskAssigner.service.llm;

import java.time.LocalDate;

public final class AdvisoryPrompt {

    private AdvisoryPrompt() {}

    public static String forSegment(String segmentText, LocalDate referenceDate) {
        return """
                You are an assistant that helps extract task-related information from a meeting utterance.
                Return strictly valid JSON with keys:
                - summary: a single short action-style sentence (or empty string)
                - persons: list of person names mentioned (may be empty)
                - date_phrases: list of natural-language date phrases found (e.g., "by Friday")
                - priority_hint: one of ["Critical","High","Medium","Low",""] (or empty)
                - dependencies: list of phrases indicating dependencies (e.g., "after design is ready")
                - context_notes: short notes (blockers, constraints) or empty

                Reference meeting date (ISO): %s

                Utterance: \"""%s\"""
                """.formatted(referenceDate, segmentText);
    }
}
