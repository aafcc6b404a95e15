package com.Unthinkable.TaskAssigner.service.llm;

import java.time.LocalDate;

public interface LlmService {
    /**
     * Asks the model about one utterance and returns its raw reply, expected to contain a JSON
     * object. An empty string means no model is configured.
     */
    String analyzeSegment(String segmentText, LocalDate referenceDate) throws Exception;

    boolean isEnabled();
}
