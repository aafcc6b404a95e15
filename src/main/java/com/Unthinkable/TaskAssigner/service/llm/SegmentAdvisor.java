package com.Unthinkable.TaskAssigner.service.llm;

import com.Unthinkable.TaskAssigner.engine.model.AdvisorySuggestion;
import com.Unthinkable.TaskAssigner.engine.model.Segment;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.LocalDate;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * Collects advisory suggestions for every segment before a run. A failing or garbled model
 * call only loses the suggestion for that segment; the run then falls back to heuristics.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class SegmentAdvisor {

    private final LlmService llmService;
    private final AdvisoryParser advisoryParser;

    public Map<Integer, AdvisorySuggestion> advise(List<Segment> segments, LocalDate referenceDate) {
        Map<Integer, AdvisorySuggestion> out = new HashMap<>();
        if (!llmService.isEnabled()) {
            return out;
        }
        int failures = 0;
        for (Segment segment : segments) {
            try {
                String raw = llmService.analyzeSegment(segment.text(), referenceDate);
                advisoryParser.parse(raw).ifPresent(s -> out.put(segment.index(), s));
            } catch (Exception e) {
                failures++;
                log.warn("Advisory call failed for segment {}: {}", segment.index(), e.toString());
            }
        }
        log.info("Advisory suggestions for {}/{} segment(s), {} failure(s)", out.size(), segments.size(), failures);
        return out;
    }
}
