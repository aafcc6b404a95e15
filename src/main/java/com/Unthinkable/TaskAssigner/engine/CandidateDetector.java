package com.Unthinkable.TaskAssigner.engine;

import com.Unthinkable.TaskAssigner.engine.model.AdvisorySuggestion;
import com.Unthinkable.TaskAssigner.engine.model.CandidateTask.DetectionSource;
import org.springframework.stereotype.Component;

import java.util.Locale;
import java.util.Optional;
import java.util.Set;
import java.util.regex.Pattern;

/**
 * Decides whether a segment describes an actionable item. Rules are checked in order and the
 * first hit wins; a segment that hits none is rejected outright.
 */
@Component
public class CandidateDetector {

    private static final Pattern CUE_PHRASES = Pattern.compile(
            "\\b(we need to|need to|needs to|have to|has to|can you|could you|please|assign|assigned to|"
                    + "todo|to do|action item|we should|should|must|i'll|i will|can someone|who can|"
                    + "volunteer|take it|responsible for|work on|going to)\\b",
            Pattern.CASE_INSENSITIVE);

    private static final Set<String> IMPERATIVE_VERBS = Set.of(
            "update", "fix", "test", "deploy", "design", "redesign", "create", "prepare", "write", "review",
            "check", "implement", "investigate", "follow", "schedule", "setup", "set", "migrate", "refactor",
            "improve", "add", "remove", "patch", "build", "send", "draft", "document", "organize",
            "coordinate", "finish", "complete", "book", "run", "plan");

    private static final Pattern DATE_CUES = Pattern.compile(
            "\\b(by|before|until|due|next|tomorrow|today|tonight|this week|end of day|end of week|eod)\\b",
            Pattern.CASE_INSENSITIVE);

    private static final Pattern CLAUSE_BREAK = Pattern.compile("[,;:]");

    private final int advisoryMinSummaryLength;

    public CandidateDetector(EngineSettings settings) {
        this.advisoryMinSummaryLength = settings.advisoryMinSummaryLength();
    }

    public boolean isCandidate(String text) {
        if (text == null || text.isBlank()) {
            return false;
        }
        if (CUE_PHRASES.matcher(text).find()) {
            return true;
        }
        if (startsWithImperative(text)) {
            return true;
        }
        return DATE_CUES.matcher(text).find();
    }

    public boolean isCandidate(String text, AdvisorySuggestion advisory) {
        return detect(text, advisory).isPresent();
    }

    /**
     * Same decision as {@link #isCandidate(String, AdvisorySuggestion)}, reporting which side
     * admitted the segment. The heuristic is always consulted first.
     */
    public Optional<DetectionSource> detect(String text, AdvisorySuggestion advisory) {
        if (isCandidate(text)) {
            return Optional.of(DetectionSource.HEURISTIC);
        }
        if (advisory != null && advisory.summary().length() > advisoryMinSummaryLength) {
            return Optional.of(DetectionSource.ADVISORY);
        }
        return Optional.empty();
    }

    // The addressee or a leading condition often precedes the verb: "Alice, redesign ...".
    private boolean startsWithImperative(String text) {
        for (String clause : CLAUSE_BREAK.split(text.trim())) {
            String first = firstWord(clause);
            if (!first.isEmpty() && IMPERATIVE_VERBS.contains(first)) {
                return true;
            }
        }
        return false;
    }

    private static String firstWord(String clause) {
        String trimmed = clause.trim();
        if (trimmed.isEmpty()) {
            return "";
        }
        String word = trimmed.split("\\s+", 2)[0].toLowerCase(Locale.ROOT);
        return word.replaceAll("[^a-z']", "");
    }
}
