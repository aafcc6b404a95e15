package com.Unthinkable.TaskAssigner.engine;

import com.Unthinkable.TaskAssigner.engine.model.AdvisorySuggestion;
import com.Unthinkable.TaskAssigner.engine.model.CandidateTask.DetectionSource;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

import java.util.List;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;

class CandidateDetectorTest {

    private final CandidateDetector detector = new CandidateDetector(EngineSettings.defaults());

    @ParameterizedTest
    @ValueSource(strings = {
            "We need to ship the release notes.",
            "Can you look at the flaky build?",
            "I'll take the onboarding doc.",
            "Who can volunteer for the demo?",
            "PLEASE review my PR"
    })
    void cuePhrasesMakeCandidates(String text) {
        assertTrue(detector.isCandidate(text));
    }

    @Test
    void imperativeAtStartOfAnyClause() {
        assertTrue(detector.isCandidate("Deploy the hotfix."));
        assertTrue(detector.isCandidate("Alice, redesign the landing page."));
        assertTrue(detector.isCandidate("After the API is done, write tests."));
    }

    @Test
    void dateCueAloneIsEnough() {
        assertTrue(detector.isCandidate("The report is due tomorrow."));
    }

    @Test
    void cuesMatchOnWordBoundariesOnly() {
        // "pleased", "byte" and "updated" must not trigger
        assertFalse(detector.isCandidate("We were pleased with the byte counts."));
        assertFalse(detector.isCandidate("Everything got updated already."));
    }

    @Test
    void smallTalkIsRejected() {
        assertFalse(detector.isCandidate("Good morning everyone."));
        assertFalse(detector.isCandidate(""));
        assertFalse(detector.isCandidate(null));
    }

    @Test
    void advisorySummaryAdmitsSegmentOnlyWhenLongEnough() {
        String text = "The login page looks off on mobile.";
        AdvisorySuggestion shortSummary = new AdvisorySuggestion("Fix it", List.of(), List.of(), "", List.of(), "");
        AdvisorySuggestion longSummary = new AdvisorySuggestion("Fix the mobile login layout", List.of(), List.of(), "", List.of(), "");

        assertEquals(Optional.empty(), detector.detect(text, shortSummary));
        assertEquals(Optional.of(DetectionSource.ADVISORY), detector.detect(text, longSummary));
        assertFalse(detector.isCandidate(text, AdvisorySuggestion.empty()));
        assertTrue(detector.isCandidate(text, longSummary));
    }

    @Test
    void heuristicWinsWhenBothApply() {
        AdvisorySuggestion advisory = new AdvisorySuggestion("Fix the mobile login layout", List.of(), List.of(), "", List.of(), "");
        assertEquals(Optional.of(DetectionSource.HEURISTIC), detector.detect("Please fix the login page.", advisory));
    }
}
