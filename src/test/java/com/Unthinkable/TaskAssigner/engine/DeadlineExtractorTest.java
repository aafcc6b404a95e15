package com.Unthinkable.TaskAssigner.engine;

import org.junit.jupiter.api.Test;

import java.time.LocalDate;
import java.util.Optional;

import static com.Unthinkable.TaskAssigner.engine.EngineFixtures.CLOCK;
import static com.Unthinkable.TaskAssigner.engine.EngineFixtures.REF;
import static org.junit.jupiter.api.Assertions.*;

class DeadlineExtractorTest {

    private final DeadlineExtractor extractor = new DeadlineExtractor(CLOCK);

    private LocalDate extract(String text) {
        return extractor.extract(text, REF).orElse(null);
    }

    @Test
    void relativeDays() {
        assertEquals(LocalDate.of(2024, 1, 11), extract("Finish it tomorrow"));
        assertEquals(REF, extract("Ship it by end of day"));
        assertEquals(LocalDate.of(2024, 1, 17), extract("Let's revisit next week"));
    }

    @Test
    void weekdayIsNextOccurrenceAfterReference() {
        assertEquals(LocalDate.of(2024, 1, 12), extract("Send the deck by Friday"));
        // the reference date is itself a Wednesday
        assertEquals(LocalDate.of(2024, 1, 17), extract("Demo on Wednesday"));
        assertEquals(LocalDate.of(2024, 1, 15), extract("due next monday"));
    }

    @Test
    void thisWeekMeansFriday() {
        assertEquals(LocalDate.of(2024, 1, 12), extract("Wrap this up this week"));
        LocalDate saturday = LocalDate.of(2024, 1, 13);
        assertEquals(Optional.of(saturday), extractor.extract("end of the week please", saturday));
    }

    @Test
    void monthsAndQuarters() {
        assertEquals(LocalDate.of(2024, 1, 31), extract("before end of month"));
        assertEquals(LocalDate.of(2024, 2, 10), extract("next month works"));
        assertEquals(LocalDate.of(2024, 4, 10), extract("plan it for next quarter"));
    }

    @Test
    void durations() {
        assertEquals(LocalDate.of(2024, 1, 13), extract("in 3 days"));
        assertEquals(LocalDate.of(2024, 1, 24), extract("within two weeks"));
        assertEquals(LocalDate.of(2024, 1, 12), extract("in a couple of days"));
        assertEquals(LocalDate.of(2024, 2, 10), extract("in a month"));
    }

    @Test
    void isoDate() {
        assertEquals(LocalDate.of(2024, 3, 1), extract("Release on 2024-03-01"));
    }

    @Test
    void invalidIsoDateYieldsNothing() {
        assertNull(extract("Release on 2024-02-30"));
    }

    @Test
    void earliestPhraseWins() {
        assertEquals(LocalDate.of(2024, 1, 12), extract("By Friday, or tomorrow at the latest"));
        assertEquals(Optional.of("By Friday"), extractor.findPhrase("By Friday, or tomorrow at the latest"));
    }

    @Test
    void noPhrase() {
        assertNull(extract("Refactor the billing module"));
        assertEquals(Optional.empty(), extractor.findPhrase(null));
    }

    @Test
    void resolveStandalonePhrase() {
        assertEquals(Optional.of(LocalDate.of(2024, 1, 12)), extractor.resolve("by Friday", REF));
        assertEquals(Optional.empty(), extractor.resolve("sometime", REF));
    }

    @Test
    void urgencyIsTwoDaysOrLessIncludingOverdue() {
        assertTrue(extractor.isUrgent(LocalDate.of(2024, 1, 12)));
        assertTrue(extractor.isUrgent(LocalDate.of(2024, 1, 5)));
        assertFalse(extractor.isUrgent(LocalDate.of(2024, 1, 13)));
        assertFalse(extractor.isUrgent(null));
    }
}
