package com.Unthinkable.TaskAssigner.engine;

import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.DateTimeException;
import java.time.DayOfWeek;
import java.time.LocalDate;
import java.time.temporal.ChronoUnit;
import java.time.temporal.TemporalAdjusters;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.function.BiFunction;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Finds the first deadline phrase in a segment and resolves it against a reference date.
 * Only one deadline per segment is produced; a phrase that cannot be turned into a date
 * yields no deadline.
 */
@Component
public class DeadlineExtractor {

    static final int URGENT_WITHIN_DAYS = 2;

    private static final String WEEKDAY = "monday|tuesday|wednesday|thursday|friday|saturday|sunday";
    private static final String AMOUNT = "\\d{1,4}|an?|one|two|three|four|five|six|seven|eight|nine|ten|eleven|twelve";

    private static final Map<String, Integer> NUMBER_WORDS = Map.ofEntries(
            Map.entry("a", 1), Map.entry("an", 1), Map.entry("one", 1), Map.entry("two", 2),
            Map.entry("three", 3), Map.entry("four", 4), Map.entry("five", 5), Map.entry("six", 6),
            Map.entry("seven", 7), Map.entry("eight", 8), Map.entry("nine", 9), Map.entry("ten", 10),
            Map.entry("eleven", 11), Map.entry("twelve", 12));

    // Order matters only for phrases starting at the same position.
    private static final List<DeadlinePattern> PATTERNS = List.of(
            pattern("\\b(\\d{4}-\\d{2}-\\d{2})\\b", (m, ref) -> Optional.of(LocalDate.parse(m.group(1)))),
            pattern("\\b(?:(?:by|on|before|until|due)\\s+)?(?:next\\s+|this\\s+)?(" + WEEKDAY + ")\\b",
                    (m, ref) -> Optional.of(ref.with(TemporalAdjusters.next(dayOfWeek(m.group(1)))))),
            pattern("\\btomorrow\\b", (m, ref) -> Optional.of(ref.plusDays(1))),
            pattern("\\b(?:today|tonight|eod|end of (?:the )?day)\\b", (m, ref) -> Optional.of(ref)),
            pattern("\\bnext week\\b", (m, ref) -> Optional.of(ref.plusDays(7))),
            pattern("\\b(?:this week|end of (?:the )?week)\\b", (m, ref) -> Optional.of(endOfWorkWeek(ref))),
            pattern("\\b(?:end of (?:the )?month|this month)\\b",
                    (m, ref) -> Optional.of(ref.with(TemporalAdjusters.lastDayOfMonth()))),
            pattern("\\bnext month\\b", (m, ref) -> Optional.of(ref.plusMonths(1))),
            pattern("\\bnext quarter\\b", (m, ref) -> Optional.of(ref.plusMonths(3))),
            pattern("\\b(?:in|within)\\s+(" + AMOUNT + ")\\s+(days?|weeks?|months?)\\b",
                    (m, ref) -> Optional.of(plus(ref, amount(m.group(1)), m.group(2)))),
            pattern("\\b(?:in|within)\\s+(?:a\\s+)?(couple of|few)\\s+(days|weeks)\\b",
                    (m, ref) -> Optional.of(plus(ref, m.group(1).startsWith("couple") ? 2 : 3, m.group(2))))
    );

    private final Clock clock;

    public DeadlineExtractor(Clock clock) {
        this.clock = clock;
    }

    public Optional<LocalDate> extract(String text, LocalDate referenceDate) {
        return findMatch(text).flatMap(match -> match.resolve(referenceDate));
    }

    /** Resolves a standalone phrase such as "by Friday" or "2024-05-01". */
    public Optional<LocalDate> resolve(String phrase, LocalDate referenceDate) {
        return extract(phrase, referenceDate);
    }

    public Optional<String> findPhrase(String text) {
        return findMatch(text).map(PhraseMatch::phrase);
    }

    /** True when the date falls no more than two days after today, overdue dates included. */
    public boolean isUrgent(LocalDate deadline) {
        if (deadline == null) {
            return false;
        }
        long days = ChronoUnit.DAYS.between(LocalDate.now(clock), deadline);
        return days <= URGENT_WITHIN_DAYS;
    }

    private Optional<PhraseMatch> findMatch(String text) {
        if (text == null || text.isBlank()) {
            return Optional.empty();
        }
        PhraseMatch best = null;
        for (DeadlinePattern p : PATTERNS) {
            Matcher m = p.regex().matcher(text);
            if (m.find() && (best == null || m.start() < best.start())) {
                best = new PhraseMatch(m.start(), m.group(), p, m);
            }
        }
        return Optional.ofNullable(best);
    }

    private static DeadlinePattern pattern(String regex, BiFunction<Matcher, LocalDate, Optional<LocalDate>> resolver) {
        return new DeadlinePattern(Pattern.compile(regex, Pattern.CASE_INSENSITIVE), resolver);
    }

    private static DayOfWeek dayOfWeek(String name) {
        return DayOfWeek.valueOf(name.toUpperCase(Locale.ROOT));
    }

    private static LocalDate endOfWorkWeek(LocalDate ref) {
        DayOfWeek dow = ref.getDayOfWeek();
        if (dow == DayOfWeek.SATURDAY || dow == DayOfWeek.SUNDAY) {
            return ref;
        }
        return ref.with(TemporalAdjusters.nextOrSame(DayOfWeek.FRIDAY));
    }

    private static int amount(String token) {
        String t = token.toLowerCase(Locale.ROOT);
        Integer word = NUMBER_WORDS.get(t);
        return word != null ? word : Integer.parseInt(t);
    }

    private static LocalDate plus(LocalDate ref, int amount, String unit) {
        String u = unit.toLowerCase(Locale.ROOT);
        if (u.startsWith("day")) return ref.plusDays(amount);
        if (u.startsWith("week")) return ref.plusWeeks(amount);
        return ref.plusMonths(amount);
    }

    private record DeadlinePattern(Pattern regex, BiFunction<Matcher, LocalDate, Optional<LocalDate>> resolver) {}

    private record PhraseMatch(int start, String phrase, DeadlinePattern pattern, Matcher matcher) {

        Optional<LocalDate> resolve(LocalDate referenceDate) {
            try {
                return pattern.resolver().apply(matcher, referenceDate);
            } catch (DateTimeException | NumberFormatException e) {
                // e.g. "2024-02-30": the phrase is there but names no real date
                return Optional.empty();
            }
        }
    }
}
