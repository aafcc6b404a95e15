package com.Unthinkable.TaskAssigner.engine;

import com.Unthinkable.TaskAssigner.engine.model.Priority;
import org.springframework.stereotype.Component;

import java.util.EnumMap;
import java.util.Map;
import java.util.Optional;
import java.util.regex.Pattern;

/**
 * Maps text to a {@link Priority} through an ordered cascade. Levels are tried from most to
 * least urgent, so text carrying both "urgent" and "by tomorrow" is Critical.
 */
@Component
public class PriorityClassifier {

    private static final String WEEKDAYS = "monday|tuesday|wednesday|thursday|friday|saturday|sunday";

    private static final Map<Priority, Pattern> CASCADE = new EnumMap<>(Priority.class);

    static {
        CASCADE.put(Priority.CRITICAL, cues("critical|urgent|urgently|asap|blocking|blocker|immediately|emergency"));
        CASCADE.put(Priority.HIGH, cues("high priority|important|soon|quickly|by (?:tomorrow|eod|end of day|" + WEEKDAYS + ")"));
        CASCADE.put(Priority.MEDIUM, cues("this week|next week|within a week|medium priority|normal|regular"));
        CASCADE.put(Priority.LOW, cues("low priority|when possible|whenever possible|eventually|nice to have"));
    }

    public Priority classify(String text) {
        return cascade(text).orElse(Priority.MEDIUM);
    }

    /**
     * A non-empty hint overrides the text. It is read as a level name first ("High"), then through
     * the same cascade as the text ("urgent", "high priority"). A hint that yields no level is
     * ignored.
     */
    public Priority classify(String text, String advisoryHint) {
        return fromHint(advisoryHint).orElseGet(() -> classify(text));
    }

    public boolean isAdvisoryHintUsable(String advisoryHint) {
        return fromHint(advisoryHint).isPresent();
    }

    private Optional<Priority> fromHint(String advisoryHint) {
        Optional<Priority> named = Priority.fromLabel(advisoryHint);
        return named.isPresent() ? named : cascade(advisoryHint);
    }

    private static Optional<Priority> cascade(String text) {
        if (text == null || text.isBlank()) {
            return Optional.empty();
        }
        for (Map.Entry<Priority, Pattern> level : CASCADE.entrySet()) {
            if (level.getValue().matcher(text).find()) {
                return Optional.of(level.getKey());
            }
        }
        return Optional.empty();
    }

    private static Pattern cues(String alternatives) {
        return Pattern.compile("\\b(?:" + alternatives + ")\\b", Pattern.CASE_INSENSITIVE);
    }
}
