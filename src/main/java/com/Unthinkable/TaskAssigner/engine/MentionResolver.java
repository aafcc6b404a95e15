package com.Unthinkable.TaskAssigner.engine;

import com.Unthinkable.TaskAssigner.engine.EngineSettings.MatchMode;
import com.Unthinkable.TaskAssigner.engine.model.Person;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.Locale;
import java.util.Optional;
import java.util.regex.Pattern;

/**
 * Matches mentioned names against the roster, case-insensitively.
 * <ul>
 *   <li>{@link MatchMode#EXACT_NAME}: the mention equals the member's full name.</li>
 *   <li>{@link MatchMode#SUBSTRING}: the mention is contained in the member's name
 *   ("Alice" finds "Alice Johnson"), or, for free text, the member's name is contained in
 *   the text.</li>
 * </ul>
 * The first matching member in roster order wins.
 */
@Component
public class MentionResolver {

    private final MatchMode matchMode;

    public MentionResolver(EngineSettings settings) {
        this.matchMode = settings.matchMode();
    }

    /**
     * Checks names in the order given; for each name the roster is scanned in order.
     */
    public Optional<Match> resolve(List<String> names, List<Person> roster) {
        if (names == null || roster == null) {
            return Optional.empty();
        }
        for (String name : names) {
            if (name == null || name.isBlank()) {
                continue;
            }
            String mention = name.trim().toLowerCase(Locale.ROOT);
            for (Person person : roster) {
                if (matchesName(mention, person.name().toLowerCase(Locale.ROOT))) {
                    return Optional.of(new Match(person, name.trim()));
                }
            }
        }
        return Optional.empty();
    }

    /**
     * Looks for a roster member's name inside a whole segment.
     */
    public Optional<Match> resolveInText(String text, List<Person> roster) {
        if (text == null || text.isBlank() || roster == null) {
            return Optional.empty();
        }
        String lowered = text.toLowerCase(Locale.ROOT);
        for (Person person : roster) {
            String name = person.name().toLowerCase(Locale.ROOT).trim();
            if (name.isEmpty()) {
                continue;
            }
            boolean found = matchMode == MatchMode.SUBSTRING
                    ? lowered.contains(name)
                    : Pattern.compile("\\b" + Pattern.quote(name) + "\\b").matcher(lowered).find();
            if (found) {
                return Optional.of(new Match(person, person.name()));
            }
        }
        return Optional.empty();
    }

    private boolean matchesName(String mention, String memberName) {
        if (memberName.isEmpty()) {
            return false;
        }
        return switch (matchMode) {
            case EXACT_NAME -> memberName.equals(mention);
            case SUBSTRING -> memberName.contains(mention);
        };
    }

    /**
     * @param person      roster member that matched
     * @param matchedName the literal mention as it appeared
     */
    public record Match(Person person, String matchedName) {}
}
