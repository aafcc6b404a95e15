package com.Unthinkable.TaskAssigner.engine.model;

import java.util.List;

/**
 * Untrusted per-segment hint from a language model. Missing values are normalized to empty
 * strings and empty lists so the engine never has to null-check.
 */
public record AdvisorySuggestion(
        String summary,
        List<String> persons,
        List<String> datePhrases,
        String priorityHint,
        List<String> dependencies,
        String contextNotes
) {

    private static final AdvisorySuggestion EMPTY =
            new AdvisorySuggestion("", List.of(), List.of(), "", List.of(), "");

    public AdvisorySuggestion {
        summary = summary == null ? "" : summary.trim();
        persons = persons == null ? List.of() : List.copyOf(persons);
        datePhrases = datePhrases == null ? List.of() : List.copyOf(datePhrases);
        priorityHint = priorityHint == null ? "" : priorityHint.trim();
        dependencies = dependencies == null ? List.of() : List.copyOf(dependencies);
        contextNotes = contextNotes == null ? "" : contextNotes.trim();
    }

    public static AdvisorySuggestion empty() {
        return EMPTY;
    }

    public boolean isEmpty() {
        return this.equals(EMPTY);
    }
}
