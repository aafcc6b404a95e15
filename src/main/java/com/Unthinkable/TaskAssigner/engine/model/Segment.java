package com.Unthinkable.TaskAssigner.engine.model;

import java.util.List;

/**
 * One utterance or sentence of a transcript. Identity is the 0-based index.
 *
 * @param personNames PERSON spans reported by the segmentation service; empty when it found
 *                    none or was not consulted
 */
public record Segment(int index, String text, List<String> personNames) {

    public Segment {
        if (index < 0) {
            throw new IllegalArgumentException("Segment index must be non-negative: " + index);
        }
        text = text == null ? "" : text.trim();
        personNames = personNames == null ? List.of() : List.copyOf(personNames);
    }

    public Segment(int index, String text) {
        this(index, text, List.of());
    }
}
