package com.Unthinkable.TaskAssigner.service.nlp;

import java.util.List;

public interface NlpService {
    List<String> segmentSentences(String text);

    /** PERSON-like spans in order of appearance, without duplicates. */
    List<String> personNames(String text);
}
