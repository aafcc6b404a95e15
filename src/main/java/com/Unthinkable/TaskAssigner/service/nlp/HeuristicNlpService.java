package com.Unthinkable.TaskAssigner.service.nlp;

import org.springframework.stereotype.Service;

import java.text.BreakIterator;
import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Sentence splitting through {@link BreakIterator}; person names are capitalized words that are
 * not calendar words. A word opening a sentence only counts when a comma follows it, as in
 * "Bob, fix the login".
 */
@Service
public class HeuristicNlpService implements NlpService {

    private static final Pattern WORD = Pattern.compile("\\b([A-Z][a-z]{1,30})\\b");

    private static final Set<String> NOT_NAMES = Set.of(
            "monday", "tuesday", "wednesday", "thursday", "friday", "saturday", "sunday",
            "january", "february", "march", "april", "may", "june", "july", "august",
            "september", "october", "november", "december",
            "please", "thanks", "okay", "yes", "no", "also", "then", "and", "but", "the");

    @Override
    public List<String> segmentSentences(String text) {
        List<String> out = new ArrayList<>();
        if (text == null || text.isBlank()) return out;
        BreakIterator it = BreakIterator.getSentenceInstance(Locale.ENGLISH);
        it.setText(text);
        int start = it.first();
        for (int end = it.next(); end != BreakIterator.DONE; start = end, end = it.next()) {
            String sentence = text.substring(start, end).trim();
            if (!sentence.isEmpty()) {
                out.add(sentence);
            }
        }
        return out;
    }

    @Override
    public List<String> personNames(String text) {
        Set<String> names = new LinkedHashSet<>();
        if (text == null || text.isBlank()) return new ArrayList<>();
        for (String sentence : segmentSentences(text)) {
            Matcher m = WORD.matcher(sentence);
            while (m.find()) {
                if (isSentenceStart(sentence, m.start()) && !isAddressee(sentence, m.end())) continue;
                String word = m.group(1);
                if (!NOT_NAMES.contains(word.toLowerCase(Locale.ROOT))) {
                    names.add(word);
                }
            }
        }
        return new ArrayList<>(names);
    }

    private static boolean isAddressee(String sentence, int wordEnd) {
        return wordEnd < sentence.length() && sentence.charAt(wordEnd) == ',';
    }

    private static boolean isSentenceStart(String sentence, int offset) {
        for (int i = 0; i < offset; i++) {
            if (Character.isLetterOrDigit(sentence.charAt(i))) return false;
        }
        return true;
    }
}
