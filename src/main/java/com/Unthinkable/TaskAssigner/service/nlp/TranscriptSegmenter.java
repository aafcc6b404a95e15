package com.Unthinkable.TaskAssigner.service.nlp;

import com.Unthinkable.TaskAssigner.engine.model.Segment;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;

/**
 * Turns raw transcript text into indexed segments. {@code newline} keeps one utterance per
 * line, {@code sentence} splits on sentence boundaries. Blank pieces are dropped and indexes
 * stay contiguous.
 */
@Slf4j
@Component
public class TranscriptSegmenter {

    private final NlpService nlpService;
    private final String strategy;

    public TranscriptSegmenter(NlpService nlpService,
                               @Value("${app.engine.segmentation:newline}") String strategy) {
        this.nlpService = nlpService;
        this.strategy = strategy == null ? "newline" : strategy.trim().toLowerCase(Locale.ROOT);
        if (!this.strategy.equals("newline") && !this.strategy.equals("sentence")) {
            throw new IllegalStateException("Unknown segmentation strategy: " + strategy + ". Use 'newline' or 'sentence'.");
        }
    }

    public List<Segment> segment(String transcript) {
        List<String> pieces = new ArrayList<>();
        if (transcript != null) {
            if (strategy.equals("sentence")) {
                pieces.addAll(nlpService.segmentSentences(transcript));
            } else {
                for (String line : transcript.split("\\R")) {
                    if (!line.isBlank()) pieces.add(line.trim());
                }
            }
        }
        List<Segment> segments = new ArrayList<>(pieces.size());
        for (String piece : pieces) {
            segments.add(new Segment(segments.size(), piece, nlpService.personNames(piece)));
        }
        log.debug("Segmented transcript into {} {} segment(s)", segments.size(), strategy);
        return segments;
    }
}
