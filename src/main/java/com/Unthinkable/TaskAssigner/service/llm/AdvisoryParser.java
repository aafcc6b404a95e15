package com.Unthinkable.TaskAssigner.service.llm;

import com.Unthinkable.TaskAssigner.engine.model.AdvisorySuggestion;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Reads a model reply into an {@link AdvisorySuggestion}. Replies are often wrapped in prose or
 * markdown fences, so the outermost {@code {...}} block is parsed. Unknown keys are ignored and
 * wrongly typed values are treated as missing.
 */
@Slf4j
@Component
public class AdvisoryParser {

    private static final Pattern JSON_BLOCK = Pattern.compile("(?s)(\\{.*\\})");

    private final ObjectMapper mapper = new ObjectMapper();

    public Optional<AdvisorySuggestion> parse(String raw) {
        if (raw == null || raw.isBlank()) return Optional.empty();
        String stripped = raw.replaceAll("(?s)```json|```", "").trim();
        Matcher m = JSON_BLOCK.matcher(stripped);
        if (!m.find()) {
            log.debug("No JSON object in model reply");
            return Optional.empty();
        }
        JsonNode json;
        try {
            json = mapper.readTree(m.group(1));
        } catch (JsonProcessingException e) {
            log.debug("Unparseable model reply: {}", e.getOriginalMessage());
            return Optional.empty();
        }
        if (!json.isObject()) return Optional.empty();
        return Optional.of(new AdvisorySuggestion(
                text(json, "summary"),
                list(json, "persons"),
                list(json, "date_phrases"),
                text(json, "priority_hint"),
                list(json, "dependencies"),
                text(json, "context_notes")));
    }

    private static String text(JsonNode json, String key) {
        JsonNode node = json.path(key);
        return node.isTextual() ? node.asText() : "";
    }

    // a bare string is accepted as a one-element list
    private static List<String> list(JsonNode json, String key) {
        JsonNode node = json.path(key);
        List<String> out = new ArrayList<>();
        if (node.isTextual() && !node.asText().isBlank()) {
            out.add(node.asText().trim());
        } else if (node.isArray()) {
            for (JsonNode item : node) {
                if (item.isTextual() && !item.asText().isBlank()) {
                    out.add(item.asText().trim());
                }
            }
        }
        return out;
    }
}
