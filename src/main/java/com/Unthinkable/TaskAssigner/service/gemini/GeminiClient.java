package com.Unthinkable.TaskAssigner.service.gemini;

import com.Unthinkable.TaskAssigner.service.llm.AdvisoryPrompt;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.time.LocalDate;
import java.util.Base64;
import java.util.Locale;

@Component
public class GeminiClient {

    private final ObjectMapper mapper = new ObjectMapper();

    @Value("${app.gemini.api-key:}")
    private String apiKey;

    @Value("${app.gemini.model:gemini-2.0-flash}")
    private String model;

    @Value("${app.gemini.timeout-seconds:30}")
    private long timeoutSeconds;

    public boolean isConfigured() {
        return apiKey != null && !apiKey.isBlank();
    }

    public String transcribe(Path audioPath) throws Exception {
        if (!isConfigured()) throw new IllegalStateException("Gemini API key not configured");
        String b64 = Base64.getEncoder().encodeToString(Files.readAllBytes(audioPath));

        ObjectNode root = mapper.createObjectNode();
        ArrayNode parts = userParts(root);
        parts.add(mapper.createObjectNode().put("text", "Transcribe this meeting audio. Put each utterance on its own line. Return only the transcript text."));
        ObjectNode inline = mapper.createObjectNode();
        inline.put("mime_type", guessMime(audioPath.getFileName().toString()));
        inline.put("data", b64);
        parts.add(mapper.createObjectNode().set("inline_data", inline));
        return generate(root, Duration.ofSeconds(120), "Gemini ASR");
    }

    public String analyzeSegment(String segmentText, LocalDate referenceDate) throws Exception {
        if (!isConfigured()) throw new IllegalStateException("Gemini API key not configured");
        ObjectNode root = mapper.createObjectNode();
        userParts(root).add(mapper.createObjectNode().put("text", AdvisoryPrompt.forSegment(segmentText, referenceDate)));
        // deterministic replies; the engine only treats them as hints anyway
        ObjectNode config = root.putObject("generationConfig");
        config.put("temperature", 0.0);
        config.put("maxOutputTokens", 512);
        config.put("responseMimeType", "application/json");
        return generate(root, Duration.ofSeconds(timeoutSeconds), "Gemini advisory");
    }

    private ArrayNode userParts(ObjectNode root) {
        ObjectNode user = root.putArray("contents").addObject();
        user.put("role", "user");
        return user.putArray("parts");
    }

    private String generate(ObjectNode root, Duration timeout, String what) throws Exception {
        String url = "https://generativelanguage.googleapis.com/v1beta/models/" + model + ":generateContent?key=" + apiKey;
        HttpRequest req = HttpRequest.newBuilder()
                .uri(URI.create(url))
                .timeout(timeout)
                .header("Content-Type", "application/json")
                .POST(HttpRequest.BodyPublishers.ofString(mapper.writeValueAsString(root)))
                .build();
        HttpResponse<String> resp = HttpClient.newHttpClient().send(req, HttpResponse.BodyHandlers.ofString());
        if (resp.statusCode() >= 300) {
            throw new IllegalStateException(what + " failed: " + resp.statusCode() + " - " + resp.body());
        }
        return mapper.readTree(resp.body())
                .path("candidates").path(0).path("content").path("parts").path(0).path("text").asText("");
    }

    private String guessMime(String filename) {
        String lower = filename.toLowerCase(Locale.ROOT);
        if (lower.endsWith(".wav")) return "audio/wav";
        if (lower.endsWith(".mp3")) return "audio/mpeg";
        if (lower.endsWith(".m4a")) return "audio/mp4";
        return "application/octet-stream";
    }
}
