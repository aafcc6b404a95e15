package com.Unthinkable.TaskAssigner.service.openai;

import com.Unthinkable.TaskAssigner.service.llm.AdvisoryPrompt;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.time.LocalDate;
import java.util.UUID;

@Component
public class OpenAiClient {

    private static final String CRLF = "\r\n";

    private final ObjectMapper objectMapper = new ObjectMapper();

    @Value("${app.openai.api-key:}")
    private String apiKey;

    @Value("${app.openai.chat.model:gpt-4o-mini}")
    private String chatModel;

    @Value("${app.openai.asr.model:whisper-1}")
    private String asrModel;

    @Value("${app.openai.asr.language:en}")
    private String language;

    @Value("${app.openai.timeout-seconds:30}")
    private long timeoutSeconds;

    private HttpClient client() {
        return HttpClient.newBuilder().connectTimeout(Duration.ofSeconds(30)).build();
    }

    public boolean isConfigured() {
        return apiKey != null && !apiKey.isBlank();
    }

    public String transcribe(Path audio) throws Exception {
        if (!isConfigured()) throw new IllegalStateException("OpenAI API key not configured");
        String boundary = "Boundary-" + UUID.randomUUID();
        ByteArrayOutputStream body = new ByteArrayOutputStream();
        writeField(body, boundary, "model", asrModel);
        writeField(body, boundary, "response_format", "json");
        writeField(body, boundary, "language", language);
        body.write(("--" + boundary + CRLF
                + "Content-Disposition: form-data; name=\"file\"; filename=\"" + audio.getFileName() + "\"" + CRLF
                + "Content-Type: application/octet-stream" + CRLF + CRLF).getBytes(StandardCharsets.UTF_8));
        body.write(Files.readAllBytes(audio));
        body.write((CRLF + "--" + boundary + "--" + CRLF).getBytes(StandardCharsets.UTF_8));

        HttpRequest request = HttpRequest.newBuilder()
                .uri(URI.create("https://api.openai.com/v1/audio/transcriptions"))
                .timeout(Duration.ofMinutes(2))
                .header("Authorization", "Bearer " + apiKey)
                .header("Content-Type", "multipart/form-data; boundary=" + boundary)
                .POST(HttpRequest.BodyPublishers.ofByteArray(body.toByteArray()))
                .build();
        HttpResponse<String> response = client().send(request, HttpResponse.BodyHandlers.ofString());
        if (response.statusCode() >= 300) {
            throw new IOException("OpenAI ASR failed: " + response.statusCode() + " - " + response.body());
        }
        JsonNode textNode = objectMapper.readTree(response.body()).get("text");
        if (textNode == null) {
            throw new IOException("OpenAI ASR returned no text");
        }
        return textNode.asText();
    }

    private static void writeField(ByteArrayOutputStream out, String boundary, String name, String value) throws IOException {
        out.write(("--" + boundary + CRLF
                + "Content-Disposition: form-data; name=\"" + name + "\"" + CRLF + CRLF
                + value + CRLF).getBytes(StandardCharsets.UTF_8));
    }

    public String analyzeSegment(String segmentText, LocalDate referenceDate) throws Exception {
        if (!isConfigured()) throw new IllegalStateException("OpenAI API key not configured");

        ObjectNode root = objectMapper.createObjectNode();
        root.put("model", chatModel);
        root.put("temperature", 0.0);
        root.put("max_tokens", 512);
        ArrayNode messages = root.putArray("messages");
        ObjectNode userMsg = messages.addObject();
        userMsg.put("role", "user");
        userMsg.put("content", AdvisoryPrompt.forSegment(segmentText, referenceDate));
        root.putObject("response_format").put("type", "json_object");

        HttpRequest request = HttpRequest.newBuilder()
                .uri(URI.create("https://api.openai.com/v1/chat/completions"))
                .timeout(Duration.ofSeconds(timeoutSeconds))
                .header("Authorization", "Bearer " + apiKey)
                .header("Content-Type", "application/json")
                .POST(HttpRequest.BodyPublishers.ofString(objectMapper.writeValueAsString(root)))
                .build();
        HttpResponse<String> response = client().send(request, HttpResponse.BodyHandlers.ofString());
        if (response.statusCode() >= 300) {
            throw new IOException("OpenAI Chat failed: " + response.statusCode() + " - " + response.body());
        }
        return objectMapper.readTree(response.body())
                .path("choices").path(0).path("message").path("content").asText("");
    }
}
