package com.Unthinkable.TaskAssigner.service.asr;

import com.Unthinkable.TaskAssigner.service.gemini.GeminiClient;
import com.Unthinkable.TaskAssigner.service.openai.OpenAiClient;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

import java.nio.file.Path;

/**
 * Picks the speech-to-text backend from {@code app.asr.provider}. Without a provider, uploads
 * are rejected with 503 by the exception handler.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class AsrFacade implements AsrService {

    private final OpenAiClient openAiClient;
    private final GeminiClient geminiClient;

    @Value("${app.asr.provider:openai}")
    private String provider;

    @Override
    public String transcribe(Path audioFile) throws Exception {
        log.info("Transcribing {} with {}", audioFile.getFileName(), provider);
        return switch (provider.toLowerCase()) {
            case "openai" -> openAiClient.transcribe(audioFile);
            case "gemini" -> geminiClient.transcribe(audioFile);
            case "none" -> throw new IllegalStateException("Speech-to-text is disabled (app.asr.provider=none)");
            default -> throw new IllegalStateException("Unknown ASR provider: " + provider + ". Use 'openai', 'gemini' or 'none'.");
        };
    }
}
