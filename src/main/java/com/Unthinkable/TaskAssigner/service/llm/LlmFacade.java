package com.Unthinkable.TaskAssigner.service.llm;

import com.Unthinkable.TaskAssigner.service.gemini.GeminiClient;
import com.Unthinkable.TaskAssigner.service.openai.OpenAiClient;
import lombok.RequiredArgsConstructor;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

import java.time.LocalDate;

@Service
@RequiredArgsConstructor
public class LlmFacade implements LlmService {

    private final GeminiClient geminiClient;
    private final OpenAiClient openAiClient;

    @Value("${app.llm.provider:none}")
    private String provider;

    @Override
    public String analyzeSegment(String segmentText, LocalDate referenceDate) throws Exception {
        return switch (provider.toLowerCase()) {
            case "none" -> "";
            case "gemini" -> geminiClient.analyzeSegment(segmentText, referenceDate);
            case "openai" -> openAiClient.analyzeSegment(segmentText, referenceDate);
            default -> throw new IllegalStateException("Unknown LLM provider: " + provider + ". Use 'none', 'gemini' or 'openai'.");
        };
    }

    @Override
    public boolean isEnabled() {
        return !"none".equalsIgnoreCase(provider);
    }
}
