package com.Unthinkable.TaskAssigner.controller;

import com.Unthinkable.TaskAssigner.engine.EngineSettings;
import com.Unthinkable.TaskAssigner.service.MeetingTxService;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.core.env.Environment;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.LinkedHashMap;
import java.util.Map;

@RestController
@RequestMapping("/api/admin")
public class AdminConfigController {

    private final Environment env;
    private final EngineSettings engineSettings;
    private final MeetingTxService meetingTxService;

    public AdminConfigController(Environment env, EngineSettings engineSettings, MeetingTxService meetingTxService) {
        this.env = env;
        this.engineSettings = engineSettings;
        this.meetingTxService = meetingTxService;
    }

    @Value("${app.processing.async:false}")
    private boolean asyncProcessing;

    @GetMapping("/config")
    public Map<String, Object> config() {
        Map<String, Object> out = new LinkedHashMap<>();
        out.put("asyncProcessing", asyncProcessing);
        out.put("rabbitHost", env.getProperty("spring.rabbitmq.host", "localhost"));
        out.put("rabbitPort", env.getProperty("spring.rabbitmq.port", "5672"));
        out.put("queue", env.getProperty("app.rabbitmq.queue", "transcript.jobs"));
        out.put("llmProvider", env.getProperty("app.llm.provider", "none"));
        out.put("asrProvider", env.getProperty("app.asr.provider", "openai"));
        out.put("segmentation", env.getProperty("app.engine.segmentation", "newline"));
        out.put("workloadMode", engineSettings.workloadMode());
        out.put("scoringMode", engineSettings.scoringMode());
        out.put("matchMode", engineSettings.matchMode());
        out.put("workloadCapacity", engineSettings.workloadCapacity());
        // key presence only, never the key itself
        out.put("geminiConfigured", !env.getProperty("app.gemini.api-key", "").isBlank());
        out.put("openAiConfigured", !env.getProperty("app.openai.api-key", "").isBlank());
        return out;
    }

    @DeleteMapping("/reset")
    public ResponseEntity<Map<String, String>> reset() {
        meetingTxService.resetAll();
        return ResponseEntity.ok(Map.of("status", "reset"));
    }
}
