package com.Unthinkable.TaskAssigner.config;

import com.Unthinkable.TaskAssigner.engine.EngineSettings;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Clock;

@Slf4j
@Configuration
public class EngineConfig {

    @Value("${app.engine.workload-mode:integer_count}")
    private String workloadMode;

    @Value("${app.engine.scoring-mode:weighted_continuous}")
    private String scoringMode;

    @Value("${app.engine.match-mode:substring}")
    private String matchMode;

    @Value("${app.engine.description-max-length:300}")
    private int descriptionMaxLength;

    @Value("${app.engine.context-window:2}")
    private int contextWindow;

    @Value("${app.engine.context-max-length:500}")
    private int contextMaxLength;

    @Value("${app.engine.advisory-min-summary-length:10}")
    private int advisoryMinSummaryLength;

    @Value("${app.engine.workload-capacity:10}")
    private double workloadCapacity;

    @Bean
    public EngineSettings engineSettings() {
        EngineSettings settings = new EngineSettings(
                EngineSettings.WorkloadMode.fromProperty(workloadMode),
                EngineSettings.ScoringMode.fromProperty(scoringMode),
                EngineSettings.MatchMode.fromProperty(matchMode),
                descriptionMaxLength,
                contextWindow,
                contextMaxLength,
                advisoryMinSummaryLength,
                workloadCapacity);
        log.info("Engine settings: {}", settings);
        return settings;
    }

    @Bean
    public Clock clock() {
        return Clock.systemDefaultZone();
    }
}
