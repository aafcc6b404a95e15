package com.Unthinkable.TaskAssigner.engine;

import java.util.Locale;

/**
 * Tunables of the decision engine. Built from {@code app.engine.*} properties by
 * {@link com.Unthinkable.TaskAssigner.config.EngineConfig}.
 */
public record EngineSettings(
        WorkloadMode workloadMode,
        ScoringMode scoringMode,
        MatchMode matchMode,
        int descriptionMaxLength,
        int contextWindow,
        int contextMaxLength,
        int advisoryMinSummaryLength,
        double workloadCapacity
) {

    public EngineSettings {
        if (workloadMode == null || scoringMode == null || matchMode == null) {
            throw new IllegalArgumentException("workloadMode, scoringMode and matchMode are required");
        }
        if (descriptionMaxLength < 4) {
            throw new IllegalArgumentException("descriptionMaxLength must be at least 4");
        }
        if (workloadCapacity <= 0) {
            throw new IllegalArgumentException("workloadCapacity must be positive");
        }
    }

    public static EngineSettings defaults() {
        return new EngineSettings(WorkloadMode.INTEGER_COUNT, ScoringMode.WEIGHTED_CONTINUOUS, MatchMode.SUBSTRING,
                300, 2, 500, 10, 10.0);
    }

    public EngineSettings withScoringMode(ScoringMode mode) {
        return new EngineSettings(workloadMode, mode, matchMode, descriptionMaxLength, contextWindow,
                contextMaxLength, advisoryMinSummaryLength, workloadCapacity);
    }

    public EngineSettings withWorkloadMode(WorkloadMode mode) {
        return new EngineSettings(mode, scoringMode, matchMode, descriptionMaxLength, contextWindow,
                contextMaxLength, advisoryMinSummaryLength, workloadCapacity);
    }

    public EngineSettings withMatchMode(MatchMode mode) {
        return new EngineSettings(workloadMode, scoringMode, mode, descriptionMaxLength, contextWindow,
                contextMaxLength, advisoryMinSummaryLength, workloadCapacity);
    }

    public enum WorkloadMode {
        /** Workload counts assigned tasks and is incremented by the engine. */
        INTEGER_COUNT,
        /** Workload is a caller-supplied load factor in [0,1]; the engine never changes it. */
        NORMALIZED_LOAD;

        public static WorkloadMode fromProperty(String value) {
            return WorkloadMode.valueOf(normalize(value));
        }
    }

    public enum ScoringMode {
        WEIGHTED_CONTINUOUS,
        CATEGORY_DISCRETE;

        public static ScoringMode fromProperty(String value) {
            return ScoringMode.valueOf(normalize(value));
        }
    }

    public enum MatchMode {
        EXACT_NAME,
        SUBSTRING;

        public static MatchMode fromProperty(String value) {
            return MatchMode.valueOf(normalize(value));
        }
    }

    private static String normalize(String value) {
        if (value == null) {
            throw new IllegalArgumentException("Missing engine mode value");
        }
        return value.trim().replace('-', '_').toUpperCase(Locale.ROOT);
    }
}
