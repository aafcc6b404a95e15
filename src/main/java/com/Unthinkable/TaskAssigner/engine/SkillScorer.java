package com.Unthinkable.TaskAssigner.engine;

import com.Unthinkable.TaskAssigner.engine.EngineSettings.ScoringMode;
import com.Unthinkable.TaskAssigner.engine.EngineSettings.WorkloadMode;
import com.Unthinkable.TaskAssigner.engine.model.Person;
import com.Unthinkable.TaskAssigner.engine.model.Priority;
import com.Unthinkable.TaskAssigner.engine.model.ScoreBreakdown;
import org.springframework.stereotype.Component;

import java.time.LocalDate;
import java.util.ArrayList;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * Affinity between a person and a task's text. Pure function of its arguments and the
 * settings; the weights are fixed.
 *
 * <p>{@link ScoringMode#WEIGHTED_CONTINUOUS}:
 * {@code 0.6*skill_match + 0.25*role_fit + 0.15*availability + priority_boost + urgency_boost}.
 *
 * <p>{@link ScoringMode#CATEGORY_DISCRETE}: {@code +2} for every skill category the person holds
 * whose keywords appear in the text, minus {@code 0.5 * workload}.
 */
@Component
public class SkillScorer {

    static final double SKILL_WEIGHT = 0.6;
    static final double ROLE_WEIGHT = 0.25;
    static final double AVAILABILITY_WEIGHT = 0.15;
    static final double URGENCY_WEIGHT = 0.05;
    static final double CATEGORY_HIT = 2.0;
    static final double WORKLOAD_PENALTY = 0.5;

    private static final Map<Priority, Double> PRIORITY_BOOST = new EnumMap<>(Map.of(
            Priority.CRITICAL, 0.12,
            Priority.HIGH, 0.07,
            Priority.MEDIUM, 0.0,
            Priority.LOW, 0.0));

    static final Map<String, List<String>> SKILL_CATEGORIES = new LinkedHashMap<>();

    static {
        SKILL_CATEGORIES.put("frontend", List.of("ui", "interface", "design", "frontend", "react", "vue", "css", "html"));
        SKILL_CATEGORIES.put("backend", List.of("api", "database", "server", "backend", "python", "java", "node"));
        SKILL_CATEGORIES.put("devops", List.of("deploy", "deployment", "ci/cd", "docker", "kubernetes", "aws", "cloud"));
        SKILL_CATEGORIES.put("testing", List.of("test", "qa", "quality", "bug", "testing", "automation"));
        SKILL_CATEGORIES.put("documentation", List.of("document", "documentation", "wiki", "guide", "readme"));
        SKILL_CATEGORIES.put("data", List.of("data", "analytics", "ml", "machine learning", "model", "dataset"));
        SKILL_CATEGORIES.put("management", List.of("schedule", "coordinate", "organize", "meeting", "plan"));
    }

    private final EngineSettings settings;
    private final DeadlineExtractor deadlineExtractor;

    public SkillScorer(EngineSettings settings, DeadlineExtractor deadlineExtractor) {
        this.settings = settings;
        this.deadlineExtractor = deadlineExtractor;
    }

    public ScoreBreakdown score(Person person, String taskText, Priority priority, LocalDate deadline) {
        return score(person, taskText, priority, deadline, settings.workloadMode());
    }

    public ScoreBreakdown score(Person person, String taskText, Priority priority, LocalDate deadline,
                                WorkloadMode workloadMode) {
        String text = taskText == null ? "" : taskText.toLowerCase(Locale.ROOT);
        if (settings.scoringMode() == ScoringMode.CATEGORY_DISCRETE) {
            return categoryScore(person, text);
        }
        return weightedScore(person, text, priority, deadline, workloadMode);
    }

    /** Workload mapped to [0,1] whatever the workload mode. */
    public double normalizedWorkload(Person person, WorkloadMode workloadMode) {
        double raw = person.workload();
        double normalized = workloadMode == WorkloadMode.NORMALIZED_LOAD
                ? raw
                : raw / settings.workloadCapacity();
        return Math.max(0.0, Math.min(1.0, normalized));
    }

    private ScoreBreakdown weightedScore(Person person, String text, Priority priority, LocalDate deadline,
                                         WorkloadMode workloadMode) {
        List<String> matched = new ArrayList<>();
        for (String skill : person.skills()) {
            String token = skill.toLowerCase(Locale.ROOT).trim();
            if (!token.isEmpty() && text.contains(token)) {
                matched.add(skill);
            }
        }
        double skillMatch = person.skills().isEmpty() ? 0.0 : (double) matched.size() / Math.max(1, person.skills().size());
        String role = person.role().toLowerCase(Locale.ROOT).trim();
        double roleFit = !role.isEmpty() && text.contains(role) ? 1.0 : 0.0;
        double availability = 1.0 - normalizedWorkload(person, workloadMode);

        double base = SKILL_WEIGHT * skillMatch + ROLE_WEIGHT * roleFit + AVAILABILITY_WEIGHT * availability;
        double priorityBoost = priority == null ? 0.0 : PRIORITY_BOOST.get(priority);
        double urgencyBoost = deadlineExtractor.isUrgent(deadline) ? URGENCY_WEIGHT * availability : 0.0;
        if (roleFit > 0) {
            matched.add("role:" + person.role());
        }
        return new ScoreBreakdown(person.id(), base + priorityBoost + urgencyBoost, matched,
                skillMatch, roleFit, availability, priorityBoost, urgencyBoost, 0.0);
    }

    private ScoreBreakdown categoryScore(Person person, String text) {
        double hits = 0.0;
        List<String> matched = new ArrayList<>();
        for (Map.Entry<String, List<String>> category : SKILL_CATEGORIES.entrySet()) {
            if (!person.hasSkill(category.getKey())) {
                continue;
            }
            for (String keyword : category.getValue()) {
                if (text.contains(keyword)) {
                    hits += CATEGORY_HIT;
                    matched.add(category.getKey());
                    break;
                }
            }
        }
        double penalty = WORKLOAD_PENALTY * person.workload();
        return new ScoreBreakdown(person.id(), hits - penalty, matched, 0.0, 0.0, 0.0, 0.0, 0.0, penalty);
    }
}
