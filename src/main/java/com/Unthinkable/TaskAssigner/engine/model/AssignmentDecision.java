package com.Unthinkable.TaskAssigner.engine.model;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Structured audit record of one assignment decision.
 *
 * @param method       the rule that fired
 * @param score        winning score, {@code null} for an explicit mention
 * @param matchedTerms skill tokens or categories that contributed to the score
 * @param matchedName  the literal mentioned name, explicit mentions only
 * @param memberScores score of every roster member keyed by person id, in roster order
 */
public record AssignmentDecision(
        Method method,
        Double score,
        List<String> matchedTerms,
        String matchedName,
        Map<String, Double> memberScores
) {

    public AssignmentDecision {
        matchedTerms = matchedTerms == null ? List.of() : List.copyOf(matchedTerms);
        memberScores = memberScores == null ? Map.of() : new LinkedHashMap<>(memberScores);
    }

    public static AssignmentDecision mention(String matchedName) {
        return new AssignmentDecision(Method.EXPLICIT_MENTION, null, List.of(), matchedName, Map.of());
    }

    public static AssignmentDecision unassigned() {
        return new AssignmentDecision(Method.UNASSIGNED, null, List.of(), null, Map.of());
    }

    public enum Method {
        EXPLICIT_MENTION, SKILL_SCORING, LOWEST_WORKLOAD, UNASSIGNED
    }
}
