package com.Unthinkable.TaskAssigner.engine.model;

import java.util.List;

/**
 * Feature values behind one person's score for one task. Components that do not apply to the
 * active scoring mode are zero.
 */
public record ScoreBreakdown(
        String personId,
        double total,
        List<String> matchedTerms,
        double skillMatch,
        double roleFit,
        double availability,
        double priorityBoost,
        double urgencyBoost,
        double workloadPenalty
) {

    public ScoreBreakdown {
        matchedTerms = matchedTerms == null ? List.of() : List.copyOf(matchedTerms);
    }
}
