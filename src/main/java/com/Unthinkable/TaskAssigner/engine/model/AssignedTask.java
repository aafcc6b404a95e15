package com.Unthinkable.TaskAssigner.engine.model;

/**
 * A candidate extended with its assignee. The assignee is referenced by id and display name
 * only; the roster keeps ownership of the person.
 */
public record AssignedTask(
        CandidateTask candidate,
        String assigneeId,
        String assigneeName,
        String reasoning,
        AssignmentDecision decision
) {

    public AssignedTask {
        if (candidate == null) {
            throw new IllegalArgumentException("candidate is required");
        }
        reasoning = reasoning == null ? "" : reasoning;
        decision = decision == null ? AssignmentDecision.unassigned() : decision;
    }

    public boolean isAssigned() {
        return assigneeId != null;
    }
}
