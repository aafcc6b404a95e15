package com.Unthinkable.TaskAssigner.engine.model;

import java.time.Duration;
import java.util.Collections;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * Aggregate view of one pipeline run.
 */
public record RunSummary(
        int totalTasks,
        Map<Priority, Integer> countsByPriority,
        Map<String, Integer> countsByAssignee,
        Duration processingTime,
        String message
) {

    public static final String UNASSIGNED = "Unassigned";
    public static final String NO_TASKS_MESSAGE = "No tasks extracted from meeting";

    public RunSummary {
        Map<Priority, Integer> priorities = new EnumMap<>(Priority.class);
        if (countsByPriority != null) {
            priorities.putAll(countsByPriority);
        }
        countsByPriority = Collections.unmodifiableMap(priorities);
        countsByAssignee = Collections.unmodifiableMap(new LinkedHashMap<>(countsByAssignee == null ? Map.of() : countsByAssignee));
        processingTime = processingTime == null ? Duration.ZERO : processingTime;
    }

    public static RunSummary of(List<FinalTask> tasks, Duration processingTime) {
        Map<Priority, Integer> byPriority = new EnumMap<>(Priority.class);
        Map<String, Integer> byAssignee = new LinkedHashMap<>();
        for (FinalTask t : tasks) {
            byPriority.merge(t.priority(), 1, Integer::sum);
            String who = t.assigneeName() == null ? UNASSIGNED : t.assigneeName();
            byAssignee.merge(who, 1, Integer::sum);
        }
        String message = tasks.isEmpty() ? NO_TASKS_MESSAGE : "Extracted " + tasks.size() + " task(s)";
        return new RunSummary(tasks.size(), byPriority, byAssignee, processingTime, message);
    }

    public String render() {
        StringBuilder sb = new StringBuilder();
        sb.append(String.format(Locale.ROOT, "Processing Time: %.2f seconds%n%n", processingTime.toMillis() / 1000.0));
        if (totalTasks == 0) {
            return sb.append(message).toString();
        }
        sb.append("Total Tasks Identified: ").append(totalTasks).append("\n\n");
        sb.append("Priority Breakdown:\n");
        countsByPriority.forEach((p, n) -> sb.append("  - ").append(p.label()).append(": ").append(n).append('\n'));
        sb.append("\nAssignment Breakdown:\n");
        countsByAssignee.forEach((who, n) -> sb.append("  - ").append(who).append(": ").append(n).append(" task(s)\n"));
        return sb.toString();
    }
}
