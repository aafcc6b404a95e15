package com.Unthinkable.TaskAssigner.engine.model;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * Roster member as seen by the engine. Instances are snapshots; the current workload during a
 * run lives in {@link com.Unthinkable.TaskAssigner.engine.WorkloadLedger}.
 */
public record Person(String id, String name, String role, List<String> skills, double workload) {

    public Person {
        if (id == null || id.isBlank()) {
            throw new IllegalArgumentException("Person id is required");
        }
        name = name == null ? "" : name;
        role = role == null ? "" : role;
        skills = distinctSkills(skills);
        if (workload < 0) {
            throw new IllegalArgumentException("Workload must be non-negative for " + id);
        }
    }

    public boolean hasSkill(String skill) {
        if (skill == null) return false;
        String wanted = skill.toLowerCase(Locale.ROOT);
        return skills.stream().anyMatch(s -> s.toLowerCase(Locale.ROOT).equals(wanted));
    }

    private static List<String> distinctSkills(List<String> skills) {
        if (skills == null) {
            return List.of();
        }
        Map<String, String> byKey = new LinkedHashMap<>();
        for (String s : skills) {
            if (s != null && !s.isBlank()) {
                byKey.putIfAbsent(s.trim().toLowerCase(Locale.ROOT), s.trim());
            }
        }
        return List.copyOf(byKey.values());
    }

    public Person withWorkload(double newWorkload) {
        return new Person(id, name, role, skills, newWorkload);
    }
}
