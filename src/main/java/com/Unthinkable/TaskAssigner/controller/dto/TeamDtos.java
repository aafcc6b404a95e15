package com.Unthinkable.TaskAssigner.controller.dto;

import com.Unthinkable.TaskAssigner.model.TeamMember;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.ArrayList;
import java.util.List;

public class TeamDtos {

    @Data
    @NoArgsConstructor
    @AllArgsConstructor
    public static class MemberRequest {
        private String id; // optional; generated when absent
        private String name;
        private String role;
        private List<String> skills = new ArrayList<>();
        private Double workload;
    }

    @Data
    @NoArgsConstructor
    @AllArgsConstructor
    public static class MemberView {
        private String id;
        private String name;
        private String role;
        private List<String> skills;
        private double workload;

        public static MemberView of(TeamMember m) {
            return new MemberView(m.getMemberId(), m.getName(), m.getRole(), List.copyOf(m.getSkills()), m.getWorkload());
        }
    }
}
