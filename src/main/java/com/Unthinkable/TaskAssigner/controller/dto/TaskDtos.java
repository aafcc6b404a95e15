package com.Unthinkable.TaskAssigner.controller.dto;

import com.Unthinkable.TaskAssigner.engine.model.Priority;
import com.Unthinkable.TaskAssigner.model.ExtractedTask;
import com.Unthinkable.TaskAssigner.model.TaskAssignment;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.LocalDate;
import java.util.List;

public class TaskDtos {

    @Data
    @NoArgsConstructor
    @AllArgsConstructor
    public static class TaskView {
        private Integer taskId;
        private Integer position;
        private String description;
        private Priority priority;
        private LocalDate deadline;
        private List<Integer> dependencies;
        private String assigneeId;
        private String assignedTo;
        private String reason;
        private String method;
        private String detectedBy;
        private String context;

        public static TaskView of(ExtractedTask t, TaskAssignment current) {
            return new TaskView(t.getTaskId(), t.getPosition(), t.getDescription(), t.getPriority(),
                    t.getDeadline(), List.copyOf(t.getDependencies()),
                    current != null ? current.getMemberId() : null,
                    current != null ? current.getMemberName() : null,
                    current != null ? current.getReason() : null,
                    current != null ? current.getMethod() : null,
                    t.getDetectedBy(), t.getContextNotes());
        }
    }

    @Data
    @NoArgsConstructor
    @AllArgsConstructor
    public static class ReassignRequest {
        private String memberId;
        private String reason;
    }

    @Data
    @NoArgsConstructor
    @AllArgsConstructor
    public static class AssignmentView {
        private Integer assignmentId;
        private Integer taskId;
        private String memberId;
        private String memberName;
        private String reason;
        private String method;

        public static AssignmentView of(TaskAssignment a) {
            return new AssignmentView(a.getAssignmentId(), a.getTaskId(), a.getMemberId(), a.getMemberName(),
                    a.getReason(), a.getMethod());
        }
    }
}
