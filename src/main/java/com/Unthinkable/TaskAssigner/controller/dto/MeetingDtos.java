package com.Unthinkable.TaskAssigner.controller.dto;

import com.Unthinkable.TaskAssigner.model.Meeting;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.LocalDate;
import java.time.LocalDateTime;
import java.util.List;

public class MeetingDtos {

    @Data
    @NoArgsConstructor
    @AllArgsConstructor
    public static class TranscriptRequest {
        private String title;
        private String transcript;
        private LocalDate referenceDate; // defaults to today
    }

    @Data
    @NoArgsConstructor
    @AllArgsConstructor
    public static class ProcessResponse {
        private Integer meetingId;
        private Meeting.MeetingStatus status;
        private Integer totalTasks;
        private String summary;
    }

    @Data
    @NoArgsConstructor
    @AllArgsConstructor
    public static class ListItem {
        private Integer meetingId;
        private String title;
        private Meeting.MeetingStatus status;
        private Integer tasksCount;
        private LocalDateTime createdAt;
    }

    @Data
    @NoArgsConstructor
    @AllArgsConstructor
    public static class Detail {
        private Integer meetingId;
        private String title;
        private Meeting.MeetingStatus status;
        private LocalDate referenceDate;
        private LocalDateTime createdAt;
        private LocalDateTime processedAt;
        private String transcriptText;
        private String summaryText;
        private String failureReason;
        private List<TaskDtos.TaskView> tasks;
    }
}
