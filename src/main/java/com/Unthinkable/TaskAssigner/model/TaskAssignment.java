package com.Unthinkable.TaskAssigner.model;

import jakarta.persistence.*;
import lombok.Data;
import lombok.ToString;
import lombok.NoArgsConstructor;
import lombok.AllArgsConstructor;

import java.time.LocalDateTime;

/**
 * One assignment decision for a task. Manual reassignments add rows; the newest row is the
 * current assignment.
 */
@Entity
@Data
@ToString(exclude = {"advisorySuggestion", "finalDecision"})
@Table(name = "assignments")
@NoArgsConstructor
@AllArgsConstructor
public class TaskAssignment {
    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Integer assignmentId;

    @Column(nullable = false)
    private Integer taskId;

    @Column(length = 64)
    private String memberId;

    @Column(length = 255)
    private String memberName;

    @Column(nullable = false, length = 1024)
    private String reason;

    @Column(nullable = false, length = 32)
    private String method;

    @Lob
    private String advisorySuggestion;

    @Lob
    private String finalDecision;

    @Column(nullable = false)
    private LocalDateTime createdAt;

    @PrePersist
    public void prePersist() {
        if (this.createdAt == null) {
            this.createdAt = LocalDateTime.now();
        }
    }
}
