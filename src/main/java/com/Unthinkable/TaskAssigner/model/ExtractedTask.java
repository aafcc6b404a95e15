package com.Unthinkable.TaskAssigner.model;

import com.Unthinkable.TaskAssigner.engine.model.Priority;
import jakarta.persistence.*;
import lombok.Data;
import lombok.NoArgsConstructor;
import lombok.AllArgsConstructor;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.List;

@Entity
@Table(name = "tasks")
@Data
@NoArgsConstructor
@AllArgsConstructor
public class ExtractedTask {
    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Integer taskId;

    @Column(nullable = false)
    private Integer meetingId;

    // position within the meeting's task list; dependencies refer to these
    @Column(nullable = false)
    private Integer position;

    @Column(nullable = false)
    private Integer sourceSegmentIndex;

    @Column(nullable = false, length = 2048)
    private String rawText;

    @Column(nullable = false, length = 1024)
    private String description;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false, length = 16)
    private Priority priority = Priority.MEDIUM;

    private LocalDate deadline;

    @Convert(converter = IntegerListConverter.class)
    @Column(nullable = false, length = 512)
    private List<Integer> dependencies = new ArrayList<>();

    @Column(length = 1024)
    private String contextNotes;

    @Column(nullable = false, length = 32)
    private String detectedBy;

    @Column(nullable = false)
    private LocalDateTime createdAt;

    @PrePersist
    public void prePersist() {
        if (this.createdAt == null) {
            this.createdAt = LocalDateTime.now();
        }
        if (this.priority == null) {
            this.priority = Priority.MEDIUM;
        }
    }
}
