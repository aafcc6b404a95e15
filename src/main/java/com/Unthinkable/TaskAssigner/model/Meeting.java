package com.Unthinkable.TaskAssigner.model;

import jakarta.persistence.*;
import lombok.Data;
import lombok.NoArgsConstructor;
import lombok.AllArgsConstructor;
import java.time.LocalDate;
import java.time.LocalDateTime;

@Entity
@Table(name = "meetings")
@Data
@NoArgsConstructor
@AllArgsConstructor
public class Meeting {
    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Integer meetingId;

    @Column(nullable = false, length = 255)
    private String title;

    // anchor for relative deadlines ("tomorrow", "next week")
    @Column(nullable = false)
    private LocalDate referenceDate;

    @Column(length = 1024)
    private String audioFilePath;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false, length = 32)
    private MeetingStatus status = MeetingStatus.UPLOADED;

    private Integer tasksCount;

    private Long processingMillis;

    @Lob
    private String summaryText;

    // JSON map of memberId -> increment applied by the last run; reverted before a reprocess
    @Lob
    private String appliedWorkloadDeltas;

    @Column(length = 1024)
    private String failureReason;

    @Column(nullable = false)
    private LocalDateTime createdAt;

    private LocalDateTime processedAt;

    public enum MeetingStatus {
        UPLOADED, PROCESSING, COMPLETED, FAILED
    }

    @PrePersist
    public void prePersist() {
        if (this.createdAt == null) {
            this.createdAt = LocalDateTime.now();
        }
        if (this.status == null) {
            this.status = MeetingStatus.UPLOADED;
        }
        if (this.referenceDate == null) {
            this.referenceDate = this.createdAt.toLocalDate();
        }
    }
}
