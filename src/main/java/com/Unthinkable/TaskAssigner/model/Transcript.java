package com.Unthinkable.TaskAssigner.model;

import jakarta.persistence.*;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;

import java.time.LocalDateTime;

/**
 * Raw text a meeting was processed from. One row per meeting; reprocessing reuses it.
 */
@Entity
@Getter
@Setter
@NoArgsConstructor
@Table(name = "meeting_transcripts")
public class Transcript {

    public enum Source { TEXT, AUDIO, MOCK }

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Integer transcriptId;

    @Column(nullable = false, unique = true)
    private Integer meetingId;

    @Lob
    @Column(name = "body", nullable = false)
    private String transcriptText;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false, length = 8)
    private Source source;

    // filled once segmentation has run
    private Integer segmentCount;

    @Column(nullable = false)
    private LocalDateTime createdAt;

    @PrePersist
    void onCreate() {
        if (createdAt == null) createdAt = LocalDateTime.now();
    }
}
