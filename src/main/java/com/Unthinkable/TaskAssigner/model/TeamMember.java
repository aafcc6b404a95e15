package com.Unthinkable.TaskAssigner.model;

import jakarta.persistence.*;
import lombok.Data;
import lombok.NoArgsConstructor;
import lombok.AllArgsConstructor;

import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.List;
import java.util.UUID;

@Entity
@Data
@Table(name = "team_members")
@NoArgsConstructor
@AllArgsConstructor
public class TeamMember {
    // caller-supplied ids ("m1") are kept, otherwise a UUID is generated
    @Id
    @Column(length = 64)
    private String memberId;

    @Column(nullable = false, unique = true, length = 255)
    private String name;

    @Column(nullable = false, length = 255)
    private String role;

    @Convert(converter = StringListConverter.class)
    @Column(nullable = false, length = 2048)
    private List<String> skills = new ArrayList<>();

    // task count, or a 0..1 load factor depending on app.engine.workload-mode
    @Column(nullable = false)
    private double workload;

    // roster order decides score ties
    @Column(nullable = false)
    private Integer rosterPosition;

    @Column(nullable = false)
    private LocalDateTime createdAt;

    @PrePersist
    public void prePersist() {
        if (this.memberId == null || this.memberId.isBlank()) {
            this.memberId = UUID.randomUUID().toString();
        }
        if (this.createdAt == null) {
            this.createdAt = LocalDateTime.now();
        }
        if (this.skills == null) {
            this.skills = new ArrayList<>();
        }
    }
}
