package com.yerin.syncwatch.domain;

import jakarta.persistence.*;
import lombok.*;

import java.time.Instant;

@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
@Builder
@Entity
@Table(name = "data_change_log")
public class DataChangeLog {
    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(name="entity_type", nullable=false, length=50)
    private String entityType;

    @Column(name="entity_id", nullable=false, length=200)
    private String entityId;

    @Column(name="change_type", nullable=false, length=30)
    private String changeType;

    @Column(name="field_changes", columnDefinition = "text")
    private String fieldChanges;

    @Column(name="old_values", columnDefinition = "text")
    private String oldValues;

    @Column(nullable=false, length=50)
    private String source;

    @Column(name="ts", nullable=false)
    private Instant ts;

    @PrePersist void pre() { if (ts == null) ts = Instant.now(); }
}
