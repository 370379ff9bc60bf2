package com.yerin.syncwatch.domain;

import jakarta.persistence.*;
import lombok.*;
import org.hibernate.annotations.DynamicUpdate;

import java.time.Instant;

@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
@Builder
@Entity
@Table(name = "tracked_record", uniqueConstraints = {
        @UniqueConstraint(name = "uk_tracked_entity", columnNames = {"entity_type", "external_id"})
})
@DynamicUpdate
public class TrackedRecord {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(name="entity_type", nullable=false, length=50)
    private String entityType;

    @Column(name="external_id", nullable=false, length=200)
    private String externalId;

    @Column(nullable=false, length=50)
    private String source;

    @Column(nullable=false, length=64)
    private String fingerprint;

    @Column(name="fields_json", nullable=false, columnDefinition = "text")
    private String fieldsJson;

    @Column(name="first_seen_at", nullable=false)
    private Instant firstSeenAt;

    @Column(name="updated_at", nullable=false)
    private Instant updatedAt;

    @PrePersist
    void prePersist() {
        Instant now = Instant.now();
        if (firstSeenAt == null) firstSeenAt = now;
        if (updatedAt == null) updatedAt = now;
    }

    @PreUpdate
    void preUpdate() { updatedAt = Instant.now(); }
}
