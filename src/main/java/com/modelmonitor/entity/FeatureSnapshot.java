package com.modelmonitor.entity;

import jakarta.persistence.*;
import lombok.*;
import org.hibernate.annotations.CreationTimestamp;

import java.time.Instant;
import java.util.UUID;

/**
 * Content-addressed, insert-only storage row behind the feature store.
 */
@Entity
@Table(
    name = "feature_snapshots",
    uniqueConstraints = {
        @UniqueConstraint(name = "uk_snapshot_model_version", columnNames = {"model_key", "version"}),
    }
)
@Getter
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class FeatureSnapshot {

    @Id
    @GeneratedValue(strategy = GenerationType.UUID)
    @Column(updatable = false, nullable = false)
    private UUID id;

    @Column(name = "model_key", nullable = false, length = 128, updatable = false)
    private String modelKey;

    @Column(nullable = false, length = 64, updatable = false)
    private String version;

    @Column(name = "content_hash", nullable = false, length = 64, updatable = false)
    private String contentHash;

    @Column(nullable = false, columnDefinition = "text", updatable = false)
    private String payload;

    @CreationTimestamp
    @Column(name = "created_at", updatable = false)
    private Instant createdAt;
}
