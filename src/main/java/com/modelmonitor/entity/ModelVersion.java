package com.modelmonitor.entity;

import jakarta.persistence.*;
import lombok.*;

import java.time.Instant;
import java.util.UUID;

/**
 * Immutable once created; only {@code status} moves between ACTIVE and ARCHIVED.
 */
@Entity
@Table(
    name = "model_versions",
    uniqueConstraints = {
        @UniqueConstraint(name = "uk_model_version", columnNames = {"model_key", "version"}),
    },
    indexes = {
        @Index(name = "idx_version_model", columnList = "model_key"),
    }
)
@Getter
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class ModelVersion {

    @Id
    @GeneratedValue(strategy = GenerationType.UUID)
    @Column(updatable = false, nullable = false)
    private UUID id;

    @Column(name = "model_key", nullable = false, length = 128, updatable = false)
    private String modelKey;

    @Column(nullable = false, length = 64, updatable = false)
    private String version;

    @Setter
    @Enumerated(EnumType.STRING)
    @Column(nullable = false, length = 16)
    private ModelStatus status;

    @Column(updatable = false)
    private Double accuracy;

    @Column(columnDefinition = "text", updatable = false)
    private String metrics;

    @Column(name = "training_metadata", columnDefinition = "text", updatable = false)
    private String trainingMetadata;

    @Column(name = "artifact_uri", length = 512, updatable = false)
    private String artifactUri;

    @Column(name = "created_at", updatable = false)
    private Instant createdAt;
}
