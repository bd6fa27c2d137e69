package com.modelmonitor.entity;

import jakarta.persistence.*;
import lombok.*;

import java.time.Instant;

/**
 * A deployed model. {@code activeVersion} is the only cross-cutting mutable pointer and is
 * changed through conditional updates in {@code ManagedModelRepository}, never by setters.
 */
@Entity
@Table(
    name = "models",
    indexes = {
        @Index(name = "idx_models_status", columnList = "status"),
    }
)
@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class ManagedModel {

    @Id
    @Column(name = "model_key", length = 128, updatable = false, nullable = false)
    private String modelKey;

    @Setter(AccessLevel.NONE)
    @Column(name = "active_version", nullable = false, length = 64)
    private String activeVersion;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false, length = 16)
    private ModelStatus status;

    private Double accuracy;

    @Column(name = "last_trained")
    private Instant lastTrained;

    @Column(name = "task_type", length = 32)
    private String taskType;

    @Column(name = "target_field", length = 128)
    private String targetField;

    @Column(name = "created_at", updatable = false)
    private Instant createdAt;

    @Column(name = "updated_at")
    private Instant updatedAt;
}
