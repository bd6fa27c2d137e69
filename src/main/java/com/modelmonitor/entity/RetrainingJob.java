package com.modelmonitor.entity;

import jakarta.persistence.*;
import lombok.*;

import java.time.Instant;
import java.util.UUID;

@Entity
@Table(
    name = "retraining_jobs",
    indexes = {
        @Index(name = "idx_job_model_status", columnList = "model_key, status"),
        @Index(name = "idx_job_started", columnList = "started_at"),
    }
)
@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class RetrainingJob {

    @Id
    @GeneratedValue(strategy = GenerationType.UUID)
    @Column(updatable = false, nullable = false)
    private UUID id;

    @Column(name = "model_key", nullable = false, length = 128, updatable = false)
    private String modelKey;

    @Column(name = "source_model_version", nullable = false, length = 64, updatable = false)
    private String sourceModelVersion;

    @Column(name = "new_model_version", length = 64)
    private String newModelVersion;

    @Enumerated(EnumType.STRING)
    @Column(name = "trigger_source", nullable = false, length = 16, updatable = false)
    private RetrainingTrigger trigger;

    @Column(name = "requested_by", length = 128, updatable = false)
    private String requestedBy;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false, length = 32)
    private RetrainingStatus status;

    @Column(name = "old_metrics", columnDefinition = "text")
    private String oldMetrics;

    @Column(name = "new_metrics", columnDefinition = "text")
    private String newMetrics;

    @Column(name = "accuracy_delta")
    private Double accuracyDelta;

    @Column(name = "dataset_items")
    private Long datasetItems;

    @Column(name = "error_message", length = 1000)
    private String errorMessage;

    @Column(name = "created_at", updatable = false)
    private Instant createdAt;

    @Column(name = "started_at")
    private Instant startedAt;

    @Column(name = "completed_at")
    private Instant completedAt;

    @Column(name = "reverted_at")
    private Instant revertedAt;

    @Column(name = "reverted_by", length = 128)
    private String revertedBy;

    @Column(name = "revert_reason", length = 255)
    private String revertReason;
}
