package com.modelmonitor.entity;

import jakarta.persistence.*;
import lombok.*;

import java.time.Instant;
import java.util.UUID;

@Entity
@Table(
    name = "client_datasets",
    uniqueConstraints = {
        @UniqueConstraint(name = "uk_dataset_model_version", columnNames = {"model_key", "dataset_version"}),
    },
    indexes = {
        @Index(name = "idx_dataset_model_status", columnList = "model_key, status"),
        @Index(name = "idx_dataset_job", columnList = "retraining_job_id"),
    }
)
@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class ClientDataset {

    @Id
    @GeneratedValue(strategy = GenerationType.UUID)
    @Column(updatable = false, nullable = false)
    private UUID id;

    @Column(name = "model_key", nullable = false, length = 128, updatable = false)
    private String modelKey;

    @Column(name = "dataset_version", nullable = false, updatable = false)
    private long datasetVersion;

    @Column(name = "item_count", nullable = false)
    private long itemCount;

    @Column(name = "confidence_threshold", nullable = false)
    private double confidenceThreshold;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false, length = 16)
    private DatasetStatus status;

    @Column(name = "retraining_job_id")
    private UUID retrainingJobId;

    @Column(name = "created_at", updatable = false)
    private Instant createdAt;
}
