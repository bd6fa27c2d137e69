package com.modelmonitor.entity;

import jakarta.persistence.*;
import lombok.*;

import java.time.Instant;
import java.util.UUID;

@Entity
@Table(
    name = "prediction_logs",
    indexes = {
        @Index(name = "idx_pred_model_version_created", columnList = "model_key, model_version, created_at"),
        @Index(name = "idx_pred_created", columnList = "created_at"),
    }
)
@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class PredictionLog {

    @Id
    @GeneratedValue(strategy = GenerationType.UUID)
    @Column(updatable = false, nullable = false)
    private UUID id;

    @Column(name = "model_key", nullable = false, length = 128)
    private String modelKey;

    @Column(name = "model_version", nullable = false, length = 64)
    private String modelVersion;

    /** Input feature vector as a JSON object of feature name to numeric value. */
    @Column(columnDefinition = "text")
    private String features;

    @Column(name = "predicted_class", length = 128)
    private String predictedClass;

    private Double confidence;

    @Column(name = "created_at", nullable = false, updatable = false)
    private Instant createdAt;
}
