package com.modelmonitor.entity;

import jakarta.persistence.*;
import lombok.*;
import org.hibernate.annotations.CreationTimestamp;

import java.time.Instant;
import java.time.LocalDate;
import java.util.UUID;

/**
 * One row per model per day, written once and never updated.
 */
@Entity
@Table(
    name = "drift_checks",
    uniqueConstraints = {
        @UniqueConstraint(name = "uk_drift_model_date", columnNames = {"model_key", "check_date"}),
    },
    indexes = {
        @Index(name = "idx_drift_date", columnList = "check_date"),
    }
)
@Getter
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class DriftCheck {

    @Id
    @GeneratedValue(strategy = GenerationType.UUID)
    @Column(updatable = false, nullable = false)
    private UUID id;

    @Column(name = "model_key", nullable = false, length = 128, updatable = false)
    private String modelKey;

    @Column(name = "model_version", nullable = false, length = 64, updatable = false)
    private String modelVersion;

    @Column(name = "check_date", nullable = false, updatable = false)
    private LocalDate checkDate;

    @Column(name = "psi_value", updatable = false)
    private Double psiValue;

    @Column(name = "js_divergence", updatable = false)
    private Double jsDivergence;

    @Column(name = "drift_detected", nullable = false, updatable = false)
    private boolean driftDetected;

    @Column(name = "items_analyzed", nullable = false, updatable = false)
    private int itemsAnalyzed;

    @Column(name = "feature_psi", columnDefinition = "text", updatable = false)
    private String featurePsi;

    @CreationTimestamp
    @Column(name = "created_at", updatable = false)
    private Instant createdAt;
}
