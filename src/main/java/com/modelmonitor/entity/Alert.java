package com.modelmonitor.entity;

import jakarta.persistence.*;
import lombok.*;

import java.time.Instant;
import java.util.UUID;

@Entity
@Table(
    name = "alerts",
    indexes = {
        @Index(name = "idx_alert_model", columnList = "model_key"),
        @Index(name = "idx_alert_created", columnList = "created_at"),
        @Index(name = "idx_alert_dismissed", columnList = "dismissed_at"),
    }
)
@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class Alert {

    @Id
    @GeneratedValue(strategy = GenerationType.UUID)
    @Column(updatable = false, nullable = false)
    private UUID id;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false, length = 32, updatable = false)
    private AlertType type;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false, length = 16, updatable = false)
    private AlertSeverity severity;

    @Column(name = "model_key", length = 128, updatable = false)
    private String modelKey;

    @Column(nullable = false, length = 500, updatable = false)
    private String message;

    /** Structured diagnostic payload as JSON. */
    @Column(columnDefinition = "text", updatable = false)
    private String details;

    @Column(name = "created_at", nullable = false, updatable = false)
    private Instant createdAt;

    @Column(name = "dismissed_at")
    private Instant dismissedAt;

    @Column(name = "dismissed_by", length = 128)
    private String dismissedBy;
}
