package com.modelmonitor.service;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.modelmonitor.entity.Alert;
import com.modelmonitor.entity.AlertSeverity;
import com.modelmonitor.entity.AlertType;
import com.modelmonitor.entity.DriftCheck;
import com.modelmonitor.entity.RetrainingJob;
import com.modelmonitor.entity.RetrainingStatus;
import com.modelmonitor.entity.RetrainingTrigger;
import com.modelmonitor.event.LifecycleEvent;
import com.modelmonitor.event.LifecycleEventBus;
import com.modelmonitor.event.LifecycleEventType;
import com.modelmonitor.exception.AlertNotFoundException;
import com.modelmonitor.repository.AlertRepository;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.time.Clock;
import java.time.Instant;
import java.time.LocalDate;
import java.time.ZoneOffset;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;

import static org.assertj.core.api.Assertions.*;
import static org.mockito.ArgumentMatchers.*;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
class AlertPublisherTest {

    private static final Instant NOW = Instant.parse("2025-06-15T23:00:00Z");

    @Mock AlertRepository repository;
    @Mock LifecycleEventBus eventBus;

    private AlertPublisher publisher;
    private JsonCodec json;

    @BeforeEach
    void setUp() {
        json = new JsonCodec(new ObjectMapper());
        publisher = new AlertPublisher(repository, eventBus, json, Clock.fixed(NOW, ZoneOffset.UTC));
    }

    private void saveAssignsId() {
        when(repository.save(any())).thenAnswer(inv -> {
            Alert alert = inv.getArgument(0);
            if (alert.getId() == null) {
                alert.setId(UUID.randomUUID());
            }
            return alert;
        });
    }

    private RetrainingJob degradedJob() {
        return RetrainingJob.builder()
            .id(UUID.randomUUID()).modelKey("churn").trigger(RetrainingTrigger.DRIFT)
            .sourceModelVersion("v1").newModelVersion("v2")
            .status(RetrainingStatus.DEGRADATION_DETECTED)
            .oldMetrics("{\"accuracy\":0.92}").newMetrics("{\"accuracy\":0.85}")
            .accuracyDelta(-0.07)
            .build();
    }

    @Test
    void degradation_isCriticalWithMetricsInDetails() {
        saveAssignsId();

        Alert alert = publisher.degradation(degradedJob());

        assertThat(alert.getType()).isEqualTo(AlertType.MODEL_DEGRADATION);
        assertThat(alert.getSeverity()).isEqualTo(AlertSeverity.CRITICAL);
        assertThat(alert.getCreatedAt()).isEqualTo(NOW);
        assertThat(alert.getMessage()).contains("v2").contains("v1");
        Map<String, Object> details = json.readMap(alert.getDetails());
        assertThat(details).containsEntry("accuracyDelta", -0.07);
        assertThat(details.get("oldMetrics")).isEqualTo(Map.of("accuracy", 0.92));
    }

    @Test
    void publish_announcesAlertOnEventBus() {
        saveAssignsId();

        Alert alert = publisher.publish(AlertType.MODEL_PROMOTED, AlertSeverity.INFO, "churn", "promoted", null);

        ArgumentCaptor<LifecycleEvent> event = ArgumentCaptor.forClass(LifecycleEvent.class);
        verify(eventBus).publish(event.capture());
        assertThat(event.getValue().type()).isEqualTo(LifecycleEventType.ALERT_RAISED);
        assertThat(event.getValue().modelKey()).isEqualTo("churn");
        assertThat(event.getValue().payload())
            .containsEntry("alertId", alert.getId())
            .containsEntry("type", "model_promoted");
        assertThat(alert.getDetails()).isEqualTo("{}");
    }

    @Test
    void driftDetected_isWarningWithScores() {
        saveAssignsId();
        DriftCheck check = DriftCheck.builder()
            .modelKey("churn").modelVersion("v1").checkDate(LocalDate.of(2025, 6, 15))
            .psiValue(0.31).jsDivergence(0.05).driftDetected(true).itemsAnalyzed(120)
            .featurePsi("{\"tenure\":0.31}")
            .build();

        Alert alert = publisher.driftDetected(check);

        assertThat(alert.getType()).isEqualTo(AlertType.DRIFT_DETECTED);
        assertThat(alert.getSeverity()).isEqualTo(AlertSeverity.WARNING);
        assertThat(json.readMap(alert.getDetails())).containsEntry("itemsAnalyzed", 120);
    }

    @Test
    void publish_longMessage_isTruncated() {
        saveAssignsId();
        Alert alert = publisher.publish(AlertType.INFRASTRUCTURE_FAILURE, AlertSeverity.CRITICAL,
            "churn", "x".repeat(800), Map.of());
        assertThat(alert.getMessage()).hasSize(500).endsWith("...");
    }

    @Test
    void dismiss_stampsOnce() {
        UUID id = UUID.randomUUID();
        Alert alert = Alert.builder().id(id).type(AlertType.DRIFT_DETECTED).severity(AlertSeverity.WARNING)
            .modelKey("churn").message("drift").createdAt(NOW.minusSeconds(60)).build();
        when(repository.findById(id)).thenReturn(Optional.of(alert));
        when(repository.save(any())).thenAnswer(inv -> inv.getArgument(0));

        Alert first = publisher.dismiss(id, "alice");
        Alert second = publisher.dismiss(id, "bob");

        assertThat(first.getDismissedAt()).isEqualTo(NOW);
        assertThat(second.getDismissedBy()).isEqualTo("alice");
        verify(repository, times(1)).save(any());
        verify(eventBus, times(1)).publish(argThat(e -> e.type() == LifecycleEventType.ALERT_DISMISSED));
    }

    @Test
    void dismiss_unknownAlert_throwsNotFound() {
        UUID id = UUID.randomUUID();
        when(repository.findById(id)).thenReturn(Optional.empty());
        assertThatThrownBy(() -> publisher.dismiss(id, "alice")).isInstanceOf(AlertNotFoundException.class);
    }
}
