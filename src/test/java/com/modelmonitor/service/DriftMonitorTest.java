package com.modelmonitor.service;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.modelmonitor.config.LifecycleProperties;
import com.modelmonitor.dto.DistributionSample;
import com.modelmonitor.entity.DriftCheck;
import com.modelmonitor.entity.ManagedModel;
import com.modelmonitor.entity.ModelStatus;
import com.modelmonitor.event.LifecycleEvent;
import com.modelmonitor.event.LifecycleEventBus;
import com.modelmonitor.event.LifecycleEventType;
import com.modelmonitor.exception.FeatureSnapshotNotFoundException;
import com.modelmonitor.exception.InsufficientDataException;
import com.modelmonitor.repository.DriftCheckRepository;
import com.modelmonitor.support.Fixtures;
import com.modelmonitor.support.InlineTransactionTemplate;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.dao.DataIntegrityViolationException;

import java.time.Clock;
import java.time.Instant;
import java.time.LocalDate;
import java.time.ZoneOffset;
import java.util.Map;
import java.util.Optional;

import static org.assertj.core.api.Assertions.*;
import static org.mockito.ArgumentMatchers.*;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
class DriftMonitorTest {

    private static final Instant NOW = Instant.parse("2025-06-15T23:00:00Z");
    private static final LocalDate TODAY = LocalDate.of(2025, 6, 15);

    @Mock DriftCheckRepository repository;
    @Mock FeatureStore featureStore;
    @Mock PredictionLogService predictionLogs;
    @Mock LifecycleEventBus eventBus;

    private DriftMonitor monitor;
    private ManagedModel model;

    @BeforeEach
    void setUp() {
        LifecycleProperties properties = new LifecycleProperties();
        properties.getDrift().setMinSampleSize(20);
        DurableWrites durable = new DurableWrites(new InlineTransactionTemplate(), properties);
        monitor = new DriftMonitor(repository, featureStore, predictionLogs, durable, eventBus,
            new JsonCodec(new ObjectMapper()), Clock.fixed(NOW, ZoneOffset.UTC), properties);
        model = ManagedModel.builder().modelKey("churn").activeVersion("v3").status(ModelStatus.ACTIVE).build();
    }

    @Test
    void check_identicalDistribution_persistsNoDrift() {
        when(repository.findByModelKeyAndCheckDate("churn", TODAY)).thenReturn(Optional.empty());
        when(featureStore.baseline("churn", "v3")).thenReturn(Optional.of(Fixtures.churnBaseline()));
        when(predictionLogs.sample(eq("churn"), eq("v3"), any(), any())).thenReturn(Fixtures.churnBaseline());
        when(repository.saveAndFlush(any())).thenAnswer(inv -> inv.getArgument(0));

        DriftCheck check = monitor.check(model, TODAY);

        assertThat(check.isDriftDetected()).isFalse();
        assertThat(check.getPsiValue()).isEqualTo(0.0);
        assertThat(check.getJsDivergence()).isEqualTo(0.0);
        assertThat(check.getItemsAnalyzed()).isEqualTo(30);
        assertThat(check.getModelVersion()).isEqualTo("v3");
        assertThat(check.getFeaturePsi()).contains("tenure");

        ArgumentCaptor<LifecycleEvent> event = ArgumentCaptor.forClass(LifecycleEvent.class);
        verify(eventBus).publish(event.capture());
        assertThat(event.getValue().type()).isEqualTo(LifecycleEventType.DRIFT_CHECKED);
        assertThat(event.getValue().payload()).containsEntry("driftDetected", false);
    }

    @Test
    void check_samplesTheConfiguredWindow() {
        when(repository.findByModelKeyAndCheckDate("churn", TODAY)).thenReturn(Optional.empty());
        when(featureStore.baseline("churn", "v3")).thenReturn(Optional.of(Fixtures.churnBaseline()));
        when(predictionLogs.sample(any(), any(), any(), any())).thenReturn(DistributionSample.empty());

        assertThatThrownBy(() -> monitor.check(model, TODAY)).isInstanceOf(InsufficientDataException.class);

        verify(predictionLogs).sample("churn", "v3", NOW.minusSeconds(24 * 3600), NOW);
    }

    @Test
    void check_pastDate_samplesThatDayNotTheLastDay() {
        LocalDate twoDaysAgo = TODAY.minusDays(2);
        when(repository.findByModelKeyAndCheckDate("churn", twoDaysAgo)).thenReturn(Optional.empty());
        when(featureStore.baseline("churn", "v3")).thenReturn(Optional.of(Fixtures.churnBaseline()));
        when(predictionLogs.sample(any(), any(), any(), any())).thenReturn(DistributionSample.empty());

        assertThatThrownBy(() -> monitor.check(model, twoDaysAgo)).isInstanceOf(InsufficientDataException.class);

        verify(predictionLogs).sample("churn", "v3",
            Instant.parse("2025-06-13T00:00:00Z"), Instant.parse("2025-06-14T00:00:00Z"));
    }

    @Test
    void windowEnd_usesSchedulerZoneForDayBoundary() {
        LifecycleProperties properties = new LifecycleProperties();
        properties.getScheduler().setZone("Europe/Berlin");
        DriftMonitor berlin = new DriftMonitor(repository, featureStore, predictionLogs,
            new DurableWrites(new InlineTransactionTemplate(), properties), eventBus,
            new JsonCodec(new ObjectMapper()), Clock.fixed(NOW, ZoneOffset.UTC), properties);

        // 23:00 UTC is already the next day in Berlin.
        assertThat(berlin.windowEnd(TODAY)).isEqualTo(Instant.parse("2025-06-15T22:00:00Z"));
        assertThat(berlin.windowEnd(TODAY.plusDays(1))).isEqualTo(NOW);
    }

    @Test
    void check_tooFewItems_throwsAndStoresNothing() {
        when(repository.findByModelKeyAndCheckDate("churn", TODAY)).thenReturn(Optional.empty());
        when(featureStore.baseline("churn", "v3")).thenReturn(Optional.of(Fixtures.churnBaseline()));
        DistributionSample small = new DistributionSample(Map.of("tenure", Fixtures.range(1, 5)), Map.of("stay", 5L), 5);
        when(predictionLogs.sample(any(), any(), any(), any())).thenReturn(small);

        assertThatThrownBy(() -> monitor.check(model, TODAY))
            .isInstanceOf(InsufficientDataException.class)
            .hasMessageContaining("5 items analyzed");
        verify(repository, never()).saveAndFlush(any());
        verifyNoInteractions(eventBus);
    }

    @Test
    void check_missingBaseline_isInsufficientData() {
        when(repository.findByModelKeyAndCheckDate("churn", TODAY)).thenReturn(Optional.empty());
        when(featureStore.baseline("churn", "v3")).thenReturn(Optional.empty());

        assertThatThrownBy(() -> monitor.check(model, TODAY))
            .isInstanceOf(InsufficientDataException.class)
            .extracting("errorCode").isEqualTo("INSUFFICIENT_DATA");
        verifyNoInteractions(predictionLogs);
    }

    @Test
    void check_missingSnapshot_isInsufficientData() {
        when(repository.findByModelKeyAndCheckDate("churn", TODAY)).thenReturn(Optional.empty());
        when(featureStore.baseline("churn", "v3")).thenThrow(new FeatureSnapshotNotFoundException("churn", "v3"));

        assertThatThrownBy(() -> monitor.check(model, TODAY)).isInstanceOf(InsufficientDataException.class);
    }

    @Test
    void check_alreadyRecorded_returnsExistingRow() {
        DriftCheck existing = DriftCheck.builder().modelKey("churn").checkDate(TODAY).modelVersion("v3").build();
        when(repository.findByModelKeyAndCheckDate("churn", TODAY)).thenReturn(Optional.of(existing));

        assertThat(monitor.check(model, TODAY)).isSameAs(existing);
        verifyNoInteractions(featureStore, predictionLogs, eventBus);
    }

    @Test
    void check_concurrentInsert_returnsWinnerRow() {
        DriftCheck winner = DriftCheck.builder().modelKey("churn").checkDate(TODAY).modelVersion("v3").build();
        when(repository.findByModelKeyAndCheckDate("churn", TODAY))
            .thenReturn(Optional.empty())
            .thenReturn(Optional.of(winner));
        when(featureStore.baseline("churn", "v3")).thenReturn(Optional.of(Fixtures.churnBaseline()));
        when(predictionLogs.sample(any(), any(), any(), any())).thenReturn(Fixtures.churnBaseline());
        when(repository.saveAndFlush(any())).thenThrow(new DataIntegrityViolationException("uk_drift_model_date"));

        assertThat(monitor.check(model, TODAY)).isSameAs(winner);
        verifyNoInteractions(eventBus);
    }

    @Test
    void history_limitsToRequestedSize() {
        monitor.history("churn", 5);
        verify(repository).findByModelKeyOrderByCheckDateDesc(eq("churn"),
            argThat(p -> p.getPageSize() == 5 && p.getPageNumber() == 0));
    }
}
