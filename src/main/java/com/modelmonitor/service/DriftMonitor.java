package com.modelmonitor.service;

import com.modelmonitor.config.LifecycleProperties;
import com.modelmonitor.dto.DistributionSample;
import com.modelmonitor.dto.DriftScores;
import com.modelmonitor.entity.DriftCheck;
import com.modelmonitor.entity.ManagedModel;
import com.modelmonitor.event.LifecycleEvent;
import com.modelmonitor.event.LifecycleEventBus;
import com.modelmonitor.event.LifecycleEventType;
import com.modelmonitor.exception.FeatureSnapshotNotFoundException;
import com.modelmonitor.exception.InsufficientDataException;
import com.modelmonitor.repository.DriftCheckRepository;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.data.domain.PageRequest;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Instant;
import java.time.LocalDate;
import java.time.ZoneId;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Compares a model's training baseline with its recent production predictions and records at
 * most one {@link DriftCheck} per model per day.
 */
@Slf4j
@Service
public class DriftMonitor {

    public static final int DEFAULT_HISTORY_LIMIT = 30;

    private final DriftCheckRepository repository;
    private final FeatureStore featureStore;
    private final PredictionLogService predictionLogs;
    private final DurableWrites durable;
    private final LifecycleEventBus eventBus;
    private final JsonCodec json;
    private final Clock clock;
    private final LifecycleProperties.Drift config;
    private final ZoneId zone;
    private final DriftCalculator calculator;

    public DriftMonitor(DriftCheckRepository repository, FeatureStore featureStore,
                        PredictionLogService predictionLogs, DurableWrites durable,
                        LifecycleEventBus eventBus, JsonCodec json, Clock clock,
                        LifecycleProperties properties) {
        this.repository = repository;
        this.featureStore = featureStore;
        this.predictionLogs = predictionLogs;
        this.durable = durable;
        this.eventBus = eventBus;
        this.json = json;
        this.clock = clock;
        this.config = properties.getDrift();
        this.zone = ZoneId.of(properties.getScheduler().getZone());
        this.calculator = new DriftCalculator(config);
    }

    /**
     * Runs the check of {@code model}'s active version for {@code checkDate}. Returns the stored
     * row, or the row another caller stored first for the same day.
     *
     * @throws InsufficientDataException when no baseline exists or the production sample is
     *                                   smaller than the configured minimum; nothing is stored
     */
    public DriftCheck check(ManagedModel model, LocalDate checkDate) {
        String modelKey = model.getModelKey();
        String version = model.getActiveVersion();

        DriftCheck existing = repository.findByModelKeyAndCheckDate(modelKey, checkDate).orElse(null);
        if (existing != null) {
            log.debug("Drift check already recorded | model={} | date={}", modelKey, checkDate);
            return existing;
        }

        DistributionSample baseline;
        try {
            baseline = featureStore.baseline(modelKey, version)
                .orElseThrow(() -> new InsufficientDataException(modelKey, "no baseline for version " + version));
        } catch (FeatureSnapshotNotFoundException ex) {
            throw new InsufficientDataException(modelKey, "no feature snapshot for version " + version);
        }

        Instant until = windowEnd(checkDate);
        Instant since = until.minus(config.getWindow());
        DistributionSample current = predictionLogs.sample(modelKey, version, since, until);
        if (current.itemCount() < config.getMinSampleSize()) {
            log.info("Drift check inconclusive | model={} | date={} | items={} | required={}",
                     modelKey, checkDate, current.itemCount(), config.getMinSampleSize());
            throw new InsufficientDataException(modelKey, current.itemCount(), config.getMinSampleSize());
        }

        DriftScores scores = calculator.score(baseline, current);
        DriftCheck check = DriftCheck.builder()
            .modelKey(modelKey)
            .modelVersion(version)
            .checkDate(checkDate)
            .psiValue(scores.psi())
            .jsDivergence(scores.jsDivergence())
            .driftDetected(scores.driftDetected())
            .itemsAnalyzed(current.itemCount())
            .featurePsi(json.write(scores.featurePsi()))
            .build();

        DriftCheck saved;
        try {
            saved = durable.inTransaction("drift-check", status -> repository.saveAndFlush(check));
        } catch (DataIntegrityViolationException ex) {
            log.info("Drift check raced with a concurrent writer | model={} | date={}", modelKey, checkDate);
            return repository.findByModelKeyAndCheckDate(modelKey, checkDate).orElseThrow(() -> ex);
        }

        if (saved.isDriftDetected()) {
            log.warn("Drift detected | model={} | version={} | psi={} | js={} | items={}",
                     modelKey, version, saved.getPsiValue(), saved.getJsDivergence(), saved.getItemsAnalyzed());
        } else {
            log.info("Drift check passed | model={} | version={} | psi={} | js={} | items={}",
                     modelKey, version, saved.getPsiValue(), saved.getJsDivergence(), saved.getItemsAnalyzed());
        }

        Map<String, Object> payload = new LinkedHashMap<>();
        payload.put("checkDate", checkDate.toString());
        payload.put("modelVersion", version);
        payload.put("psi", saved.getPsiValue());
        payload.put("jsDivergence", saved.getJsDivergence());
        payload.put("driftDetected", saved.isDriftDetected());
        eventBus.publish(new LifecycleEvent(LifecycleEventType.DRIFT_CHECKED, modelKey, clock.instant(), payload));
        return saved;
    }

    /**
     * The sample window closes at the end of {@code checkDate} in the scheduler's zone, or now if
     * that is earlier, so a late or repeated run of a past date reads that date's predictions.
     */
    Instant windowEnd(LocalDate checkDate) {
        Instant endOfDay = checkDate.plusDays(1).atStartOfDay(zone).toInstant();
        Instant now = clock.instant();
        return endOfDay.isBefore(now) ? endOfDay : now;
    }

    public boolean alreadyChecked(String modelKey, LocalDate checkDate) {
        return repository.existsByModelKeyAndCheckDate(modelKey, checkDate);
    }

    public List<DriftCheck> history(String modelKey, int limit) {
        return repository.findByModelKeyOrderByCheckDateDesc(modelKey, PageRequest.of(0, Math.max(1, limit)));
    }

    public List<DriftCheck> history(String modelKey) {
        return history(modelKey, DEFAULT_HISTORY_LIMIT);
    }
}
