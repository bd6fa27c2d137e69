package com.modelmonitor.service;

import com.fasterxml.jackson.core.type.TypeReference;
import com.modelmonitor.dto.DistributionSample;
import com.modelmonitor.entity.PredictionLog;
import com.modelmonitor.repository.PredictionLogRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

@Slf4j
@Service
@RequiredArgsConstructor
public class PredictionLogService {

    private static final TypeReference<Map<String, Double>> FEATURE_MAP = new TypeReference<>() {};

    private final PredictionLogRepository repository;
    private final JsonCodec json;
    private final Clock clock;

    public PredictionLog record(String modelKey, String version, Map<String, Double> features,
                                String predictedClass, Double confidence) {
        PredictionLog entry = PredictionLog.builder()
            .modelKey(modelKey)
            .modelVersion(version)
            .features(json.write(features != null ? features : Map.of()))
            .predictedClass(predictedClass)
            .confidence(confidence)
            .createdAt(clock.instant())
            .build();
        return repository.save(entry);
    }

    /**
     * Production sample for drift detection: feature columns of every prediction of
     * {@code version} logged between {@code since} and {@code until} inclusive, plus
     * predicted-class counts. Non-numeric and missing feature values are skipped per column.
     */
    public DistributionSample sample(String modelKey, String version, Instant since, Instant until) {
        List<PredictionLog> logs = repository.findInWindow(modelKey, version, since, until);
        Map<String, List<Double>> columns = new LinkedHashMap<>();
        Map<String, Long> classCounts = new LinkedHashMap<>();

        for (PredictionLog entry : logs) {
            Map<String, Double> features = json.read(entry.getFeatures(), FEATURE_MAP);
            if (features != null) {
                features.forEach((name, value) -> {
                    if (value != null && Double.isFinite(value)) {
                        columns.computeIfAbsent(name, k -> new ArrayList<>()).add(value);
                    }
                });
            }
            if (entry.getPredictedClass() != null) {
                classCounts.merge(entry.getPredictedClass(), 1L, Long::sum);
            }
        }
        log.debug("Production sample built | model={} | version={} | items={}", modelKey, version, logs.size());
        return new DistributionSample(columns, classCounts, logs.size());
    }

    public int purgeOlderThan(int days) {
        Instant cutoff = clock.instant().minus(Duration.ofDays(days));
        int removed = repository.deleteOlderThan(cutoff);
        if (removed > 0) {
            log.info("Prediction logs purged | olderThan={} | removed={}", cutoff, removed);
        }
        return removed;
    }
}
