package com.modelmonitor.dto;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Column-wise feature values plus predicted-class counts. Used both for the training baseline
 * and for a window of production predictions.
 */
public record DistributionSample(
    Map<String, List<Double>> featureValues,
    Map<String, Long> classCounts,
    int itemCount
) {
    public DistributionSample {
        Map<String, List<Double>> values = new LinkedHashMap<>();
        if (featureValues != null) {
            featureValues.forEach((k, v) -> values.put(k, v != null ? List.copyOf(v) : List.of()));
        }
        featureValues = Collections.unmodifiableMap(values);
        classCounts = classCounts != null
            ? Collections.unmodifiableMap(new LinkedHashMap<>(classCounts))
            : Map.of();
    }

    public static DistributionSample empty() {
        return new DistributionSample(Map.of(), Map.of(), 0);
    }
}
