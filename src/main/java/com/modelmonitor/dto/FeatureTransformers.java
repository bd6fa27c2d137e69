package com.modelmonitor.dto;

import com.fasterxml.jackson.databind.JsonNode;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Fitted input transformers of one model version (vectorizers, encoders, scalers keyed by name),
 * the ordered feature schema they produce, and the training baseline used for drift detection.
 */
public record FeatureTransformers(
    List<FeatureSpec> features,
    Map<String, JsonNode> transformers,
    DistributionSample baseline
) {
    public FeatureTransformers {
        features = features != null ? List.copyOf(features) : List.of();
        Map<String, JsonNode> copy = new LinkedHashMap<>();
        if (transformers != null) {
            transformers.forEach((k, v) -> copy.put(k, v != null ? v.deepCopy() : null));
        }
        transformers = Collections.unmodifiableMap(copy);
    }

    public List<String> featureNames() {
        return features.stream().map(FeatureSpec::name).toList();
    }
}
