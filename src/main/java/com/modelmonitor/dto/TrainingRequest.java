package com.modelmonitor.dto;

import java.util.List;

/**
 * What the trainer receives: the client datasets to learn from and the baseline configuration
 * of the version being replaced.
 */
public record TrainingRequest(
    String modelKey,
    String sourceVersion,
    String candidateVersion,
    List<DatasetRef> datasets,
    double confidenceThreshold,
    List<String> featureNames,
    String baselineContentHash
) {
    public TrainingRequest {
        datasets = datasets != null ? List.copyOf(datasets) : List.of();
        featureNames = featureNames != null ? List.copyOf(featureNames) : List.of();
    }

    public record DatasetRef(String datasetId, long datasetVersion, long itemCount) {}
}
