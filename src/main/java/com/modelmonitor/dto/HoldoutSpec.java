package com.modelmonitor.dto;

import java.util.List;

public record HoldoutSpec(String modelKey, double fraction, List<Long> datasetVersions) {
    public HoldoutSpec {
        datasetVersions = datasetVersions != null ? List.copyOf(datasetVersions) : List.of();
    }
}
