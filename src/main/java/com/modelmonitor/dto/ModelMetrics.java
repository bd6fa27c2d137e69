package com.modelmonitor.dto;

import com.fasterxml.jackson.annotation.JsonInclude;

@JsonInclude(JsonInclude.Include.NON_NULL)
public record ModelMetrics(
    double accuracy,
    Double precision,
    Double recall,
    Double f1Score,
    Long sampleCount
) {
    public static ModelMetrics ofAccuracy(double accuracy) {
        return new ModelMetrics(accuracy, null, null, null, null);
    }
}
