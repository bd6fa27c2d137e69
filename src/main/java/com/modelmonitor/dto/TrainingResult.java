package com.modelmonitor.dto;

public record TrainingResult(ModelArtifact artifact, ModelMetrics trainingMetrics) {}
