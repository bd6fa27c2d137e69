package com.modelmonitor.dto;

public record ModelArtifact(
    String modelKey,
    String version,
    String artifactUri,
    FeatureTransformers transformers
) {}
