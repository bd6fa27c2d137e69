package com.modelmonitor.dto;

import lombok.Builder;
import lombok.Value;

import java.time.Instant;
import java.util.List;

@Value
@Builder
public class FeatureSnapshotMetadata {
    String modelKey;
    String version;
    List<String> featureNames;
    List<FeatureType> featureTypes;
    String contentHash;
    Instant createdAt;
}
