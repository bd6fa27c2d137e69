package com.modelmonitor.dto;

public enum FeatureType {
    NUMERIC,
    CATEGORICAL,
    TEXT
}
