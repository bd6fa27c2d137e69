package com.modelmonitor.dto;

public record FeatureSpec(String name, FeatureType type) {}
