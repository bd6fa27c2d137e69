package com.modelmonitor.dto;

import java.util.Map;

public record DriftScores(
    double psi,
    double jsDivergence,
    Map<String, Double> featurePsi,
    boolean driftDetected
) {}
