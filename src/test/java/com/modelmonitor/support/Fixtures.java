package com.modelmonitor.support;

import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import com.modelmonitor.dto.DistributionSample;
import com.modelmonitor.dto.FeatureSpec;
import com.modelmonitor.dto.FeatureTransformers;
import com.modelmonitor.dto.FeatureType;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

public final class Fixtures {

    private Fixtures() {
    }

    /** Tenure values 1..30, 20 "stay" and 10 "churn" predictions. */
    public static DistributionSample churnBaseline() {
        return new DistributionSample(Map.of("tenure", range(1, 30)), Map.of("stay", 20L, "churn", 10L), 30);
    }

    public static FeatureTransformers churnTransformers() {
        return transformers(churnBaseline(), 15.5);
    }

    public static FeatureTransformers transformers(DistributionSample baseline, double scalerMean) {
        return new FeatureTransformers(
            List.of(new FeatureSpec("tenure", FeatureType.NUMERIC), new FeatureSpec("plan", FeatureType.CATEGORICAL)),
            Map.of(
                "scaler", JsonNodeFactory.instance.objectNode().put("mean", scalerMean).put("std", 8.8),
                "plan_encoder", JsonNodeFactory.instance.objectNode().put("kind", "one_hot")),
            baseline);
    }

    public static List<Double> range(int fromInclusive, int toInclusive) {
        List<Double> values = new ArrayList<>();
        for (int i = fromInclusive; i <= toInclusive; i++) {
            values.add((double) i);
        }
        return values;
    }
}
