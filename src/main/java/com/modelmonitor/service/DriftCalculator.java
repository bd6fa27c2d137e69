package com.modelmonitor.service;

import com.modelmonitor.config.LifecycleProperties;
import com.modelmonitor.config.LifecycleProperties.BinningStrategy;
import com.modelmonitor.dto.DistributionSample;
import com.modelmonitor.dto.DriftScores;

import java.util.Arrays;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.TreeSet;

/**
 * Population Stability Index and Jensen-Shannon divergence. Stateless apart from its
 * configuration; safe to share between threads.
 */
public class DriftCalculator {

    private static final double LN2 = Math.log(2.0);

    private final LifecycleProperties.Drift config;

    public DriftCalculator(LifecycleProperties.Drift config) {
        this.config = config;
    }

    public DriftScores score(DistributionSample baseline, DistributionSample current) {
        Map<String, Double> featurePsi = new LinkedHashMap<>();
        baseline.featureValues().forEach((feature, expected) -> {
            List<Double> actual = current.featureValues().get(feature);
            if (expected.isEmpty() || actual == null || actual.isEmpty()) {
                return;
            }
            featurePsi.put(feature, psi(toArray(expected), toArray(actual)));
        });

        double psi = aggregate(featurePsi);
        double js = jsDivergence(baseline.classCounts(), current.classCounts());
        boolean drift = psi > config.getPsiThreshold() || js > config.getJsThreshold();
        return new DriftScores(psi, js, featurePsi, drift);
    }

    /**
     * PSI of one feature, bucketed by edges derived from the expected (baseline) values.
     */
    public double psi(double[] expected, double[] actual) {
        double[] edges = config.getBinning() == BinningStrategy.EQUAL_WIDTH
            ? equalWidthEdges(expected, config.getBins())
            : quantileEdges(expected, config.getBins());
        return psiFromPercentages(bucketShares(expected, edges), bucketShares(actual, edges));
    }

    /**
     * PSI over two pre-bucketed distributions of equal length.
     */
    public double psiFromPercentages(double[] expectedPct, double[] actualPct) {
        if (expectedPct.length != actualPct.length) {
            throw new IllegalArgumentException("bucket counts differ: "
                + expectedPct.length + " vs " + actualPct.length);
        }
        double eps = config.getEpsilon();
        double psi = 0.0;
        for (int i = 0; i < expectedPct.length; i++) {
            double e = expectedPct[i] > 0 ? expectedPct[i] : eps;
            double a = actualPct[i] > 0 ? actualPct[i] : eps;
            psi += (a - e) * Math.log(a / e);
        }
        return psi;
    }

    /**
     * Jensen-Shannon divergence between two class-count distributions, natural log, bounded by
     * ln 2 (or by 1 when normalisation is on). Empty inputs yield 0.
     */
    public double jsDivergence(Map<String, Long> baselineCounts, Map<String, Long> currentCounts) {
        long baseTotal = total(baselineCounts);
        long curTotal = total(currentCounts);
        if (baseTotal == 0 || curTotal == 0) {
            return 0.0;
        }
        TreeSet<String> classes = new TreeSet<>(baselineCounts.keySet());
        classes.addAll(currentCounts.keySet());

        double[] p = new double[classes.size()];
        double[] q = new double[classes.size()];
        int i = 0;
        for (String c : classes) {
            p[i] = baselineCounts.getOrDefault(c, 0L) / (double) baseTotal;
            q[i] = currentCounts.getOrDefault(c, 0L) / (double) curTotal;
            i++;
        }
        return jsDivergence(p, q);
    }

    public double jsDivergence(double[] p, double[] q) {
        if (p.length != q.length) {
            throw new IllegalArgumentException("distribution lengths differ: " + p.length + " vs " + q.length);
        }
        double[] pn = normalise(p);
        double[] qn = normalise(q);
        double eps = config.getEpsilon();
        double kp = 0.0;
        double kq = 0.0;
        for (int i = 0; i < pn.length; i++) {
            double pi = pn[i] > 0 ? pn[i] : eps;
            double qi = qn[i] > 0 ? qn[i] : eps;
            double m = (pi + qi) / 2.0;
            kp += pi * Math.log(pi / m);
            kq += qi * Math.log(qi / m);
        }
        double js = Math.min(LN2, Math.max(0.0, 0.5 * kp + 0.5 * kq));
        return config.isNormalizeJs() ? js / LN2 : js;
    }

    private double aggregate(Map<String, Double> featurePsi) {
        if (featurePsi.isEmpty()) {
            return 0.0;
        }
        return switch (config.getPsiAggregation()) {
            case MAX -> featurePsi.values().stream().mapToDouble(Double::doubleValue).max().orElse(0.0);
            case MEAN -> featurePsi.values().stream().mapToDouble(Double::doubleValue).average().orElse(0.0);
        };
    }

    /**
     * Interior edges at the i/bins quantiles of the baseline (linear interpolation), duplicates
     * collapsed. Buckets are upper-inclusive with open outer ends.
     */
    static double[] quantileEdges(double[] baseline, int bins) {
        double[] sorted = baseline.clone();
        Arrays.sort(sorted);
        TreeSet<Double> edges = new TreeSet<>();
        for (int i = 1; i < bins; i++) {
            edges.add(quantile(sorted, i, bins));
        }
        return edges.stream().mapToDouble(Double::doubleValue).toArray();
    }

    static double[] equalWidthEdges(double[] baseline, int bins) {
        double min = Arrays.stream(baseline).min().orElse(0.0);
        double max = Arrays.stream(baseline).max().orElse(0.0);
        if (max <= min) {
            return new double[] {min};
        }
        double width = (max - min) / bins;
        double[] edges = new double[bins - 1];
        for (int i = 1; i < bins; i++) {
            edges[i - 1] = min + i * width;
        }
        return edges;
    }

    static double[] bucketShares(double[] values, double[] edges) {
        double[] counts = new double[edges.length + 1];
        for (double v : values) {
            int idx = Arrays.binarySearch(edges, v);
            int bucket = idx >= 0 ? idx : -idx - 1;
            counts[bucket]++;
        }
        for (int i = 0; i < counts.length; i++) {
            counts[i] = counts[i] / values.length;
        }
        return counts;
    }

    private static double quantile(double[] sorted, int i, int bins) {
        double pos = (double) i * (sorted.length - 1) / bins;
        int lower = (int) Math.floor(pos);
        int upper = (int) Math.ceil(pos);
        double frac = pos - lower;
        return sorted[lower] + (sorted[upper] - sorted[lower]) * frac;
    }

    private static double[] normalise(double[] dist) {
        double sum = Arrays.stream(dist).sum();
        if (sum <= 0) {
            return dist.clone();
        }
        return Arrays.stream(dist).map(v -> v / sum).toArray();
    }

    private static long total(Map<String, Long> counts) {
        return counts == null ? 0L : counts.values().stream().mapToLong(Long::longValue).sum();
    }

    private static double[] toArray(List<Double> values) {
        return values.stream().mapToDouble(Double::doubleValue).toArray();
    }
}
