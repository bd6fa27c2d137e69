package com.modelmonitor.config;

import jakarta.validation.Valid;
import jakarta.validation.constraints.DecimalMax;
import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Positive;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

import java.time.Duration;

/**
 * Every threshold and tuning knob of the lifecycle monitor, bound from {@code lifecycle.*}.
 */
@Data
@Validated
@ConfigurationProperties(prefix = "lifecycle")
public class LifecycleProperties {

    @Valid
    private Drift drift = new Drift();

    @Valid
    private Retraining retraining = new Retraining();

    @Valid
    private Scheduler scheduler = new Scheduler();

    @Valid
    private Limiter limiter = new Limiter();

    @Valid
    private FeatureStore featureStore = new FeatureStore();

    @Valid
    private Persistence persistence = new Persistence();

    @Valid
    private PredictionLog predictionLog = new PredictionLog();

    @Data
    public static class Drift {
        /** Drift is flagged when the aggregated PSI exceeds this value. */
        private double psiThreshold = 0.1;

        /** Drift is flagged when the class-distribution JS divergence exceeds this value. */
        private double jsThreshold = 0.2;

        @Min(2)
        private int bins = 10;

        @NotNull
        private BinningStrategy binning = BinningStrategy.QUANTILE;

        @NotNull
        private PsiAggregation psiAggregation = PsiAggregation.MAX;

        /** Substituted for empty buckets and zero probabilities. */
        @Positive
        private double epsilon = 1e-4;

        /** Below this many production items the check is inconclusive and nothing is stored. */
        @Min(1)
        private int minSampleSize = 50;

        /** How far back production predictions are sampled. */
        @NotNull
        private Duration window = Duration.ofHours(24);

        /** Report JS divergence in [0, 1] instead of [0, ln 2]. */
        private boolean normalizeJs = false;
    }

    @Data
    public static class Retraining {
        /** A candidate whose accuracy delta falls below this value is not promoted. */
        @DecimalMax("0.0")
        private double rollbackThreshold = -0.05;

        /** Pending client dataset items required before drift triggers a retraining. */
        @Min(0)
        private long minDatasetItems = 100;

        @DecimalMin("0.0")
        @DecimalMax("1.0")
        private double confidenceThreshold = 0.8;

        @DecimalMin("0.01")
        @DecimalMax("0.9")
        private double holdoutFraction = 0.1;

        /** After promotion, regressions within this window trigger an automatic rollback. */
        @NotNull
        private Duration rollbackWindow = Duration.ofDays(7);
    }

    @Data
    public static class Scheduler {
        private boolean enabled = true;

        /** Local time of the daily cycle, HH:mm. */
        @NotBlank
        private String dailyTime = "23:00";

        @NotBlank
        private String zone = "UTC";

        @Min(1)
        private int workerPoolSize = 4;

        /** RUNNING jobs older than this are failed by the next reconciliation pass. */
        @NotNull
        private Duration staleJobTimeout = Duration.ofHours(6);
    }

    @Data
    public static class Limiter {
        /** Concurrent trainer/evaluation calls. */
        @Min(1)
        private int permits = 2;
    }

    @Data
    public static class FeatureStore {
        @Min(1)
        private int cacheSize = 64;
    }

    @Data
    public static class Persistence {
        @Min(1)
        private int maxAttempts = 3;

        @NotNull
        private Duration backoff = Duration.ofMillis(200);
    }

    @Data
    public static class PredictionLog {
        @Min(1)
        private int retentionDays = 30;
    }

    public enum BinningStrategy {
        /** Bucket edges at the baseline deciles (or whatever {@code bins} quantiles). */
        QUANTILE,
        /** Equal-width buckets across the baseline range. */
        EQUAL_WIDTH
    }

    public enum PsiAggregation {
        MAX,
        MEAN
    }
}
