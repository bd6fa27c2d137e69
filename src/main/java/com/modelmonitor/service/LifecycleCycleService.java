package com.modelmonitor.service;

import com.modelmonitor.config.LifecycleProperties;
import com.modelmonitor.dto.CycleOutcome;
import com.modelmonitor.dto.CycleReport;
import com.modelmonitor.entity.DriftCheck;
import com.modelmonitor.entity.ManagedModel;
import com.modelmonitor.entity.RetrainingJob;
import com.modelmonitor.entity.RetrainingStatus;
import com.modelmonitor.exception.InsufficientDataException;
import jakarta.annotation.PostConstruct;
import jakarta.annotation.PreDestroy;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Instant;
import java.time.LocalDate;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.CancellationException;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * The daily pass over every active model: reconcile stale jobs, then per model check drift,
 * watch recent promotions and hand off to retraining, each model as its own task on a bounded
 * worker pool. A failing model never aborts the others.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class LifecycleCycleService {

    private final ModelRegistryService registry;
    private final DriftMonitor driftMonitor;
    private final RetrainingOrchestrator orchestrator;
    private final AlertPublisher alerts;
    private final PredictionLogService predictionLogs;
    private final LifecycleProperties properties;
    private final Clock clock;

    private final AtomicBoolean running = new AtomicBoolean(false);
    private ExecutorService workers;

    @PostConstruct
    void init() {
        AtomicInteger counter = new AtomicInteger();
        int poolSize = Math.max(1, properties.getScheduler().getWorkerPoolSize());
        workers = Executors.newFixedThreadPool(poolSize, r -> {
            Thread t = new Thread(r, "lifecycle-worker-" + counter.incrementAndGet());
            t.setDaemon(true);
            return t;
        });
        log.info("Lifecycle worker pool started | size={}", poolSize);
    }

    @PreDestroy
    void shutdown() {
        if (workers != null) {
            workers.shutdownNow();
            log.info("Lifecycle worker pool stopped");
        }
    }

    public CycleReport runCycle() {
        return runCycle(LocalDate.now(clock));
    }

    /**
     * Runs the cycle for {@code date}. A call that overlaps a running cycle returns at once with
     * a report marked {@code skipped}.
     */
    public CycleReport runCycle(LocalDate date) {
        Instant startedAt = clock.instant();
        if (!running.compareAndSet(false, true)) {
            log.warn("Cycle already running, skipped | date={}", date);
            return CycleReport.builder()
                .cycleDate(date)
                .skipped(true)
                .outcomes(Map.of())
                .startedAt(startedAt)
                .completedAt(startedAt)
                .build();
        }
        try {
            log.info("Cycle started | date={}", date);
            int reconciled = reconcile();

            List<ManagedModel> models = registry.activeModels();
            Map<String, Future<CycleOutcome>> tasks = new LinkedHashMap<>();
            for (ManagedModel model : models) {
                tasks.put(model.getModelKey(), workers.submit(() -> processModel(model, date)));
            }

            Map<String, CycleOutcome> outcomes = new LinkedHashMap<>();
            tasks.forEach((modelKey, future) -> outcomes.put(modelKey, await(modelKey, future)));

            purgePredictionLogs();

            CycleReport report = CycleReport.builder()
                .cycleDate(date)
                .skipped(false)
                .reconciledJobs(reconciled)
                .outcomes(outcomes)
                .startedAt(startedAt)
                .completedAt(clock.instant())
                .build();
            log.info("Cycle completed | date={} | models={} | reconciled={} | insufficient={} | failed={}",
                     date, outcomes.size(), reconciled,
                     report.count(CycleOutcome.INSUFFICIENT_DATA), report.count(CycleOutcome.FAILED));
            return report;
        } finally {
            running.set(false);
        }
    }

    CycleOutcome processModel(ManagedModel model, LocalDate date) {
        String modelKey = model.getModelKey();
        try {
            if (driftMonitor.alreadyChecked(modelKey, date)) {
                log.debug("Model already checked today | model={} | date={}", modelKey, date);
                return CycleOutcome.ALREADY_CHECKED;
            }

            DriftCheck check;
            try {
                check = driftMonitor.check(model, date);
            } catch (InsufficientDataException ex) {
                log.info("Drift check skipped | model={} | date={} | reason={}", modelKey, date, ex.getMessage());
                return CycleOutcome.INSUFFICIENT_DATA;
            }

            if (check.isDriftDetected()) {
                alerts.driftDetected(check);
            }

            Optional<RetrainingJob> reverted = orchestrator.watchPromotion(model);
            if (reverted.isPresent()) {
                return CycleOutcome.ROLLED_BACK;
            }

            if (!check.isDriftDetected()) {
                return CycleOutcome.NO_DRIFT;
            }
            return orchestrator.onDriftChecked(check)
                .map(job -> outcomeOf(job.getStatus()))
                .orElse(CycleOutcome.DRIFT_DETECTED);
        } catch (RuntimeException ex) {
            log.error("Cycle failed for model | model={} | date={} | error={}", modelKey, date, ex.getMessage(), ex);
            raiseInfrastructureAlert(modelKey, ex);
            return CycleOutcome.FAILED;
        }
    }

    private int reconcile() {
        try {
            int reconciled = orchestrator.reconcileStaleJobs();
            if (reconciled > 0) {
                log.warn("Stale jobs reconciled | count={}", reconciled);
            }
            return reconciled;
        } catch (RuntimeException ex) {
            log.error("Stale job reconciliation failed | error={}", ex.getMessage(), ex);
            raiseInfrastructureAlert(null, ex);
            return 0;
        }
    }

    private void purgePredictionLogs() {
        try {
            predictionLogs.purgeOlderThan(properties.getPredictionLog().getRetentionDays());
        } catch (RuntimeException ex) {
            log.error("Prediction log purge failed | error={}", ex.getMessage(), ex);
        }
    }

    private CycleOutcome await(String modelKey, Future<CycleOutcome> future) {
        try {
            return future.get();
        } catch (InterruptedException ex) {
            Thread.currentThread().interrupt();
            future.cancel(true);
            log.warn("Cycle interrupted while waiting | model={}", modelKey);
            return CycleOutcome.CANCELLED;
        } catch (CancellationException ex) {
            log.warn("Cycle task cancelled | model={}", modelKey);
            return CycleOutcome.CANCELLED;
        } catch (ExecutionException ex) {
            log.error("Cycle task crashed | model={}", modelKey, ex.getCause());
            return CycleOutcome.FAILED;
        }
    }

    private void raiseInfrastructureAlert(String modelKey, RuntimeException ex) {
        try {
            alerts.infrastructureFailure(modelKey, "daily-cycle", ex);
        } catch (RuntimeException alertError) {
            log.error("Infrastructure alert not stored | model={} | error={}", modelKey, alertError.getMessage());
        }
    }

    private static CycleOutcome outcomeOf(RetrainingStatus status) {
        return switch (status) {
            case SUCCESS -> CycleOutcome.RETRAINING_SUCCEEDED;
            case DEGRADATION_DETECTED -> CycleOutcome.RETRAINING_DEGRADED;
            case FAILED -> CycleOutcome.RETRAINING_FAILED;
            case QUEUED, RUNNING -> CycleOutcome.DRIFT_DETECTED;
        };
    }
}
