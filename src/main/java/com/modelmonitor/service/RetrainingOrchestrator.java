package com.modelmonitor.service;

import com.modelmonitor.client.Trainer;
import com.modelmonitor.config.LifecycleProperties;
import com.modelmonitor.dto.FeatureSnapshotMetadata;
import com.modelmonitor.dto.HoldoutSpec;
import com.modelmonitor.dto.ModelArtifact;
import com.modelmonitor.dto.ModelMetrics;
import com.modelmonitor.dto.TrainingRequest;
import com.modelmonitor.dto.TrainingResult;
import com.modelmonitor.entity.ClientDataset;
import com.modelmonitor.entity.DriftCheck;
import com.modelmonitor.entity.ManagedModel;
import com.modelmonitor.entity.ModelStatus;
import com.modelmonitor.entity.ModelVersion;
import com.modelmonitor.entity.RetrainingJob;
import com.modelmonitor.entity.RetrainingStatus;
import com.modelmonitor.entity.RetrainingTrigger;
import com.modelmonitor.event.LifecycleEvent;
import com.modelmonitor.event.LifecycleEventBus;
import com.modelmonitor.event.LifecycleEventType;
import com.modelmonitor.exception.ConcurrencyConflictException;
import com.modelmonitor.exception.FeatureSnapshotConflictException;
import com.modelmonitor.exception.FeatureSnapshotNotFoundException;
import com.modelmonitor.exception.ModelNotFoundException;
import com.modelmonitor.exception.PersistenceFailureException;
import com.modelmonitor.exception.RollbackUnavailableException;
import com.modelmonitor.exception.TrainingException;
import com.modelmonitor.repository.ManagedModelRepository;
import com.modelmonitor.repository.ModelVersionRepository;
import com.modelmonitor.repository.RetrainingJobRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Retraining state machine: {@code QUEUED → RUNNING → SUCCESS | DEGRADATION_DETECTED | FAILED}.
 *
 * <p>At most one attempt runs per model. The in-process {@link ModelLocks} entry is taken with
 * {@code tryLock} and a RUNNING row in storage also blocks a new attempt; either way the caller
 * gets a {@link ConcurrencyConflictException} and nothing is written. The active-version pointer
 * only moves through a compare-and-swap executed while the lock is held.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class RetrainingOrchestrator {

    static final String SCHEDULER_ACTOR = "scheduler";
    static final String WATCH_ACTOR = "post-promotion-watch";
    static final String WATCH_REASON = "post_promotion_regression";

    private static final List<RetrainingStatus> IN_FLIGHT = List.of(RetrainingStatus.QUEUED, RetrainingStatus.RUNNING);
    private static final int MAX_ERROR_LENGTH = 1000;
    private static final int MAX_REASON_LENGTH = 255;

    private final ManagedModelRepository models;
    private final ModelVersionRepository versions;
    private final RetrainingJobRepository jobs;
    private final ClientDatasetService datasets;
    private final FeatureStore featureStore;
    private final Trainer trainer;
    private final ResourceLimiter limiter;
    private final ModelLocks locks;
    private final DurableWrites durable;
    private final AlertPublisher alerts;
    private final LifecycleEventBus eventBus;
    private final JsonCodec json;
    private final Clock clock;
    private final LifecycleProperties properties;

    /**
     * Starts a retraining outside the daily cycle and blocks until it reaches a terminal state.
     */
    public RetrainingJob triggerManual(String modelKey, String requestedBy) {
        try {
            return retrain(modelKey, RetrainingTrigger.MANUAL, requestedBy);
        } catch (PersistenceFailureException ex) {
            try {
                alerts.infrastructureFailure(modelKey, "manual-retraining", ex);
            } catch (RuntimeException alertError) {
                ex.addSuppressed(alertError);
            }
            throw ex;
        }
    }

    /**
     * Retrains when {@code check} found drift and enough client data has accumulated. With too
     * little data a {@code retraining_required} alert is raised instead.
     */
    public Optional<RetrainingJob> onDriftChecked(DriftCheck check) {
        if (!check.isDriftDetected()) {
            return Optional.empty();
        }
        String modelKey = check.getModelKey();
        long pending = datasets.pendingItems(modelKey);
        long required = properties.getRetraining().getMinDatasetItems();
        if (pending < required) {
            log.info("Retraining deferred | model={} | pendingItems={} | required={}", modelKey, pending, required);
            alerts.retrainingRequired(modelKey, pending, required);
            return Optional.empty();
        }
        if (hasJobInFlight(modelKey)) {
            log.info("Retraining skipped, job in flight | model={}", modelKey);
            return Optional.empty();
        }
        try {
            return Optional.of(retrain(modelKey, RetrainingTrigger.DRIFT, SCHEDULER_ACTOR));
        } catch (ConcurrencyConflictException ex) {
            log.info("Retraining skipped | model={} | reason={}", modelKey, ex.getMessage());
            return Optional.empty();
        }
    }

    public boolean hasJobInFlight(String modelKey) {
        return jobs.existsByModelKeyAndStatusIn(modelKey, IN_FLIGHT);
    }

    RetrainingJob retrain(String modelKey, RetrainingTrigger trigger, String requestedBy) {
        if (!locks.tryLock(modelKey)) {
            throw new ConcurrencyConflictException(modelKey, "a retraining or rollback is already in progress");
        }
        try {
            StartedJob started = start(modelKey, trigger, requestedBy);
            return execute(started);
        } finally {
            locks.unlock(modelKey);
        }
    }

    private StartedJob start(String modelKey, RetrainingTrigger trigger, String requestedBy) {
        return durable.inTransaction("retraining-start", status -> {
            if (jobs.existsByModelKeyAndStatusIn(modelKey, IN_FLIGHT)) {
                throw new ConcurrencyConflictException(modelKey, "a retraining job is already running");
            }
            ManagedModel model = models.findById(modelKey).orElseThrow(() -> new ModelNotFoundException(modelKey));
            String source = model.getActiveVersion();
            ModelVersion sourceVersion = versions.findByModelKeyAndVersion(modelKey, source)
                .orElseThrow(() -> new ModelNotFoundException(modelKey, source));
            ModelMetrics oldMetrics = metricsOf(sourceVersion, model);
            String candidate = ModelVersionNaming.next(source, v -> versions.existsByModelKeyAndVersion(modelKey, v));
            List<ClientDataset> consumed = datasets.pending(modelKey);
            long items = consumed.stream().mapToLong(ClientDataset::getItemCount).sum();

            Instant now = clock.instant();
            RetrainingJob job = jobs.saveAndFlush(RetrainingJob.builder()
                .modelKey(modelKey)
                .sourceModelVersion(source)
                .newModelVersion(candidate)
                .trigger(trigger)
                .requestedBy(requestedBy)
                .status(RetrainingStatus.QUEUED)
                .oldMetrics(json.write(oldMetrics))
                .datasetItems(items)
                .createdAt(now)
                .build());
            job.setStatus(RetrainingStatus.RUNNING);
            job.setStartedAt(now);
            job = jobs.save(job);
            datasets.markProcessing(consumed, job.getId());
            return new StartedJob(job, oldMetrics, new ArrayList<>(consumed));
        });
    }

    private RetrainingJob execute(StartedJob started) {
        RetrainingJob job = started.job();
        String modelKey = job.getModelKey();
        log.info("Retraining started | model={} | job={} | trigger={} | source={} | candidate={} | items={}",
                 modelKey, job.getId(), job.getTrigger(), job.getSourceModelVersion(),
                 job.getNewModelVersion(), job.getDatasetItems());
        publishTransition(job);

        ModelArtifact artifact;
        ModelMetrics trainingMetrics;
        ModelMetrics newMetrics;
        try {
            limiter.acquire();
            try {
                TrainingResult result = trainer.train(trainingRequest(started));
                if (result == null || result.artifact() == null) {
                    throw new TrainingException("Trainer returned no artifact");
                }
                artifact = new ModelArtifact(modelKey, job.getNewModelVersion(),
                    result.artifact().artifactUri(), result.artifact().transformers());
                trainingMetrics = result.trainingMetrics();
                newMetrics = trainer.evaluate(artifact, holdout(modelKey, started.datasets()));
                if (newMetrics == null) {
                    throw new TrainingException("Evaluation returned no metrics");
                }
            } finally {
                limiter.release();
            }
        } catch (InterruptedException ex) {
            Thread.currentThread().interrupt();
            return fail(job, new TrainingException("Interrupted while waiting for a compute slot", ex));
        } catch (PersistenceFailureException ex) {
            throw persistenceFailure(job, "retraining", ex);
        } catch (RuntimeException ex) {
            return fail(job, ex);
        }

        double delta = newMetrics.accuracy() - started.oldMetrics().accuracy();
        try {
            if (delta < properties.getRetraining().getRollbackThreshold()) {
                return degrade(job, newMetrics, delta);
            }
            return promote(job, artifact, newMetrics, trainingMetrics, delta);
        } catch (PersistenceFailureException ex) {
            throw persistenceFailure(job, "retraining-commit", ex);
        } catch (ConcurrencyConflictException | FeatureSnapshotConflictException ex) {
            return fail(job, ex);
        }
    }

    private RetrainingJob degrade(RetrainingJob job, ModelMetrics newMetrics, double delta) {
        Optional<RetrainingJob> committed = durable.inTransaction("retraining-degraded", status -> {
            Optional<RetrainingJob> current = stillRunning(job);
            current.ifPresent(j -> {
                j.setStatus(RetrainingStatus.DEGRADATION_DETECTED);
                j.setNewMetrics(json.write(newMetrics));
                j.setAccuracyDelta(delta);
                j.setCompletedAt(clock.instant());
                jobs.save(j);
                datasets.markArchived(j.getId());
            });
            return current;
        });
        if (committed.isEmpty()) {
            return abandoned(job);
        }
        RetrainingJob done = committed.get();
        log.warn("Retraining degraded | model={} | job={} | candidate={} | delta={} | active={}",
                 done.getModelKey(), done.getId(), done.getNewModelVersion(), delta, done.getSourceModelVersion());
        publishTransition(done);
        alerts.degradation(done);
        return done;
    }

    private RetrainingJob promote(RetrainingJob job, ModelArtifact artifact, ModelMetrics newMetrics,
                                  ModelMetrics trainingMetrics, double delta) {
        String modelKey = job.getModelKey();
        String source = job.getSourceModelVersion();
        String candidate = job.getNewModelVersion();

        Optional<RetrainingJob> committed = durable.inTransaction("retraining-promote", status -> {
            Optional<RetrainingJob> current = stillRunning(job);
            if (current.isEmpty()) {
                return current;
            }
            Instant now = clock.instant();
            RetrainingJob j = current.get();

            featureStore.save(modelKey, candidate, artifact.transformers());

            Map<String, Object> metadata = new LinkedHashMap<>();
            metadata.put("jobId", String.valueOf(j.getId()));
            metadata.put("trigger", String.valueOf(j.getTrigger()));
            metadata.put("sourceVersion", source);
            metadata.put("datasetItems", j.getDatasetItems());
            if (trainingMetrics != null) {
                metadata.put("trainingMetrics", trainingMetrics);
            }
            versions.save(ModelVersion.builder()
                .modelKey(modelKey)
                .version(candidate)
                .status(ModelStatus.ACTIVE)
                .accuracy(newMetrics.accuracy())
                .metrics(json.write(newMetrics))
                .trainingMetadata(json.write(metadata))
                .artifactUri(artifact.artifactUri())
                .createdAt(now)
                .build());
            versions.findByModelKeyAndVersion(modelKey, source).ifPresent(v -> {
                v.setStatus(ModelStatus.ARCHIVED);
                versions.save(v);
            });

            j.setStatus(RetrainingStatus.SUCCESS);
            j.setNewMetrics(json.write(newMetrics));
            j.setAccuracyDelta(delta);
            j.setCompletedAt(now);
            jobs.save(j);
            datasets.markArchived(j.getId());

            // Flushes the changes above and detaches them, so it has to come last.
            int swapped = models.promoteActiveVersion(modelKey, source, candidate, newMetrics.accuracy(), now);
            if (swapped != 1) {
                throw new ConcurrencyConflictException(modelKey,
                    "active version is no longer " + source + ", promotion of " + candidate + " abandoned");
            }
            return Optional.of(j);
        });
        if (committed.isEmpty()) {
            return abandoned(job);
        }
        RetrainingJob done = committed.get();
        log.info("Model promoted | model={} | job={} | from={} | to={} | delta={}",
                 modelKey, done.getId(), source, candidate, delta);
        publishTransition(done);
        alerts.promoted(done);
        return done;
    }

    private RetrainingJob fail(RetrainingJob job, Exception cause) {
        String message = truncate(cause.getMessage() != null ? cause.getMessage() : cause.getClass().getSimpleName());
        Optional<RetrainingJob> committed = durable.inTransaction("retraining-failed", status -> {
            Optional<RetrainingJob> current = stillRunning(job);
            current.ifPresent(j -> {
                j.setStatus(RetrainingStatus.FAILED);
                j.setErrorMessage(message);
                j.setCompletedAt(clock.instant());
                jobs.save(j);
                datasets.restoreActive(j.getId());
            });
            return current;
        });
        if (committed.isEmpty()) {
            return abandoned(job);
        }
        RetrainingJob done = committed.get();
        log.error("Retraining failed | model={} | job={} | error={}", done.getModelKey(), done.getId(), message, cause);
        publishTransition(done);
        alerts.retrainingFailed(done);
        return done;
    }

    /**
     * Reverts the active version to the source of the promotion that installed it.
     *
     * @throws RollbackUnavailableException when the active version was not installed by a
     *                                      non-reverted retraining job
     */
    public RetrainingJob rollback(String modelKey, String requestedBy, String reason) {
        if (!locks.tryLock(modelKey)) {
            throw new ConcurrencyConflictException(modelKey, "a retraining or rollback is already in progress");
        }
        try {
            if (hasJobInFlight(modelKey)) {
                throw new ConcurrencyConflictException(modelKey, "a retraining job is running");
            }
            RetrainingJob reverted = durable.inTransaction("rollback", status -> {
                ManagedModel model = models.findById(modelKey).orElseThrow(() -> new ModelNotFoundException(modelKey));
                String active = model.getActiveVersion();
                RetrainingJob job = latestPromotion(modelKey, active)
                    .orElseThrow(() -> new RollbackUnavailableException(modelKey, active));
                String previous = job.getSourceModelVersion();
                ModelVersion restored = versions.findByModelKeyAndVersion(modelKey, previous)
                    .orElseThrow(() -> new ModelNotFoundException(modelKey, previous));
                Instant now = clock.instant();

                restored.setStatus(ModelStatus.ACTIVE);
                versions.save(restored);
                versions.findByModelKeyAndVersion(modelKey, active).ifPresent(v -> {
                    v.setStatus(ModelStatus.ARCHIVED);
                    versions.save(v);
                });
                job.setRevertedAt(now);
                job.setRevertedBy(requestedBy);
                job.setRevertReason(truncate(reason, MAX_REASON_LENGTH));
                jobs.save(job);

                int swapped = models.restoreActiveVersion(modelKey, active, previous, restored.getAccuracy(), now);
                if (swapped != 1) {
                    throw new ConcurrencyConflictException(modelKey, "active version changed during rollback");
                }
                return job;
            });
            log.warn("Model rolled back | model={} | from={} | to={} | by={} | reason={}",
                     modelKey, reverted.getNewModelVersion(), reverted.getSourceModelVersion(), requestedBy, reason);
            publishTransition(reverted);
            alerts.rolledBack(reverted, requestedBy, reason);
            return reverted;
        } finally {
            locks.unlock(modelKey);
        }
    }

    /**
     * Re-evaluates a recently promoted active version and rolls it back when its accuracy has
     * fallen below the promotion-time accuracy by more than the rollback threshold.
     *
     * @return the reverted job if a rollback happened
     */
    public Optional<RetrainingJob> watchPromotion(ManagedModel model) {
        String modelKey = model.getModelKey();
        String active = model.getActiveVersion();
        Optional<RetrainingJob> promotion = latestPromotion(modelKey, active);
        if (promotion.isEmpty() || hasJobInFlight(modelKey)) {
            return Optional.empty();
        }
        RetrainingJob job = promotion.get();
        Instant windowStart = clock.instant().minus(properties.getRetraining().getRollbackWindow());
        if (job.getCompletedAt() == null || job.getCompletedAt().isBefore(windowStart)) {
            return Optional.empty();
        }
        ModelMetrics promoted = json.read(job.getNewMetrics(), ModelMetrics.class);
        if (promoted == null) {
            return Optional.empty();
        }

        ModelVersion version = versions.findByModelKeyAndVersion(modelKey, active)
            .orElseThrow(() -> new ModelNotFoundException(modelKey, active));
        ModelArtifact artifact = new ModelArtifact(modelKey, active, version.getArtifactUri(),
            featureStore.load(modelKey, active));
        ModelMetrics observed;
        try {
            limiter.acquire();
            try {
                observed = trainer.evaluate(artifact, holdout(modelKey, datasets.pending(modelKey)));
            } finally {
                limiter.release();
            }
        } catch (InterruptedException ex) {
            Thread.currentThread().interrupt();
            log.warn("Promotion watch interrupted | model={} | version={}", modelKey, active);
            return Optional.empty();
        } catch (RuntimeException ex) {
            log.warn("Promotion watch skipped | model={} | version={} | error={}", modelKey, active, ex.getMessage());
            raiseWatchFailure(modelKey, ex);
            return Optional.empty();
        }
        if (observed == null) {
            log.warn("Promotion watch skipped | model={} | version={} | error=no accuracy reported", modelKey, active);
            return Optional.empty();
        }

        double regression = observed.accuracy() - promoted.accuracy();
        log.info("Promotion watch | model={} | version={} | promotedAccuracy={} | observedAccuracy={}",
                 modelKey, active, promoted.accuracy(), observed.accuracy());
        if (regression >= properties.getRetraining().getRollbackThreshold()) {
            return Optional.empty();
        }
        try {
            return Optional.of(rollback(modelKey, WATCH_ACTOR, WATCH_REASON));
        } catch (ConcurrencyConflictException ex) {
            log.warn("Promotion watch rollback deferred | model={} | version={} | reason={}", modelKey, active, ex.getMessage());
            return Optional.empty();
        }
    }

    /**
     * Fails jobs left RUNNING past the stale timeout, typically by a crash, and returns their
     * datasets to ACTIVE.
     */
    public int reconcileStaleJobs() {
        Instant now = clock.instant();
        Instant cutoff = now.minus(properties.getScheduler().getStaleJobTimeout());
        List<RetrainingJob> reconciled = durable.inTransaction("reconcile-stale-jobs", status -> {
            List<RetrainingJob> stale = new ArrayList<>(jobs.findByStatusAndStartedAtBefore(RetrainingStatus.RUNNING, cutoff));
            stale.addAll(jobs.findByStatusAndCreatedAtBefore(RetrainingStatus.QUEUED, cutoff));
            for (RetrainingJob job : stale) {
                job.setStatus(RetrainingStatus.FAILED);
                job.setErrorMessage(truncate("Marked failed by reconciliation: not completed within "
                    + properties.getScheduler().getStaleJobTimeout() + " (started at " + job.getStartedAt() + ")"));
                job.setCompletedAt(now);
                jobs.save(job);
                datasets.restoreActive(job.getId());
            }
            return stale;
        });
        for (RetrainingJob job : reconciled) {
            log.warn("Stale job reconciled | model={} | job={} | startedAt={}", job.getModelKey(), job.getId(), job.getStartedAt());
            publishTransition(job);
            alerts.retrainingFailed(job);
        }
        return reconciled.size();
    }

    public List<RetrainingJob> history(String modelKey) {
        return jobs.findByModelKeyOrderByCreatedAtDesc(modelKey);
    }

    private Optional<RetrainingJob> latestPromotion(String modelKey, String activeVersion) {
        return jobs.findFirstByModelKeyAndStatusAndNewModelVersionAndRevertedAtIsNullOrderByCompletedAtDesc(
            modelKey, RetrainingStatus.SUCCESS, activeVersion);
    }

    private Optional<RetrainingJob> stillRunning(RetrainingJob job) {
        return jobs.findById(job.getId()).filter(j -> j.getStatus() == RetrainingStatus.RUNNING);
    }

    private RetrainingJob abandoned(RetrainingJob job) {
        RetrainingJob current = jobs.findById(job.getId()).orElse(job);
        log.warn("Retraining result discarded, job no longer running | model={} | job={} | status={}",
                 job.getModelKey(), job.getId(), current.getStatus());
        return current;
    }

    private PersistenceFailureException persistenceFailure(RetrainingJob job, String operation,
                                                           PersistenceFailureException ex) {
        log.error("Retraining persistence failed | model={} | job={} | operation={}",
                  job.getModelKey(), job.getId(), operation, ex);
        return ex;
    }

    private TrainingRequest trainingRequest(StartedJob started) {
        RetrainingJob job = started.job();
        List<String> featureNames = List.of();
        String baselineHash = null;
        try {
            FeatureSnapshotMetadata snapshot = featureStore.metadata(job.getModelKey(), job.getSourceModelVersion());
            featureNames = snapshot.getFeatureNames();
            baselineHash = snapshot.getContentHash();
        } catch (FeatureSnapshotNotFoundException ex) {
            log.warn("No feature snapshot for source version | model={} | version={}",
                     job.getModelKey(), job.getSourceModelVersion());
        }
        List<TrainingRequest.DatasetRef> refs = started.datasets().stream()
            .map(d -> new TrainingRequest.DatasetRef(String.valueOf(d.getId()), d.getDatasetVersion(), d.getItemCount()))
            .toList();
        return new TrainingRequest(job.getModelKey(), job.getSourceModelVersion(), job.getNewModelVersion(),
            refs, properties.getRetraining().getConfidenceThreshold(), featureNames, baselineHash);
    }

    private HoldoutSpec holdout(String modelKey, List<ClientDataset> consumed) {
        return new HoldoutSpec(modelKey, properties.getRetraining().getHoldoutFraction(),
            consumed.stream().map(ClientDataset::getDatasetVersion).toList());
    }

    private ModelMetrics metricsOf(ModelVersion version, ManagedModel model) {
        ModelMetrics stored = json.read(version.getMetrics(), ModelMetrics.class);
        if (stored != null) {
            return stored;
        }
        Double accuracy = version.getAccuracy() != null ? version.getAccuracy() : model.getAccuracy();
        return ModelMetrics.ofAccuracy(accuracy != null ? accuracy : 0.0);
    }

    private void publishTransition(RetrainingJob job) {
        Map<String, Object> payload = new LinkedHashMap<>();
        payload.put("jobId", String.valueOf(job.getId()));
        payload.put("status", job.getStatus().name());
        payload.put("sourceVersion", job.getSourceModelVersion());
        payload.put("candidateVersion", job.getNewModelVersion());
        if (job.getRevertedAt() != null) {
            payload.put("revertedAt", job.getRevertedAt().toString());
        }
        eventBus.publish(new LifecycleEvent(LifecycleEventType.JOB_TRANSITION, job.getModelKey(), clock.instant(), payload));
    }

    private void raiseWatchFailure(String modelKey, RuntimeException cause) {
        try {
            alerts.infrastructureFailure(modelKey, "post-promotion-watch", cause);
        } catch (RuntimeException alertFailure) {
            log.error("Could not raise watch failure alert | model={} | error={}", modelKey, alertFailure.getMessage(), alertFailure);
        }
    }

    private static String truncate(String value) {
        return truncate(value, MAX_ERROR_LENGTH);
    }

    private static String truncate(String value, int maxLength) {
        if (value == null) {
            return null;
        }
        return value.length() <= maxLength ? value : value.substring(0, maxLength);
    }

    private record StartedJob(RetrainingJob job, ModelMetrics oldMetrics, List<ClientDataset> datasets) {}
}
