package com.modelmonitor.service;

import com.modelmonitor.entity.Alert;
import com.modelmonitor.entity.AlertSeverity;
import com.modelmonitor.entity.AlertType;
import com.modelmonitor.entity.DriftCheck;
import com.modelmonitor.entity.RetrainingJob;
import com.modelmonitor.event.LifecycleEvent;
import com.modelmonitor.event.LifecycleEventBus;
import com.modelmonitor.event.LifecycleEventType;
import com.modelmonitor.exception.AlertNotFoundException;
import com.modelmonitor.repository.AlertRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.Clock;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.UUID;

/**
 * Turns lifecycle outcomes into durable alert rows and announces each one on the event bus.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class AlertPublisher {

    private static final int MAX_MESSAGE = 500;

    private final AlertRepository repository;
    private final LifecycleEventBus eventBus;
    private final JsonCodec json;
    private final Clock clock;

    public Alert publish(AlertType type, AlertSeverity severity, String modelKey,
                         String message, Map<String, Object> details) {
        Alert alert = repository.save(Alert.builder()
            .type(type)
            .severity(severity)
            .modelKey(modelKey)
            .message(truncate(message))
            .details(json.write(details != null ? details : Map.of()))
            .createdAt(clock.instant())
            .build());

        if (severity == AlertSeverity.INFO) {
            log.info("Alert raised | type={} | model={} | message={}", type.code(), modelKey, alert.getMessage());
        } else {
            log.warn("Alert raised | type={} | severity={} | model={} | message={}",
                     type.code(), severity, modelKey, alert.getMessage());
        }

        Map<String, Object> payload = new LinkedHashMap<>();
        payload.put("alertId", alert.getId());
        payload.put("type", type.code());
        payload.put("severity", severity.name());
        payload.put("message", alert.getMessage());
        eventBus.publish(new LifecycleEvent(LifecycleEventType.ALERT_RAISED, modelKey, alert.getCreatedAt(), payload));
        return alert;
    }

    public Alert driftDetected(DriftCheck check) {
        Map<String, Object> details = new LinkedHashMap<>();
        details.put("checkDate", check.getCheckDate().toString());
        details.put("modelVersion", check.getModelVersion());
        details.put("psi", check.getPsiValue());
        details.put("jsDivergence", check.getJsDivergence());
        details.put("itemsAnalyzed", check.getItemsAnalyzed());
        details.put("featurePsi", json.readMap(check.getFeaturePsi()));
        return publish(AlertType.DRIFT_DETECTED, AlertSeverity.WARNING, check.getModelKey(),
            String.format("Drift detected on %s (PSI %.4f, JS %.4f)",
                check.getModelVersion(), check.getPsiValue(), check.getJsDivergence()),
            details);
    }

    public Alert retrainingRequired(String modelKey, long pendingItems, long requiredItems) {
        return publish(AlertType.RETRAINING_REQUIRED, AlertSeverity.WARNING, modelKey,
            "Drift detected but only " + pendingItems + " of " + requiredItems + " dataset items are available",
            Map.of("pendingItems", pendingItems, "requiredItems", requiredItems));
    }

    public Alert degradation(RetrainingJob job) {
        return publish(AlertType.MODEL_DEGRADATION, AlertSeverity.CRITICAL, job.getModelKey(),
            String.format("Candidate %s degraded accuracy by %.4f; %s stays active",
                job.getNewModelVersion(), job.getAccuracyDelta(), job.getSourceModelVersion()),
            jobDetails(job));
    }

    public Alert retrainingFailed(RetrainingJob job) {
        return publish(AlertType.RETRAINING_FAILED, AlertSeverity.CRITICAL, job.getModelKey(),
            "Retraining failed: " + job.getErrorMessage(), jobDetails(job));
    }

    public Alert promoted(RetrainingJob job) {
        return publish(AlertType.MODEL_PROMOTED, AlertSeverity.INFO, job.getModelKey(),
            "Version " + job.getNewModelVersion() + " promoted over " + job.getSourceModelVersion(),
            jobDetails(job));
    }

    public Alert rolledBack(RetrainingJob job, String requestedBy, String reason) {
        Map<String, Object> details = jobDetails(job);
        details.put("requestedBy", requestedBy);
        details.put("reason", reason);
        return publish(AlertType.MODEL_ROLLED_BACK, AlertSeverity.WARNING, job.getModelKey(),
            "Rolled back " + job.getNewModelVersion() + " to " + job.getSourceModelVersion() + " (" + reason + ")",
            details);
    }

    public Alert infrastructureFailure(String modelKey, String operation, Throwable error) {
        Map<String, Object> details = new LinkedHashMap<>();
        details.put("operation", operation);
        details.put("error", error.getClass().getSimpleName());
        details.put("message", String.valueOf(error.getMessage()));
        return publish(AlertType.INFRASTRUCTURE_FAILURE, AlertSeverity.CRITICAL, modelKey,
            "Infrastructure failure during " + operation + ": " + error.getMessage(), details);
    }

    /**
     * Stamps the alert as dismissed. Dismissing an already dismissed alert changes nothing.
     */
    @Transactional
    public Alert dismiss(UUID alertId, String dismissedBy) {
        Alert alert = repository.findById(alertId).orElseThrow(() -> new AlertNotFoundException(alertId));
        if (alert.getDismissedAt() != null) {
            return alert;
        }
        alert.setDismissedAt(clock.instant());
        alert.setDismissedBy(dismissedBy);
        Alert saved = repository.save(alert);
        log.info("Alert dismissed | id={} | by={}", alertId, dismissedBy);
        eventBus.publish(new LifecycleEvent(LifecycleEventType.ALERT_DISMISSED, alert.getModelKey(),
            saved.getDismissedAt(), Map.of("alertId", alertId, "dismissedBy", String.valueOf(dismissedBy))));
        return saved;
    }

    public List<Alert> active() {
        return repository.findByDismissedAtIsNullOrderByCreatedAtDesc();
    }

    public List<Alert> forModel(String modelKey) {
        return repository.findByModelKeyOrderByCreatedAtDesc(modelKey);
    }

    private Map<String, Object> jobDetails(RetrainingJob job) {
        Map<String, Object> details = new LinkedHashMap<>();
        details.put("jobId", String.valueOf(job.getId()));
        details.put("trigger", String.valueOf(job.getTrigger()));
        details.put("sourceVersion", job.getSourceModelVersion());
        details.put("candidateVersion", job.getNewModelVersion());
        details.put("accuracyDelta", job.getAccuracyDelta());
        details.put("oldMetrics", json.readMap(job.getOldMetrics()));
        details.put("newMetrics", json.readMap(job.getNewMetrics()));
        if (job.getErrorMessage() != null) {
            details.put("error", job.getErrorMessage());
        }
        return details;
    }

    private static String truncate(String message) {
        if (message == null) {
            return "";
        }
        return message.length() <= MAX_MESSAGE ? message : message.substring(0, MAX_MESSAGE - 3) + "...";
    }
}
