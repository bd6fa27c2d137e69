package com.modelmonitor.service;

import com.modelmonitor.dto.FeatureTransformers;
import com.modelmonitor.dto.ModelMetrics;
import com.modelmonitor.entity.ManagedModel;
import com.modelmonitor.entity.ModelStatus;
import com.modelmonitor.entity.ModelVersion;
import com.modelmonitor.exception.ModelNotFoundException;
import com.modelmonitor.exception.ModelRegistrationException;
import com.modelmonitor.repository.ManagedModelRepository;
import com.modelmonitor.repository.ModelVersionRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.Clock;
import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.regex.Pattern;

@Slf4j
@Service
@RequiredArgsConstructor
public class ModelRegistryService {

    static final Pattern VERSION_PATTERN = Pattern.compile("^[a-zA-Z0-9._-]{1,64}$");
    private static final Pattern KEY_PATTERN = Pattern.compile("^[a-zA-Z0-9._:-]{1,128}$");

    private final ManagedModelRepository models;
    private final ModelVersionRepository versions;
    private final FeatureStore featureStore;
    private final JsonCodec json;
    private final Clock clock;

    /**
     * Creates the model with its first ACTIVE version and stores the version's transformers.
     */
    @Transactional
    public ManagedModel register(String modelKey, String initialVersion, String artifactUri,
                                 ModelMetrics metrics, FeatureTransformers transformers) {
        if (modelKey == null || !KEY_PATTERN.matcher(modelKey).matches()) {
            throw new ModelRegistrationException("Model key must match " + KEY_PATTERN.pattern());
        }
        if (initialVersion == null || !VERSION_PATTERN.matcher(initialVersion).matches()) {
            throw new ModelRegistrationException("Model version must match " + VERSION_PATTERN.pattern());
        }
        if (models.existsById(modelKey)) {
            throw new ModelRegistrationException("Model '" + modelKey + "' is already registered.");
        }

        Instant now = clock.instant();
        Double accuracy = metrics != null ? metrics.accuracy() : null;
        featureStore.save(modelKey, initialVersion, transformers);
        versions.save(ModelVersion.builder()
            .modelKey(modelKey)
            .version(initialVersion)
            .status(ModelStatus.ACTIVE)
            .accuracy(accuracy)
            .metrics(json.write(metrics))
            .trainingMetadata(json.write(Map.of("registeredAt", now.toString())))
            .artifactUri(artifactUri)
            .createdAt(now)
            .build());
        ManagedModel model = models.save(ManagedModel.builder()
            .modelKey(modelKey)
            .activeVersion(initialVersion)
            .status(ModelStatus.ACTIVE)
            .accuracy(accuracy)
            .lastTrained(now)
            .createdAt(now)
            .updatedAt(now)
            .build());
        log.info("Model registered | model={} | version={} | accuracy={}", modelKey, initialVersion, accuracy);
        return model;
    }

    public ManagedModel get(String modelKey) {
        return models.findById(modelKey).orElseThrow(() -> new ModelNotFoundException(modelKey));
    }

    public List<ManagedModel> activeModels() {
        return models.findByStatusOrderByModelKeyAsc(ModelStatus.ACTIVE);
    }

    /**
     * Reads the committed pointer; promotion and rollback change it atomically, so a caller sees
     * either the old or the new version.
     */
    @Transactional(readOnly = true)
    public String activeVersion(String modelKey) {
        return get(modelKey).getActiveVersion();
    }

    public ModelVersion version(String modelKey, String version) {
        return versions.findByModelKeyAndVersion(modelKey, version)
            .orElseThrow(() -> new ModelNotFoundException(modelKey, version));
    }

    public List<ModelVersion> versions(String modelKey) {
        return versions.findByModelKeyOrderByCreatedAtDesc(modelKey);
    }
}
