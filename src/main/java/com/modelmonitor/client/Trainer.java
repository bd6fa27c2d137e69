package com.modelmonitor.client;

import com.modelmonitor.dto.HoldoutSpec;
import com.modelmonitor.dto.ModelArtifact;
import com.modelmonitor.dto.ModelMetrics;
import com.modelmonitor.dto.TrainingRequest;
import com.modelmonitor.dto.TrainingResult;
import com.modelmonitor.exception.TrainingException;

/**
 * External training backend. Implementations block until the call completes.
 */
public interface Trainer {

    /**
     * @throws TrainingException when training fails or the backend cannot be reached
     */
    TrainingResult train(TrainingRequest request);

    /**
     * Scores {@code artifact} on the held-out split described by {@code holdout}.
     *
     * @throws TrainingException when evaluation fails or the backend cannot be reached
     */
    ModelMetrics evaluate(ModelArtifact artifact, HoldoutSpec holdout);
}
