package com.modelmonitor.entity;

import com.fasterxml.jackson.annotation.JsonValue;

public enum AlertType {
    DRIFT_DETECTED("drift_detected"),
    MODEL_DEGRADATION("model_degradation"),
    RETRAINING_REQUIRED("retraining_required"),
    RETRAINING_FAILED("retraining_failed"),
    MODEL_PROMOTED("model_promoted"),
    MODEL_ROLLED_BACK("model_rolled_back"),
    INFRASTRUCTURE_FAILURE("infrastructure_failure");

    private final String code;

    AlertType(String code) {
        this.code = code;
    }

    @JsonValue
    public String code() {
        return code;
    }
}
