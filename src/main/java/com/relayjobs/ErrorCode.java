package com.relayjobs;

import com.fasterxml.jackson.annotation.JsonValue;

public enum ErrorCode {
    PREFLIGHT_REJECTED("PreflightRejected"),
    WAIT_PATTERN_REJECTED("WaitPatternRejected"),
    PROCESS_SPAWN_FAILED("ProcessSpawnFailed"),
    ARTIFACT_TIMEOUT("ArtifactTimeout"),
    ARTIFACT_READ_ERROR("ArtifactReadError"),
    CALLBACK_ENQUEUE_FAILED("CallbackEnqueueFailed"),
    RESTART_RECOVERY_MISMATCH("RestartRecoveryMismatch"),
    NON_ZERO_EXIT("NonZeroExit"),
    CANCELED("canceled"),
    CALLBACK_TASK_FAILED("CallbackTaskFailed"),
    INVALID_REQUEST("InvalidRequest"),
    ILLEGAL_TRANSITION("IllegalTransition"),
    STORE_ERROR("StoreError");

    private final String wire;

    ErrorCode(String wire) {
        this.wire = wire;
    }

    @JsonValue
    public String wire() {
        return wire;
    }

    @Override
    public String toString() {
        return wire;
    }
}
