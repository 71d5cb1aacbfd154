package io.stackwarden.orchestrator.domain;

public enum DeploymentStatus {
    IDLE,
    DEPLOYING,
    UPGRADING,
    ROLLING_BACK,
    FAILED
}
