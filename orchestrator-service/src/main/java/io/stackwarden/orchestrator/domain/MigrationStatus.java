package io.stackwarden.orchestrator.domain;

public enum MigrationStatus {
    NONE,
    RUNNING,
    SUCCEEDED,
    FAILED
}
