package io.stackwarden.orchestrator.domain;

public enum ProgressOutcome {
    STARTED,
    SUCCEEDED,
    FAILED,
    SKIPPED,
    WARNING
}
