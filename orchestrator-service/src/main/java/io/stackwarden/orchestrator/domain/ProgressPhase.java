package io.stackwarden.orchestrator.domain;

public enum ProgressPhase {
    NETWORK,
    PULL,
    REMOVE_EXISTING,
    CREATE,
    START,
    VERIFY,
    AWAIT_EXIT,
    STOP,
    REMOVE,
    COMPLETE
}
