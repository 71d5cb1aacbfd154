package io.stackwarden.orchestrator.domain;

import java.util.Locale;

public enum OperationKind {
    DEPLOY,
    UPGRADE,
    ROLLBACK,
    ENTER_MAINTENANCE,
    EXIT_MAINTENANCE,
    STOP,
    START,
    REMOVE,
    RECOVER,
    SELF_REPLACE;

    public String label() {
        return name().toLowerCase(Locale.ROOT).replace('_', ' ');
    }
}
