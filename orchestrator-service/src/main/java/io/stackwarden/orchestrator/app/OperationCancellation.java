package io.stackwarden.orchestrator.app;

import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Cooperative cancellation flag checked between plan steps. A step that already started always
 * runs to completion.
 */
public final class OperationCancellation {
    private final AtomicBoolean cancelled = new AtomicBoolean();

    public void cancel() {
        cancelled.set(true);
    }

    public boolean isCancelled() {
        return cancelled.get();
    }

    public static OperationCancellation none() {
        return new OperationCancellation();
    }
}
