package io.stackwarden.orchestrator.app;

import io.stackwarden.orchestrator.domain.ReasonCode;

/**
 * Outcome of handing the orchestrator's own container over to the replacement helper. Once
 * accepted, the swap itself is the helper's job.
 */
public record SelfReplacementResult(boolean accepted,
                                    String message,
                                    String replacementName,
                                    String helperName,
                                    ReasonCode reason) {

    public static SelfReplacementResult accepted(String message, String replacementName, String helperName) {
        return new SelfReplacementResult(true, message, replacementName, helperName, null);
    }

    public static SelfReplacementResult rejected(ReasonCode reason, String message) {
        return new SelfReplacementResult(false, message, null, null, reason);
    }
}
