package io.stackwarden.orchestrator.api;

/**
 * Body of every rejected request.
 */
public record ErrorResponse(String reason, String message, boolean retryable) {
}
