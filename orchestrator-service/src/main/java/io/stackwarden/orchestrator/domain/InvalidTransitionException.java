package io.stackwarden.orchestrator.domain;

public class InvalidTransitionException extends StackOperationException {

    public InvalidTransitionException(String message) {
        super(ReasonCode.INVALID_TRANSITION, message);
    }

    public InvalidTransitionException(ReasonCode reason, String message) {
        super(reason, message);
    }

    public static InvalidTransitionException of(StackKey key, OperationMode from, String operation) {
        return new InvalidTransitionException(
            "Cannot " + operation + " stack " + key + " while it is " + from);
    }
}
