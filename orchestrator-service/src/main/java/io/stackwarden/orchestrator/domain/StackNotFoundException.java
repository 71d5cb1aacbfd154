package io.stackwarden.orchestrator.domain;

public class StackNotFoundException extends StackOperationException {

    public StackNotFoundException(String message) {
        super(ReasonCode.STACK_NOT_FOUND, message);
    }

    public static StackNotFoundException stack(StackKey key) {
        return new StackNotFoundException("Stack " + key + " is not known");
    }
}
