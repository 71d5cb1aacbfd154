package io.stackwarden.orchestrator.domain;

public class OperationInProgressException extends StackOperationException {
    private final String environmentId;

    public OperationInProgressException(String environmentId, String runningOperation) {
        super(ReasonCode.OPERATION_IN_PROGRESS,
            "Environment " + environmentId + " is busy with " + runningOperation + "; retry later");
        this.environmentId = environmentId;
    }

    public String environmentId() {
        return environmentId;
    }
}
