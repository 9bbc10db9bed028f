package net.kairos.core.error;

public class ExecutionNotFoundException extends RuntimeException {
    private final String executionId;

    public ExecutionNotFoundException(String executionId) {
        super("Execution " + executionId + " not found");
        this.executionId = executionId;
    }

    public String executionId() { return executionId; }
}
