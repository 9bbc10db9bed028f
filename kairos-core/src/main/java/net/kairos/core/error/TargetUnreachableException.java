package net.kairos.core.error;

public class TargetUnreachableException extends TargetException {
    public TargetUnreachableException(String target, String message, Throwable cause) {
        super(target, message, cause);
    }

    @Override
    public String describe() {
        return "Agent not reachable: " + getMessage();
    }
}
