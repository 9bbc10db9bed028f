package net.kairos.core.error;

import java.time.Duration;

public class TargetTimeoutException extends TargetException {
    private final Duration timeout;

    public TargetTimeoutException(String target, Duration timeout, Throwable cause) {
        super(target, "Request to agent " + target + " timed out after " + timeout.toSeconds() + "s", cause);
        this.timeout = timeout;
    }

    public Duration timeout() { return timeout; }

    @Override
    public String describe() {
        return getMessage();
    }
}
