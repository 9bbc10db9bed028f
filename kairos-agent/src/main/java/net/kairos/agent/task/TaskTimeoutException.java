package net.kairos.agent.task;

import java.time.Duration;

public class TaskTimeoutException extends Exception {
    private final Duration timeout;

    public TaskTimeoutException(Duration timeout) {
        super("Task execution timed out after " + timeout.toSeconds() + " seconds");
        this.timeout = timeout;
    }

    public Duration timeout() {
        return timeout;
    }
}
