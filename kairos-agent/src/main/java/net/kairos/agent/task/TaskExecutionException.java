package net.kairos.agent.task;

/** 0 이 아닌 종료 코드, 빈 응답, 실행 자체의 실패 */
public class TaskExecutionException extends Exception {
    private final Integer exitCode;

    public TaskExecutionException(String message, Integer exitCode) {
        super(message);
        this.exitCode = exitCode;
    }

    public TaskExecutionException(String message, Throwable cause) {
        super(message, cause);
        this.exitCode = null;
    }

    public Integer exitCode() {
        return exitCode;
    }
}
