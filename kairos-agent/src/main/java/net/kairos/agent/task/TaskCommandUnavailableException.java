package net.kairos.agent.task;

/** 설정된 명령을 실행할 수 없다(설치되지 않음, 권한 없음) */
public class TaskCommandUnavailableException extends TaskExecutionException {
    public TaskCommandUnavailableException(String message, Throwable cause) {
        super(message, cause);
    }
}
