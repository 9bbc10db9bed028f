package net.kairos.core.spi;

import net.kairos.core.error.TargetException;
import net.kairos.core.model.RunningExecution;
import net.kairos.core.model.TaskResult;
import net.kairos.core.model.TerminationResult;

import java.time.Duration;
import java.util.List;

public interface TaskTargetClient {
    /** executionId는 대상 쪽 프로세스 레지스트리 키로 그대로 쓰인다 */
    TaskResult dispatch(String target, String message, String executionId, Duration timeout) throws TargetException;

    TerminationResult terminate(String target, String executionId) throws TargetException;

    List<RunningExecution> listRunning(String target) throws TargetException;

    boolean healthCheck(String target);
}
