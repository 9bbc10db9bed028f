package net.kairos.core.spi;

import net.kairos.core.model.Execution;
import net.kairos.core.model.TaskResult;

import java.time.Instant;
import java.util.List;
import java.util.Optional;

public interface ExecutionRepository {
    /** RUNNING 상태로 INSERT (id는 호출자가 생성) */
    Execution create(Execution running) throws Exception;

    /**
     * 종료 상태 기록. STATUS='running' 인 경우에만 갱신(조건부 UPDATE 1회).
     * @return false = 이미 종료 상태(예: cancelled)라서 덮어쓰지 않음
     */
    boolean completeIfRunning(String id, Execution.Status status, TaskResult result,
                              String error, Instant completedAt) throws Exception;

    /** RUNNING → CANCELLED. 이미 종료됐으면 false */
    boolean cancelIfRunning(String id, String reason, Instant completedAt) throws Exception;

    Optional<Execution> findById(String id) throws Exception;
    List<Execution> findRecent(int limit) throws Exception;
}
