package net.kairos.core.support;

import net.kairos.core.error.TargetException;
import net.kairos.core.error.TargetRequestException;
import net.kairos.core.error.TargetUnreachableException;
import net.kairos.core.model.RunningExecution;
import net.kairos.core.model.TaskMetrics;
import net.kairos.core.model.TaskResult;
import net.kairos.core.model.TerminationResult;
import net.kairos.core.spi.TaskTargetClient;

import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;

/**
 * 실행 대상 더블. delay 동안 블록하고, 그 사이 terminate 되면 HTTP 500 으로 끝난다.
 */
public class FakeTaskTarget implements TaskTargetClient {
    public final List<String> dispatched = new CopyOnWriteArrayList<>();
    private final Map<String, CountDownLatch> inFlight = new ConcurrentHashMap<>();

    private volatile Duration delay = Duration.ZERO;
    private volatile boolean unreachable;

    public void setDelay(Duration delay) { this.delay = delay; }
    public void setUnreachable(boolean unreachable) { this.unreachable = unreachable; }

    public boolean isRunning(String executionId) { return inFlight.containsKey(executionId); }

    @Override
    public TaskResult dispatch(String target, String message, String executionId, Duration timeout) throws TargetException {
        if (unreachable) throw new TargetUnreachableException(target, "Connection refused", null);
        var killed = new CountDownLatch(1);
        inFlight.put(executionId, killed);
        dispatched.add(executionId);
        try {
            if (!delay.isZero() && killed.await(delay.toMillis(), TimeUnit.MILLISECONDS)) {
                throw new TargetRequestException(target, 500, "Execution terminated");
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new TargetUnreachableException(target, "interrupted", e);
        } finally {
            inFlight.remove(executionId);
        }
        return new TaskResult("done: " + message, new TaskMetrics(1200, 200_000, 300, 0.01), "[]");
    }

    @Override
    public TerminationResult terminate(String target, String executionId) throws TargetException {
        CountDownLatch l = inFlight.get(executionId);
        if (l == null) return new TerminationResult(TerminationResult.Status.NOT_FOUND, null, null);
        l.countDown();
        return new TerminationResult(TerminationResult.Status.TERMINATED, -2, null);
    }

    @Override
    public List<RunningExecution> listRunning(String target) {
        return inFlight.keySet().stream()
                .map(id -> new RunningExecution(id, Instant.now(), Map.of()))
                .toList();
    }

    @Override
    public boolean healthCheck(String target) {
        return !unreachable;
    }
}
