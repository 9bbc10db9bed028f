package net.kairos.core.service;

import net.kairos.core.error.ExecutionNotFoundException;
import net.kairos.core.error.TargetException;
import net.kairos.core.model.CancellationResult;
import net.kairos.core.model.Execution;
import net.kairos.core.model.ExecutionEvent;
import net.kairos.core.model.TerminationResult;
import net.kairos.core.spi.Clock;
import net.kairos.core.spi.ExecutionEventPublisher;
import net.kairos.core.spi.ExecutionRepository;
import net.kairos.core.spi.TaskTargetClient;
import net.kairos.core.spi.TxRunner;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * 협조적 취소. 실행 대상의 종료 엔드포인트를 호출한 뒤 기록을 조건부로 cancelled 처리한다.
 * 대상이 already_finished 를 돌려주면 디스패치 쪽이 결과를 기록하도록 기록은 건드리지 않는다.
 */
public final class ExecutionCancellationService {
    private static final Logger log = LoggerFactory.getLogger(ExecutionCancellationService.class);

    public static final String DEFAULT_REASON = "Cancelled by operator";

    private final ExecutionRepository executions;
    private final TaskTargetClient target;
    private final ExecutionEventPublisher events;
    private final TxRunner tx;
    private final CancellationTracker tracker;
    private final Clock clock;

    public ExecutionCancellationService(ExecutionRepository executions,
                                        TaskTargetClient target,
                                        ExecutionEventPublisher events,
                                        TxRunner tx,
                                        CancellationTracker tracker,
                                        Clock clock) {
        this.executions = executions;
        this.target = target;
        this.events = events;
        this.tx = tx;
        this.tracker = tracker;
        this.clock = clock;
    }

    public CancellationResult cancel(String executionId) throws Exception {
        Execution exec = executions.findById(executionId)
                .orElseThrow(() -> new ExecutionNotFoundException(executionId));
        if (exec.status().terminal()) {
            return new CancellationResult(executionId,
                    new TerminationResult(TerminationResult.Status.ALREADY_FINISHED, null, null), exec.status());
        }

        tracker.begin(executionId);
        boolean cancelled = false;
        TerminationResult termination;
        try {
            try {
                termination = target.terminate(exec.agentName(), executionId);
            } catch (TargetException e) {
                log.warn("Terminate of execution {} on agent {} failed: {}", executionId, exec.agentName(), e.describe());
                termination = new TerminationResult(TerminationResult.Status.ERROR, null, e.describe());
            }

            // not_found: 대상에 프로세스가 없으면 running 기록이 남지 않도록 정리
            if (termination.status() == TerminationResult.Status.TERMINATED
                    || termination.status() == TerminationResult.Status.NOT_FOUND) {
                cancelled = tx.required(() -> executions.cancelIfRunning(executionId, DEFAULT_REASON, clock.now()));
                if (cancelled) {
                    log.info("Execution {} cancelled ({})", executionId, termination.status().code());
                    publish(ExecutionEvent.completed(exec, Execution.Status.CANCELLED, null));
                }
            }
        } finally {
            tracker.finish(executionId, cancelled);
        }

        Execution.Status current = executions.findById(executionId)
                .map(Execution::status).orElse(Execution.Status.UNKNOWN);
        return new CancellationResult(executionId, termination, current);
    }

    private void publish(ExecutionEvent event) {
        try {
            events.publish(event);
        } catch (Exception e) {
            log.warn("Failed to publish {} event: {}", event.type().code(), e.toString());
        }
    }
}
