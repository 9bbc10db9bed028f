package net.kairos.core.service;

import net.kairos.core.model.Execution;
import net.kairos.core.model.TriggerSource;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.atomic.AtomicInteger;

/** 타이머 스레드에서 받은 발화를 디스패치 풀로 넘긴다. 스케줄끼리 동시에 실행된다. */
public final class ScheduleDispatcher implements ScheduleTimerTable.FireHandler {
    private static final Logger log = LoggerFactory.getLogger(ScheduleDispatcher.class);

    private final ScheduleExecutionService executionService;
    private final ExecutorService dispatchPool;
    private final AtomicInteger inFlight = new AtomicInteger();

    public ScheduleDispatcher(ScheduleExecutionService executionService, ExecutorService dispatchPool) {
        this.executionService = executionService;
        this.dispatchPool = dispatchPool;
    }

    @Override
    public void onFire(String scheduleId) {
        submit(scheduleId, TriggerSource.SCHEDULE);
    }

    public CompletableFuture<FireOutcome> submit(String scheduleId, TriggerSource source) {
        return run(() -> executionService.fire(scheduleId, source), "schedule " + scheduleId);
    }

    public CompletableFuture<FireOutcome> submitAdHoc(Execution exec) {
        return run(() -> executionService.dispatchAndRecord(exec, null), "execution " + exec.id());
    }

    public int inFlight() { return inFlight.get(); }

    private CompletableFuture<FireOutcome> run(java.util.function.Supplier<FireOutcome> body, String what) {
        inFlight.incrementAndGet();
        try {
            return CompletableFuture.supplyAsync(body, dispatchPool)
                    .whenComplete((outcome, ex) -> inFlight.decrementAndGet());
        } catch (RejectedExecutionException e) {
            inFlight.decrementAndGet();
            log.warn("Dispatch pool rejected {}: {}", what, e.toString());
            return CompletableFuture.completedFuture(FireOutcome.ERROR);
        }
    }
}
