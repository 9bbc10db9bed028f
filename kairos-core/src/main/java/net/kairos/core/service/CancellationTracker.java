package net.kairos.core.service;

import net.kairos.core.spi.Clock;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.time.Instant;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

/**
 * 이 프로세스에서 요청된 취소. 종료 요청 때문에 디스패치가 끝나면
 * 디스패치 쪽은 결과를 기록하기 전에 취소 결과를 기다리고, 취소 쪽이 기록과 이벤트를 맡는다.
 * 끝난 항목은 maxWait 동안 남겨 두어 늦게 돌아온 디스패치도 확인할 수 있다.
 */
public final class CancellationTracker {
    private static final Logger log = LoggerFactory.getLogger(CancellationTracker.class);

    private record Entry(CompletableFuture<Boolean> result, Instant startedAt) {}

    private final Map<String, Entry> entries = new ConcurrentHashMap<>();
    private final Clock clock;
    private final Duration maxWait;

    public CancellationTracker(Clock clock, Duration maxWait) {
        this.clock = clock;
        this.maxWait = maxWait;
    }

    void begin(String executionId) {
        purgeExpired();
        entries.put(executionId, new Entry(new CompletableFuture<>(), clock.now()));
    }

    /** @param cancelled 기록이 이 요청으로 cancelled 가 됐는지 */
    void finish(String executionId, boolean cancelled) {
        Entry e = entries.get(executionId);
        if (e != null) e.result.complete(cancelled);
    }

    public boolean isPending(String executionId) {
        Entry e = entries.get(executionId);
        return e != null && !e.result.isDone();
    }

    /** 이 프로세스의 취소 요청이 기록을 cancelled 로 만들었는지. 요청이 없었으면 즉시 false */
    boolean awaitCancelled(String executionId) {
        Entry e = entries.get(executionId);
        if (e == null) return false;
        try {
            return e.result.get(maxWait.toMillis(), TimeUnit.MILLISECONDS);
        } catch (TimeoutException ex) {
            log.warn("Cancellation of execution {} still pending after {}", executionId, maxWait);
            return false;
        } catch (InterruptedException ex) {
            Thread.currentThread().interrupt();
            return false;
        } catch (ExecutionException ex) {
            return false;
        }
    }

    int size() { return entries.size(); }

    private void purgeExpired() {
        Instant cutoff = clock.now().minus(maxWait);
        entries.entrySet().removeIf(en -> en.getValue().result.isDone() && en.getValue().startedAt.isBefore(cutoff));
    }
}
