package net.kairos.core.lock;

import net.kairos.core.spi.LockStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * 획득에 성공한 락 한 건. 토큰으로 소유권을 확인한 뒤에만 연장/해제한다.
 * 갱신 실패(키 소실, 다른 토큰)는 lost로 표시만 하고 진행 중인 작업을 끊지 않는다.
 */
public final class DistributedLock implements AutoCloseable {
    private static final Logger log = LoggerFactory.getLogger(DistributedLock.class);

    private final LockStore store;
    private final String key;
    private final String token;
    private final Duration ttl;

    private final AtomicBoolean released = new AtomicBoolean(false);
    private volatile boolean lost;
    private volatile ScheduledFuture<?> renewal;

    DistributedLock(LockStore store, String key, String token, Duration ttl) {
        this.store = store;
        this.key = key;
        this.token = token;
        this.ttl = ttl;
    }

    public String key() { return key; }
    public String token() { return token; }
    public Duration ttl() { return ttl; }

    /** 갱신 중 소유권 상실이 관측됨 */
    public boolean isLost() { return lost; }

    public boolean isReleased() { return released.get(); }

    public boolean isRenewing() {
        var f = renewal;
        return f != null && !f.isDone();
    }

    /** TTL의 절반 주기로 연장 */
    void startRenewal(ScheduledExecutorService renewer) {
        long periodMs = Math.max(1, ttl.toMillis() / 2);
        renewal = renewer.scheduleAtFixedRate(this::renewOnce, periodMs, periodMs, TimeUnit.MILLISECONDS);
    }

    void renewOnce() {
        if (released.get() || lost) return;
        try {
            if (store.compareAndExpire(key, token, ttl)) {
                log.debug("Lock {} renewed for {}ms", key, ttl.toMillis());
                return;
            }
            if (released.get()) return; // release와 경합
            lost = true;
            log.warn("Lock {} renewal failed - lock lost", key);
        } catch (Exception e) {
            log.error("Error renewing lock {}: {}", key, e.toString());
        }
        stopRenewal();
    }

    private void stopRenewal() {
        var f = renewal;
        if (f != null) f.cancel(false);
    }

    /**
     * 갱신을 멈추고 토큰이 일치할 때만 키를 지운다. 두 번째 호출부터는 no-op.
     * @return 실제로 키를 지웠으면 true
     */
    public boolean release() {
        if (!released.compareAndSet(false, true)) return false;
        stopRenewal();
        try {
            boolean deleted = store.compareAndDelete(key, token);
            if (!deleted) log.debug("Lock {} was not owned at release (expired or taken over)", key);
            return deleted;
        } catch (Exception e) {
            log.warn("Failed to release lock {}: {} (will expire in {}ms)", key, e.toString(), ttl.toMillis());
            return false;
        }
    }

    @Override
    public void close() {
        release();
    }

    @Override
    public String toString() {
        return "DistributedLock{key='" + key + "', ttl=" + ttl + ", lost=" + lost + ", released=" + released.get() + '}';
    }
}
