package net.kairos.core.lock;

import net.kairos.core.spi.LockStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.security.SecureRandom;
import java.time.Duration;
import java.util.HexFormat;
import java.util.Optional;
import java.util.concurrent.ScheduledExecutorService;

/** 스케줄 실행 락 획득/조회, 인스턴스 하트비트 */
public final class LockManager {
    private static final Logger log = LoggerFactory.getLogger(LockManager.class);

    public static final String LOCK_PREFIX = "scheduler:lock:";
    public static final String HEARTBEAT_PREFIX = "scheduler:heartbeat:";

    private final LockStore store;
    private final ScheduledExecutorService renewer;
    private final Duration defaultTtl;
    private final boolean autoRenewal;
    private final SecureRandom random = new SecureRandom();

    public LockManager(LockStore store,
                       ScheduledExecutorService renewer,
                       Duration defaultTtl,
                       boolean autoRenewal) {
        this.store = store;
        this.renewer = renewer;
        this.defaultTtl = defaultTtl;
        this.autoRenewal = autoRenewal;
    }

    public static String scheduleLockName(String scheduleId) {
        return "schedule:" + scheduleId;
    }

    /**
     * 비차단 획득. 경합은 정상 결과이므로 empty로 돌려준다.
     * 저장소 장애도 empty (중복 실행보다 이번 발화를 건너뛰는 쪽을 택함).
     */
    public Optional<DistributedLock> tryAcquire(String name, Duration ttl) {
        String key = LOCK_PREFIX + name;
        String token = newToken();
        boolean acquired;
        try {
            acquired = store.setIfAbsent(key, token, ttl);
        } catch (Exception e) {
            log.warn("Lock store unavailable while acquiring {}: {}", key, e.toString());
            return Optional.empty();
        }
        if (!acquired) return Optional.empty();

        var lock = new DistributedLock(store, key, token, ttl);
        if (autoRenewal) lock.startRenewal(renewer);
        return Optional.of(lock);
    }

    public Optional<DistributedLock> tryAcquireScheduleLock(String scheduleId) {
        return tryAcquire(scheduleLockName(scheduleId), defaultTtl);
    }

    public boolean isScheduleLocked(String scheduleId) {
        try {
            return store.exists(LOCK_PREFIX + scheduleLockName(scheduleId));
        } catch (Exception e) {
            log.warn("Lock store unavailable while checking schedule {}: {}", scheduleId, e.toString());
            return false;
        }
    }

    /** 인스턴스 생존 표시. 실패는 로그만 */
    public boolean heartbeat(String instanceId, Duration ttl) {
        try {
            store.put(HEARTBEAT_PREFIX + instanceId, "alive", ttl);
            return true;
        } catch (Exception e) {
            log.warn("Heartbeat for {} failed: {}", instanceId, e.toString());
            return false;
        }
    }

    public Duration defaultTtl() { return defaultTtl; }

    private String newToken() {
        byte[] bytes = new byte[16];
        random.nextBytes(bytes);
        return HexFormat.of().formatHex(bytes);
    }
}
