package net.kairos.core.spi;

import java.time.Duration;

/**
 * 분산 락 저장소. 모든 연산은 저장소 측에서 원자적으로 수행되어야 한다
 * (GET 후 DEL 같은 2단계 구현 금지).
 */
public interface LockStore {
    /** SET key token NX + TTL */
    boolean setIfAbsent(String key, String token, Duration ttl) throws Exception;

    /** 값이 token과 같을 때만 삭제 */
    boolean compareAndDelete(String key, String token) throws Exception;

    /** 값이 token과 같을 때만 TTL 연장 */
    boolean compareAndExpire(String key, String token, Duration ttl) throws Exception;

    boolean exists(String key) throws Exception;

    /** 무조건 SET + TTL (하트비트용) */
    void put(String key, String value, Duration ttl) throws Exception;
}
