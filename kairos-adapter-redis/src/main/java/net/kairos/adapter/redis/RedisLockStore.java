package net.kairos.adapter.redis;

import net.kairos.core.spi.LockStore;
import org.springframework.data.redis.core.StringRedisTemplate;
import org.springframework.data.redis.core.script.DefaultRedisScript;
import org.springframework.data.redis.core.script.RedisScript;

import java.time.Duration;
import java.util.List;

/**
 * Redis 락 저장소. 소유권 확인이 필요한 연산은 Lua 스크립트로 서버에서 원자적으로 실행한다.
 */
public final class RedisLockStore implements LockStore {

    static final RedisScript<Long> COMPARE_AND_DELETE = new DefaultRedisScript<>("""
            if redis.call('get', KEYS[1]) == ARGV[1] then
                return redis.call('del', KEYS[1])
            else
                return 0
            end
            """, Long.class);

    static final RedisScript<Long> COMPARE_AND_EXPIRE = new DefaultRedisScript<>("""
            if redis.call('get', KEYS[1]) == ARGV[1] then
                return redis.call('pexpire', KEYS[1], ARGV[2])
            else
                return 0
            end
            """, Long.class);

    private final StringRedisTemplate redis;

    public RedisLockStore(StringRedisTemplate redis) {
        this.redis = redis;
    }

    @Override
    public boolean setIfAbsent(String key, String token, Duration ttl) {
        return Boolean.TRUE.equals(redis.opsForValue().setIfAbsent(key, token, ttl));
    }

    @Override
    public boolean compareAndDelete(String key, String token) {
        Long n = redis.execute(COMPARE_AND_DELETE, List.of(key), token);
        return n != null && n > 0;
    }

    @Override
    public boolean compareAndExpire(String key, String token, Duration ttl) {
        Long n = redis.execute(COMPARE_AND_EXPIRE, List.of(key), token, String.valueOf(ttl.toMillis()));
        return n != null && n > 0;
    }

    @Override
    public boolean exists(String key) {
        return Boolean.TRUE.equals(redis.hasKey(key));
    }

    @Override
    public void put(String key, String value, Duration ttl) {
        redis.opsForValue().set(key, value, ttl);
    }
}
