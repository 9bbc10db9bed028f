package net.kairos.integration.spring.cron;

import com.cronutils.model.CronType;
import com.cronutils.model.definition.CronDefinitionBuilder;
import com.cronutils.model.time.ExecutionTime;
import com.cronutils.parser.CronParser;
import net.kairos.core.spi.CronCalculator;

import java.time.Instant;
import java.time.ZoneId;
import java.time.ZonedDateTime;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * cron-utils 구현. 플랫폼이 저장하는 5필드 UNIX 표현식을 쓴다.
 * 파싱 결과는 표현식 문자열로 LRU 캐시한다(스케줄마다 매 발화 재파싱 방지).
 */
public final class CronUtilsCalculator implements CronCalculator {
    static final int DEFAULT_CACHE_SIZE = 256;

    private final CronParser parser = new CronParser(CronDefinitionBuilder.instanceDefinitionFor(CronType.UNIX));
    private final Map<String, ExecutionTime> cache;

    public CronUtilsCalculator() {
        this(DEFAULT_CACHE_SIZE);
    }

    public CronUtilsCalculator(int cacheSize) {
        this.cache = new LinkedHashMap<>(16, 0.75f, true) {
            @Override
            protected boolean removeEldestEntry(Map.Entry<String, ExecutionTime> eldest) {
                return size() > cacheSize;
            }
        };
    }

    @Override
    public Instant next(Instant after, String cronExpr, ZoneId zone) {
        Objects.requireNonNull(after, "after");
        Objects.requireNonNull(zone, "zone");
        ExecutionTime et = executionTime(cronExpr);

        ZonedDateTime base = after.atZone(zone);
        Optional<ZonedDateTime> next = et.nextExecution(base);
        // 정각 경계에서 같은 슬롯이 돌아오는 경우가 있어 after 를 넘을 때까지 전진
        while (next.isPresent() && !next.get().toInstant().isAfter(after)) {
            next = et.nextExecution(next.get().plusSeconds(1));
        }
        return next
                .orElseThrow(() -> new IllegalArgumentException("No next execution for [" + cronExpr + "] after " + base))
                .toInstant();
    }

    int cachedExpressions() {
        synchronized (cache) {
            return cache.size();
        }
    }

    private ExecutionTime executionTime(String cronExpr) {
        if (cronExpr == null || cronExpr.isBlank()) {
            throw new IllegalArgumentException("Cron expression is empty");
        }
        String expr = cronExpr.trim();
        synchronized (cache) {
            ExecutionTime cached = cache.get(expr);
            if (cached != null) return cached;
        }
        ExecutionTime et;
        try {
            et = ExecutionTime.forCron(parser.parse(expr));
        } catch (IllegalArgumentException e) {
            throw new IllegalArgumentException("Invalid cron expression [" + expr + "]: " + e.getMessage(), e);
        }
        synchronized (cache) {
            cache.put(expr, et);
        }
        return et;
    }
}
