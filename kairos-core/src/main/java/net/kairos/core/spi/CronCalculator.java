package net.kairos.core.spi;

import java.time.Instant;
import java.time.ZoneId;

/**
 * 스케줄 cron 표현식의 다음 발화 시각.
 * 표현식은 zone 의 벽시계 기준으로 해석하고, 결과는 항상 after 보다 뒤다.
 */
public interface CronCalculator {
    /** @throws IllegalArgumentException 표현식이 비었거나 잘못됐거나, 다음 발화가 없는 경우 */
    Instant next(Instant after, String cronExpr, ZoneId zone);
}
