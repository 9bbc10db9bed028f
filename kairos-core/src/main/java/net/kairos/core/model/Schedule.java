package net.kairos.core.model;

import java.time.Instant;

public record Schedule(
        String id,
        String agentName,       // 실행 대상(target) 식별자
        String name,
        String cronExpr,        // 5필드 UNIX cron
        String message,
        boolean enabled,
        String timezone,        // IANA zone id, null = UTC
        String description,
        Instant createdAt,
        Instant updatedAt,      // 변경 감지용
        Instant lastRunAt,
        Instant nextRunAt
) {
    public String zoneOrDefault(String fallback) {
        return timezone == null || timezone.isBlank() ? fallback : timezone;
    }
}
