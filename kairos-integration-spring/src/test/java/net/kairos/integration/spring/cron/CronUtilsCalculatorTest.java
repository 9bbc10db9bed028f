package net.kairos.integration.spring.cron;

import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.time.ZoneId;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class CronUtilsCalculatorTest {
    private final CronUtilsCalculator cron = new CronUtilsCalculator();
    private static final ZoneId UTC = ZoneId.of("UTC");

    @Test
    void every_five_minutes_rounds_up_to_next_slot() {
        Instant from = Instant.parse("2024-03-01T10:02:30Z");
        assertThat(cron.next(from, "*/5 * * * *", UTC)).isEqualTo(Instant.parse("2024-03-01T10:05:00Z"));
    }

    @Test
    void exact_slot_boundary_returns_following_slot() {
        Instant from = Instant.parse("2024-03-01T10:05:00Z");
        assertThat(cron.next(from, "*/5 * * * *", UTC)).isEqualTo(Instant.parse("2024-03-01T10:10:00Z"));
    }

    @Test
    void daily_expression_is_evaluated_in_schedule_zone() {
        // 09:00 서울 = 00:00 UTC
        Instant from = Instant.parse("2024-03-01T01:00:00Z");
        assertThat(cron.next(from, "0 9 * * *", ZoneId.of("Asia/Seoul")))
                .isEqualTo(Instant.parse("2024-03-02T00:00:00Z"));
    }

    @Test
    void weekday_field_is_honoured() {
        // 2024-03-01은 금요일
        Instant from = Instant.parse("2024-03-01T12:00:00Z");
        assertThat(cron.next(from, "30 8 * * 1", UTC)).isEqualTo(Instant.parse("2024-03-04T08:30:00Z"));
    }

    @Test
    void invalid_expressions_are_rejected() {
        Instant now = Instant.now();
        assertThatThrownBy(() -> cron.next(now, "not a cron", UTC)).isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> cron.next(now, "0 0 * * * *", UTC)).isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> cron.next(now, "61 * * * *", UTC)).isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> cron.next(now, " ", UTC)).isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void parsed_expressions_are_cached_up_to_the_limit() {
        CronUtilsCalculator small = new CronUtilsCalculator(2);
        Instant from = Instant.parse("2024-03-01T10:00:00Z");

        small.next(from, "*/5 * * * *", UTC);
        small.next(from, " */5 * * * * ", UTC);
        assertThat(small.cachedExpressions()).isEqualTo(1);

        small.next(from, "0 * * * *", UTC);
        small.next(from, "0 0 * * *", UTC);
        assertThat(small.cachedExpressions()).isEqualTo(2);
    }
}
