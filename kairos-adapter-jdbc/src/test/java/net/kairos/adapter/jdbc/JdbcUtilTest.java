package net.kairos.adapter.jdbc;

import org.junit.jupiter.api.Test;

import java.time.Instant;

import static org.junit.jupiter.api.Assertions.*;

class JdbcUtilTest {

    @Test
    void writes_naive_utc_with_microseconds() {
        assertEquals("2026-01-02T03:04:00.000000", JdbcUtil.text(Instant.parse("2026-01-02T03:04:00Z")));
        assertEquals("2026-01-02T03:04:05.123456", JdbcUtil.text(Instant.parse("2026-01-02T03:04:05.123456789Z")));
        assertNull(JdbcUtil.text(null));
    }

    @Test
    void reads_platform_and_sqlite_formats() {
        Instant expected = Instant.parse("2026-01-02T03:04:05Z");
        assertEquals(expected, JdbcUtil.toInstant("2026-01-02T03:04:05"));
        assertEquals(expected, JdbcUtil.toInstant("2026-01-02 03:04:05"));
        assertEquals(expected, JdbcUtil.toInstant("2026-01-02T03:04:05Z"));
        assertEquals(expected, JdbcUtil.toInstant("2026-01-02T12:04:05+09:00"));
        assertEquals(Instant.parse("2026-01-02T03:04:05.250Z"), JdbcUtil.toInstant("2026-01-02T03:04:05.250000"));
        assertNull(JdbcUtil.toInstant(" "));
        assertThrows(IllegalArgumentException.class, () -> JdbcUtil.toInstant("yesterday"));
    }
}
