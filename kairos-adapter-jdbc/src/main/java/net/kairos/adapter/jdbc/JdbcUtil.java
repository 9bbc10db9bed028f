package net.kairos.adapter.jdbc;

import javax.sql.DataSource;
import java.sql.Connection;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.time.Instant;
import java.time.LocalDateTime;
import java.time.OffsetDateTime;
import java.time.ZoneOffset;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeParseException;
import java.time.temporal.ChronoUnit;
import java.util.regex.Pattern;

/**
 * SQLite 는 시각을 TEXT 로 저장한다. 플랫폼과 같은 형식(UTC, 오프셋 없는 ISO-8601, 마이크로초)으로 쓰고,
 * 읽을 때는 오프셋이 붙은 값과 CURRENT_TIMESTAMP 형식('yyyy-MM-dd HH:mm:ss')도 받아준다.
 */
public final class JdbcUtil {
    private static final Pattern OFFSET_SUFFIX = Pattern.compile("(Z|[+-]\\d{2}:\\d{2})$");
    private static final DateTimeFormatter WRITE = DateTimeFormatter.ofPattern("yyyy-MM-dd'T'HH:mm:ss.SSSSSS");

    private JdbcUtil() {}

    @FunctionalInterface
    public interface ConnectionCallback<T> {
        T doInConnection(Connection c) throws SQLException;
    }

    /** 바인딩된 트랜잭션이 있으면 참여, 없으면 auto-commit 커넥션 하나를 빌려 쓴다 */
    public static <T> T withConnection(DataSource ds, ConnectionCallback<T> cb) throws SQLException {
        Connection bound = TxContext.current();
        if (bound != null) return cb.doInConnection(bound);
        try (Connection c = ds.getConnection()) {
            return cb.doInConnection(c);
        }
    }

    public static String text(Instant i) {
        if (i == null) return null;
        return WRITE.format(LocalDateTime.ofInstant(i.truncatedTo(ChronoUnit.MICROS), ZoneOffset.UTC));
    }

    public static Instant toInstant(String s) {
        if (s == null || s.isBlank()) return null;
        String v = s.trim().replace(' ', 'T');
        try {
            if (OFFSET_SUFFIX.matcher(v).find()) return OffsetDateTime.parse(v).toInstant();
            return LocalDateTime.parse(v).toInstant(ZoneOffset.UTC); // 오프셋 없는 값은 UTC
        } catch (DateTimeParseException e) {
            throw new IllegalArgumentException("Unparseable timestamp '" + s + "'", e);
        }
    }

    public static Instant instant(ResultSet rs, String column) throws SQLException {
        return toInstant(rs.getString(column));
    }

    public static Integer intOrNull(ResultSet rs, String column) throws SQLException {
        int v = rs.getInt(column);
        return rs.wasNull() ? null : v;
    }

    public static Long longOrNull(ResultSet rs, String column) throws SQLException {
        long v = rs.getLong(column);
        return rs.wasNull() ? null : v;
    }

    public static Double doubleOrNull(ResultSet rs, String column) throws SQLException {
        double v = rs.getDouble(column);
        return rs.wasNull() ? null : v;
    }
}
