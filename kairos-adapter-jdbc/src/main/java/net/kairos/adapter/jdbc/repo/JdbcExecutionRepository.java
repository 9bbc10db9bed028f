package net.kairos.adapter.jdbc.repo;

import net.kairos.adapter.jdbc.JdbcUtil;
import net.kairos.adapter.jdbc.mapper.RowMappers;
import net.kairos.core.model.Execution;
import net.kairos.core.model.TaskMetrics;
import net.kairos.core.model.TaskResult;
import net.kairos.core.spi.ExecutionRepository;

import javax.sql.DataSource;
import java.sql.Connection;
import java.sql.SQLException;
import java.sql.Types;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

import static net.kairos.adapter.jdbc.JdbcUtil.withConnection;

/**
 * 종료 상태 기록은 모두 {@code WHERE status = 'running'} 조건부 UPDATE 한 번으로 처리한다.
 * 영향 행이 0이면 다른 경로가 먼저 종료 상태를 쓴 것.
 */
public final class JdbcExecutionRepository implements ExecutionRepository {
    private final DataSource ds;

    public JdbcExecutionRepository(DataSource ds) {
        this.ds = ds;
    }

    @Override
    public Execution create(Execution e) throws Exception {
        return withConnection(ds, c -> {
            try (var ps = c.prepareStatement("""
                INSERT INTO schedule_executions
                       (id, schedule_id, agent_name, status, started_at, message, triggered_by)
                VALUES (?, ?, ?, ?, ?, ?, ?)
            """)) {
                ps.setString(1, e.id());
                ps.setString(2, e.scheduleId());
                ps.setString(3, e.agentName());
                ps.setString(4, e.status().code());
                ps.setString(5, JdbcUtil.text(e.startedAt()));
                ps.setString(6, e.message());
                ps.setString(7, e.triggeredBy().code());
                ps.executeUpdate();
                return e;
            }
        });
    }

    @Override
    public boolean completeIfRunning(String id, Execution.Status status, TaskResult result,
                                     String error, Instant completedAt) throws Exception {
        return withConnection(ds, c -> {
            Instant startedAt = startedAt(c, id);
            if (startedAt == null) return false;
            TaskMetrics m = result == null ? null : result.metrics();

            try (var ps = c.prepareStatement("""
                UPDATE schedule_executions
                   SET status        = ?,
                       completed_at  = ?,
                       duration_ms   = ?,
                       response      = ?,
                       error         = ?,
                       context_used  = ?,
                       context_max   = ?,
                       cost          = ?,
                       tool_calls    = ?,
                       execution_log = ?
                 WHERE id = ? AND status = 'running'
            """)) {
                ps.setString(1, status.code());
                ps.setString(2, JdbcUtil.text(completedAt));
                ps.setLong(3, Duration.between(startedAt, completedAt).toMillis());
                ps.setString(4, result == null ? null : result.responseText());
                ps.setString(5, error);
                if (m == null) {
                    ps.setNull(6, Types.INTEGER);
                    ps.setNull(7, Types.INTEGER);
                } else {
                    ps.setInt(6, m.contextUsed());
                    ps.setInt(7, m.contextMax());
                }
                if (m == null || m.costUsd() == null) ps.setNull(8, Types.REAL);
                else ps.setDouble(8, m.costUsd());
                ps.setString(9, result == null ? null : result.executionLog());
                ps.setString(10, result == null ? null : result.executionLog());
                ps.setString(11, id);
                return ps.executeUpdate() == 1;
            }
        });
    }

    @Override
    public boolean cancelIfRunning(String id, String reason, Instant completedAt) throws Exception {
        return withConnection(ds, c -> {
            Instant startedAt = startedAt(c, id);
            if (startedAt == null) return false;
            try (var ps = c.prepareStatement("""
                UPDATE schedule_executions
                   SET status       = 'cancelled',
                       completed_at = ?,
                       duration_ms  = ?,
                       error        = ?
                 WHERE id = ? AND status = 'running'
            """)) {
                ps.setString(1, JdbcUtil.text(completedAt));
                ps.setLong(2, Duration.between(startedAt, completedAt).toMillis());
                ps.setString(3, reason);
                ps.setString(4, id);
                return ps.executeUpdate() == 1;
            }
        });
    }

    @Override
    public Optional<Execution> findById(String id) throws Exception {
        return withConnection(ds, c -> {
            try (var ps = c.prepareStatement("SELECT * FROM schedule_executions WHERE id = ?")) {
                ps.setString(1, id);
                try (var rs = ps.executeQuery()) {
                    return rs.next() ? Optional.of(RowMappers.toExecution(rs)) : Optional.<Execution>empty();
                }
            }
        });
    }

    @Override
    public List<Execution> findRecent(int limit) throws Exception {
        return withConnection(ds, c -> {
            try (var ps = c.prepareStatement(
                    "SELECT * FROM schedule_executions ORDER BY started_at DESC LIMIT ?")) {
                ps.setInt(1, Math.max(0, limit));
                try (var rs = ps.executeQuery()) {
                    List<Execution> out = new ArrayList<>();
                    while (rs.next()) out.add(RowMappers.toExecution(rs));
                    return out;
                }
            }
        });
    }

    private static Instant startedAt(Connection c, String id) throws SQLException {
        try (var ps = c.prepareStatement("SELECT started_at FROM schedule_executions WHERE id = ?")) {
            ps.setString(1, id);
            try (var rs = ps.executeQuery()) {
                return rs.next() ? JdbcUtil.instant(rs, "started_at") : null;
            }
        }
    }
}
