package net.kairos.adapter.jdbc.repo;

import net.kairos.adapter.jdbc.JdbcUtil;
import net.kairos.adapter.jdbc.mapper.RowMappers;
import net.kairos.core.model.Schedule;
import net.kairos.core.spi.ScheduleRepository;

import javax.sql.DataSource;
import java.sql.PreparedStatement;
import java.sql.SQLException;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

import static net.kairos.adapter.jdbc.JdbcUtil.withConnection;

public final class JdbcScheduleRepository implements ScheduleRepository {
    private final DataSource ds;

    public JdbcScheduleRepository(DataSource ds) {
        this.ds = ds;
    }

    @Override
    public Optional<Schedule> findById(String id) throws Exception {
        return withConnection(ds, c -> {
            try (var ps = c.prepareStatement("SELECT * FROM agent_schedules WHERE id = ?")) {
                ps.setString(1, id);
                try (var rs = ps.executeQuery()) {
                    return rs.next() ? Optional.of(RowMappers.toSchedule(rs)) : Optional.<Schedule>empty();
                }
            }
        });
    }

    @Override
    public List<Schedule> listEnabled() throws Exception {
        return list("SELECT * FROM agent_schedules WHERE enabled = 1 ORDER BY id");
    }

    @Override
    public List<Schedule> listAll() throws Exception {
        return list("SELECT * FROM agent_schedules ORDER BY id");
    }

    /** COALESCE 로 null 인자는 기존 값 유지. updated_at 은 외부 편집 감지용이라 건드리지 않는다 */
    @Override
    public boolean updateRunTimes(String id, Instant lastRunAt, Instant nextRunAt) throws Exception {
        return withConnection(ds, c -> {
            try (var ps = c.prepareStatement("""
                UPDATE agent_schedules
                   SET last_run_at = COALESCE(?, last_run_at),
                       next_run_at = COALESCE(?, next_run_at)
                 WHERE id = ?
            """)) {
                ps.setString(1, JdbcUtil.text(lastRunAt));
                ps.setString(2, JdbcUtil.text(nextRunAt));
                ps.setString(3, id);
                return ps.executeUpdate() == 1;
            }
        });
    }

    private List<Schedule> list(String sql) throws SQLException {
        return withConnection(ds, c -> {
            try (PreparedStatement ps = c.prepareStatement(sql); var rs = ps.executeQuery()) {
                List<Schedule> out = new ArrayList<>();
                while (rs.next()) out.add(RowMappers.toSchedule(rs));
                return out;
            }
        });
    }
}
