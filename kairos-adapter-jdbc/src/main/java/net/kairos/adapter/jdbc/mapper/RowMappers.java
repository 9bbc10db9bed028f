package net.kairos.adapter.jdbc.mapper;

import net.kairos.core.model.Execution;
import net.kairos.core.model.Schedule;
import net.kairos.core.model.TriggerSource;

import java.sql.ResultSet;
import java.sql.SQLException;

import static net.kairos.adapter.jdbc.JdbcUtil.*;

public final class RowMappers {
    private RowMappers() {}

    // --- Schedule ---
    public static Schedule toSchedule(ResultSet rs) throws SQLException {
        return new Schedule(
                rs.getString("id"),
                rs.getString("agent_name"),
                rs.getString("name"),
                rs.getString("cron_expression"),
                rs.getString("message"),
                rs.getInt("enabled") != 0,
                rs.getString("timezone"),
                rs.getString("description"),
                instant(rs, "created_at"),
                instant(rs, "updated_at"),
                instant(rs, "last_run_at"),
                instant(rs, "next_run_at")
        );
    }

    // --- Execution ---
    public static Execution toExecution(ResultSet rs) throws SQLException {
        return new Execution(
                rs.getString("id"),
                rs.getString("schedule_id"),
                rs.getString("agent_name"),
                Execution.Status.from(rs.getString("status")),
                rs.getString("message"),
                TriggerSource.from(rs.getString("triggered_by")),
                instant(rs, "started_at"),
                instant(rs, "completed_at"),
                longOrNull(rs, "duration_ms"),
                rs.getString("response"),
                intOrNull(rs, "context_used"),
                intOrNull(rs, "context_max"),
                doubleOrNull(rs, "cost"),
                rs.getString("tool_calls"),
                rs.getString("execution_log"),
                rs.getString("error")
        );
    }
}
