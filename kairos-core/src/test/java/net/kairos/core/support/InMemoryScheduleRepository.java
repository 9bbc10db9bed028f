package net.kairos.core.support;

import net.kairos.core.model.Schedule;
import net.kairos.core.spi.ScheduleRepository;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

public class InMemoryScheduleRepository implements ScheduleRepository {
    private final Map<String, Schedule> rows = new ConcurrentHashMap<>();
    private volatile boolean down;

    public void setDown(boolean down) { this.down = down; }

    public void save(Schedule s) { rows.put(s.id(), s); }

    public void delete(String id) { rows.remove(id); }

    public Schedule get(String id) { return rows.get(id); }

    private void check() {
        if (down) throw new IllegalStateException("schedule store down");
    }

    @Override
    public Optional<Schedule> findById(String id) {
        check();
        return Optional.ofNullable(rows.get(id));
    }

    @Override
    public List<Schedule> listEnabled() {
        check();
        return rows.values().stream().filter(Schedule::enabled).toList();
    }

    @Override
    public List<Schedule> listAll() {
        check();
        return new ArrayList<>(rows.values());
    }

    @Override
    public boolean updateRunTimes(String id, Instant lastRunAt, Instant nextRunAt) {
        check();
        Schedule s = rows.get(id);
        if (s == null) return false;
        rows.put(id, new Schedule(s.id(), s.agentName(), s.name(), s.cronExpr(), s.message(), s.enabled(),
                s.timezone(), s.description(), s.createdAt(), s.updatedAt(),
                lastRunAt != null ? lastRunAt : s.lastRunAt(),
                nextRunAt != null ? nextRunAt : s.nextRunAt()));
        return true;
    }

    public static Schedule schedule(String id, String agent, String cron, boolean enabled, Instant updatedAt) {
        return new Schedule(id, agent, "job-" + id, cron, "run " + id, enabled, null, null,
                updatedAt, updatedAt, null, null);
    }
}
