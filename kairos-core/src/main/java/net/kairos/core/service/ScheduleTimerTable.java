package net.kairos.core.service;

import net.kairos.core.model.Schedule;
import net.kairos.core.model.SchedulerStatus;
import net.kairos.core.spi.Clock;
import net.kairos.core.spi.CronCalculator;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.time.Instant;
import java.time.ZoneId;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.TreeSet;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;

/**
 * 스케줄 id → 다음 발화 타이머. 발화 시 핸들러를 부른 뒤 다음 슬롯으로 다시 건다.
 * 밀린 슬롯은 하나로 합친다(지난 슬롯을 몰아서 실행하지 않음).
 */
public final class ScheduleTimerTable {
    private static final Logger log = LoggerFactory.getLogger(ScheduleTimerTable.class);

    @FunctionalInterface
    public interface FireHandler {
        void onFire(String scheduleId);
    }

    private final ScheduledExecutorService timers;
    private final CronCalculator cron;
    private final Clock clock;
    private final String defaultZone;
    private final FireHandler handler;
    private final Map<String, Entry> entries = new ConcurrentHashMap<>();

    public ScheduleTimerTable(ScheduledExecutorService timers,
                              CronCalculator cron,
                              Clock clock,
                              String defaultZone,
                              FireHandler handler) {
        this.timers = timers;
        this.cron = cron;
        this.clock = clock;
        this.defaultZone = defaultZone;
        this.handler = handler;
    }

    /**
     * 등록(같은 id가 있으면 교체).
     * @throws IllegalArgumentException cron 표현식이나 타임존이 잘못된 경우. 기존 타이머는 유지된다.
     */
    public synchronized Instant register(Schedule schedule) {
        ZoneId zone;
        try {
            zone = ZoneId.of(schedule.zoneOrDefault(defaultZone));
        } catch (RuntimeException e) {
            throw new IllegalArgumentException("Invalid timezone '" + schedule.timezone() + "'", e);
        }
        Instant first = cron.next(clock.now(), schedule.cronExpr(), zone);

        var entry = new Entry(schedule.id(), schedule.name(), schedule.cronExpr(), zone);
        Entry previous = entries.put(schedule.id(), entry);
        if (previous != null) previous.cancel();
        arm(entry, first);
        log.info("Registered schedule {} ({}) '{}' next at {}", schedule.name(), schedule.id(),
                schedule.cronExpr(), first);
        return first;
    }

    public synchronized boolean remove(String scheduleId) {
        Entry e = entries.remove(scheduleId);
        if (e == null) return false;
        e.cancel();
        log.info("Removed schedule {} ({})", e.name, scheduleId);
        return true;
    }

    public synchronized void clear() {
        entries.values().forEach(Entry::cancel);
        entries.clear();
    }

    public boolean contains(String scheduleId) { return entries.containsKey(scheduleId); }

    public Set<String> scheduleIds() { return new TreeSet<>(entries.keySet()); }

    public int size() { return entries.size(); }

    public Optional<Instant> nextFireAt(String scheduleId) {
        return Optional.ofNullable(entries.get(scheduleId)).map(e -> e.nextFireAt);
    }

    public List<SchedulerStatus.JobView> jobs() {
        List<SchedulerStatus.JobView> out = new ArrayList<>();
        for (Entry e : entries.values()) out.add(new SchedulerStatus.JobView(e.scheduleId, e.name, e.nextFireAt));
        out.sort(Comparator.comparing(SchedulerStatus.JobView::id));
        return out;
    }

    private void arm(Entry e, Instant at) {
        long delayMs = Math.max(0, Duration.between(clock.now(), at).toMillis());
        e.nextFireAt = at;
        e.future = timers.schedule(() -> fire(e), delayMs, TimeUnit.MILLISECONDS);
    }

    private void fire(Entry e) {
        if (entries.get(e.scheduleId) != e) return; // 교체/삭제된 타이머
        try {
            handler.onFire(e.scheduleId);
        } catch (RuntimeException ex) {
            log.error("Fire handler failed for schedule {}", e.scheduleId, ex);
        }
        synchronized (this) {
            if (entries.get(e.scheduleId) != e) return;
            Instant base = e.nextFireAt.isAfter(clock.now()) ? e.nextFireAt : clock.now();
            try {
                arm(e, cron.next(base, e.cronExpr, e.zone));
            } catch (RuntimeException ex) {
                entries.remove(e.scheduleId);
                log.error("Cannot re-arm schedule {}, timer dropped: {}", e.scheduleId, ex.toString());
            }
        }
    }

    private static final class Entry {
        final String scheduleId;
        final String name;
        final String cronExpr;
        final ZoneId zone;
        volatile Instant nextFireAt;
        volatile ScheduledFuture<?> future;

        Entry(String scheduleId, String name, String cronExpr, ZoneId zone) {
            this.scheduleId = scheduleId;
            this.name = name;
            this.cronExpr = cronExpr;
            this.zone = zone;
        }

        void cancel() {
            var f = future;
            if (f != null) f.cancel(false);
        }
    }
}
