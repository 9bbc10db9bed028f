package net.kairos.core.sync;

import net.kairos.core.model.Schedule;
import net.kairos.core.service.ScheduleTimerTable;
import net.kairos.core.spi.Clock;
import net.kairos.core.spi.ScheduleRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Instant;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * 외부 저장소의 스케줄 목록과 타이머 테이블을 (enabled, updatedAt) 스냅샷으로 비교해 맞춘다.
 * 첫 패스가 초기 적재. 저장소 장애면 그 패스는 건너뛰고 스냅샷은 유지.
 */
public final class ScheduleSyncService {
    private static final Logger log = LoggerFactory.getLogger(ScheduleSyncService.class);

    private final ScheduleRepository schedules;
    private final ScheduleTimerTable timers;
    private final Clock clock;

    private Map<String, Fingerprint> snapshot = new HashMap<>();
    private volatile Instant lastSyncAt;

    public ScheduleSyncService(ScheduleRepository schedules, ScheduleTimerTable timers, Clock clock) {
        this.schedules = schedules;
        this.timers = timers;
        this.clock = clock;
    }

    public synchronized SyncReport syncOnce() {
        SyncReport r = new SyncReport();
        r.timestamp = clock.now();

        List<Schedule> current;
        try {
            current = schedules.listAll();
        } catch (Exception e) {
            log.warn("Schedule sync skipped, store unavailable: {}", e.toString());
            r.skipped = true;
            return r;
        }

        Map<String, Fingerprint> next = new HashMap<>();
        for (Schedule s : current) {
            var fp = new Fingerprint(s.enabled(), s.updatedAt());
            Fingerprint prev = snapshot.get(s.id());

            if (prev == null) {
                if (!s.enabled()) {
                    next.put(s.id(), fp);
                } else if (register(s)) {
                    next.put(s.id(), fp);
                    r.added++;
                } else {
                    r.failed++;
                }
            } else if (!prev.equals(fp)) {
                timers.remove(s.id());
                if (!s.enabled()) {
                    next.put(s.id(), fp);
                    r.updated++;
                } else if (register(s)) {
                    next.put(s.id(), fp);
                    r.updated++;
                } else {
                    r.failed++;
                }
            } else {
                next.put(s.id(), fp);
                r.unchanged++;
            }
        }

        Set<String> present = current.stream().map(Schedule::id).collect(Collectors.toSet());
        for (String id : snapshot.keySet()) {
            if (!present.contains(id) && timers.remove(id)) r.removed++;
        }

        snapshot = next;
        lastSyncAt = r.timestamp;
        if (r.changed()) log.info("Schedule sync: {}", r);
        else log.debug("Schedule sync: {}", r);
        return r;
    }

    /** 등록 실패(잘못된 cron/타임존)는 스냅샷에 넣지 않아 다음 패스에 다시 시도한다 */
    private boolean register(Schedule s) {
        Instant nextRun;
        try {
            nextRun = timers.register(s);
        } catch (IllegalArgumentException e) {
            log.error("Failed to add schedule {} ({}): {}", s.name(), s.id(), e.getMessage());
            return false;
        }
        try {
            schedules.updateRunTimes(s.id(), null, nextRun);
        } catch (Exception e) {
            log.warn("Failed to write next run time of schedule {}: {}", s.id(), e.toString());
        }
        return true;
    }

    public Instant lastSyncAt() { return lastSyncAt; }

    /** 타이머 표를 비운 뒤 호출. 다음 동기화는 모든 스케줄을 새로 등록한다 */
    public synchronized void reset() {
        snapshot = new HashMap<>();
    }

    private record Fingerprint(boolean enabled, Instant updatedAt) {}

    /** 간단 리포트 DTO */
    public static final class SyncReport {
        public Instant timestamp;
        public boolean skipped;
        public int added;
        public int removed;
        public int updated;
        public int unchanged;
        public int failed;

        public boolean changed() { return added + removed + updated + failed > 0; }

        @Override public String toString() {
            return "SyncReport{" +
                    "timestamp=" + timestamp +
                    ", skipped=" + skipped +
                    ", added=" + added +
                    ", removed=" + removed +
                    ", updated=" + updated +
                    ", unchanged=" + unchanged +
                    ", failed=" + failed +
                    '}';
        }
    }
}
