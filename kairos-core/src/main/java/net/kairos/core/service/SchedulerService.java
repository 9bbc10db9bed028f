package net.kairos.core.service;

import net.kairos.core.error.ScheduleNotFoundException;
import net.kairos.core.lock.LockManager;
import net.kairos.core.model.Execution;
import net.kairos.core.model.SchedulerStatus;
import net.kairos.core.model.TriggerSource;
import net.kairos.core.spi.Clock;
import net.kairos.core.spi.ScheduleRepository;
import net.kairos.core.sync.ScheduleSyncService;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.time.Instant;

/** 스케줄러 프로세스 수명주기와 외부 진입점(수동 트리거, ad-hoc 실행, 상태) */
public final class SchedulerService {
    private static final Logger log = LoggerFactory.getLogger(SchedulerService.class);

    private final ScheduleTimerTable timers;
    private final ScheduleDispatcher dispatcher;
    private final ScheduleSyncService sync;
    private final ScheduleExecutionService executionService;
    private final ScheduleRepository schedules;
    private final LockManager locks;
    private final Clock clock;
    private final String instanceId;
    private final Duration heartbeatTtl;

    private volatile boolean running;
    private volatile Instant startedAt;

    public SchedulerService(ScheduleTimerTable timers,
                            ScheduleDispatcher dispatcher,
                            ScheduleSyncService sync,
                            ScheduleExecutionService executionService,
                            ScheduleRepository schedules,
                            LockManager locks,
                            Clock clock,
                            String instanceId,
                            Duration heartbeatTtl) {
        this.timers = timers;
        this.dispatcher = dispatcher;
        this.sync = sync;
        this.executionService = executionService;
        this.schedules = schedules;
        this.locks = locks;
        this.clock = clock;
        this.instanceId = instanceId;
        this.heartbeatTtl = heartbeatTtl;
    }

    /** 초기 적재 후 실행 상태로 전환 */
    public synchronized ScheduleSyncService.SyncReport start() {
        if (running) throw new IllegalStateException("Scheduler already running");
        startedAt = clock.now();
        var report = sync.syncOnce();
        running = true;
        heartbeat();
        log.info("Scheduler {} started with {} jobs", instanceId, timers.size());
        return report;
    }

    public synchronized void shutdown() {
        if (!running) return;
        running = false;
        timers.clear();
        sync.reset();
        log.info("Scheduler {} stopped", instanceId);
    }

    /** 동기화 루프 한 번. 정지 상태면 아무것도 하지 않는다 */
    public ScheduleSyncService.SyncReport syncNow() {
        if (!running) return null;
        return sync.syncOnce();
    }

    public boolean heartbeat() {
        return locks.heartbeat(instanceId, heartbeatTtl);
    }

    /**
     * 수동 트리거. 존재 여부만 확인하고 즉시 반환; 실행 결과는 동기적으로 알려주지 않는다.
     * @throws ScheduleNotFoundException 스케줄이 없을 때
     */
    public Instant trigger(String scheduleId) throws Exception {
        if (schedules.findById(scheduleId).isEmpty()) throw new ScheduleNotFoundException(scheduleId);
        Instant at = clock.now();
        log.info("Manual trigger for schedule {}", scheduleId);
        dispatcher.submit(scheduleId, TriggerSource.MANUAL);
        return at;
    }

    /** 스케줄 없이 대상에 바로 보낸다 (triggered_by=api, 락 없음) */
    public Execution dispatchAdHoc(String agentName, String message) throws Exception {
        Execution exec = executionService.createAdHoc(agentName, message);
        log.info("Ad-hoc dispatch {} to agent {}", exec.id(), agentName);
        dispatcher.submitAdHoc(exec);
        return exec;
    }

    public boolean isRunning() { return running; }

    public String instanceId() { return instanceId; }

    public SchedulerStatus status() {
        Instant started = startedAt;
        double uptime = started == null ? 0.0 : Duration.between(started, clock.now()).toMillis() / 1000.0;
        return new SchedulerStatus(running, timers.size(), sync.lastSyncAt(), uptime, instanceId, timers.jobs());
    }
}
