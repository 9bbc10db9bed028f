package net.kairos.core.service;

import net.kairos.core.error.TargetException;
import net.kairos.core.lock.DistributedLock;
import net.kairos.core.lock.LockManager;
import net.kairos.core.model.Execution;
import net.kairos.core.model.ExecutionEvent;
import net.kairos.core.model.Schedule;
import net.kairos.core.model.TaskResult;
import net.kairos.core.model.TriggerSource;
import net.kairos.core.spi.AgentPolicyRepository;
import net.kairos.core.spi.Clock;
import net.kairos.core.spi.CronCalculator;
import net.kairos.core.spi.ExecutionEventPublisher;
import net.kairos.core.spi.ExecutionRepository;
import net.kairos.core.spi.ScheduleRepository;
import net.kairos.core.spi.TaskTargetClient;
import net.kairos.core.spi.TxRunner;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.time.Instant;
import java.time.ZoneId;
import java.util.Optional;

/**
 * 발화 한 번의 상태 기계: 락 → 재조회/정책 확인 → 기록 생성 → 디스패치 → 조건부 종료 기록.
 * 어떤 실패도 호출자(타이머/디스패치 스레드)로 새지 않는다.
 */
public final class ScheduleExecutionService {
    private static final Logger log = LoggerFactory.getLogger(ScheduleExecutionService.class);

    private final ScheduleRepository schedules;
    private final ExecutionRepository executions;
    private final AgentPolicyRepository policies;
    private final LockManager locks;
    private final TaskTargetClient target;
    private final ExecutionEventPublisher events;
    private final TxRunner tx;
    private final CancellationTracker cancellations;
    private final CronCalculator cron;
    private final Clock clock;
    private final Duration dispatchTimeout;
    private final String defaultZone;

    public ScheduleExecutionService(ScheduleRepository schedules,
                                    ExecutionRepository executions,
                                    AgentPolicyRepository policies,
                                    LockManager locks,
                                    TaskTargetClient target,
                                    ExecutionEventPublisher events,
                                    TxRunner tx,
                                    CancellationTracker cancellations,
                                    CronCalculator cron,
                                    Clock clock,
                                    Duration dispatchTimeout,
                                    String defaultZone) {
        this.schedules = schedules;
        this.executions = executions;
        this.policies = policies;
        this.locks = locks;
        this.target = target;
        this.events = events;
        this.tx = tx;
        this.cancellations = cancellations;
        this.cron = cron;
        this.clock = clock;
        this.dispatchTimeout = dispatchTimeout;
        this.defaultZone = defaultZone;
    }

    public FireOutcome fire(String scheduleId, TriggerSource source) {
        Optional<DistributedLock> acquired = locks.tryAcquireScheduleLock(scheduleId);
        if (acquired.isEmpty()) {
            log.info("Schedule {} already being executed by another instance, skipping", scheduleId);
            return FireOutcome.SKIPPED_LOCKED;
        }
        try (DistributedLock lock = acquired.get()) {
            FireOutcome outcome = fireLocked(scheduleId, source);
            if (lock.isLost()) {
                log.warn("Schedule {} finished with {} after its lock was lost", scheduleId, outcome);
            }
            return outcome;
        } catch (RuntimeException e) {
            log.error("Unexpected error firing schedule {}", scheduleId, e);
            return FireOutcome.ERROR;
        }
    }

    private FireOutcome fireLocked(String scheduleId, TriggerSource source) {
        Schedule schedule;
        try {
            schedule = schedules.findById(scheduleId).orElse(null);
        } catch (Exception e) {
            log.error("Failed to load schedule {}: {}", scheduleId, e.toString());
            return FireOutcome.ERROR;
        }
        if (schedule == null) {
            log.info("Schedule {} not found, skipping", scheduleId);
            return FireOutcome.SKIPPED_NOT_FOUND;
        }
        if (!schedule.enabled()) {
            log.info("Schedule {} ({}) is disabled, skipping", scheduleId, schedule.name());
            publish(ExecutionEvent.skipped(schedule, "schedule disabled", source));
            return FireOutcome.SKIPPED_DISABLED;
        }
        if (!autonomyEnabled(schedule.agentName())) {
            log.info("Autonomy disabled for agent {}, skipping schedule {}", schedule.agentName(), scheduleId);
            publish(ExecutionEvent.skipped(schedule, "autonomy disabled", source));
            return FireOutcome.SKIPPED_POLICY;
        }

        Execution exec = Execution.started(ExecutionIds.newId(), schedule.id(), schedule.agentName(),
                schedule.message(), source, clock.now());
        try {
            executions.create(exec);
        } catch (Exception e) {
            log.error("Failed to create execution record for schedule {}: {}", scheduleId, e.toString());
            return FireOutcome.ERROR;
        }
        log.info("Executing schedule {} ({}) for agent {} as {}", schedule.name(), scheduleId,
                schedule.agentName(), exec.id());
        publish(ExecutionEvent.started(exec, schedule.name()));

        return dispatchAndRecord(exec, schedule);
    }

    /** API 직접 실행: 스케줄/락 없이 기록만 만든다. 디스패치는 {@link #dispatchAndRecord}로 이어서 */
    public Execution createAdHoc(String agentName, String message) throws Exception {
        Execution exec = Execution.started(ExecutionIds.newId(), null, agentName, message,
                TriggerSource.API, clock.now());
        executions.create(exec);
        publish(ExecutionEvent.started(exec, null));
        return exec;
    }

    /**
     * 디스패치 후 결과를 조건부로 기록한다.
     * @param schedule ad-hoc 실행이면 null (실행 시각 갱신 생략)
     */
    public FireOutcome dispatchAndRecord(Execution exec, Schedule schedule) {
        // 대기 중에 취소된 실행은 대상으로 보내지 않는다
        Optional<FireOutcome> preempted = preemptedBeforeDispatch(exec);
        if (preempted.isPresent()) return preempted.get();

        TaskResult result;
        try {
            result = target.dispatch(exec.agentName(), exec.message(), exec.id(), dispatchTimeout);
        } catch (TargetException e) {
            return recordFailure(exec, e.describe());
        } catch (RuntimeException e) {
            log.error("Unexpected error dispatching execution {}", exec.id(), e);
            return recordFailure(exec, e.toString());
        }

        // 성공 기록과 실행 시각 갱신을 한 트랜잭션으로
        boolean written;
        try {
            written = tx.required(() -> {
                boolean ok = executions.completeIfRunning(exec.id(), Execution.Status.SUCCESS, result, null, clock.now());
                if (ok && schedule != null) writeRunTimes(schedule);
                return ok;
            });
        } catch (Exception e) {
            log.error("Failed to record success of execution {}: {}", exec.id(), e.toString());
            return FireOutcome.ERROR;
        }
        if (!written) return reportSuperseded(exec);

        log.info("Execution {} for agent {} completed", exec.id(), exec.agentName());
        publish(ExecutionEvent.completed(exec, Execution.Status.SUCCESS, null));
        return FireOutcome.SUCCEEDED;
    }

    private Optional<FireOutcome> preemptedBeforeDispatch(Execution exec) {
        if (cancellations.isPending(exec.id()) && cancellations.awaitCancelled(exec.id())) {
            log.info("Execution {} cancelled before dispatch to agent {}", exec.id(), exec.agentName());
            return Optional.of(FireOutcome.CANCELLED);
        }
        Execution.Status current;
        try {
            current = executions.findById(exec.id()).map(Execution::status).orElse(Execution.Status.UNKNOWN);
        } catch (Exception e) {
            log.warn("Failed to reload execution {} before dispatch: {}", exec.id(), e.toString());
            return Optional.empty();
        }
        if (current == Execution.Status.RUNNING) return Optional.empty();

        log.info("Execution {} already {} before dispatch, not sent to agent {}", exec.id(), current.code(), exec.agentName());
        return Optional.of(current == Execution.Status.CANCELLED ? FireOutcome.CANCELLED : FireOutcome.ERROR);
    }

    private FireOutcome recordFailure(Execution exec, String error) {
        // 종료 요청으로 끊긴 디스패치: 취소 쪽이 기록과 이벤트를 맡는다
        if (cancellations.awaitCancelled(exec.id())) {
            log.info("Execution {} for agent {} cancelled during dispatch", exec.id(), exec.agentName());
            return FireOutcome.CANCELLED;
        }
        log.error("Execution {} for agent {} failed: {}", exec.id(), exec.agentName(), error);
        boolean written;
        try {
            written = tx.required(() ->
                    executions.completeIfRunning(exec.id(), Execution.Status.FAILED, null, error, clock.now()));
        } catch (Exception e) {
            log.error("Failed to record failure of execution {}: {}", exec.id(), e.toString());
            return FireOutcome.ERROR;
        }
        if (!written) return reportSuperseded(exec);

        publish(ExecutionEvent.completed(exec, Execution.Status.FAILED, error));
        return FireOutcome.FAILED;
    }

    /** 종료 기록이 억제됨: 다른 경로(취소)가 먼저 종료 상태를 썼다. 다른 프로세스의 취소면 여기서 이벤트를 낸다 */
    private FireOutcome reportSuperseded(Execution exec) {
        if (cancellations.awaitCancelled(exec.id())) {
            log.info("Execution {} for agent {} cancelled during dispatch", exec.id(), exec.agentName());
            return FireOutcome.CANCELLED;
        }
        Execution.Status current;
        try {
            current = executions.findById(exec.id()).map(Execution::status).orElse(Execution.Status.UNKNOWN);
        } catch (Exception e) {
            log.warn("Failed to reload execution {}: {}", exec.id(), e.toString());
            current = Execution.Status.UNKNOWN;
        }
        log.info("Execution {} already {}, result not recorded", exec.id(), current.code());
        if (current == Execution.Status.CANCELLED) {
            publish(ExecutionEvent.completed(exec, Execution.Status.CANCELLED, null));
            return FireOutcome.CANCELLED;
        }
        return FireOutcome.ERROR;
    }

    private void writeRunTimes(Schedule schedule) {
        Instant now = clock.now();
        Instant next = null;
        try {
            next = cron.next(now, schedule.cronExpr(), ZoneId.of(schedule.zoneOrDefault(defaultZone)));
        } catch (RuntimeException e) {
            log.warn("Cannot compute next run of schedule {}: {}", schedule.id(), e.toString());
        }
        try {
            schedules.updateRunTimes(schedule.id(), now, next);
        } catch (Exception e) {
            log.error("Failed to update run times of schedule {}: {}", schedule.id(), e.toString());
        }
    }

    private boolean autonomyEnabled(String agentName) {
        try {
            return policies.isAutonomyEnabled(agentName);
        } catch (Exception e) {
            log.warn("Autonomy lookup for agent {} failed: {}", agentName, e.toString());
            return false;
        }
    }

    private void publish(ExecutionEvent event) {
        try {
            events.publish(event);
        } catch (Exception e) {
            log.warn("Failed to publish {} event: {}", event.type().code(), e.toString());
        }
    }
}
