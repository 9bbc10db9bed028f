package net.kairos.core.service;

import net.kairos.core.lock.LockManager;
import net.kairos.core.model.Execution;
import net.kairos.core.model.ExecutionEvent;
import net.kairos.core.model.TriggerSource;
import net.kairos.core.spi.AgentPolicyRepository;
import net.kairos.core.support.DirectTxRunner;
import net.kairos.core.support.FakeTaskTarget;
import net.kairos.core.support.InMemoryExecutionRepository;
import net.kairos.core.support.InMemoryLockStore;
import net.kairos.core.support.InMemoryScheduleRepository;
import net.kairos.core.support.IntervalCron;
import net.kairos.core.support.RecordingEventPublisher;
import org.awaitility.Awaitility;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Set;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;

import static net.kairos.core.support.InMemoryScheduleRepository.schedule;
import static org.junit.jupiter.api.Assertions.*;

class ScheduleExecutionServiceTest {

    private InMemoryScheduleRepository schedules;
    private InMemoryExecutionRepository executions;
    private InMemoryLockStore lockStore;
    private FakeTaskTarget target;
    private RecordingEventPublisher events;
    private final Set<String> autonomyOff = ConcurrentHashMap.newKeySet();
    private ScheduledExecutorService renewer;
    private final CancellationTracker tracker = new CancellationTracker(Instant::now, Duration.ofSeconds(5));
    private ScheduleExecutionService service;

    @BeforeEach
    void setUp() {
        schedules = new InMemoryScheduleRepository();
        executions = new InMemoryExecutionRepository();
        lockStore = new InMemoryLockStore();
        target = new FakeTaskTarget();
        events = new RecordingEventPublisher();
        renewer = Executors.newSingleThreadScheduledExecutor();
        service = newInstance();
        schedules.save(schedule("S1", "alpha", "60000", true, Instant.parse("2026-01-01T00:00:00Z")));
    }

    @AfterEach
    void tearDown() {
        renewer.shutdownNow();
    }

    /** 같은 저장소를 공유하는 스케줄러 인스턴스 하나 */
    private ScheduleExecutionService newInstance() {
        AgentPolicyRepository policies = agent -> !autonomyOff.contains(agent);
        var locks = new LockManager(lockStore, renewer, Duration.ofSeconds(30), true);
        return new ScheduleExecutionService(schedules, executions, policies, locks, target, events, new DirectTxRunner(), tracker,
                new IntervalCron(), Instant::now, Duration.ofSeconds(5), "UTC");
    }

    @Test
    void successful_fire_records_success_and_run_times() {
        Instant before = Instant.now();

        assertEquals(FireOutcome.SUCCEEDED, service.fire("S1", TriggerSource.SCHEDULE));

        List<Execution> recs = executions.forSchedule("S1");
        assertEquals(1, recs.size());
        Execution e = recs.get(0);
        assertEquals(Execution.Status.SUCCESS, e.status());
        assertEquals(TriggerSource.SCHEDULE, e.triggeredBy());
        assertEquals("done: run S1", e.response());
        assertEquals(1200, e.contextUsed());
        assertTrue(e.id().matches("[A-Za-z0-9_-]{22}"));
        assertNotNull(e.durationMs());

        var s = schedules.get("S1");
        assertFalse(s.lastRunAt().isBefore(before));
        assertTrue(s.nextRunAt().isAfter(s.lastRunAt()));
        // 실행 시각 기록은 변경 감지 컬럼을 건드리지 않음
        assertEquals(Instant.parse("2026-01-01T00:00:00Z"), s.updatedAt());

        assertEquals(List.of(ExecutionEvent.Type.EXECUTION_STARTED, ExecutionEvent.Type.EXECUTION_COMPLETED),
                events.types());
        assertEquals(Execution.Status.SUCCESS, events.events.get(1).status());
        assertEquals("job-S1", events.events.get(0).scheduleName());
        // 락은 항상 해제
        assertNull(lockStore.get("scheduler:lock:schedule:S1"));
    }

    @Test
    void held_lock_skips_without_record() {
        lockStore.overwrite("scheduler:lock:schedule:S1", "other-instance", Duration.ofSeconds(30));

        assertEquals(FireOutcome.SKIPPED_LOCKED, service.fire("S1", TriggerSource.SCHEDULE));

        assertTrue(executions.all().isEmpty());
        assertTrue(target.dispatched.isEmpty());
        assertEquals("other-instance", lockStore.get("scheduler:lock:schedule:S1"));
    }

    @Test
    void missing_disabled_and_policy_blocked_schedules_are_skipped() throws Exception {
        schedules.save(schedule("S2", "beta", "60000", false, Instant.now()));
        schedules.save(schedule("S3", "gamma", "60000", true, Instant.now()));
        autonomyOff.add("gamma");

        assertEquals(FireOutcome.SKIPPED_NOT_FOUND, service.fire("nope", TriggerSource.SCHEDULE));
        assertEquals(FireOutcome.SKIPPED_DISABLED, service.fire("S2", TriggerSource.SCHEDULE));
        assertEquals(FireOutcome.SKIPPED_POLICY, service.fire("S3", TriggerSource.MANUAL));

        assertTrue(executions.all().isEmpty());
        assertTrue(target.dispatched.isEmpty());
        assertEquals(List.of(ExecutionEvent.Type.EXECUTION_SKIPPED, ExecutionEvent.Type.EXECUTION_SKIPPED),
                events.types());
        assertEquals(TriggerSource.MANUAL, events.events.get(1).triggeredBy());
        assertFalse(lockStore.exists("scheduler:lock:schedule:S2") || lockStore.exists("scheduler:lock:schedule:S3"));
    }

    @Test
    void unreachable_target_marks_execution_failed() {
        target.setUnreachable(true);

        assertEquals(FireOutcome.FAILED, service.fire("S1", TriggerSource.SCHEDULE));

        Execution e = executions.forSchedule("S1").get(0);
        assertEquals(Execution.Status.FAILED, e.status());
        assertTrue(e.error().startsWith("Agent not reachable"), e.error());
        assertNull(schedules.get("S1").lastRunAt());
        assertEquals(Execution.Status.FAILED, events.events.get(1).status());
        assertNull(lockStore.get("scheduler:lock:schedule:S1"));
    }

    @Test
    void two_instances_racing_produce_one_execution() throws Exception {
        target.setDelay(Duration.ofMillis(300));
        var other = newInstance();
        ExecutorService pool = Executors.newFixedThreadPool(2);
        try {
            var a = CompletableFuture.supplyAsync(() -> service.fire("S1", TriggerSource.SCHEDULE), pool);
            var b = CompletableFuture.supplyAsync(() -> other.fire("S1", TriggerSource.SCHEDULE), pool);

            List<FireOutcome> outcomes = List.of(a.get(), b.get());
            assertTrue(outcomes.contains(FireOutcome.SUCCEEDED));
            assertTrue(outcomes.contains(FireOutcome.SKIPPED_LOCKED));
        } finally {
            pool.shutdownNow();
        }
        List<Execution> recs = executions.forSchedule("S1");
        assertEquals(1, recs.size());
        assertEquals(Execution.Status.SUCCESS, recs.get(0).status());
        assertEquals(1, target.dispatched.size());
    }

    @Test
    void cancellation_during_dispatch_wins_over_failure() throws Exception {
        target.setDelay(Duration.ofSeconds(5));
        var cancellation = new ExecutionCancellationService(executions, target, events, new DirectTxRunner(), tracker, Instant::now);

        var fired = CompletableFuture.supplyAsync(() -> service.fire("S1", TriggerSource.SCHEDULE));
        Awaitility.await().atMost(Duration.ofSeconds(2)).until(() -> !target.dispatched.isEmpty());
        String id = target.dispatched.get(0);

        var result = cancellation.cancel(id);

        assertTrue(result.cancelled());
        assertEquals(FireOutcome.CANCELLED, fired.get());
        Execution e = executions.findById(id).orElseThrow();
        assertEquals(Execution.Status.CANCELLED, e.status());
        assertNotNull(e.completedAt());
        assertTrue(events.events.stream().noneMatch(ev -> ev.status() == Execution.Status.FAILED));
        assertEquals(1, events.events.stream().filter(ev -> ev.status() == Execution.Status.CANCELLED).count());
    }

    @Test
    void event_publish_failure_does_not_affect_execution() {
        events.setFailing(true);

        assertEquals(FireOutcome.SUCCEEDED, service.fire("S1", TriggerSource.SCHEDULE));
        assertEquals(Execution.Status.SUCCESS, executions.forSchedule("S1").get(0).status());
    }

    @Test
    void schedule_store_outage_releases_lock() {
        schedules.setDown(true);

        assertEquals(FireOutcome.ERROR, service.fire("S1", TriggerSource.SCHEDULE));
        assertNull(lockStore.get("scheduler:lock:schedule:S1"));
    }

    @Test
    void ad_hoc_dispatch_has_no_schedule() throws Exception {
        Execution exec = service.createAdHoc("alpha", "hello");

        assertEquals(Execution.Status.RUNNING, executions.findById(exec.id()).orElseThrow().status());
        assertEquals(FireOutcome.SUCCEEDED, service.dispatchAndRecord(exec, null));

        Execution done = executions.findById(exec.id()).orElseThrow();
        assertEquals(Execution.Status.SUCCESS, done.status());
        assertEquals(TriggerSource.API, done.triggeredBy());
        assertNull(done.scheduleId());
    }

    @Test
    void execution_cancelled_while_queued_is_never_sent() throws Exception {
        var cancellation = new ExecutionCancellationService(executions, target, events, new DirectTxRunner(), tracker, Instant::now);
        Execution exec = service.createAdHoc("alpha", "hello");

        var result = cancellation.cancel(exec.id());
        assertTrue(result.cancelled());

        assertEquals(FireOutcome.CANCELLED, service.dispatchAndRecord(exec, null));
        assertTrue(target.dispatched.isEmpty());
        assertEquals(Execution.Status.CANCELLED, executions.findById(exec.id()).orElseThrow().status());
        assertEquals(1, events.events.stream().filter(ev -> ev.status() == Execution.Status.CANCELLED).count());
    }

    @Test
    void execution_finished_elsewhere_is_not_dispatched() throws Exception {
        Execution exec = service.createAdHoc("alpha", "hello");
        executions.completeIfRunning(exec.id(), Execution.Status.FAILED, null, "boom", Instant.now());

        assertEquals(FireOutcome.ERROR, service.dispatchAndRecord(exec, null));
        assertTrue(target.dispatched.isEmpty());
        assertEquals(Execution.Status.FAILED, executions.findById(exec.id()).orElseThrow().status());
    }
}
