package net.kairos.adapter.jdbc;

import net.kairos.adapter.jdbc.repo.JdbcExecutionRepository;
import net.kairos.core.model.Execution;
import net.kairos.core.model.TaskMetrics;
import net.kairos.core.model.TaskResult;
import net.kairos.core.model.TriggerSource;
import net.kairos.core.spi.ExecutionRepository;
import org.junit.jupiter.api.BeforeAll;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.List;
import java.util.concurrent.Callable;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.Executors;

import static org.junit.jupiter.api.Assertions.*;

/**
 * 실행 기록 저장소 인수 테스트
 * - 종료 상태는 한 번만 기록(조건부 UPDATE)
 * - cancelled 뒤에 도착한 failed/success 는 무시
 */
class ExecutionRepositoryAcceptanceTest extends TestSupport {

    private static final Instant START = Instant.parse("2026-03-01T09:00:00Z");

    private ExecutionRepository executions;

    @BeforeAll
    void initRepo() {
        executions = new JdbcExecutionRepository(ds);
    }

    private Execution seedRunning(String id, String scheduleId, Instant startedAt) throws Exception {
        return executions.create(Execution.started(id, scheduleId, "alpha", "hello", TriggerSource.SCHEDULE, startedAt));
    }

    @Test
    void success_write_stores_result_and_metrics() throws Exception {
        seedSchedule("S1", "alpha", "* * * * *", true, "2026-01-01T00:00:00");
        seedRunning("e1", "S1", START);
        var result = new TaskResult("all good", new TaskMetrics(1500, 200_000, 320, 0.0421), "[{\"type\":\"tool_use\"}]");

        assertTrue(executions.completeIfRunning("e1", Execution.Status.SUCCESS, result, null, START.plusMillis(2500)));

        Execution e = executions.findById("e1").orElseThrow();
        assertEquals(Execution.Status.SUCCESS, e.status());
        assertEquals("S1", e.scheduleId());
        assertEquals(TriggerSource.SCHEDULE, e.triggeredBy());
        assertEquals(START, e.startedAt());
        assertEquals(START.plusMillis(2500), e.completedAt());
        assertEquals(2500L, e.durationMs());
        assertEquals("all good", e.response());
        assertEquals(1500, e.contextUsed());
        assertEquals(200_000, e.contextMax());
        assertEquals(0.0421, e.cost(), 1e-9);
        assertEquals("[{\"type\":\"tool_use\"}]", e.executionLog());
        assertEquals(e.executionLog(), e.toolCalls());
        assertNull(e.error());
        assertEquals("success", scalar("SELECT status FROM schedule_executions WHERE id = ?", "e1"));
    }

    @Test
    void terminal_status_is_written_once() throws Exception {
        seedRunning("e2", "S1", START);

        assertTrue(executions.completeIfRunning("e2", Execution.Status.FAILED, null, "Agent not reachable: x", START.plusSeconds(1)));
        assertFalse(executions.completeIfRunning("e2", Execution.Status.SUCCESS,
                new TaskResult("late", TaskMetrics.empty(), null), null, START.plusSeconds(2)));
        assertFalse(executions.cancelIfRunning("e2", "too late", START.plusSeconds(3)));

        Execution e = executions.findById("e2").orElseThrow();
        assertEquals(Execution.Status.FAILED, e.status());
        assertEquals("Agent not reachable: x", e.error());
        assertNull(e.response());
        assertNull(e.contextUsed());
    }

    @Test
    void failure_after_cancel_is_suppressed() throws Exception {
        seedRunning("e3", "S1", START);

        assertTrue(executions.cancelIfRunning("e3", "Cancelled by operator", START.plusSeconds(4)));
        assertFalse(executions.completeIfRunning("e3", Execution.Status.FAILED, null, "Agent returned HTTP 500", START.plusSeconds(5)));

        Execution e = executions.findById("e3").orElseThrow();
        assertEquals(Execution.Status.CANCELLED, e.status());
        assertEquals("Cancelled by operator", e.error());
        assertEquals(4000L, e.durationMs());
    }

    @Test
    void concurrent_terminal_writes_have_one_winner() throws Exception {
        seedRunning("e4", "S1", START);
        var pool = Executors.newFixedThreadPool(2);
        var go = new CountDownLatch(1);
        try {
            Callable<Boolean> cancel = () -> { go.await(); return executions.cancelIfRunning("e4", "cancel", START.plusSeconds(1)); };
            Callable<Boolean> fail = () -> { go.await(); return executions.completeIfRunning("e4", Execution.Status.FAILED, null, "boom", START.plusSeconds(1)); };
            var f1 = pool.submit(cancel);
            var f2 = pool.submit(fail);
            go.countDown();
            assertTrue(f1.get() ^ f2.get());
        } finally {
            pool.shutdownNow();
        }
        assertTrue(executions.findById("e4").orElseThrow().status().terminal());
    }

    @Test
    void ad_hoc_execution_has_no_schedule_and_recent_is_newest_first() throws Exception {
        seedRunning("old", "S1", START);
        seedRunning("mid", "S1", START.plusSeconds(60));
        executions.create(Execution.started("adhoc", null, "beta", "ping", TriggerSource.API, START.plusSeconds(120)));

        List<Execution> recent = executions.findRecent(2);
        assertEquals(List.of("adhoc", "mid"), recent.stream().map(Execution::id).toList());
        assertNull(recent.get(0).scheduleId());
        assertEquals(TriggerSource.API, recent.get(0).triggeredBy());
        assertEquals(Execution.Status.RUNNING, recent.get(0).status());

        assertFalse(executions.completeIfRunning("ghost", Execution.Status.SUCCESS, null, null, START));
        assertTrue(executions.findById("ghost").isEmpty());
    }
}
