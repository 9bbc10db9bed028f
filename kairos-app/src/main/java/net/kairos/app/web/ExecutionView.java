package net.kairos.app.web;

import net.kairos.core.model.Execution;

import java.time.Instant;

/** 실행 기록 응답 본문 (상태/트리거는 소문자 코드) */
public record ExecutionView(
        String id,
        String scheduleId,
        String agentName,
        String status,
        String message,
        String triggeredBy,
        Instant startedAt,
        Instant completedAt,
        Long durationMs,
        String response,
        Integer contextUsed,
        Integer contextMax,
        Double cost,
        String toolCalls,
        String executionLog,
        String error
) {
    public static ExecutionView of(Execution e) {
        return new ExecutionView(e.id(), e.scheduleId(), e.agentName(), e.status().code(), e.message(),
                e.triggeredBy() == null ? null : e.triggeredBy().code(),
                e.startedAt(), e.completedAt(), e.durationMs(), e.response(),
                e.contextUsed(), e.contextMax(), e.cost(), e.toolCalls(), e.executionLog(), e.error());
    }
}
