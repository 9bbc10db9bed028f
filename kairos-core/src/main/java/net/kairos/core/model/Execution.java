package net.kairos.core.model;

import java.time.Instant;

public record Execution(
        String id,              // 프로세스 레지스트리 키와 동일
        String scheduleId,      // ad-hoc 실행이면 null
        String agentName,
        Status status,
        String message,
        TriggerSource triggeredBy,
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
    public enum Status {
        RUNNING, SUCCESS, FAILED, CANCELLED, UNKNOWN;

        public static Status from(String s) {
            if (s == null) return UNKNOWN;
            try { return Status.valueOf(s.toUpperCase()); } catch (IllegalArgumentException e) { return UNKNOWN; }
        }
        public String code() { return name().toLowerCase(); }
        public boolean terminal() { return this == SUCCESS || this == FAILED || this == CANCELLED; }
    }

    public static Execution started(String id, String scheduleId, String agentName,
                                    String message, TriggerSource triggeredBy, Instant startedAt) {
        return new Execution(id, scheduleId, agentName, Status.RUNNING, message, triggeredBy, startedAt,
                null, null, null, null, null, null, null, null, null);
    }
}
