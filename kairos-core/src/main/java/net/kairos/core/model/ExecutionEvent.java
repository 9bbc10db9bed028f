package net.kairos.core.model;

public record ExecutionEvent(
        Type type,
        String scheduleId,
        String executionId,
        String agentName,
        String scheduleName,
        Execution.Status status,    // completed 에서만
        String error,
        TriggerSource triggeredBy
) {
    public enum Type {
        EXECUTION_STARTED, EXECUTION_COMPLETED, EXECUTION_SKIPPED;
        public String code() { return name().toLowerCase(); }
    }

    public static ExecutionEvent started(Execution e, String scheduleName) {
        return new ExecutionEvent(Type.EXECUTION_STARTED, e.scheduleId(), e.id(), e.agentName(),
                scheduleName, null, null, e.triggeredBy());
    }

    public static ExecutionEvent completed(Execution e, Execution.Status status, String error) {
        return new ExecutionEvent(Type.EXECUTION_COMPLETED, e.scheduleId(), e.id(), e.agentName(),
                null, status, error, e.triggeredBy());
    }

    public static ExecutionEvent skipped(Schedule s, String reason, TriggerSource triggeredBy) {
        return new ExecutionEvent(Type.EXECUTION_SKIPPED, s.id(), null, s.agentName(),
                s.name(), null, reason, triggeredBy);
    }
}
