package net.kairos.core.model;

/**
 * 실행 대상이 돌려준 결과.
 * executionLog는 대상이 준 JSON을 그대로 보관한다(파싱하지 않음).
 */
public record TaskResult(
        String responseText,
        TaskMetrics metrics,
        String executionLog
) {}
