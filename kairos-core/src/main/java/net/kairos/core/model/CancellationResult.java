package net.kairos.core.model;

/**
 * 취소 요청 결과.
 * @param termination 실행 대상이 돌려준 종료 결과 (이미 종료된 기록이면 대상 호출 없이 ALREADY_FINISHED)
 * @param status      처리 후 기록 상태
 */
public record CancellationResult(
        String executionId,
        TerminationResult termination,
        Execution.Status status
) {
    public boolean cancelled() { return status == Execution.Status.CANCELLED; }
}
