package net.kairos.core.service;

/** 발화 한 번의 결과 */
public enum FireOutcome {
    SKIPPED_LOCKED,
    SKIPPED_NOT_FOUND,
    SKIPPED_DISABLED,
    SKIPPED_POLICY,
    SUCCEEDED,
    FAILED,
    CANCELLED,
    /** 저장소 오류로 기록을 남기지 못함 */
    ERROR;

    public boolean skipped() {
        return this == SKIPPED_LOCKED || this == SKIPPED_NOT_FOUND
                || this == SKIPPED_DISABLED || this == SKIPPED_POLICY;
    }
}
