package net.kairos.core.error;

/** 실행 대상(에이전트) 호출 실패의 공통 상위 타입 */
public abstract class TargetException extends Exception {
    private final String target;

    protected TargetException(String target, String message, Throwable cause) {
        super(message, cause);
        this.target = target;
    }

    public String target() { return target; }

    /** 실행 기록 error 컬럼에 남길 문자열 */
    public abstract String describe();
}
