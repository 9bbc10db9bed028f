package net.kairos.core.model;

import java.time.Instant;
import java.util.Map;

/** 실행 대상의 프로세스 레지스트리에 올라 있는 실행 한 건 */
public record RunningExecution(
        String executionId,
        Instant startedAt,
        Map<String, Object> metadata
) {}
