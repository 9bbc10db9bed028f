package net.kairos.agent.process;

import java.time.Instant;
import java.util.Map;

/** returncode 는 실행 중이면 null */
public record ProcessStatus(String executionId,
                            boolean running,
                            Integer returncode,
                            Instant startedAt,
                            Map<String, Object> metadata) {
}
