package net.kairos.agent.task;

import java.util.List;

/**
 * /api/task 요청 본문. executionId 가 없으면 대상이 임의로 만든다.
 */
public record TaskRequest(String message,
                          Integer timeoutSeconds,
                          String executionId,
                          String model,
                          List<String> allowedTools,
                          String systemPrompt,
                          Integer maxTurns) {

    public static TaskRequest of(String message, Integer timeoutSeconds, String executionId) {
        return new TaskRequest(message, timeoutSeconds, executionId, null, null, null, null);
    }
}
