package net.kairos.agent.task;

public record TaskMetadata(Double costUsd,
                           Long durationMs,
                           Integer numTurns,
                           int toolCount,
                           String sessionId,
                           String executionId,
                           long inputTokens,
                           long outputTokens,
                           long cacheCreationTokens,
                           long cacheReadTokens,
                           long contextWindow) {

    public static final long DEFAULT_CONTEXT_WINDOW = 200_000;
}
