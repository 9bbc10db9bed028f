package net.kairos.core.model;

public record TaskMetrics(
        int contextUsed,        // input tokens
        int contextMax,
        int outputTokens,
        Double costUsd
) {
    public static final int DEFAULT_CONTEXT_MAX = 200_000;

    public static TaskMetrics empty() {
        return new TaskMetrics(0, DEFAULT_CONTEXT_MAX, 0, null);
    }

    public double contextPercent() {
        return Math.round(contextUsed * 1000.0 / Math.max(contextMax, 1)) / 10.0;
    }
}
