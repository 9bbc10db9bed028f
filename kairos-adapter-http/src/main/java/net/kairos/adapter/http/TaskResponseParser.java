package net.kairos.adapter.http;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import net.kairos.core.model.TaskMetrics;
import net.kairos.core.model.TaskResult;

/**
 * /api/task 응답 파싱.
 * response 는 10 000자에서 자르고, execution_log 는 JSON 그대로 보관한다.
 */
public final class TaskResponseParser {
    public static final int MAX_RESPONSE_CHARS = 10_000;
    public static final String TRUNCATION_MARKER = "... (truncated)";

    private final ObjectMapper mapper;

    public TaskResponseParser(ObjectMapper mapper) {
        this.mapper = mapper;
    }

    public TaskResult parse(JsonNode body) throws Exception {
        JsonNode resp = body.get("response");
        String text = resp == null || resp.isNull()
                ? mapper.writeValueAsString(body)
                : resp.isTextual() ? resp.asText() : mapper.writeValueAsString(resp);
        if (text.length() > MAX_RESPONSE_CHARS) {
            text = text.substring(0, MAX_RESPONSE_CHARS) + TRUNCATION_MARKER;
        }

        JsonNode meta = body.path("metadata");
        int contextUsed = meta.path("input_tokens").asInt(0);
        int contextMax = meta.path("context_window").asInt(TaskMetrics.DEFAULT_CONTEXT_MAX);
        int outputTokens = meta.path("output_tokens").asInt(0);
        JsonNode cost = meta.get("cost_usd");
        Double costUsd = cost == null || cost.isNull() ? null : cost.asDouble();

        JsonNode log = body.get("execution_log");
        String executionLog = log == null || log.isNull() ? null : mapper.writeValueAsString(log);

        return new TaskResult(text, new TaskMetrics(contextUsed, contextMax, outputTokens, costUsd), executionLog);
    }
}
