package net.kairos.agent.task;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.util.ArrayList;
import java.util.Iterator;
import java.util.List;

/**
 * 헤드리스 명령의 stream-json 출력(한 줄에 JSON 하나)을 읽어 응답 텍스트와 메타데이터를 모은다.
 *
 * <ul>
 *   <li>init(또는 system/init): 세션 id</li>
 *   <li>assistant/user: text 블록은 응답 조각, tool_use 블록은 도구 호출 수</li>
 *   <li>result: 최종 응답, 비용, 토큰 사용량. modelUsage 의 값이 더 크면 그쪽을 쓴다</li>
 * </ul>
 */
public class StreamJsonParser {
    private static final Logger log = LoggerFactory.getLogger(StreamJsonParser.class);

    private final ObjectMapper mapper;

    public StreamJsonParser(ObjectMapper mapper) {
        this.mapper = mapper;
    }

    public Accumulator newAccumulator() {
        return new Accumulator();
    }

    /** 한 실행 분량. stdout 리더가 채우고 실행 스레드가 읽는다 */
    public final class Accumulator {
        private final List<JsonNode> rawMessages = new ArrayList<>();
        private final List<String> responseParts = new ArrayList<>();
        private String sessionId;
        private Double costUsd;
        private Long durationMs;
        private Integer numTurns;
        private int toolCount;
        private long inputTokens;
        private long outputTokens;
        private long cacheCreationTokens;
        private long cacheReadTokens;
        private long contextWindow = TaskMetadata.DEFAULT_CONTEXT_WINDOW;

        private Accumulator() {
        }

        /** @return 반영한 메시지, 건너뛴 줄이면 null */
        public synchronized JsonNode accept(String line) {
            if (line == null || line.isBlank()) return null;
            JsonNode msg;
            try {
                msg = mapper.readTree(line);
            } catch (IOException e) {
                log.warn("Failed to parse line as JSON: {}", abbreviate(line));
                return null;
            }
            if (msg == null || !msg.isObject()) return null;
            rawMessages.add(msg);

            String type = msg.path("type").asText("");
            switch (type) {
                case "init" -> sessionId = textOrNull(msg, "session_id");
                case "system" -> {
                    if ("init".equals(msg.path("subtype").asText())) sessionId = textOrNull(msg, "session_id");
                }
                case "result" -> result(msg);
                case "assistant", "user" -> content(msg.path("message").path("content"));
                default -> log.trace("Ignoring stream message of type '{}'", type);
            }
            return msg;
        }

        private void result(JsonNode msg) {
            if (msg.hasNonNull("total_cost_usd")) costUsd = msg.get("total_cost_usd").asDouble();
            if (msg.hasNonNull("duration_ms")) durationMs = msg.get("duration_ms").asLong();
            if (msg.hasNonNull("num_turns")) numTurns = msg.get("num_turns").asInt();
            if (sessionId == null) sessionId = textOrNull(msg, "session_id");

            String result = msg.path("result").asText("");
            if (!result.isEmpty()) {
                responseParts.clear();
                responseParts.add(result);
            }

            JsonNode usage = msg.path("usage");
            inputTokens = usage.path("input_tokens").asLong(0);
            outputTokens = usage.path("output_tokens").asLong(0);
            cacheCreationTokens = usage.path("cache_creation_input_tokens").asLong(0);
            cacheReadTokens = usage.path("cache_read_input_tokens").asLong(0);

            // 첫 번째 모델 항목만 본다
            Iterator<JsonNode> models = msg.path("modelUsage").elements();
            if (models.hasNext()) {
                JsonNode m = models.next();
                if (m.has("contextWindow")) contextWindow = m.get("contextWindow").asLong(contextWindow);
                inputTokens = Math.max(inputTokens, m.path("inputTokens").asLong(0));
                outputTokens = Math.max(outputTokens, m.path("outputTokens").asLong(0));
            }
        }

        private void content(JsonNode blocks) {
            for (JsonNode block : blocks) {
                switch (block.path("type").asText("")) {
                    case "tool_use" -> toolCount++;
                    case "text" -> {
                        String text = block.path("text").asText("");
                        if (!text.isEmpty()) responseParts.add(text);
                    }
                    default -> {
                    }
                }
            }
        }

        public synchronized String response() {
            return String.join("\n", responseParts);
        }

        public synchronized List<JsonNode> rawMessages() {
            return List.copyOf(rawMessages);
        }

        public synchronized String sessionId() {
            return sessionId;
        }

        public synchronized TaskMetadata metadata(String executionId) {
            return new TaskMetadata(costUsd, durationMs, numTurns, toolCount, sessionId, executionId,
                    inputTokens, outputTokens, cacheCreationTokens, cacheReadTokens, contextWindow);
        }
    }

    private static String textOrNull(JsonNode n, String field) {
        JsonNode v = n.get(field);
        return v == null || v.isNull() ? null : v.asText();
    }

    private static String abbreviate(String line) {
        return line.length() > 100 ? line.substring(0, 100) : line;
    }
}
