package net.kairos.agent.task;

import com.fasterxml.jackson.databind.JsonNode;

import java.util.List;

/** executionLog 는 명령이 stdout 으로 낸 JSON 메시지 원본 그대로 */
public record TaskOutcome(String response, List<JsonNode> executionLog, TaskMetadata metadata, String sessionId) {
}
