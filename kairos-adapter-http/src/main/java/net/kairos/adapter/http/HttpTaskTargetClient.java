package net.kairos.adapter.http;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import net.kairos.core.error.TargetException;
import net.kairos.core.error.TargetRequestException;
import net.kairos.core.error.TargetTimeoutException;
import net.kairos.core.error.TargetUnreachableException;
import net.kairos.core.model.RunningExecution;
import net.kairos.core.model.TaskResult;
import net.kairos.core.model.TerminationResult;
import net.kairos.core.spi.TaskTargetClient;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.net.ConnectException;
import java.net.http.HttpClient;
import java.net.http.HttpConnectTimeoutException;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.net.http.HttpTimeoutException;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.time.Instant;
import java.time.format.DateTimeParseException;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * 실행 대상(에이전트 컨테이너) HTTP 클라이언트.
 * 태스크 요청의 HTTP 타임아웃은 대상에 넘기는 timeout 에 버퍼를 더한 값이다.
 */
public final class HttpTaskTargetClient implements TaskTargetClient {
    private static final Logger log = LoggerFactory.getLogger(HttpTaskTargetClient.class);
    private static final TypeReference<Map<String, Object>> METADATA_TYPE = new TypeReference<>() {};

    static final int ERROR_EXCERPT_CHARS = 500;

    private final HttpClient http;
    private final ObjectMapper mapper;
    private final TargetEndpointResolver endpoints;
    private final TaskResponseParser parser;
    private final Duration timeoutBuffer;
    private final Duration controlTimeout;

    /**
     * @param timeoutBuffer  태스크 요청 HTTP 타임아웃 여유분
     * @param controlTimeout 종료/목록/헬스 요청 타임아웃
     */
    public HttpTaskTargetClient(HttpClient http,
                                ObjectMapper mapper,
                                TargetEndpointResolver endpoints,
                                Duration timeoutBuffer,
                                Duration controlTimeout) {
        this.http = http;
        this.mapper = mapper;
        this.endpoints = endpoints;
        this.parser = new TaskResponseParser(mapper);
        this.timeoutBuffer = timeoutBuffer;
        this.controlTimeout = controlTimeout;
    }

    @Override
    public TaskResult dispatch(String target, String message, String executionId, Duration timeout) throws TargetException {
        ObjectNode payload = mapper.createObjectNode();
        payload.put("message", message);
        payload.put("timeout_seconds", timeout.toSeconds());
        if (executionId != null) payload.put("execution_id", executionId);

        Duration httpTimeout = timeout.plus(timeoutBuffer);
        HttpResponse<String> resp = send(target, HttpRequest.newBuilder(endpoints.resolve(target, "/api/task"))
                .timeout(httpTimeout)
                .header("Content-Type", "application/json")
                .POST(HttpRequest.BodyPublishers.ofString(write(payload), StandardCharsets.UTF_8))
                .build(), httpTimeout);

        if (resp.statusCode() >= 400) {
            throw new TargetRequestException(target, resp.statusCode(), errorDetail(resp));
        }
        try {
            return parser.parse(mapper.readTree(resp.body()));
        } catch (Exception e) {
            throw new TargetRequestException(target, resp.statusCode(), "Invalid task response: " + e.getMessage());
        }
    }

    @Override
    public TerminationResult terminate(String target, String executionId) throws TargetException {
        HttpResponse<String> resp = send(target, HttpRequest.newBuilder(
                        endpoints.resolve(target, "/api/executions/" + executionId + "/terminate"))
                .timeout(controlTimeout)
                .POST(HttpRequest.BodyPublishers.noBody())
                .build(), controlTimeout);

        if (resp.statusCode() == 404) return new TerminationResult(TerminationResult.Status.NOT_FOUND, null, null);
        if (resp.statusCode() >= 400) {
            throw new TargetRequestException(target, resp.statusCode(), errorDetail(resp));
        }
        JsonNode body = readOrEmpty(resp.body());
        JsonNode rc = body.get("returncode");
        return new TerminationResult(
                TerminationResult.Status.from(body.path("status").asText(null)),
                rc == null || rc.isNull() ? null : rc.asInt(),
                body.hasNonNull("error") ? body.get("error").asText() : null);
    }

    @Override
    public List<RunningExecution> listRunning(String target) throws TargetException {
        HttpResponse<String> resp = send(target, HttpRequest.newBuilder(endpoints.resolve(target, "/api/executions/running"))
                .timeout(controlTimeout)
                .GET()
                .build(), controlTimeout);
        if (resp.statusCode() >= 400) {
            throw new TargetRequestException(target, resp.statusCode(), errorDetail(resp));
        }

        List<RunningExecution> out = new ArrayList<>();
        for (JsonNode n : readOrEmpty(resp.body()).path("executions")) {
            Map<String, Object> meta = n.has("metadata") ? mapper.convertValue(n.get("metadata"), METADATA_TYPE) : Map.of();
            out.add(new RunningExecution(n.path("execution_id").asText(), instantOrNull(n.path("started_at").asText(null)), meta));
        }
        return out;
    }

    @Override
    public boolean healthCheck(String target) {
        try {
            var resp = send(target, HttpRequest.newBuilder(endpoints.resolve(target, "/api/health"))
                    .timeout(controlTimeout)
                    .GET()
                    .build(), controlTimeout);
            return resp.statusCode() == 200;
        } catch (TargetException e) {
            log.debug("Health check of {} failed: {}", target, e.describe());
            return false;
        }
    }

    private HttpResponse<String> send(String target, HttpRequest req, Duration timeout) throws TargetException {
        try {
            return http.send(req, HttpResponse.BodyHandlers.ofString(StandardCharsets.UTF_8));
        } catch (HttpConnectTimeoutException e) {
            throw new TargetUnreachableException(target, "Cannot connect to agent " + target + ": connect timed out", e);
        } catch (HttpTimeoutException e) {
            throw new TargetTimeoutException(target, timeout, e);
        } catch (ConnectException e) {
            throw new TargetUnreachableException(target, "Cannot connect to agent " + target + ": " + describe(e), e);
        } catch (IOException e) {
            throw new TargetUnreachableException(target, "Request to agent " + target + " failed: " + describe(e), e);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new TargetUnreachableException(target, "Request to agent " + target + " interrupted", e);
        }
    }

    /** {"detail": ...} 가 있으면 그것, 아니면 본문 앞 500자 */
    String errorDetail(HttpResponse<String> resp) {
        String body = resp.body();
        if (body != null && !body.isBlank()) {
            try {
                JsonNode n = mapper.readTree(body);
                JsonNode detail = n.get("detail");
                if (detail != null && !detail.isNull()) {
                    return detail.isTextual() ? detail.asText() : mapper.writeValueAsString(detail);
                }
            } catch (IOException e) {
                log.trace("Error body is not JSON: {}", e.getMessage());
            }
            return body.length() > ERROR_EXCERPT_CHARS ? body.substring(0, ERROR_EXCERPT_CHARS) : body;
        }
        return "HTTP " + resp.statusCode() + " error";
    }

    private JsonNode readOrEmpty(String body) {
        if (body == null || body.isBlank()) return mapper.createObjectNode();
        try {
            return mapper.readTree(body);
        } catch (IOException e) {
            log.warn("Ignoring malformed response body: {}", e.getMessage());
            return mapper.createObjectNode();
        }
    }

    private String write(JsonNode n) {
        try {
            return mapper.writeValueAsString(n);
        } catch (IOException e) {
            throw new IllegalStateException(e);
        }
    }

    private static Instant instantOrNull(String s) {
        if (s == null) return null;
        try {
            return Instant.parse(s);
        } catch (DateTimeParseException e) {
            log.debug("Unparseable started_at '{}'", s);
            return null;
        }
    }

    private static String describe(Throwable e) {
        return e.getMessage() != null ? e.getMessage() : e.getClass().getSimpleName();
    }
}
