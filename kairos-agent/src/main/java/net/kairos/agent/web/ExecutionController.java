package net.kairos.agent.web;

import com.fasterxml.jackson.databind.JsonNode;
import net.kairos.agent.config.AgentProperties;
import net.kairos.agent.process.LogSubscription;
import net.kairos.agent.process.ProcessRegistry;
import net.kairos.agent.process.ProcessStatus;
import net.kairos.agent.process.TerminationOutcome;
import org.springframework.http.HttpStatus;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;
import org.springframework.web.server.ResponseStatusException;
import org.springframework.web.servlet.mvc.method.annotation.SseEmitter;

import java.time.Instant;
import java.util.List;
import java.util.Map;

@RestController
@RequestMapping("/api/executions")
public class ExecutionController {
    private final ProcessRegistry registry;
    private final AgentProperties props;
    private final ExecutionLogStreamer streamer;

    public ExecutionController(ProcessRegistry registry, AgentProperties props, ExecutionLogStreamer streamer) {
        this.registry = registry;
        this.props = props;
        this.streamer = streamer;
    }

    public record TerminateResponse(String status, String executionId, Integer returncode, String error) {}

    public record RunningView(String executionId, Instant startedAt, Map<String, Object> metadata) {}

    public record RunningResponse(List<RunningView> executions, int count) {}

    public record LookupResponse(String executionId) {}

    public record LogsResponse(String executionId, List<JsonNode> logs, int count) {}

    /** 등록되지 않은 실행은 404. 이미 끝난 실행은 already_finished 로 200 */
    @PostMapping("/{id}/terminate")
    public TerminateResponse terminate(@PathVariable("id") String id) {
        TerminationOutcome out = registry.terminate(id, props.getGracefulTimeout());
        if (out.status() == TerminationOutcome.Status.NOT_FOUND) {
            throw new ResponseStatusException(HttpStatus.NOT_FOUND, "Execution " + id + " not found or already finished");
        }
        return new TerminateResponse(out.status().code(), id, out.returncode(), out.error());
    }

    @GetMapping("/running")
    public RunningResponse running() {
        List<RunningView> views = registry.listRunning().stream()
                .map(s -> new RunningView(s.executionId(), s.startedAt(), s.metadata()))
                .toList();
        return new RunningResponse(views, views.size());
    }

    // 실행 id 를 모르는 호출자용
    @GetMapping("/lookup")
    public LookupResponse lookup(@RequestParam(name = "message", required = false) String message) {
        return registry.inferExecutionId(message)
                .map(LookupResponse::new)
                .orElseThrow(() -> new ResponseStatusException(HttpStatus.NOT_FOUND, "No unique running execution"));
    }

    /** 실시간 로그(SSE). 버퍼된 항목부터 보내고 실행이 끝나면 stream_end 로 닫는다 */
    @GetMapping("/{id}/stream")
    public SseEmitter stream(@PathVariable("id") String id) {
        LogSubscription subscription = registry.subscribeLogs(id)
                .orElseThrow(() -> new ResponseStatusException(HttpStatus.NOT_FOUND, "Execution " + id + " not found"));
        return streamer.open(subscription);
    }

    @GetMapping("/{id}/logs")
    public LogsResponse logs(@PathVariable("id") String id) {
        List<JsonNode> logs = registry.getBufferedLogs(id)
                .orElseThrow(() -> new ResponseStatusException(HttpStatus.NOT_FOUND, "Execution " + id + " not found"));
        return new LogsResponse(id, logs, logs.size());
    }

    @GetMapping("/{id}")
    public ProcessStatus status(@PathVariable("id") String id) {
        return registry.getStatus(id)
                .orElseThrow(() -> new ResponseStatusException(HttpStatus.NOT_FOUND, "Execution " + id + " not found"));
    }
}
