package net.kairos.agent.web;

import com.fasterxml.jackson.databind.JsonNode;
import net.kairos.agent.task.HeadlessTaskRunner;
import net.kairos.agent.task.TaskMetadata;
import net.kairos.agent.task.TaskOutcome;
import net.kairos.agent.task.TaskRequest;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RestController;
import org.springframework.web.server.ResponseStatusException;

import java.time.Clock;
import java.time.Instant;
import java.util.List;

/** 상태 없는 태스크 실행. 요청마다 독립적이며 병렬로 돈다 */
@RestController
public class TaskController {
    private static final Logger log = LoggerFactory.getLogger(TaskController.class);

    private final HeadlessTaskRunner runner;
    private final Clock clock;

    public TaskController(HeadlessTaskRunner runner, Clock agentClock) {
        this.runner = runner;
        this.clock = agentClock;
    }

    public record TaskResponse(String response,
                               List<JsonNode> executionLog,
                               TaskMetadata metadata,
                               String sessionId,
                               Instant timestamp) {}

    @PostMapping("/api/task")
    public TaskResponse execute(@RequestBody TaskRequest req) throws Exception {
        if (req == null || req.message() == null || req.message().isBlank()) {
            throw new ResponseStatusException(HttpStatus.BAD_REQUEST, "message is required");
        }
        log.info("Executing task {}: {}", req.executionId(), abbreviate(req.message()));
        TaskOutcome out = runner.run(req);
        return new TaskResponse(out.response(), out.executionLog(), out.metadata(), out.sessionId(), clock.instant());
    }

    private static String abbreviate(String s) {
        return s.length() > 50 ? s.substring(0, 50) + "..." : s;
    }
}
