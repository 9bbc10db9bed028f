package net.kairos.app.web;

import net.kairos.core.error.ExecutionNotFoundException;
import net.kairos.core.model.CancellationResult;
import net.kairos.core.model.Execution;
import net.kairos.core.service.ExecutionCancellationService;
import net.kairos.core.service.SchedulerService;
import net.kairos.core.spi.ExecutionRepository;
import org.springframework.http.HttpStatus;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.ResponseStatus;
import org.springframework.web.bind.annotation.RestController;
import org.springframework.web.server.ResponseStatusException;

import java.util.List;

@RestController
@RequestMapping("/api/executions")
public class ExecutionController {
    static final int MAX_LIMIT = 100;

    private final ExecutionRepository executions;
    private final ExecutionCancellationService cancellation;
    private final SchedulerService scheduler;

    public ExecutionController(ExecutionRepository executions,
                               ExecutionCancellationService cancellation,
                               SchedulerService scheduler) {
        this.executions = executions;
        this.cancellation = cancellation;
        this.scheduler = scheduler;
    }

    public record DispatchRequest(String agentName, String message) {}

    public record DispatchResponse(String executionId, String agentName, String status) {}

    public record TerminationView(String status, Integer returncode, String error) {}

    public record CancelResponse(String executionId, String status, boolean cancelled, TerminationView termination) {
        static CancelResponse of(CancellationResult r) {
            var t = r.termination();
            return new CancelResponse(r.executionId(), r.status().code(), r.cancelled(),
                    new TerminationView(t.status().code(), t.returnCode(), t.error()));
        }
    }

    @GetMapping
    public List<ExecutionView> recent(@RequestParam(name = "limit", defaultValue = "20") int limit) throws Exception {
        if (limit < 1) throw new ResponseStatusException(HttpStatus.BAD_REQUEST, "limit must be positive");
        return executions.findRecent(Math.min(limit, MAX_LIMIT)).stream().map(ExecutionView::of).toList();
    }

    @GetMapping("/{id}")
    public ExecutionView get(@PathVariable("id") String id) throws Exception {
        Execution e = executions.findById(id).orElseThrow(() -> new ExecutionNotFoundException(id));
        return ExecutionView.of(e);
    }

    /** 스케줄 없이 대상에 바로 보낸다. 결과는 실행 기록으로 확인 */
    @PostMapping
    @ResponseStatus(HttpStatus.ACCEPTED)
    public DispatchResponse dispatch(@RequestBody DispatchRequest req) throws Exception {
        if (req == null || isBlank(req.agentName()) || isBlank(req.message())) {
            throw new ResponseStatusException(HttpStatus.BAD_REQUEST, "agent_name and message are required");
        }
        Execution e = scheduler.dispatchAdHoc(req.agentName().trim(), req.message());
        return new DispatchResponse(e.id(), e.agentName(), e.status().code());
    }

    @PostMapping("/{id}/cancel")
    public CancelResponse cancel(@PathVariable("id") String id) throws Exception {
        return CancelResponse.of(cancellation.cancel(id));
    }

    private static boolean isBlank(String s) {
        return s == null || s.isBlank();
    }
}
