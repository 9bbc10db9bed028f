package net.kairos.app.web;

import net.kairos.core.model.SchedulerStatus;
import net.kairos.core.service.SchedulerService;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.LinkedHashMap;
import java.util.Map;

/** 헬스/상태/서비스 정보 */
@RestController
public class SchedulerStatusController {
    static final String SERVICE_NAME = "Kairos Scheduler";
    static final String VERSION = "1.0.0";

    private final SchedulerService scheduler;

    public SchedulerStatusController(SchedulerService scheduler) {
        this.scheduler = scheduler;
    }

    @GetMapping("/")
    public Map<String, Object> info() {
        Map<String, String> endpoints = new LinkedHashMap<>();
        endpoints.put("/health", "Health check");
        endpoints.put("/status", "Detailed status");
        endpoints.put("/api/schedules/{id}/trigger", "Trigger a schedule now");
        endpoints.put("/api/executions", "Recent executions");

        Map<String, Object> body = new LinkedHashMap<>();
        body.put("service", SERVICE_NAME);
        body.put("version", VERSION);
        body.put("endpoints", endpoints);
        return body;
    }

    @GetMapping("/health")
    public ResponseEntity<Map<String, String>> health() {
        if (scheduler.isRunning()) return ResponseEntity.ok(Map.of("status", "healthy"));
        return ResponseEntity.status(HttpStatus.SERVICE_UNAVAILABLE).body(Map.of("status", "unhealthy"));
    }

    @GetMapping("/status")
    public SchedulerStatus status() {
        return scheduler.status();
    }
}
