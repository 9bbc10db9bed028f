package net.kairos.app.web;

import net.kairos.core.service.SchedulerService;
import org.springframework.http.HttpStatus;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.ResponseStatus;
import org.springframework.web.bind.annotation.RestController;

import java.time.Instant;

@RestController
@RequestMapping("/api/schedules")
public class ScheduleController {

    private final SchedulerService scheduler;

    public ScheduleController(SchedulerService scheduler) {
        this.scheduler = scheduler;
    }

    public record TriggerResponse(String status, String scheduleId, Instant triggeredAt) {}

    /** 실행 결과는 기다리지 않는다. 없는 스케줄이면 404 */
    @PostMapping("/{id}/trigger")
    @ResponseStatus(HttpStatus.ACCEPTED)
    public TriggerResponse trigger(@PathVariable("id") String scheduleId) throws Exception {
        Instant at = scheduler.trigger(scheduleId);
        return new TriggerResponse("triggered", scheduleId, at);
    }
}
