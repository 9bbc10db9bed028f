package net.kairos.core.model;

import java.time.Instant;
import java.util.List;

public record SchedulerStatus(
        boolean running,
        int jobsCount,
        Instant lastCheck,
        double uptimeSeconds,
        String instanceId,
        List<JobView> jobs
) {
    public record JobView(String id, String name, Instant nextRun) {}
}
