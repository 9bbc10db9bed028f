package net.kairos.agent.web;

import net.kairos.agent.config.AgentProperties;
import net.kairos.agent.process.ProcessRegistry;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RestController;

@RestController
public class HealthController {
    private final ProcessRegistry registry;
    private final AgentProperties props;

    public HealthController(ProcessRegistry registry, AgentProperties props) {
        this.registry = registry;
        this.props = props;
    }

    public record Health(String status, String agentName, int runningExecutions) {}

    @GetMapping({"/api/health", "/health"})
    public Health health() {
        return new Health("healthy", props.getName(), registry.listRunning().size());
    }
}
