package net.kairos.agent.config;

import com.fasterxml.jackson.databind.ObjectMapper;
import net.kairos.agent.process.ProcessRegistry;
import net.kairos.agent.task.HeadlessTaskRunner;
import net.kairos.agent.task.StreamJsonParser;
import net.kairos.agent.web.ExecutionLogStreamer;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.concurrent.CustomizableThreadFactory;

import java.nio.file.Path;
import java.time.Clock;
import java.time.Duration;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;

@Configuration
@EnableConfigurationProperties(AgentProperties.class)
public class AgentConfig {

    @Bean
    public Clock agentClock() {
        return Clock.systemUTC();
    }

    @Bean
    public ProcessRegistry processRegistry(Clock agentClock) {
        return new ProcessRegistry(agentClock);
    }

    @Bean
    public StreamJsonParser streamJsonParser(ObjectMapper mapper) {
        return new StreamJsonParser(mapper);
    }

    // 실행 하나에 스레드 셋(stdin, stdout, stderr)
    @Bean(destroyMethod = "shutdownNow")
    public ExecutorService agentStreamPool() {
        return Executors.newCachedThreadPool(new CustomizableThreadFactory("agent-stream-"));
    }

    @Bean
    public HeadlessTaskRunner headlessTaskRunner(AgentProperties props,
                                                 ProcessRegistry registry,
                                                 StreamJsonParser parser,
                                                 ExecutorService agentStreamPool) {
        Path mcp = props.getMcpConfig() == null || props.getMcpConfig().isBlank()
                ? Path.of(System.getProperty("user.home"), ".mcp.json")
                : Path.of(props.getMcpConfig());
        return new HeadlessTaskRunner(props.getCommand(), mcp, registry, parser, agentStreamPool,
                props.getDefaultTaskTimeout(), props.getMaxTaskTimeout());
    }

    // 구독자 하나에 펌프 스레드 하나. 응답은 가장 긴 작업보다 1분 더 열어 둔다
    @Bean
    public ExecutionLogStreamer executionLogStreamer(AgentProperties props, ExecutorService agentStreamPool) {
        return new ExecutionLogStreamer(agentStreamPool, props.getLogStreamKeepalive(),
                props.getMaxTaskTimeout().plus(Duration.ofMinutes(1)));
    }
}
