package net.kairos.agent.config;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.convert.DurationUnit;

import java.time.Duration;
import java.time.temporal.ChronoUnit;
import java.util.ArrayList;
import java.util.List;

@ConfigurationProperties("kairos.agent")
public class AgentProperties {
    private String name = "agent";
    /** 헤드리스 실행 명령. 메시지는 stdin 으로 들어간다 */
    private List<String> command = new ArrayList<>(List.of(
            "claude", "--print", "--output-format", "stream-json", "--verbose", "--dangerously-skip-permissions"));
    /** 비어 있으면 ~/.mcp.json */
    private String mcpConfig;
    @DurationUnit(ChronoUnit.SECONDS)
    private Duration gracefulTimeout = Duration.ofSeconds(5);
    private long cleanupIntervalMs = 60_000;
    @DurationUnit(ChronoUnit.SECONDS)
    private Duration defaultTaskTimeout = Duration.ofSeconds(300);
    @DurationUnit(ChronoUnit.SECONDS)
    private Duration maxTaskTimeout = Duration.ofSeconds(3600);
    /** 로그 스트림에 항목이 없을 때 keepalive 주석 간격 */
    @DurationUnit(ChronoUnit.SECONDS)
    private Duration logStreamKeepalive = Duration.ofSeconds(15);

    public String getName() {
        return name;
    }

    public void setName(String name) {
        this.name = name;
    }

    public List<String> getCommand() {
        return command;
    }

    public void setCommand(List<String> command) {
        this.command = command;
    }

    public String getMcpConfig() {
        return mcpConfig;
    }

    public void setMcpConfig(String mcpConfig) {
        this.mcpConfig = mcpConfig;
    }

    public Duration getGracefulTimeout() {
        return gracefulTimeout;
    }

    public void setGracefulTimeout(Duration gracefulTimeout) {
        this.gracefulTimeout = gracefulTimeout;
    }

    public long getCleanupIntervalMs() {
        return cleanupIntervalMs;
    }

    public void setCleanupIntervalMs(long cleanupIntervalMs) {
        this.cleanupIntervalMs = cleanupIntervalMs;
    }

    public Duration getDefaultTaskTimeout() {
        return defaultTaskTimeout;
    }

    public void setDefaultTaskTimeout(Duration defaultTaskTimeout) {
        this.defaultTaskTimeout = defaultTaskTimeout;
    }

    public Duration getMaxTaskTimeout() {
        return maxTaskTimeout;
    }

    public void setMaxTaskTimeout(Duration maxTaskTimeout) {
        this.maxTaskTimeout = maxTaskTimeout;
    }

    public Duration getLogStreamKeepalive() {
        return logStreamKeepalive;
    }

    public void setLogStreamKeepalive(Duration logStreamKeepalive) {
        this.logStreamKeepalive = logStreamKeepalive;
    }
}
