package net.kairos.app;

import net.kairos.adapter.jdbc.JdbcUtil;
import net.kairos.app.support.FakeAgent;
import net.kairos.core.lock.LockManager;
import net.kairos.core.service.SchedulerService;
import org.awaitility.Awaitility;
import org.junit.jupiter.api.AfterAll;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.boot.test.web.client.TestRestTemplate;
import org.springframework.core.ParameterizedTypeReference;
import org.springframework.data.redis.core.StringRedisTemplate;
import org.springframework.http.HttpMethod;
import org.springframework.http.HttpStatus;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.test.context.DynamicPropertyRegistry;
import org.springframework.test.context.DynamicPropertySource;
import org.testcontainers.containers.GenericContainer;
import org.testcontainers.junit.jupiter.Container;
import org.testcontainers.junit.jupiter.Testcontainers;
import org.testcontainers.utility.DockerImageName;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.time.Instant;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;

@SpringBootTest(webEnvironment = SpringBootTest.WebEnvironment.RANDOM_PORT)
@Testcontainers(disabledWithoutDocker = true)
class SchedulingFlowIntegrationTest {

    @Container
    static GenericContainer<?> redis = new GenericContainer<>(DockerImageName.parse("redis:7-alpine"))
            .withExposedPorts(6379);

    static final FakeAgent agent = startAgent();
    static final Path dbFile = tempDb();

    @DynamicPropertySource
    static void props(DynamicPropertyRegistry r) {
        r.add("spring.datasource.url", () -> "jdbc:sqlite:" + dbFile.toAbsolutePath());
        r.add("spring.flyway.enabled", () -> true);
        r.add("spring.data.redis.url", () -> "redis://" + redis.getHost() + ":" + redis.getMappedPort(6379));
        r.add("kairos.target.url-template", agent::template);
        r.add("kairos.instance-id", () -> "it-node");
        r.add("kairos.dispatch.timeout", () -> "10");
        r.add("kairos.dispatch.timeout-buffer", () -> "0");
    }

    @Autowired TestRestTemplate http;
    @Autowired JdbcTemplate jdbc;
    @Autowired StringRedisTemplate redisTemplate;
    @Autowired SchedulerService scheduler;

    @AfterAll
    static void cleanup() throws IOException {
        agent.close();
        Files.deleteIfExists(dbFile);
    }

    @Test
    void manual_trigger_runs_schedule_end_to_end() {
        String now = JdbcUtil.text(Instant.now());
        jdbc.update("""
            INSERT INTO agent_schedules (id, agent_name, name, cron_expression, message, enabled,
                                         timezone, owner_id, created_at, updated_at)
            VALUES ('IT1', 'alpha', 'nightly', '0 3 * * *', 'summarize', 1, 'UTC', 1, ?, ?)
        """, now, now);
        jdbc.update("""
            INSERT INTO agent_ownership (agent_name, owner_id, created_at, autonomy_enabled)
            VALUES ('alpha', 1, ?, 1)
        """, now);

        assertThat(scheduler.isRunning()).isTrue();
        assertThat(scheduler.syncNow().added).isEqualTo(1);

        Map<String, Object> status = http.exchange("/status", HttpMethod.GET, null,
                new ParameterizedTypeReference<Map<String, Object>>() {}).getBody();
        assertThat(status).containsEntry("jobs_count", 1).containsEntry("instance_id", "it-node");

        var trigger = http.postForEntity("/api/schedules/IT1/trigger", null, Map.class);
        assertThat(trigger.getStatusCode()).isEqualTo(HttpStatus.ACCEPTED);

        Awaitility.await().atMost(Duration.ofSeconds(15)).untilAsserted(() -> {
            var rows = jdbc.queryForList("SELECT status, triggered_by, response FROM schedule_executions WHERE schedule_id = 'IT1'");
            assertThat(rows).hasSize(1);
            assertThat(rows.get(0)).containsEntry("status", "success").containsEntry("triggered_by", "manual");
        });

        String lastRun = jdbc.queryForObject("SELECT last_run_at FROM agent_schedules WHERE id = 'IT1'", String.class);
        assertThat(lastRun).isNotNull();
        assertThat(redisTemplate.hasKey(LockManager.LOCK_PREFIX + LockManager.scheduleLockName("IT1"))).isFalse();
        assertThat(redisTemplate.opsForValue().get(LockManager.HEARTBEAT_PREFIX + "it-node")).isEqualTo("alive");
    }

    @Test
    void unknown_schedule_trigger_is_404() {
        var resp = http.postForEntity("/api/schedules/does-not-exist/trigger", null, Map.class);
        assertThat(resp.getStatusCode()).isEqualTo(HttpStatus.NOT_FOUND);
        assertThat(resp.getBody()).containsEntry("detail", "Schedule does-not-exist not found");
    }

    @Test
    void health_is_ok_while_running() {
        var resp = http.getForEntity("/health", Map.class);
        assertThat(resp.getStatusCode()).isEqualTo(HttpStatus.OK);
    }

    private static FakeAgent startAgent() {
        try {
            return new FakeAgent();
        } catch (IOException e) {
            throw new UncheckedIOException(e);
        }
    }

    private static Path tempDb() {
        try {
            return Files.createTempFile("kairos-it-", ".db");
        } catch (IOException e) {
            throw new UncheckedIOException(e);
        }
    }
}
