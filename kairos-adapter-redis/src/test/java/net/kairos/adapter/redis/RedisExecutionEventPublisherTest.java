package net.kairos.adapter.redis;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import net.kairos.core.model.Execution;
import net.kairos.core.model.ExecutionEvent;
import net.kairos.core.model.TriggerSource;
import org.awaitility.Awaitility;
import org.junit.jupiter.api.Test;
import org.springframework.data.redis.listener.ChannelTopic;
import org.springframework.data.redis.listener.RedisMessageListenerContainer;

import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;

import static org.assertj.core.api.Assertions.assertThat;

class RedisExecutionEventPublisherTest extends RedisTestSupport {

    private final ObjectMapper mapper = new ObjectMapper();

    private static Execution exec() {
        return Execution.started("ex-1", "S1", "alpha", "hello", TriggerSource.MANUAL, Instant.now());
    }

    @Test
    void subscribers_receive_lifecycle_events() throws Exception {
        List<String> received = new CopyOnWriteArrayList<>();
        var container = new RedisMessageListenerContainer();
        container.setConnectionFactory(factory);
        container.addMessageListener((message, pattern) ->
                received.add(new String(message.getBody(), StandardCharsets.UTF_8)),
                new ChannelTopic(RedisExecutionEventPublisher.DEFAULT_CHANNEL));
        container.afterPropertiesSet();
        container.start();
        try {
            var publisher = new RedisExecutionEventPublisher(redis, mapper, RedisExecutionEventPublisher.DEFAULT_CHANNEL);
            // 구독이 붙을 때까지 발행 반복
            Awaitility.await().atMost(Duration.ofSeconds(5)).pollInterval(Duration.ofMillis(100)).until(() -> {
                publisher.publish(ExecutionEvent.started(exec(), "nightly"));
                return !received.isEmpty();
            });
        } finally {
            container.stop();
            container.destroy();
        }

        JsonNode n = mapper.readTree(received.get(0));
        assertThat(n.get("type").asText()).isEqualTo("execution_started");
        assertThat(n.get("execution_id").asText()).isEqualTo("ex-1");
        assertThat(n.get("schedule_name").asText()).isEqualTo("nightly");
        assertThat(n.get("triggered_by").asText()).isEqualTo("manual");
    }
}
