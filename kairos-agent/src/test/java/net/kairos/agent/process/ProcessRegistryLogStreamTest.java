package net.kairos.agent.process;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import org.junit.jupiter.api.Test;

import java.time.Clock;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertTrue;

class ProcessRegistryLogStreamTest {

    private static final Duration WAIT = Duration.ofMillis(200);

    private final ProcessRegistry registry = new ProcessRegistry(Clock.systemUTC());

    private static JsonNode entry(int n) {
        return JsonNodeFactory.instance.objectNode().put("type", "assistant").put("seq", n);
    }

    /** stream_end 까지 읽는다 */
    private static List<JsonNode> drain(LogSubscription sub) throws InterruptedException {
        List<JsonNode> out = new ArrayList<>();
        for (int i = 0; i < 5000; i++) {
            JsonNode e = sub.poll(WAIT);
            if (e == null) break;
            out.add(e);
            if (LogSubscription.isStreamEnd(e)) break;
        }
        return out;
    }

    @Test
    void late_subscriber_gets_buffered_entries_then_live_ones_then_stream_end() throws Exception {
        registry.register("e1", new FakeChildProcess(1), Map.of());
        registry.publishLogEntry("e1", entry(1));
        registry.publishLogEntry("e1", entry(2));

        LogSubscription sub = registry.subscribeLogs("e1").orElseThrow();
        registry.publishLogEntry("e1", entry(3));
        registry.unregister("e1");

        List<JsonNode> got = drain(sub);
        assertThat(got).hasSize(4);
        assertThat(got.subList(0, 3)).extracting(n -> n.path("seq").asInt()).containsExactly(1, 2, 3);
        assertTrue(LogSubscription.isStreamEnd(got.get(3)));
    }

    @Test
    void every_subscriber_receives_each_entry() throws Exception {
        registry.register("e1", new FakeChildProcess(1), Map.of());
        LogSubscription a = registry.subscribeLogs("e1").orElseThrow();
        LogSubscription b = registry.subscribeLogs("e1").orElseThrow();

        registry.publishLogEntry("e1", entry(7));
        registry.unregister("e1");

        List<JsonNode> fromA = drain(a);
        assertThat(fromA).hasSize(2);
        assertThat(fromA.get(0).path("seq").asInt()).isEqualTo(7);
        assertThat(drain(b)).hasSize(2);
    }

    @Test
    void buffer_keeps_only_the_most_recent_entries() {
        registry.register("e1", new FakeChildProcess(1), Map.of());
        for (int i = 0; i < ProcessRegistry.LOG_BUFFER_SIZE + 50; i++) {
            registry.publishLogEntry("e1", entry(i));
        }

        List<JsonNode> buffered = registry.getBufferedLogs("e1").orElseThrow();
        assertThat(buffered).hasSize(ProcessRegistry.LOG_BUFFER_SIZE);
        assertThat(buffered.get(0).path("seq").asInt()).isEqualTo(50);
    }

    @Test
    void unknown_or_unregistered_execution_has_no_stream() {
        assertThat(registry.subscribeLogs("nope")).isEmpty();
        assertThat(registry.getBufferedLogs("nope")).isEmpty();
        registry.publishLogEntry("nope", entry(1));

        registry.register("e1", new FakeChildProcess(1), Map.of());
        registry.unregister("e1");
        assertThat(registry.subscribeLogs("e1")).isEmpty();
        assertThat(registry.getBufferedLogs("e1")).isEmpty();
    }

    @Test
    void slow_subscriber_drops_overflow_but_still_sees_stream_end() throws Exception {
        registry.register("e1", new FakeChildProcess(1), Map.of());
        LogSubscription sub = registry.subscribeLogs("e1").orElseThrow();
        for (int i = 0; i < LogSubscription.QUEUE_CAPACITY + 20; i++) {
            registry.publishLogEntry("e1", entry(i));
        }
        registry.unregister("e1");

        List<JsonNode> got = drain(sub);
        assertThat(got).hasSize(LogSubscription.QUEUE_CAPACITY + 1);
        assertTrue(LogSubscription.isStreamEnd(got.get(got.size() - 1)));
    }

    @Test
    void closed_subscription_stops_receiving() throws Exception {
        registry.register("e1", new FakeChildProcess(1), Map.of());
        LogSubscription sub = registry.subscribeLogs("e1").orElseThrow();
        sub.close();

        registry.publishLogEntry("e1", entry(1));

        // 닫힌 구독은 남은 항목 없이 바로 끝을 알린다
        assertTrue(LogSubscription.isStreamEnd(sub.poll(WAIT)));
        assertThat(registry.getBufferedLogs("e1").orElseThrow()).hasSize(1);
    }

    @Test
    void poll_times_out_with_null_while_execution_is_quiet() throws Exception {
        registry.register("e1", new FakeChildProcess(1), Map.of());
        LogSubscription sub = registry.subscribeLogs("e1").orElseThrow();

        assertNull(sub.poll(Duration.ofMillis(50)));
    }
}
