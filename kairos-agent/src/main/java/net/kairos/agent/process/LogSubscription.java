package net.kairos.agent.process;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import com.fasterxml.jackson.databind.node.ObjectNode;

import java.time.Duration;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.TimeUnit;
import java.util.function.Consumer;

/**
 * 실행 하나의 실시간 로그 구독. 구독 시점까지 버퍼된 항목이 먼저 오고, 마지막 항목은 stream_end.
 *
 * <p>큐가 차면 새 항목은 이 구독자에게서만 버려진다. stream_end 는 큐 상태와 관계없이 전달된다.
 */
public final class LogSubscription implements AutoCloseable {

    static final int QUEUE_CAPACITY = 500;

    private static final ObjectNode STREAM_END = JsonNodeFactory.instance.objectNode().put("type", "stream_end");

    private final String executionId;
    private final BlockingQueue<JsonNode> queue = new LinkedBlockingQueue<>(QUEUE_CAPACITY);
    private final Consumer<LogSubscription> onClose;
    private volatile boolean ended;

    LogSubscription(String executionId, Consumer<LogSubscription> onClose) {
        this.executionId = executionId;
        this.onClose = onClose;
    }

    public String executionId() { return executionId; }

    public static boolean isStreamEnd(JsonNode entry) {
        return entry != null && "stream_end".equals(entry.path("type").asText());
    }

    /** @return 큐가 가득 차 버렸으면 false */
    boolean offer(JsonNode entry) {
        return queue.offer(entry);
    }

    void end() {
        ended = true;
        queue.offer(STREAM_END.deepCopy());
    }

    /**
     * 다음 항목을 최대 timeout 동안 기다린다.
     * @return 다음 항목, 시간 안에 없으면 null
     */
    public JsonNode poll(Duration timeout) throws InterruptedException {
        JsonNode entry = queue.poll(timeout.toMillis(), TimeUnit.MILLISECONDS);
        if (entry == null && ended) return STREAM_END.deepCopy();
        return entry;
    }

    @Override
    public void close() {
        ended = true;
        onClose.accept(this);
    }
}
