package net.kairos.adapter.redis;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import net.kairos.core.model.ExecutionEvent;
import net.kairos.core.spi.ExecutionEventPublisher;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.data.redis.core.StringRedisTemplate;

/**
 * 실행 수명주기 이벤트를 Redis pub/sub 채널에 JSON 으로 발행한다.
 * 선택 필드(schedule_name, status, error)는 값이 있을 때만 넣는다.
 */
public final class RedisExecutionEventPublisher implements ExecutionEventPublisher {
    private static final Logger log = LoggerFactory.getLogger(RedisExecutionEventPublisher.class);

    public static final String DEFAULT_CHANNEL = "scheduler:events";

    private final StringRedisTemplate redis;
    private final ObjectMapper mapper;
    private final String channel;

    public RedisExecutionEventPublisher(StringRedisTemplate redis, ObjectMapper mapper, String channel) {
        this.redis = redis;
        this.mapper = mapper;
        this.channel = channel;
    }

    @Override
    public void publish(ExecutionEvent event) throws Exception {
        String json = toJson(event);
        Long receivers = redis.convertAndSend(channel, json);
        log.debug("Published {} to {} ({} receivers)", event.type().code(), channel, receivers);
    }

    String toJson(ExecutionEvent e) throws Exception {
        ObjectNode n = mapper.createObjectNode();
        n.put("type", e.type().code());
        n.put("schedule_id", e.scheduleId());
        n.put("execution_id", e.executionId());
        n.put("agent", e.agentName());
        if (e.scheduleName() != null) n.put("schedule_name", e.scheduleName());
        if (e.status() != null) n.put("status", e.status().code());
        if (e.error() != null) n.put("error", e.error());
        n.put("triggered_by", e.triggeredBy() == null ? null : e.triggeredBy().code());
        return mapper.writeValueAsString(n);
    }
}
