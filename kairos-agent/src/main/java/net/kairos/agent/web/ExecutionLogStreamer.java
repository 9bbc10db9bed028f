package net.kairos.agent.web;

import com.fasterxml.jackson.databind.JsonNode;
import net.kairos.agent.process.LogSubscription;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.MediaType;
import org.springframework.web.servlet.mvc.method.annotation.SseEmitter;

import java.io.IOException;
import java.time.Duration;
import java.util.concurrent.ExecutorService;

/**
 * 로그 구독을 SSE 로 흘려보낸다. 항목마다 data 이벤트 하나, stream_end 를 보내면 응답을 닫는다.
 * 항목이 없는 동안에는 keepalive 주석을 보낸다.
 */
public class ExecutionLogStreamer {
    private static final Logger log = LoggerFactory.getLogger(ExecutionLogStreamer.class);

    private final ExecutorService pumps;
    private final Duration keepalive;
    private final Duration emitterTimeout;

    public ExecutionLogStreamer(ExecutorService pumps, Duration keepalive, Duration emitterTimeout) {
        this.pumps = pumps;
        this.keepalive = keepalive;
        this.emitterTimeout = emitterTimeout;
    }

    public SseEmitter open(LogSubscription subscription) {
        SseEmitter emitter = new SseEmitter(emitterTimeout.toMillis());
        emitter.onTimeout(subscription::close);
        emitter.onError(e -> subscription.close());
        pumps.submit(() -> pump(subscription, emitter));
        return emitter;
    }

    private void pump(LogSubscription subscription, SseEmitter emitter) {
        String id = subscription.executionId();
        try (subscription) {
            while (true) {
                JsonNode entry = subscription.poll(keepalive);
                if (entry == null) {
                    emitter.send(SseEmitter.event().comment("keepalive"));
                    continue;
                }
                emitter.send(SseEmitter.event().data(entry, MediaType.APPLICATION_JSON));
                if (LogSubscription.isStreamEnd(entry)) break;
            }
            emitter.complete();
            log.debug("Log stream for execution {} ended", id);
        } catch (IOException | IllegalStateException e) {
            // 클라이언트가 끊었거나 응답이 이미 닫힘
            log.debug("Log stream for execution {} closed: {}", id, e.toString());
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            emitter.completeWithError(e);
        }
    }
}
