package net.kairos.core.spi;

import net.kairos.core.model.ExecutionEvent;

/** best-effort 브로드캐스트. 구현체는 실패해도 예외를 던질 수 있으나 코어가 삼킨다. */
public interface ExecutionEventPublisher {
    void publish(ExecutionEvent event) throws Exception;

    static ExecutionEventPublisher noop() {
        return event -> { };
    }
}
