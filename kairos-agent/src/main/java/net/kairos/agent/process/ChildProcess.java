package net.kairos.agent.process;

import java.time.Duration;
import java.util.OptionalInt;

/**
 * 레지스트리가 다루는 자식 프로세스 핸들.
 * 종료 코드가 비어 있으면 아직 실행 중이다.
 */
public interface ChildProcess {

    enum Signal {
        /** SIGINT. 진행 중인 도구 호출을 마무리할 기회를 준다 */
        GRACEFUL,
        /** SIGKILL */
        FORCED
    }

    long pid();

    OptionalInt poll();

    void signal(Signal signal) throws Exception;

    /** timeout 안에 끝나면 종료 코드, 아니면 empty */
    OptionalInt waitFor(Duration timeout) throws InterruptedException;
}
