package net.kairos.core.spi;

import java.util.concurrent.Callable;

/**
 * 실행 기록의 종료 쓰기와 스케줄 실행 시각 갱신을 한 트랜잭션으로 묶는다.
 * 이미 트랜잭션 안에서 호출되면 바깥 트랜잭션에 참여한다.
 */
public interface TxRunner {
    <T> T required(Callable<T> body) throws Exception;
}
