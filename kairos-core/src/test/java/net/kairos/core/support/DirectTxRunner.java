package net.kairos.core.support;

import net.kairos.core.spi.TxRunner;

import java.util.concurrent.Callable;

/** 트랜잭션 경계 없이 바로 실행 */
public final class DirectTxRunner implements TxRunner {
    @Override
    public <T> T required(Callable<T> body) throws Exception {
        return body.call();
    }
}
