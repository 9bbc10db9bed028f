package net.kairos.adapter.jdbc;

import java.sql.Connection;
import java.util.concurrent.Callable;

/**
 * 스레드에 묶인 트랜잭션 커넥션.
 * 저장소는 묶인 커넥션이 있으면 그것을 쓰고, 없으면 풀에서 꺼내 자동 커밋으로 쓴다.
 */
public final class TxContext {
    private static final ThreadLocal<Connection> BOUND = new ThreadLocal<>();

    private TxContext() {
    }

    /** 없으면 null */
    public static Connection current() {
        return BOUND.get();
    }

    /** @return 이전에 묶여 있던 커넥션. {@link #restore}에 그대로 넘긴다 */
    static Connection bind(Connection c) {
        Connection previous = BOUND.get();
        BOUND.set(c);
        return previous;
    }

    static void restore(Connection previous) {
        if (previous != null) BOUND.set(previous);
        else BOUND.remove();
    }

    /** 스프링 트랜잭션 러너용 */
    public static <T> T callBound(Connection c, Callable<T> body) throws Exception {
        Connection previous = bind(c);
        try {
            return body.call();
        } finally {
            restore(previous);
        }
    }
}
