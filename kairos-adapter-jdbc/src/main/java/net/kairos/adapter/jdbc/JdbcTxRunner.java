package net.kairos.adapter.jdbc;

import net.kairos.core.spi.TxRunner;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import javax.sql.DataSource;
import java.sql.Connection;
import java.sql.SQLException;
import java.util.concurrent.Callable;

/** 스프링 없이 쓰는 트랜잭션 러너(테스트, 단독 실행). 중첩 호출은 바깥 트랜잭션에 합류한다 */
public final class JdbcTxRunner implements TxRunner {
    private static final Logger log = LoggerFactory.getLogger(JdbcTxRunner.class);

    private final DataSource ds;

    public JdbcTxRunner(DataSource ds) {
        this.ds = ds;
    }

    @Override
    public <T> T required(Callable<T> body) throws Exception {
        if (TxContext.current() != null) return body.call();

        try (Connection c = ds.getConnection()) {
            boolean autoCommit = c.getAutoCommit();
            c.setAutoCommit(false);
            Connection previous = TxContext.bind(c);
            try {
                T result = body.call();
                c.commit();
                return result;
            } catch (Exception | Error e) {
                rollback(c, e);
                throw e;
            } finally {
                TxContext.restore(previous);
                resetAutoCommit(c, autoCommit);
            }
        }
    }

    private static void rollback(Connection c, Throwable cause) {
        try {
            c.rollback();
        } catch (SQLException e) {
            cause.addSuppressed(e);
        }
    }

    // 풀로 돌아가는 커넥션의 상태 복원. 실패해도 Hikari 가 반납 시 다시 맞춘다
    private static void resetAutoCommit(Connection c, boolean autoCommit) {
        try {
            c.setAutoCommit(autoCommit);
        } catch (SQLException e) {
            log.debug("Could not reset auto-commit on {}: {}", c, e.toString());
        }
    }
}
