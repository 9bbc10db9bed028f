package net.kairos.integration.spring.tx;

import net.kairos.adapter.jdbc.TxContext;
import net.kairos.core.spi.TxRunner;
import org.springframework.jdbc.datasource.DataSourceUtils;
import org.springframework.transaction.PlatformTransactionManager;
import org.springframework.transaction.support.TransactionTemplate;

import javax.sql.DataSource;
import java.sql.Connection;
import java.util.concurrent.Callable;

/**
 * 스프링 트랜잭션 매니저 위의 {@link TxRunner}.
 * 트랜잭션에 묶인 커넥션을 {@link TxContext}에도 걸어 JDBC 저장소가 같은 커넥션을 쓰게 한다.
 * 본문의 checked 예외는 IllegalStateException 으로 감싸 롤백시킨다.
 */
public final class SpringTxRunner implements TxRunner {
    private final TransactionTemplate template;
    private final DataSource ds;

    public SpringTxRunner(PlatformTransactionManager tm, DataSource ds) {
        this.template = new TransactionTemplate(tm);
        this.ds = ds;
    }

    @Override
    public <T> T required(Callable<T> body) {
        return template.execute(status -> {
            Connection con = DataSourceUtils.getConnection(ds);
            try {
                return TxContext.callBound(con, body);
            } catch (RuntimeException e) {
                throw e;
            } catch (Exception e) {
                throw new IllegalStateException(e);
            } finally {
                DataSourceUtils.releaseConnection(con, ds);
            }
        });
    }
}
