package net.kairos.integration.spring;

import net.kairos.adapter.jdbc.repo.JdbcAgentPolicyRepository;
import net.kairos.adapter.jdbc.repo.JdbcExecutionRepository;
import net.kairos.adapter.jdbc.repo.JdbcScheduleRepository;
import net.kairos.core.spi.AgentPolicyRepository;
import net.kairos.core.spi.Clock;
import net.kairos.core.spi.CronCalculator;
import net.kairos.core.spi.ExecutionRepository;
import net.kairos.core.spi.ScheduleRepository;
import net.kairos.core.spi.TxRunner;
import net.kairos.integration.spring.cron.CronUtilsCalculator;
import net.kairos.integration.spring.tx.SpringTxRunner;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.transaction.PlatformTransactionManager;

import javax.sql.DataSource;

@Configuration
public class KairosSpringConfig {

    // TxRunner (Spring)
    @Bean
    public TxRunner txRunner(PlatformTransactionManager tm, DataSource ds) {
        return new SpringTxRunner(tm, ds);
    }

    // Repository 구현 등록 (adapter-jdbc 재사용)
    @Bean public ScheduleRepository scheduleRepository(DataSource ds) { return new JdbcScheduleRepository(ds); }
    @Bean public ExecutionRepository executionRepository(DataSource ds) { return new JdbcExecutionRepository(ds); }
    @Bean public AgentPolicyRepository agentPolicyRepository(DataSource ds) { return new JdbcAgentPolicyRepository(ds); }

    @Bean public Clock systemClock() { return java.time.Instant::now; }

    @Bean public CronCalculator cronCalculator() { return new CronUtilsCalculator(); }
}
