package net.kairos.bootstrap.autoconfigure;

import com.fasterxml.jackson.databind.ObjectMapper;
import net.kairos.adapter.redis.RedisExecutionEventPublisher;
import net.kairos.bootstrap.props.KairosProperties;
import net.kairos.core.service.ExecutionCancellationService;
import net.kairos.core.service.SchedulerService;
import net.kairos.core.spi.ExecutionEventPublisher;
import net.kairos.core.spi.LockStore;
import net.kairos.core.spi.TxRunner;
import net.kairos.integration.spring.sched.KairosSchedulers;
import net.kairos.integration.spring.tx.SpringTxRunner;
import org.junit.jupiter.api.Test;
import org.springframework.boot.autoconfigure.AutoConfigurations;
import org.springframework.boot.test.context.runner.ApplicationContextRunner;
import org.springframework.jdbc.datasource.DataSourceTransactionManager;
import org.springframework.jdbc.datasource.DriverManagerDataSource;
import org.springframework.transaction.PlatformTransactionManager;

import javax.sql.DataSource;
import java.time.Duration;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.Mockito.mock;

class KairosAutoConfigurationTest {

    private final ApplicationContextRunner runner = new ApplicationContextRunner()
            .withConfiguration(AutoConfigurations.of(KairosAutoConfiguration.class))
            .withBean(DataSource.class, () -> new DriverManagerDataSource("jdbc:sqlite::memory:"))
            .withBean(PlatformTransactionManager.class, () -> new DataSourceTransactionManager(
                    new DriverManagerDataSource("jdbc:sqlite::memory:")))
            .withBean(ObjectMapper.class, ObjectMapper::new)
            .withBean(LockStore.class, () -> mock(LockStore.class));

    @Test
    void wires_scheduler_services_with_defaults() {
        runner.run(ctx -> {
            assertThat(ctx).hasSingleBean(SchedulerService.class);
            assertThat(ctx).hasSingleBean(ExecutionCancellationService.class);
            assertThat(ctx).hasSingleBean(KairosSchedulers.class);
            assertThat(ctx.getBean(TxRunner.class)).isInstanceOf(SpringTxRunner.class);

            var props = ctx.getBean(KairosProperties.class);
            assertThat(props.getLock().getTtl()).isEqualTo(Duration.ofSeconds(600));
            assertThat(props.getDispatch().getTimeout()).isEqualTo(Duration.ofSeconds(900));
            assertThat(props.getTarget().getUrlTemplate()).isEqualTo("http://agent-{name}:8000");
            assertThat(ctx.getBean(SchedulerService.class).isRunning()).isFalse();
        });
    }

    @Test
    void plain_numbers_bind_as_seconds() {
        runner.withPropertyValues("kairos.lock.ttl=120", "kairos.dispatch.timeout=30", "kairos.instance-id=node-a")
                .run(ctx -> {
                    var props = ctx.getBean(KairosProperties.class);
                    assertThat(props.getLock().getTtl()).isEqualTo(Duration.ofSeconds(120));
                    assertThat(props.getDispatch().getTimeout()).isEqualTo(Duration.ofSeconds(30));
                    assertThat(ctx.getBean(SchedulerService.class).instanceId()).isEqualTo("node-a");
                });
    }

    @Test
    void events_fall_back_to_noop_without_redis() {
        runner.run(ctx -> assertThat(ctx.getBean(ExecutionEventPublisher.class))
                .isNotInstanceOf(RedisExecutionEventPublisher.class));
    }

    @Test
    void periodic_loops_are_off_when_scheduler_disabled() {
        runner.withPropertyValues("kairos.scheduler.enabled=false")
                .run(ctx -> assertThat(ctx).doesNotHaveBean(KairosSchedulers.class));
    }

    @Test
    void generated_instance_id_is_host_based_and_unique() {
        String a = KairosAutoConfiguration.resolveInstanceId(null);
        String b = KairosAutoConfiguration.resolveInstanceId(" ");
        assertThat(a).isNotBlank().isNotEqualTo(b);
        assertThat(KairosAutoConfiguration.resolveInstanceId(" fixed ")).isEqualTo("fixed");
    }
}
