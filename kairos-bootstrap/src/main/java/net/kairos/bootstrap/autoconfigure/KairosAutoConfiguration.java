package net.kairos.bootstrap.autoconfigure;

import com.fasterxml.jackson.databind.ObjectMapper;
import net.kairos.adapter.http.HttpTaskTargetClient;
import net.kairos.adapter.http.TargetEndpointResolver;
import net.kairos.adapter.redis.RedisExecutionEventPublisher;
import net.kairos.adapter.redis.RedisLockStore;
import net.kairos.bootstrap.props.KairosProperties;
import net.kairos.core.lock.LockManager;
import net.kairos.core.service.CancellationTracker;
import net.kairos.core.service.ExecutionCancellationService;
import net.kairos.core.service.ScheduleDispatcher;
import net.kairos.core.service.ScheduleExecutionService;
import net.kairos.core.service.ScheduleTimerTable;
import net.kairos.core.service.SchedulerService;
import net.kairos.core.spi.AgentPolicyRepository;
import net.kairos.core.spi.Clock;
import net.kairos.core.spi.CronCalculator;
import net.kairos.core.spi.ExecutionEventPublisher;
import net.kairos.core.spi.ExecutionRepository;
import net.kairos.core.spi.LockStore;
import net.kairos.core.spi.ScheduleRepository;
import net.kairos.core.spi.TaskTargetClient;
import net.kairos.core.spi.TxRunner;
import net.kairos.core.sync.ScheduleSyncService;
import net.kairos.integration.spring.KairosSpringConfig;
import net.kairos.integration.spring.sched.KairosSchedulers;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.boot.ApplicationRunner;
import org.springframework.boot.autoconfigure.AutoConfiguration;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.boot.autoconfigure.data.redis.RedisAutoConfiguration;
import org.springframework.boot.autoconfigure.jackson.JacksonAutoConfiguration;
import org.springframework.boot.autoconfigure.jdbc.DataSourceAutoConfiguration;
import org.springframework.boot.autoconfigure.jdbc.DataSourceTransactionManagerAutoConfiguration;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Import;
import org.springframework.data.redis.core.StringRedisTemplate;
import org.springframework.scheduling.concurrent.CustomizableThreadFactory;

import java.net.InetAddress;
import java.net.UnknownHostException;
import java.net.http.HttpClient;
import java.util.UUID;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;

@AutoConfiguration(after = {
        DataSourceAutoConfiguration.class,
        DataSourceTransactionManagerAutoConfiguration.class,
        RedisAutoConfiguration.class,
        JacksonAutoConfiguration.class
})
@EnableConfigurationProperties(KairosProperties.class)
@Import(KairosSpringConfig.class) // integration-spring: repos/tx/clock/cron wiring
public class KairosAutoConfiguration {
    private static final Logger log = LoggerFactory.getLogger(KairosAutoConfiguration.class);

    // --- 스레드 풀 ---

    @Bean(name = "kairosTimerPool", destroyMethod = "shutdownNow")
    public ScheduledExecutorService kairosTimerPool(KairosProperties props) {
        return Executors.newScheduledThreadPool(props.getScheduler().getTimerThreads(),
                new CustomizableThreadFactory("kairos-timer-"));
    }

    @Bean(name = "kairosLockRenewer", destroyMethod = "shutdownNow")
    public ScheduledExecutorService kairosLockRenewer() {
        return Executors.newSingleThreadScheduledExecutor(new CustomizableThreadFactory("kairos-lock-renew-"));
    }

    @Bean(name = "kairosDispatchPool", destroyMethod = "shutdownNow")
    public ExecutorService kairosDispatchPool(KairosProperties props) {
        return Executors.newFixedThreadPool(props.getDispatch().getMaxConcurrent(),
                new CustomizableThreadFactory("kairos-dispatch-"));
    }

    // --- 어댑터 ---

    @Bean
    @ConditionalOnMissingBean(LockStore.class)
    public LockStore lockStore(StringRedisTemplate redis) {
        return new RedisLockStore(redis);
    }

    @Bean
    @ConditionalOnMissingBean(ExecutionEventPublisher.class)
    public ExecutionEventPublisher executionEventPublisher(KairosProperties props,
                                                           ObjectProvider<StringRedisTemplate> redis,
                                                           ObjectMapper mapper) {
        StringRedisTemplate template = redis.getIfAvailable();
        if (!props.getEvents().isEnabled() || template == null) {
            log.info("Execution events disabled");
            return ExecutionEventPublisher.noop();
        }
        return new RedisExecutionEventPublisher(template, mapper, props.getEvents().getChannel());
    }

    @Bean
    @ConditionalOnMissingBean(TaskTargetClient.class)
    public TaskTargetClient taskTargetClient(KairosProperties props, ObjectMapper mapper) {
        var d = props.getDispatch();
        HttpClient http = HttpClient.newBuilder()
                .connectTimeout(d.getControlTimeout())
                .build();
        return new HttpTaskTargetClient(http, mapper,
                new TargetEndpointResolver(props.getTarget().getUrlTemplate()),
                d.getTimeoutBuffer(), d.getControlTimeout());
    }

    // --- 코어 서비스 조립 ---

    @Bean
    @ConditionalOnMissingBean
    public LockManager lockManager(LockStore store,
                                   @Qualifier("kairosLockRenewer") ScheduledExecutorService renewer,
                                   KairosProperties props) {
        return new LockManager(store, renewer, props.getLock().getTtl(), props.getLock().isAutoRenewal());
    }

    @Bean
    @ConditionalOnMissingBean
    public CancellationTracker cancellationTracker(Clock clock, KairosProperties props) {
        return new CancellationTracker(clock, props.getDispatch().getCancelWait());
    }

    @Bean
    @ConditionalOnMissingBean
    public ScheduleExecutionService scheduleExecutionService(ScheduleRepository schedules,
                                                             ExecutionRepository executions,
                                                             AgentPolicyRepository policies,
                                                             LockManager locks,
                                                             TaskTargetClient target,
                                                             ExecutionEventPublisher events,
                                                             TxRunner tx,
                                                             CancellationTracker cancellations,
                                                             CronCalculator cron,
                                                             Clock clock,
                                                             KairosProperties props) {
        return new ScheduleExecutionService(schedules, executions, policies, locks, target, events, tx,
                cancellations, cron, clock, props.getDispatch().getTimeout(), props.getZone());
    }

    @Bean
    @ConditionalOnMissingBean
    public ExecutionCancellationService executionCancellationService(ExecutionRepository executions,
                                                                     TaskTargetClient target,
                                                                     ExecutionEventPublisher events,
                                                                     TxRunner tx,
                                                                     CancellationTracker tracker,
                                                                     Clock clock) {
        return new ExecutionCancellationService(executions, target, events, tx, tracker, clock);
    }

    @Bean
    @ConditionalOnMissingBean
    public ScheduleDispatcher scheduleDispatcher(ScheduleExecutionService executionService,
                                                 @Qualifier("kairosDispatchPool") ExecutorService pool) {
        return new ScheduleDispatcher(executionService, pool);
    }

    @Bean
    @ConditionalOnMissingBean
    public ScheduleTimerTable scheduleTimerTable(@Qualifier("kairosTimerPool") ScheduledExecutorService timers,
                                                 CronCalculator cron,
                                                 Clock clock,
                                                 ScheduleDispatcher dispatcher,
                                                 KairosProperties props) {
        return new ScheduleTimerTable(timers, cron, clock, props.getZone(), dispatcher);
    }

    @Bean
    @ConditionalOnMissingBean
    public ScheduleSyncService scheduleSyncService(ScheduleRepository schedules,
                                                   ScheduleTimerTable timers,
                                                   Clock clock) {
        return new ScheduleSyncService(schedules, timers, clock);
    }

    @Bean(destroyMethod = "shutdown")
    @ConditionalOnMissingBean
    public SchedulerService schedulerService(ScheduleTimerTable timers,
                                             ScheduleDispatcher dispatcher,
                                             ScheduleSyncService sync,
                                             ScheduleExecutionService executionService,
                                             ScheduleRepository schedules,
                                             LockManager locks,
                                             Clock clock,
                                             KairosProperties props) {
        return new SchedulerService(timers, dispatcher, sync, executionService, schedules, locks, clock,
                resolveInstanceId(props.getInstanceId()), props.getHeartbeat().getTtl());
    }

    // --- 주기 작업 / 기동 ---

    @Bean
    @ConditionalOnProperty(prefix = "kairos.scheduler", name = "enabled", havingValue = "true", matchIfMissing = true)
    public KairosSchedulers kairosSchedulers(SchedulerService scheduler) {
        return new KairosSchedulers(scheduler);
    }

    @Bean
    @ConditionalOnProperty(prefix = "kairos.scheduler", name = "enabled", havingValue = "true", matchIfMissing = true)
    public ApplicationRunner schedulerStartRunner(SchedulerService scheduler) {
        return args -> {
            var report = scheduler.start();
            log.info("Initial schedule load: {}", report);
        };
    }

    static String resolveInstanceId(String configured) {
        if (configured != null && !configured.isBlank()) return configured.trim();
        String host;
        try {
            host = InetAddress.getLocalHost().getHostName();
        } catch (UnknownHostException e) {
            host = "scheduler";
        }
        return host + "-" + UUID.randomUUID().toString().substring(0, 8);
    }
}
