package net.kairos.integration.spring.sched;

import net.kairos.core.service.SchedulerService;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.scheduling.annotation.Scheduled;

/** 주기 작업: DB 동기화와 하트비트 */
public class KairosSchedulers {
    private static final Logger log = LoggerFactory.getLogger(KairosSchedulers.class);

    private final SchedulerService scheduler;

    public KairosSchedulers(SchedulerService scheduler) {
        this.scheduler = scheduler;
    }

    @Scheduled(fixedDelayString = "${kairos.sync.interval-ms:60000}",
               initialDelayString = "${kairos.sync.interval-ms:60000}")
    public void sync() {
        scheduler.syncNow();
    }

    @Scheduled(fixedDelayString = "${kairos.heartbeat.interval-ms:30000}")
    public void heartbeat() {
        if (!scheduler.isRunning()) return;
        if (!scheduler.heartbeat()) log.warn("Heartbeat for {} not recorded", scheduler.instanceId());
    }
}
