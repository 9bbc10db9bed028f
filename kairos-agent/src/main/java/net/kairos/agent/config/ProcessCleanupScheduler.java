package net.kairos.agent.config;

import net.kairos.agent.process.ProcessRegistry;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

/** 해제되지 않고 끝난 프로세스 항목을 주기적으로 지운다 */
@Component
public class ProcessCleanupScheduler {
    private final ProcessRegistry registry;

    public ProcessCleanupScheduler(ProcessRegistry registry) {
        this.registry = registry;
    }

    @Scheduled(fixedDelayString = "${kairos.agent.cleanup-interval-ms:60000}",
               initialDelayString = "${kairos.agent.cleanup-interval-ms:60000}")
    public void cleanup() {
        registry.cleanupFinished();
    }
}
