package com.openforge.gazetranslate.memory;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

import java.util.concurrent.locks.ReentrantLock;

/**
 * Runs {@link MemoryStore#purgeStale()} on the {@code app.memory.purge-cron}
 * schedule. Disable with {@code app.memory.purge-enabled=false}.
 */
@Slf4j
@Component
@RequiredArgsConstructor
@ConditionalOnProperty(prefix = "app.memory", name = "purge-enabled", havingValue = "true", matchIfMissing = true)
public class MemoryMaintenanceJob {

    private final MemoryStore memoryStore;
    private final ReentrantLock running = new ReentrantLock();

    @Scheduled(cron = "${app.memory.purge-cron:0 30 3 * * *}")
    public void purgeStale() {
        if (!running.tryLock()) {
            log.info("[Maintenance] Purge already running, skipping this tick");
            return;
        }
        try {
            long start = System.currentTimeMillis();
            int deleted = memoryStore.purgeStale();
            log.info("[Maintenance] Purge finished: {} deleted in {} ms", deleted, System.currentTimeMillis() - start);
        } catch (RuntimeException e) {
            log.error("[Maintenance] Purge failed: {}", e.getMessage(), e);
        } finally {
            running.unlock();
        }
    }
}
