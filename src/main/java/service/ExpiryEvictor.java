package service;

import lombok.extern.slf4j.Slf4j;

import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;

/**
 * 주기적으로 만료된 키를 정리하는 백그라운드 작업
 */
@Slf4j
public class ExpiryEvictor implements AutoCloseable {

    private final StorageService storageService;
    private final long intervalMs;
    private ScheduledExecutorService scheduler;

    public ExpiryEvictor(StorageService storageService, long intervalMs) {
        this.storageService = storageService;
        this.intervalMs = intervalMs;
    }

    public synchronized void start() {
        if (scheduler != null) {
            return;
        }
        scheduler = Executors.newSingleThreadScheduledExecutor(r -> {
            Thread thread = new Thread(r, "expiry-evictor");
            thread.setDaemon(true);
            return thread;
        });
        scheduler.scheduleWithFixedDelay(this::evict, intervalMs, intervalMs, TimeUnit.MILLISECONDS);
        log.debug("Starting the eviction loop every {} ms", intervalMs);
    }

    private void evict() {
        try {
            storageService.evictExpired();
        } catch (RuntimeException e) {
            // 예외가 전파되면 이후 실행이 취소되므로 기록만 함
            log.error("Eviction failed", e);
        }
    }

    @Override
    public synchronized void close() {
        if (scheduler != null) {
            scheduler.shutdownNow();
            scheduler = null;
        }
    }
}
