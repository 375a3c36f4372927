package com.telemetra.service.core.job;

import com.telemetra.service.core.config.TelemetraProperties;
import jakarta.annotation.PostConstruct;
import jakarta.annotation.PreDestroy;
import java.time.Clock;
import java.time.Duration;
import java.util.List;
import java.util.Set;
import java.util.UUID;
import java.util.concurrent.ArrayBlockingQueue;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.atomic.AtomicInteger;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.dao.DataAccessException;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

/**
 * Bounded queue of job ids drained by a fixed worker pool. The queue is only a dispatch hint: the
 * job table is the source of truth and the periodic sweep re-enqueues anything still pending.
 */
@Component
@Slf4j
@RequiredArgsConstructor
public class IngestionJobExecutor {

    private final IngestionJobRunner runner;
    private final IngestionJobRepository repository;
    private final PayloadSpool spool;
    private final TelemetraProperties properties;
    private final Clock clock;

    @Value("${telemetra.jobs.sweep.enabled:true}")
    private boolean sweepEnabled = true;

    @Value("${telemetra.jobs.stale-after:PT30M}")
    private Duration staleAfter = Duration.ofMinutes(30);

    private int queueCapacity;
    private BlockingQueue<UUID> queue;
    private ExecutorService executor;
    private final Set<UUID> queued = ConcurrentHashMap.newKeySet();
    private final AtomicInteger activeJobs = new AtomicInteger();

    @PostConstruct
    void start() {
        TelemetraProperties.Jobs jobs = properties.getJobs();
        this.queueCapacity = Math.max(1, jobs.getQueueCapacity());
        int workerCount = Math.max(1, jobs.getWorkers());
        queue = new ArrayBlockingQueue<>(queueCapacity);
        executor = Executors.newFixedThreadPool(workerCount);
        for (int i = 0; i < workerCount; i++) {
            executor.submit(this::drainLoop);
        }
        log.info("Ingestion job executor started workers={}, queueCapacity={}", workerCount, queueCapacity);
    }

    @PreDestroy
    void stop() {
        if (executor != null) {
            executor.shutdownNow();
        }
    }

    /** @return false when the queue is full; the sweep picks the job up later */
    public boolean enqueue(UUID jobId) {
        if (!queued.add(jobId)) {
            return true;
        }
        if (!queue.offer(jobId)) {
            queued.remove(jobId);
            log.warn("Ingestion job queue full ({}), job {} left for the sweep", queueCapacity, jobId);
            return false;
        }
        log.debug("Ingestion job queue depth={}/{}", queue.size(), queueCapacity);
        return true;
    }

    @Scheduled(fixedRateString = "${telemetra.jobs.sweep-rate-millis:5000}")
    public void sweep() {
        if (!sweepEnabled) {
            return;
        }
        try {
            List<String> staleRefs = repository.failStale(
                    clock.instant().minus(staleAfter), "Ingestion job stopped reporting progress", clock.instant());
            if (!staleRefs.isEmpty()) {
                log.warn("Failed {} stale ingestion jobs", staleRefs.size());
                staleRefs.forEach(spool::delete);
            }
            List<UUID> pending = repository.findPendingIds(properties.getJobs().getSweepBatchSize());
            for (UUID id : pending) {
                if (!enqueue(id)) {
                    break;
                }
            }
        } catch (DataAccessException ex) {
            log.error("Ingestion job sweep failed", ex);
        }
    }

    private void drainLoop() {
        while (!Thread.currentThread().isInterrupted()) {
            UUID jobId;
            try {
                jobId = queue.take();
            } catch (InterruptedException ie) {
                Thread.currentThread().interrupt();
                return;
            }
            activeJobs.incrementAndGet();
            try {
                runner.run(jobId);
            } catch (Exception ex) {
                log.error("Ingestion job worker failed on job {}", jobId, ex);
            } finally {
                queued.remove(jobId);
                activeJobs.decrementAndGet();
            }
        }
    }

    public void waitForDrain() {
        while (!queue.isEmpty() || activeJobs.get() > 0) {
            try {
                Thread.sleep(10);
            } catch (InterruptedException ie) {
                Thread.currentThread().interrupt();
                break;
            }
        }
    }
}
