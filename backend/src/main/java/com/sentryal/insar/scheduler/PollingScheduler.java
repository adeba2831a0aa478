package com.sentryal.insar.scheduler;

import com.sentryal.insar.config.PipelineProperties;
import com.sentryal.insar.ledger.JobLedger;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.atomic.AtomicInteger;

@Slf4j
@Component
@ConditionalOnProperty(prefix = "insar.polling", name = "enabled", havingValue = "true", matchIfMissing = true)
public class PollingScheduler {

    private final JobLedger jobLedger;
    private final JobProcessor jobProcessor;
    private final ExecutorService pollingWorkerPool;
    private final int workers;
    private final int batchSize;
    private final AtomicInteger inFlight = new AtomicInteger();

    public PollingScheduler(JobLedger jobLedger, JobProcessor jobProcessor, ExecutorService pollingWorkerPool,
                            PipelineProperties properties) {
        this.jobLedger = jobLedger;
        this.jobProcessor = jobProcessor;
        this.pollingWorkerPool = pollingWorkerPool;
        this.workers = properties.getPolling().getWorkers();
        this.batchSize = properties.getPolling().getBatchSize();
    }

    @Scheduled(fixedDelayString = "${insar.polling.interval:PT30S}",
            initialDelayString = "${insar.polling.initial-delay:PT10S}")
    public void tick() {
        int capacity = Math.min(workers - inFlight.get(), batchSize);
        if (capacity <= 0) {
            log.debug("All {} workers busy, skipping tick", workers);
            return;
        }
        List<String> due;
        try {
            due = jobLedger.findDueJobIds(capacity);
        } catch (RuntimeException e) {
            log.error("Failed to look up due jobs", e);
            return;
        }
        if (!due.isEmpty()) {
            log.debug("Dispatching {} due jobs", due.size());
        }
        for (String jobId : due) {
            inFlight.incrementAndGet();
            try {
                pollingWorkerPool.execute(() -> {
                    try {
                        jobProcessor.process(jobId);
                    } finally {
                        inFlight.decrementAndGet();
                    }
                });
            } catch (RejectedExecutionException e) {
                inFlight.decrementAndGet();
                log.warn("Worker pool rejected job {}: {}", jobId, e.getMessage());
                break;
            }
        }
    }

    int inFlight() {
        return inFlight.get();
    }
}
