package com.sentryal.insar.config;

import lombok.extern.slf4j.Slf4j;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.concurrent.CustomizableThreadFactory;

import java.time.Clock;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;

@Slf4j
@Configuration
public class WorkerPoolConfiguration {

    @Bean(destroyMethod = "shutdown")
    public ExecutorService pollingWorkerPool(PipelineProperties properties) {
        int workers = properties.getPolling().getWorkers();
        log.info("Creating polling worker pool with {} threads", workers);
        return Executors.newFixedThreadPool(workers, new CustomizableThreadFactory("insar-worker-"));
    }

    @Bean
    public Clock clock() {
        return Clock.systemUTC();
    }
}
