package com.sentryal.insar.config;

import com.sentryal.insar.client.HttpProcessingJobClient;
import com.sentryal.insar.client.ProcessingJobClient;
import com.sentryal.insar.client.RateLimitedProcessingJobClient;
import io.github.resilience4j.ratelimiter.RateLimiter;
import io.github.resilience4j.ratelimiter.RateLimiterConfig;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.http.HttpHeaders;
import org.springframework.http.client.SimpleClientHttpRequestFactory;
import org.springframework.web.client.RestClient;

import java.time.Duration;

@Slf4j
@Configuration
public class ProcessingClientConfiguration {

    @Bean
    public RateLimiter processingApiRateLimiter(PipelineProperties properties) {
        PipelineProperties.RateLimit limit = properties.getClient().getRateLimit();
        RateLimiterConfig config = RateLimiterConfig.custom()
                .limitForPeriod(limit.getLimitForPeriod())
                .limitRefreshPeriod(limit.getRefreshPeriod())
                .timeoutDuration(limit.getTimeout())
                .build();
        return RateLimiter.of("processing-api", config);
    }

    @Bean
    public ProcessingJobClient processingJobClient(RestClient.Builder builder,
                                                   PipelineProperties properties,
                                                   RateLimiter processingApiRateLimiter) {
        PipelineProperties.Client client = properties.getClient();

        RestClient.Builder api = builder.clone()
                .baseUrl(client.getBaseUrl())
                .requestFactory(requestFactory(client.getConnectTimeout(), client.getReadTimeout()));
        if (client.getApiKey() == null || client.getApiKey().isBlank()) {
            log.warn("insar.client.api-key is not set; calls to {} will be unauthenticated", client.getBaseUrl());
        } else {
            api.defaultHeader(HttpHeaders.AUTHORIZATION, "Bearer " + client.getApiKey());
        }
        RestClient downloads = builder.clone()
                .requestFactory(requestFactory(client.getConnectTimeout(), client.getDownloadTimeout()))
                .build();

        log.info("Processing client targets {} endpoint {} ({} calls per {})", client.getBaseUrl(),
                client.getEndpointId(), client.getRateLimit().getLimitForPeriod(),
                client.getRateLimit().getRefreshPeriod());
        return new RateLimitedProcessingJobClient(
                new HttpProcessingJobClient(api.build(), downloads, client.getEndpointId()),
                processingApiRateLimiter);
    }

    private static SimpleClientHttpRequestFactory requestFactory(Duration connectTimeout, Duration readTimeout) {
        SimpleClientHttpRequestFactory factory = new SimpleClientHttpRequestFactory();
        factory.setConnectTimeout((int) connectTimeout.toMillis());
        factory.setReadTimeout((int) readTimeout.toMillis());
        return factory;
    }
}
