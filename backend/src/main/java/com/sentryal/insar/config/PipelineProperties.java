package com.sentryal.insar.config;

import com.sentryal.insar.raster.CoherencePolicy;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;

import java.nio.file.Path;
import java.time.Duration;

@Data
@ConfigurationProperties(prefix = "insar")
public class PipelineProperties {

    private Polling polling = new Polling();
    private Extraction extraction = new Extraction();
    private Client client = new Client();
    private Artifacts artifacts = new Artifacts();

    @Data
    public static class Polling {
        private boolean enabled = true;
        private Duration interval = Duration.ofSeconds(30);
        private int workers = 5;
        private int batchSize = 20;
        private Duration initialDelay = Duration.ofSeconds(10);
        private int maxAttempts = 50;
        private Duration maxJobAge = Duration.ofHours(24);
        private Duration leaseDuration = Duration.ofMinutes(15);
        private Backoff backoff = new Backoff();
    }

    @Data
    public static class Backoff {
        private Duration initial = Duration.ofSeconds(30);
        private Duration max = Duration.ofSeconds(30);
    }

    @Data
    public static class Extraction {
        private double coherenceThreshold = 0.3;
        private CoherencePolicy coherencePolicy = CoherencePolicy.DROP;
    }

    @Data
    public static class Client {
        private String baseUrl = "https://api.runpod.ai/v2";
        private String endpointId;
        private String apiKey;
        private Duration connectTimeout = Duration.ofSeconds(10);
        private Duration readTimeout = Duration.ofSeconds(30);
        private Duration downloadTimeout = Duration.ofMinutes(5);
        private RateLimit rateLimit = new RateLimit();
    }

    @Data
    public static class RateLimit {
        private int limitForPeriod = 10;
        private Duration refreshPeriod = Duration.ofMinutes(1);
        private Duration timeout = Duration.ofSeconds(5);
    }

    @Data
    public static class Artifacts {
        private Path workDir = Path.of(System.getProperty("java.io.tmpdir"), "insar-artifacts");
        private boolean keepFiles = false;
    }
}
