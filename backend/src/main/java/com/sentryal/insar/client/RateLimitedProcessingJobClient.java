package com.sentryal.insar.client;

import com.sentryal.insar.exception.RateLimitExceededException;
import com.sentryal.insar.model.JobParameters;
import com.sentryal.insar.raster.TargetPoint;
import io.github.resilience4j.ratelimiter.RateLimiter;
import io.github.resilience4j.ratelimiter.RequestNotPermitted;

import java.nio.file.Path;
import java.util.List;
import java.util.function.Supplier;

public class RateLimitedProcessingJobClient implements ProcessingJobClient {

    private final ProcessingJobClient delegate;
    private final RateLimiter rateLimiter;

    public RateLimitedProcessingJobClient(ProcessingJobClient delegate, RateLimiter rateLimiter) {
        this.delegate = delegate;
        this.rateLimiter = rateLimiter;
    }

    @Override
    public String submit(String jobId, String infrastructureId, JobParameters parameters, List<TargetPoint> points) {
        return limited("submit", () -> delegate.submit(jobId, infrastructureId, parameters, points));
    }

    @Override
    public RemoteStatusReport status(String remoteJobId) {
        return limited("status", () -> delegate.status(remoteJobId));
    }

    @Override
    public List<RasterArtifact> downloadArtifacts(String remoteJobId, Path targetDir) {
        return limited("download", () -> delegate.downloadArtifacts(remoteJobId, targetDir));
    }

    @Override
    public void cancel(String remoteJobId) {
        limited("cancel", () -> {
            delegate.cancel(remoteJobId);
            return null;
        });
    }

    private <T> T limited(String action, Supplier<T> call) {
        try {
            return RateLimiter.decorateSupplier(rateLimiter, call).get();
        } catch (RequestNotPermitted e) {
            throw new RateLimitExceededException("Rate limit '" + rateLimiter.getName() + "' refused " + action, e);
        }
    }
}
