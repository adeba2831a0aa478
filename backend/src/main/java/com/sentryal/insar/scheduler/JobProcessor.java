package com.sentryal.insar.scheduler;

import com.sentryal.insar.catalog.PointCatalog;
import com.sentryal.insar.client.ProcessingJobClient;
import com.sentryal.insar.client.RemoteJobStatus;
import com.sentryal.insar.client.RemoteStatusReport;
import com.sentryal.insar.config.PipelineProperties;
import com.sentryal.insar.exception.PermanentRemoteException;
import com.sentryal.insar.exception.PersistenceFailureException;
import com.sentryal.insar.exception.PostProcessingFailureException;
import com.sentryal.insar.exception.RateLimitExceededException;
import com.sentryal.insar.exception.TransientRemoteException;
import com.sentryal.insar.ledger.JobLedger;
import com.sentryal.insar.model.FailureClass;
import com.sentryal.insar.model.InsarJob;
import com.sentryal.insar.model.JobStatus;
import com.sentryal.insar.raster.PointMeasurement;
import com.sentryal.insar.raster.TargetPoint;
import lombok.extern.slf4j.Slf4j;
import org.slf4j.MDC;
import org.springframework.dao.DataAccessException;
import org.springframework.orm.ObjectOptimisticLockingFailureException;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.UUID;

/**
 * Advances one job by a single step of its state machine.
 *
 * <p>The job is claimed first; a job that cannot be claimed is left untouched. Every
 * failure is recorded on the job itself, nothing escapes to the worker thread.
 */
@Slf4j
@Component
public class JobProcessor {

    static final String MDC_JOB_ID = "jobId";

    private final JobLedger jobLedger;
    private final ProcessingJobClient processingJobClient;
    private final PointCatalog pointCatalog;
    private final ArtifactProcessor artifactProcessor;
    private final JobCompletionService completionService;
    private final Clock clock;
    private final BackoffPolicy backoffPolicy;
    private final int maxAttempts;
    private final Duration maxJobAge;
    private final Duration leaseDuration;
    private final String instanceId = UUID.randomUUID().toString().substring(0, 8);

    public JobProcessor(JobLedger jobLedger,
                        ProcessingJobClient processingJobClient,
                        PointCatalog pointCatalog,
                        ArtifactProcessor artifactProcessor,
                        JobCompletionService completionService,
                        Clock clock,
                        PipelineProperties properties) {
        this.jobLedger = jobLedger;
        this.processingJobClient = processingJobClient;
        this.pointCatalog = pointCatalog;
        this.artifactProcessor = artifactProcessor;
        this.completionService = completionService;
        this.clock = clock;
        PipelineProperties.Polling polling = properties.getPolling();
        this.backoffPolicy = BackoffPolicy.from(polling.getBackoff());
        this.maxAttempts = polling.getMaxAttempts();
        this.maxJobAge = polling.getMaxJobAge();
        this.leaseDuration = polling.getLeaseDuration();
    }

    public void process(String jobId) {
        String owner = instanceId + "/" + Thread.currentThread().getName();
        if (!jobLedger.claim(jobId, owner, leaseDuration)) {
            return;
        }
        MDC.put(MDC_JOB_ID, jobId);
        try {
            advance(jobLedger.find(jobId));
        } catch (ObjectOptimisticLockingFailureException e) {
            log.info("Job {} was changed concurrently, will retry on the next tick", jobId);
        } catch (RuntimeException e) {
            log.error("Unexpected error while processing job {}", jobId, e);
            failQuietly(jobId, FailureClass.INTERNAL_ERROR, describe(e));
        } finally {
            try {
                jobLedger.release(jobId, owner);
            } catch (RuntimeException e) {
                log.error("Failed to release lease on job {}, it expires in {}", jobId, leaseDuration, e);
            }
            MDC.remove(MDC_JOB_ID);
        }
    }

    private void advance(InsarJob job) {
        if (job.getStatus().isTerminal()) {
            return;
        }
        if (job.isCancelRequested()) {
            jobLedger.markTerminal(job.getId(), JobStatus.FAILED, FailureClass.CANCELLED, "Cancelled by operator");
            cancelRemotely(job);
            return;
        }
        Duration age = Duration.between(job.getCreatedAt(), clock.instant());
        if (age.compareTo(maxJobAge) > 0) {
            jobLedger.markTerminal(job.getId(), JobStatus.EXPIRED, FailureClass.MAX_AGE_EXCEEDED,
                    "Job older than " + maxJobAge + " (age " + age + ")");
            cancelRemotely(job);
            return;
        }
        if (expireIfExhausted(job)) {
            return;
        }
        switch (job.getStatus()) {
            case PENDING:
                submit(job);
                break;
            case SUBMITTED:
            case RUNNING:
                poll(job);
                break;
            default:
                throw new IllegalStateException("Job " + job.getId() + " has unexpected status " + job.getStatus());
        }
    }

    private void submit(InsarJob job) {
        List<TargetPoint> points = pointCatalog.pointsFor(job.getInfrastructureId());
        if (points.isEmpty()) {
            jobLedger.markTerminal(job.getId(), JobStatus.FAILED, FailureClass.NO_MONITORING_POINTS,
                    "No monitoring points for infrastructure " + job.getInfrastructureId());
            return;
        }
        String remoteJobId;
        try {
            remoteJobId = processingJobClient.submit(job.getId(), job.getInfrastructureId(),
                    job.getParameters(), points);
        } catch (RateLimitExceededException e) {
            log.debug("Submission of job {} deferred: {}", job.getId(), e.getMessage());
            return;
        } catch (TransientRemoteException e) {
            recordFailedAttempt(job, "Submit failed: " + e.getMessage());
            return;
        } catch (PermanentRemoteException e) {
            jobLedger.markTerminal(job.getId(), JobStatus.FAILED, FailureClass.REMOTE_REJECTED, e.getMessage());
            return;
        }
        jobLedger.markSubmitted(job.getId(), remoteJobId);
    }

    private void poll(InsarJob job) {
        RemoteStatusReport report;
        try {
            report = processingJobClient.status(job.getRemoteJobId());
        } catch (RateLimitExceededException e) {
            log.debug("Status poll of job {} deferred: {}", job.getId(), e.getMessage());
            return;
        } catch (TransientRemoteException e) {
            recordFailedAttempt(job, "Status poll failed: " + e.getMessage());
            return;
        } catch (PermanentRemoteException e) {
            jobLedger.markTerminal(job.getId(), JobStatus.FAILED, FailureClass.REMOTE_FAILURE, e.getMessage());
            return;
        }

        InsarJob updated = jobLedger.recordPollResult(job.getId(), report);
        if (report.status() == RemoteJobStatus.SUCCEEDED) {
            complete(updated);
        } else {
            expireIfExhausted(updated);
        }
    }

    private void complete(InsarJob job) {
        Instant started = clock.instant();
        List<PointMeasurement> measurements;
        try {
            measurements = artifactProcessor.process(job);
        } catch (RateLimitExceededException e) {
            log.debug("Download for job {} deferred: {}", job.getId(), e.getMessage());
            return;
        } catch (PostProcessingFailureException e) {
            jobLedger.markTerminal(job.getId(), JobStatus.FAILED, FailureClass.POST_PROCESSING_FAILURE,
                    e.getMessage());
            return;
        } catch (RuntimeException e) {
            log.error("Post-processing of job {} failed unexpectedly", job.getId(), e);
            jobLedger.markTerminal(job.getId(), JobStatus.FAILED, FailureClass.POST_PROCESSING_FAILURE,
                    describe(e));
            return;
        }

        try {
            long elapsed = Duration.between(started, clock.instant()).toMillis();
            completionService.complete(job.getId(), measurements, elapsed);
        } catch (ObjectOptimisticLockingFailureException e) {
            throw e;
        } catch (PersistenceFailureException | DataAccessException e) {
            log.error("Failed to store results of job {}", job.getId(), e);
            jobLedger.markTerminal(job.getId(), JobStatus.FAILED, FailureClass.PERSISTENCE_FAILURE, describe(e));
        }
    }

    private void recordFailedAttempt(InsarJob job, String reason) {
        Duration delay = backoffPolicy.delayFor(job.getAttempts() + 1);
        InsarJob updated = jobLedger.recordFailedAttempt(job.getId(), reason, clock.instant().plus(delay));
        log.warn("Job {} attempt {}/{} failed, retrying in {}: {}", job.getId(), updated.getAttempts(),
                maxAttempts, delay, reason);
        expireIfExhausted(updated);
    }

    private boolean expireIfExhausted(InsarJob job) {
        if (job.getStatus().isTerminal() || job.getAttempts() < maxAttempts) {
            return false;
        }
        jobLedger.markTerminal(job.getId(), JobStatus.EXPIRED, FailureClass.ATTEMPTS_EXHAUSTED,
                "Gave up after " + job.getAttempts() + " attempts");
        cancelRemotely(job);
        return true;
    }

    private void cancelRemotely(InsarJob job) {
        if (job.getRemoteJobId() == null) {
            return;
        }
        try {
            processingJobClient.cancel(job.getRemoteJobId());
        } catch (RuntimeException e) {
            log.warn("Could not cancel remote job {} of job {}: {}", job.getRemoteJobId(), job.getId(),
                    e.getMessage());
        }
    }

    private void failQuietly(String jobId, FailureClass failureClass, String reason) {
        try {
            jobLedger.markTerminal(jobId, JobStatus.FAILED, failureClass, reason);
        } catch (RuntimeException e) {
            log.error("Could not record failure of job {}", jobId, e);
        }
    }

    private static String describe(Throwable e) {
        return e.getClass().getSimpleName() + ": " + e.getMessage();
    }
}
