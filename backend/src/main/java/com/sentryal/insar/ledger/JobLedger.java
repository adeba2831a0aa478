package com.sentryal.insar.ledger;

import com.sentryal.insar.client.RemoteStatusReport;
import com.sentryal.insar.exception.AlreadyTerminalException;
import com.sentryal.insar.exception.InvalidTransitionException;
import com.sentryal.insar.exception.JobNotFoundException;
import com.sentryal.insar.model.FailureClass;
import com.sentryal.insar.model.InsarJob;
import com.sentryal.insar.model.JobParameters;
import com.sentryal.insar.model.JobStatus;
import com.sentryal.insar.repository.InsarJobRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.data.domain.PageRequest;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.UUID;

/**
 * Durable record of every job and the only place job state changes.
 *
 * <p>Each method runs in its own transaction. Writers racing on the same job are
 * serialized by the entity version; the loser gets an
 * {@link org.springframework.orm.ObjectOptimisticLockingFailureException}.
 */
@Slf4j
@Service
@Transactional
@RequiredArgsConstructor
public class JobLedger {

    private static final int MAX_REASON_LENGTH = 4000;

    private final InsarJobRepository jobRepository;
    private final Clock clock;

    public InsarJob create(String infrastructureId, JobParameters parameters) {
        if (infrastructureId == null || infrastructureId.isBlank()) {
            throw new IllegalArgumentException("infrastructureId is required");
        }
        if (parameters.getEndDate().isBefore(parameters.getStartDate())) {
            throw new IllegalArgumentException("endDate " + parameters.getEndDate()
                    + " is before startDate " + parameters.getStartDate());
        }
        Instant now = clock.instant();
        InsarJob job = new InsarJob();
        job.setId(UUID.randomUUID().toString());
        job.setInfrastructureId(infrastructureId);
        job.setParameters(parameters);
        job.setStatus(JobStatus.PENDING);
        job.setAttempts(0);
        job.setCreatedAt(now);
        job.setUpdatedAt(now);
        job = jobRepository.save(job);
        log.info("Created job {} for infrastructure {} ({} to {}, {})", job.getId(), infrastructureId,
                parameters.getStartDate(), parameters.getEndDate(), parameters.getProcessingMode());
        return job;
    }

    public InsarJob markSubmitted(String jobId, String remoteJobId) {
        InsarJob job = load(jobId);
        if (job.getRemoteJobId() != null) {
            throw new InvalidTransitionException("Job " + jobId + " already has remote job "
                    + job.getRemoteJobId() + ", refusing " + remoteJobId);
        }
        if (job.getStatus() != JobStatus.PENDING) {
            throw new InvalidTransitionException(jobId, job.getStatus(), JobStatus.SUBMITTED);
        }
        job.setRemoteJobId(remoteJobId);
        job.setStatus(JobStatus.SUBMITTED);
        job.setNextAttemptAt(null);
        job.setFailureReason(null);
        job.setUpdatedAt(clock.instant());
        log.info("Job {} submitted as remote job {}", jobId, remoteJobId);
        return jobRepository.save(job);
    }

    /**
     * Counts one status poll and applies what the remote side reported. A remote success
     * only moves the job to RUNNING; the caller completes it once results are stored.
     */
    public InsarJob recordPollResult(String jobId, RemoteStatusReport report) {
        InsarJob job = load(jobId);
        JobStatus current = job.getStatus();
        if (current != JobStatus.SUBMITTED && current != JobStatus.RUNNING) {
            throw new InvalidTransitionException("Job " + jobId + " is " + current + ", nothing to poll");
        }
        Instant now = clock.instant();
        job.setAttempts(job.getAttempts() + 1);
        job.setNextAttemptAt(null);
        job.setUpdatedAt(now);

        switch (report.status()) {
            case FAILED:
                terminate(job, JobStatus.FAILED, FailureClass.REMOTE_FAILURE,
                        report.detail() != null ? report.detail() : "Remote job failed", now);
                log.warn("Job {} failed remotely: {}", jobId, job.getFailureReason());
                break;
            case PENDING:
            case RUNNING:
            case SUCCEEDED:
                if (current == JobStatus.SUBMITTED) {
                    log.info("Job {} is now running remotely", jobId);
                }
                job.setStatus(JobStatus.RUNNING);
                break;
            default:
                throw new IllegalStateException("Unhandled remote status " + report.status());
        }
        return jobRepository.save(job);
    }

    public InsarJob recordFailedAttempt(String jobId, String reason, Instant nextAttemptAt) {
        InsarJob job = load(jobId);
        if (job.getStatus().isTerminal()) {
            throw new InvalidTransitionException("Job " + jobId + " is already " + job.getStatus());
        }
        job.setAttempts(job.getAttempts() + 1);
        job.setFailureReason(truncate(reason));
        job.setNextAttemptAt(nextAttemptAt);
        job.setUpdatedAt(clock.instant());
        log.debug("Job {} attempt {} failed, next attempt at {}", jobId, job.getAttempts(), nextAttemptAt);
        return jobRepository.save(job);
    }

    /**
     * Moves a job into a terminal status. Repeating the same terminal status is a no-op.
     *
     * @throws AlreadyTerminalException when the job already ended in another status
     */
    public InsarJob markTerminal(String jobId, JobStatus status, FailureClass failureClass, String reason) {
        if (!status.isTerminal()) {
            throw new IllegalArgumentException(status + " is not a terminal status");
        }
        InsarJob job = load(jobId);
        if (job.getStatus() == status) {
            log.debug("Job {} is already {}", jobId, status);
            return job;
        }
        if (job.getStatus().isTerminal()) {
            throw new AlreadyTerminalException(jobId, job.getStatus(), status);
        }
        if (!job.getStatus().canTransitionTo(status)) {
            throw new InvalidTransitionException(jobId, job.getStatus(), status);
        }
        Instant now = clock.instant();
        terminate(job, status, failureClass, reason, now);
        if (status == JobStatus.SUCCEEDED) {
            log.info("Job {} succeeded after {} attempts", jobId, job.getAttempts());
        } else {
            log.warn("Job {} ended {} ({}): {}", jobId, status, failureClass, reason);
        }
        return jobRepository.save(job);
    }

    public InsarJob markSucceeded(String jobId, int samplesPersisted, long processingTimeMs) {
        InsarJob job = markTerminal(jobId, JobStatus.SUCCEEDED, null, null);
        job.setSamplesPersisted(samplesPersisted);
        job.setProcessingTimeMs(processingTimeMs);
        return jobRepository.save(job);
    }

    /**
     * @return true when {@code owner} now holds the lease; false means someone else does or
     *         the job has ended, and nothing was changed
     */
    public boolean claim(String jobId, String owner, Duration leaseDuration) {
        Instant now = clock.instant();
        boolean claimed = jobRepository.claim(jobId, owner, now, now.plus(leaseDuration), JobStatus.ACTIVE) == 1;
        if (!claimed) {
            log.debug("Job {} not claimed by {}", jobId, owner);
        }
        return claimed;
    }

    public void release(String jobId, String owner) {
        if (jobRepository.release(jobId, owner) == 0) {
            log.debug("Lease on job {} was no longer held by {}", jobId, owner);
        }
    }

    public InsarJob requestCancellation(String jobId) {
        InsarJob job = load(jobId);
        if (job.getStatus().isTerminal()) {
            throw new InvalidTransitionException("Job " + jobId + " is already " + job.getStatus());
        }
        if (!job.isCancelRequested()) {
            job.setCancelRequested(true);
            job.setUpdatedAt(clock.instant());
            log.info("Cancellation requested for job {}", jobId);
        }
        return jobRepository.save(job);
    }

    @Transactional(readOnly = true)
    public List<String> findDueJobIds(int limit) {
        if (limit <= 0) {
            return List.of();
        }
        return jobRepository.findDueJobIds(JobStatus.ACTIVE, clock.instant(), PageRequest.of(0, limit));
    }

    @Transactional(readOnly = true)
    public InsarJob find(String jobId) {
        return load(jobId);
    }

    @Transactional(readOnly = true)
    public List<InsarJob> findByInfrastructure(String infrastructureId) {
        return jobRepository.findByInfrastructureIdOrderByCreatedAtDesc(infrastructureId);
    }

    private InsarJob load(String jobId) {
        return jobRepository.findById(jobId).orElseThrow(() -> new JobNotFoundException(jobId));
    }

    private static void terminate(InsarJob job, JobStatus status, FailureClass failureClass, String reason,
                                  Instant now) {
        job.setStatus(status);
        job.setFailureClass(failureClass);
        job.setFailureReason(truncate(reason));
        job.setNextAttemptAt(null);
        job.setCompletedAt(now);
        job.setUpdatedAt(now);
    }

    private static String truncate(String reason) {
        if (reason == null || reason.length() <= MAX_REASON_LENGTH) {
            return reason;
        }
        return reason.substring(0, MAX_REASON_LENGTH);
    }
}
