package com.sentryal.insar.model;

import jakarta.persistence.*;
import lombok.Data;

import java.time.Instant;

@Entity
@Table(name = "insar_jobs", indexes = {
        @Index(name = "idx_insar_jobs_status_next_attempt", columnList = "status, next_attempt_at"),
        @Index(name = "idx_insar_jobs_infrastructure", columnList = "infrastructure_id")
})
@Data
public class InsarJob {

    @Id
    @Column(length = 36, updatable = false)
    private String id;

    @Column(name = "infrastructure_id", nullable = false, updatable = false)
    private String infrastructureId;

    @Column(name = "remote_job_id", unique = true)
    private String remoteJobId;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false, length = 16)
    private JobStatus status;

    @Column(nullable = false)
    private int attempts;

    @Embedded
    private JobParameters parameters;

    @Enumerated(EnumType.STRING)
    @Column(name = "failure_class", length = 32)
    private FailureClass failureClass;

    @Column(name = "failure_reason", length = 4000)
    private String failureReason;

    @Column(name = "lease_owner")
    private String leaseOwner;

    @Column(name = "lease_expires_at")
    private Instant leaseExpiresAt;

    @Column(name = "next_attempt_at")
    private Instant nextAttemptAt;

    @Column(name = "cancel_requested", nullable = false)
    private boolean cancelRequested;

    @Column(name = "samples_persisted")
    private Integer samplesPersisted;

    @Column(name = "processing_time_ms")
    private Long processingTimeMs;

    @Column(name = "created_at", nullable = false, updatable = false)
    private Instant createdAt;

    @Column(name = "updated_at", nullable = false)
    private Instant updatedAt;

    @Column(name = "completed_at")
    private Instant completedAt;

    @Version
    private Long version;

    @PrePersist
    protected void onCreate() {
        if (createdAt == null) {
            createdAt = Instant.now();
        }
        if (updatedAt == null) {
            updatedAt = createdAt;
        }
        if (status == null) {
            status = JobStatus.PENDING;
        }
    }
}
