package com.sentryal.insar.model;

import java.util.EnumSet;
import java.util.Set;

/**
 * Lifecycle of an InSAR job. SUCCEEDED, FAILED and EXPIRED are absorbing.
 */
public enum JobStatus {
    PENDING,
    SUBMITTED,
    RUNNING,
    SUCCEEDED,
    FAILED,
    EXPIRED;

    public static final Set<JobStatus> ACTIVE = EnumSet.of(PENDING, SUBMITTED, RUNNING);

    public boolean isTerminal() {
        return !ACTIVE.contains(this);
    }

    public boolean canTransitionTo(JobStatus next) {
        if (isTerminal()) {
            return false;
        }
        switch (next) {
            case SUBMITTED:
                return this == PENDING || this == SUBMITTED;
            case RUNNING:
                return this == SUBMITTED || this == RUNNING;
            case SUCCEEDED:
                return this == RUNNING;
            case FAILED:
            case EXPIRED:
                return true;
            default:
                return false;
        }
    }
}
