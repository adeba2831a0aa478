package com.sentryal.insar.exception;

import com.sentryal.insar.model.JobStatus;

public class InvalidTransitionException extends InsarPipelineException {

    public InvalidTransitionException(String jobId, JobStatus from, JobStatus to) {
        super("Job " + jobId + " cannot move from " + from + " to " + to);
    }

    public InvalidTransitionException(String message) {
        super(message);
    }
}
