package com.sentryal.insar.exception;

import com.sentryal.insar.model.JobStatus;

public class AlreadyTerminalException extends InsarPipelineException {

    public AlreadyTerminalException(String jobId, JobStatus current, JobStatus requested) {
        super("Job " + jobId + " is already " + current + ", refusing " + requested);
    }
}
