package com.sentryal.insar.exception;

public class JobNotFoundException extends InsarPipelineException {

    public JobNotFoundException(String jobId) {
        super("Job not found: " + jobId);
    }
}
