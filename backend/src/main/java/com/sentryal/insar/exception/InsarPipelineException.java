package com.sentryal.insar.exception;

/**
 * Base type for every failure raised by the polling and extraction pipeline.
 */
public class InsarPipelineException extends RuntimeException {

    public InsarPipelineException(String message) {
        super(message);
    }

    public InsarPipelineException(String message, Throwable cause) {
        super(message, cause);
    }
}
