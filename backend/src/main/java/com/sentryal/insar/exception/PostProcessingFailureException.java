package com.sentryal.insar.exception;

public class PostProcessingFailureException extends InsarPipelineException {

    public PostProcessingFailureException(String message) {
        super(message);
    }

    public PostProcessingFailureException(String message, Throwable cause) {
        super(message, cause);
    }
}
