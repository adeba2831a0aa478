package com.sentryal.insar.exception;

public class PersistenceFailureException extends InsarPipelineException {

    public PersistenceFailureException(String message, Throwable cause) {
        super(message, cause);
    }
}
