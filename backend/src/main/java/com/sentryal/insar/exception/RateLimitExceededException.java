package com.sentryal.insar.exception;

public class RateLimitExceededException extends TransientRemoteException {

    public RateLimitExceededException(String message, Throwable cause) {
        super(message, cause);
    }
}
