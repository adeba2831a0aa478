package com.sentryal.insar.exception;

public class PermanentRemoteException extends InsarPipelineException {

    public PermanentRemoteException(String message) {
        super(message);
    }

    public PermanentRemoteException(String message, Throwable cause) {
        super(message, cause);
    }
}
