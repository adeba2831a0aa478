package com.sentryal.insar.exception;

public class TransientRemoteException extends InsarPipelineException {

    public TransientRemoteException(String message) {
        super(message);
    }

    public TransientRemoteException(String message, Throwable cause) {
        super(message, cause);
    }
}
