package com.sentryal.insar.exception;

public class GeometryMismatchException extends InsarPipelineException {

    public GeometryMismatchException(String message) {
        super(message);
    }
}
