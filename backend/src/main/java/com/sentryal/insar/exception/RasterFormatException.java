package com.sentryal.insar.exception;

public class RasterFormatException extends InsarPipelineException {

    public RasterFormatException(String message) {
        super(message);
    }

    public RasterFormatException(String message, Throwable cause) {
        super(message, cause);
    }
}
