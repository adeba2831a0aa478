package com.sentryal.insar.exception;

public class UnparsableFilenameException extends InsarPipelineException {

    private final String filename;

    public UnparsableFilenameException(String filename) {
        super("No acquisition date found in filename: " + filename);
        this.filename = filename;
    }

    public String getFilename() {
        return filename;
    }
}
