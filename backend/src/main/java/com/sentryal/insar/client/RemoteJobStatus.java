package com.sentryal.insar.client;

public enum RemoteJobStatus {
    PENDING,
    RUNNING,
    SUCCEEDED,
    FAILED
}
