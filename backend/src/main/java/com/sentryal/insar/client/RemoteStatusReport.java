package com.sentryal.insar.client;

public record RemoteStatusReport(RemoteJobStatus status, String detail) {

    public static RemoteStatusReport of(RemoteJobStatus status) {
        return new RemoteStatusReport(status, null);
    }
}
