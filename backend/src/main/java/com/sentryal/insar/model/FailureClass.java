package com.sentryal.insar.model;

public enum FailureClass {
    REMOTE_REJECTED,
    REMOTE_FAILURE,
    POST_PROCESSING_FAILURE,
    PERSISTENCE_FAILURE,
    ATTEMPTS_EXHAUSTED,
    MAX_AGE_EXCEEDED,
    CANCELLED,
    NO_MONITORING_POINTS,
    INTERNAL_ERROR
}
