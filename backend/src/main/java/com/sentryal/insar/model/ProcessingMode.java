package com.sentryal.insar.model;

public enum ProcessingMode {
    STANDARD,
    FAST
}
