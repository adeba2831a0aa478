package com.sentryal.insar.store;

public record CommitResult(int inserted, int duplicatesSkipped) {
}
