package com.sentryal.insar.scheduler;

import com.sentryal.insar.config.PipelineProperties;

import java.time.Duration;

public final class BackoffPolicy {

    private final Duration initial;
    private final Duration max;

    public BackoffPolicy(Duration initial, Duration max) {
        if (initial.isNegative() || max.compareTo(initial) < 0) {
            throw new IllegalArgumentException("Invalid backoff " + initial + " .. " + max);
        }
        this.initial = initial;
        this.max = max;
    }

    public static BackoffPolicy from(PipelineProperties.Backoff backoff) {
        return new BackoffPolicy(backoff.getInitial(), backoff.getMax());
    }

    /**
     * @param attempts attempts made so far, including the one that just failed
     */
    public Duration delayFor(int attempts) {
        int doublings = Math.max(0, attempts - 1);
        Duration delay = initial;
        for (int i = 0; i < doublings && delay.compareTo(max) < 0; i++) {
            delay = delay.multipliedBy(2);
        }
        return delay.compareTo(max) > 0 ? max : delay;
    }
}
