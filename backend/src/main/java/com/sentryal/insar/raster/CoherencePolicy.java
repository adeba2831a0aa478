package com.sentryal.insar.raster;

/**
 * What happens to a sample whose coherence is under the quality threshold.
 */
public enum CoherencePolicy {
    /** Not emitted at all. */
    DROP,
    /** Emitted with the low-confidence flag set. */
    FLAG
}
