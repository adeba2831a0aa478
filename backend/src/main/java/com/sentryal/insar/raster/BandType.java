package com.sentryal.insar.raster;

public enum BandType {
    VERTICAL,
    LINE_OF_SIGHT,
    COHERENCE
}
