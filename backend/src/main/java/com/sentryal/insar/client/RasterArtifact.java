package com.sentryal.insar.client;

import com.sentryal.insar.raster.BandType;

import java.nio.file.Path;

public record RasterArtifact(BandType bandType, Path path) {

    public String filename() {
        return path.getFileName().toString();
    }
}
