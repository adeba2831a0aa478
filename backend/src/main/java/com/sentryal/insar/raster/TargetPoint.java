package com.sentryal.insar.raster;

public record TargetPoint(String pointId, double latitude, double longitude) {
}
