package com.sentryal.insar.raster;

import java.util.Objects;

public final class RasterBand {

    private final String sourceName;
    private final int width;
    private final int height;
    private final GeoTransform geoTransform;
    private final Double noData;
    private final float[] values; // row-major

    public RasterBand(String sourceName, int width, int height, GeoTransform geoTransform,
                      Double noData, float[] values) {
        if (width <= 0 || height <= 0) {
            throw new IllegalArgumentException("Raster dimensions must be positive: " + width + "x" + height);
        }
        if (values.length != width * height) {
            throw new IllegalArgumentException("Expected " + (width * height) + " values, got " + values.length);
        }
        this.sourceName = Objects.requireNonNull(sourceName, "sourceName");
        this.width = width;
        this.height = height;
        this.geoTransform = Objects.requireNonNull(geoTransform, "geoTransform");
        this.noData = noData;
        this.values = values;
    }

    public String getSourceName() {
        return sourceName;
    }

    public int getWidth() {
        return width;
    }

    public int getHeight() {
        return height;
    }

    public GeoTransform getGeoTransform() {
        return geoTransform;
    }

    public Double getNoData() {
        return noData;
    }

    public float valueAt(int col, int row) {
        return values[row * width + col];
    }

    /**
     * False for NaN, infinities and the declared no-data sentinel.
     */
    public boolean isValid(float value) {
        if (Float.isNaN(value) || Float.isInfinite(value)) {
            return false;
        }
        return noData == null || Double.isNaN(noData) || value != noData.floatValue();
    }

    public boolean sameGeometry(RasterBand other) {
        return width == other.width
                && height == other.height
                && geoTransform.matches(other.geoTransform);
    }

    float[] rawValues() {
        return values;
    }
}
