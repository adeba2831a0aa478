package com.sentryal.insar.raster;

public record RasterStatistics(long validCount, long noDataCount,
                               double min, double max, double mean, double stdDev) {

    public static RasterStatistics of(RasterBand band) {
        float[] values = band.rawValues();
        long valid = 0;
        double min = Double.POSITIVE_INFINITY;
        double max = Double.NEGATIVE_INFINITY;
        double mean = 0.0;
        double m2 = 0.0;
        for (float v : values) {
            if (!band.isValid(v)) {
                continue;
            }
            valid++;
            min = Math.min(min, v);
            max = Math.max(max, v);
            // Welford
            double delta = v - mean;
            mean += delta / valid;
            m2 += delta * (v - mean);
        }
        if (valid == 0) {
            return new RasterStatistics(0, values.length, Double.NaN, Double.NaN, Double.NaN, Double.NaN);
        }
        return new RasterStatistics(valid, values.length - valid, min, max, mean, Math.sqrt(m2 / valid));
    }
}
