package com.sentryal.insar.raster;

/**
 * Affine pixel to geographic mapping in GDAL coefficient order. Pixel coordinates refer
 * to the top-left corner of the top-left pixel, so pixel {@code (c, r)} covers
 * {@code [c, c + 1) x [r, r + 1)}.
 *
 * <pre>
 * x = originX + col * pixelWidth + row * rowRotation
 * y = originY + col * colRotation + row * pixelHeight
 * </pre>
 */
public record GeoTransform(double originX,
                           double pixelWidth,
                           double rowRotation,
                           double originY,
                           double colRotation,
                           double pixelHeight) {

    private static final double TOLERANCE = 1e-9;

    public static GeoTransform northUp(double originX, double originY, double pixelWidth, double pixelHeight) {
        return new GeoTransform(originX, pixelWidth, 0.0, originY, 0.0, -Math.abs(pixelHeight));
    }

    public double[] toGeo(double col, double row) {
        return new double[] {
                originX + col * pixelWidth + row * rowRotation,
                originY + col * colRotation + row * pixelHeight
        };
    }

    public boolean isInvertible() {
        double det = determinant();
        return det != 0.0 && Double.isFinite(det) && Double.isFinite(originX) && Double.isFinite(originY);
    }

    /**
     * Inverts the transform.
     *
     * @return fractional {@code {col, row}}
     */
    public double[] toPixel(double x, double y) {
        double det = determinant();
        if (det == 0.0) {
            throw new IllegalStateException("Geotransform is not invertible: " + this);
        }
        double dx = x - originX;
        double dy = y - originY;
        double col = (pixelHeight * dx - rowRotation * dy) / det;
        double row = (-colRotation * dx + pixelWidth * dy) / det;
        return new double[] {col, row};
    }

    public boolean matches(GeoTransform other) {
        return close(originX, other.originX)
                && close(pixelWidth, other.pixelWidth)
                && close(rowRotation, other.rowRotation)
                && close(originY, other.originY)
                && close(colRotation, other.colRotation)
                && close(pixelHeight, other.pixelHeight);
    }

    private double determinant() {
        return pixelWidth * pixelHeight - rowRotation * colRotation;
    }

    private static boolean close(double a, double b) {
        return Math.abs(a - b) <= TOLERANCE * Math.max(1.0, Math.max(Math.abs(a), Math.abs(b)));
    }
}
