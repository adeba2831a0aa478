package com.sentryal.insar.raster;

import com.sentryal.insar.config.PipelineProperties;
import com.sentryal.insar.exception.GeometryMismatchException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Samples co-registered displacement and coherence bands at catalog points.
 *
 * <p>Stateless: the same bands and points always give the same result, so a job can be
 * re-extracted safely. Sampling is nearest-neighbour on the pixel containing the point.
 * Displacements arrive in metres and leave in millimetres with two decimals.
 */
@Slf4j
@Component
public class RasterExtractor {

    private static final BigDecimal MM_PER_METRE = BigDecimal.valueOf(1000);
    private static final int MM_SCALE = 2;

    private final double coherenceThreshold;
    private final CoherencePolicy coherencePolicy;

    @Autowired
    public RasterExtractor(PipelineProperties properties) {
        this(properties.getExtraction().getCoherenceThreshold(), properties.getExtraction().getCoherencePolicy());
    }

    public RasterExtractor(double coherenceThreshold, CoherencePolicy coherencePolicy) {
        this.coherenceThreshold = coherenceThreshold;
        this.coherencePolicy = Objects.requireNonNull(coherencePolicy, "coherencePolicy");
    }

    /**
     * @param bands  the vertical band is mandatory; line-of-sight and coherence are optional
     *               but, when present, must share the vertical band's grid and hold a valid
     *               value at a point for that point to be sampled
     * @param points catalog points in WGS84 degrees, matching the rasters' coordinate system
     * @throws GeometryMismatchException when the bands are not aligned
     * @throws com.sentryal.insar.exception.UnparsableFilenameException when the vertical
     *         band's name carries no acquisition date
     */
    public ExtractionResult extract(Map<BandType, RasterBand> bands, Collection<TargetPoint> points) {
        RasterBand vertical = bands.get(BandType.VERTICAL);
        if (vertical == null) {
            throw new IllegalArgumentException("A vertical displacement band is required, got " + bands.keySet());
        }
        checkAligned(vertical, bands);
        LocalDate acquisitionDate = AcquisitionDateParser.parse(vertical.getSourceName());

        RasterBand lineOfSight = bands.get(BandType.LINE_OF_SIGHT);
        RasterBand coherence = bands.get(BandType.COHERENCE);
        GeoTransform transform = vertical.getGeoTransform();

        List<PointMeasurement> samples = new ArrayList<>(points.size());
        int outOfBounds = 0;
        int noData = 0;
        int dropped = 0;

        for (TargetPoint point : points) {
            double[] pixel = transform.toPixel(point.longitude(), point.latitude());
            if (!Double.isFinite(pixel[0]) || !Double.isFinite(pixel[1])) {
                outOfBounds++;
                continue;
            }
            int col = (int) Math.floor(pixel[0]);
            int row = (int) Math.floor(pixel[1]);
            if (pixel[0] < 0 || pixel[1] < 0 || col >= vertical.getWidth() || row >= vertical.getHeight()) {
                outOfBounds++;
                continue;
            }

            float verticalMetres = vertical.valueAt(col, row);
            if (!vertical.isValid(verticalMetres)) {
                noData++;
                continue;
            }

            BigDecimal losMm = null;
            if (lineOfSight != null) {
                float losMetres = lineOfSight.valueAt(col, row);
                if (!lineOfSight.isValid(losMetres)) {
                    noData++;
                    continue;
                }
                losMm = toMillimetres(losMetres);
            }

            Double coherenceValue = null;
            if (coherence != null) {
                float raw = coherence.valueAt(col, row);
                if (!coherence.isValid(raw)) {
                    noData++;
                    continue;
                }
                coherenceValue = Double.valueOf(Float.toString(raw));
            }

            boolean belowThreshold = coherenceValue != null && coherenceValue < coherenceThreshold;
            if (belowThreshold && coherencePolicy == CoherencePolicy.DROP) {
                dropped++;
                continue;
            }
            // no coherence band means unknown quality
            boolean lowConfidence = belowThreshold || coherenceValue == null;

            samples.add(new PointMeasurement(point.pointId(), acquisitionDate, toMillimetres(verticalMetres),
                    losMm, coherenceValue, lowConfidence));
        }

        ExtractionResult result = new ExtractionResult(vertical.getSourceName(), acquisitionDate, samples,
                points.size(), outOfBounds, noData, dropped);
        log.debug("Extracted {} samples from {} ({} out of bounds, {} no-data, {} below coherence {})",
                samples.size(), vertical.getSourceName(), outOfBounds, noData, dropped, coherenceThreshold);
        return result;
    }

    static BigDecimal toMillimetres(float metres) {
        return new BigDecimal(Float.toString(metres)).multiply(MM_PER_METRE).setScale(MM_SCALE, RoundingMode.HALF_UP);
    }

    private static void checkAligned(RasterBand reference, Map<BandType, RasterBand> bands) {
        for (Map.Entry<BandType, RasterBand> entry : bands.entrySet()) {
            RasterBand band = entry.getValue();
            if (band != reference && !reference.sameGeometry(band)) {
                throw new GeometryMismatchException(String.format(
                        "%s band %s (%dx%d, %s) does not match vertical band %s (%dx%d, %s)",
                        entry.getKey(), band.getSourceName(), band.getWidth(), band.getHeight(),
                        band.getGeoTransform(), reference.getSourceName(), reference.getWidth(),
                        reference.getHeight(), reference.getGeoTransform()));
            }
        }
    }
}
