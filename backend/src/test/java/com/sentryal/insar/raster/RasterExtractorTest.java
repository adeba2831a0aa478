package com.sentryal.insar.raster;

import com.sentryal.insar.exception.GeometryMismatchException;
import com.sentryal.insar.exception.UnparsableFilenameException;
import org.junit.jupiter.api.Test;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.util.Arrays;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

public class RasterExtractorTest {

    private static final String VERTICAL_NAME = "S1AA_20240101T054512_20240113T054512_VVP012_INT80_vert_disp.tif";
    private static final GeoTransform GRID = GeoTransform.northUp(10.0, 50.0, 0.01, 0.01);

    private final RasterExtractor extractor = new RasterExtractor(0.3, CoherencePolicy.DROP);

    @Test
    public void testToMillimetres_RoundsToTwoDecimals() {
        assertEquals(new BigDecimal("-51.20"), RasterExtractor.toMillimetres(-0.0512f));
        assertEquals(new BigDecimal("12.35"), RasterExtractor.toMillimetres(0.01235f));
        assertEquals(new BigDecimal("0.00"), RasterExtractor.toMillimetres(0.0f));
    }

    @Test
    public void testExtract_VerticalOnly_MarksLowConfidence() {
        Map<BandType, RasterBand> bands = bands(band(VERTICAL_NAME, -0.0512f), null, null);

        ExtractionResult result = extractor.extract(bands, List.of(pointAt("p1", 2, 3)));

        assertEquals(1, result.samples().size());
        PointMeasurement sample = result.samples().get(0);
        assertEquals("p1", sample.pointId());
        assertEquals(LocalDate.of(2024, 1, 13), sample.acquisitionDate());
        assertEquals(new BigDecimal("-51.20"), sample.verticalMm());
        assertNull(sample.losMm());
        assertNull(sample.coherence());
        assertTrue(sample.lowConfidence());
        assertEquals(LocalDate.of(2024, 1, 13), result.acquisitionDate());
    }

    @Test
    public void testExtract_SamplesThePixelContainingThePoint() {
        float[] values = new float[100];
        for (int i = 0; i < values.length; i++) {
            values[i] = i / 1000f;
        }
        RasterBand vertical = new RasterBand(VERTICAL_NAME, 10, 10, GRID, null, values);
        RasterBand coherence = band("coh_20240113.tif", 0.9f);

        ExtractionResult result = extractor.extract(bands(vertical, null, coherence),
                List.of(pointAt("a", 0, 0), pointAt("b", 7, 4), pointAt("c", 9, 9)));

        assertEquals(new BigDecimal("0.00"), result.samples().get(0).verticalMm());
        assertEquals(new BigDecimal("47.00"), result.samples().get(1).verticalMm());
        assertEquals(new BigDecimal("99.00"), result.samples().get(2).verticalMm());
        assertFalse(result.samples().get(1).lowConfidence());
    }

    @Test
    public void testExtract_PointsOutsideRasterAreCountedAndSkipped() {
        Map<BandType, RasterBand> bands = bands(band(VERTICAL_NAME, 0.001f), null, null);
        List<TargetPoint> points = List.of(
                pointAt("inside", 5, 5),
                new TargetPoint("west", 49.95, 9.99),
                new TargetPoint("south", 49.85, 10.05),
                new TargetPoint("east", 49.95, 10.15));

        ExtractionResult result = extractor.extract(bands, points);

        assertEquals(1, result.samples().size());
        assertEquals(3, result.outOfBounds());
        assertEquals(3, result.skipped());
        assertEquals(4, result.requested());
    }

    @Test
    public void testExtract_NoDataAndNaNAreSkipped() {
        float[] values = filled(0.002f);
        values[pixel(1, 1)] = -9999f;
        values[pixel(2, 2)] = Float.NaN;
        values[pixel(3, 3)] = Float.POSITIVE_INFINITY;
        RasterBand vertical = new RasterBand(VERTICAL_NAME, 10, 10, GRID, -9999.0, values);
        float[] los = filled(0.003f);
        los[pixel(4, 4)] = Float.NaN;
        RasterBand lineOfSight = new RasterBand("los_20240113.tif", 10, 10, GRID, null, los);

        ExtractionResult result = extractor.extract(bands(vertical, lineOfSight, null), List.of(
                pointAt("nodata", 1, 1), pointAt("nan", 2, 2), pointAt("inf", 3, 3),
                pointAt("los-nan", 4, 4), pointAt("ok", 5, 5)));

        assertEquals(1, result.samples().size());
        assertEquals("ok", result.samples().get(0).pointId());
        assertEquals(new BigDecimal("3.00"), result.samples().get(0).losMm());
        assertEquals(4, result.noData());
    }

    @Test
    public void testExtract_DropPolicyRemovesLowCoherencePoints() {
        float[] coherence = filled(0.8f);
        coherence[pixel(1, 1)] = 0.1f;
        Map<BandType, RasterBand> bands = bands(band(VERTICAL_NAME, 0.001f), null,
                new RasterBand("corr_20240113.tif", 10, 10, GRID, null, coherence));

        ExtractionResult result = extractor.extract(bands, List.of(pointAt("low", 1, 1), pointAt("high", 2, 2)));

        assertEquals(1, result.samples().size());
        assertEquals("high", result.samples().get(0).pointId());
        assertEquals(0.8, result.samples().get(0).coherence(), 1e-9);
        assertEquals(1, result.lowCoherenceDropped());
        assertEquals(1, result.trustedCount());
    }

    @Test
    public void testExtract_FlagPolicyKeepsLowCoherencePoints() {
        float[] coherence = filled(0.8f);
        coherence[pixel(1, 1)] = 0.1f;
        Map<BandType, RasterBand> bands = bands(band(VERTICAL_NAME, 0.001f), null,
                new RasterBand("corr_20240113.tif", 10, 10, GRID, null, coherence));

        ExtractionResult result = new RasterExtractor(0.3, CoherencePolicy.FLAG)
                .extract(bands, List.of(pointAt("low", 1, 1), pointAt("high", 2, 2)));

        assertEquals(2, result.samples().size());
        assertTrue(result.samples().get(0).lowConfidence());
        assertFalse(result.samples().get(1).lowConfidence());
        assertEquals(0, result.lowCoherenceDropped());
        assertEquals(1, result.lowConfidenceCount());
    }

    @Test
    public void testExtract_MisalignedBandsAreRejected() {
        RasterBand vertical = band(VERTICAL_NAME, 0.001f);
        RasterBand shifted = new RasterBand("corr_20240113.tif", 10, 10,
                GeoTransform.northUp(10.005, 50.0, 0.01, 0.01), null, filled(0.9f));
        RasterBand smaller = new RasterBand("los_20240113.tif", 9, 10, GRID, null, new float[90]);

        assertThrows(GeometryMismatchException.class,
                () -> extractor.extract(bands(vertical, null, shifted), List.of(pointAt("p", 1, 1))));
        assertThrows(GeometryMismatchException.class,
                () -> extractor.extract(bands(vertical, smaller, null), List.of(pointAt("p", 1, 1))));
    }

    @Test
    public void testExtract_RequiresVerticalBand() {
        Map<BandType, RasterBand> bands = new EnumMap<>(BandType.class);
        bands.put(BandType.COHERENCE, band("corr_20240113.tif", 0.9f));

        assertThrows(IllegalArgumentException.class, () -> extractor.extract(bands, List.of(pointAt("p", 1, 1))));
    }

    @Test
    public void testExtract_UndatedVerticalBandIsRejected() {
        Map<BandType, RasterBand> bands = bands(band("vertical_displacement.tif", 0.001f), null, null);

        UnparsableFilenameException e = assertThrows(UnparsableFilenameException.class,
                () -> extractor.extract(bands, List.of(pointAt("p", 1, 1))));
        assertEquals("vertical_displacement.tif", e.getFilename());
    }

    @Test
    public void testExtract_IsRepeatable() {
        Map<BandType, RasterBand> bands = bands(band(VERTICAL_NAME, -0.0205f), null, band("corr_20240113.tif", 0.5f));
        List<TargetPoint> points = List.of(pointAt("a", 1, 2), pointAt("b", 3, 4), pointAt("c", 8, 0));

        assertEquals(extractor.extract(bands, points), extractor.extract(bands, points));
    }

    private static Map<BandType, RasterBand> bands(RasterBand vertical, RasterBand los, RasterBand coherence) {
        Map<BandType, RasterBand> bands = new EnumMap<>(BandType.class);
        bands.put(BandType.VERTICAL, vertical);
        if (los != null) {
            bands.put(BandType.LINE_OF_SIGHT, los);
        }
        if (coherence != null) {
            bands.put(BandType.COHERENCE, coherence);
        }
        return bands;
    }

    private static RasterBand band(String name, float value) {
        return new RasterBand(name, 10, 10, GRID, null, filled(value));
    }

    private static float[] filled(float value) {
        float[] values = new float[100];
        Arrays.fill(values, value);
        return values;
    }

    private static int pixel(int col, int row) {
        return row * 10 + col;
    }

    static TargetPoint pointAt(String id, int col, int row) {
        double[] centre = GRID.toGeo(col + 0.5, row + 0.5);
        return new TargetPoint(id, centre[1], centre[0]);
    }
}
