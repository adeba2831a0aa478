package com.sentryal.insar.raster;

import java.math.BigDecimal;
import java.time.LocalDate;

public record PointMeasurement(String pointId,
                               LocalDate acquisitionDate,
                               BigDecimal verticalMm,
                               BigDecimal losMm,
                               Double coherence,
                               boolean lowConfidence) {
}
