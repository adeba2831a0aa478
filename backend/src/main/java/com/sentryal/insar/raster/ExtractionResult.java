package com.sentryal.insar.raster;

import java.time.LocalDate;
import java.util.DoubleSummaryStatistics;
import java.util.List;
import java.util.Objects;
import java.util.OptionalDouble;

public record ExtractionResult(String sourceName,
                               LocalDate acquisitionDate,
                               List<PointMeasurement> samples,
                               int requested,
                               int outOfBounds,
                               int noData,
                               int lowCoherenceDropped) {

    public ExtractionResult {
        samples = List.copyOf(samples);
    }

    public int skipped() {
        return outOfBounds + noData + lowCoherenceDropped;
    }

    public long trustedCount() {
        return samples.stream().filter(s -> !s.lowConfidence()).count();
    }

    public long lowConfidenceCount() {
        return samples.size() - trustedCount();
    }

    public DoubleSummaryStatistics verticalMmStatistics() {
        return samples.stream().mapToDouble(s -> s.verticalMm().doubleValue()).summaryStatistics();
    }

    public OptionalDouble meanCoherence() {
        return samples.stream()
                .map(PointMeasurement::coherence)
                .filter(Objects::nonNull)
                .mapToDouble(Double::doubleValue)
                .average();
    }
}
