package com.sentryal.insar.scheduler;

import com.sentryal.insar.catalog.PointCatalog;
import com.sentryal.insar.client.ProcessingJobClient;
import com.sentryal.insar.client.RasterArtifact;
import com.sentryal.insar.config.PipelineProperties;
import com.sentryal.insar.exception.GeometryMismatchException;
import com.sentryal.insar.exception.PermanentRemoteException;
import com.sentryal.insar.exception.PostProcessingFailureException;
import com.sentryal.insar.exception.RasterFormatException;
import com.sentryal.insar.exception.RateLimitExceededException;
import com.sentryal.insar.exception.TransientRemoteException;
import com.sentryal.insar.exception.UnparsableFilenameException;
import com.sentryal.insar.model.InsarJob;
import com.sentryal.insar.raster.AcquisitionDateParser;
import com.sentryal.insar.raster.BandType;
import com.sentryal.insar.raster.ExtractionResult;
import com.sentryal.insar.raster.GeoTiffReader;
import com.sentryal.insar.raster.PointMeasurement;
import com.sentryal.insar.raster.RasterBand;
import com.sentryal.insar.raster.RasterExtractor;
import com.sentryal.insar.raster.RasterStatistics;
import com.sentryal.insar.raster.TargetPoint;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;
import org.springframework.util.FileSystemUtils;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.DoubleSummaryStatistics;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;

/**
 * Turns the products of a finished remote job into point measurements.
 *
 * <p>Downloaded files are grouped by acquisition date; each group is one set of
 * co-registered bands. A group that cannot be read or is misaligned is rejected and the
 * remaining groups still count. Only a job with no usable group at all fails.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class ArtifactProcessor {

    private final ProcessingJobClient processingJobClient;
    private final PointCatalog pointCatalog;
    private final GeoTiffReader geoTiffReader;
    private final RasterExtractor rasterExtractor;
    private final PipelineProperties properties;

    /**
     * @throws PostProcessingFailureException when nothing usable could be extracted
     * @throws RateLimitExceededException     when the download could not be started yet
     */
    public List<PointMeasurement> process(InsarJob job) {
        List<TargetPoint> points = pointCatalog.pointsFor(job.getInfrastructureId());
        if (points.isEmpty()) {
            throw new PostProcessingFailureException("No monitoring points for infrastructure "
                    + job.getInfrastructureId());
        }
        Path jobDir = properties.getArtifacts().getWorkDir().resolve(job.getId());
        try {
            Files.createDirectories(jobDir);
            List<RasterArtifact> artifacts = download(job.getRemoteJobId(), jobDir);
            log.info("Downloaded {} artifacts for remote job {}", artifacts.size(), job.getRemoteJobId());
            return extractAll(job, group(artifacts), points);
        } catch (IOException e) {
            throw new PostProcessingFailureException("Cannot prepare work directory " + jobDir, e);
        } finally {
            cleanUp(jobDir);
        }
    }

    private List<RasterArtifact> download(String remoteJobId, Path jobDir) {
        try {
            List<RasterArtifact> artifacts = processingJobClient.downloadArtifacts(remoteJobId, jobDir);
            if (artifacts.isEmpty()) {
                throw new PostProcessingFailureException("Remote job " + remoteJobId + " produced no artifacts");
            }
            return artifacts;
        } catch (RateLimitExceededException e) {
            throw e;
        } catch (TransientRemoteException | PermanentRemoteException e) {
            throw new PostProcessingFailureException("Failed to download artifacts of remote job "
                    + remoteJobId + ": " + e.getMessage(), e);
        }
    }

    private Map<LocalDate, Map<BandType, RasterArtifact>> group(List<RasterArtifact> artifacts) {
        Map<LocalDate, Map<BandType, RasterArtifact>> groups = new TreeMap<>();
        for (RasterArtifact artifact : artifacts) {
            LocalDate date = AcquisitionDateParser.tryParse(artifact.filename()).orElse(null);
            if (date == null) {
                log.warn("Skipping artifact {}: no acquisition date in its name", artifact.filename());
                continue;
            }
            Map<BandType, RasterArtifact> bands = groups.computeIfAbsent(date, d -> new EnumMap<>(BandType.class));
            RasterArtifact previous = bands.putIfAbsent(artifact.bandType(), artifact);
            if (previous != null) {
                log.warn("Ignoring {}: {} band for {} already provided by {}", artifact.filename(),
                        artifact.bandType(), date, previous.filename());
            }
        }
        return groups;
    }

    private List<PointMeasurement> extractAll(InsarJob job, Map<LocalDate, Map<BandType, RasterArtifact>> groups,
                                              List<TargetPoint> points) {
        List<PointMeasurement> measurements = new ArrayList<>();
        int rejected = 0;
        for (Map.Entry<LocalDate, Map<BandType, RasterArtifact>> entry : groups.entrySet()) {
            Map<BandType, RasterArtifact> group = entry.getValue();
            if (!group.containsKey(BandType.VERTICAL)) {
                rejected++;
                log.warn("Rejected products for {}: no vertical displacement band among {}",
                        entry.getKey(), group.keySet());
                continue;
            }
            try {
                ExtractionResult result = rasterExtractor.extract(readBands(group), points);
                logResult(result);
                measurements.addAll(result.samples());
            } catch (GeometryMismatchException | RasterFormatException | UnparsableFilenameException e) {
                rejected++;
                log.warn("Rejected products for {}, {} points skipped: {}", entry.getKey(), points.size(),
                        e.getMessage());
            } catch (RuntimeException e) {
                rejected++;
                log.error("Rejected products for {}, {} points skipped", entry.getKey(), points.size(), e);
            }
        }
        if (measurements.isEmpty()) {
            throw new PostProcessingFailureException(String.format(
                    "No usable samples for job %s: %d of %d acquisition groups rejected",
                    job.getId(), rejected, groups.size()));
        }
        log.info("Extracted {} samples from {} acquisition groups ({} rejected)",
                measurements.size(), groups.size() - rejected, rejected);
        return measurements;
    }

    private Map<BandType, RasterBand> readBands(Map<BandType, RasterArtifact> group) {
        Map<BandType, RasterBand> bands = new EnumMap<>(BandType.class);
        for (Map.Entry<BandType, RasterArtifact> entry : group.entrySet()) {
            RasterBand band = geoTiffReader.read(entry.getValue().path());
            if (log.isDebugEnabled()) {
                RasterStatistics stats = RasterStatistics.of(band);
                log.debug("{} band {}: {} valid, {} no-data, min {} max {} mean {} stddev {}",
                        entry.getKey(), band.getSourceName(), stats.validCount(), stats.noDataCount(),
                        stats.min(), stats.max(), stats.mean(), stats.stdDev());
            }
            bands.put(entry.getKey(), band);
        }
        return bands;
    }

    private void logResult(ExtractionResult result) {
        DoubleSummaryStatistics vertical = result.verticalMmStatistics();
        log.info("{} ({}): {}/{} points sampled, {} low confidence, {} skipped"
                        + " [out of bounds {}, no data {}, low coherence {}]",
                result.sourceName(), result.acquisitionDate(), result.samples().size(), result.requested(),
                result.lowConfidenceCount(), result.skipped(), result.outOfBounds(), result.noData(),
                result.lowCoherenceDropped());
        if (vertical.getCount() > 0) {
            log.info("{}: vertical mm min {} mean {} max {}, mean coherence {}", result.acquisitionDate(),
                    vertical.getMin(), String.format("%.2f", vertical.getAverage()), vertical.getMax(),
                    result.meanCoherence().isPresent()
                            ? String.format("%.3f", result.meanCoherence().getAsDouble()) : "n/a");
        }
    }

    private void cleanUp(Path jobDir) {
        if (properties.getArtifacts().isKeepFiles()) {
            log.debug("Keeping artifacts in {}", jobDir);
            return;
        }
        try {
            FileSystemUtils.deleteRecursively(jobDir);
        } catch (IOException e) {
            log.warn("Failed to delete work directory {}: {}", jobDir, e.getMessage());
        }
    }
}
