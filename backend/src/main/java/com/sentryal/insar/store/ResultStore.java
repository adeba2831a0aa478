package com.sentryal.insar.store;

import com.sentryal.insar.exception.JobNotFoundException;
import com.sentryal.insar.exception.PersistenceFailureException;
import com.sentryal.insar.model.DeformationSample;
import com.sentryal.insar.model.InsarJob;
import com.sentryal.insar.raster.PointMeasurement;
import com.sentryal.insar.repository.DeformationSampleRepository;
import com.sentryal.insar.repository.InsarJobRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataAccessException;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Set;

/**
 * Writes extracted samples for a job. Re-committing the same samples is a no-op, so a
 * completion step that crashed half way can simply run again.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class ResultStore {

    private final DeformationSampleRepository sampleRepository;
    private final InsarJobRepository jobRepository;
    private final Clock clock;

    /**
     * Inserts the samples not yet stored for {@code jobId}, all or nothing.
     *
     * @throws PersistenceFailureException when the database rejects the batch
     */
    @Transactional
    public CommitResult commit(String jobId, List<PointMeasurement> measurements) {
        InsarJob job = jobRepository.findById(jobId).orElseThrow(() -> new JobNotFoundException(jobId));
        try {
            Set<SampleKey> seen = new HashSet<>(sampleRepository.findKeysByJobId(jobId));
            Instant now = clock.instant();
            List<DeformationSample> toInsert = new ArrayList<>();
            int duplicates = 0;
            for (PointMeasurement m : measurements) {
                if (!seen.add(new SampleKey(m.pointId(), m.acquisitionDate()))) {
                    duplicates++;
                    continue;
                }
                toInsert.add(DeformationSample.builder()
                        .jobId(jobId)
                        .infrastructureId(job.getInfrastructureId())
                        .pointId(m.pointId())
                        .acquisitionDate(m.acquisitionDate())
                        .verticalMm(m.verticalMm())
                        .losMm(m.losMm())
                        .coherence(m.coherence())
                        .lowConfidence(m.lowConfidence())
                        .createdAt(now)
                        .build());
            }
            sampleRepository.saveAll(toInsert);
            sampleRepository.flush();
            if (duplicates > 0) {
                log.info("Job {}: skipped {} samples already stored", jobId, duplicates);
            }
            return new CommitResult(toInsert.size(), duplicates);
        } catch (DataAccessException e) {
            throw new PersistenceFailureException("Failed to store " + measurements.size()
                    + " samples for job " + jobId, e);
        }
    }

    @Transactional(readOnly = true)
    public List<DeformationSample> findByJob(String jobId) {
        return sampleRepository.findByJobIdOrderByPointIdAscAcquisitionDateAsc(jobId);
    }

    @Transactional(readOnly = true)
    public List<DeformationSample> findByInfrastructure(String infrastructureId) {
        return sampleRepository.findByInfrastructureIdOrderByAcquisitionDateAscPointIdAsc(infrastructureId);
    }

    @Transactional(readOnly = true)
    public long countTrusted(String jobId) {
        return sampleRepository.countByJobIdAndLowConfidenceFalse(jobId);
    }
}
