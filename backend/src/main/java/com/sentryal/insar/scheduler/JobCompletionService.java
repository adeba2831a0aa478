package com.sentryal.insar.scheduler;

import com.sentryal.insar.ledger.JobLedger;
import com.sentryal.insar.model.InsarJob;
import com.sentryal.insar.raster.PointMeasurement;
import com.sentryal.insar.store.CommitResult;
import com.sentryal.insar.store.ResultStore;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.util.List;

@Slf4j
@Service
@RequiredArgsConstructor
public class JobCompletionService {

    private final ResultStore resultStore;
    private final JobLedger jobLedger;

    // samples and the SUCCEEDED mark commit or roll back together
    @Transactional
    public InsarJob complete(String jobId, List<PointMeasurement> measurements, long processingTimeMs) {
        CommitResult result = resultStore.commit(jobId, measurements);
        log.info("Stored {} samples for job {} ({} already present)", result.inserted(), jobId,
                result.duplicatesSkipped());
        int persisted = result.inserted() + result.duplicatesSkipped();
        return jobLedger.markSucceeded(jobId, persisted, processingTimeMs);
    }
}
