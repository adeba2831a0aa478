package com.sentryal.insar.scheduler;

import com.sentryal.insar.client.ProcessingJobClient;
import com.sentryal.insar.client.RemoteJobStatus;
import com.sentryal.insar.client.RemoteStatusReport;
import com.sentryal.insar.exception.InvalidTransitionException;
import com.sentryal.insar.exception.PersistenceFailureException;
import com.sentryal.insar.ledger.JobLedger;
import com.sentryal.insar.model.InsarJob;
import com.sentryal.insar.model.JobParameters;
import com.sentryal.insar.model.JobStatus;
import com.sentryal.insar.model.ProcessingMode;
import com.sentryal.insar.raster.PointMeasurement;
import com.sentryal.insar.repository.DeformationSampleRepository;
import com.sentryal.insar.repository.InsarJobRepository;
import com.sentryal.insar.store.ResultStore;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.boot.test.mock.mockito.MockBean;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

// Not transactional: every call commits or rolls back for real.
@SpringBootTest(properties = "insar.artifacts.work-dir=${java.io.tmpdir}/insar-scenario-test")
class JobCompletionServiceTest {

    private static final LocalDate JAN_13 = LocalDate.of(2024, 1, 13);

    @Autowired
    private JobCompletionService completionService;

    @Autowired
    private ResultStore resultStore;

    @Autowired
    private JobLedger ledger;

    @Autowired
    private InsarJobRepository jobRepository;

    @Autowired
    private DeformationSampleRepository sampleRepository;

    @MockBean
    private ProcessingJobClient client;

    private String jobId;

    @BeforeEach
    void setup() {
        sampleRepository.deleteAll();
        jobRepository.deleteAll();
        jobId = ledger.create("bridge-7", JobParameters.of(LocalDate.of(2024, 1, 1), LocalDate.of(2024, 2, 1),
                ProcessingMode.STANDARD)).getId();
    }

    @Test
    void testCommit_FailingRowRollsBackWholeBatch() {
        List<PointMeasurement> batch = List.of(
                sample("p1", "-51.20"),
                sample("p2", "-50.10"),
                new PointMeasurement("p3", JAN_13, null, null, 0.8, false));

        assertThrows(PersistenceFailureException.class, () -> resultStore.commit(jobId, batch));

        assertEquals(0, sampleRepository.countByJobId(jobId));
    }

    @Test
    void testComplete_StoreFailureLeavesJobRunningWithoutSamples() {
        ledger.markSubmitted(jobId, "remote-1");
        ledger.recordPollResult(jobId, RemoteStatusReport.of(RemoteJobStatus.RUNNING));
        List<PointMeasurement> batch = List.of(
                sample("p1", "-51.20"),
                new PointMeasurement("p2", JAN_13, null, null, 0.8, false));

        assertThrows(PersistenceFailureException.class, () -> completionService.complete(jobId, batch, 120L));

        InsarJob job = ledger.find(jobId);
        assertEquals(JobStatus.RUNNING, job.getStatus());
        assertNull(job.getSamplesPersisted());
        assertEquals(0, sampleRepository.countByJobId(jobId));
    }

    @Test
    void testComplete_FailedStatusChangeDiscardsStoredSamples() {
        List<PointMeasurement> batch = List.of(sample("p1", "-51.20"), sample("p2", "-50.10"));

        // a PENDING job cannot become SUCCEEDED, so marking fails after the rows were written
        assertThrows(InvalidTransitionException.class, () -> completionService.complete(jobId, batch, 120L));

        assertEquals(JobStatus.PENDING, ledger.find(jobId).getStatus());
        assertEquals(0, sampleRepository.countByJobId(jobId));
    }

    @Test
    void testComplete_StoresSamplesAndSucceeds() {
        ledger.markSubmitted(jobId, "remote-1");
        ledger.recordPollResult(jobId, RemoteStatusReport.of(RemoteJobStatus.RUNNING));

        InsarJob job = completionService.complete(jobId, List.of(sample("p1", "-51.20"), sample("p2", "-50.10")),
                120L);

        assertEquals(JobStatus.SUCCEEDED, job.getStatus());
        assertEquals(2, job.getSamplesPersisted());
        assertEquals(2, sampleRepository.countByJobId(jobId));
    }

    private static PointMeasurement sample(String pointId, String verticalMm) {
        return new PointMeasurement(pointId, JAN_13, new BigDecimal(verticalMm), null, 0.8, false);
    }
}
