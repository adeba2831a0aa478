package com.sentryal.insar.repository;

import com.sentryal.insar.model.DeformationSample;
import com.sentryal.insar.store.SampleKey;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.util.List;

@Repository
public interface DeformationSampleRepository extends JpaRepository<DeformationSample, Long> {

    List<DeformationSample> findByJobIdOrderByPointIdAscAcquisitionDateAsc(String jobId);

    List<DeformationSample> findByInfrastructureIdOrderByAcquisitionDateAscPointIdAsc(String infrastructureId);

    long countByJobId(String jobId);

    long countByJobIdAndLowConfidenceFalse(String jobId);

    @Query("select new com.sentryal.insar.store.SampleKey(s.pointId, s.acquisitionDate)"
            + " from DeformationSample s where s.jobId = :jobId")
    List<SampleKey> findKeysByJobId(@Param("jobId") String jobId);
}
