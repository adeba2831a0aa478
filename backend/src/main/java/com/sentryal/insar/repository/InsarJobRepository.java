package com.sentryal.insar.repository;

import com.sentryal.insar.model.InsarJob;
import com.sentryal.insar.model.JobStatus;
import org.springframework.data.domain.Pageable;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.time.Instant;
import java.util.Collection;
import java.util.List;

@Repository
public interface InsarJobRepository extends JpaRepository<InsarJob, String> {

    List<InsarJob> findByInfrastructureIdOrderByCreatedAtDesc(String infrastructureId);

    @Query("select j.id from InsarJob j"
            + " where j.status in :statuses"
            + " and (j.nextAttemptAt is null or j.nextAttemptAt <= :now)"
            + " and (j.leaseExpiresAt is null or j.leaseExpiresAt < :now)"
            + " order by j.createdAt")
    List<String> findDueJobIds(@Param("statuses") Collection<JobStatus> statuses,
                               @Param("now") Instant now,
                               Pageable page);

    /**
     * Takes the lease on a job if it is still active and nobody holds a live lease.
     *
     * @return 1 when this caller now owns the job, 0 otherwise
     */
    @Modifying(flushAutomatically = true, clearAutomatically = true)
    @Query("update InsarJob j set j.leaseOwner = :owner, j.leaseExpiresAt = :leaseUntil,"
            + " j.version = j.version + 1"
            + " where j.id = :id and j.status in :statuses"
            + " and (j.leaseExpiresAt is null or j.leaseExpiresAt < :now)")
    int claim(@Param("id") String id,
              @Param("owner") String owner,
              @Param("now") Instant now,
              @Param("leaseUntil") Instant leaseUntil,
              @Param("statuses") Collection<JobStatus> statuses);

    @Modifying(flushAutomatically = true, clearAutomatically = true)
    @Query("update InsarJob j set j.leaseOwner = null, j.leaseExpiresAt = null,"
            + " j.version = j.version + 1"
            + " where j.id = :id and j.leaseOwner = :owner")
    int release(@Param("id") String id, @Param("owner") String owner);
}
