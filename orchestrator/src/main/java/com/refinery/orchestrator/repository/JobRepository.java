package com.refinery.orchestrator.repository;

import com.refinery.orchestrator.model.Job;
import com.refinery.orchestrator.model.JobStatus;
import jakarta.persistence.LockModeType;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.JpaSpecificationExecutor;
import org.springframework.data.jpa.repository.Lock;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

import java.time.Instant;
import java.util.Collection;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

/**
 * CRUD + query operations for the jobs table.
 *
 * Spring Data JPA generates the implementation at startup;
 * list filters are built as Specifications by JpaJobStore.
 */
public interface JobRepository extends JpaRepository<Job, UUID>, JpaSpecificationExecutor<Job> {

    /**
     * Load a job and hold a row lock until the surrounding transaction ends.
     *
     * Every state transition and every event append goes through this lock,
     * so sequence assignment and transition checks are serialized per job
     * even if a recovered worker races the original one.
     */
    @Lock(LockModeType.PESSIMISTIC_WRITE)
    @Query("SELECT j FROM Job j WHERE j.id = :id")
    Optional<Job> findByIdForUpdate(@Param("id") UUID id);

    /** Jobs in one of the given statuses that have not been touched since 'cutoff'. */
    List<Job> findByStatusInAndUpdatedAtBeforeOrderByCreatedAtAsc(Collection<JobStatus> statuses, Instant cutoff);

    @Query("SELECT j.status, COUNT(j) FROM Job j GROUP BY j.status")
    List<Object[]> countGroupedByStatus();
}
