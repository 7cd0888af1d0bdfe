package com.refinery.orchestrator.repository;

import com.refinery.orchestrator.model.JobEvent;
import org.springframework.data.jpa.repository.JpaRepository;

import java.util.List;
import java.util.Optional;
import java.util.UUID;

/**
 * Append-only access to the job_events table.
 */
public interface JobEventRepository extends JpaRepository<JobEvent, UUID> {

    /** Replay feed: everything after 'sequence', oldest first. */
    List<JobEvent> findByJobIdAndSequenceGreaterThanOrderBySequenceAsc(UUID jobId, long sequence);

    Optional<JobEvent> findFirstByJobIdOrderBySequenceDesc(UUID jobId);
}
