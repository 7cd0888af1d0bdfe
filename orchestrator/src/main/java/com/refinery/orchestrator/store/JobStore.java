package com.refinery.orchestrator.store;

import com.refinery.orchestrator.model.Job;
import com.refinery.orchestrator.model.JobEvent;
import com.refinery.orchestrator.model.JobStatus;
import com.refinery.orchestrator.model.JobTransition;

import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.UUID;

/**
 * Durable job state plus the append-only event log of each job.
 *
 * Implementations must serialize sequence assignment and transition checks
 * per job, even though the orchestrator is the only logical writer: a
 * recovered worker may race the one it replaces.
 */
public interface JobStore {

    /**
     * @throws com.refinery.orchestrator.error.ValidationException if totalPasses < 1
     *         or the file id/name is blank
     */
    Job createJob(NewJob newJob);

    /**
     * @throws com.refinery.orchestrator.error.NotFoundException if absent
     */
    Job getJob(UUID jobId);

    /** Newest first, capped at {@link JobFilter#effectiveLimit()}. */
    List<Job> listJobs(JobFilter filter);

    /**
     * Persist one event under the next sequence number of its job.
     *
     * @throws com.refinery.orchestrator.error.NotFoundException if the job does not exist
     * @throws com.refinery.orchestrator.error.ConflictException if the sequence was taken
     *         concurrently, or the job already reached a terminal status
     */
    JobEvent appendEvent(UUID jobId, NewEvent event);

    /**
     * @throws com.refinery.orchestrator.error.InvalidTransitionException if not legal
     *         from the job's current status
     */
    Job updateJobState(UUID jobId, JobTransition transition);

    /**
     * Apply a transition and append its events atomically, so a crash can never
     * leave the status and the log disagreeing.
     */
    RecordedTransition record(UUID jobId, JobTransition transition, List<NewEvent> events);

    /** Events with sequence > sinceSequence, ascending. */
    List<JobEvent> listEvents(UUID jobId, long sinceSequence);

    Optional<JobEvent> lastEvent(UUID jobId);

    /** Jobs in the given statuses whose updated_at is older than the cutoff, oldest first. */
    List<Job> findStale(Set<JobStatus> statuses, Instant updatedBefore);

    Map<JobStatus, Long> countByStatus();
}
