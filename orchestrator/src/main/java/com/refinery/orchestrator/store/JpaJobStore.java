package com.refinery.orchestrator.store;

import com.refinery.orchestrator.error.ConflictException;
import com.refinery.orchestrator.error.NotFoundException;
import com.refinery.orchestrator.model.Job;
import com.refinery.orchestrator.model.JobEvent;
import com.refinery.orchestrator.model.JobStatus;
import com.refinery.orchestrator.model.JobTransition;
import com.refinery.orchestrator.repository.JobEventRepository;
import com.refinery.orchestrator.repository.JobRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.data.domain.PageRequest;
import org.springframework.data.domain.Sort;
import org.springframework.data.jpa.domain.Specification;
import org.springframework.stereotype.Component;
import org.springframework.transaction.annotation.Transactional;

import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.UUID;

/**
 * Postgres-backed Job Store.
 *
 * Every write locks the job row (SELECT ... FOR UPDATE) before touching it,
 * so sequence assignment and transition legality are checked against the
 * committed state. The unique (job_id, sequence) constraint is the last line:
 * a violation surfaces as ConflictException.
 */
@Component
public class JpaJobStore implements JobStore {

    private static final Logger log = LoggerFactory.getLogger(JpaJobStore.class);

    private final JobRepository      jobRepo;
    private final JobEventRepository eventRepo;
    private final Clock              clock;

    public JpaJobStore(JobRepository jobRepo, JobEventRepository eventRepo, Clock clock) {
        this.jobRepo   = jobRepo;
        this.eventRepo = eventRepo;
        this.clock     = clock;
    }

    @Override
    @Transactional
    public Job createJob(NewJob newJob) {
        newJob.validate();
        Job job = jobRepo.save(new Job(newJob.fileId(), newJob.fileName(), newJob.userId(),
                newJob.totalPasses(), newJob.model(), newJob.metadata(), clock.instant()));
        log.info("Created job {} for file {} ({} passes, model={})",
                job.getId(), job.getFileId(), job.getTotalPasses(), job.getModel());
        return job;
    }

    @Override
    @Transactional(readOnly = true)
    public Job getJob(UUID jobId) {
        return jobRepo.findById(jobId).orElseThrow(() -> new NotFoundException("Job", jobId));
    }

    @Override
    @Transactional(readOnly = true)
    public List<Job> listJobs(JobFilter filter) {
        Specification<Job> spec = Specification.where(null);
        if (filter.status() != null) {
            spec = spec.and((root, q, cb) -> cb.equal(root.get("status"), filter.status()));
        }
        if (filter.userId() != null) {
            spec = spec.and((root, q, cb) -> cb.equal(root.get("userId"), filter.userId()));
        }
        if (filter.createdAfter() != null) {
            spec = spec.and((root, q, cb) -> cb.greaterThanOrEqualTo(root.get("createdAt"), filter.createdAfter()));
        }
        if (filter.createdBefore() != null) {
            spec = spec.and((root, q, cb) -> cb.lessThan(root.get("createdAt"), filter.createdBefore()));
        }
        PageRequest page = PageRequest.of(0, filter.effectiveLimit(), Sort.by(Sort.Direction.DESC, "createdAt"));
        return jobRepo.findAll(spec, page).getContent();
    }

    @Override
    @Transactional
    public JobEvent appendEvent(UUID jobId, NewEvent event) {
        Job job = lockJob(jobId);
        if (job.getStatus().isTerminal()) {
            throw new ConflictException("Job " + jobId + " is " + job.getStatus() + "; its event log is closed",
                    Map.of("jobId", jobId.toString(), "status", job.getStatus().wireName()));
        }
        return insertEvent(job, event);
    }

    @Override
    @Transactional
    public Job updateJobState(UUID jobId, JobTransition transition) {
        Job job = lockJob(jobId);
        JobStatus from = job.getStatus();
        job.apply(transition, clock.instant());
        log.info("Job {} {} → {} ({})", jobId, from, job.getStatus(), transition.kind());
        return jobRepo.save(job);
    }

    @Override
    @Transactional
    public RecordedTransition record(UUID jobId, JobTransition transition, List<NewEvent> events) {
        Job job = lockJob(jobId);
        JobStatus from = job.getStatus();
        job.apply(transition, clock.instant());
        List<JobEvent> appended = new ArrayList<>(events.size());
        for (NewEvent event : events) {
            appended.add(insertEvent(job, event));
        }
        jobRepo.save(job);
        log.info("Job {} {} → {} ({}, {} event(s))",
                jobId, from, job.getStatus(), transition.kind(), appended.size());
        return new RecordedTransition(job, List.copyOf(appended));
    }

    @Override
    @Transactional(readOnly = true)
    public List<JobEvent> listEvents(UUID jobId, long sinceSequence) {
        if (!jobRepo.existsById(jobId)) {
            throw new NotFoundException("Job", jobId);
        }
        return eventRepo.findByJobIdAndSequenceGreaterThanOrderBySequenceAsc(jobId, sinceSequence);
    }

    @Override
    @Transactional(readOnly = true)
    public Optional<JobEvent> lastEvent(UUID jobId) {
        return eventRepo.findFirstByJobIdOrderBySequenceDesc(jobId);
    }

    @Override
    @Transactional(readOnly = true)
    public List<Job> findStale(Set<JobStatus> statuses, Instant updatedBefore) {
        return jobRepo.findByStatusInAndUpdatedAtBeforeOrderByCreatedAtAsc(statuses, updatedBefore);
    }

    @Override
    @Transactional(readOnly = true)
    public Map<JobStatus, Long> countByStatus() {
        Map<JobStatus, Long> counts = new EnumMap<>(JobStatus.class);
        for (JobStatus status : JobStatus.values()) {
            counts.put(status, 0L);
        }
        for (Object[] row : jobRepo.countGroupedByStatus()) {
            counts.put((JobStatus) row[0], ((Number) row[1]).longValue());
        }
        return counts;
    }

    // ------------------------------------------------------------------
    // Helpers
    // ------------------------------------------------------------------

    private Job lockJob(UUID jobId) {
        return jobRepo.findByIdForUpdate(jobId).orElseThrow(() -> new NotFoundException("Job", jobId));
    }

    private JobEvent insertEvent(Job job, NewEvent event) {
        Instant now = clock.instant();
        long sequence = job.nextSequence(now);
        JobEvent row = new JobEvent(job.getId(), sequence, event.type(), event.passNumber(),
                event.message(), event.details(), now);
        try {
            return eventRepo.saveAndFlush(row);
        } catch (DataIntegrityViolationException e) {
            throw new ConflictException("Sequence " + sequence + " already taken for job " + job.getId(),
                    Map.of("jobId", job.getId().toString(), "sequence", sequence), e);
        }
    }
}
