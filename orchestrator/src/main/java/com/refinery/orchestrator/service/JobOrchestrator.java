package com.refinery.orchestrator.service;

import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.refinery.orchestrator.broadcast.EventBroadcaster;
import com.refinery.orchestrator.collaborator.FileSource;
import com.refinery.orchestrator.collaborator.FileSourceException;
import com.refinery.orchestrator.collaborator.PassRefiner;
import com.refinery.orchestrator.collaborator.PassRequest;
import com.refinery.orchestrator.config.RefineryProperties;
import com.refinery.orchestrator.error.ConflictException;
import com.refinery.orchestrator.error.InvalidTransitionException;
import com.refinery.orchestrator.error.PassException;
import com.refinery.orchestrator.model.FileVersion;
import com.refinery.orchestrator.model.Job;
import com.refinery.orchestrator.model.JobEvent;
import com.refinery.orchestrator.model.JobEventType;
import com.refinery.orchestrator.model.JobStatus;
import com.refinery.orchestrator.model.JobTransition;
import com.refinery.orchestrator.store.JobFilter;
import com.refinery.orchestrator.store.JobStore;
import com.refinery.orchestrator.store.NewEvent;
import com.refinery.orchestrator.store.NewJob;
import com.refinery.orchestrator.store.RecordedTransition;
import com.refinery.orchestrator.store.VersionStore;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import jakarta.annotation.PreDestroy;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.slf4j.MDC;
import org.springframework.stereotype.Service;

import java.time.Duration;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Drives each job through its passes.
 *
 * A job runs on one worker thread from start to terminal state:
 *
 *   1. PENDING → PROCESSING, append job_started
 *   2. Seed pass 0 from the file source
 *   3. For each pass: pass_started, call the refiner, write the snapshot,
 *      pass_completed (plus job_completed on the last pass)
 *   4. Transient failures are retried up to max-attempts-per-pass; the last
 *      failure (or any fatal one) appends pass_failed + job_failed
 *
 * Every store write is published to the broadcaster right after it commits.
 * Refiner calls are timed as refinery.pass.duration (tag outcome) and
 * finished jobs counted as refinery.jobs.finished (tag status).
 *
 * The DB row is the source of truth, so a job found PROCESSING with no local
 * worker (after a crash or restart) is simply resumed from its current_pass.
 */
@Service
public class JobOrchestrator {

    private static final Logger log = LoggerFactory.getLogger(JobOrchestrator.class);

    private final JobStore         jobStore;
    private final VersionStore     versionStore;
    private final EventBroadcaster broadcaster;
    private final PassRefiner      refiner;
    private final FileSource       fileSource;
    private final MeterRegistry    meterRegistry;
    private final int              maxAttemptsPerPass;
    private final Duration         passTimeout;

    // One task per job; the queue is unbounded so excess jobs simply wait in PENDING.
    private final ExecutorService workers;
    // Refiner calls run here so a hung call can be abandoned after passTimeout.
    private final ExecutorService refinerCalls;

    // Jobs queued on or running in this node's pool.
    private final Set<UUID> scheduled       = ConcurrentHashMap.newKeySet();
    // Jobs a worker thread is executing right now.
    private final Set<UUID> active          = ConcurrentHashMap.newKeySet();
    private final Set<UUID> cancelRequested = ConcurrentHashMap.newKeySet();

    public JobOrchestrator(JobStore jobStore,
                           VersionStore versionStore,
                           EventBroadcaster broadcaster,
                           PassRefiner refiner,
                           FileSource fileSource,
                           MeterRegistry meterRegistry,
                           RefineryProperties properties) {
        this.jobStore           = jobStore;
        this.versionStore       = versionStore;
        this.broadcaster        = broadcaster;
        this.refiner            = refiner;
        this.fileSource         = fileSource;
        this.meterRegistry      = meterRegistry;
        this.maxAttemptsPerPass = properties.orchestrator().maxAttemptsPerPass();
        this.passTimeout        = properties.orchestrator().passTimeout();
        this.workers            = Executors.newFixedThreadPool(
                properties.orchestrator().maxConcurrentJobs(), namedThreads("refinery-worker-"));
        this.refinerCalls       = Executors.newCachedThreadPool(namedThreads("refinery-pass-"));
    }

    @PreDestroy
    public void shutdown() {
        log.info("Shutting down job workers ({} active)", active.size());
        workers.shutdownNow();
        refinerCalls.shutdownNow();
    }

    // ------------------------------------------------------------------
    // Commands
    // ------------------------------------------------------------------

    /**
     * Create a PENDING job and queue it for execution.
     *
     * @throws com.refinery.orchestrator.error.ValidationException if the request is invalid;
     *         no job is created
     */
    public Job submit(NewJob newJob) {
        Job job = jobStore.createJob(newJob);
        dispatch(job.getId());
        return job;
    }

    /**
     * Queue a job on the worker pool unless this node already has it.
     *
     * @return false if the job was already queued or running here
     */
    public boolean dispatch(UUID jobId) {
        if (!scheduled.add(jobId)) {
            return false;
        }
        try {
            workers.submit(() -> {
                try {
                    runJob(jobId);
                } finally {
                    scheduled.remove(jobId);
                }
            });
        } catch (RuntimeException e) {
            scheduled.remove(jobId);
            throw e;
        }
        log.debug("Dispatched job {}", jobId);
        return true;
    }

    public boolean isActive(UUID jobId) {
        return scheduled.contains(jobId) || active.contains(jobId);
    }

    /**
     * Request cancellation.
     *
     * A job no worker is executing, including one still queued for a worker,
     * is cancelled at once. Otherwise the worker observes the request before its next pass or attempt, and drops
     * any pass result that arrives after it.
     *
     * @return the job as it is now; still PROCESSING if a worker will finish the cancel
     * @throws InvalidTransitionException if the job is already terminal
     */
    public Job cancel(UUID jobId) {
        Job job = jobStore.getJob(jobId);
        if (job.getStatus().isTerminal()) {
            throw new InvalidTransitionException(jobId, job.getStatus(), JobTransition.Kind.CANCEL.name());
        }
        cancelRequested.add(jobId);
        if (active.contains(jobId)) {
            log.info("Cancellation of job {} requested; worker will stop at the next boundary", jobId);
            return job;
        }
        // Queued or unclaimed: cancel now. A queued worker finds the job terminal and returns.
        try {
            Job cancelled = recordCancel(job).job();
            cancelRequested.remove(jobId);
            return cancelled;
        } catch (InvalidTransitionException | ConflictException e) {
            Job current = jobStore.getJob(jobId);
            if (current.getStatus().isTerminal()) {
                cancelRequested.remove(jobId);
                throw e;
            }
            log.info("Job {} was claimed by a worker while cancelling; it will stop at the next boundary", jobId);
            return current;
        }
    }

    /**
     * Start a fresh job for the same file, passes and model as a failed or
     * cancelled one. The new job's metadata records retryOf.
     *
     * @throws InvalidTransitionException unless the job is FAILED or CANCELLED
     */
    public Job retry(UUID jobId) {
        Job previous = jobStore.getJob(jobId);
        if (previous.getStatus() != JobStatus.FAILED && previous.getStatus() != JobStatus.CANCELLED) {
            throw new InvalidTransitionException(jobId, previous.getStatus(), "RETRY",
                    "only failed or cancelled jobs can be retried");
        }
        ObjectNode metadata = previous.getMetadata() != null && previous.getMetadata().isObject()
                ? ((ObjectNode) previous.getMetadata()).deepCopy()
                : JsonNodeFactory.instance.objectNode();
        metadata.put("retryOf", jobId.toString());

        Job retried = submit(new NewJob(previous.getFileId(), previous.getFileName(), previous.getUserId(),
                previous.getTotalPasses(), previous.getModel(), metadata));
        log.info("Job {} retried as {}", jobId, retried.getId());
        return retried;
    }

    // ------------------------------------------------------------------
    // Queries
    // ------------------------------------------------------------------

    public Job getJob(UUID jobId) {
        return jobStore.getJob(jobId);
    }

    public List<Job> listJobs(JobFilter filter) {
        return jobStore.listJobs(filter);
    }

    public List<JobEvent> listEvents(UUID jobId, long sinceSequence) {
        return jobStore.listEvents(jobId, sinceSequence);
    }

    public Map<JobStatus, Long> stats() {
        return jobStore.countByStatus();
    }

    // ------------------------------------------------------------------
    // Worker
    // ------------------------------------------------------------------

    /**
     * Run a job to a terminal state on the calling thread.
     *
     * Never throws: an unexpected error fails the job with its message. If the
     * thread is interrupted the job is left as is, for the watchdog to resume.
     */
    public void runJob(UUID jobId) {
        if (!active.add(jobId)) {
            log.debug("Job {} is already running on this node", jobId);
            return;
        }
        MDC.put("jobId", jobId.toString());
        try {
            execute(jobId);
        } catch (InvalidTransitionException | ConflictException e) {
            // Another writer (a cancel, or a recovered worker) moved the job first.
            log.warn("Job {} changed under its worker, stopping: {}", jobId, e.getMessage());
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            log.warn("Worker interrupted; job {} left for recovery", jobId);
        } catch (Exception e) {
            log.error("Unhandled error while running job {}", jobId, e);
            failQuietly(jobId, "Unexpected error: " + describe(e));
        } finally {
            active.remove(jobId);
            cancelRequested.remove(jobId);
            MDC.clear();
        }
    }

    private void execute(UUID jobId) throws InterruptedException {
        Job job = jobStore.getJob(jobId);
        if (job.getStatus().isTerminal()) {
            log.info("Job {} is already {}, nothing to do", jobId, job.getStatus());
            return;
        }
        if (cancelRequested.contains(jobId)) {
            recordCancel(job);
            return;
        }

        String content;
        if (job.getStatus() == JobStatus.PENDING) {
            job = publish(jobStore.record(jobId, JobTransition.start(),
                    List.of(NewEvent.of(JobEventType.JOB_STARTED, null,
                            "Refinement started: " + job.getTotalPasses() + " pass(es) with " + job.getModel()))))
                    .job();
            content = seed(job);
        } else {
            log.info("Resuming job {} after pass {} of {}", jobId, job.getCurrentPass(), job.getTotalPasses());
            if (!recoverInterruptedAttempt(job)) {
                return;
            }
            content = resumeContent(job);
        }
        if (content == null) {
            return;
        }

        for (int pass = job.getCurrentPass() + 1; pass <= job.getTotalPasses(); pass++) {
            MDC.put("pass", String.valueOf(pass));
            String output = runPassWithRetries(job, pass, content);
            if (output == null) {
                return;
            }
            content = storeSnapshot(job, pass, output);

            ObjectNode details = JsonNodeFactory.instance.objectNode().put("characters", content.length());
            NewEvent passCompleted = NewEvent.of(JobEventType.PASS_COMPLETED, pass,
                    "Pass " + pass + " of " + job.getTotalPasses() + " completed", details);
            if (pass == job.getTotalPasses()) {
                ObjectNode result = JsonNodeFactory.instance.objectNode()
                        .put("fileId", job.getFileId())
                        .put("passes", job.getTotalPasses())
                        .put("finalVersion", pass)
                        .put("characters", content.length());
                job = publish(jobStore.record(jobId, JobTransition.complete(result), List.of(passCompleted,
                        NewEvent.of(JobEventType.JOB_COMPLETED, pass,
                                "Refinement completed after " + pass + " pass(es)")))).job();
                log.info("Job {} completed ({} passes)", jobId, pass);
            } else {
                job = publish(jobStore.record(jobId, JobTransition.passSucceeded(), List.of(passCompleted))).job();
            }
        }
    }

    /**
     * Run one pass, retrying transient failures.
     *
     * @return the refined content, or null if the job was failed or cancelled
     */
    private String runPassWithRetries(Job job, int pass, String content) throws InterruptedException {
        UUID jobId = job.getId();
        int attempt = attemptsMade(jobId, pass);
        while (true) {
            if (cancelRequested.contains(jobId)) {
                recordCancel(job);
                return null;
            }
            attempt++;
            ObjectNode startDetails = JsonNodeFactory.instance.objectNode()
                    .put("attempt", attempt)
                    .put("maxAttempts", maxAttemptsPerPass);
            publish(jobStore.appendEvent(jobId, NewEvent.of(JobEventType.PASS_STARTED, pass,
                    "Pass " + pass + " of " + job.getTotalPasses() + " started", startDetails)));

            try {
                String output = callRefiner(new PassRequest(job.getFileId(), pass, job.getTotalPasses(),
                        content, job.getModel(), job.getMetadata().path("config")));
                if (cancelRequested.contains(jobId)) {
                    log.info("Discarding result of pass {} for cancelled job {}", pass, jobId);
                    recordCancel(job);
                    return null;
                }
                return output;
            } catch (PassException e) {
                if (cancelRequested.contains(jobId)) {
                    log.info("Pass {} attempt {} failed after job {} was cancelled: {}", pass, attempt, jobId, describe(e));
                    recordCancel(job);
                    return null;
                }
                boolean exhausted = !e.isRetryable() || attempt >= maxAttemptsPerPass;
                ObjectNode failDetails = JsonNodeFactory.instance.objectNode()
                        .put("attempt", attempt)
                        .put("kind", e.getKind().name().toLowerCase())
                        .put("error", describe(e));
                NewEvent passFailed = NewEvent.of(JobEventType.PASS_FAILED, pass,
                        "Pass " + pass + " attempt " + attempt + " failed: " + describe(e), failDetails);
                if (!exhausted) {
                    log.warn("Pass {} attempt {}/{} failed for job {}, retrying: {}",
                            pass, attempt, maxAttemptsPerPass, jobId, describe(e));
                    publish(jobStore.appendEvent(jobId, passFailed));
                    continue;
                }
                String reason = e.isRetryable()
                        ? "Pass " + pass + " failed after " + attempt + " attempt(s): " + describe(e)
                        : "Pass " + pass + " failed: " + describe(e);
                log.error("Job {} failed: {}", jobId, reason);
                publish(jobStore.record(jobId, JobTransition.fail(reason),
                        List.of(passFailed, NewEvent.of(JobEventType.JOB_FAILED, pass, reason))));
                return null;
            }
        }
    }

    /**
     * Call the refiner on its own thread, bounded by passTimeout.
     * Anything other than a PassException from the refiner counts as transient.
     */
    private String callRefiner(PassRequest request) throws InterruptedException {
        Timer.Sample sample = Timer.start(meterRegistry);
        String outcome = "success";
        try {
            return awaitRefiner(request);
        } catch (PassException e) {
            outcome = e.getKind().name().toLowerCase();
            throw e;
        } catch (InterruptedException e) {
            outcome = "interrupted";
            throw e;
        } finally {
            sample.stop(meterRegistry.timer("refinery.pass.duration", "outcome", outcome));
        }
    }

    private String awaitRefiner(PassRequest request) throws InterruptedException {
        Future<String> call = refinerCalls.submit(() -> refiner.runPass(request));
        try {
            String output = call.get(passTimeout.toMillis(), TimeUnit.MILLISECONDS);
            if (output == null) {
                throw PassException.transientFailure("Refiner returned no content");
            }
            return output;
        } catch (TimeoutException e) {
            call.cancel(true);
            throw new PassException(PassException.Kind.TRANSIENT,
                    "Pass timed out after " + passTimeout.toMillis() + " ms", e);
        } catch (ExecutionException e) {
            Throwable cause = e.getCause();
            if (cause instanceof PassException passException) {
                throw passException;
            }
            throw new PassException(PassException.Kind.TRANSIENT, describe(cause), cause);
        } catch (InterruptedException e) {
            call.cancel(true);
            throw e;
        }
    }

    // ------------------------------------------------------------------
    // Snapshots
    // ------------------------------------------------------------------

    /**
     * Store pass 0. A snapshot this job already wrote is reused.
     *
     * @return the original content, or null if it could not be fetched (job failed)
     */
    private String seed(Job job) {
        Optional<FileVersion> own = versionStore.findVersion(job.getFileId(), 0)
                .filter(v -> job.getId().equals(v.getJobId()));
        if (own.isPresent()) {
            return own.get().getContent();
        }
        String original;
        try {
            original = fileSource.fetchOriginal(job.getFileId());
            if (original == null) {
                throw new FileSourceException("No content returned for file " + job.getFileId());
            }
        } catch (FileSourceException e) {
            String reason = "Could not fetch original content: " + describe(e);
            log.error("Job {} failed: {}", job.getId(), reason, e);
            publish(jobStore.record(job.getId(), JobTransition.fail(reason),
                    List.of(NewEvent.of(JobEventType.JOB_FAILED, 0, reason))));
            return null;
        }
        return storeSnapshot(job, 0, original);
    }

    /**
     * Write the snapshot for one pass and return the content now on record.
     *
     * A snapshot this job already wrote (an earlier attempt that crashed before
     * pass_completed) wins. One from a different job is superseded and audited.
     */
    private String storeSnapshot(Job job, int pass, String content) {
        Optional<FileVersion> existing = versionStore.findVersion(job.getFileId(), pass);
        if (existing.isEmpty()) {
            try {
                return versionStore.putVersion(job.getFileId(), pass, content, job.getId()).getContent();
            } catch (ConflictException e) {
                existing = versionStore.findVersion(job.getFileId(), pass);
                if (existing.isEmpty()) throw e;
            }
        }
        FileVersion stored = existing.get();
        if (job.getId().equals(stored.getJobId())) {
            log.info("Pass {} of file {} already stored by this job; keeping it", pass, job.getFileId());
            return stored.getContent();
        }
        return versionStore.replaceVersion(job.getFileId(), pass, content, job.getId(),
                "Superseded by job " + job.getId()).getContent();
    }

    // ------------------------------------------------------------------
    // Recovery
    // ------------------------------------------------------------------

    /**
     * Close an attempt that a dead worker left open; it counts as one failed attempt.
     *
     * @return false if that was the last allowed attempt and the job has been failed
     */
    private boolean recoverInterruptedAttempt(Job job) {
        Optional<JobEvent> last = jobStore.lastEvent(job.getId());
        if (last.isEmpty() || last.get().getEventType() != JobEventType.PASS_STARTED) {
            return true;
        }
        int pass = last.get().getPassNumber() != null ? last.get().getPassNumber() : job.getCurrentPass() + 1;
        int attempts = attemptsMade(job.getId(), pass);
        ObjectNode details = JsonNodeFactory.instance.objectNode()
                .put("attempt", attempts)
                .put("interrupted", true);
        NewEvent interrupted = NewEvent.of(JobEventType.PASS_FAILED, pass,
                "Pass " + pass + " attempt " + attempts + " interrupted", details);

        if (attempts >= maxAttemptsPerPass) {
            String reason = "Pass " + pass + " failed after " + attempts + " attempt(s): interrupted";
            log.error("Job {} failed during recovery: {}", job.getId(), reason);
            publish(jobStore.record(job.getId(), JobTransition.fail(reason),
                    List.of(interrupted, NewEvent.of(JobEventType.JOB_FAILED, pass, reason))));
            return false;
        }
        log.warn("Job {} pass {} attempt {} was interrupted; retrying", job.getId(), pass, attempts);
        publish(jobStore.appendEvent(job.getId(), interrupted));
        return true;
    }

    /** Content the next pass starts from when resuming a PROCESSING job. */
    private String resumeContent(Job job) {
        if (job.getCurrentPass() == 0) {
            return seed(job);
        }
        Optional<FileVersion> version = versionStore.findVersion(job.getFileId(), job.getCurrentPass());
        if (version.isPresent()) {
            return version.get().getContent();
        }
        String reason = "Snapshot for pass " + job.getCurrentPass() + " is missing; cannot resume";
        log.error("Job {} failed: {}", job.getId(), reason);
        publish(jobStore.record(job.getId(), JobTransition.fail(reason),
                List.of(NewEvent.of(JobEventType.JOB_FAILED, job.getCurrentPass(), reason))));
        return null;
    }

    private int attemptsMade(UUID jobId, int pass) {
        return (int) jobStore.listEvents(jobId, 0).stream()
                .filter(e -> e.getEventType() == JobEventType.PASS_STARTED)
                .filter(e -> e.getPassNumber() != null && e.getPassNumber() == pass)
                .count();
    }

    // ------------------------------------------------------------------
    // Helpers
    // ------------------------------------------------------------------

    private RecordedTransition recordCancel(Job job) {
        RecordedTransition recorded = publish(jobStore.record(job.getId(), JobTransition.cancel(),
                List.of(NewEvent.of(JobEventType.JOB_CANCELLED, null, "Job cancelled"))));
        log.info("Job {} cancelled after pass {}", job.getId(), recorded.job().getCurrentPass());
        return recorded;
    }

    /** Last resort for unexpected worker errors; the job may already be terminal. */
    private void failQuietly(UUID jobId, String reason) {
        try {
            publish(jobStore.record(jobId, JobTransition.fail(reason),
                    List.of(NewEvent.of(JobEventType.JOB_FAILED, null, reason))));
        } catch (RuntimeException e) {
            log.error("Could not mark job {} failed: {}", jobId, e.getMessage(), e);
        }
    }

    private JobEvent publish(JobEvent event) {
        broadcaster.publish(event);
        return event;
    }

    private RecordedTransition publish(RecordedTransition recorded) {
        broadcaster.publishAll(recorded.events());
        JobStatus status = recorded.job().getStatus();
        if (status.isTerminal()) {
            meterRegistry.counter("refinery.jobs.finished", "status", status.wireName()).increment();
        }
        return recorded;
    }

    private static String describe(Throwable e) {
        String message = e.getMessage();
        return message == null || message.isBlank() ? e.getClass().getSimpleName() : message;
    }

    private static ThreadFactory namedThreads(String prefix) {
        AtomicInteger counter = new AtomicInteger();
        return runnable -> {
            Thread thread = new Thread(runnable, prefix + counter.incrementAndGet());
            thread.setDaemon(true);
            return thread;
        };
    }
}
