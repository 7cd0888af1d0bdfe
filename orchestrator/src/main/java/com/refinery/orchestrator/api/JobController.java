package com.refinery.orchestrator.api;

import com.refinery.orchestrator.api.dto.JobEventResponse;
import com.refinery.orchestrator.api.dto.JobResponse;
import com.refinery.orchestrator.api.dto.JobStatsResponse;
import com.refinery.orchestrator.api.dto.SubmitJobRequest;
import com.refinery.orchestrator.error.ValidationException;
import com.refinery.orchestrator.model.Job;
import com.refinery.orchestrator.model.JobStatus;
import com.refinery.orchestrator.service.JobOrchestrator;
import com.refinery.orchestrator.store.JobFilter;
import com.refinery.orchestrator.stream.ProgressRelay;
import org.springframework.format.annotation.DateTimeFormat;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;
import org.springframework.web.servlet.mvc.method.annotation.SseEmitter;

import java.time.Instant;
import java.util.List;
import java.util.UUID;

/**
 * REST API for refinement jobs.
 *
 * POST /jobs                 : submit a new job
 * GET  /jobs                 : list jobs, newest first
 * GET  /jobs/stats           : job counts per status
 * GET  /jobs/{id}            : poll the current state of a job
 * GET  /jobs/{id}/events     : event log after ?since=
 * GET  /jobs/{id}/stream     : the same log as Server-Sent Events, then live
 * POST /jobs/{id}/cancel     : request cancellation
 * POST /jobs/{id}/retry      : re-run a failed or cancelled job as a new job
 */
@RestController
@RequestMapping("/jobs")
public class JobController {

    private final JobOrchestrator orchestrator;
    private final ProgressRelay   relay;

    public JobController(JobOrchestrator orchestrator, ProgressRelay relay) {
        this.orchestrator = orchestrator;
        this.relay        = relay;
    }

    /**
     * Submit a new refinement job.
     *
     * Example:
     *   curl -X POST http://localhost:8080/jobs \
     *     -H "Content-Type: application/json" \
     *     -d '{"fileId":"doc-42","fileName":"essay.md","totalPasses":3}'
     */
    @PostMapping
    public ResponseEntity<JobResponse> submit(@RequestBody SubmitJobRequest req) {
        Job job = orchestrator.submit(req.toNewJob());
        return ResponseEntity.status(HttpStatus.CREATED).body(JobResponse.from(job));
    }

    @GetMapping
    public List<JobResponse> list(
            @RequestParam(required = false) String status,
            @RequestParam(required = false) String userId,
            @RequestParam(required = false) @DateTimeFormat(iso = DateTimeFormat.ISO.DATE_TIME) Instant createdAfter,
            @RequestParam(required = false) @DateTimeFormat(iso = DateTimeFormat.ISO.DATE_TIME) Instant createdBefore,
            @RequestParam(required = false) Integer limit) {
        JobStatus statusFilter = status == null || status.isBlank() ? null : JobStatus.fromWire(status);
        return orchestrator.listJobs(new JobFilter(statusFilter, userId, createdAfter, createdBefore, limit))
                .stream()
                .map(JobResponse::from)
                .toList();
    }

    @GetMapping("/stats")
    public JobStatsResponse stats() {
        return JobStatsResponse.from(orchestrator.stats());
    }

    /**
     * Poll the current state of a job.
     * Returns 404 if the job ID is not found.
     */
    @GetMapping("/{id}")
    public JobResponse getJob(@PathVariable UUID id) {
        return JobResponse.from(orchestrator.getJob(id));
    }

    /**
     * Events with sequence > since, ascending. Clients poll with the last
     * sequence they saw.
     */
    @GetMapping("/{id}/events")
    public List<JobEventResponse> events(@PathVariable UUID id,
                                         @RequestParam(defaultValue = "0") long since) {
        requireNonNegative(since);
        return orchestrator.listEvents(id, since).stream()
                .map(JobEventResponse::from)
                .toList();
    }

    /**
     * Server-Sent Events feed. A reconnecting EventSource sends Last-Event-ID,
     * which takes precedence over ?since=.
     */
    @GetMapping(value = "/{id}/stream", produces = MediaType.TEXT_EVENT_STREAM_VALUE)
    public SseEmitter stream(@PathVariable UUID id,
                             @RequestParam(defaultValue = "0") long since,
                             @RequestHeader(value = "Last-Event-ID", required = false) Long lastEventId) {
        long from = lastEventId != null ? lastEventId : since;
        requireNonNegative(from);
        return relay.openSse(id, from);
    }

    /**
     * HTTP 202 : cancellation accepted; the body shows the job as it is now,
     *            which may still be "processing" until its worker stops
     * HTTP 409 : the job already finished
     */
    @PostMapping("/{id}/cancel")
    public ResponseEntity<JobResponse> cancel(@PathVariable UUID id) {
        return ResponseEntity.accepted().body(JobResponse.from(orchestrator.cancel(id)));
    }

    @PostMapping("/{id}/retry")
    public ResponseEntity<JobResponse> retry(@PathVariable UUID id) {
        return ResponseEntity.status(HttpStatus.CREATED).body(JobResponse.from(orchestrator.retry(id)));
    }

    private static void requireNonNegative(long since) {
        if (since < 0) {
            throw new ValidationException("since", "since must be >= 0");
        }
    }
}
