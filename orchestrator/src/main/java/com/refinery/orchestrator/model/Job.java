package com.refinery.orchestrator.model;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import com.refinery.orchestrator.error.InvalidTransitionException;
import com.refinery.orchestrator.error.ValidationException;
import jakarta.persistence.*;

import java.time.Instant;
import java.util.UUID;

/**
 * One refinement run of one file.
 *
 * The Job row is the single authoritative state for a run. It is only ever
 * changed through apply(), which enforces the state machine in JobStatus, and
 * through nextSequence(), which hands out event sequence numbers. Both happen
 * inside the Job Store while it holds a row lock on this job.
 *
 * DB table: jobs  (created by Flyway V1 migration)
 */
@Entity
@Table(name = "jobs")
public class Job {

    @Id
    @GeneratedValue(strategy = GenerationType.UUID)
    private UUID id;

    @Column(name = "file_id", nullable = false)
    private String fileId;

    @Column(name = "file_name", nullable = false)
    private String fileName;

    // Owner of the job; only used for list filtering.
    @Column(name = "user_id")
    private String userId;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false)
    private JobStatus status = JobStatus.PENDING;

    @Column(name = "current_pass", nullable = false)
    private int currentPass = 0;

    @Column(name = "total_passes", nullable = false)
    private int totalPasses;

    @Column(nullable = false)
    private String model;

    @Column(name = "created_at", nullable = false, updatable = false)
    private Instant createdAt;

    @Column(name = "updated_at", nullable = false)
    private Instant updatedAt;

    @Column(name = "completed_at")
    private Instant completedAt;

    @Column(name = "error_message", columnDefinition = "TEXT")
    private String errorMessage;

    @Convert(converter = JsonNodeConverter.class)
    @Column(columnDefinition = "TEXT")
    private JsonNode result;

    @Convert(converter = JsonNodeConverter.class)
    @Column(columnDefinition = "TEXT", nullable = false)
    private JsonNode metadata = JsonNodeFactory.instance.objectNode();

    // Highest event sequence handed out so far; 0 before the first event.
    @Column(name = "last_sequence", nullable = false)
    private long lastSequence = 0;

    // ------------------------------------------------------------------
    // Constructors
    // ------------------------------------------------------------------

    protected Job() {}   // required by JPA

    public Job(String fileId, String fileName, String userId, int totalPasses,
               String model, JsonNode metadata, Instant now) {
        if (totalPasses < 1) {
            throw new ValidationException("totalPasses", "totalPasses must be >= 1, was " + totalPasses);
        }
        this.fileId      = fileId;
        this.fileName    = fileName;
        this.userId      = userId;
        this.totalPasses = totalPasses;
        this.model       = model;
        if (metadata != null) this.metadata = metadata;
        this.createdAt   = now;
        this.updatedAt   = now;
    }

    // ------------------------------------------------------------------
    // State machine
    // ------------------------------------------------------------------

    /**
     * Apply one transition or throw without touching any field.
     */
    public void apply(JobTransition transition, Instant now) {
        if (!transition.allowedFrom(status)) {
            throw new InvalidTransitionException(id, status, transition.kind().name());
        }
        switch (transition.kind()) {
            case START -> { }
            case PASS_SUCCEEDED -> {
                if (currentPass + 1 >= totalPasses) {
                    throw new InvalidTransitionException(id, status, transition.kind().name(),
                            "pass " + (currentPass + 1) + " is the last pass, use COMPLETE");
                }
                currentPass++;
            }
            case COMPLETE -> {
                if (currentPass + 1 != totalPasses) {
                    throw new InvalidTransitionException(id, status, transition.kind().name(),
                            "pass " + (currentPass + 1) + " of " + totalPasses + " is not the last pass");
                }
                currentPass  = totalPasses;
                completedAt  = now;
                result       = transition.result();
                errorMessage = null;
            }
            case FAIL -> {
                String message = transition.errorMessage();
                if (message == null || message.isBlank()) {
                    throw new ValidationException("errorMessage", "A failed job needs a non-empty error message");
                }
                errorMessage = message;
                completedAt  = now;
            }
            case CANCEL -> completedAt = now;
        }
        status    = transition.target();
        updatedAt = now;
    }

    /** Reserve the next event sequence number. */
    public long nextSequence(Instant now) {
        lastSequence++;
        updatedAt = now;
        return lastSequence;
    }

    // ------------------------------------------------------------------
    // Getters
    // ------------------------------------------------------------------

    public UUID      getId()           { return id; }
    public String    getFileId()       { return fileId; }
    public String    getFileName()     { return fileName; }
    public String    getUserId()       { return userId; }
    public JobStatus getStatus()       { return status; }
    public int       getCurrentPass()  { return currentPass; }
    public int       getTotalPasses()  { return totalPasses; }
    public String    getModel()        { return model; }
    public Instant   getCreatedAt()    { return createdAt; }
    public Instant   getUpdatedAt()    { return updatedAt; }
    public Instant   getCompletedAt()  { return completedAt; }
    public String    getErrorMessage() { return errorMessage; }
    public JsonNode  getResult()       { return result; }
    public JsonNode  getMetadata()     { return metadata; }
    public long      getLastSequence() { return lastSequence; }
}
