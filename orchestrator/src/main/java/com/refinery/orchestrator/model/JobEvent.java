package com.refinery.orchestrator.model;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import jakarta.persistence.*;

import java.time.Instant;
import java.util.UUID;

/**
 * One immutable fact in a job's append-only log.
 *
 * (job_id, sequence) is unique; sequences start at 1 and have no gaps.
 * Rows are never updated or deleted, hence no setters.
 *
 * DB table: job_events  (created by Flyway V1 migration)
 */
@Entity
@Table(name = "job_events",
       uniqueConstraints = @UniqueConstraint(name = "uq_job_events_job_sequence",
                                             columnNames = {"job_id", "sequence"}))
public class JobEvent {

    @Id
    @GeneratedValue(strategy = GenerationType.UUID)
    private UUID id;

    @Column(name = "job_id", nullable = false, updatable = false)
    private UUID jobId;

    @Column(nullable = false, updatable = false)
    private long sequence;

    @Enumerated(EnumType.STRING)
    @Column(name = "event_type", nullable = false, updatable = false)
    private JobEventType eventType;

    @Column(name = "pass_number", updatable = false)
    private Integer passNumber;

    @Column(columnDefinition = "TEXT", updatable = false)
    private String message;

    @Convert(converter = JsonNodeConverter.class)
    @Column(columnDefinition = "TEXT", updatable = false)
    private JsonNode details;

    @Column(name = "created_at", nullable = false, updatable = false)
    private Instant createdAt;

    protected JobEvent() {}   // required by JPA

    public JobEvent(UUID jobId, long sequence, JobEventType eventType, Integer passNumber,
                    String message, JsonNode details, Instant createdAt) {
        this.jobId      = jobId;
        this.sequence   = sequence;
        this.eventType  = eventType;
        this.passNumber = passNumber;
        this.message    = message;
        this.details    = details == null ? JsonNodeFactory.instance.objectNode() : details;
        this.createdAt  = createdAt;
    }

    /**
     * Sentinel for a subscriber whose live buffer overflowed. Not persisted;
     * carries the last sequence the subscriber is known to have received.
     */
    public static JobEvent resyncRequired(UUID jobId, long lastDelivered, Instant now) {
        return new JobEvent(jobId, lastDelivered, JobEventType.RESYNC_REQUIRED, null,
                "Live feed dropped; re-subscribe from sequence " + lastDelivered,
                JsonNodeFactory.instance.objectNode().put("resumeFrom", lastDelivered), now);
    }

    public UUID         getId()         { return id; }
    public UUID         getJobId()      { return jobId; }
    public long         getSequence()   { return sequence; }
    public JobEventType getEventType()  { return eventType; }
    public Integer      getPassNumber() { return passNumber; }
    public String       getMessage()    { return message; }
    public JsonNode     getDetails()    { return details; }
    public Instant      getCreatedAt()  { return createdAt; }
}
