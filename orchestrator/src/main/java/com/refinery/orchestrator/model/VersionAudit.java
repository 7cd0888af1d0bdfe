package com.refinery.orchestrator.model;

import jakarta.persistence.*;

import java.time.Instant;
import java.util.UUID;

/**
 * Record of a snapshot that was explicitly superseded.
 *
 * DB table: version_audit  (created by Flyway V1 migration)
 */
@Entity
@Table(name = "version_audit")
public class VersionAudit {

    @Id
    @GeneratedValue(strategy = GenerationType.UUID)
    private UUID id;

    @Column(name = "file_id", nullable = false)
    private String fileId;

    @Column(name = "pass_number", nullable = false)
    private int passNumber;

    @Column(name = "previous_content", nullable = false, columnDefinition = "TEXT")
    private String previousContent;

    @Column(name = "previous_job_id")
    private UUID previousJobId;

    @Column(name = "replaced_by_job_id")
    private UUID replacedByJobId;

    @Column(columnDefinition = "TEXT")
    private String reason;

    @Column(name = "replaced_at", nullable = false)
    private Instant replacedAt;

    protected VersionAudit() {}   // required by JPA

    public VersionAudit(FileVersion previous, UUID replacedByJobId, String reason, Instant replacedAt) {
        this.fileId          = previous.getFileId();
        this.passNumber      = previous.getPassNumber();
        this.previousContent = previous.getContent();
        this.previousJobId   = previous.getJobId();
        this.replacedByJobId = replacedByJobId;
        this.reason          = reason;
        this.replacedAt      = replacedAt;
    }

    public UUID    getId()              { return id; }
    public String  getFileId()          { return fileId; }
    public int     getPassNumber()      { return passNumber; }
    public String  getPreviousContent() { return previousContent; }
    public UUID    getPreviousJobId()   { return previousJobId; }
    public UUID    getReplacedByJobId() { return replacedByJobId; }
    public String  getReason()          { return reason; }
    public Instant getReplacedAt()      { return replacedAt; }
}
