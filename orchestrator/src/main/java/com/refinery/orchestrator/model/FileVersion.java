package com.refinery.orchestrator.model;

import jakarta.persistence.*;

import java.time.Instant;
import java.util.UUID;

/**
 * Content of a file as it existed after one pass (pass 0 = original).
 *
 * At most one row per (file_id, pass_number). Content only changes through
 * VersionStore.replaceVersion, which writes a VersionAudit row first.
 *
 * DB table: file_versions  (created by Flyway V1 migration)
 */
@Entity
@Table(name = "file_versions",
       uniqueConstraints = @UniqueConstraint(name = "uq_file_versions_file_pass",
                                             columnNames = {"file_id", "pass_number"}))
public class FileVersion {

    @Id
    @GeneratedValue(strategy = GenerationType.UUID)
    private UUID id;

    @Column(name = "file_id", nullable = false, updatable = false)
    private String fileId;

    @Column(name = "pass_number", nullable = false, updatable = false)
    private int passNumber;

    @Column(nullable = false, columnDefinition = "TEXT")
    private String content;

    // Job that wrote this snapshot; lets recovery tell its own earlier write
    // apart from one left by another run on the same file.
    @Column(name = "job_id")
    private UUID jobId;

    @Column(name = "created_at", nullable = false)
    private Instant createdAt;

    protected FileVersion() {}   // required by JPA

    public FileVersion(String fileId, int passNumber, String content, UUID jobId, Instant createdAt) {
        this.fileId     = fileId;
        this.passNumber = passNumber;
        this.content    = content;
        this.jobId      = jobId;
        this.createdAt  = createdAt;
    }

    /** Only called by the Version Store after the previous content was audited. */
    public void supersede(String content, UUID jobId, Instant now) {
        this.content   = content;
        this.jobId     = jobId;
        this.createdAt = now;
    }

    public UUID    getId()         { return id; }
    public String  getFileId()     { return fileId; }
    public int     getPassNumber() { return passNumber; }
    public String  getContent()    { return content; }
    public UUID    getJobId()      { return jobId; }
    public Instant getCreatedAt()  { return createdAt; }
}
