package com.refinery.orchestrator.api.dto;

import com.refinery.orchestrator.model.FileVersion;

import java.time.Instant;
import java.util.UUID;

public record VersionResponse(
        String  fileId,
        int     passNumber,
        String  content,
        UUID    jobId,
        Instant createdAt
) {
    public static VersionResponse from(FileVersion v) {
        return new VersionResponse(v.getFileId(), v.getPassNumber(), v.getContent(), v.getJobId(), v.getCreatedAt());
    }
}
