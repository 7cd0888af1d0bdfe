package com.refinery.orchestrator.store;

import com.refinery.orchestrator.model.FileVersion;

import java.util.List;
import java.util.Optional;
import java.util.UUID;

/**
 * Append-only content snapshots keyed by (file id, pass number).
 */
public interface VersionStore {

    /**
     * @throws com.refinery.orchestrator.error.ConflictException if a snapshot already
     *         exists for the pair
     */
    FileVersion putVersion(String fileId, int passNumber, String content, UUID jobId);

    /**
     * Supersede an existing snapshot; the old content is kept in the audit trail.
     *
     * @throws com.refinery.orchestrator.error.NotFoundException if there is nothing to replace
     */
    FileVersion replaceVersion(String fileId, int passNumber, String content, UUID jobId, String reason);

    /**
     * @throws com.refinery.orchestrator.error.NotFoundException if absent
     */
    FileVersion getVersion(String fileId, int passNumber);

    Optional<FileVersion> findVersion(String fileId, int passNumber);

    /** Recorded pass numbers, ascending. */
    List<Integer> listPasses(String fileId);
}
