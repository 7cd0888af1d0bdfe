package com.refinery.orchestrator.api;

import com.refinery.orchestrator.api.dto.DiffResponse;
import com.refinery.orchestrator.api.dto.VersionListResponse;
import com.refinery.orchestrator.api.dto.VersionResponse;
import com.refinery.orchestrator.diff.DiffEngine;
import com.refinery.orchestrator.store.VersionStore;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

/**
 * Read-only access to the per-pass snapshots of a file.
 *
 * GET /files/{fileId}/versions          : recorded pass numbers
 * GET /files/{fileId}/versions/{pass}   : one snapshot
 * GET /files/{fileId}/diff?from=&to=    : what changed between two passes
 */
@RestController
@RequestMapping("/files/{fileId}")
public class FileController {

    private final VersionStore versionStore;
    private final DiffEngine   diffEngine;

    public FileController(VersionStore versionStore, DiffEngine diffEngine) {
        this.versionStore = versionStore;
        this.diffEngine   = diffEngine;
    }

    @GetMapping("/versions")
    public VersionListResponse versions(@PathVariable String fileId) {
        return new VersionListResponse(fileId, versionStore.listPasses(fileId));
    }

    @GetMapping("/versions/{pass}")
    public VersionResponse version(@PathVariable String fileId, @PathVariable int pass) {
        return VersionResponse.from(versionStore.getVersion(fileId, pass));
    }

    @GetMapping("/diff")
    public DiffResponse diff(@PathVariable String fileId,
                             @RequestParam("from") int fromPass,
                             @RequestParam("to") int toPass) {
        return DiffResponse.from(diffEngine.computeDiff(fileId, fromPass, toPass));
    }
}
