package com.refinery.orchestrator.diff;

import com.refinery.orchestrator.error.ValidationException;
import com.refinery.orchestrator.model.FileVersion;
import com.refinery.orchestrator.store.VersionStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/**
 * Answers "what changed between pass X and pass Y of this file".
 */
@Component
public class DiffEngine {

    private static final Logger log = LoggerFactory.getLogger(DiffEngine.class);

    private final VersionStore versionStore;

    public DiffEngine(VersionStore versionStore) {
        this.versionStore = versionStore;
    }

    /**
     * @throws com.refinery.orchestrator.error.NotFoundException if either pass was never recorded
     */
    public Diff computeDiff(String fileId, int fromPass, int toPass) {
        if (fromPass < 0 || toPass < 0) {
            throw new ValidationException(fromPass < 0 ? "from" : "to", "pass numbers must be >= 0");
        }
        FileVersion from = versionStore.getVersion(fileId, fromPass);
        FileVersion to   = fromPass == toPass ? from : versionStore.getVersion(fileId, toPass);

        Diff diff = ContentDiffer.diff(fileId, fromPass, toPass, from.getContent(), to.getContent());
        log.debug("Diff {} {}→{}: {} by {}", fileId, fromPass, toPass, diff.summary(), diff.granularity());
        return diff;
    }
}
