package com.refinery.orchestrator.store;

import com.refinery.orchestrator.error.ConflictException;
import com.refinery.orchestrator.error.NotFoundException;
import com.refinery.orchestrator.error.ValidationException;
import com.refinery.orchestrator.model.FileVersion;
import com.refinery.orchestrator.model.VersionAudit;
import com.refinery.orchestrator.repository.FileVersionRepository;
import com.refinery.orchestrator.repository.VersionAuditRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.stereotype.Component;
import org.springframework.transaction.annotation.Transactional;

import java.time.Clock;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;

/**
 * Postgres-backed Version Store. The unique (file_id, pass_number) constraint
 * guarantees at most one snapshot per pass even if two writers race.
 */
@Component
public class JpaVersionStore implements VersionStore {

    private static final Logger log = LoggerFactory.getLogger(JpaVersionStore.class);

    private final FileVersionRepository  versionRepo;
    private final VersionAuditRepository auditRepo;
    private final Clock                  clock;

    public JpaVersionStore(FileVersionRepository versionRepo, VersionAuditRepository auditRepo, Clock clock) {
        this.versionRepo = versionRepo;
        this.auditRepo   = auditRepo;
        this.clock       = clock;
    }

    @Override
    @Transactional
    public FileVersion putVersion(String fileId, int passNumber, String content, UUID jobId) {
        if (passNumber < 0) {
            throw new ValidationException("passNumber", "passNumber must be >= 0, was " + passNumber);
        }
        if (versionRepo.existsByFileIdAndPassNumber(fileId, passNumber)) {
            throw duplicate(fileId, passNumber, null);
        }
        try {
            FileVersion saved = versionRepo.saveAndFlush(
                    new FileVersion(fileId, passNumber, content, jobId, clock.instant()));
            log.debug("Stored version {}@{} ({} chars)", fileId, passNumber, content.length());
            return saved;
        } catch (DataIntegrityViolationException e) {
            throw duplicate(fileId, passNumber, e);
        }
    }

    @Override
    @Transactional
    public FileVersion replaceVersion(String fileId, int passNumber, String content, UUID jobId, String reason) {
        FileVersion existing = versionRepo.findByFileIdAndPassNumber(fileId, passNumber)
                .orElseThrow(() -> new NotFoundException("Version", fileId + "@" + passNumber));
        UUID previousJobId = existing.getJobId();
        auditRepo.save(new VersionAudit(existing, jobId, reason, clock.instant()));
        existing.supersede(content, jobId, clock.instant());
        log.info("Replaced version {}@{} (previous job={}, new job={}): {}",
                fileId, passNumber, previousJobId, jobId, reason);
        return versionRepo.save(existing);
    }

    @Override
    @Transactional(readOnly = true)
    public FileVersion getVersion(String fileId, int passNumber) {
        return findVersion(fileId, passNumber)
                .orElseThrow(() -> new NotFoundException("Version", fileId + "@" + passNumber));
    }

    @Override
    @Transactional(readOnly = true)
    public Optional<FileVersion> findVersion(String fileId, int passNumber) {
        return versionRepo.findByFileIdAndPassNumber(fileId, passNumber);
    }

    @Override
    @Transactional(readOnly = true)
    public List<Integer> listPasses(String fileId) {
        return versionRepo.findPassNumbers(fileId);
    }

    private static ConflictException duplicate(String fileId, int passNumber, Throwable cause) {
        return new ConflictException("Version " + fileId + "@" + passNumber + " already exists",
                Map.of("fileId", fileId, "passNumber", passNumber), cause);
    }
}
