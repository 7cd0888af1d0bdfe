package com.refinery.orchestrator.store;

import com.refinery.orchestrator.error.ConflictException;
import com.refinery.orchestrator.error.NotFoundException;
import com.refinery.orchestrator.error.ValidationException;
import com.refinery.orchestrator.model.FileVersion;
import com.refinery.orchestrator.model.VersionAudit;

import java.time.Clock;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;

/**
 * VersionStore over a ConcurrentHashMap keyed by "fileId@pass".
 */
public class InMemoryVersionStore implements VersionStore {

    private final Clock clock;
    private final Map<String, FileVersion> versions = new ConcurrentHashMap<>();
    private final List<VersionAudit>       audit    = new ArrayList<>();

    public InMemoryVersionStore(Clock clock) {
        this.clock = clock;
    }

    @Override
    public FileVersion putVersion(String fileId, int passNumber, String content, UUID jobId) {
        if (passNumber < 0) throw new ValidationException("passNumber", "passNumber must be >= 0");
        FileVersion version = new FileVersion(fileId, passNumber, content, jobId, clock.instant());
        TestEntities.setId(version, UUID.randomUUID());
        if (versions.putIfAbsent(key(fileId, passNumber), version) != null) {
            throw new ConflictException("Version " + key(fileId, passNumber) + " already exists", Map.of());
        }
        return version;
    }

    @Override
    public synchronized FileVersion replaceVersion(String fileId, int passNumber, String content,
                                                   UUID jobId, String reason) {
        FileVersion existing = getVersion(fileId, passNumber);
        audit.add(new VersionAudit(existing, jobId, reason, clock.instant()));
        existing.supersede(content, jobId, clock.instant());
        return existing;
    }

    @Override
    public FileVersion getVersion(String fileId, int passNumber) {
        return findVersion(fileId, passNumber)
                .orElseThrow(() -> new NotFoundException("Version", key(fileId, passNumber)));
    }

    @Override
    public Optional<FileVersion> findVersion(String fileId, int passNumber) {
        return Optional.ofNullable(versions.get(key(fileId, passNumber)));
    }

    @Override
    public List<Integer> listPasses(String fileId) {
        return versions.values().stream()
                .filter(v -> v.getFileId().equals(fileId))
                .map(FileVersion::getPassNumber)
                .sorted()
                .toList();
    }

    public synchronized List<VersionAudit> audit() {
        return List.copyOf(audit);
    }

    private static String key(String fileId, int passNumber) {
        return fileId + "@" + passNumber;
    }
}
