package com.refinery.orchestrator.repository;

import com.refinery.orchestrator.model.VersionAudit;
import org.springframework.data.jpa.repository.JpaRepository;

import java.util.List;
import java.util.UUID;

public interface VersionAuditRepository extends JpaRepository<VersionAudit, UUID> {

    List<VersionAudit> findByFileIdAndPassNumberOrderByReplacedAtAsc(String fileId, int passNumber);
}
