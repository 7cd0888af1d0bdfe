package com.refinery.orchestrator.repository;

import com.refinery.orchestrator.model.FileVersion;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

import java.util.List;
import java.util.Optional;
import java.util.UUID;

public interface FileVersionRepository extends JpaRepository<FileVersion, UUID> {

    Optional<FileVersion> findByFileIdAndPassNumber(String fileId, int passNumber);

    boolean existsByFileIdAndPassNumber(String fileId, int passNumber);

    @Query("SELECT v.passNumber FROM FileVersion v WHERE v.fileId = :fileId ORDER BY v.passNumber ASC")
    List<Integer> findPassNumbers(@Param("fileId") String fileId);
}
