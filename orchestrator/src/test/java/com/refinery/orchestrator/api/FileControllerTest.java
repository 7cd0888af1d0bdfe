package com.refinery.orchestrator.api;

import com.refinery.orchestrator.config.RefineryConfig;
import com.refinery.orchestrator.diff.ContentDiffer;
import com.refinery.orchestrator.diff.DiffEngine;
import com.refinery.orchestrator.error.NotFoundException;
import com.refinery.orchestrator.model.FileVersion;
import com.refinery.orchestrator.store.VersionStore;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.WebMvcTest;
import org.springframework.context.annotation.Import;
import org.springframework.test.context.bean.override.mockito.MockitoBean;
import org.springframework.test.web.servlet.MockMvc;

import java.time.Instant;
import java.util.List;
import java.util.UUID;

import static org.mockito.Mockito.when;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

@WebMvcTest(FileController.class)
@Import(RefineryConfig.class)
class FileControllerTest {

    @Autowired MockMvc mockMvc;
    @MockitoBean VersionStore versionStore;
    @MockitoBean DiffEngine   diffEngine;

    @Test
    void versions_listsRecordedPasses() throws Exception {
        when(versionStore.listPasses("doc-1")).thenReturn(List.of(0, 1, 2));

        mockMvc.perform(get("/files/{fileId}/versions", "doc-1"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.fileId").value("doc-1"))
                .andExpect(jsonPath("$.passes.length()").value(3))
                .andExpect(jsonPath("$.passes[2]").value(2));
    }

    @Test
    void version_returnsSnapshot() throws Exception {
        UUID jobId = UUID.randomUUID();
        when(versionStore.getVersion("doc-1", 1)).thenReturn(
                new FileVersion("doc-1", 1, "Refined text.", jobId, Instant.parse("2026-01-01T00:00:00Z")));

        mockMvc.perform(get("/files/{fileId}/versions/{pass}", "doc-1", 1))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.passNumber").value(1))
                .andExpect(jsonPath("$.content").value("Refined text."))
                .andExpect(jsonPath("$.jobId").value(jobId.toString()));
    }

    @Test
    void version_missingPass_returns404() throws Exception {
        when(versionStore.getVersion("doc-1", 9)).thenThrow(new NotFoundException("Version", "doc-1@9"));

        mockMvc.perform(get("/files/{fileId}/versions/{pass}", "doc-1", 9))
                .andExpect(status().isNotFound())
                .andExpect(jsonPath("$.error").value("NOT_FOUND"));
    }

    @Test
    void diff_rendersChangesInLowerCase() throws Exception {
        when(diffEngine.computeDiff("doc-1", 0, 1)).thenReturn(
                ContentDiffer.diff("doc-1", 0, 1, "Intro.\n\nBody.", "Intro.\n\nBetter body."));

        mockMvc.perform(get("/files/{fileId}/diff", "doc-1").param("from", "0").param("to", "1"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.granularity").value("paragraph"))
                .andExpect(jsonPath("$.identical").value(false))
                .andExpect(jsonPath("$.changes[0].type").value("unchanged"))
                .andExpect(jsonPath("$.changes[1].type").value("modified"))
                .andExpect(jsonPath("$.changes[1].newText").value("Better body."))
                .andExpect(jsonPath("$.summary.modified").value(1));
    }

    @Test
    void diff_missingParameter_returns400() throws Exception {
        mockMvc.perform(get("/files/{fileId}/diff", "doc-1").param("from", "0"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.error").value("VALIDATION_ERROR"));
    }

    @Test
    void diff_nonNumericPass_returns400() throws Exception {
        mockMvc.perform(get("/files/{fileId}/diff", "doc-1").param("from", "zero").param("to", "1"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.details.field").value("from"));
    }
}
