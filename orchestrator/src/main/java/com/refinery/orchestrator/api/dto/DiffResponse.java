package com.refinery.orchestrator.api.dto;

import com.refinery.orchestrator.diff.Change;
import com.refinery.orchestrator.diff.Diff;

import java.util.List;

/**
 * Response body for GET /files/{fileId}/diff.
 * Enum values are rendered in lower case like every other wire name.
 */
public record DiffResponse(
        String             fileId,
        int                fromPass,
        int                toPass,
        String             granularity,
        boolean            identical,
        List<ChangeView>   changes,
        Diff.Summary       summary
) {
    public record ChangeView(String type, Integer fromIndex, Integer toIndex, String oldText, String newText) {
        static ChangeView from(Change c) {
            return new ChangeView(c.type().name().toLowerCase(), c.fromIndex(), c.toIndex(), c.oldText(), c.newText());
        }
    }

    public static DiffResponse from(Diff diff) {
        return new DiffResponse(
                diff.fileId(),
                diff.fromPass(),
                diff.toPass(),
                diff.granularity().name().toLowerCase(),
                diff.isIdentical(),
                diff.changes().stream().map(ChangeView::from).toList(),
                diff.summary()
        );
    }
}
