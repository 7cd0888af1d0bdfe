package com.refinery.orchestrator.diff;

import java.util.List;
import java.util.stream.Collectors;

/**
 * Structured delta between two passes of one file. Computed on demand, never stored.
 */
public record Diff(String fileId,
                   int fromPass,
                   int toPass,
                   Granularity granularity,
                   List<Change> changes,
                   Summary summary) {

    public record Summary(int unchanged, int added, int removed, int modified) {

        static Summary of(List<Change> changes) {
            int unchanged = 0, added = 0, removed = 0, modified = 0;
            for (Change c : changes) {
                switch (c.type()) {
                    case UNCHANGED -> unchanged++;
                    case ADDED     -> added++;
                    case REMOVED   -> removed++;
                    case MODIFIED  -> modified++;
                }
            }
            return new Summary(unchanged, added, removed, modified);
        }
    }

    /** True when both passes have identical content. */
    public boolean isIdentical() {
        return changes.stream().allMatch(c -> c.type() == ChangeType.UNCHANGED);
    }

    /**
     * Rebuild the toPass content by applying the changes to the fromPass segments:
     * keep unchanged, take the new text of added and modified, drop removed.
     */
    public String reconstructTarget() {
        return changes.stream()
                .filter(c -> c.type() != ChangeType.REMOVED)
                .map(Change::newText)
                .collect(Collectors.joining(granularity.separator()));
    }
}
