package com.refinery.orchestrator.diff;

/**
 * One aligned segment of a diff.
 *
 * fromIndex/oldText are null for ADDED, toIndex/newText are null for REMOVED.
 */
public record Change(ChangeType type, Integer fromIndex, Integer toIndex, String oldText, String newText) {

    static Change unchanged(int fromIndex, int toIndex, String text) {
        return new Change(ChangeType.UNCHANGED, fromIndex, toIndex, text, text);
    }

    static Change added(int toIndex, String text) {
        return new Change(ChangeType.ADDED, null, toIndex, null, text);
    }

    static Change removed(int fromIndex, String text) {
        return new Change(ChangeType.REMOVED, fromIndex, null, text, null);
    }

    static Change modified(int fromIndex, int toIndex, String oldText, String newText) {
        return new Change(ChangeType.MODIFIED, fromIndex, toIndex, oldText, newText);
    }
}
