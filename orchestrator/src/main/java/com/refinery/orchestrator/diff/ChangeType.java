package com.refinery.orchestrator.diff;

public enum ChangeType {
    UNCHANGED,
    ADDED,
    REMOVED,
    MODIFIED
}
