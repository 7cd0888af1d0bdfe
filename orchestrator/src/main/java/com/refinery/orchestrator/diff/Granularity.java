package com.refinery.orchestrator.diff;

/**
 * Unit a diff is computed over. The separator is what content is split on and
 * what segments are joined with again, so splitting is lossless.
 */
public enum Granularity {
    PARAGRAPH("\n\n"),
    LINE("\n");

    private final String separator;

    Granularity(String separator) {
        this.separator = separator;
    }

    public String separator() { return separator; }
}
