package com.refinery.orchestrator.diff;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.regex.Pattern;

/**
 * Paragraph/line diff of two text snapshots.
 *
 * Content is split on blank lines when either side has one, otherwise on
 * newlines. Segments are aligned with a longest-common-subsequence table.
 * Among optimal alignments the one whose first matched block is longest is
 * chosen; after that block the walk takes a match as soon as one is
 * available and prefers removals over insertions on ties. Runs of removals
 * and insertions between matches are paired up position-wise into MODIFIED
 * entries.
 *
 * Pure: no I/O and no state, so equal inputs give equal Diffs.
 */
public final class ContentDiffer {

    // Upper bound on LCS table cells (ints). Larger inputs are aligned on the
    // middle left after trimming the common prefix and suffix; larger middles
    // are reported as a plain remove/add block.
    static final long MAX_TABLE_CELLS = 4_000_000L;

    private ContentDiffer() {}

    public static Diff diff(String fileId, int fromPass, int toPass, String fromContent, String toContent) {
        Granularity granularity = granularityFor(fromContent, toContent);
        List<String> a = split(fromContent, granularity);
        List<String> b = split(toContent, granularity);
        List<Change> changes = pairModifications(align(a, b));
        return new Diff(fileId, fromPass, toPass, granularity, List.copyOf(changes), Diff.Summary.of(changes));
    }

    static Granularity granularityFor(String fromContent, String toContent) {
        String sep = Granularity.PARAGRAPH.separator();
        return fromContent.contains(sep) || toContent.contains(sep) ? Granularity.PARAGRAPH : Granularity.LINE;
    }

    static List<String> split(String content, Granularity granularity) {
        if (content.isEmpty()) return List.of();
        return Arrays.asList(content.split(Pattern.quote(granularity.separator()), -1));
    }

    // ------------------------------------------------------------------
    // Alignment
    // ------------------------------------------------------------------

    static List<Change> align(List<String> a, List<String> b) {
        int n = a.size();
        int m = b.size();
        List<Change> out = new ArrayList<>(Math.max(n, m));

        if ((long) (n + 1) * (m + 1) <= MAX_TABLE_CELLS) {
            alignMiddle(a, b, 0, n, 0, m, true, out);
            return out;
        }

        int prefix = 0;
        while (prefix < n && prefix < m && a.get(prefix).equals(b.get(prefix))) prefix++;
        int suffix = 0;
        while (suffix < n - prefix && suffix < m - prefix
                && a.get(n - 1 - suffix).equals(b.get(m - 1 - suffix))) suffix++;

        for (int k = 0; k < prefix; k++) {
            out.add(Change.unchanged(k, k, a.get(k)));
        }

        int aEnd = n - suffix;
        int bEnd = m - suffix;
        int rows = aEnd - prefix;
        int cols = bEnd - prefix;

        if ((long) (rows + 1) * (cols + 1) > MAX_TABLE_CELLS) {
            for (int i = prefix; i < aEnd; i++) out.add(Change.removed(i, a.get(i)));
            for (int j = prefix; j < bEnd; j++) out.add(Change.added(j, b.get(j)));
        } else {
            alignMiddle(a, b, prefix, aEnd, prefix, bEnd, prefix == 0, out);
        }

        for (int k = 0; k < suffix; k++) {
            out.add(Change.unchanged(aEnd + k, bEnd + k, a.get(aEnd + k)));
        }
        return out;
    }

    private static void alignMiddle(List<String> a, List<String> b,
                                    int aStart, int aEnd, int bStart, int bEnd,
                                    boolean firstBlock, List<Change> out) {
        int rows = aEnd - aStart;
        int cols = bEnd - bStart;
        int width = cols + 1;

        // lcs[i * width + j] = LCS length of a[aStart+i ..] and b[bStart+j ..]
        int[] lcs = new int[(rows + 1) * width];
        for (int i = rows - 1; i >= 0; i--) {
            for (int j = cols - 1; j >= 0; j--) {
                lcs[i * width + j] = a.get(aStart + i).equals(b.get(bStart + j))
                        ? lcs[(i + 1) * width + j + 1] + 1
                        : Math.max(lcs[(i + 1) * width + j], lcs[i * width + j + 1]);
            }
        }

        int i = 0;
        int j = 0;
        if (firstBlock && lcs[0] > 0) {
            int[] start = longestFirstBlock(a, b, aStart, bStart, rows, cols, lcs);
            for (; i < start[0]; i++) out.add(Change.removed(aStart + i, a.get(aStart + i)));
            for (; j < start[1]; j++) out.add(Change.added(bStart + j, b.get(bStart + j)));
        }

        while (i < rows && j < cols) {
            String left  = a.get(aStart + i);
            String right = b.get(bStart + j);
            if (left.equals(right)) {
                out.add(Change.unchanged(aStart + i, bStart + j, left));
                i++;
                j++;
            } else if (lcs[(i + 1) * width + j] >= lcs[i * width + j + 1]) {
                out.add(Change.removed(aStart + i, left));
                i++;
            } else {
                out.add(Change.added(bStart + j, right));
                j++;
            }
        }
        for (; i < rows; i++) out.add(Change.removed(aStart + i, a.get(aStart + i)));
        for (; j < cols; j++) out.add(Change.added(bStart + j, b.get(bStart + j)));
    }

    /**
     * Where the first matched block starts, as {i, j} relative to the range.
     *
     * Candidates are equal pairs that can open an optimal alignment
     * (lcs == total, nothing matched before them). The longest run of equal
     * pairs wins; ties go to the smallest i, then the smallest j.
     */
    private static int[] longestFirstBlock(List<String> a, List<String> b, int aStart, int bStart,
                                           int rows, int cols, int[] lcs) {
        int width = cols + 1;
        int total = lcs[0];
        int[] start = {0, 0};
        int best = 0;
        // below[j]: run of equal pairs starting at (i + 1, j); row[cols] stays 0
        int[] below = new int[width];
        int[] row = new int[width];
        for (int i = rows - 1; i >= 0; i--) {
            for (int j = cols - 1; j >= 0; j--) {
                boolean equal = a.get(aStart + i).equals(b.get(bStart + j));
                row[j] = equal ? below[j + 1] + 1 : 0;
                if (equal && lcs[i * width + j] == total && row[j] >= best) {
                    best = row[j];
                    start[0] = i;
                    start[1] = j;
                }
            }
            int[] swap = below;
            below = row;
            row = swap;
        }
        return start;
    }

    // ------------------------------------------------------------------
    // Modification pairing
    // ------------------------------------------------------------------

    static List<Change> pairModifications(List<Change> aligned) {
        List<Change> out = new ArrayList<>(aligned.size());
        List<Change> removed = new ArrayList<>();
        List<Change> added = new ArrayList<>();
        for (Change c : aligned) {
            switch (c.type()) {
                case REMOVED -> removed.add(c);
                case ADDED   -> added.add(c);
                default -> {
                    flushRun(removed, added, out);
                    out.add(c);
                }
            }
        }
        flushRun(removed, added, out);
        return out;
    }

    private static void flushRun(List<Change> removed, List<Change> added, List<Change> out) {
        int paired = Math.min(removed.size(), added.size());
        for (int k = 0; k < paired; k++) {
            Change r = removed.get(k);
            Change ad = added.get(k);
            out.add(Change.modified(r.fromIndex(), ad.toIndex(), r.oldText(), ad.newText()));
        }
        out.addAll(removed.subList(paired, removed.size()));
        out.addAll(added.subList(paired, added.size()));
        removed.clear();
        added.clear();
    }
}
