package nl.bytesoflife.deltasdf.analysis;

import java.util.List;

/**
 * Everything {@link SdfDiff} found between a first file (A) and a second
 * file (B).
 */
public class DiffResult {

    /** A header field whose value differs; null means unset. */
    public record HeaderChange(String field, String valueA, String valueB) {
    }

    private final List<HeaderChange> headerChanges;
    private final List<EntryKey> onlyInA;
    private final List<EntryKey> onlyInB;
    private final List<DiffEntry> valueDiffs;

    public DiffResult(List<HeaderChange> headerChanges, List<EntryKey> onlyInA, List<EntryKey> onlyInB,
                      List<DiffEntry> valueDiffs) {
        this.headerChanges = List.copyOf(headerChanges);
        this.onlyInA = List.copyOf(onlyInA);
        this.onlyInB = List.copyOf(onlyInB);
        this.valueDiffs = List.copyOf(valueDiffs);
    }

    public List<HeaderChange> getHeaderChanges() { return headerChanges; }
    public List<EntryKey> getOnlyInA() { return onlyInA; }
    public List<EntryKey> getOnlyInB() { return onlyInB; }
    public List<DiffEntry> getValueDiffs() { return valueDiffs; }

    public boolean isIdentical() {
        return headerChanges.isEmpty() && onlyInA.isEmpty() && onlyInB.isEmpty() && valueDiffs.isEmpty();
    }

    @Override
    public String toString() {
        StringBuilder sb = new StringBuilder("SDF Diff:\n");
        if (isIdentical()) {
            sb.append("  Files are identical\n");
            return sb.toString();
        }
        if (!headerChanges.isEmpty()) {
            sb.append("  Header differences: ").append(headerChanges.size()).append("\n");
            for (HeaderChange change : headerChanges) {
                sb.append("    ").append(change.field()).append(": ")
                        .append(change.valueA() != null ? change.valueA() : "-").append(" -> ")
                        .append(change.valueB() != null ? change.valueB() : "-").append("\n");
            }
        }
        appendKeys(sb, "Only in A", onlyInA);
        appendKeys(sb, "Only in B", onlyInB);
        if (!valueDiffs.isEmpty()) {
            sb.append("  Value differences: ").append(valueDiffs.size()).append("\n");
            for (DiffEntry diff : valueDiffs) {
                sb.append("    ").append(diff).append("\n");
            }
        }
        return sb.toString();
    }

    private static void appendKeys(StringBuilder sb, String title, List<EntryKey> keys) {
        if (keys.isEmpty()) {
            return;
        }
        sb.append("  ").append(title).append(": ").append(keys.size()).append(" entries\n");
        for (EntryKey key : keys) {
            sb.append("    ").append(key).append("\n");
        }
    }
}
