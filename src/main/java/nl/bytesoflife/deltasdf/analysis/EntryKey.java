package nl.bytesoflife.deltasdf.analysis;

import java.util.Comparator;

/**
 * Location of one entry in a file: cell type, instance and entry name.
 * Ordered field by field.
 */
public record EntryKey(String cellType, String instance, String entryName) implements Comparable<EntryKey> {

    private static final Comparator<EntryKey> ORDER = Comparator.comparing(EntryKey::cellType)
            .thenComparing(EntryKey::instance)
            .thenComparing(EntryKey::entryName);

    @Override
    public int compareTo(EntryKey other) {
        return ORDER.compare(this, other);
    }

    @Override
    public String toString() {
        return cellType + "/" + instance + "/" + entryName;
    }
}
