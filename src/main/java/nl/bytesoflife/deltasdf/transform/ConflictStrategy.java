package nl.bytesoflife.deltasdf.transform;

import java.util.Locale;

/**
 * What {@link SdfMerger} does when two files carry an entry with the same
 * cell type, instance and entry name.
 */
public enum ConflictStrategy {
    KEEP_FIRST,
    KEEP_LAST,
    ERROR;

    /** Accepts {@code keep-first}, {@code keep_first}, {@code KEEP_FIRST} and so on. */
    public static ConflictStrategy fromName(String name) {
        return switch (name.toLowerCase(Locale.ROOT).replace('_', '-')) {
            case "keep-first" -> KEEP_FIRST;
            case "keep-last" -> KEEP_LAST;
            case "error" -> ERROR;
            default -> throw new IllegalArgumentException("Unknown conflict strategy: " + name);
        };
    }
}
