package nl.bytesoflife.deltasdf.model;

import java.util.Locale;
import java.util.Map;

/**
 * The fixed vocabulary of SDF entries this library understands.
 */
public enum EntryType {
    PORT(Category.DELAY),
    INTERCONNECT(Category.DELAY),
    IOPATH(Category.DELAY),
    DEVICE(Category.DELAY),
    SETUP(Category.TIMING_CHECK),
    HOLD(Category.TIMING_CHECK),
    REMOVAL(Category.TIMING_CHECK),
    RECOVERY(Category.TIMING_CHECK),
    WIDTH(Category.TIMING_CHECK),
    SETUPHOLD(Category.TIMING_CHECK),
    PATHCONSTRAINT(Category.TIMING_ENV);

    public enum Category {
        DELAY,
        TIMING_CHECK,
        TIMING_ENV
    }

    private static final Map<String, EntryType> SDF_NAMES = Map.ofEntries(
            Map.entry("port", PORT),
            Map.entry("interconnect", INTERCONNECT),
            Map.entry("iopath", IOPATH),
            Map.entry("device", DEVICE),
            Map.entry("setup", SETUP),
            Map.entry("hold", HOLD),
            Map.entry("removal", REMOVAL),
            Map.entry("recovery", RECOVERY),
            Map.entry("width", WIDTH),
            Map.entry("setuphold", SETUPHOLD),
            Map.entry("pathconstraint", PATHCONSTRAINT)
    );

    private final Category category;

    EntryType(Category category) {
        this.category = category;
    }

    public Category getCategory() {
        return category;
    }

    public boolean isTimingCheck() {
        return category == Category.TIMING_CHECK;
    }

    /** Lowercase name, used as the entry name prefix and as the serialized type tag. */
    public String sdfName() {
        return name().toLowerCase(Locale.ROOT);
    }

    /** Uppercase SDF keyword, e.g. {@code IOPATH}. */
    public String keyword() {
        return name();
    }

    public static EntryType fromName(String name) {
        EntryType type = name != null ? SDF_NAMES.get(name.toLowerCase(Locale.ROOT)) : null;
        if (type == null) {
            throw new IllegalArgumentException("Unknown entry type: " + name);
        }
        return type;
    }
}
