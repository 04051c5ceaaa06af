package nl.bytesoflife.deltasdf.model;

import java.util.Locale;

/**
 * The named slots of a {@link DelayPaths} bundle.
 * Which slots are meaningful depends on the entry kind: delays use
 * nominal/fast/slow, SETUPHOLD uses setup/hold, PATHCONSTRAINT uses rise/fall.
 */
public enum DelayField {
    NOMINAL,
    FAST,
    SLOW,
    SETUP,
    HOLD,
    RISE,
    FALL;

    public String sdfName() {
        return name().toLowerCase(Locale.ROOT);
    }

    public static DelayField fromName(String name) {
        if (name != null) {
            for (DelayField field : values()) {
                if (field.sdfName().equals(name)) {
                    return field;
                }
            }
        }
        throw new IllegalArgumentException("Invalid delay field name: " + name
                + " (expected nominal, fast, slow, setup, hold, rise or fall)");
    }
}
