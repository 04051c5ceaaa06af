package nl.bytesoflife.deltasdf.analysis;

import java.util.Locale;

public enum Severity {
    ERROR,
    WARNING;

    public String displayName() {
        return name().toLowerCase(Locale.ROOT);
    }
}
