package nl.bytesoflife.deltasdf.model;

import java.util.Locale;

/**
 * One corner of an SDF triple.
 */
public enum Metric {
    MIN,
    AVG,
    MAX;

    public String sdfName() {
        return name().toLowerCase(Locale.ROOT);
    }

    public static Metric fromName(String name) {
        if (name != null) {
            for (Metric metric : values()) {
                if (metric.sdfName().equals(name)) {
                    return metric;
                }
            }
        }
        throw new IllegalArgumentException("Invalid metric name: " + name + " (expected min, avg or max)");
    }
}
