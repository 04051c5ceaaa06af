package nl.bytesoflife.deltasdf.model;

import java.util.Locale;

/**
 * Edge qualifier on a port specification.
 */
public enum EdgeType {
    POSEDGE,
    NEGEDGE;

    public String sdfName() {
        return name().toLowerCase(Locale.ROOT);
    }

    public static EdgeType fromSdfName(String name) {
        return switch (name.toLowerCase(Locale.ROOT)) {
            case "posedge" -> POSEDGE;
            case "negedge" -> NEGEDGE;
            default -> throw new IllegalArgumentException("Unknown edge type: " + name);
        };
    }

    public static boolean isEdgeKeyword(String name) {
        String lower = name.toLowerCase(Locale.ROOT);
        return lower.equals("posedge") || lower.equals("negedge");
    }
}
