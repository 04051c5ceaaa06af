package nl.bytesoflife.deltasdf.transform;

import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * SDF TIMESCALE text: 1, 10 or 100 (optionally with {@code .0}) followed by
 * s, ms, us, ns, ps or fs.
 */
public final class Timescale {

    private static final Pattern TIMESCALE = Pattern.compile("(10{0,2})(\\.0)? *([munpf]?s)");

    private Timescale() {
    }

    /**
     * Length of one time unit in femtoseconds: {@code "1ps"} is 1000,
     * {@code "10 ns"} is 10_000_000.
     *
     * @throws IllegalArgumentException if the text is not a valid SDF timescale
     */
    public static long toFemtoseconds(String timescale) {
        Matcher m = timescale == null ? null : TIMESCALE.matcher(timescale);
        if (m == null || !m.lookingAt()) {
            throw new IllegalArgumentException("Invalid SDF timescale " + timescale);
        }
        long multiplier = Long.parseLong(m.group(1));
        return multiplier * unitFemtoseconds(m.group(3));
    }

    public static double toSeconds(String timescale) {
        return toFemtoseconds(timescale) * 1e-15;
    }

    /** Factor that converts a delay in {@code from} units into {@code to} units. */
    public static double ratio(String from, String to) {
        return (double) toFemtoseconds(from) / toFemtoseconds(to);
    }

    private static long unitFemtoseconds(String unit) {
        return switch (unit) {
            case "s" -> 1_000_000_000_000_000L;
            case "ms" -> 1_000_000_000_000L;
            case "us" -> 1_000_000_000L;
            case "ns" -> 1_000_000L;
            case "ps" -> 1_000L;
            case "fs" -> 1L;
            default -> throw new IllegalArgumentException("Invalid SDF timescale unit " + unit);
        };
    }
}
