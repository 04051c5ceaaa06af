package nl.bytesoflife.deltasdf.parser;

import nl.bytesoflife.deltasdf.model.Values;

import java.math.BigDecimal;
import java.util.Locale;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Number, triple and timescale text conversions shared by the reader and the
 * writer.
 */
public final class ValueParser {

    private static final Pattern NUMBER = Pattern.compile("[+-]?(?:[0-9]+\\.?[0-9]*|\\.[0-9]+)(?:[eE][+-]?[0-9]+)?");
    private static final Pattern TIMESCALE_TEXT = Pattern.compile("([0-9]+(?:\\.[0-9]*)?)\\s*([a-zA-Z]+)");

    private ValueParser() {
    }

    /**
     * Parses the text between the parentheses of an rvalue.
     * <ul>
     *   <li>{@code ""} gives a triple with no slots set;</li>
     *   <li>a bare number {@code "2.5"} sets only the avg slot;</li>
     *   <li>{@code "min:avg:max"} sets each non-empty slot.</li>
     * </ul>
     *
     * @throws IllegalArgumentException on any other shape or an unparsable number
     */
    public static Values parseTriple(String text) {
        String trimmed = text.strip();
        if (trimmed.isEmpty()) {
            return Values.empty();
        }
        String[] parts = trimmed.split(":", -1);
        if (parts.length == 1) {
            return Values.ofAvg(parseNumber(parts[0]));
        }
        if (parts.length != 3) {
            throw new IllegalArgumentException("Expected min:avg:max triple but got '" + text + "'");
        }
        return new Values(parseSlot(parts[0]), parseSlot(parts[1]), parseSlot(parts[2]));
    }

    private static Double parseSlot(String slot) {
        String s = slot.strip();
        return s.isEmpty() ? null : parseNumber(s);
    }

    /**
     * Parses an SDF real number: optional sign, digits with an optional
     * fraction, optional exponent. Java literal suffixes such as {@code 1.5f}
     * are rejected.
     */
    public static double parseNumber(String text) {
        String s = text.strip();
        if (!NUMBER.matcher(s).matches()) {
            throw new IllegalArgumentException("Not a number: '" + text + "'");
        }
        try {
            double value = Double.parseDouble(s);
            if (!Double.isFinite(value)) {
                throw new IllegalArgumentException("Not a finite number: '" + text + "'");
            }
            return value;
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException("Not a number: '" + text + "'", e);
        }
    }

    /** Plain decimal notation, integral values without a fraction: 2.0 becomes "2", 1e-4 becomes "0.0001". */
    public static String formatNumber(double value) {
        if (!Double.isFinite(value)) {
            return Double.toString(value);
        }
        BigDecimal decimal = BigDecimal.valueOf(value).stripTrailingZeros();
        if (decimal.signum() == 0) {
            return "0";
        }
        return decimal.toPlainString();
    }

    /** {@code min:avg:max} with unset slots left empty. */
    public static String formatTriple(Values values) {
        return formatSlot(values.getMin()) + ":" + formatSlot(values.getAvg()) + ":" + formatSlot(values.getMax());
    }

    private static String formatSlot(Double value) {
        return value == null ? "" : formatNumber(value);
    }

    /**
     * Normalizes TIMESCALE text: {@code "1.0 ns"} becomes {@code "1ns"},
     * {@code "100ps"} stays as is. Units are lower-cased.
     *
     * @throws IllegalArgumentException if the text is not a number followed by a unit
     */
    public static String normalizeTimescale(String text) {
        Matcher m = TIMESCALE_TEXT.matcher(text.strip());
        if (!m.matches()) {
            throw new IllegalArgumentException("Invalid timescale: '" + text + "'");
        }
        return formatNumber(Double.parseDouble(m.group(1))) + m.group(2).toLowerCase(Locale.ROOT);
    }
}
