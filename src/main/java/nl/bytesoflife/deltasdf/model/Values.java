package nl.bytesoflife.deltasdf.model;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.function.DoubleBinaryOperator;
import java.util.function.DoubleUnaryOperator;

/**
 * An SDF {@code min:avg:max} triple. Each slot is optional; a null slot means
 * "no value", which is different from zero.
 * <p>
 * Arithmetic works slot by slot: a result slot is set only when the
 * corresponding slot is set in every operand.
 */
public final class Values {

    public static final double DEFAULT_TOLERANCE = 1e-9;

    private static final Values EMPTY = new Values(null, null, null);

    private final Double min;
    private final Double avg;
    private final Double max;

    public Values(Double min, Double avg, Double max) {
        this.min = min;
        this.avg = avg;
        this.max = max;
    }

    public static Values empty() {
        return EMPTY;
    }

    public static Values of(double min, double avg, double max) {
        return new Values(min, avg, max);
    }

    /** A bare value with no colons populates only the avg slot. */
    public static Values ofAvg(double avg) {
        return new Values(null, avg, null);
    }

    public Double getMin() {
        return min;
    }

    public Double getAvg() {
        return avg;
    }

    public Double getMax() {
        return max;
    }

    public Double get(Metric metric) {
        return switch (metric) {
            case MIN -> min;
            case AVG -> avg;
            case MAX -> max;
        };
    }

    public boolean isEmpty() {
        return min == null && avg == null && max == null;
    }

    public Values plus(Values other) {
        return combine(other, Double::sum);
    }

    public Values minus(Values other) {
        return combine(other, (a, b) -> a - b);
    }

    public Values negate() {
        return map(v -> -v);
    }

    public Values times(double factor) {
        return map(v -> v * factor);
    }

    public Values map(DoubleUnaryOperator op) {
        return new Values(apply(min, op), apply(avg, op), apply(max, op));
    }

    private Values combine(Values other, DoubleBinaryOperator op) {
        return new Values(apply(min, other.min, op), apply(avg, other.avg, op), apply(max, other.max, op));
    }

    private static Double apply(Double a, DoubleUnaryOperator op) {
        return a == null ? null : op.applyAsDouble(a);
    }

    private static Double apply(Double a, Double b, DoubleBinaryOperator op) {
        return a == null || b == null ? null : op.applyAsDouble(a, b);
    }

    public boolean approxEquals(Values other) {
        return approxEquals(other, DEFAULT_TOLERANCE);
    }

    /**
     * Slot-wise comparison within an absolute tolerance. Two unset slots are
     * equal; an unset slot never equals a set one.
     */
    public boolean approxEquals(Values other, double tolerance) {
        if (other == null) {
            return false;
        }
        return slotEquals(min, other.min, tolerance)
                && slotEquals(avg, other.avg, tolerance)
                && slotEquals(max, other.max, tolerance);
    }

    private static boolean slotEquals(Double a, Double b, double tolerance) {
        if (a == null || b == null) {
            return a == null && b == null;
        }
        return Math.abs(a - b) <= tolerance;
    }

    public Map<String, Object> toMap() {
        Map<String, Object> map = new LinkedHashMap<>();
        map.put("min", min);
        map.put("avg", avg);
        map.put("max", max);
        return map;
    }

    public static Values fromMap(Map<String, ?> map) {
        return new Values(toDouble(map.get("min")), toDouble(map.get("avg")), toDouble(map.get("max")));
    }

    private static Double toDouble(Object value) {
        if (value == null) return null;
        if (value instanceof Number n) return n.doubleValue();
        if (value instanceof String s) return Double.parseDouble(s);
        throw new IllegalArgumentException("Not a number: " + value);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof Values other)) return false;
        return Objects.equals(min, other.min) && Objects.equals(avg, other.avg) && Objects.equals(max, other.max);
    }

    @Override
    public int hashCode() {
        return Objects.hash(min, avg, max);
    }

    @Override
    public String toString() {
        return "Values{min=" + min + ", avg=" + avg + ", max=" + max + "}";
    }
}
