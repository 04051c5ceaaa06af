package nl.bytesoflife.deltasdf.model;

import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.function.BinaryOperator;
import java.util.function.UnaryOperator;

/**
 * A bundle of up to seven optional {@link Values}, one per {@link DelayField}.
 * An unset field means the source carried no data for it.
 */
public final class DelayPaths {

    private final Map<DelayField, Values> fields;

    private DelayPaths(Map<DelayField, Values> fields) {
        this.fields = fields;
    }

    public static Builder builder() {
        return new Builder();
    }

    public static DelayPaths ofNominal(Values nominal) {
        return builder().nominal(nominal).build();
    }

    public static DelayPaths empty() {
        return builder().build();
    }

    public Values get(DelayField field) {
        return fields.get(field);
    }

    public boolean isSet(DelayField field) {
        return fields.containsKey(field);
    }

    public Values getNominal() {
        return fields.get(DelayField.NOMINAL);
    }

    public Values getFast() {
        return fields.get(DelayField.FAST);
    }

    public Values getSlow() {
        return fields.get(DelayField.SLOW);
    }

    public Values getSetup() {
        return fields.get(DelayField.SETUP);
    }

    public Values getHold() {
        return fields.get(DelayField.HOLD);
    }

    public Values getRise() {
        return fields.get(DelayField.RISE);
    }

    public Values getFall() {
        return fields.get(DelayField.FALL);
    }

    /**
     * Extracts one number by field and metric name.
     *
     * @return the value, or null if the field or that field's metric is unset
     * @throws IllegalArgumentException if either name is not part of the fixed vocabulary
     */
    public Double getScalar(String field, String metric) {
        return getScalar(DelayField.fromName(field), Metric.fromName(metric));
    }

    public Double getScalar(DelayField field, Metric metric) {
        Values values = fields.get(field);
        return values == null ? null : values.get(metric);
    }

    /** Fieldwise sum. A field missing on either side is unset in the result. */
    public DelayPaths plus(DelayPaths other) {
        return combine(other, Values::plus);
    }

    public DelayPaths minus(DelayPaths other) {
        return combine(other, Values::minus);
    }

    public DelayPaths times(double factor) {
        return map(v -> v.times(factor));
    }

    public DelayPaths map(UnaryOperator<Values> op) {
        EnumMap<DelayField, Values> result = new EnumMap<>(DelayField.class);
        fields.forEach((field, values) -> result.put(field, op.apply(values)));
        return new DelayPaths(result);
    }

    private DelayPaths combine(DelayPaths other, BinaryOperator<Values> op) {
        EnumMap<DelayField, Values> result = new EnumMap<>(DelayField.class);
        for (Map.Entry<DelayField, Values> e : fields.entrySet()) {
            Values theirs = other.fields.get(e.getKey());
            if (theirs != null) {
                result.put(e.getKey(), op.apply(e.getValue(), theirs));
            }
        }
        return new DelayPaths(result);
    }

    public boolean approxEquals(DelayPaths other) {
        return approxEquals(other, Values.DEFAULT_TOLERANCE);
    }

    public boolean approxEquals(DelayPaths other, double tolerance) {
        if (other == null) {
            return false;
        }
        for (DelayField field : DelayField.values()) {
            Values mine = fields.get(field);
            Values theirs = other.fields.get(field);
            if (mine == null || theirs == null) {
                if (mine != theirs) return false;
            } else if (!mine.approxEquals(theirs, tolerance)) {
                return false;
            }
        }
        return true;
    }

    public Builder toBuilder() {
        Builder builder = new Builder();
        builder.fields.putAll(fields);
        return builder;
    }

    /** Only set fields appear, in {@link DelayField} order. */
    public Map<String, Object> toMap() {
        Map<String, Object> map = new LinkedHashMap<>();
        fields.forEach((field, values) -> map.put(field.sdfName(), values.toMap()));
        return map;
    }

    @SuppressWarnings("unchecked")
    public static DelayPaths fromMap(Map<String, ?> map) {
        Builder builder = builder();
        for (Map.Entry<String, ?> e : map.entrySet()) {
            if (e.getValue() == null) continue;
            builder.set(DelayField.fromName(e.getKey()), Values.fromMap((Map<String, ?>) e.getValue()));
        }
        return builder.build();
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof DelayPaths other)) return false;
        return fields.equals(other.fields);
    }

    @Override
    public int hashCode() {
        return Objects.hash(fields);
    }

    @Override
    public String toString() {
        return "DelayPaths" + fields;
    }

    public static final class Builder {
        private final EnumMap<DelayField, Values> fields = new EnumMap<>(DelayField.class);

        private Builder() {
        }

        public Builder set(DelayField field, Values values) {
            if (values == null) {
                fields.remove(field);
            } else {
                fields.put(field, values);
            }
            return this;
        }

        public Builder nominal(Values values) {
            return set(DelayField.NOMINAL, values);
        }

        public Builder fast(Values values) {
            return set(DelayField.FAST, values);
        }

        public Builder slow(Values values) {
            return set(DelayField.SLOW, values);
        }

        public Builder setup(Values values) {
            return set(DelayField.SETUP, values);
        }

        public Builder hold(Values values) {
            return set(DelayField.HOLD, values);
        }

        public Builder rise(Values values) {
            return set(DelayField.RISE, values);
        }

        public Builder fall(Values values) {
            return set(DelayField.FALL, values);
        }

        public DelayPaths build() {
            return new DelayPaths(new EnumMap<>(fields));
        }
    }
}
