package nl.bytesoflife.deltasdf.analysis;

import nl.bytesoflife.deltasdf.model.DelayField;
import nl.bytesoflife.deltasdf.model.Metric;
import nl.bytesoflife.deltasdf.parser.ValueParser;

/**
 * One value that differs between two files, addressed by entry, delay field
 * and metric. A value missing on one side is null, and so is the delta.
 */
public class DiffEntry {

    private final EntryKey key;
    private final DelayField field;
    private final Metric metric;
    private final Double valueA;
    private final Double valueB;

    public DiffEntry(EntryKey key, DelayField field, Metric metric, Double valueA, Double valueB) {
        this.key = key;
        this.field = field;
        this.metric = metric;
        this.valueA = valueA;
        this.valueB = valueB;
    }

    public EntryKey getKey() { return key; }
    public DelayField getField() { return field; }
    public Metric getMetric() { return metric; }
    public Double getValueA() { return valueA; }
    public Double getValueB() { return valueB; }

    /** {@code valueB - valueA}, or null when either side is missing. */
    public Double getDelta() {
        return valueA == null || valueB == null ? null : valueB - valueA;
    }

    /** Dotted field and metric, for example {@code slow.max}. */
    public String getFieldPath() {
        return field.sdfName() + "." + metric.sdfName();
    }

    @Override
    public String toString() {
        Double delta = getDelta();
        return key + " " + getFieldPath() + ": " + format(valueA) + " -> " + format(valueB)
                + (delta != null ? " (delta " + ValueParser.formatNumber(delta) + ")" : "");
    }

    static String format(Double value) {
        return value == null ? "-" : ValueParser.formatNumber(value);
    }
}
