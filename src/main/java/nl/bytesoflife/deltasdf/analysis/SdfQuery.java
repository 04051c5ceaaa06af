package nl.bytesoflife.deltasdf.analysis;

import nl.bytesoflife.deltasdf.model.*;

import java.util.*;
import java.util.regex.Pattern;

/**
 * Filters a file down to the entries matching every configured criterion.
 * <pre>
 * SdfFile slowBuffers = new SdfQuery()
 *         .withCellTypes(Set.of("BUF"))
 *         .withDelayRange(2.0, null)
 *         .apply(sdf);
 * </pre>
 * Unconfigured criteria match everything. Cell instances left without a
 * matching entry are dropped.
 */
public class SdfQuery {

    private Set<String> cellTypes;
    private Set<String> instances;
    private Set<EntryType> entryTypes;
    private Pattern pinPattern;
    private Double minDelay;
    private Double maxDelay;
    private DelayField field = DelayField.SLOW;
    private Metric metric = Metric.MAX;

    public SdfQuery withCellTypes(Collection<String> cellTypes) {
        this.cellTypes = Set.copyOf(cellTypes);
        return this;
    }

    public SdfQuery withInstances(Collection<String> instances) {
        this.instances = Set.copyOf(instances);
        return this;
    }

    public SdfQuery withEntryTypes(Collection<EntryType> entryTypes) {
        this.entryTypes = entryTypes.isEmpty() ? EnumSet.noneOf(EntryType.class) : EnumSet.copyOf(entryTypes);
        return this;
    }

    /** Regex searched (not fully matched) in the from and to pin; either may match. */
    public SdfQuery withPinPattern(String regex) {
        this.pinPattern = Pattern.compile(regex);
        return this;
    }

    /**
     * Inclusive bounds on the chosen scalar; null leaves a side open. Once a
     * range is set, entries without the scalar no longer match.
     */
    public SdfQuery withDelayRange(Double min, Double max) {
        this.minDelay = min;
        this.maxDelay = max;
        return this;
    }

    public SdfQuery withScalar(DelayField field, Metric metric) {
        this.field = field;
        this.metric = metric;
        return this;
    }

    public SdfFile apply(SdfFile sdf) {
        SdfFile result = new SdfFile(new SdfHeader(sdf.getHeader()));
        for (var cellEntry : sdf.getCells().entrySet()) {
            String cellType = cellEntry.getKey();
            if (cellTypes != null && !cellTypes.contains(cellType)) {
                continue;
            }
            for (var instanceEntry : cellEntry.getValue().entrySet()) {
                String instance = instanceEntry.getKey();
                if (instances != null && !instances.contains(instance)) {
                    continue;
                }
                for (var e : instanceEntry.getValue().entrySet()) {
                    if (matches(e.getValue())) {
                        result.put(cellType, instance, e.getKey(), e.getValue());
                    }
                }
            }
        }
        return result;
    }

    private boolean matches(Entry entry) {
        if (entryTypes != null && !entryTypes.contains(entry.getType())) {
            return false;
        }
        if (pinPattern != null && !find(entry.getFromPin()) && !find(entry.getToPin())) {
            return false;
        }
        if (minDelay != null || maxDelay != null) {
            if (entry.getDelayPaths() == null) {
                return false;
            }
            Double scalar = entry.getDelayPaths().getScalar(field, metric);
            if (scalar == null) {
                return false;
            }
            if (minDelay != null && scalar < minDelay) {
                return false;
            }
            if (maxDelay != null && scalar > maxDelay) {
                return false;
            }
        }
        return true;
    }

    private boolean find(String pin) {
        return pinPattern.matcher(pin != null ? pin : "").find();
    }
}
