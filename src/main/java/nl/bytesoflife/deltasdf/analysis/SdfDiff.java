package nl.bytesoflife.deltasdf.analysis;

import nl.bytesoflife.deltasdf.model.*;
import nl.bytesoflife.deltasdf.transform.DelayNormalizer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.*;

/**
 * Compares two files: header fields, entries present on one side only, and
 * every delay value of the entries both share.
 * <pre>
 * DiffResult result = new SdfDiff()
 *         .withTolerance(1e-3)
 *         .withNormalization("1ps")
 *         .compare(before, after);
 * </pre>
 */
public class SdfDiff {

    private static final Logger log = LoggerFactory.getLogger(SdfDiff.class);

    private double tolerance = Values.DEFAULT_TOLERANCE;
    private String normalizeTo;

    /** Absolute difference at or below which two values count as equal. */
    public SdfDiff withTolerance(double tolerance) {
        if (tolerance < 0 || Double.isNaN(tolerance)) {
            throw new IllegalArgumentException("Tolerance must not be negative: " + tolerance);
        }
        this.tolerance = tolerance;
        return this;
    }

    /**
     * Rescales both files to {@code targetTimescale} before comparing; null
     * compares values as stored.
     */
    public SdfDiff withNormalization(String targetTimescale) {
        this.normalizeTo = targetTimescale;
        return this;
    }

    /**
     * @throws IllegalArgumentException when normalizing and a file has no
     *                                  timescale
     */
    public DiffResult compare(SdfFile a, SdfFile b) {
        if (normalizeTo != null) {
            a = DelayNormalizer.normalize(a, normalizeTo);
            b = DelayNormalizer.normalize(b, normalizeTo);
        }

        List<DiffResult.HeaderChange> headerChanges = new ArrayList<>();
        for (String field : SdfHeader.FIELD_NAMES) {
            String valueA = a.getHeader().get(field);
            String valueB = b.getHeader().get(field);
            if (!Objects.equals(valueA, valueB)) {
                headerChanges.add(new DiffResult.HeaderChange(field, valueA, valueB));
            }
        }

        SortedSet<EntryKey> keysA = keys(a);
        SortedSet<EntryKey> keysB = keys(b);
        List<EntryKey> onlyInA = new ArrayList<>();
        List<EntryKey> onlyInB = new ArrayList<>();
        List<DiffEntry> valueDiffs = new ArrayList<>();
        for (EntryKey key : keysA) {
            if (!keysB.contains(key)) {
                onlyInA.add(key);
                continue;
            }
            Entry entryA = a.getEntries(key.cellType(), key.instance()).get(key.entryName());
            Entry entryB = b.getEntries(key.cellType(), key.instance()).get(key.entryName());
            compareDelays(key, entryA.getDelayPaths(), entryB.getDelayPaths(), valueDiffs);
        }
        for (EntryKey key : keysB) {
            if (!keysA.contains(key)) {
                onlyInB.add(key);
            }
        }

        log.debug("Diff: {} header, {} only in A, {} only in B, {} value differences",
                headerChanges.size(), onlyInA.size(), onlyInB.size(), valueDiffs.size());
        return new DiffResult(headerChanges, onlyInA, onlyInB, valueDiffs);
    }

    private void compareDelays(EntryKey key, DelayPaths pathsA, DelayPaths pathsB, List<DiffEntry> out) {
        for (DelayField field : DelayField.values()) {
            Values valuesA = pathsA != null ? pathsA.get(field) : null;
            Values valuesB = pathsB != null ? pathsB.get(field) : null;
            for (Metric metric : Metric.values()) {
                Double valueA = valuesA != null ? valuesA.get(metric) : null;
                Double valueB = valuesB != null ? valuesB.get(metric) : null;
                if (valueA == null && valueB == null) {
                    continue;
                }
                if (valueA != null && valueB != null && Math.abs(valueB - valueA) <= tolerance) {
                    continue;
                }
                out.add(new DiffEntry(key, field, metric, valueA, valueB));
            }
        }
    }

    private static SortedSet<EntryKey> keys(SdfFile sdf) {
        SortedSet<EntryKey> keys = new TreeSet<>();
        sdf.getCells().forEach((cellType, instances) -> instances.forEach((instance, entries) -> {
            for (String name : entries.keySet()) {
                keys.add(new EntryKey(cellType, instance, name));
            }
        }));
        return keys;
    }
}
