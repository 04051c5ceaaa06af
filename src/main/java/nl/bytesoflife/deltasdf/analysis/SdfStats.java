package nl.bytesoflife.deltasdf.analysis;

import nl.bytesoflife.deltasdf.model.*;

import java.util.*;

/**
 * Counts and a delay distribution summary for one file. The distribution
 * covers entries that have the chosen field and metric; its figures are null
 * when no entry does.
 */
public class SdfStats {

    private final int totalCells;
    private final int totalInstances;
    private final int totalEntries;
    private final Map<EntryType, Integer> entryTypeCounts;
    private final Double delayMin;
    private final Double delayMax;
    private final Double delayMean;
    private final Double delayMedian;

    private SdfStats(int totalCells, int totalInstances, int totalEntries, Map<EntryType, Integer> entryTypeCounts,
                     Double delayMin, Double delayMax, Double delayMean, Double delayMedian) {
        this.totalCells = totalCells;
        this.totalInstances = totalInstances;
        this.totalEntries = totalEntries;
        this.entryTypeCounts = Collections.unmodifiableMap(entryTypeCounts);
        this.delayMin = delayMin;
        this.delayMax = delayMax;
        this.delayMean = delayMean;
        this.delayMedian = delayMedian;
    }

    public static SdfStats compute(SdfFile sdf) {
        return compute(sdf, DelayField.SLOW, Metric.MAX);
    }

    public static SdfStats compute(SdfFile sdf, DelayField field, Metric metric) {
        Map<EntryType, Integer> counts = new EnumMap<>(EntryType.class);
        List<Double> scalars = new ArrayList<>();
        int instances = 0;
        int entries = 0;
        for (Map<String, Map<String, Entry>> byInstance : sdf.getCells().values()) {
            instances += byInstance.size();
            for (Map<String, Entry> byName : byInstance.values()) {
                entries += byName.size();
                for (Entry entry : byName.values()) {
                    counts.merge(entry.getType(), 1, Integer::sum);
                    if (entry.getDelayPaths() != null) {
                        Double scalar = entry.getDelayPaths().getScalar(field, metric);
                        if (scalar != null) {
                            scalars.add(scalar);
                        }
                    }
                }
            }
        }

        if (scalars.isEmpty()) {
            return new SdfStats(sdf.getCells().size(), instances, entries, counts, null, null, null, null);
        }
        Collections.sort(scalars);
        double sum = 0;
        for (double s : scalars) {
            sum += s;
        }
        int n = scalars.size();
        double median = n % 2 == 1 ? scalars.get(n / 2) : (scalars.get(n / 2 - 1) + scalars.get(n / 2)) / 2;
        return new SdfStats(sdf.getCells().size(), instances, entries, counts,
                scalars.get(0), scalars.get(n - 1), sum / n, median);
    }

    /** Number of distinct cell types. */
    public int getTotalCells() { return totalCells; }
    public int getTotalInstances() { return totalInstances; }
    public int getTotalEntries() { return totalEntries; }
    public Map<EntryType, Integer> getEntryTypeCounts() { return entryTypeCounts; }
    public Double getDelayMin() { return delayMin; }
    public Double getDelayMax() { return delayMax; }
    public Double getDelayMean() { return delayMean; }
    public Double getDelayMedian() { return delayMedian; }

    @Override
    public String toString() {
        StringBuilder sb = new StringBuilder("SDF Statistics:\n");
        sb.append("  Cell types: ").append(totalCells).append("\n");
        sb.append("  Instances:  ").append(totalInstances).append("\n");
        sb.append("  Entries:    ").append(totalEntries).append("\n");
        entryTypeCounts.forEach((type, count) ->
                sb.append("    ").append(type.sdfName()).append(": ").append(count).append("\n"));
        if (delayMin != null) {
            sb.append(String.format(Locale.US, "  Delay min/max: %.4f / %.4f%n", delayMin, delayMax));
            sb.append(String.format(Locale.US, "  Delay mean/median: %.4f / %.4f%n", delayMean, delayMedian));
        } else {
            sb.append("  No delay values for the chosen field and metric\n");
        }
        return sb.toString();
    }
}
