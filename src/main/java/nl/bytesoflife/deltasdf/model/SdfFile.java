package nl.bytesoflife.deltasdf.model;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.function.UnaryOperator;

/**
 * A parsed delay file: a header plus cells keyed celltype, then instance,
 * then entry name. Maps keep insertion order.
 * <p>
 * Entries are added through {@link #store}; after construction a file is
 * treated as read-only and derived files are produced with {@link #copy()} or
 * {@link #mapEntries}.
 */
public class SdfFile {

    private final SdfHeader header;
    private final Map<String, Map<String, Map<String, Entry>>> cells = new LinkedHashMap<>();

    public SdfFile() {
        this(new SdfHeader());
    }

    public SdfFile(SdfHeader header) {
        this.header = header;
    }

    public SdfHeader getHeader() {
        return header;
    }

    /** Read-only view at every level; entries change only through {@link #store} and {@link #put}. */
    public Map<String, Map<String, Map<String, Entry>>> getCells() {
        Map<String, Map<String, Map<String, Entry>>> view = new LinkedHashMap<>();
        cells.forEach((cellType, instances) -> {
            Map<String, Map<String, Entry>> instanceView = new LinkedHashMap<>();
            instances.forEach((instance, entries) -> instanceView.put(instance, Collections.unmodifiableMap(entries)));
            view.put(cellType, Collections.unmodifiableMap(instanceView));
        });
        return Collections.unmodifiableMap(view);
    }

    public Map<String, Entry> getEntries(String cellType, String instance) {
        Map<String, Map<String, Entry>> instances = cells.get(cellType);
        if (instances == null || !instances.containsKey(instance)) {
            return Map.of();
        }
        return Collections.unmodifiableMap(instances.get(instance));
    }

    /** Registers a cell instance with no entries; a no-op if it already exists. */
    public void addCell(String cellType, String instance) {
        cells.computeIfAbsent(cellType, k -> new LinkedHashMap<>())
                .computeIfAbsent(instance, k -> new LinkedHashMap<>());
    }

    /**
     * Stores {@code entry} under its name. When that name is already taken in
     * the instance the entry is renamed to the first free {@code name_1},
     * {@code name_2}, ... and stored under the new name.
     *
     * @return the key the entry was stored under
     */
    public String store(String cellType, String instance, Entry entry) {
        addCell(cellType, instance);
        Map<String, Entry> entries = cells.get(cellType).get(instance);
        String base = entry.getName();
        String key = base;
        int suffix = 1;
        while (entries.containsKey(key)) {
            key = base + "_" + suffix++;
        }
        entries.put(key, key.equals(base) ? entry : entry.withName(key));
        return key;
    }

    /** Stores or overwrites the entry at an explicit key, keeping its name in step. */
    public void put(String cellType, String instance, String key, Entry entry) {
        addCell(cellType, instance);
        cells.get(cellType).get(instance).put(key, key.equals(entry.getName()) ? entry : entry.withName(key));
    }

    public int getEntryCount() {
        int count = 0;
        for (Map<String, Map<String, Entry>> instances : cells.values()) {
            for (Map<String, Entry> entries : instances.values()) {
                count += entries.size();
            }
        }
        return count;
    }

    /** Deep copy with a copied header. Entries are immutable and shared. */
    public SdfFile copy() {
        return mapEntries(UnaryOperator.identity());
    }

    /** Copy whose every entry has been passed through {@code op}, keys unchanged. */
    public SdfFile mapEntries(UnaryOperator<Entry> op) {
        SdfFile result = new SdfFile(new SdfHeader(header));
        cells.forEach((cellType, instances) -> instances.forEach((instance, entries) -> {
            result.addCell(cellType, instance);
            entries.forEach((key, entry) -> result.cells.get(cellType).get(instance).put(key, op.apply(entry)));
        }));
        return result;
    }

    public Map<String, Object> toMap() {
        Map<String, Object> cellsMap = new LinkedHashMap<>();
        cells.forEach((cellType, instances) -> {
            Map<String, Object> instancesMap = new LinkedHashMap<>();
            instances.forEach((instance, entries) -> {
                Map<String, Object> entriesMap = new LinkedHashMap<>();
                entries.forEach((key, entry) -> entriesMap.put(key, entry.toMap()));
                instancesMap.put(instance, entriesMap);
            });
            cellsMap.put(cellType, instancesMap);
        });
        Map<String, Object> map = new LinkedHashMap<>();
        map.put("header", header.toMap());
        map.put("cells", cellsMap);
        return map;
    }

    @SuppressWarnings("unchecked")
    public static SdfFile fromMap(Map<String, ?> map) {
        Object headerMap = map.get("header");
        SdfFile file = new SdfFile(headerMap != null
                ? SdfHeader.fromMap((Map<String, ?>) headerMap) : new SdfHeader());
        Object cellsMap = map.get("cells");
        if (cellsMap == null) {
            return file;
        }
        ((Map<String, ?>) cellsMap).forEach((cellType, instances) ->
                ((Map<String, ?>) instances).forEach((instance, entries) -> {
                    file.addCell(cellType, instance);
                    ((Map<String, ?>) entries).forEach((key, entry) ->
                            file.put(cellType, instance, key, Entry.fromMap((Map<String, ?>) entry)));
                }));
        return file;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof SdfFile other)) return false;
        return header.equals(other.header) && cells.equals(other.cells);
    }

    @Override
    public int hashCode() {
        return 31 * header.hashCode() + cells.hashCode();
    }

    @Override
    public String toString() {
        return "SdfFile{cellTypes=" + cells.size() + ", entries=" + getEntryCount() + "}";
    }
}
