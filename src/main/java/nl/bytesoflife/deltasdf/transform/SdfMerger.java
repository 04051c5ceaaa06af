package nl.bytesoflife.deltasdf.transform;

import nl.bytesoflife.deltasdf.model.Entry;
import nl.bytesoflife.deltasdf.model.SdfFile;
import nl.bytesoflife.deltasdf.model.SdfHeader;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.*;

/**
 * Combines several delay files into one. The header is taken from the first
 * file.
 */
public final class SdfMerger {

    private static final Logger log = LoggerFactory.getLogger(SdfMerger.class);

    private SdfMerger() {
    }

    public static SdfFile merge(List<SdfFile> files) {
        return merge(files, ConflictStrategy.KEEP_LAST, null);
    }

    /**
     * @param targetTimescale when non-null every file is first normalized to it;
     *                        when null all files must share one timescale
     * @throws IllegalArgumentException if {@code files} is empty, timescales
     *                                  differ without a target, or a conflict is
     *                                  found under {@link ConflictStrategy#ERROR}
     */
    public static SdfFile merge(List<SdfFile> files, ConflictStrategy strategy, String targetTimescale) {
        if (files.isEmpty()) {
            throw new IllegalArgumentException("No files to merge");
        }
        List<SdfFile> prepared = prepare(files, targetTimescale);

        SdfHeader header = new SdfHeader(prepared.get(0).getHeader());
        if (targetTimescale != null) {
            header.setTimescale(targetTimescale);
        }
        SdfFile result = new SdfFile(header);
        int conflicts = 0;

        for (SdfFile sdf : prepared) {
            for (var cellEntry : sdf.getCells().entrySet()) {
                String cellType = cellEntry.getKey();
                for (var instanceEntry : cellEntry.getValue().entrySet()) {
                    String instance = instanceEntry.getKey();
                    result.addCell(cellType, instance);
                    Map<String, Entry> existing = result.getEntries(cellType, instance);
                    for (var e : instanceEntry.getValue().entrySet()) {
                        if (existing.containsKey(e.getKey())) {
                            conflicts++;
                            if (strategy == ConflictStrategy.ERROR) {
                                throw new IllegalArgumentException("Conflicting entry: cell_type='" + cellType
                                        + "', instance='" + instance + "', entry_name='" + e.getKey() + "'");
                            }
                            if (strategy == ConflictStrategy.KEEP_FIRST) {
                                continue;
                            }
                        }
                        result.put(cellType, instance, e.getKey(), e.getValue());
                    }
                }
            }
        }

        if (conflicts > 0) {
            log.warn("Merged {} files with {} conflicting entries resolved by {}", files.size(), conflicts, strategy);
        } else {
            log.debug("Merged {} files without conflicts", files.size());
        }
        return result;
    }

    private static List<SdfFile> prepare(List<SdfFile> files, String targetTimescale) {
        if (targetTimescale != null) {
            List<SdfFile> normalized = new ArrayList<>(files.size());
            for (SdfFile file : files) {
                normalized.add(DelayNormalizer.normalize(file, targetTimescale));
            }
            return normalized;
        }
        Set<String> timescales = new LinkedHashSet<>();
        for (SdfFile file : files) {
            timescales.add(file.getHeader().getTimescale());
        }
        if (timescales.size() > 1) {
            throw new IllegalArgumentException("Files have differing timescales " + timescales
                    + " and no target timescale was specified");
        }
        return files;
    }
}
