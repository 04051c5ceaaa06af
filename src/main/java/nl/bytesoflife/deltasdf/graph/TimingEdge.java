package nl.bytesoflife.deltasdf.graph;

import nl.bytesoflife.deltasdf.model.DelayPaths;
import nl.bytesoflife.deltasdf.model.EntryType;

/**
 * One directed delay between two fully qualified pins, with the cell it came
 * from.
 */
public record TimingEdge(String source, String sink, DelayPaths delay,
                         EntryType entryType, String cellType, String instance) {

    @Override
    public String toString() {
        return source + " -> " + sink + " [" + entryType.sdfName() + " " + cellType + " " + instance + "]";
    }
}
