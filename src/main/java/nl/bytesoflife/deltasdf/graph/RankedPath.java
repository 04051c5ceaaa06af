package nl.bytesoflife.deltasdf.graph;

import nl.bytesoflife.deltasdf.model.DelayPaths;

import java.util.List;

/**
 * A path, its composed delay and the scalar it was ranked by. {@code scalar}
 * is null when the composed delay has no value for the chosen field and
 * metric.
 */
public record RankedPath(List<TimingEdge> edges, DelayPaths delay, Double scalar) {

    public RankedPath {
        edges = List.copyOf(edges);
    }
}
