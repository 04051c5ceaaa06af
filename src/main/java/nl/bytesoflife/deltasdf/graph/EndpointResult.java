package nl.bytesoflife.deltasdf.graph;

/**
 * Worst delay and number of paths between one startpoint and one endpoint.
 */
public record EndpointResult(String source, String sink, Double criticalDelay, int pathCount) {
}
