package nl.bytesoflife.deltasdf.graph;

import nl.bytesoflife.deltasdf.model.DelayPaths;

import java.util.List;

/**
 * Outcome of checking a measured or expected delay against every path found
 * between two pins. Passed when at least one path matches within tolerance.
 */
public record VerificationResult(String source, String sink, DelayPaths expected,
                                 List<DelayPaths> actual, boolean passed, double tolerance) {

    public VerificationResult {
        actual = List.copyOf(actual);
    }
}
