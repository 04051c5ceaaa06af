package nl.bytesoflife.deltasdf.graph;

import nl.bytesoflife.deltasdf.model.DelayField;
import nl.bytesoflife.deltasdf.model.DelayPaths;
import nl.bytesoflife.deltasdf.model.Metric;
import nl.bytesoflife.deltasdf.model.Values;

import java.util.*;
import java.util.function.Function;

/**
 * Ranking, critical path, slack and verification over a {@link TimingGraph}.
 * Every ranking reduces a composed {@link DelayPaths} to one scalar chosen by
 * field and metric; paths without that scalar sort after all others.
 */
public final class PathAnalysis {

    public static final DelayField DEFAULT_FIELD = DelayField.SLOW;
    public static final Metric DEFAULT_METRIC = Metric.MAX;

    private PathAnalysis() {
    }

    public static List<RankedPath> rankPaths(TimingGraph graph, String source, String sink,
                                             DelayField field, Metric metric, boolean descending) {
        List<RankedPath> ranked = new ArrayList<>();
        for (List<TimingEdge> path : graph.findPaths(source, sink)) {
            DelayPaths delay = TimingGraph.composeDelay(path);
            ranked.add(new RankedPath(path, delay, delay.getScalar(field, metric)));
        }
        ranked.sort(byScalar(RankedPath::scalar, descending));
        return ranked;
    }

    /** The worst path by the chosen scalar, i.e. the head of a descending ranking. */
    public static Optional<RankedPath> criticalPath(TimingGraph graph, String source, String sink,
                                                    DelayField field, Metric metric) {
        List<RankedPath> ranked = rankPaths(graph, source, sink, field, metric, true);
        return ranked.isEmpty() ? Optional.empty() : Optional.of(ranked.get(0));
    }

    /**
     * {@code period} minus the critical path delay. Negative slack is a
     * violation.
     *
     * @return empty when there is no path or its scalar is unset
     */
    public static OptionalDouble computeSlack(TimingGraph graph, String source, String sink, double period,
                                              DelayField field, Metric metric) {
        Optional<RankedPath> critical = criticalPath(graph, source, sink, field, metric);
        if (critical.isEmpty() || critical.get().scalar() == null) {
            return OptionalDouble.empty();
        }
        return OptionalDouble.of(period - critical.get().scalar());
    }

    public static List<EndpointResult> batchEndpointAnalysis(TimingGraph graph, DelayField field, Metric metric) {
        return batchEndpointAnalysis(graph, field, metric, null, null);
    }

    /**
     * Worst delay and path count for every connected (source, sink) pair.
     * Null {@code sources} or {@code sinks} default to all startpoints or all
     * endpoints of the graph, in name order. Results are ordered by decreasing
     * critical delay; pairs whose paths all lack the scalar come last.
     */
    public static List<EndpointResult> batchEndpointAnalysis(TimingGraph graph, DelayField field, Metric metric,
                                                             Collection<String> sources, Collection<String> sinks) {
        Collection<String> from = sources != null ? sources : new TreeSet<>(graph.startpoints());
        Collection<String> to = sinks != null ? sinks : new TreeSet<>(graph.endpoints());

        List<EndpointResult> results = new ArrayList<>();
        for (String source : from) {
            for (String sink : to) {
                List<List<TimingEdge>> paths = graph.findPaths(source, sink);
                if (paths.isEmpty()) {
                    continue;
                }
                Double worst = null;
                for (List<TimingEdge> path : paths) {
                    Double scalar = TimingGraph.composeDelay(path).getScalar(field, metric);
                    if (scalar != null && (worst == null || scalar > worst)) {
                        worst = scalar;
                    }
                }
                results.add(new EndpointResult(source, sink, worst, paths.size()));
            }
        }
        results.sort(byScalar(EndpointResult::criticalDelay, true));
        return results;
    }

    /** The unknown part of a path: {@code total - known}, field by field. */
    public static DelayPaths decomposeDelay(DelayPaths total, DelayPaths known) {
        return total.minus(known);
    }

    public static VerificationResult verifyPath(TimingGraph graph, String source, String sink, DelayPaths expected) {
        return verifyPath(graph, source, sink, expected, Values.DEFAULT_TOLERANCE);
    }

    public static VerificationResult verifyPath(TimingGraph graph, String source, String sink,
                                                DelayPaths expected, double tolerance) {
        List<DelayPaths> actual = graph.compose(source, sink);
        boolean passed = actual.stream().anyMatch(delay -> expected.approxEquals(delay, tolerance));
        return new VerificationResult(source, sink, expected, actual, passed, tolerance);
    }

    private static <T> Comparator<T> byScalar(Function<T, Double> scalar, boolean descending) {
        Comparator<Double> order = descending ? Comparator.reverseOrder() : Comparator.naturalOrder();
        return Comparator.comparing(scalar, Comparator.nullsLast(order));
    }
}
