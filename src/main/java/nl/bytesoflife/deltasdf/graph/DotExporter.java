package nl.bytesoflife.deltasdf.graph;

import nl.bytesoflife.deltasdf.model.DelayField;
import nl.bytesoflife.deltasdf.model.Metric;

import java.util.*;

/**
 * Renders a {@link TimingGraph} as a Graphviz digraph. Edges are labelled
 * with the chosen scalar, or {@code ?} when an edge does not have it.
 * <pre>
 * String dot = new DotExporter()
 *         .withHighlight(critical)
 *         .withClusterByInstance(true)
 *         .export(graph);
 * </pre>
 */
public class DotExporter {

    private RankedPath highlight;
    private boolean clusterByInstance;
    private DelayField field = PathAnalysis.DEFAULT_FIELD;
    private Metric metric = PathAnalysis.DEFAULT_METRIC;

    /** Draws every edge between the pin pairs of {@code path} in bold red; null clears it. */
    public DotExporter withHighlight(RankedPath path) {
        this.highlight = path;
        return this;
    }

    /** Groups pins into one subgraph cluster per instance prefix. */
    public DotExporter withClusterByInstance(boolean enabled) {
        this.clusterByInstance = enabled;
        return this;
    }

    public DotExporter withScalar(DelayField field, Metric metric) {
        this.field = field;
        this.metric = metric;
        return this;
    }

    public String export(TimingGraph graph) {
        Set<List<String>> highlighted = new HashSet<>();
        if (highlight != null) {
            for (TimingEdge edge : highlight.edges()) {
                highlighted.add(List.of(edge.source(), edge.sink()));
            }
        }

        StringBuilder sb = new StringBuilder();
        sb.append("digraph timing {\n");
        sb.append("  rankdir=LR;\n");

        SortedSet<String> nodes = new TreeSet<>(graph.nodes());
        if (clusterByInstance) {
            SortedMap<String, List<String>> clusters = new TreeMap<>();
            for (String node : nodes) {
                clusters.computeIfAbsent(instanceOf(node, graph.getDivider()), k -> new ArrayList<>()).add(node);
            }
            int i = 0;
            for (var cluster : clusters.entrySet()) {
                String label = cluster.getKey().isEmpty() ? "(top)" : cluster.getKey();
                sb.append("  subgraph cluster_").append(i++).append(" {\n");
                sb.append("    label=").append(quote(label)).append(";\n");
                for (String node : cluster.getValue()) {
                    sb.append("    ").append(quote(node)).append(";\n");
                }
                sb.append("  }\n");
            }
        } else {
            for (String node : nodes) {
                sb.append("  ").append(quote(node)).append(";\n");
            }
        }

        for (TimingEdge edge : graph.edges()) {
            Double scalar = edge.delay().getScalar(field, metric);
            String label = scalar != null ? String.format(Locale.US, "%.3f", scalar) : "?";
            sb.append("  ").append(quote(edge.source())).append(" -> ").append(quote(edge.sink()))
                    .append(" [label=").append(quote(label));
            if (highlighted.contains(List.of(edge.source(), edge.sink()))) {
                sb.append(", color=\"red\", penwidth=2.0");
            }
            sb.append("];\n");
        }

        sb.append("}\n");
        return sb.toString();
    }

    // top-level pins have no divider and fall in the "" cluster
    private static String instanceOf(String node, String divider) {
        int cut = node.lastIndexOf(divider);
        return cut < 0 ? "" : node.substring(0, cut);
    }

    private static String quote(String text) {
        return '"' + text.replace("\\", "\\\\").replace("\"", "\\\"") + '"';
    }
}
