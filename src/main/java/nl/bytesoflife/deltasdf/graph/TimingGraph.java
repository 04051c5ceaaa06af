package nl.bytesoflife.deltasdf.graph;

import nl.bytesoflife.deltasdf.model.DelayPaths;
import nl.bytesoflife.deltasdf.model.Entry;
import nl.bytesoflife.deltasdf.model.EntryType;
import nl.bytesoflife.deltasdf.model.SdfFile;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.*;

/**
 * Directed multigraph of pin-to-pin delays built from the IOPATH and
 * INTERCONNECT entries of an {@link SdfFile}.
 * <p>
 * IOPATH pins are local to their instance and are qualified as
 * {@code instance + divider + pin}; INTERCONNECT pins are already hierarchical
 * and are used as written. Entries without both pins or without delay data
 * do not become edges.
 * <p>
 * Pin names are interned to dense indices. Adjacency is kept in compressed
 * sparse row form: for node {@code i}, its outgoing edge ids are
 * {@code outEdges[outOffset[i] .. outOffset[i + 1])}, likewise for incoming
 * edges and for distinct successor nodes. The graph is immutable once built,
 * so queries may run concurrently.
 */
public final class TimingGraph {

    private static final Logger log = LoggerFactory.getLogger(TimingGraph.class);

    public static final int DEFAULT_MAX_DEPTH = 50;

    private final String[] nodeNames;
    private final Map<String, Integer> nameToIndex;
    private final TimingEdge[] edges;
    private final int[] edgeSource;
    private final int[] edgeSink;

    private final int[] outOffset;
    private final int[] outEdges;
    private final int[] inOffset;
    private final int[] inEdges;
    private final int[] succOffset;
    private final int[] succList;

    private final int defaultMaxDepth;
    private final String divider;

    public TimingGraph(SdfFile sdf) {
        this(sdf, DEFAULT_MAX_DEPTH);
    }

    public TimingGraph(SdfFile sdf, int defaultMaxDepth) {
        this.defaultMaxDepth = defaultMaxDepth;
        this.divider = sdf.getHeader().getDividerOrDefault();

        Map<String, Integer> index = new HashMap<>();
        List<String> names = new ArrayList<>();
        List<TimingEdge> edgeList = new ArrayList<>();
        List<int[]> endpoints = new ArrayList<>();
        int skipped = 0;

        for (var cellEntry : sdf.getCells().entrySet()) {
            String cellType = cellEntry.getKey();
            for (var instanceEntry : cellEntry.getValue().entrySet()) {
                String instance = instanceEntry.getKey();
                for (Entry entry : instanceEntry.getValue().values()) {
                    EntryType type = entry.getType();
                    if (type != EntryType.IOPATH && type != EntryType.INTERCONNECT) {
                        continue;
                    }
                    if (entry.getFromPin() == null || entry.getToPin() == null || entry.getDelayPaths() == null) {
                        skipped++;
                        continue;
                    }
                    String source;
                    String sink;
                    if (type == EntryType.INTERCONNECT) {
                        source = entry.getFromPin();
                        sink = entry.getToPin();
                    } else {
                        source = qualify(instance, entry.getFromPin(), divider);
                        sink = qualify(instance, entry.getToPin(), divider);
                    }
                    int u = intern(source, index, names);
                    int v = intern(sink, index, names);
                    edgeList.add(new TimingEdge(source, sink, entry.getDelayPaths(), type, cellType, instance));
                    endpoints.add(new int[]{u, v});
                }
            }
        }

        int n = names.size();
        int m = edgeList.size();
        this.nodeNames = names.toArray(new String[0]);
        this.nameToIndex = Collections.unmodifiableMap(index);
        this.edges = edgeList.toArray(new TimingEdge[0]);
        this.edgeSource = new int[m];
        this.edgeSink = new int[m];
        for (int e = 0; e < m; e++) {
            edgeSource[e] = endpoints.get(e)[0];
            edgeSink[e] = endpoints.get(e)[1];
        }

        this.outOffset = new int[n + 1];
        this.outEdges = new int[m];
        fillCsr(edgeSource, outOffset, outEdges);
        this.inOffset = new int[n + 1];
        this.inEdges = new int[m];
        fillCsr(edgeSink, inOffset, inEdges);

        // distinct successors, first-seen order
        int[] succOff = new int[n + 1];
        int[] succ = new int[m];
        int count = 0;
        boolean[] seen = new boolean[n];
        for (int u = 0; u < n; u++) {
            succOff[u] = count;
            for (int k = outOffset[u]; k < outOffset[u + 1]; k++) {
                int v = edgeSink[outEdges[k]];
                if (!seen[v]) {
                    seen[v] = true;
                    succ[count++] = v;
                }
            }
            for (int k = succOff[u]; k < count; k++) {
                seen[succ[k]] = false;
            }
        }
        succOff[n] = count;
        this.succOffset = succOff;
        this.succList = Arrays.copyOf(succ, count);

        log.debug("Built timing graph: {} nodes, {} edges, {} entries without pins or delays skipped", n, m, skipped);
    }

    private static String qualify(String instance, String pin, String divider) {
        return instance == null || instance.isEmpty() ? pin : instance + divider + pin;
    }

    private static int intern(String name, Map<String, Integer> index, List<String> names) {
        Integer existing = index.get(name);
        if (existing != null) {
            return existing;
        }
        int idx = names.size();
        names.add(name);
        index.put(name, idx);
        return idx;
    }

    // Counting sort of edge ids by key node; keeps insertion order within a node.
    private static void fillCsr(int[] keyOfEdge, int[] offset, int[] list) {
        for (int key : keyOfEdge) {
            offset[key + 1]++;
        }
        for (int i = 1; i < offset.length; i++) {
            offset[i] += offset[i - 1];
        }
        int[] cursor = Arrays.copyOf(offset, offset.length - 1);
        for (int e = 0; e < keyOfEdge.length; e++) {
            list[cursor[keyOfEdge[e]]++] = e;
        }
    }

    // --- Accessors ---

    public int getDefaultMaxDepth() {
        return defaultMaxDepth;
    }

    /** Hierarchy divider used to qualify cell pins with their instance. */
    public String getDivider() {
        return divider;
    }

    public int nodeCount() {
        return nodeNames.length;
    }

    public int edgeCount() {
        return edges.length;
    }

    public boolean containsNode(String node) {
        return nameToIndex.containsKey(node);
    }

    public Set<String> nodes() {
        return new LinkedHashSet<>(Arrays.asList(nodeNames));
    }

    /** Nodes without incoming edges. */
    public Set<String> startpoints() {
        Set<String> result = new LinkedHashSet<>();
        for (int i = 0; i < nodeNames.length; i++) {
            if (inOffset[i + 1] == inOffset[i]) {
                result.add(nodeNames[i]);
            }
        }
        return result;
    }

    /** Nodes without outgoing edges. */
    public Set<String> endpoints() {
        Set<String> result = new LinkedHashSet<>();
        for (int i = 0; i < nodeNames.length; i++) {
            if (outOffset[i + 1] == outOffset[i]) {
                result.add(nodeNames[i]);
            }
        }
        return result;
    }

    public List<TimingEdge> edges() {
        return List.of(edges);
    }

    /** Outgoing edges of {@code node}; empty for a node not in the graph. */
    public List<TimingEdge> successors(String node) {
        Integer idx = nameToIndex.get(node);
        return idx == null ? List.of() : collect(outOffset, outEdges, idx);
    }

    /** Incoming edges of {@code node}; empty for a node not in the graph. */
    public List<TimingEdge> predecessors(String node) {
        Integer idx = nameToIndex.get(node);
        return idx == null ? List.of() : collect(inOffset, inEdges, idx);
    }

    private List<TimingEdge> collect(int[] offset, int[] list, int node) {
        List<TimingEdge> result = new ArrayList<>(offset[node + 1] - offset[node]);
        for (int k = offset[node]; k < offset[node + 1]; k++) {
            result.add(edges[list[k]]);
        }
        return result;
    }

    // --- Paths ---

    public List<List<TimingEdge>> findPaths(String source, String sink) {
        return findPaths(source, sink, defaultMaxDepth);
    }

    /**
     * Enumerates every simple path from {@code source} to {@code sink} of at
     * most {@code maxDepth} edges. A node path whose hops have parallel edges
     * yields one edge sequence per combination of those edges.
     *
     * @return the edge sequences, empty when the pins are not connected or equal
     * @throws IllegalArgumentException if either pin is not a node of this graph
     */
    public List<List<TimingEdge>> findPaths(String source, String sink, int maxDepth) {
        int s = requireIndex(source);
        int t = requireIndex(sink);
        List<List<TimingEdge>> result = new ArrayList<>();
        if (s == t || maxDepth < 1) {
            return result;
        }
        int[] nodePath = new int[Math.min(maxDepth, nodeNames.length) + 1];
        boolean[] onPath = new boolean[nodeNames.length];
        nodePath[0] = s;
        onPath[s] = true;
        walk(nodePath, 0, onPath, t, maxDepth, result);
        return result;
    }

    private void walk(int[] nodePath, int depth, boolean[] onPath, int target, int maxDepth,
                      List<List<TimingEdge>> result) {
        int u = nodePath[depth];
        for (int k = succOffset[u]; k < succOffset[u + 1]; k++) {
            int v = succList[k];
            if (onPath[v]) {
                continue;
            }
            nodePath[depth + 1] = v;
            if (v == target) {
                expand(nodePath, depth + 1, result);
            } else if (depth + 1 < maxDepth) {
                onPath[v] = true;
                walk(nodePath, depth + 1, onPath, target, maxDepth, result);
                onPath[v] = false;
            }
        }
    }

    // Cartesian product over the parallel edges of each hop
    private void expand(int[] nodePath, int hops, List<List<TimingEdge>> result) {
        List<List<TimingEdge>> options = new ArrayList<>(hops);
        for (int h = 0; h < hops; h++) {
            options.add(parallelEdges(nodePath[h], nodePath[h + 1]));
        }
        product(options, 0, new ArrayDeque<>(), result);
    }

    private void product(List<List<TimingEdge>> options, int hop, Deque<TimingEdge> current,
                         List<List<TimingEdge>> result) {
        if (hop == options.size()) {
            result.add(List.copyOf(current));
            return;
        }
        for (TimingEdge edge : options.get(hop)) {
            current.addLast(edge);
            product(options, hop + 1, current, result);
            current.removeLast();
        }
    }

    private List<TimingEdge> parallelEdges(int u, int v) {
        List<TimingEdge> result = new ArrayList<>(1);
        for (int k = outOffset[u]; k < outOffset[u + 1]; k++) {
            int e = outEdges[k];
            if (edgeSink[e] == v) {
                result.add(edges[e]);
            }
        }
        return result;
    }

    private int requireIndex(String node) {
        Integer idx = nameToIndex.get(node);
        if (idx == null) {
            throw new IllegalArgumentException("Unknown node: " + node);
        }
        return idx;
    }

    // --- Delay composition ---

    /**
     * Sums the delays along {@code path} field by field.
     *
     * @throws IllegalArgumentException if the path is empty
     */
    public static DelayPaths composeDelay(List<TimingEdge> path) {
        if (path.isEmpty()) {
            throw new IllegalArgumentException("Cannot compose delay for an empty path.");
        }
        DelayPaths total = path.get(0).delay();
        for (int i = 1; i < path.size(); i++) {
            total = total.plus(path.get(i).delay());
        }
        return total;
    }

    /** Composed delay of every path from {@code source} to {@code sink}. */
    public List<DelayPaths> compose(String source, String sink) {
        List<DelayPaths> result = new ArrayList<>();
        for (List<TimingEdge> path : findPaths(source, sink)) {
            result.add(composeDelay(path));
        }
        return result;
    }

    @Override
    public String toString() {
        return "TimingGraph{nodes=" + nodeNames.length + ", edges=" + edges.length + "}";
    }
}
