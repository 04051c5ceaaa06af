package nl.bytesoflife.deltasdf.cli;

import nl.bytesoflife.deltasdf.analysis.*;
import nl.bytesoflife.deltasdf.graph.*;
import nl.bytesoflife.deltasdf.model.DelayField;
import nl.bytesoflife.deltasdf.model.DelayPaths;
import nl.bytesoflife.deltasdf.model.EntryType;
import nl.bytesoflife.deltasdf.model.Metric;
import nl.bytesoflife.deltasdf.model.SdfFile;
import nl.bytesoflife.deltasdf.model.Values;
import nl.bytesoflife.deltasdf.parser.ParseException;
import nl.bytesoflife.deltasdf.parser.SdfParser;
import nl.bytesoflife.deltasdf.parser.ValueParser;
import nl.bytesoflife.deltasdf.transform.ConflictStrategy;
import nl.bytesoflife.deltasdf.transform.DelayNormalizer;
import nl.bytesoflife.deltasdf.transform.SdfMerger;
import nl.bytesoflife.deltasdf.writer.SdfWriter;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.PrintStream;
import java.io.UncheckedIOException;
import java.nio.file.Path;
import java.util.*;

/**
 * Command-line front end.
 * <pre>
 * sdftool &lt;command&gt; [files and arguments] [options]
 * </pre>
 * Exit status is 0 on success, 1 when the input cannot be read or processed
 * (or validation reports errors, or verification fails) and 2 on a usage
 * error.
 */
public class SdfTool {

    private static final Logger log = LoggerFactory.getLogger(SdfTool.class);

    static final int EXIT_OK = 0;
    static final int EXIT_FAILURE = 1;
    static final int EXIT_USAGE = 2;

    private static final String USAGE = """
            Usage: sdftool <command> [files and arguments] [options]

            Commands:
              parse <file>                       summary of cells and entries
              validate <file>                    structural checks, exits 1 on errors
              stats <file>                       entry counts and delay distribution
              emit <file>                        write the file back as SDF
              normalize <file> <timescale>       rescale delays and write as SDF
              query <file>                       keep matching entries and write as SDF
              merge <file> <file>...             combine files and write as SDF
              diff <file-a> <file-b>             header, entry and value differences
              paths <file> <from> <to>           every path between two pins
              critical <file> <from> <to>        worst path between two pins
              slack <file> <from> <to> <period>  period minus worst path delay
              endpoints <file>                   worst delay for every startpoint/endpoint pair
              compose <file> <from> <to>         summed delay of every path between two pins
              verify <file> <from> <to>          check --expected against the composed paths
              decompose                          --total minus --known
              dot <file>                         timing graph as Graphviz DOT

            Options:
              --field <name>              nominal, fast, slow, setup, hold, rise, fall (default slow)
              --metric <name>             min, avg, max (default max)
              --max-depth <n>             longest path to search, in edges (default 50)
              --timescale <ts>            TIMESCALE written by emit (default: the file's own)
              --target-timescale <ts>     normalize first (merge, diff)
              --strategy <name>           merge conflicts: keep-first, keep-last (default), error
              --tolerance <x>             absolute tolerance (verify, diff; default 1e-9)
              --expected <delays>         verify: field=min:avg:max[,field=min:avg:max...]
              --total <delays>            decompose: total delay, same form as --expected
              --known <delays>            decompose: known part, same form as --expected
              --cell-type <name>          query: keep this cell type (repeatable)
              --instance <name>           query: keep this instance (repeatable)
              --entry-type <type>         query: keep this entry type (repeatable)
              --pin-pattern <regex>       query: from or to pin must contain a match
              --min-delay <x>             query: lower bound on the --field/--metric value
              --max-delay <x>             query: upper bound on the --field/--metric value
              --highlight-source <pin>    dot: highlight the critical path from this pin
              --highlight-sink <pin>      dot: highlight the critical path to this pin
              --cluster                   dot: group pins by instance
            """;

    private static final Set<String> FLAGS = Set.of("--cluster");

    private final PrintStream out;

    private DelayField field = PathAnalysis.DEFAULT_FIELD;
    private Metric metric = PathAnalysis.DEFAULT_METRIC;
    private int maxDepth = TimingGraph.DEFAULT_MAX_DEPTH;
    private String timescale;
    private String targetTimescale;
    private ConflictStrategy strategy = ConflictStrategy.KEEP_LAST;
    private double tolerance = Values.DEFAULT_TOLERANCE;
    private DelayPaths expected;
    private DelayPaths total;
    private DelayPaths known;
    private final List<String> cellTypes = new ArrayList<>();
    private final List<String> instances = new ArrayList<>();
    private final List<EntryType> entryTypes = new ArrayList<>();
    private String pinPattern;
    private Double minDelay;
    private Double maxDelay;
    private String highlightSource;
    private String highlightSink;
    private boolean cluster;

    public SdfTool(PrintStream out) {
        this.out = out;
    }

    public static void main(String[] args) {
        Locale.setDefault(Locale.US);
        System.exit(new SdfTool(System.out).run(args));
    }

    public int run(String[] args) {
        List<String> positional;
        try {
            positional = parseOptions(args);
            if (positional.isEmpty()) {
                throw new UsageException("Expected a command");
            }
        } catch (UsageException e) {
            out.println(e.getMessage());
            out.print(USAGE);
            return EXIT_USAGE;
        }

        String command = positional.get(0);
        List<String> rest = positional.subList(1, positional.size());
        try {
            return dispatch(command, rest);
        } catch (UsageException e) {
            out.println(e.getMessage());
            out.print(USAGE);
            return EXIT_USAGE;
        } catch (ParseException | UncheckedIOException | IllegalArgumentException e) {
            log.error("{} failed for {}", command, rest, e);
            out.println("Error: " + e.getMessage());
            return EXIT_FAILURE;
        }
    }

    private List<String> parseOptions(String[] args) throws UsageException {
        List<String> positional = new ArrayList<>();
        for (int i = 0; i < args.length; i++) {
            String arg = args[i];
            if (!arg.startsWith("--")) {
                positional.add(arg);
                continue;
            }
            if (FLAGS.contains(arg)) {
                cluster = true;
                continue;
            }
            if (i + 1 >= args.length) {
                throw new UsageException("Missing value for " + arg);
            }
            String value = args[++i];
            try {
                switch (arg) {
                    case "--field" -> field = DelayField.fromName(value);
                    case "--metric" -> metric = Metric.fromName(value);
                    case "--max-depth" -> maxDepth = Integer.parseInt(value);
                    case "--timescale" -> timescale = value;
                    case "--target-timescale" -> targetTimescale = value;
                    case "--strategy" -> strategy = ConflictStrategy.fromName(value);
                    case "--tolerance" -> tolerance = Double.parseDouble(value);
                    case "--expected" -> expected = delayArgument(value);
                    case "--total" -> total = delayArgument(value);
                    case "--known" -> known = delayArgument(value);
                    case "--cell-type" -> cellTypes.add(value);
                    case "--instance" -> instances.add(value);
                    case "--entry-type" -> entryTypes.add(EntryType.fromName(value));
                    case "--pin-pattern" -> pinPattern = value;
                    case "--min-delay" -> minDelay = Double.parseDouble(value);
                    case "--max-delay" -> maxDelay = Double.parseDouble(value);
                    case "--highlight-source" -> highlightSource = value;
                    case "--highlight-sink" -> highlightSink = value;
                    default -> throw new UsageException("Unknown option " + arg);
                }
            } catch (IllegalArgumentException e) {
                throw new UsageException("Invalid value for " + arg + ": " + e.getMessage());
            }
        }
        return positional;
    }

    // nominal=1:2:3,slow=2:3:4
    static DelayPaths delayArgument(String text) {
        DelayPaths.Builder builder = DelayPaths.builder();
        for (String part : text.split(",")) {
            int eq = part.indexOf('=');
            if (eq < 0) {
                throw new IllegalArgumentException("Expected field=min:avg:max but got '" + part + "'");
            }
            builder.set(DelayField.fromName(part.substring(0, eq).strip()),
                    ValueParser.parseTriple(part.substring(eq + 1)));
        }
        return builder.build();
    }

    private int dispatch(String command, List<String> args) throws UsageException {
        return switch (command) {
            case "parse" -> {
                expectArgs(command, args, 1);
                yield parse(load(args.get(0)));
            }
            case "validate" -> {
                expectArgs(command, args, 1);
                yield validate(load(args.get(0)));
            }
            case "stats" -> {
                expectArgs(command, args, 1);
                out.print(SdfStats.compute(load(args.get(0)), field, metric));
                yield EXIT_OK;
            }
            case "emit" -> {
                expectArgs(command, args, 1);
                SdfFile sdf = load(args.get(0));
                out.print(timescale != null ? new SdfWriter().emit(sdf, timescale) : new SdfWriter().emit(sdf));
                yield EXIT_OK;
            }
            case "normalize" -> {
                expectArgs(command, args, 2);
                out.print(new SdfWriter().emit(DelayNormalizer.normalize(load(args.get(0)), args.get(1))));
                yield EXIT_OK;
            }
            case "query" -> {
                expectArgs(command, args, 1);
                yield query(load(args.get(0)));
            }
            case "merge" -> {
                if (args.size() < 2) {
                    throw new UsageException("merge takes at least two files, got " + args.size());
                }
                yield merge(args);
            }
            case "diff" -> {
                expectArgs(command, args, 2);
                yield diff(load(args.get(0)), load(args.get(1)));
            }
            case "paths" -> {
                expectArgs(command, args, 3);
                yield paths(graph(args.get(0)), args.get(1), args.get(2));
            }
            case "critical" -> {
                expectArgs(command, args, 3);
                yield critical(graph(args.get(0)), args.get(1), args.get(2));
            }
            case "slack" -> {
                expectArgs(command, args, 4);
                double period;
                try {
                    period = Double.parseDouble(args.get(3));
                } catch (NumberFormatException e) {
                    throw new UsageException("Period is not a number: " + args.get(3));
                }
                yield slack(graph(args.get(0)), args.get(1), args.get(2), period);
            }
            case "endpoints" -> {
                expectArgs(command, args, 1);
                yield endpoints(graph(args.get(0)));
            }
            case "compose" -> {
                expectArgs(command, args, 3);
                yield compose(graph(args.get(0)), args.get(1), args.get(2));
            }
            case "verify" -> {
                expectArgs(command, args, 3);
                if (expected == null) {
                    throw new UsageException("verify needs --expected");
                }
                yield verify(graph(args.get(0)), args.get(1), args.get(2));
            }
            case "decompose" -> {
                expectArgs(command, args, 0);
                if (total == null || known == null) {
                    throw new UsageException("decompose needs --total and --known");
                }
                out.println(formatDelay(PathAnalysis.decomposeDelay(total, known)));
                yield EXIT_OK;
            }
            case "dot" -> {
                expectArgs(command, args, 1);
                if ((highlightSource == null) != (highlightSink == null)) {
                    throw new UsageException("dot needs both --highlight-source and --highlight-sink");
                }
                yield dot(graph(args.get(0)));
            }
            default -> throw new UsageException("Unknown command " + command);
        };
    }

    private static void expectArgs(String command, List<String> args, int count) throws UsageException {
        if (args.size() != count) {
            throw new UsageException(command + " takes " + count + " argument(s), got " + args.size());
        }
    }

    private SdfFile load(String file) {
        long start = System.currentTimeMillis();
        SdfFile sdf = new SdfParser().parse(Path.of(file));
        log.info("Parsed {} in {}ms: {} cell types, {} entries",
                file, System.currentTimeMillis() - start, sdf.getCells().size(), sdf.getEntryCount());
        return sdf;
    }

    private TimingGraph graph(String file) {
        TimingGraph graph = new TimingGraph(load(file), maxDepth);
        log.info("Timing graph: {} nodes, {} edges", graph.nodeCount(), graph.edgeCount());
        return graph;
    }

    // --- Commands ---

    private int parse(SdfFile sdf) {
        out.println("Header: " + sdf.getHeader().toMap());
        for (var cellEntry : sdf.getCells().entrySet()) {
            for (var instanceEntry : cellEntry.getValue().entrySet()) {
                String instance = instanceEntry.getKey().isEmpty() ? "<none>" : instanceEntry.getKey();
                out.println(cellEntry.getKey() + " " + instance + ": " + instanceEntry.getValue().size() + " entries");
            }
        }
        out.println("Total: " + sdf.getCells().size() + " cell types, " + sdf.getEntryCount() + " entries");
        return EXIT_OK;
    }

    private int validate(SdfFile sdf) {
        List<LintIssue> issues = SdfValidator.validate(sdf);
        long errors = issues.stream().filter(i -> i.getSeverity() == Severity.ERROR).count();
        for (LintIssue issue : issues) {
            out.println(issue);
        }
        out.println(errors + " " + Severity.ERROR.displayName() + "(s), "
                + (issues.size() - errors) + " " + Severity.WARNING.displayName() + "(s)");
        return errors > 0 ? EXIT_FAILURE : EXIT_OK;
    }

    private int query(SdfFile sdf) {
        SdfQuery query = new SdfQuery().withScalar(field, metric);
        if (!cellTypes.isEmpty()) {
            query.withCellTypes(cellTypes);
        }
        if (!instances.isEmpty()) {
            query.withInstances(instances);
        }
        if (!entryTypes.isEmpty()) {
            query.withEntryTypes(entryTypes);
        }
        if (pinPattern != null) {
            query.withPinPattern(pinPattern);
        }
        if (minDelay != null || maxDelay != null) {
            query.withDelayRange(minDelay, maxDelay);
        }
        SdfFile result = query.apply(sdf);
        log.info("Query kept {} of {} entries", result.getEntryCount(), sdf.getEntryCount());
        out.print(new SdfWriter().emit(result));
        return EXIT_OK;
    }

    private int merge(List<String> files) {
        List<SdfFile> loaded = new ArrayList<>();
        for (String file : files) {
            loaded.add(load(file));
        }
        out.print(new SdfWriter().emit(SdfMerger.merge(loaded, strategy, targetTimescale)));
        return EXIT_OK;
    }

    private int diff(SdfFile a, SdfFile b) {
        DiffResult result = new SdfDiff()
                .withTolerance(tolerance)
                .withNormalization(targetTimescale)
                .compare(a, b);
        out.print(result);
        return EXIT_OK;
    }

    private int paths(TimingGraph graph, String from, String to) {
        List<RankedPath> ranked = PathAnalysis.rankPaths(graph, from, to, field, metric, true);
        if (ranked.isEmpty()) {
            out.println("No path from " + from + " to " + to);
            return EXIT_OK;
        }
        int n = 1;
        for (RankedPath path : ranked) {
            out.println("#" + n++ + " " + formatScalar(path.scalar()) + ": " + describe(path.edges()));
        }
        return EXIT_OK;
    }

    private int critical(TimingGraph graph, String from, String to) {
        Optional<RankedPath> critical = PathAnalysis.criticalPath(graph, from, to, field, metric);
        if (critical.isEmpty()) {
            out.println("No path from " + from + " to " + to);
            return EXIT_OK;
        }
        out.println("Critical path " + field.sdfName() + "/" + metric.sdfName() + " = "
                + formatScalar(critical.get().scalar()));
        for (TimingEdge edge : critical.get().edges()) {
            out.println("  " + edge + " " + formatScalar(edge.delay().getScalar(field, metric)));
        }
        return EXIT_OK;
    }

    private int slack(TimingGraph graph, String from, String to, double period) {
        OptionalDouble slack = PathAnalysis.computeSlack(graph, from, to, period, field, metric);
        if (slack.isEmpty()) {
            out.println("No slack: no path from " + from + " to " + to + " with a "
                    + field.sdfName() + "/" + metric.sdfName() + " delay");
            return EXIT_OK;
        }
        double value = slack.getAsDouble();
        out.println("Slack " + ValueParser.formatNumber(value) + (value < 0 ? " (VIOLATED)" : " (MET)"));
        return EXIT_OK;
    }

    private int endpoints(TimingGraph graph) {
        List<EndpointResult> results = PathAnalysis.batchEndpointAnalysis(graph, field, metric);
        for (EndpointResult r : results) {
            out.println(r.source() + " -> " + r.sink() + ": " + formatScalar(r.criticalDelay())
                    + " (" + r.pathCount() + " path" + (r.pathCount() == 1 ? "" : "s") + ")");
        }
        out.println(results.size() + " connected pairs");
        return EXIT_OK;
    }

    private int compose(TimingGraph graph, String from, String to) {
        List<List<TimingEdge>> paths = graph.findPaths(from, to);
        if (paths.isEmpty()) {
            out.println("No path from " + from + " to " + to);
            return EXIT_OK;
        }
        int n = 1;
        for (List<TimingEdge> path : paths) {
            out.println("Path " + n++ + ": " + describe(path) + ": " + formatDelay(TimingGraph.composeDelay(path)));
        }
        return EXIT_OK;
    }

    private int verify(TimingGraph graph, String from, String to) {
        VerificationResult result = PathAnalysis.verifyPath(graph, from, to, expected, tolerance);
        out.println(result.passed() ? "PASS" : "FAIL");
        out.println("Expected: " + formatDelay(result.expected()));
        int n = 1;
        for (DelayPaths actual : result.actual()) {
            out.println("Actual path " + n++ + ": " + formatDelay(actual));
        }
        return result.passed() ? EXIT_OK : EXIT_FAILURE;
    }

    private int dot(TimingGraph graph) {
        DotExporter exporter = new DotExporter()
                .withScalar(field, metric)
                .withClusterByInstance(cluster);
        if (highlightSource != null) {
            exporter.withHighlight(PathAnalysis.criticalPath(graph, highlightSource, highlightSink, field, metric)
                    .orElse(null));
        }
        out.print(exporter.export(graph));
        return EXIT_OK;
    }

    private static String describe(List<TimingEdge> edges) {
        StringBuilder sb = new StringBuilder(edges.get(0).source());
        for (TimingEdge edge : edges) {
            sb.append(" -> ").append(edge.sink());
        }
        return sb.toString();
    }

    static String formatDelay(DelayPaths paths) {
        StringJoiner joiner = new StringJoiner(" ");
        for (DelayField f : DelayField.values()) {
            Values values = paths.get(f);
            if (values != null) {
                joiner.add(f.sdfName() + "=" + ValueParser.formatTriple(values));
            }
        }
        return joiner.length() == 0 ? "<none>" : joiner.toString();
    }

    private static String formatScalar(Double value) {
        return value == null ? "n/a" : ValueParser.formatNumber(value);
    }

    static class UsageException extends Exception {
        UsageException(String message) {
            super(message);
        }
    }
}
