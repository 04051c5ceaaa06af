package nl.bytesoflife.deltasdf.writer;

import nl.bytesoflife.deltasdf.model.*;
import nl.bytesoflife.deltasdf.parser.ValueParser;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.TreeMap;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Renders an {@link SdfFile} as SDF text that reads back into an equal model.
 * <p>
 * Every value is written as a full {@code min:avg:max} triple with unset
 * slots left empty, never as a bare number, because a bare number reads back
 * into the avg slot only.
 */
public class SdfWriter {

    public static final String DEFAULT_TIMESCALE = "1ps";

    private static final String INDENT = "  ";

    private static final List<String> QUOTED_HEADER_FIELDS = List.of(
            "sdfversion", "design", "date", "vendor", "program", "version", "process");

    private static final Pattern NUMBERED_KEY = Pattern.compile("(.*)_([0-9]+)");

    // name_2 before name_10, so collision suffixes are reassigned in the same order on re-read
    static final Comparator<String> KEY_ORDER = Comparator
            .comparing(SdfWriter::keyBase)
            .thenComparingLong(SdfWriter::keySuffix)
            .thenComparing(Comparator.naturalOrder());

    private boolean uppercaseCelltype;

    public SdfWriter withUppercaseCelltype(boolean enabled) {
        this.uppercaseCelltype = enabled;
        return this;
    }

    /** Writes with the file's own timescale, or {@value #DEFAULT_TIMESCALE} when it has none. */
    public String emit(SdfFile sdf) {
        String timescale = sdf.getHeader().getTimescale();
        return emit(sdf, timescale != null ? timescale : DEFAULT_TIMESCALE);
    }

    /**
     * Writes with the given TIMESCALE text. Delay values are written as stored;
     * use {@code DelayNormalizer} to rescale them first.
     */
    public String emit(SdfFile sdf, String timescale) {
        StringBuilder out = new StringBuilder();
        out.append("(DELAYFILE\n");
        writeHeader(sdf.getHeader(), timescale, out);
        for (var cellEntry : sdf.getCells().entrySet()) {
            for (var instanceEntry : cellEntry.getValue().entrySet()) {
                writeCell(cellEntry.getKey(), instanceEntry.getKey(), instanceEntry.getValue(), out);
            }
        }
        out.append(")\n");
        return out.toString();
    }

    private void writeHeader(SdfHeader header, String timescale, StringBuilder out) {
        for (String field : SdfHeader.FIELD_NAMES) {
            if (field.equals("timescale")) {
                continue;
            }
            String value = header.get(field);
            if (value == null) {
                continue;
            }
            out.append(INDENT).append('(').append(field.toUpperCase(Locale.ROOT)).append(' ');
            if (QUOTED_HEADER_FIELDS.contains(field)) {
                out.append(quote(value));
            } else {
                out.append(value);
            }
            out.append(")\n");
        }
        out.append(INDENT).append("(TIMESCALE ").append(timescale).append(")\n");
    }

    private void writeCell(String cellType, String instance, Map<String, Entry> entries, StringBuilder out) {
        Map<String, Entry> sorted = new TreeMap<>(KEY_ORDER);
        sorted.putAll(entries);
        List<Entry> absolute = new ArrayList<>();
        List<Entry> increment = new ArrayList<>();
        List<Entry> checks = new ArrayList<>();
        List<Entry> env = new ArrayList<>();
        for (Entry entry : sorted.values()) {
            if (entry.isAbsolute()) {
                absolute.add(entry);
            } else if (entry.isIncremental()) {
                increment.add(entry);
            }
            if (entry.isTimingCheck()) {
                checks.add(entry);
            }
            if (entry.isTimingEnv()) {
                env.add(entry);
            }
        }

        String ind = INDENT.repeat(2);
        out.append(INDENT).append("(CELL\n");
        out.append(ind).append("(CELLTYPE ")
                .append(quote(uppercaseCelltype ? cellType.toUpperCase(Locale.ROOT) : cellType)).append(")\n");
        out.append(ind).append("(INSTANCE");
        if (!instance.isEmpty()) {
            out.append(' ').append(instance);
        }
        out.append(")\n");

        if (!absolute.isEmpty() || !increment.isEmpty()) {
            out.append(ind).append("(DELAY\n");
            writeDelayBlock("ABSOLUTE", absolute, out);
            writeDelayBlock("INCREMENT", increment, out);
            out.append(ind).append(")\n");
        }
        if (!checks.isEmpty()) {
            out.append(ind).append("(TIMINGCHECK\n");
            for (Entry check : checks) {
                out.append(INDENT.repeat(3)).append(timingCheck(check)).append('\n');
            }
            out.append(ind).append(")\n");
        }
        if (!env.isEmpty()) {
            out.append(ind).append("(TIMINGENV\n");
            for (Entry constraint : env) {
                out.append(INDENT.repeat(3)).append(pathConstraint(constraint)).append('\n');
            }
            out.append(ind).append(")\n");
        }
        out.append(INDENT).append(")\n");
    }

    private void writeDelayBlock(String keyword, List<Entry> entries, StringBuilder out) {
        if (entries.isEmpty()) {
            return;
        }
        String ind = INDENT.repeat(3);
        out.append(ind).append('(').append(keyword).append('\n');
        for (Entry entry : entries) {
            String line = delayEntry(entry);
            if (entry.isCond()) {
                line = "(COND " + entry.getCondEquation() + " " + line + ")";
            }
            out.append(ind).append(INDENT).append(line).append('\n');
        }
        out.append(ind).append(")\n");
    }

    private String delayEntry(Entry entry) {
        DelayPaths paths = entry.getDelayPaths();
        StringBuilder sb = new StringBuilder("(").append(entry.getType().keyword());
        switch (entry.getType()) {
            case IOPATH, INTERCONNECT -> sb.append(' ').append(port(entry.getFromPin(), entry.getFromPinEdge()))
                    .append(' ').append(port(entry.getToPin(), entry.getToPinEdge()));
            case PORT -> sb.append(' ').append(entry.getFromPin());
            case DEVICE -> {
                if (entry.getFromPin() != null) {
                    sb.append(' ').append(entry.getFromPin());
                }
            }
            default -> throw new IllegalArgumentException(
                    "Entry " + entry.getName() + " of type " + entry.getType().sdfName() + " is not a delay");
        }
        sb.append(' ').append(delayList(paths)).append(')');
        return sb.toString();
    }

    // nominal alone unless fast or slow is set; then fast [nominal] slow with () for a missing corner
    static String delayList(DelayPaths paths) {
        if (paths == null) {
            return "()";
        }
        if (paths.getFast() == null && paths.getSlow() == null) {
            return rvalue(paths.getNominal());
        }
        if (paths.getNominal() != null) {
            return rvalue(paths.getFast()) + " " + rvalue(paths.getNominal()) + " " + rvalue(paths.getSlow());
        }
        return rvalue(paths.getFast()) + " " + rvalue(paths.getSlow());
    }

    private String timingCheck(Entry entry) {
        DelayPaths paths = entry.getDelayPaths();
        String from = entry.isCond()
                ? "(COND " + entry.getCondEquation() + " " + port(entry.getFromPin(), entry.getFromPinEdge()) + ")"
                : port(entry.getFromPin(), entry.getFromPinEdge());
        String to = port(entry.getToPin(), entry.getToPinEdge());
        StringBuilder sb = new StringBuilder("(").append(entry.getType().keyword()).append(' ');
        switch (entry.getType()) {
            case SETUP, HOLD, REMOVAL, RECOVERY -> sb.append(to).append(' ').append(from)
                    .append(' ').append(rvalue(paths != null ? paths.getNominal() : null));
            case WIDTH -> sb.append(from).append(' ').append(rvalue(paths != null ? paths.getNominal() : null));
            case SETUPHOLD -> sb.append(to).append(' ').append(from)
                    .append(' ').append(rvalue(paths != null ? paths.getSetup() : null))
                    .append(' ').append(rvalue(paths != null ? paths.getHold() : null));
            default -> throw new IllegalArgumentException(
                    "Entry " + entry.getName() + " of type " + entry.getType().sdfName() + " is not a timing check");
        }
        return sb.append(')').toString();
    }

    private String pathConstraint(Entry entry) {
        DelayPaths paths = entry.getDelayPaths();
        return "(PATHCONSTRAINT " + port(entry.getToPin(), entry.getToPinEdge())
                + " " + port(entry.getFromPin(), entry.getFromPinEdge())
                + " " + rvalue(paths != null ? paths.getRise() : null)
                + " " + rvalue(paths != null ? paths.getFall() : null) + ")";
    }

    private static String port(String pin, EdgeType edge) {
        return edge == null ? pin : "(" + edge.sdfName() + " " + pin + ")";
    }

    private static String rvalue(Values values) {
        if (values == null || values.isEmpty()) {
            return "()";
        }
        return "(" + ValueParser.formatTriple(values) + ")";
    }

    private static String keyBase(String key) {
        Matcher m = NUMBERED_KEY.matcher(key);
        return m.matches() ? m.group(1) : key;
    }

    private static long keySuffix(String key) {
        Matcher m = NUMBERED_KEY.matcher(key);
        if (!m.matches() || m.group(2).length() > 18) {
            return -1;
        }
        return Long.parseLong(m.group(2));
    }

    private static String quote(String value) {
        return '"' + value.replace("\\", "\\\\").replace("\"", "\\\"") + '"';
    }
}
