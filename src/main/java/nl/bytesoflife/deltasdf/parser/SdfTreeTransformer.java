package nl.bytesoflife.deltasdf.parser;

import nl.bytesoflife.deltasdf.model.*;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Set;

/**
 * Folds the syntax tree of one DELAYFILE into an {@link SdfFile}.
 * <p>
 * An instance transforms exactly one tree. Entries gathered while visiting a
 * CELL are kept in a list local to that visit and committed to the file when
 * the CELL has been read completely.
 */
public class SdfTreeTransformer {

    private static final Logger log = LoggerFactory.getLogger(SdfTreeTransformer.class);

    private static final Set<String> STRING_HEADER_FIELDS = Set.of(
            "SDFVERSION", "DESIGN", "DATE", "VENDOR", "PROGRAM", "VERSION", "PROCESS");

    private static final Set<String> DELAY_KEYWORDS = Set.of("IOPATH", "INTERCONNECT", "PORT", "DEVICE");

    private boolean used;

    public SdfFile transform(List<SNode> nodes) {
        if (used) {
            throw new IllegalStateException("SdfTreeTransformer instances transform a single tree; create a new one");
        }
        used = true;

        SNode.SList delayFile = findDelayFile(nodes);
        SdfFile file = new SdfFile();
        int cellCount = 0;

        for (int i = 1; i < delayFile.size(); i++) {
            SNode.SList item = requireList(delayFile.get(i), "DELAYFILE item");
            String tag = item.tag();
            if (STRING_HEADER_FIELDS.contains(tag)) {
                file.getHeader().set(tag.toLowerCase(Locale.ROOT), optionalString(item));
            } else {
                switch (tag) {
                    case "DIVIDER" -> file.getHeader().setDivider(requireAtom(item, 1, "divider character").value());
                    case "VOLTAGE" -> file.getHeader().setVoltage(ValueParser.formatTriple(headerRvalue(item)));
                    case "TEMPERATURE" -> file.getHeader().setTemperature(ValueParser.formatTriple(headerRvalue(item)));
                    case "TIMESCALE" -> file.getHeader().setTimescale(timescale(item));
                    case "CELL" -> {
                        transformCell(item, file);
                        cellCount++;
                    }
                    default -> throw new ParseException("Unexpected DELAYFILE item '" + describe(item) + "'", item);
                }
            }
        }

        log.debug("Transformed DELAYFILE: {} CELL blocks, {} entries", cellCount, file.getEntryCount());
        return file;
    }

    private SNode.SList findDelayFile(List<SNode> nodes) {
        SNode.SList delayFile = null;
        for (SNode node : nodes) {
            SNode.SList list = requireList(node, "top-level item");
            if (!"DELAYFILE".equals(list.tag())) {
                throw new ParseException("Expected DELAYFILE but found '" + describe(list) + "'", list);
            }
            if (delayFile != null) {
                throw new ParseException("More than one DELAYFILE in input", list);
            }
            delayFile = list;
        }
        if (delayFile == null) {
            throw new ParseException("No DELAYFILE found in input", 1, 1);
        }
        return delayFile;
    }

    // --- Header ---

    private String optionalString(SNode.SList item) {
        if (item.size() < 2) {
            return "";
        }
        if (item.size() > 2) {
            throw new ParseException("Expected a single value for " + item.tag(), item.get(2));
        }
        return requireAtom(item, 1, item.tag() + " value").value();
    }

    // VOLTAGE and TEMPERATURE carry an rtriple or a bare number without parentheses
    private Values headerRvalue(SNode.SList item) {
        if (item.size() == 2 && item.get(1) instanceof SNode.SList list) {
            return rvalue(list);
        }
        return triple(joinAtoms(item, 1), item);
    }

    private String timescale(SNode.SList item) {
        try {
            return ValueParser.normalizeTimescale(atomText(item, 1));
        } catch (IllegalArgumentException e) {
            throw new ParseException(e.getMessage(), item, e);
        }
    }

    // --- Cells ---

    private void transformCell(SNode.SList cell, SdfFile file) {
        SNode.SList cellTypeNode = requireTagged(cell, 1, "CELLTYPE");
        SNode.SList instanceNode = requireTagged(cell, 2, "INSTANCE");
        String cellType = requireAtom(cellTypeNode, 1, "cell type name").value();
        String instance = instanceNode.size() > 1 ? requireAtom(instanceNode, 1, "instance path").value() : "";

        List<Entry.Builder> pending = new ArrayList<>();
        for (int i = 3; i < cell.size(); i++) {
            SNode.SList section = requireList(cell.get(i), "CELL section");
            switch (section.tag()) {
                case "DELAY" -> delaySection(section, pending);
                case "TIMINGCHECK" -> timingCheckSection(section, pending);
                case "TIMINGENV" -> timingEnvSection(section, pending);
                default -> throw new ParseException("Unsupported CELL section '" + describe(section) + "'", section);
            }
        }

        file.addCell(cellType, instance);
        for (Entry.Builder builder : pending) {
            file.store(cellType, instance, builder.build());
        }
    }

    // --- DELAY ---

    private void delaySection(SNode.SList delay, List<Entry.Builder> pending) {
        for (int i = 1; i < delay.size(); i++) {
            SNode.SList block = requireList(delay.get(i), "DELAY block");
            List<Entry.Builder> entries = new ArrayList<>();
            for (int j = 1; j < block.size(); j++) {
                delayEntry(requireList(block.get(j), "delay entry"), entries);
            }
            switch (block.tag()) {
                case "ABSOLUTE" -> entries.forEach(e -> e.absolute(true));
                case "INCREMENT" -> entries.forEach(e -> e.incremental(true));
                default -> throw new ParseException("Unsupported DELAY block '" + describe(block) + "'", block);
            }
            pending.addAll(entries);
        }
    }

    private void delayEntry(SNode.SList node, List<Entry.Builder> out) {
        switch (node.tag()) {
            case "IOPATH", "INTERCONNECT" -> {
                PortRef from = portSpec(child(node, 1, "input port"));
                PortRef to = portSpec(child(node, 2, "output port"));
                out.add(Entry.builder(EntryType.fromName(node.tag()))
                        .pins(from.port(), to.port())
                        .edges(from.edge(), to.edge())
                        .delayPaths(delayValueList(node, 3)));
            }
            case "PORT" -> {
                PortRef port = portSpec(child(node, 1, "port"));
                out.add(Entry.builder(EntryType.PORT)
                        .pins(port.port(), port.port())
                        .delayPaths(delayValueList(node, 2)));
            }
            case "DEVICE" -> {
                // the port is optional: (DEVICE (1:2:3)) applies to every output of the cell
                if (node.size() > 1 && node.get(1) instanceof SNode.SAtom) {
                    PortRef port = portSpec(node.get(1));
                    out.add(Entry.builder(EntryType.DEVICE)
                            .pins(port.port(), port.port())
                            .delayPaths(delayValueList(node, 2)));
                } else {
                    out.add(Entry.builder(EntryType.DEVICE).delayPaths(delayValueList(node, 1)));
                }
            }
            case "COND" -> {
                int start = skipConditionName(node);
                int split = start;
                while (split < node.size() && !isDelayEntry(node.get(split))) {
                    split++;
                }
                if (split == start) {
                    throw new ParseException("COND without a condition expression", node);
                }
                if (split == node.size()) {
                    throw new ParseException("COND without a delay entry", node);
                }
                String equation = ConditionFormatter.format(node.children().subList(start, split));
                List<Entry.Builder> wrapped = new ArrayList<>();
                for (int i = split; i < node.size(); i++) {
                    delayEntry(requireList(node.get(i), "conditional delay entry"), wrapped);
                }
                wrapped.forEach(e -> e.condition(equation));
                out.addAll(wrapped);
            }
            default -> throw new ParseException("Unsupported delay entry '" + describe(node) + "'", node);
        }
    }

    private static boolean isDelayEntry(SNode node) {
        return node instanceof SNode.SList list && DELAY_KEYWORDS.contains(list.tag());
    }

    /**
     * One triple is nominal, two are fast and slow, three are fast, nominal and
     * slow. Any other count leaves only an empty nominal triple.
     */
    private DelayPaths delayValueList(SNode.SList node, int start) {
        List<Values> triples = new ArrayList<>();
        for (int i = start; i < node.size(); i++) {
            triples.add(rvalue(requireList(node.get(i), "delay value")));
        }
        DelayPaths.Builder paths = DelayPaths.builder();
        switch (triples.size()) {
            case 1 -> paths.nominal(triples.get(0));
            case 2 -> paths.fast(triples.get(0)).slow(triples.get(1));
            case 3 -> paths.fast(triples.get(0)).nominal(triples.get(1)).slow(triples.get(2));
            default -> paths.nominal(Values.empty());
        }
        return paths.build();
    }

    // --- TIMINGCHECK ---

    private void timingCheckSection(SNode.SList section, List<Entry.Builder> pending) {
        for (int i = 1; i < section.size(); i++) {
            timingCheck(requireList(section.get(i), "timing check"), pending);
        }
    }

    private void timingCheck(SNode.SList node, List<Entry.Builder> out) {
        String tag = node.tag();
        switch (tag) {
            case "SETUP", "HOLD", "REMOVAL", "RECOVERY" -> {
                expectSize(node, 4);
                TimingPort to = timingPort(node.get(1));
                TimingPort from = timingPort(node.get(2));
                out.add(timingCheckEntry(EntryType.fromName(tag), to, from,
                        DelayPaths.ofNominal(rvalue(requireList(node.get(3), "check value")))));
            }
            case "SETUPHOLD" -> {
                expectSize(node, 5);
                TimingPort to = timingPort(node.get(1));
                TimingPort from = timingPort(node.get(2));
                DelayPaths paths = DelayPaths.builder()
                        .setup(rvalue(requireList(node.get(3), "setup value")))
                        .hold(rvalue(requireList(node.get(4), "hold value")))
                        .build();
                out.add(timingCheckEntry(EntryType.SETUPHOLD, to, from, paths));
            }
            case "WIDTH" -> {
                expectSize(node, 3);
                TimingPort port = timingPort(node.get(1));
                out.add(timingCheckEntry(EntryType.WIDTH, port, port,
                        DelayPaths.ofNominal(rvalue(requireList(node.get(2), "width value")))));
            }
            case "COND" -> {
                int start = skipConditionName(node);
                int split = start;
                while (split < node.size() && !isTimingCheck(node.get(split))) {
                    split++;
                }
                if (split == start || split == node.size()) {
                    throw new ParseException("COND needs a condition expression followed by timing checks", node);
                }
                String equation = ConditionFormatter.format(node.children().subList(start, split));
                List<Entry.Builder> wrapped = new ArrayList<>();
                for (int i = split; i < node.size(); i++) {
                    SNode.SList check = requireList(node.get(i), "conditional timing check");
                    int before = wrapped.size();
                    timingCheck(check, wrapped);
                    // an entry holds one condition: a COND port inside a COND check is ambiguous
                    for (Entry.Builder e : wrapped.subList(before, wrapped.size())) {
                        if (e.isCond()) {
                            throw new ParseException("Timing check under COND already has a COND port", check);
                        }
                    }
                }
                wrapped.forEach(e -> e.condition(equation));
                out.addAll(wrapped);
            }
            default -> throw new ParseException("Unsupported timing check '" + describe(node) + "'", node);
        }
    }

    private static boolean isTimingCheck(SNode node) {
        if (node instanceof SNode.SList list) {
            return switch (list.tag()) {
                case "SETUP", "HOLD", "REMOVAL", "RECOVERY", "WIDTH", "SETUPHOLD" -> true;
                default -> false;
            };
        }
        return false;
    }

    // the condition of a check is taken from its second (from) port
    private Entry.Builder timingCheckEntry(EntryType type, TimingPort to, TimingPort from, DelayPaths paths) {
        Entry.Builder builder = Entry.builder(type)
                .pins(from.ref().port(), to.ref().port())
                .edges(from.ref().edge(), to.ref().edge())
                .delayPaths(paths);
        if (from.condition() != null) {
            builder.condition(from.condition());
        }
        return builder;
    }

    // --- TIMINGENV ---

    private void timingEnvSection(SNode.SList section, List<Entry.Builder> pending) {
        for (int i = 1; i < section.size(); i++) {
            SNode.SList node = requireList(section.get(i), "timing environment entry");
            if (!"PATHCONSTRAINT".equals(node.tag())) {
                throw new ParseException("Unsupported timing environment entry '" + describe(node) + "'", node);
            }
            int start = skipConditionName(node);
            if (node.size() - start != 4) {
                throw new ParseException("PATHCONSTRAINT expects two ports and rise/fall values", node);
            }
            PortRef to = portSpec(node.get(start));
            PortRef from = portSpec(node.get(start + 1));
            DelayPaths paths = DelayPaths.builder()
                    .rise(rvalue(requireList(node.get(start + 2), "rise value")))
                    .fall(rvalue(requireList(node.get(start + 3), "fall value")))
                    .build();
            pending.add(Entry.builder(EntryType.PATHCONSTRAINT)
                    .pins(from.port(), to.port())
                    .edges(from.edge(), to.edge())
                    .delayPaths(paths));
        }
    }

    // --- Ports ---

    private record PortRef(String port, EdgeType edge) {
    }

    private record TimingPort(PortRef ref, String condition) {
    }

    private PortRef portSpec(SNode node) {
        if (node instanceof SNode.SAtom atom && !atom.quoted()) {
            return new PortRef(atom.value(), null);
        }
        if (node instanceof SNode.SList list && list.size() == 2
                && list.get(0) instanceof SNode.SAtom keyword && EdgeType.isEdgeKeyword(keyword.value())) {
            return new PortRef(requireAtom(list, 1, "port").value(), EdgeType.fromSdfName(keyword.value()));
        }
        throw new ParseException("Expected a port or (posedge|negedge port) but found '" + node + "'", node);
    }

    private TimingPort timingPort(SNode node) {
        if (node instanceof SNode.SList list && "COND".equals(list.tag())) {
            int start = skipConditionName(list);
            if (list.size() - start < 2) {
                throw new ParseException("COND port needs a condition expression and a port", list);
            }
            String equation = ConditionFormatter.format(list.children().subList(start, list.size() - 1));
            return new TimingPort(portSpec(list.get(list.size() - 1)), equation);
        }
        return new TimingPort(portSpec(node), null);
    }

    // COND may carry a quoted name before the expression; it is not kept
    private static int skipConditionName(SNode.SList node) {
        if (node.size() > 1 && node.get(1) instanceof SNode.SAtom atom && atom.quoted()) {
            return 2;
        }
        return 1;
    }

    // --- Values ---

    private Values rvalue(SNode.SList list) {
        return triple(joinAtoms(list, 0), list);
    }

    private Values triple(String text, SNode at) {
        try {
            return ValueParser.parseTriple(text);
        } catch (IllegalArgumentException e) {
            throw new ParseException(e.getMessage(), at, e);
        }
    }

    // (1.0 : 2.0 : 3.0) and (1.0:2.0:3.0) read the same; (1 2) is an error
    private String joinAtoms(SNode.SList list, int start) {
        StringBuilder sb = new StringBuilder();
        String previous = null;
        for (int i = start; i < list.size(); i++) {
            String value = plainAtom(list.get(i)).value();
            if (previous != null && !previous.endsWith(":") && !value.startsWith(":")) {
                throw new ParseException("Expected ':' between '" + previous + "' and '" + value + "'", list.get(i));
            }
            sb.append(value);
            previous = value;
        }
        return sb.toString();
    }

    // TIMESCALE may separate the number and the unit: (TIMESCALE 1.0 ns)
    private String atomText(SNode.SList list, int start) {
        StringBuilder sb = new StringBuilder();
        for (int i = start; i < list.size(); i++) {
            if (sb.length() > 0) {
                sb.append(' ');
            }
            sb.append(plainAtom(list.get(i)).value());
        }
        return sb.toString();
    }

    private static SNode.SAtom plainAtom(SNode node) {
        if (node instanceof SNode.SAtom atom && !atom.quoted()) {
            return atom;
        }
        throw new ParseException("Expected a number but found '" + node + "'", node);
    }

    // --- Node helpers ---

    private static SNode.SList requireList(SNode node, String what) {
        if (node instanceof SNode.SList list) {
            return list;
        }
        throw new ParseException("Expected " + what + " but found '" + node + "'", node);
    }

    private static SNode.SAtom requireAtom(SNode.SList list, int index, String what) {
        SNode node = child(list, index, what);
        if (node instanceof SNode.SAtom atom) {
            return atom;
        }
        throw new ParseException("Expected " + what + " but found '" + node + "'", node);
    }

    private static SNode.SList requireTagged(SNode.SList list, int index, String tag) {
        SNode.SList child = requireList(child(list, index, tag), tag);
        if (!tag.equals(child.tag())) {
            throw new ParseException("Expected " + tag + " but found '" + describe(child) + "'", child);
        }
        return child;
    }

    private static SNode child(SNode.SList list, int index, String what) {
        if (index >= list.size()) {
            throw new ParseException("Missing " + what + " in " + describe(list), list);
        }
        return list.get(index);
    }

    private static void expectSize(SNode.SList node, int size) {
        if (node.size() != size) {
            throw new ParseException(node.tag() + " expects " + (size - 1) + " arguments but has " + (node.size() - 1), node);
        }
    }

    private static String describe(SNode.SList list) {
        String tag = list.tag();
        return tag.isEmpty() ? list.toString() : tag;
    }
}
