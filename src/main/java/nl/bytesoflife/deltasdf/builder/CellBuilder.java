package nl.bytesoflife.deltasdf.builder;

import nl.bytesoflife.deltasdf.model.*;

/**
 * Adds entries to one cell instance of an {@link SdfBuilder}. Entries whose
 * name is already taken are stored as {@code name_1}, {@code name_2}, ...
 * <p>
 * Use {@link #entry(Entry)} for incremental or conditional delays.
 */
public class CellBuilder {

    private final SdfBuilder parent;
    private final String cellType;
    private final String instance;

    CellBuilder(SdfBuilder parent, String cellType, String instance) {
        this.parent = parent;
        this.cellType = cellType;
        this.instance = instance;
    }

    public CellBuilder entry(Entry entry) {
        parent.target().store(cellType, instance, entry);
        return this;
    }

    public CellBuilder iopath(String fromPin, String toPin, DelayPaths paths) {
        return delay(Entry.builder(EntryType.IOPATH).pins(fromPin, toPin), paths);
    }

    public CellBuilder iopath(EdgeType fromEdge, String fromPin, String toPin, DelayPaths paths) {
        return delay(Entry.builder(EntryType.IOPATH).pins(fromPin, toPin).edges(fromEdge, null), paths);
    }

    public CellBuilder interconnect(String fromPin, String toPin, DelayPaths paths) {
        return delay(Entry.builder(EntryType.INTERCONNECT).pins(fromPin, toPin), paths);
    }

    public CellBuilder port(String pin, DelayPaths paths) {
        return delay(Entry.builder(EntryType.PORT).pins(pin, pin), paths);
    }

    public CellBuilder device(String pin, DelayPaths paths) {
        return delay(Entry.builder(EntryType.DEVICE).pins(pin, pin), paths);
    }

    // SDF has no delay outside ABSOLUTE or INCREMENT; builder delays are absolute
    private CellBuilder delay(Entry.Builder builder, DelayPaths paths) {
        return entry(builder.delayPaths(paths).absolute(true).build());
    }

    /**
     * @throws IllegalArgumentException if {@code type} is not a timing check kind
     */
    public CellBuilder timingCheck(EntryType type, String fromPin, String toPin, DelayPaths paths) {
        return entry(Entry.timingCheck(type, fromPin, toPin, paths));
    }

    public CellBuilder setup(String fromPin, String toPin, Values value) {
        return timingCheck(EntryType.SETUP, fromPin, toPin, DelayPaths.ofNominal(value));
    }

    public CellBuilder hold(String fromPin, String toPin, Values value) {
        return timingCheck(EntryType.HOLD, fromPin, toPin, DelayPaths.ofNominal(value));
    }

    public CellBuilder removal(String fromPin, String toPin, Values value) {
        return timingCheck(EntryType.REMOVAL, fromPin, toPin, DelayPaths.ofNominal(value));
    }

    public CellBuilder recovery(String fromPin, String toPin, Values value) {
        return timingCheck(EntryType.RECOVERY, fromPin, toPin, DelayPaths.ofNominal(value));
    }

    public CellBuilder width(String pin, Values value) {
        return timingCheck(EntryType.WIDTH, pin, pin, DelayPaths.ofNominal(value));
    }

    public CellBuilder setupHold(String fromPin, String toPin, Values setup, Values hold) {
        return timingCheck(EntryType.SETUPHOLD, fromPin, toPin, DelayPaths.builder().setup(setup).hold(hold).build());
    }

    public CellBuilder pathConstraint(String fromPin, String toPin, Values rise, Values fall) {
        return entry(Entry.pathConstraint(fromPin, toPin, DelayPaths.builder().rise(rise).fall(fall).build()));
    }

    public CellBuilder cell(String cellType, String instance) {
        return parent.cell(cellType, instance);
    }

    public SdfBuilder header(String field, String value) {
        return parent.header(field, value);
    }

    public SdfFile build() {
        return parent.build();
    }
}
