package nl.bytesoflife.deltasdf.model;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * One timing entry of a cell instance: a delay, a timing check or a path
 * constraint, discriminated by {@link EntryType}. All kinds share the same
 * field set; the kind decides which {@link DelayPaths} fields are meaningful.
 */
public final class Entry {

    private final EntryType type;
    private final String name;
    private final String fromPin;
    private final String toPin;
    private final EdgeType fromPinEdge;
    private final EdgeType toPinEdge;
    private final DelayPaths delayPaths;
    private final String condEquation;
    private final boolean timingCheck;
    private final boolean timingEnv;
    private final boolean absolute;
    private final boolean incremental;
    private final boolean cond;

    private Entry(Builder b) {
        this.type = Objects.requireNonNull(b.type, "type");
        this.name = b.name != null ? b.name : defaultName(b.type, b.fromPin, b.toPin);
        this.fromPin = b.fromPin;
        this.toPin = b.toPin;
        this.fromPinEdge = b.fromPinEdge;
        this.toPinEdge = b.toPinEdge;
        this.delayPaths = b.delayPaths;
        this.condEquation = b.condEquation;
        this.timingCheck = b.timingCheck;
        this.timingEnv = b.timingEnv;
        this.absolute = b.absolute;
        this.incremental = b.incremental;
        this.cond = b.cond;
    }

    // --- Factory helpers, one per kind ---

    public static Builder builder(EntryType type) {
        return new Builder(type);
    }

    public static Entry iopath(String fromPin, String toPin, DelayPaths paths) {
        return builder(EntryType.IOPATH).pins(fromPin, toPin).delayPaths(paths).build();
    }

    public static Entry interconnect(String fromPin, String toPin, DelayPaths paths) {
        return builder(EntryType.INTERCONNECT).pins(fromPin, toPin).delayPaths(paths).build();
    }

    public static Entry port(String pin, DelayPaths paths) {
        return builder(EntryType.PORT).pins(pin, pin).delayPaths(paths).build();
    }

    public static Entry device(String pin, DelayPaths paths) {
        return builder(EntryType.DEVICE).pins(pin, pin).delayPaths(paths).build();
    }

    public static Entry pathConstraint(String fromPin, String toPin, DelayPaths paths) {
        return builder(EntryType.PATHCONSTRAINT).pins(fromPin, toPin).delayPaths(paths).build();
    }

    /**
     * Creates a timing check of the given kind. WIDTH takes a single port, pass
     * it as both pins.
     *
     * @throws IllegalArgumentException if {@code type} is not a timing check kind
     */
    public static Entry timingCheck(EntryType type, String fromPin, String toPin, DelayPaths paths) {
        if (!type.isTimingCheck()) {
            throw new IllegalArgumentException("Unknown timing check type: " + type.sdfName());
        }
        return builder(type).pins(fromPin, toPin).delayPaths(paths).build();
    }

    /**
     * Creates an entry of any kind by its serialized type name.
     *
     * @throws IllegalArgumentException if the kind name is unknown
     */
    public static Entry create(String typeName, String fromPin, String toPin, DelayPaths paths) {
        return builder(EntryType.fromName(typeName)).pins(fromPin, toPin).delayPaths(paths).build();
    }

    /**
     * {@code kind_from_to} for two-pin entries, {@code kind_pin} for PORT and
     * DEVICE.
     */
    public static String defaultName(EntryType type, String fromPin, String toPin) {
        String prefix = type.sdfName();
        if (type == EntryType.PORT || type == EntryType.DEVICE) {
            return fromPin == null ? prefix : prefix + "_" + fromPin;
        }
        return prefix + "_" + fromPin + "_" + toPin;
    }

    // --- Accessors ---

    public EntryType getType() {
        return type;
    }

    public String getName() {
        return name;
    }

    public String getFromPin() {
        return fromPin;
    }

    public String getToPin() {
        return toPin;
    }

    public EdgeType getFromPinEdge() {
        return fromPinEdge;
    }

    public EdgeType getToPinEdge() {
        return toPinEdge;
    }

    public DelayPaths getDelayPaths() {
        return delayPaths;
    }

    public String getCondEquation() {
        return condEquation;
    }

    public boolean isTimingCheck() {
        return timingCheck;
    }

    public boolean isTimingEnv() {
        return timingEnv;
    }

    public boolean isAbsolute() {
        return absolute;
    }

    public boolean isIncremental() {
        return incremental;
    }

    public boolean isCond() {
        return cond;
    }

    public Entry withName(String newName) {
        return toBuilder().name(newName).build();
    }

    public Entry withDelayPaths(DelayPaths paths) {
        return toBuilder().delayPaths(paths).build();
    }

    public Builder toBuilder() {
        Builder b = new Builder(type);
        b.name = name;
        b.fromPin = fromPin;
        b.toPin = toPin;
        b.fromPinEdge = fromPinEdge;
        b.toPinEdge = toPinEdge;
        b.delayPaths = delayPaths;
        b.condEquation = condEquation;
        b.timingCheck = timingCheck;
        b.timingEnv = timingEnv;
        b.absolute = absolute;
        b.incremental = incremental;
        b.cond = cond;
        return b;
    }

    // --- Canonical map form ---

    public Map<String, Object> toMap() {
        Map<String, Object> map = new LinkedHashMap<>();
        map.put("name", name);
        map.put("type", type.sdfName());
        map.put("from_pin", fromPin);
        map.put("to_pin", toPin);
        map.put("from_pin_edge", fromPinEdge != null ? fromPinEdge.sdfName() : null);
        map.put("to_pin_edge", toPinEdge != null ? toPinEdge.sdfName() : null);
        map.put("delay_paths", delayPaths != null ? delayPaths.toMap() : null);
        map.put("cond_equation", condEquation);
        map.put("is_timing_check", timingCheck);
        map.put("is_timing_env", timingEnv);
        map.put("is_absolute", absolute);
        map.put("is_incremental", incremental);
        map.put("is_cond", cond);
        return map;
    }

    @SuppressWarnings("unchecked")
    public static Entry fromMap(Map<String, ?> map) {
        Builder b = builder(EntryType.fromName((String) map.get("type")))
                .name((String) map.get("name"))
                .pins((String) map.get("from_pin"), (String) map.get("to_pin"))
                .condEquation((String) map.get("cond_equation"))
                .timingCheck(flag(map, "is_timing_check"))
                .timingEnv(flag(map, "is_timing_env"))
                .absolute(flag(map, "is_absolute"))
                .incremental(flag(map, "is_incremental"))
                .cond(flag(map, "is_cond"));
        Object fromEdge = map.get("from_pin_edge");
        Object toEdge = map.get("to_pin_edge");
        b.edges(fromEdge != null ? EdgeType.fromSdfName((String) fromEdge) : null,
                toEdge != null ? EdgeType.fromSdfName((String) toEdge) : null);
        Object paths = map.get("delay_paths");
        if (paths != null) {
            b.delayPaths(DelayPaths.fromMap((Map<String, ?>) paths));
        }
        return b.build();
    }

    private static boolean flag(Map<String, ?> map, String key) {
        return Boolean.TRUE.equals(map.get(key));
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof Entry e)) return false;
        return type == e.type && name.equals(e.name)
                && Objects.equals(fromPin, e.fromPin) && Objects.equals(toPin, e.toPin)
                && fromPinEdge == e.fromPinEdge && toPinEdge == e.toPinEdge
                && Objects.equals(delayPaths, e.delayPaths) && Objects.equals(condEquation, e.condEquation)
                && timingCheck == e.timingCheck && timingEnv == e.timingEnv
                && absolute == e.absolute && incremental == e.incremental && cond == e.cond;
    }

    @Override
    public int hashCode() {
        return Objects.hash(type, name, fromPin, toPin, delayPaths);
    }

    @Override
    public String toString() {
        StringBuilder sb = new StringBuilder("Entry{").append(type.sdfName()).append(" '").append(name).append('\'');
        if (absolute) sb.append(", absolute");
        if (incremental) sb.append(", incremental");
        if (cond) sb.append(", cond='").append(condEquation).append('\'');
        sb.append(", ").append(delayPaths).append('}');
        return sb.toString();
    }

    /**
     * Mutable staging area for an entry. The timing-check and timing-env flags
     * default from the kind.
     */
    public static final class Builder {
        private final EntryType type;
        private String name;
        private String fromPin;
        private String toPin;
        private EdgeType fromPinEdge;
        private EdgeType toPinEdge;
        private DelayPaths delayPaths;
        private String condEquation;
        private boolean timingCheck;
        private boolean timingEnv;
        private boolean absolute;
        private boolean incremental;
        private boolean cond;

        private Builder(EntryType type) {
            this.type = type;
            this.timingCheck = type.isTimingCheck();
            this.timingEnv = type == EntryType.PATHCONSTRAINT;
        }

        public EntryType getType() {
            return type;
        }

        public boolean isCond() {
            return cond;
        }

        public Builder name(String name) {
            this.name = name;
            return this;
        }

        public Builder pins(String fromPin, String toPin) {
            this.fromPin = fromPin;
            this.toPin = toPin;
            return this;
        }

        public Builder edges(EdgeType fromPinEdge, EdgeType toPinEdge) {
            this.fromPinEdge = fromPinEdge;
            this.toPinEdge = toPinEdge;
            return this;
        }

        public Builder delayPaths(DelayPaths delayPaths) {
            this.delayPaths = delayPaths;
            return this;
        }

        public Builder condEquation(String condEquation) {
            this.condEquation = condEquation;
            return this;
        }

        /** Marks the entry conditional on {@code equation}. */
        public Builder condition(String equation) {
            this.cond = true;
            this.condEquation = equation;
            return this;
        }

        public Builder timingCheck(boolean timingCheck) {
            this.timingCheck = timingCheck;
            return this;
        }

        public Builder timingEnv(boolean timingEnv) {
            this.timingEnv = timingEnv;
            return this;
        }

        public Builder absolute(boolean absolute) {
            this.absolute = absolute;
            return this;
        }

        public Builder incremental(boolean incremental) {
            this.incremental = incremental;
            return this;
        }

        public Builder cond(boolean cond) {
            this.cond = cond;
            return this;
        }

        public Entry build() {
            return new Entry(this);
        }
    }
}
