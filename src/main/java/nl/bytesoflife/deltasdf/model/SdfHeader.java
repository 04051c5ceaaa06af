package nl.bytesoflife.deltasdf.model;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * The metadata block of a DELAYFILE. Every field is an optional string;
 * {@code voltage} and {@code temperature} hold formatted triple text such as
 * {@code "1.8:1.8:1.8"} and {@code timescale} holds text such as {@code "1ps"}.
 */
public class SdfHeader {

    public static final String DEFAULT_DIVIDER = "/";

    /** Field names in the order they appear in a DELAYFILE. */
    public static final List<String> FIELD_NAMES = List.of(
            "sdfversion", "design", "date", "vendor", "program", "version",
            "divider", "voltage", "process", "temperature", "timescale");

    private String sdfversion;
    private String design;
    private String date;
    private String vendor;
    private String program;
    private String version;
    private String divider;
    private String voltage;
    private String process;
    private String temperature;
    private String timescale;

    public SdfHeader() {
    }

    public SdfHeader(SdfHeader other) {
        for (String field : FIELD_NAMES) {
            set(field, other.get(field));
        }
    }

    public String getSdfversion() {
        return sdfversion;
    }

    public void setSdfversion(String sdfversion) {
        this.sdfversion = sdfversion;
    }

    public String getDesign() {
        return design;
    }

    public void setDesign(String design) {
        this.design = design;
    }

    public String getDate() {
        return date;
    }

    public void setDate(String date) {
        this.date = date;
    }

    public String getVendor() {
        return vendor;
    }

    public void setVendor(String vendor) {
        this.vendor = vendor;
    }

    public String getProgram() {
        return program;
    }

    public void setProgram(String program) {
        this.program = program;
    }

    public String getVersion() {
        return version;
    }

    public void setVersion(String version) {
        this.version = version;
    }

    public String getDivider() {
        return divider;
    }

    public String getDividerOrDefault() {
        return divider != null ? divider : DEFAULT_DIVIDER;
    }

    public void setDivider(String divider) {
        this.divider = divider;
    }

    public String getVoltage() {
        return voltage;
    }

    public void setVoltage(String voltage) {
        this.voltage = voltage;
    }

    public String getProcess() {
        return process;
    }

    public void setProcess(String process) {
        this.process = process;
    }

    public String getTemperature() {
        return temperature;
    }

    public void setTemperature(String temperature) {
        this.temperature = temperature;
    }

    public String getTimescale() {
        return timescale;
    }

    public void setTimescale(String timescale) {
        this.timescale = timescale;
    }

    /**
     * Looks a field up by its lowercase name.
     *
     * @throws IllegalArgumentException if {@code field} is not a header field
     */
    public String get(String field) {
        return switch (field) {
            case "sdfversion" -> sdfversion;
            case "design" -> design;
            case "date" -> date;
            case "vendor" -> vendor;
            case "program" -> program;
            case "version" -> version;
            case "divider" -> divider;
            case "voltage" -> voltage;
            case "process" -> process;
            case "temperature" -> temperature;
            case "timescale" -> timescale;
            default -> throw new IllegalArgumentException("Unknown header field: " + field);
        };
    }

    public void set(String field, String value) {
        switch (field) {
            case "sdfversion" -> sdfversion = value;
            case "design" -> design = value;
            case "date" -> date = value;
            case "vendor" -> vendor = value;
            case "program" -> program = value;
            case "version" -> version = value;
            case "divider" -> divider = value;
            case "voltage" -> voltage = value;
            case "process" -> process = value;
            case "temperature" -> temperature = value;
            case "timescale" -> timescale = value;
            default -> throw new IllegalArgumentException("Unknown header field: " + field);
        }
    }

    /** Set fields only, in DELAYFILE order. */
    public Map<String, Object> toMap() {
        Map<String, Object> map = new LinkedHashMap<>();
        for (String field : FIELD_NAMES) {
            String value = get(field);
            if (value != null) {
                map.put(field, value);
            }
        }
        return map;
    }

    public static SdfHeader fromMap(Map<String, ?> map) {
        SdfHeader header = new SdfHeader();
        for (Map.Entry<String, ?> e : map.entrySet()) {
            if (e.getValue() != null) {
                header.set(e.getKey(), e.getValue().toString());
            }
        }
        return header;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof SdfHeader other)) return false;
        return toMap().equals(other.toMap());
    }

    @Override
    public int hashCode() {
        return toMap().hashCode();
    }

    @Override
    public String toString() {
        return "SdfHeader" + toMap();
    }
}
