package nl.bytesoflife.deltasdf.builder;

import nl.bytesoflife.deltasdf.model.SdfFile;
import nl.bytesoflife.deltasdf.model.SdfHeader;

/**
 * Fluent construction of an {@link SdfFile} without going through SDF text.
 * <pre>
 * SdfFile sdf = new SdfBuilder()
 *         .sdfVersion("3.0")
 *         .timescale("1ps")
 *         .cell("BUF", "buf0")
 *             .iopath("A", "Y", DelayPaths.ofNominal(Values.of(1, 2, 3)))
 *         .build();
 * </pre>
 * {@link #build()} returns a copy, so a builder can keep growing after it has
 * produced a file.
 */
public class SdfBuilder {

    private final SdfFile file = new SdfFile(new SdfHeader());

    /**
     * @throws IllegalArgumentException if {@code field} is not a header field name
     */
    public SdfBuilder header(String field, String value) {
        file.getHeader().set(field, value);
        return this;
    }

    public SdfBuilder sdfVersion(String sdfVersion) {
        return header("sdfversion", sdfVersion);
    }

    public SdfBuilder design(String design) {
        return header("design", design);
    }

    public SdfBuilder divider(String divider) {
        return header("divider", divider);
    }

    public SdfBuilder timescale(String timescale) {
        return header("timescale", timescale);
    }

    /** Starts (or resumes) adding entries to one cell instance. */
    public CellBuilder cell(String cellType, String instance) {
        file.addCell(cellType, instance);
        return new CellBuilder(this, cellType, instance);
    }

    SdfFile target() {
        return file;
    }

    public SdfFile build() {
        return file.copy();
    }
}
