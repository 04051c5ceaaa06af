package nl.bytesoflife.deltasdf.writer;

import nl.bytesoflife.deltasdf.builder.SdfBuilder;
import nl.bytesoflife.deltasdf.model.*;
import nl.bytesoflife.deltasdf.parser.SdfParser;
import org.junit.jupiter.api.Test;

import java.io.InputStream;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class SdfWriterTest {

    private final SdfParser parser = new SdfParser();

    private SdfFile loadFixture(String name) throws Exception {
        try (InputStream in = getClass().getResourceAsStream("/sdf/" + name)) {
            assertNotNull(in);
            return parser.parse(in);
        }
    }

    @Test
    void fullFixtureReadsBackEqual() throws Exception {
        SdfFile original = loadFixture("full.sdf");

        String text = new SdfWriter().emit(original);
        SdfFile reparsed = parser.parse(text);

        assertEquals(original, reparsed);
    }

    @Test
    void chainFixtureReadsBackEqual() throws Exception {
        SdfFile original = loadFixture("chain.sdf");
        assertEquals(original, parser.parse(new SdfWriter().emit(original)));
    }

    @Test
    void headerLayout() {
        SdfFile sdf = new SdfBuilder()
                .sdfVersion("3.0")
                .design("top")
                .divider(".")
                .timescale("1ns")
                .build();

        String text = new SdfWriter().emit(sdf);

        assertEquals("""
                (DELAYFILE
                  (SDFVERSION "3.0")
                  (DESIGN "top")
                  (DIVIDER .)
                  (TIMESCALE 1ns)
                )
                """, text);
    }

    @Test
    void missingTimescaleDefaultsToPicoseconds() {
        String text = new SdfWriter().emit(new SdfFile());
        assertTrue(text.contains("(TIMESCALE 1ps)"));
    }

    @Test
    void explicitTimescaleDoesNotRescaleValues() {
        SdfFile sdf = new SdfBuilder()
                .timescale("1ns")
                .cell("BUF", "b0")
                    .iopath("A", "Y", DelayPaths.ofNominal(Values.of(1, 2, 3)))
                .build();

        String text = new SdfWriter().emit(sdf, "1ps");

        assertTrue(text.contains("(TIMESCALE 1ps)"));
        assertTrue(text.contains("(IOPATH A Y (1:2:3))"));
    }

    @Test
    void cellLayout() {
        SdfFile sdf = new SdfBuilder()
                .cell("buf", "b0")
                    .iopath(EdgeType.POSEDGE, "A", "Y", DelayPaths.builder()
                            .fast(Values.of(1, 2, 3))
                            .slow(Values.of(4, 5, 6))
                            .build())
                    .setup("CK", "D", Values.ofAvg(0.5))
                .build();

        String text = new SdfWriter().withUppercaseCelltype(true).emit(sdf);

        assertTrue(text.contains("""
                  (CELL
                    (CELLTYPE "BUF")
                    (INSTANCE b0)
                    (DELAY
                      (ABSOLUTE
                        (IOPATH (posedge A) Y (1:2:3) (4:5:6))
                      )
                    )
                    (TIMINGCHECK
                      (SETUP D CK (:0.5:))
                    )
                  )
                """), text);
    }

    @Test
    void conditionalEntries() {
        SdfFile sdf = new SdfBuilder()
                .cell("MUX", "m0")
                    .entry(Entry.builder(EntryType.IOPATH)
                            .pins("A", "Y")
                            .delayPaths(DelayPaths.ofNominal(Values.of(1, 1, 1)))
                            .incremental(true)
                            .condition("S == 1'b0")
                            .build())
                .build();

        String text = new SdfWriter().emit(sdf);

        assertTrue(text.contains("(INCREMENT"));
        assertTrue(text.contains("(COND S == 1'b0 (IOPATH A Y (1:1:1)))"));
        assertEquals(sdf.getEntries("MUX", "m0"), parser.parse(text).getEntries("MUX", "m0"));
    }

    @Test
    void delaysWithoutAbsoluteOrIncrementAreNotWritten() {
        SdfFile sdf = new SdfFile();
        sdf.store("BUF", "b0", Entry.iopath("A", "Y", DelayPaths.ofNominal(Values.of(1, 1, 1))));

        String text = new SdfWriter().emit(sdf);

        assertFalse(text.contains("IOPATH"));
        assertTrue(text.contains("(INSTANCE b0)"));
    }

    @Test
    void quotedHeaderValuesAreEscaped() {
        SdfFile sdf = new SdfBuilder().design("say \"hi\"").build();
        String text = new SdfWriter().emit(sdf);
        assertTrue(text.contains("(DESIGN \"say \\\"hi\\\"\")"));
        assertEquals("say \"hi\"", parser.parse(text).getHeader().getDesign());
    }

    @Test
    void delayListShapes() {
        assertEquals("(1:1:1)", SdfWriter.delayList(DelayPaths.ofNominal(Values.of(1, 1, 1))));
        assertEquals("()", SdfWriter.delayList(DelayPaths.ofNominal(Values.empty())));
        assertEquals("(1::) (:2:) (::3)", SdfWriter.delayList(DelayPaths.builder()
                .fast(new Values(1.0, null, null))
                .nominal(new Values(null, 2.0, null))
                .slow(new Values(null, null, 3.0))
                .build()));
        assertEquals("() (4:5:6)", SdfWriter.delayList(DelayPaths.builder().slow(Values.of(4, 5, 6)).build()));
        assertEquals("(1:2:3) ()", SdfWriter.delayList(DelayPaths.builder().fast(Values.of(1, 2, 3)).build()));
        assertEquals("() (:2:) (4:5:6)", SdfWriter.delayList(DelayPaths.builder()
                .nominal(Values.ofAvg(2))
                .slow(Values.of(4, 5, 6))
                .build()));
    }

    @Test
    void slowOnlyAndFastOnlyDelaysSurviveRoundTrip() {
        SdfFile sdf = new SdfBuilder()
                .timescale("1ps")
                .cell("BUF", "b0")
                    .iopath("A", "Y", DelayPaths.builder().slow(Values.of(1, 2, 3)).build())
                    .iopath("B", "Y", DelayPaths.builder().fast(Values.of(0.5, 1, 1.5)).build())
                .build();

        Map<String, Entry> reread = parser.parse(new SdfWriter().emit(sdf)).getEntries("BUF", "b0");

        DelayPaths slowOnly = reread.get("iopath_A_Y").getDelayPaths();
        assertEquals(Values.of(1, 2, 3), slowOnly.getSlow());
        assertTrue(slowOnly.getFast().isEmpty());
        assertFalse(slowOnly.isSet(DelayField.NOMINAL));
        assertEquals(3.0, slowOnly.getScalar(DelayField.SLOW, Metric.MAX));

        DelayPaths fastOnly = reread.get("iopath_B_Y").getDelayPaths();
        assertEquals(Values.of(0.5, 1, 1.5), fastOnly.getFast());
        assertTrue(fastOnly.getSlow().isEmpty());
    }

    @Test
    void numberedKeysKeepTheirSuffixesOnRoundTrip() {
        SdfFile sdf = new SdfFile();
        sdf.getHeader().setTimescale("1ps");
        for (int i = 0; i < 12; i++) {
            sdf.store("BUF", "b0", Entry.builder(EntryType.IOPATH)
                    .pins("A", "Y")
                    .delayPaths(DelayPaths.ofNominal(Values.ofAvg(i)))
                    .absolute(true)
                    .build());
        }

        SdfFile reparsed = parser.parse(new SdfWriter().emit(sdf));

        assertEquals(sdf.getEntries("BUF", "b0"), reparsed.getEntries("BUF", "b0"));
        assertEquals(Values.ofAvg(10), reparsed.getEntries("BUF", "b0").get("iopath_A_Y_10").getDelayPaths().getNominal());
    }

    @Test
    void keyOrderComparesSuffixesNumerically() {
        List<String> keys = new ArrayList<>(List.of("iopath_A_Y_10", "iopath_A_Y_2", "iopath_A_Y", "iopath_A_Y_1"));
        keys.sort(SdfWriter.KEY_ORDER);
        assertEquals(List.of("iopath_A_Y", "iopath_A_Y_1", "iopath_A_Y_2", "iopath_A_Y_10"), keys);
    }
}
