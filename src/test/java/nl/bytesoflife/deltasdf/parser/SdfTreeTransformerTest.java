package nl.bytesoflife.deltasdf.parser;

import nl.bytesoflife.deltasdf.model.*;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class SdfTreeTransformerTest {

    private static SdfFile transform(String text) {
        return new SdfTreeTransformer().transform(new SExpressionParser().parse(text));
    }

    private static String cell(String delay) {
        return """
                (DELAYFILE
                  (CELL (CELLTYPE "INV") (INSTANCE u1)
                    (DELAY (ABSOLUTE %s))))
                """.formatted(delay);
    }

    private static DelayPaths onlyEntry(SdfFile sdf) {
        Map<String, Entry> entries = sdf.getEntries("INV", "u1");
        assertEquals(1, entries.size());
        return entries.values().iterator().next().getDelayPaths();
    }

    @Test
    void oneTripleIsNominal() {
        DelayPaths paths = onlyEntry(transform(cell("(IOPATH A Y (1:2:3))")));
        assertEquals(Values.of(1, 2, 3), paths.getNominal());
        assertFalse(paths.isSet(DelayField.FAST));
    }

    @Test
    void twoTriplesAreFastAndSlow() {
        DelayPaths paths = onlyEntry(transform(cell("(IOPATH A Y (1:2:3) (4:5:6))")));
        assertEquals(Values.of(1, 2, 3), paths.getFast());
        assertEquals(Values.of(4, 5, 6), paths.getSlow());
        assertFalse(paths.isSet(DelayField.NOMINAL));
    }

    @Test
    void threeTriplesAreFastNominalSlow() {
        DelayPaths paths = onlyEntry(transform(cell("(IOPATH A Y (1:1:1) (2:2:2) (3:3:3))")));
        assertEquals(Values.of(1, 1, 1), paths.getFast());
        assertEquals(Values.of(2, 2, 2), paths.getNominal());
        assertEquals(Values.of(3, 3, 3), paths.getSlow());
    }

    @Test
    void otherTripleCountsLeaveEmptyNominal() {
        DelayPaths paths = onlyEntry(transform(cell(
                "(IOPATH A Y (1:1:1) (2:2:2) (3:3:3) (4:4:4) (5:5:5) (6:6:6))")));
        assertTrue(paths.getNominal().isEmpty());
        assertFalse(paths.isSet(DelayField.FAST));
        assertFalse(paths.isSet(DelayField.SLOW));
    }

    @Test
    void bareValueAndEmptyParentheses() {
        DelayPaths bare = onlyEntry(transform(cell("(IOPATH A Y (0.5))")));
        assertEquals(Values.ofAvg(0.5), bare.getNominal());

        DelayPaths empty = onlyEntry(transform(cell("(IOPATH A Y ())")));
        assertTrue(empty.getNominal().isEmpty());
    }

    @Test
    void spacedTripleReadsLikeCompactOne() {
        DelayPaths paths = onlyEntry(transform(cell("(IOPATH A Y (1.0 : 2.0 : 3.0))")));
        assertEquals(Values.of(1, 2, 3), paths.getNominal());
    }

    @Test
    void numbersWithoutColonBetweenThemAreRejected() {
        ParseException e = assertThrows(ParseException.class, () -> transform(cell("(IOPATH A Y (1 2))")));
        assertEquals(3, e.getLine());
        assertThrows(ParseException.class, () -> transform(cell("(IOPATH A Y (1 2 : 3 : 4))")));
        assertThrows(ParseException.class, () -> transform("(DELAYFILE (VOLTAGE 1 8))"));
    }

    @Test
    void splitColonsStillJoin() {
        DelayPaths paths = onlyEntry(transform(cell("(IOPATH A Y (1: 2 :3))")));
        assertEquals(Values.of(1, 2, 3), paths.getNominal());

        SdfFile sdf = transform("(DELAYFILE (VOLTAGE 1.1 : 1.2 : 1.3) (TEMPERATURE 25))");
        assertEquals("1.1:1.2:1.3", sdf.getHeader().getVoltage());
        assertEquals(":25:", sdf.getHeader().getTemperature());
    }

    @Test
    void nonSdfNumberFormsAreRejected() {
        assertThrows(ParseException.class, () -> transform(cell("(IOPATH A Y (1.5f))")));
        assertThrows(ParseException.class, () -> transform(cell("(IOPATH A Y (2d:3:4))")));
        assertThrows(ParseException.class, () -> transform(cell("(IOPATH A Y (0x10))")));
        assertThrows(ParseException.class, () -> transform(cell("(IOPATH A Y (Infinity))")));
    }

    @Test
    void condCheckKeepsItsCondition() {
        SdfFile sdf = transform("""
                (DELAYFILE
                  (CELL (CELLTYPE "DFF") (INSTANCE f)
                    (TIMINGCHECK (COND EN (SETUP D (posedge CK) (1))))))
                """);
        Entry entry = sdf.getEntries("DFF", "f").get("setup_CK_D");
        assertEquals("EN", entry.getCondEquation());
    }

    @Test
    void condPortInsideCondCheckIsRejected() {
        ParseException e = assertThrows(ParseException.class, () -> transform("""
                (DELAYFILE
                  (CELL (CELLTYPE "DFF") (INSTANCE f)
                    (TIMINGCHECK (COND EN (SETUP D (COND RST (posedge CK)) (1))))))
                """));
        assertTrue(e.getMessage().contains("COND"));
    }

    @Test
    void keywordsAreCaseInsensitive() {
        SdfFile sdf = transform("""
                (delayfile (timescale 100 ps)
                  (cell (celltype "INV") (instance u1)
                    (delay (absolute (iopath A Y (1:2:3))))))
                """);
        assertEquals("100ps", sdf.getHeader().getTimescale());
        assertTrue(sdf.getEntries("INV", "u1").containsKey("iopath_A_Y"));
    }

    @Test
    void condWithQuotedNameDropsTheName() {
        SdfFile sdf = transform(cell("(COND \"sel_high\" S == 1 (IOPATH A Y (1:2:3)))"));
        Entry entry = sdf.getEntries("INV", "u1").get("iopath_A_Y");
        assertTrue(entry.isCond());
        assertEquals("S == 1", entry.getCondEquation());
    }

    @Test
    void condWrappingSeveralDelays() {
        SdfFile sdf = transform(cell("(COND !S (IOPATH A Y (1:1:1)) (IOPATH B Y (2:2:2)))"));
        Map<String, Entry> entries = sdf.getEntries("INV", "u1");
        assertEquals(List.of("iopath_A_Y", "iopath_B_Y"), List.copyOf(entries.keySet()));
        entries.values().forEach(e -> assertEquals("! S", e.getCondEquation()));
    }

    @Test
    void cellWithoutEntriesIsKept() {
        SdfFile sdf = transform("(DELAYFILE (CELL (CELLTYPE \"FILL\") (INSTANCE f0)))");
        assertTrue(sdf.getCells().get("FILL").containsKey("f0"));
        assertEquals(0, sdf.getEntryCount());
    }

    @Test
    void missingHeaderValueIsEmptyString() {
        SdfFile sdf = transform("(DELAYFILE (SDFVERSION) (DESIGN \"x\"))");
        assertEquals("", sdf.getHeader().getSdfversion());
        assertNull(sdf.getHeader().getTimescale());
    }

    @Test
    void transformerIsSingleUse() {
        SdfTreeTransformer transformer = new SdfTreeTransformer();
        List<SNode> nodes = new SExpressionParser().parse("(DELAYFILE)");
        transformer.transform(nodes);
        assertThrows(IllegalStateException.class, () -> transformer.transform(nodes));
    }

    @Test
    void unsupportedConstructReportsPosition() {
        ParseException e = assertThrows(ParseException.class, () -> transform("""
                (DELAYFILE
                  (CELL (CELLTYPE "INV") (INSTANCE u1)
                    (DELAY (ABSOLUTE
                      (PATHPULSE A Y (1) (2))))))
                """));
        assertEquals(4, e.getLine());
        assertEquals(7, e.getColumn());
        assertTrue(e.getMessage().contains("PATHPULSE"));
    }

    @Test
    void rejectsMalformedStructure() {
        assertThrows(ParseException.class, () -> transform(""));
        assertThrows(ParseException.class, () -> transform("(SDFVERSION \"3.0\")"));
        assertThrows(ParseException.class, () -> transform("(DELAYFILE)(DELAYFILE)"));
        assertThrows(ParseException.class, () -> transform("(DELAYFILE (CELL (INSTANCE u1)))"));
        assertThrows(ParseException.class, () -> transform(cell("(IOPATH A Y (1:2))")));
        assertThrows(ParseException.class, () -> transform(
                "(DELAYFILE (CELL (CELLTYPE \"DFF\") (INSTANCE f) (TIMINGCHECK (SETUP D CK))))"));
        assertThrows(ParseException.class, () -> transform("(DELAYFILE (TIMESCALE fast))"));
    }
}
