package nl.bytesoflife.deltasdf.analysis;

import nl.bytesoflife.deltasdf.builder.SdfBuilder;
import nl.bytesoflife.deltasdf.model.*;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;

class SdfQueryTest {

    private static DelayPaths slow(double max) {
        return DelayPaths.builder().fast(Values.of(0, 0, 0)).slow(Values.of(0, 0, max)).build();
    }

    private final SdfFile sdf = new SdfBuilder()
            .design("top")
            .timescale("1ps")
            .cell("BUF", "b0")
                .iopath("A", "Y", slow(1))
            .cell("BUF", "b1")
                .iopath("A", "Y", slow(3))
            .cell("DFF", "ff0")
                .iopath("CK", "Q", slow(2))
                .setup("CK", "D", Values.of(1, 1, 1))
            .cell("top", "")
                .interconnect("b0/Y", "ff0/D", slow(0.5))
            .build();

    @Test
    void noCriteriaKeepsEverything() {
        SdfFile result = new SdfQuery().apply(sdf);
        assertEquals(sdf, result);
        assertNotSame(sdf.getHeader(), result.getHeader());
    }

    @Test
    void filterByCellTypeAndInstance() {
        SdfFile result = new SdfQuery()
                .withCellTypes(Set.of("BUF"))
                .withInstances(Set.of("b1"))
                .apply(sdf);

        assertEquals(List.of("BUF"), List.copyOf(result.getCells().keySet()));
        assertEquals(Set.of("b1"), result.getCells().get("BUF").keySet());
        assertEquals("top", result.getHeader().getDesign());
    }

    @Test
    void filterByEntryType() {
        SdfFile result = new SdfQuery().withEntryTypes(List.of(EntryType.SETUP)).apply(sdf);
        assertEquals(1, result.getEntryCount());
        assertTrue(result.getEntries("DFF", "ff0").containsKey("setup_CK_D"));
        assertFalse(result.getCells().containsKey("BUF"));

        assertEquals(0, new SdfQuery().withEntryTypes(List.of()).apply(sdf).getEntryCount());
    }

    @Test
    void pinPatternSearchesEitherPin() {
        SdfFile result = new SdfQuery().withPinPattern("ff0").apply(sdf);
        assertEquals(1, result.getEntryCount());
        assertTrue(result.getEntries("top", "").containsKey("interconnect_b0/Y_ff0/D"));

        SdfFile clocks = new SdfQuery().withPinPattern("^CK$").apply(sdf);
        assertEquals(2, clocks.getEntryCount());
    }

    @Test
    void delayRangeIsInclusive() {
        SdfFile result = new SdfQuery().withDelayRange(1.0, 2.0).apply(sdf);

        assertEquals(2, result.getEntryCount());
        assertTrue(result.getEntries("BUF", "b0").containsKey("iopath_A_Y"));
        assertTrue(result.getEntries("DFF", "ff0").containsKey("iopath_CK_Q"));
    }

    @Test
    void openEndedRangeAndOtherScalar() {
        assertEquals(1, new SdfQuery().withDelayRange(2.5, null).apply(sdf).getEntryCount());

        SdfFile nominal = new SdfQuery()
                .withScalar(DelayField.NOMINAL, Metric.MIN)
                .withDelayRange(null, 10.0)
                .apply(sdf);
        assertEquals(1, nominal.getEntryCount());
        assertTrue(nominal.getEntries("DFF", "ff0").containsKey("setup_CK_D"));
    }
}
