package nl.bytesoflife.deltasdf.analysis;

import nl.bytesoflife.deltasdf.builder.SdfBuilder;
import nl.bytesoflife.deltasdf.model.*;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class SdfValidatorTest {

    private static final DelayPaths NOMINAL = DelayPaths.ofNominal(Values.of(1, 2, 3));

    @Test
    void cleanFileHasNoIssues() {
        SdfFile sdf = new SdfBuilder()
                .timescale("1ps")
                .cell("BUF", "b0")
                    .iopath("A", "Y", NOMINAL)
                .build();
        assertTrue(SdfValidator.validate(sdf).isEmpty());
    }

    @Test
    void emptyFileWarnsAboutTimescaleAndCells() {
        List<LintIssue> issues = SdfValidator.validate(new SdfFile());

        assertEquals(2, issues.size());
        assertEquals("Missing timescale in header", issues.get(0).getMessage());
        assertEquals("SDF file contains no cells", issues.get(1).getMessage());
        issues.forEach(issue -> assertEquals(Severity.WARNING, issue.getSeverity()));
        assertEquals("[WARNING] Missing timescale in header", issues.get(0).toString());
    }

    @Test
    void missingDelayPathsIsAnError() {
        SdfFile sdf = new SdfFile();
        sdf.getHeader().setTimescale("1ps");
        sdf.store("BUF", "b0", Entry.iopath("A", "Y", null));

        List<LintIssue> issues = SdfValidator.validate(sdf);

        assertEquals(1, issues.size());
        LintIssue issue = issues.get(0);
        assertEquals(Severity.ERROR, issue.getSeverity());
        assertEquals("BUF", issue.getCellType());
        assertEquals("b0", issue.getInstance());
        assertEquals("iopath_A_Y", issue.getEntryName());
        assertEquals("Entry has no delay paths", issue.getMessage());
        assertEquals("[ERROR] BUF/b0/iopath_A_Y: Entry has no delay paths", issue.toString());
    }

    @Test
    void missingDelayPathsAndPinsAreAllReported() {
        SdfFile sdf = new SdfFile();
        sdf.getHeader().setTimescale("1ps");
        sdf.store("BUF", "b0", Entry.iopath(null, null, null));

        List<LintIssue> issues = SdfValidator.validate(sdf);

        assertEquals(List.of(
                "Entry has no delay paths",
                "iopath entry is missing 'from_pin'",
                "iopath entry is missing 'to_pin'"), issues.stream().map(LintIssue::getMessage).toList());
        issues.forEach(issue -> assertEquals(Severity.ERROR, issue.getSeverity()));
    }

    @Test
    void missingPinsOnPathEntries() {
        SdfFile sdf = new SdfFile();
        sdf.getHeader().setTimescale("1ps");
        sdf.store("top", "", Entry.interconnect(null, "b0/A", NOMINAL));
        sdf.store("BUF", "b0", Entry.iopath("A", null, NOMINAL));
        sdf.store("BUF", "b0", Entry.builder(EntryType.DEVICE).delayPaths(NOMINAL).build());

        List<LintIssue> issues = SdfValidator.validate(sdf);

        assertEquals(2, issues.size());
        assertEquals("interconnect entry is missing 'from_pin'", issues.get(0).getMessage());
        assertEquals("iopath entry is missing 'to_pin'", issues.get(1).getMessage());
    }

    @Test
    void emptyTripleIsAWarning() {
        SdfFile sdf = new SdfBuilder()
                .timescale("1ps")
                .cell("BUF", "b0")
                    .iopath("A", "Y", DelayPaths.builder()
                            .fast(Values.of(1, 1, 1))
                            .slow(Values.empty())
                            .build())
                .build();

        List<LintIssue> issues = SdfValidator.validate(sdf);

        assertEquals(1, issues.size());
        assertEquals(Severity.WARNING, issues.get(0).getSeverity());
        assertEquals("Delay path 'slow' has no values (min, avg and max unset)", issues.get(0).getMessage());
    }

    @Test
    void instanceUnderSeveralCellTypes() {
        SdfFile sdf = new SdfBuilder()
                .timescale("1ps")
                .cell("INV", "u1").iopath("A", "Y", NOMINAL)
                .cell("BUF", "u1").iopath("A", "Y", NOMINAL)
                .build();

        List<LintIssue> issues = SdfValidator.validate(sdf);

        assertEquals(1, issues.size());
        assertEquals("u1", issues.get(0).getInstance());
        assertEquals("Instance 'u1' appears under multiple cell types: BUF, INV", issues.get(0).getMessage());
    }

    @Test
    void errorsComeBeforeWarnings() {
        SdfFile sdf = new SdfFile();
        sdf.store("BUF", "b0", Entry.iopath("A", "Y", null));

        List<LintIssue> issues = SdfValidator.validate(sdf);

        assertEquals(2, issues.size());
        assertEquals(Severity.ERROR, issues.get(0).getSeverity());
        assertEquals(Severity.WARNING, issues.get(1).getSeverity());
    }
}
