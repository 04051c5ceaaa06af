package nl.bytesoflife.deltasdf.cli;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.ByteArrayOutputStream;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;

import static org.junit.jupiter.api.Assertions.*;

class SdfToolTest {

    private ByteArrayOutputStream buffer;
    private String chain;

    @BeforeEach
    void setUp() throws Exception {
        buffer = new ByteArrayOutputStream();
        chain = Path.of(getClass().getResource("/sdf/chain.sdf").toURI()).toString();
    }

    private int run(String... args) {
        return new SdfTool(new PrintStream(buffer, true, StandardCharsets.UTF_8)).run(args);
    }

    private String output() {
        return buffer.toString(StandardCharsets.UTF_8);
    }

    @Test
    void noArgumentsPrintsUsage() {
        assertEquals(SdfTool.EXIT_USAGE, run());
        assertTrue(output().contains("Usage: sdftool"));
    }

    @Test
    void unknownCommandIsUsageError() {
        assertEquals(SdfTool.EXIT_USAGE, run("simulate", chain));
        assertTrue(output().contains("Unknown command simulate"));
    }

    @Test
    void wrongArgumentCountIsUsageError() {
        assertEquals(SdfTool.EXIT_USAGE, run("critical", chain, "a/Y"));
        assertEquals(SdfTool.EXIT_USAGE, run("slack", chain, "a/Y", "d/Y", "soon"));
    }

    @Test
    void badOptionsAreUsageErrors() {
        assertEquals(SdfTool.EXIT_USAGE, run("stats", chain, "--field", "typical"));
        assertEquals(SdfTool.EXIT_USAGE, run("stats", chain, "--max-depth", "deep"));
        assertEquals(SdfTool.EXIT_USAGE, run("stats", chain, "--metric"));
        assertEquals(SdfTool.EXIT_USAGE, run("stats", chain, "--verbose", "yes"));
    }

    @Test
    void parseSummary() {
        assertEquals(SdfTool.EXIT_OK, run("parse", chain));
        String out = output();
        assertTrue(out.contains("BUF b: 1 entries"));
        assertTrue(out.contains("top <none>: 4 entries"));
        assertTrue(out.contains("Total: 4 cell types, 8 entries"));
    }

    @Test
    void validateCleanFile() {
        assertEquals(SdfTool.EXIT_OK, run("validate", chain));
        assertTrue(output().contains("0 error(s), 0 warning(s)"));
    }

    @Test
    void stats() {
        assertEquals(SdfTool.EXIT_OK, run("stats", chain, "--field", "fast", "--metric", "min"));
        assertTrue(output().contains("Delay min/max: 0.5000 / 1.0000"));
    }

    @Test
    void emitWithTimescaleOverride() {
        assertEquals(SdfTool.EXIT_OK, run("emit", chain, "--timescale", "1ns"));
        String out = output();
        assertTrue(out.startsWith("(DELAYFILE"));
        assertTrue(out.contains("(TIMESCALE 1ns)"));
        assertTrue(out.contains("(INTERCONNECT a/Y b/A (1:1:1) (1:1:1))"));
    }

    @Test
    void normalizeRescalesValues() {
        assertEquals(SdfTool.EXIT_OK, run("normalize", chain, "1ns"));
        String out = output();
        assertTrue(out.contains("(TIMESCALE 1ns)"));
        assertTrue(out.contains("(INTERCONNECT a/Y b/A (0.001:0.001:0.001) (0.001:0.001:0.001))"));
    }

    @Test
    void pathsAreRankedWorstFirst() {
        assertEquals(SdfTool.EXIT_OK, run("paths", chain, "a/Y", "d/Y"));
        String out = output();
        assertTrue(out.contains("#1 5.5: a/Y -> b/A -> b/Y -> d/A -> d/Y"));
        assertTrue(out.contains("#2 4: a/Y -> c/A -> c/Y -> d/B -> d/Y"));
    }

    @Test
    void criticalPath() {
        assertEquals(SdfTool.EXIT_OK, run("critical", chain, "a/Y", "d/Y"));
        assertTrue(output().contains("Critical path slow/max = 5.5"));
    }

    @Test
    void criticalPathHonoursMaxDepth() {
        assertEquals(SdfTool.EXIT_OK, run("critical", chain, "a/Y", "d/Y", "--max-depth", "3"));
        assertTrue(output().contains("No path from a/Y to d/Y"));
    }

    @Test
    void slack() {
        assertEquals(SdfTool.EXIT_OK, run("slack", chain, "a/Y", "d/Y", "10"));
        assertTrue(output().contains("Slack 4.5 (MET)"));
    }

    @Test
    void negativeSlackIsReportedAsViolation() {
        assertEquals(SdfTool.EXIT_OK, run("slack", chain, "a/Y", "d/Y", "5"));
        assertTrue(output().contains("Slack -0.5 (VIOLATED)"));
    }

    @Test
    void endpoints() {
        assertEquals(SdfTool.EXIT_OK, run("endpoints", chain));
        String out = output();
        assertTrue(out.contains("a/Y -> d/Y: 5.5 (2 paths)"));
        assertTrue(out.contains("1 connected pairs"));
    }

    @Test
    void unknownPinFails() {
        assertEquals(SdfTool.EXIT_FAILURE, run("critical", chain, "a/Y", "z/Q"));
        assertTrue(output().contains("Error: Unknown node: z/Q"));
    }

    @Test
    void missingFileFails(@TempDir Path dir) {
        assertEquals(SdfTool.EXIT_FAILURE, run("parse", dir.resolve("none.sdf").toString()));
        assertTrue(output().contains("Error: Cannot read SDF file"));
    }

    @Test
    void composeSumsEveryPath() {
        assertEquals(SdfTool.EXIT_OK, run("compose", chain, "a/Y", "d/Y"));
        String out = output();
        assertTrue(out.contains("a/Y -> b/A -> b/Y -> d/A -> d/Y: fast=3.5:4:4.5 slow=4.5:5:5.5"));
        assertTrue(out.contains("a/Y -> c/A -> c/Y -> d/B -> d/Y: fast=2.5:3:3.5 slow=3:3.5:4"));
    }

    @Test
    void composeWithoutPath() {
        assertEquals(SdfTool.EXIT_OK, run("compose", chain, "d/Y", "a/Y"));
        assertTrue(output().contains("No path from d/Y to a/Y"));
    }

    @Test
    void verifyPassesWhenOnePathMatches() {
        assertEquals(SdfTool.EXIT_OK, run("verify", chain, "a/Y", "d/Y",
                "--expected", "fast=2.5:3:3.5,slow=3:3.5:4"));
        String out = output();
        assertTrue(out.startsWith("PASS"));
        assertTrue(out.contains("Expected: fast=2.5:3:3.5 slow=3:3.5:4"));
        assertTrue(out.contains("Actual path 1: "));
        assertTrue(out.contains("Actual path 2: "));
    }

    @Test
    void verifyFailsOutsideTolerance() {
        assertEquals(SdfTool.EXIT_FAILURE, run("verify", chain, "a/Y", "d/Y",
                "--expected", "fast=2.5:3:3.6,slow=3:3.5:4"));
        assertTrue(output().startsWith("FAIL"));
    }

    @Test
    void verifyToleranceWidensTheMatch() {
        assertEquals(SdfTool.EXIT_OK, run("verify", chain, "a/Y", "d/Y",
                "--expected", "fast=2.5:3:3.6,slow=3:3.5:4", "--tolerance", "0.2"));
    }

    @Test
    void verifyNeedsExpectedDelay() {
        assertEquals(SdfTool.EXIT_USAGE, run("verify", chain, "a/Y", "d/Y"));
        assertTrue(output().contains("verify needs --expected"));
        buffer.reset();
        assertEquals(SdfTool.EXIT_USAGE, run("verify", chain, "a/Y", "d/Y", "--expected", "typical=1:2:3"));
        buffer.reset();
        assertEquals(SdfTool.EXIT_USAGE, run("verify", chain, "a/Y", "d/Y", "--expected", "slow"));
    }

    @Test
    void decomposeSubtractsKnownFromTotal() {
        assertEquals(SdfTool.EXIT_OK, run("decompose", "--total", "fast=4:5:6,slow=5:6:7",
                "--known", "slow=1:1.5:2"));
        assertEquals("slow=4:4.5:5", output().strip());
    }

    @Test
    void decomposeNeedsBothDelays() {
        assertEquals(SdfTool.EXIT_USAGE, run("decompose", "--total", "slow=5:6:7"));
        assertTrue(output().contains("decompose needs --total and --known"));
    }

    @Test
    void queryKeepsMatchingEntries() {
        assertEquals(SdfTool.EXIT_OK, run("query", chain, "--cell-type", "BUF", "--cell-type", "INV"));
        String out = output();
        assertTrue(out.startsWith("(DELAYFILE"));
        assertTrue(out.contains("(CELLTYPE \"BUF\")"));
        assertTrue(out.contains("(CELLTYPE \"INV\")"));
        assertFalse(out.contains("AND2"));
        assertFalse(out.contains("INTERCONNECT"));
    }

    @Test
    void queryByEntryTypeAndDelay() {
        assertEquals(SdfTool.EXIT_OK, run("query", chain, "--entry-type", "interconnect", "--min-delay", "1"));
        String out = output();
        assertTrue(out.contains("(INTERCONNECT a/Y b/A (1:1:1) (1:1:1))"));
        assertTrue(out.contains("(INTERCONNECT c/Y d/B (1:1:1) (1:1:1))"));
        assertFalse(out.contains("a/Y c/A"));
        assertFalse(out.contains("IOPATH"));
    }

    @Test
    void queryRejectsUnknownEntryType() {
        assertEquals(SdfTool.EXIT_USAGE, run("query", chain, "--entry-type", "wire"));
    }

    @Test
    void mergeCombinesFiles() {
        assertEquals(SdfTool.EXIT_OK, run("merge", chain, chain, "--strategy", "keep-first"));
        String out = output();
        assertTrue(out.startsWith("(DELAYFILE"));
        assertTrue(out.contains("(IOPATH A Y (1:1.5:2) (2:2.5:3))"));
    }

    @Test
    void mergeConflictUnderErrorStrategyFails() {
        assertEquals(SdfTool.EXIT_FAILURE, run("merge", chain, chain, "--strategy", "error"));
        assertTrue(output().contains("Error: Conflicting entry"));
    }

    @Test
    void mergeNeedsTwoFiles() {
        assertEquals(SdfTool.EXIT_USAGE, run("merge", chain));
        buffer.reset();
        assertEquals(SdfTool.EXIT_USAGE, run("merge", chain, chain, "--strategy", "newest"));
    }

    @Test
    void diffOfAFileWithItself() {
        assertEquals(SdfTool.EXIT_OK, run("diff", chain, chain));
        assertTrue(output().contains("Files are identical"));
        buffer.reset();
        assertEquals(SdfTool.EXIT_OK, run("diff", chain, chain, "--target-timescale", "1ns"));
        assertTrue(output().contains("Files are identical"));
    }

    @Test
    void diffReportsChangedValues(@TempDir Path dir) throws Exception {
        String changed = Files.readString(Path.of(chain))
                .replace("(IOPATH A Y (0.5:1.0:1.5) (1.0:1.5:2.0))", "(IOPATH A Y (0.5:1.0:1.5) (1.0:1.5:2.5))");
        Path other = Files.writeString(dir.resolve("changed.sdf"), changed);

        assertEquals(SdfTool.EXIT_OK, run("diff", chain, other.toString()));
        String out = output();
        assertTrue(out.contains("Value differences: 1"));
        assertTrue(out.contains("INV/c/iopath_A_Y slow.max: 2 -> 2.5 (delta 0.5)"));
    }

    @Test
    void dotExport() {
        assertEquals(SdfTool.EXIT_OK, run("dot", chain, "--highlight-source", "a/Y", "--highlight-sink", "d/Y",
                "--cluster"));
        String out = output();
        assertTrue(out.startsWith("digraph timing {"));
        assertTrue(out.contains("subgraph cluster_0 {"));
        assertTrue(out.contains("\"b/A\" -> \"b/Y\" [label=\"3.000\", color=\"red\", penwidth=2.0];"));
    }

    @Test
    void dotHighlightNeedsBothEnds() {
        assertEquals(SdfTool.EXIT_USAGE, run("dot", chain, "--highlight-source", "a/Y"));
    }
}
