package nl.bytesoflife.deltasdf.analysis;

import nl.bytesoflife.deltasdf.model.*;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.*;

/**
 * Structural checks on a parsed or built {@link SdfFile}. Reports rather than
 * throws, so one pass lists every problem.
 */
public final class SdfValidator {

    private static final Logger log = LoggerFactory.getLogger(SdfValidator.class);

    private SdfValidator() {
    }

    /** @return every issue found, errors before warnings */
    public static List<LintIssue> validate(SdfFile sdf) {
        List<LintIssue> issues = new ArrayList<>();

        if (sdf.getHeader().getTimescale() == null) {
            issues.add(LintIssue.fileLevel(Severity.WARNING, "Missing timescale in header"));
        }
        if (sdf.getCells().isEmpty()) {
            issues.add(LintIssue.fileLevel(Severity.WARNING, "SDF file contains no cells"));
        }

        Map<String, List<String>> cellTypesByInstance = new LinkedHashMap<>();
        for (var cellEntry : sdf.getCells().entrySet()) {
            String cellType = cellEntry.getKey();
            for (var instanceEntry : cellEntry.getValue().entrySet()) {
                String instance = instanceEntry.getKey();
                cellTypesByInstance.computeIfAbsent(instance, k -> new ArrayList<>()).add(cellType);
                for (var e : instanceEntry.getValue().entrySet()) {
                    checkEntry(cellType, instance, e.getKey(), e.getValue(), issues);
                }
            }
        }

        cellTypesByInstance.forEach((instance, cellTypes) -> {
            if (cellTypes.size() > 1) {
                List<String> sorted = new ArrayList<>(cellTypes);
                Collections.sort(sorted);
                issues.add(new LintIssue(Severity.WARNING, "", instance, "",
                        "Instance '" + instance + "' appears under multiple cell types: " + String.join(", ", sorted)));
            }
        });

        // stable: keeps discovery order within a severity
        issues.sort(Comparator.comparing(LintIssue::getSeverity));
        log.debug("Validation found {} issues", issues.size());
        return issues;
    }

    private static void checkEntry(String cellType, String instance, String name, Entry entry, List<LintIssue> issues) {
        DelayPaths paths = entry.getDelayPaths();
        if (paths == null) {
            issues.add(new LintIssue(Severity.ERROR, cellType, instance, name,
                    "Entry has no delay paths"));
        }
        if (entry.getType() == EntryType.IOPATH || entry.getType() == EntryType.INTERCONNECT) {
            if (entry.getFromPin() == null) {
                issues.add(new LintIssue(Severity.ERROR, cellType, instance, name,
                        entry.getType().sdfName() + " entry is missing 'from_pin'"));
            }
            if (entry.getToPin() == null) {
                issues.add(new LintIssue(Severity.ERROR, cellType, instance, name,
                        entry.getType().sdfName() + " entry is missing 'to_pin'"));
            }
        }
        if (paths == null) {
            return;
        }
        for (DelayField field : DelayField.values()) {
            Values values = paths.get(field);
            if (values != null && values.isEmpty()) {
                issues.add(new LintIssue(Severity.WARNING, cellType, instance, name,
                        "Delay path '" + field.sdfName() + "' has no values (min, avg and max unset)"));
            }
        }
    }
}
