package nl.bytesoflife.deltasdf.analysis;

/**
 * One finding of {@link SdfValidator}. Location fields are empty strings for
 * file-level findings.
 */
public class LintIssue {

    private final Severity severity;
    private final String cellType;
    private final String instance;
    private final String entryName;
    private final String message;

    public LintIssue(Severity severity, String cellType, String instance, String entryName, String message) {
        this.severity = severity;
        this.cellType = cellType;
        this.instance = instance;
        this.entryName = entryName;
        this.message = message;
    }

    static LintIssue fileLevel(Severity severity, String message) {
        return new LintIssue(severity, "", "", "", message);
    }

    public Severity getSeverity() { return severity; }
    public String getCellType() { return cellType; }
    public String getInstance() { return instance; }
    public String getEntryName() { return entryName; }
    public String getMessage() { return message; }

    @Override
    public String toString() {
        StringBuilder sb = new StringBuilder();
        sb.append("[").append(severity).append("] ");
        if (!cellType.isEmpty() || !instance.isEmpty() || !entryName.isEmpty()) {
            sb.append(cellType).append('/').append(instance);
            if (!entryName.isEmpty()) {
                sb.append('/').append(entryName);
            }
            sb.append(": ");
        }
        sb.append(message);
        return sb.toString();
    }
}
