package nl.bytesoflife.deltasdf.parser;

/**
 * Malformed SDF input. Line and column are 1-based.
 */
public class ParseException extends RuntimeException {

    private final int line;
    private final int column;

    public ParseException(String message, int line, int column) {
        super(format(message, line, column));
        this.line = line;
        this.column = column;
    }

    public ParseException(String message, int line, int column, Throwable cause) {
        super(format(message, line, column), cause);
        this.line = line;
        this.column = column;
    }

    public ParseException(String message, SNode node) {
        this(message, node.line(), node.column());
    }

    public ParseException(String message, SNode node, Throwable cause) {
        this(message, node.line(), node.column(), cause);
    }

    private static String format(String message, int line, int column) {
        return "SDF parsing failed at " + line + ":" + column + " - " + message;
    }

    public int getLine() {
        return line;
    }

    public int getColumn() {
        return column;
    }
}
