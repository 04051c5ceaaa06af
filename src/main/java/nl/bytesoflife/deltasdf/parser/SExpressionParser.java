package nl.bytesoflife.deltasdf.parser;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;

/**
 * Reads SDF text into a list of {@link SNode} trees. Knows nothing about SDF
 * keywords; only parentheses, atoms, quoted strings and comments.
 * <p>
 * Not thread-safe; create one per input.
 */
public class SExpressionParser {

    private String input;
    private int pos;
    private int[] lineStarts;

    public List<SNode> parse(String text) {
        this.input = text;
        this.pos = 0;
        this.lineStarts = computeLineStarts(text);
        List<SNode> nodes = new ArrayList<>();
        while (pos < input.length()) {
            skipWhitespaceAndComments();
            if (pos >= input.length()) break;
            if (input.charAt(pos) == '(') {
                nodes.add(parseList());
            } else {
                throw error("Unexpected content outside of a list: '" + input.charAt(pos) + "'", pos);
            }
        }
        return nodes;
    }

    private SNode.SList parseList() {
        int start = pos;
        expect('(');
        List<SNode> children = new ArrayList<>();
        while (pos < input.length()) {
            skipWhitespaceAndComments();
            if (pos >= input.length()) {
                break;
            }
            char c = input.charAt(pos);
            if (c == ')') {
                pos++;
                return new SNode.SList(List.copyOf(children), lineOf(start), columnOf(start));
            } else if (c == '(') {
                children.add(parseList());
            } else if (c == '"') {
                children.add(parseQuotedString());
            } else {
                children.add(parseAtom());
            }
        }
        throw error("Unexpected end of input, expected ')' to close list", start);
    }

    private SNode.SAtom parseQuotedString() {
        int start = pos;
        expect('"');
        StringBuilder sb = new StringBuilder();
        while (pos < input.length()) {
            char c = input.charAt(pos);
            if (c == '"') {
                pos++;
                return new SNode.SAtom(sb.toString(), true, lineOf(start), columnOf(start));
            }
            if (c == '\\' && pos + 1 < input.length()) {
                pos++;
                sb.append(input.charAt(pos));
            } else {
                sb.append(c);
            }
            pos++;
        }
        throw error("Unterminated quoted string", start);
    }

    // Escaped identifiers keep their backslash: top\.x1 stays top\.x1
    private SNode.SAtom parseAtom() {
        int start = pos;
        while (pos < input.length()) {
            char c = input.charAt(pos);
            if (c == '\\' && pos + 1 < input.length()) {
                pos += 2;
                continue;
            }
            if (c == '(' || c == ')' || c == '"' || Character.isWhitespace(c)) {
                break;
            }
            pos++;
        }
        if (pos == start) {
            throw error("Expected atom", pos);
        }
        return new SNode.SAtom(input.substring(start, pos), false, lineOf(start), columnOf(start));
    }

    private void skipWhitespaceAndComments() {
        while (pos < input.length()) {
            char c = input.charAt(pos);
            if (Character.isWhitespace(c)) {
                pos++;
            } else if (input.startsWith("//", pos)) {
                while (pos < input.length() && input.charAt(pos) != '\n') {
                    pos++;
                }
            } else if (input.startsWith("/*", pos)) {
                int end = input.indexOf("*/", pos + 2);
                if (end < 0) {
                    throw error("Unterminated block comment", pos);
                }
                pos = end + 2;
            } else {
                break;
            }
        }
    }

    private void expect(char expected) {
        if (pos >= input.length() || input.charAt(pos) != expected) {
            throw error("Expected '" + expected + "'", pos);
        }
        pos++;
    }

    private ParseException error(String message, int at) {
        return new ParseException(message, lineOf(at), columnOf(at));
    }

    private static int[] computeLineStarts(String text) {
        int[] starts = new int[16];
        int count = 1;
        for (int i = 0; i < text.length(); i++) {
            if (text.charAt(i) == '\n') {
                if (count == starts.length) {
                    starts = Arrays.copyOf(starts, count * 2);
                }
                starts[count++] = i + 1;
            }
        }
        return Arrays.copyOf(starts, count);
    }

    private int lineIndex(int offset) {
        int idx = Arrays.binarySearch(lineStarts, offset);
        return idx >= 0 ? idx : -idx - 2;
    }

    private int lineOf(int offset) {
        return lineIndex(offset) + 1;
    }

    private int columnOf(int offset) {
        return offset - lineStarts[lineIndex(offset)] + 1;
    }
}
