package nl.bytesoflife.deltasdf.parser;

import java.util.ArrayList;
import java.util.List;

/**
 * Renders a COND expression as one string of space separated tokens.
 * Operators written against their operands are split off, so
 * {@code A==1'b1} and {@code A == 1'b1} both render as {@code A == 1'b1}.
 * Nested lists render in parentheses.
 */
public final class ConditionFormatter {

    // Longest first so that "===" wins over "==" and "&&" over "&".
    private static final String[] OPERATORS = {
            "===", "!==",
            "==", "!=", "&&", "||", "~&", "~|", "~^", "^~",
            "&", "|", "^", "!", "~"
    };

    private ConditionFormatter() {
    }

    public static String format(List<SNode> expression) {
        List<String> tokens = new ArrayList<>();
        for (SNode node : expression) {
            appendTokens(node, tokens);
        }
        return String.join(" ", tokens);
    }

    private static void appendTokens(SNode node, List<String> tokens) {
        if (node instanceof SNode.SAtom atom) {
            if (atom.quoted()) {
                tokens.add(atom.value());
            } else {
                tokens.addAll(splitOperators(atom.value()));
            }
        } else if (node instanceof SNode.SList list) {
            tokens.add("(" + format(list.children()) + ")");
        }
    }

    static List<String> splitOperators(String text) {
        List<String> tokens = new ArrayList<>();
        StringBuilder operand = new StringBuilder();
        int i = 0;
        while (i < text.length()) {
            char c = text.charAt(i);
            if (c == '\\' && i + 1 < text.length()) {
                operand.append(c).append(text.charAt(i + 1));
                i += 2;
                continue;
            }
            String op = operatorAt(text, i);
            if (op == null) {
                operand.append(c);
                i++;
                continue;
            }
            if (operand.length() > 0) {
                tokens.add(operand.toString());
                operand.setLength(0);
            }
            tokens.add(op);
            i += op.length();
        }
        if (operand.length() > 0) {
            tokens.add(operand.toString());
        }
        return tokens;
    }

    private static String operatorAt(String text, int index) {
        for (String op : OPERATORS) {
            if (text.startsWith(op, index)) {
                return op;
            }
        }
        return null;
    }
}
