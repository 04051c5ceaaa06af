package nl.bytesoflife.deltasdf.parser;

import java.util.List;
import java.util.Locale;

/**
 * Node of the parenthesized syntax tree. Every node remembers where it
 * started in the source text.
 */
public sealed interface SNode permits SNode.SAtom, SNode.SList {

    int line();

    int column();

    record SAtom(String value, boolean quoted, int line, int column) implements SNode {

        public SAtom(String value) {
            this(value, false, 0, 0);
        }

        @Override
        public String toString() {
            return quoted ? '"' + value + '"' : value;
        }
    }

    record SList(List<SNode> children, int line, int column) implements SNode {

        public SList(List<SNode> children) {
            this(children, 0, 0);
        }

        public int size() {
            return children.size();
        }

        public SNode get(int index) {
            return children.get(index);
        }

        /** The leading keyword, upper-cased, or "" when the list does not start with a bare atom. */
        public String tag() {
            if (children.isEmpty()) return "";
            if (children.get(0) instanceof SAtom atom && !atom.quoted()) {
                return atom.value().toUpperCase(Locale.ROOT);
            }
            return "";
        }

        @Override
        public String toString() {
            StringBuilder sb = new StringBuilder("(");
            for (int i = 0; i < children.size(); i++) {
                if (i > 0) sb.append(' ');
                sb.append(children.get(i));
            }
            sb.append(')');
            return sb.toString();
        }
    }
}
