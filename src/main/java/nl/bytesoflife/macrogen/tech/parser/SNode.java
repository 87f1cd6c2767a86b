package nl.bytesoflife.macrogen.tech.parser;

import java.util.List;

public sealed interface SNode permits SNode.SAtom, SNode.SList {

    record SAtom(String value) implements SNode {
        @Override
        public String toString() {
            return value.isEmpty() || value.chars().anyMatch(Character::isWhitespace)
                    ? '"' + value + '"' : value;
        }
    }

    record SList(List<SNode> children) implements SNode {

        /** The leading atom, or an empty string for an empty or headless list. */
        public String tag() {
            if (!children.isEmpty() && children.get(0) instanceof SAtom atom) {
                return atom.value();
            }
            return "";
        }

        public int size() {
            return children.size();
        }

        public String atom(int index) {
            if (index < children.size() && children.get(index) instanceof SAtom atom) {
                return atom.value();
            }
            throw new IllegalArgumentException("Expected an atom at index " + index + " of " + this);
        }

        public List<SList> lists() {
            return children.stream()
                    .filter(SList.class::isInstance)
                    .map(SList.class::cast)
                    .toList();
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
