package nl.bytesoflife.deltakicad.parser;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

public sealed interface SNode permits SNode.SAtom, SNode.SList {

    enum AtomKind {
        STRING,
        NUMBER,
        SYMBOL
    }

    record SAtom(String value, AtomKind kind) implements SNode {

        public static SAtom string(String value) {
            return new SAtom(value, AtomKind.STRING);
        }

        public static SAtom symbol(String value) {
            return new SAtom(value, AtomKind.SYMBOL);
        }

        public static SAtom number(String value) {
            return new SAtom(value, AtomKind.NUMBER);
        }

        public boolean isNumber() {
            return kind == AtomKind.NUMBER;
        }

        public boolean isString() {
            return kind == AtomKind.STRING;
        }

        public double doubleValue() {
            return Double.parseDouble(value);
        }

        @Override
        public String toString() {
            return value;
        }
    }

    record SList(List<SNode> children) implements SNode {

        public SList {
            children = List.copyOf(children);
        }

        public int size() {
            return children.size();
        }

        public SNode get(int index) {
            return children.get(index);
        }

        /**
         * Head symbol of the list, or an empty string when the list is empty or starts with a sub-list.
         */
        public String tag() {
            if (children.isEmpty()) return "";
            if (children.get(0) instanceof SAtom atom) {
                return atom.value();
            }
            return "";
        }

        public boolean hasTag(String tag) {
            return tag.equals(tag());
        }

        /**
         * Atom text at the given index, or an empty string when absent or not an atom.
         */
        public String atomValue(int index) {
            if (index >= children.size()) return "";
            if (children.get(index) instanceof SAtom atom) {
                return atom.value();
            }
            return "";
        }

        public double number(int index, double fallback) {
            if (index >= children.size()) return fallback;
            if (children.get(index) instanceof SAtom atom && atom.isNumber()) {
                return atom.doubleValue();
            }
            return fallback;
        }

        public List<SList> lists() {
            List<SList> result = new ArrayList<>();
            for (SNode child : children) {
                if (child instanceof SList list) {
                    result.add(list);
                }
            }
            return result;
        }

        public List<SList> lists(String tag) {
            List<SList> result = new ArrayList<>();
            for (SNode child : children) {
                if (child instanceof SList list && list.hasTag(tag)) {
                    result.add(list);
                }
            }
            return result;
        }

        public Optional<SList> first(String tag) {
            for (SNode child : children) {
                if (child instanceof SList list && list.hasTag(tag)) {
                    return Optional.of(list);
                }
            }
            return Optional.empty();
        }

        /**
         * Value of a {@code (property "name" "value" ...)} child.
         */
        public Optional<String> property(String name) {
            for (SList list : lists("property")) {
                if (name.equals(list.atomValue(1)) && list.size() > 2) {
                    return Optional.of(list.atomValue(2));
                }
            }
            return Optional.empty();
        }

        @Override
        public String toString() {
            return SExpressionWriter.write(this);
        }
    }
}
