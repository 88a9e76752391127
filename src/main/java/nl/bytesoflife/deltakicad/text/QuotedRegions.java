package nl.bytesoflife.deltakicad.text;

import java.util.BitSet;

/**
 * Marks which characters of a text lie inside quoted strings, so that anchors found by a
 * plain text search can be rejected when they sit inside a property value.
 */
final class QuotedRegions {

    private final BitSet quoted;

    private QuotedRegions(BitSet quoted) {
        this.quoted = quoted;
    }

    static QuotedRegions of(String text) {
        BitSet quoted = new BitSet(text.length());
        boolean inString = false;
        for (int i = 0; i < text.length(); i++) {
            char c = text.charAt(i);
            if (inString) {
                quoted.set(i);
                if (c == '\\' && i + 1 < text.length()) {
                    quoted.set(++i);
                } else if (c == '"') {
                    inString = false;
                }
            } else if (c == '"') {
                quoted.set(i);
                inString = true;
            }
        }
        return new QuotedRegions(quoted);
    }

    boolean isQuoted(int index) {
        return quoted.get(index);
    }
}
