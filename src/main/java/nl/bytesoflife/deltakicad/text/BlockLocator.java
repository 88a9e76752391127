package nl.bytesoflife.deltakicad.text;

import nl.bytesoflife.deltakicad.parser.MalformedDocumentException;

import java.util.OptionalInt;

/**
 * Finds the extent of a parenthesized block by walking forward from its opening parenthesis.
 * Parentheses inside quoted strings do not count; {@code \"} does not end a string.
 */
public final class BlockLocator {

    private BlockLocator() {}

    /**
     * Index of the {@code )} matching the {@code (} at {@code start}, or empty if the text ends first.
     */
    public static OptionalInt findBlockEnd(String text, int start) {
        if (start < 0 || start >= text.length() || text.charAt(start) != '(') {
            throw new IllegalArgumentException("No '(' at index " + start);
        }
        int depth = 0;
        boolean inString = false;
        for (int i = start; i < text.length(); i++) {
            char c = text.charAt(i);
            if (inString) {
                if (c == '\\') {
                    i++;
                } else if (c == '"') {
                    inString = false;
                }
                continue;
            }
            if (c == '"') {
                inString = true;
            } else if (c == '(') {
                depth++;
            } else if (c == ')') {
                depth--;
                if (depth == 0) {
                    return OptionalInt.of(i);
                }
            }
        }
        return OptionalInt.empty();
    }

    /**
     * Span of the block opening at {@code start}; an unclosed block is a malformed document.
     */
    public static Span spanAt(String text, int start) {
        OptionalInt end = findBlockEnd(text, start);
        if (end.isEmpty()) {
            throw new MalformedDocumentException("Block at position " + start + " is never closed", start);
        }
        return new Span(start, end.getAsInt() + 1);
    }
}
