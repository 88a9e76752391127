package nl.bytesoflife.deltakicad.parser;

import java.util.ArrayList;
import java.util.List;
import java.util.regex.Pattern;

/**
 * Parses the parenthesized, quoted-string text format used by KiCad design files.
 * <p>
 * Instances keep cursor state while parsing and are not shared between threads;
 * the produced tree depends only on the input text.
 */
public class SExpressionParser {

    private static final Pattern NUMBER = Pattern.compile("[+-]?(\\d+\\.?\\d*|\\.\\d+)([eE][+-]?\\d+)?");

    private String input;
    private int pos;

    /**
     * Parses all top-level forms of the text into one root list.
     */
    public SNode.SList parse(String text) {
        this.input = text;
        this.pos = 0;
        List<SNode> nodes = new ArrayList<>();
        while (pos < input.length()) {
            skipWhitespace();
            if (pos >= input.length()) break;
            char c = input.charAt(pos);
            if (c == '(') {
                nodes.add(parseList());
            } else if (c == ')') {
                throw new MalformedDocumentException("Unexpected ')' at position " + pos, pos);
            } else if (c == '"') {
                nodes.add(parseQuotedString());
            } else {
                nodes.add(parseAtom());
            }
        }
        return new SNode.SList(nodes);
    }

    /**
     * Parses a design file whose content is a single root form such as {@code (kicad_sch ...)}.
     */
    public SNode.SList parseDocument(String text) {
        SNode.SList root = parse(text);
        if (root.children().isEmpty() || !(root.get(0) instanceof SNode.SList form)) {
            throw new MalformedDocumentException("Document does not start with a list", 0);
        }
        return form;
    }

    private SNode.SList parseList() {
        int start = pos;
        expect('(');
        List<SNode> children = new ArrayList<>();
        while (pos < input.length()) {
            skipWhitespace();
            if (pos >= input.length()) {
                break;
            }
            char c = input.charAt(pos);
            if (c == ')') {
                pos++;
                return new SNode.SList(children);
            } else if (c == '(') {
                children.add(parseList());
            } else if (c == '"') {
                children.add(parseQuotedString());
            } else {
                children.add(parseAtom());
            }
        }
        throw new MalformedDocumentException("Unexpected end of input, '(' at position " + start + " is never closed", start);
    }

    private SNode.SAtom parseQuotedString() {
        int start = pos;
        expect('"');
        StringBuilder sb = new StringBuilder();
        while (pos < input.length()) {
            char c = input.charAt(pos);
            if (c == '"') {
                pos++;
                return SNode.SAtom.string(sb.toString());
            }
            if (c == '\\' && pos + 1 < input.length()) {
                pos++;
                char escaped = input.charAt(pos);
                switch (escaped) {
                    case '"', '\\' -> sb.append(escaped);
                    case 'n' -> sb.append('\n');
                    case 't' -> sb.append('\t');
                    case 'r' -> sb.append('\r');
                    default -> sb.append('\\').append(escaped);
                }
            } else {
                sb.append(c);
            }
            pos++;
        }
        throw new MalformedDocumentException("Unterminated quoted string starting at position " + start, start);
    }

    private SNode.SAtom parseAtom() {
        int start = pos;
        while (pos < input.length()) {
            char c = input.charAt(pos);
            if (c == '(' || c == ')' || c == '"' || isWhitespace(c)) {
                break;
            }
            pos++;
        }
        if (pos == start) {
            throw new MalformedDocumentException("Expected atom at position " + pos, pos);
        }
        String token = input.substring(start, pos);
        return NUMBER.matcher(token).matches() ? SNode.SAtom.number(token) : SNode.SAtom.symbol(token);
    }

    private void skipWhitespace() {
        while (pos < input.length() && isWhitespace(input.charAt(pos))) {
            pos++;
        }
    }

    private static boolean isWhitespace(char c) {
        return c == ' ' || c == '\t' || c == '\r' || c == '\n';
    }

    private void expect(char expected) {
        if (pos >= input.length() || input.charAt(pos) != expected) {
            throw new MalformedDocumentException("Expected '" + expected + "' at position " + pos, pos);
        }
        pos++;
    }
}
