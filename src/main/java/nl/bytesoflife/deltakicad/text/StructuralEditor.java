package nl.bytesoflife.deltakicad.text;

import nl.bytesoflife.deltakicad.NotFoundException;
import nl.bytesoflife.deltakicad.parser.MalformedDocumentException;
import nl.bytesoflife.deltakicad.parser.SNode;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.Optional;
import java.util.UUID;
import java.util.function.Supplier;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Whole-text mutation primitives. Every method takes the complete current document text and
 * returns the complete new text; bytes outside the affected block are never rewritten.
 */
public class StructuralEditor {

    private static final Logger log = LoggerFactory.getLogger(StructuralEditor.class);

    private final Supplier<UUID> identifiers;

    public StructuralEditor() {
        this(UUID::randomUUID);
    }

    public StructuralEditor(Supplier<UUID> identifiers) {
        this.identifiers = identifiers;
    }

    public String newIdentifier() {
        return identifiers.get().toString();
    }

    /**
     * Splices {@code block} in front of the document's final closing parenthesis. When that
     * parenthesis sits on its own line the block goes on the line above it.
     */
    public String insertBeforeEnd(String text, String block) {
        int close = text.lastIndexOf(')');
        if (close < 0) {
            throw new MalformedDocumentException("Document has no closing parenthesis", text.length());
        }
        int lineStart = close;
        while (lineStart > 0 && (text.charAt(lineStart - 1) == ' ' || text.charAt(lineStart - 1) == '\t')) {
            lineStart--;
        }
        String insertion = block.endsWith("\n") ? block : block + "\n";
        if (lineStart == 0 || text.charAt(lineStart - 1) == '\n') {
            return insertAt(text, lineStart, insertion);
        }
        return insertAt(text, close, "\n" + insertion);
    }

    /**
     * Inserts {@code block} as the last child of the block delimited by {@code parent}.
     */
    public String insertIntoBlock(String text, Span parent, String block) {
        int close = parent.end() - 1;
        int lineStart = close;
        while (lineStart > parent.start() && (text.charAt(lineStart - 1) == ' ' || text.charAt(lineStart - 1) == '\t')) {
            lineStart--;
        }
        String insertion = block.endsWith("\n") ? block : block + "\n";
        if (text.charAt(lineStart - 1) == '\n') {
            return insertAt(text, lineStart, insertion);
        }
        return insertAt(text, close, "\n" + insertion);
    }

    /**
     * Inserts {@code block} at {@code index}. Line breaks in the block follow the document's own.
     */
    public String insertAt(String text, int index, String block) {
        log.debug("Inserting {} characters at {}", block.length(), index);
        return text.substring(0, index) + matchLineEndings(text, block) + text.substring(index);
    }

    /**
     * Replaces exactly the bytes of {@code span}.
     */
    public String replace(String text, Span span, String replacement) {
        return text.substring(0, span.start()) + matchLineEndings(text, replacement) + text.substring(span.end());
    }

    /**
     * Rewrites the breaks of {@code fragment} as CRLF when {@code text} uses CRLF, else as LF.
     */
    static String matchLineEndings(String text, String fragment) {
        if (fragment.indexOf('\n') < 0) {
            return fragment;
        }
        String lf = fragment.replace("\r\n", "\n");
        return text.contains("\r\n") ? lf.replace("\n", "\r\n") : lf;
    }

    /**
     * Removes the block and, when it occupied whole lines, those lines. Blank lines meeting at the
     * removal point are collapsed to at most one so repeated edits do not accumulate them.
     */
    public String delete(String text, Span span) {
        int start = span.start();
        int end = span.end();

        int lineStart = start;
        while (lineStart > 0 && isBlankChar(text.charAt(lineStart - 1))) {
            lineStart--;
        }
        int lineEnd = end;
        while (lineEnd < text.length() && (isBlankChar(text.charAt(lineEnd)) || text.charAt(lineEnd) == '\r')) {
            lineEnd++;
        }
        boolean ownsLine = (lineStart == 0 || text.charAt(lineStart - 1) == '\n')
                && (lineEnd == text.length() || text.charAt(lineEnd) == '\n');
        if (!ownsLine) {
            return text.substring(0, start) + text.substring(end);
        }

        String before = text.substring(0, lineStart);
        String after = text.substring(lineEnd < text.length() ? lineEnd + 1 : lineEnd);
        return joinCollapsingBlankLines(before, after);
    }

    /**
     * Deletes the block found by {@code lookup}, or fails naming {@code target}.
     */
    public String delete(String text, Optional<Span> lookup, String target) {
        Span span = lookup.orElseThrow(() -> new NotFoundException(target, target + " not found"));
        return delete(text, span);
    }

    /**
     * Rewrites a positioned block for a new location. The block's own {@code (at ...)} is replaced,
     * the {@code (at ...)} of each direct {@code property} child moves by the same delta when
     * {@code shiftProperties} is set, and the block's {@code (uuid ...)} is renewed.
     *
     * @param rotation new rotation, or {@code null} to keep the current one
     */
    public String relocate(String block, double x, double y, Double rotation, boolean shiftProperties) {
        Span whole = new Span(0, block.length());
        Span at = BlockFinder.child(block, whole, "at")
                .orElseThrow(() -> new NotFoundException("at", "Block has no (at ...) clause"));
        SNode.SList oldAt = BlockFinder.parseBlock(block, at);
        double oldX = oldAt.number(1, 0);
        double oldY = oldAt.number(2, 0);
        double oldRotation = oldAt.number(3, 0);
        double newRotation = rotation != null ? rotation : oldRotation;
        double dx = x - oldX;
        double dy = y - oldY;

        // Edits run back to front so earlier spans stay valid.
        List<BlockFinder.Child> children = BlockFinder.children(block, whole);
        String result = block;
        for (int i = children.size() - 1; i >= 0; i--) {
            BlockFinder.Child child = children.get(i);
            switch (child.tag()) {
                case "uuid" -> result = replace(result, child.span(), "(uuid \"" + newIdentifier() + "\")");
                case "at" -> result = replace(result, child.span(), atClause(x, y, newRotation, oldAt.size() > 3 || rotation != null));
                case "property" -> {
                    if (shiftProperties) {
                        result = shiftPropertyPosition(result, child.span(), dx, dy);
                    }
                }
                default -> {
                }
            }
        }
        return result;
    }

    private String shiftPropertyPosition(String text, Span property, double dx, double dy) {
        Optional<Span> at = BlockFinder.child(text, property, "at");
        if (at.isEmpty()) {
            return text;
        }
        SNode.SList clause = BlockFinder.parseBlock(text, at.get());
        double px = clause.number(1, 0) + dx;
        double py = clause.number(2, 0) + dy;
        String angle = clause.size() > 3 ? " " + clause.atomValue(3) : "";
        return replace(text, at.get(), "(at " + CoordinateFormat.format(px) + " " + CoordinateFormat.format(py) + angle + ")");
    }

    public static String atClause(double x, double y, double rotation, boolean withRotation) {
        String clause = "(at " + CoordinateFormat.format(x) + " " + CoordinateFormat.format(y);
        if (withRotation) {
            clause += " " + CoordinateFormat.format(rotation);
        }
        return clause + ")";
    }

    /**
     * Leading whitespace of the line containing {@code index}.
     */
    public static String lineIndent(String text, int index) {
        int lineStart = text.lastIndexOf('\n', index - 1) + 1;
        int i = lineStart;
        while (i < text.length() && isBlankChar(text.charAt(i))) i++;
        return text.substring(lineStart, i);
    }

    /**
     * Indentation one level deeper than {@code indent}, using tabs when the document does.
     */
    public static String nested(String indent) {
        return indent + (indent.contains("\t") ? "\t" : "  ");
    }

    /**
     * Re-bases a block cut from one document for another: every line after the first loses the
     * {@code from} prefix (when present) and gains {@code to}. The first line is left as is.
     */
    public static String reindent(String block, String from, String to) {
        String[] lines = block.split("\n", -1);
        StringBuilder sb = new StringBuilder(lines[0]);
        for (int i = 1; i < lines.length; i++) {
            String line = lines[i];
            if (line.startsWith(from)) {
                line = line.substring(from.length());
            }
            sb.append('\n').append(to).append(line);
        }
        return sb.toString();
    }

    /**
     * Next free number for a counter embedded in the document, e.g. {@code #PWR(\d+)} or net ids.
     * Scans the current text every time; group 1 of {@code pattern} must capture the digits.
     */
    public static int nextNumber(String text, Pattern pattern) {
        int max = 0;
        Matcher m = pattern.matcher(text);
        while (m.find()) {
            max = Math.max(max, Integer.parseInt(m.group(1)));
        }
        return max + 1;
    }

    private static String joinCollapsingBlankLines(String before, String after) {
        int runStart = before.length();
        while (runStart > 0) {
            int previousLineStart = before.lastIndexOf('\n', runStart - 2) + 1;
            if (!before.substring(previousLineStart, runStart - 1).isBlank()) break;
            runStart = previousLineStart;
        }
        int runEnd = 0;
        int blankAfter = 0;
        while (true) {
            int newline = after.indexOf('\n', runEnd);
            if (newline < 0 || !after.substring(runEnd, newline).isBlank()) break;
            runEnd = newline + 1;
            blankAfter++;
        }
        int blankBefore = countNewlines(before, runStart);
        if (blankBefore + blankAfter <= 1) {
            return before + after;
        }
        String keep = blankBefore > 0
                ? before.substring(runStart, before.indexOf('\n', runStart) + 1)
                : after.substring(0, after.indexOf('\n') + 1);
        return before.substring(0, runStart) + keep + after.substring(runEnd);
    }

    private static int countNewlines(String text, int from) {
        int count = 0;
        for (int i = from; i < text.length(); i++) {
            if (text.charAt(i) == '\n') count++;
        }
        return count;
    }

    private static boolean isBlankChar(char c) {
        return c == ' ' || c == '\t';
    }
}
