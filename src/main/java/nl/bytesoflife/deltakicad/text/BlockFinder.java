package nl.bytesoflife.deltakicad.text;

import nl.bytesoflife.deltakicad.parser.SExpressionParser;
import nl.bytesoflife.deltakicad.parser.SNode;
import org.locationtech.jts.geom.Coordinate;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Locates blocks inside raw document text without parsing the whole file.
 * <p>
 * Every lookup runs in two phases: a text search yields candidate {@code (tag} anchors outside
 * quoted strings, then {@link BlockLocator} computes each candidate's extent and the candidate
 * is verified by parsing only that block. Lookups return empty when nothing matches.
 */
public final class BlockFinder {

    private BlockFinder() {}

    /**
     * A direct child list of a block, with its head token.
     */
    public record Child(String tag, Span span) {}

    /**
     * First block whose head is {@code tag} immediately followed by a token equal to {@code value}.
     */
    public static Optional<Span> findByTagValue(String text, String tag, String value) {
        for (Span candidate : candidates(text, tag)) {
            SNode.SList block = parseBlock(text, candidate);
            if (block.size() > 1 && block.get(1) instanceof SNode.SAtom atom && atom.value().equals(value)) {
                return Optional.of(candidate);
            }
        }
        return Optional.empty();
    }

    /**
     * First block with the given head, e.g. the {@code lib_symbols} cache section.
     */
    public static Optional<Span> findSection(String text, String tag) {
        List<Span> found = candidates(text, tag);
        return found.isEmpty() ? Optional.empty() : Optional.of(found.get(0));
    }

    /**
     * Symbol instance whose {@code Reference} property equals {@code reference}. Library
     * definitions under {@code lib_symbols} share the {@code symbol} head but are never matched.
     */
    public static Optional<Span> findSymbolByReference(String text, String reference) {
        return findSymbolsByReference(text, reference).stream().findFirst();
    }

    /**
     * Every instance carrying {@code reference}, in document order. Multi-unit parts place one
     * instance per unit under a shared reference.
     */
    public static List<Span> findSymbolsByReference(String text, String reference) {
        List<Span> libraryAreas = candidates(text, "lib_symbols");
        List<Span> found = new ArrayList<>();
        for (Span candidate : candidates(text, "symbol")) {
            if (insideAny(libraryAreas, candidate)) continue;
            SNode.SList block = parseBlock(text, candidate);
            if (reference.equals(block.property("Reference").orElse(null))) {
                found.add(candidate);
            }
        }
        return found;
    }

    /**
     * Board footprint whose reference (a {@code property} or legacy {@code fp_text reference}) matches.
     */
    public static Optional<Span> findFootprintByReference(String text, String reference) {
        for (Span candidate : candidates(text, "footprint")) {
            SNode.SList block = parseBlock(text, candidate);
            String found = block.property("Reference").orElse(null);
            if (found == null) {
                for (SNode.SList fpText : block.lists("fp_text")) {
                    if ("reference".equals(fpText.atomValue(1))) {
                        found = fpText.atomValue(2);
                    }
                }
            }
            if (reference.equals(found)) {
                return Optional.of(candidate);
            }
        }
        return Optional.empty();
    }

    /**
     * Wire whose two endpoints match {@code a} and {@code b} in either order, within {@code tolerance}.
     */
    public static Optional<Span> findWireByEndpoints(String text, Coordinate a, Coordinate b, double tolerance) {
        for (Span candidate : candidates(text, "wire")) {
            SNode.SList block = parseBlock(text, candidate);
            List<Coordinate> points = new ArrayList<>();
            block.first("pts").ifPresent(pts -> {
                for (SNode.SList xy : pts.lists("xy")) {
                    points.add(new Coordinate(xy.number(1, 0), xy.number(2, 0)));
                }
            });
            if (points.size() < 2) continue;
            Coordinate start = points.get(0);
            Coordinate end = points.get(points.size() - 1);
            boolean forward = CoordinateFormat.near(start, a, tolerance) && CoordinateFormat.near(end, b, tolerance);
            boolean reverse = CoordinateFormat.near(start, b, tolerance) && CoordinateFormat.near(end, a, tolerance);
            if (forward || reverse) {
                return Optional.of(candidate);
            }
        }
        return Optional.empty();
    }

    /**
     * Point marker ({@code no_connect}, {@code junction}) anchored at {@code position}.
     */
    public static Optional<Span> findMarkerByPosition(String text, String tag, Coordinate position, double tolerance) {
        for (Span candidate : candidates(text, tag)) {
            SNode.SList block = parseBlock(text, candidate);
            Optional<SNode.SList> at = block.first("at");
            if (at.isPresent()) {
                Coordinate anchor = new Coordinate(at.get().number(1, 0), at.get().number(2, 0));
                if (CoordinateFormat.near(anchor, position, tolerance)) {
                    return Optional.of(candidate);
                }
            }
        }
        return Optional.empty();
    }

    /**
     * Direct child lists of the block delimited by {@code block}, in document order.
     */
    public static List<Child> children(String text, Span block) {
        List<Child> children = new ArrayList<>();
        int i = block.start() + 1;
        int limit = block.end() - 1;
        while (i < limit) {
            char c = text.charAt(i);
            if (c == '"') {
                i = skipString(text, i);
            } else if (c == '(') {
                Span child = BlockLocator.spanAt(text, i);
                children.add(new Child(headToken(text, i + 1), child));
                i = child.end();
            } else {
                i++;
            }
        }
        return children;
    }

    /**
     * First direct child with the given head.
     */
    public static Optional<Span> child(String text, Span block, String tag) {
        for (Child c : children(text, block)) {
            if (c.tag().equals(tag)) {
                return Optional.of(c.span());
            }
        }
        return Optional.empty();
    }

    /**
     * Span of the {@code index}-th token of a block, counting the head as 0 and nested lists as
     * one token each. Empty when the block has fewer tokens or the token is a list.
     */
    public static Optional<Span> atomSpan(String text, Span block, int index) {
        int i = block.start() + 1;
        int limit = block.end() - 1;
        int current = 0;
        while (i < limit) {
            char c = text.charAt(i);
            if (Character.isWhitespace(c)) {
                i++;
                continue;
            }
            int start = i;
            boolean list = c == '(';
            if (list) {
                i = BlockLocator.spanAt(text, i).end();
            } else if (c == '"') {
                i = skipString(text, i);
            } else {
                while (i < limit && !Character.isWhitespace(text.charAt(i))
                        && text.charAt(i) != '(' && text.charAt(i) != ')' && text.charAt(i) != '"') {
                    i++;
                }
            }
            if (current == index) {
                return list ? Optional.empty() : Optional.of(new Span(start, i));
            }
            current++;
        }
        return Optional.empty();
    }

    /**
     * Spans of every block opening with {@code (tag} outside quoted strings, in document order.
     */
    public static List<Span> candidates(String text, String tag) {
        Pattern anchor = Pattern.compile("\\(\\s*" + Pattern.quote(tag) + "(?=[\\s()\"])");
        QuotedRegions quoted = null;
        List<Span> spans = new ArrayList<>();
        Matcher m = anchor.matcher(text);
        while (m.find()) {
            if (quoted == null) {
                quoted = QuotedRegions.of(text);
            }
            if (quoted.isQuoted(m.start())) continue;
            spans.add(BlockLocator.spanAt(text, m.start()));
        }
        return spans;
    }

    /**
     * Parses just the bytes of {@code span}.
     */
    public static SNode.SList parseBlock(String text, Span span) {
        return new SExpressionParser().parseDocument(span.text(text));
    }

    private static boolean insideAny(List<Span> areas, Span candidate) {
        for (Span area : areas) {
            if (area.encloses(candidate)) return true;
        }
        return false;
    }

    private static String headToken(String text, int from) {
        int i = from;
        while (i < text.length() && Character.isWhitespace(text.charAt(i))) i++;
        int start = i;
        while (i < text.length()) {
            char c = text.charAt(i);
            if (c == '(' || c == ')' || c == '"' || Character.isWhitespace(c)) break;
            i++;
        }
        return text.substring(start, i);
    }

    private static int skipString(String text, int quoteIndex) {
        int i = quoteIndex + 1;
        while (i < text.length()) {
            char c = text.charAt(i);
            if (c == '\\') {
                i += 2;
                continue;
            }
            if (c == '"') {
                return i + 1;
            }
            i++;
        }
        return i;
    }
}
