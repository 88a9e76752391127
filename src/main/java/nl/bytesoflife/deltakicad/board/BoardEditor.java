package nl.bytesoflife.deltakicad.board;

import nl.bytesoflife.deltakicad.AlreadyExistsException;
import nl.bytesoflife.deltakicad.NotFoundException;
import nl.bytesoflife.deltakicad.config.EngineSettings;
import nl.bytesoflife.deltakicad.library.FootprintLibraries;
import nl.bytesoflife.deltakicad.library.QualifiedId;
import nl.bytesoflife.deltakicad.model.BoardNet;
import nl.bytesoflife.deltakicad.model.Placement;
import nl.bytesoflife.deltakicad.model.TrackSegment;
import nl.bytesoflife.deltakicad.model.Via;
import nl.bytesoflife.deltakicad.parser.SExpressionWriter;
import nl.bytesoflife.deltakicad.parser.SNode;
import nl.bytesoflife.deltakicad.text.BlockFinder;
import nl.bytesoflife.deltakicad.text.BlockLocator;
import nl.bytesoflife.deltakicad.text.CoordinateFormat;
import nl.bytesoflife.deltakicad.text.Edit;
import nl.bytesoflife.deltakicad.text.Span;
import nl.bytesoflife.deltakicad.text.StructuralEditor;
import org.locationtech.jts.geom.Coordinate;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.Optional;
import java.util.Set;
import java.util.regex.Pattern;

import static nl.bytesoflife.deltakicad.parser.SExpressionWriter.quote;
import static nl.bytesoflife.deltakicad.text.CoordinateFormat.format;

/**
 * Text-level board mutations over {@code .kicad_pcb} text.
 */
public class BoardEditor {

    private static final Logger log = LoggerFactory.getLogger(BoardEditor.class);

    private static final Pattern NET_ENTRY = Pattern.compile("(?m)^[ \\t]*\\(net\\s+(\\d+)\\s+\"[^\"]*\"\\)\\s*$");
    private static final Set<String> PLACEMENT_TAGS = Set.of(
            "layer", "at", "uuid", "version", "generator", "generator_version", "tedit", "tstamp");
    private static final Set<String> ROTATING_CHILDREN = Set.of("pad", "property", "fp_text");
    private static final String TEXT_EFFECTS = "(effects (font (size 1 1) (thickness 0.15)))";

    private final StructuralEditor editor;
    private final FootprintLibraries footprints;

    public BoardEditor(EngineSettings settings) {
        this.editor = new StructuralEditor(settings.getIdentifierSupplier());
        this.footprints = new FootprintLibraries(settings.getFootprintLibraries());
    }

    /**
     * Adds a footprint instance. When {@code footprintId} resolves in the configured footprint
     * libraries and the footprint goes on the front layer, its pads and graphics are copied in;
     * otherwise an empty footprint carrying only reference and value is placed.
     *
     * @return the new footprint's uuid
     */
    public Edit<String> placeFootprint(String text, String reference, String footprintId, String value,
                                       double x, double y, String layer, double rotation) {
        if (BlockFinder.findFootprintByReference(text, reference).isPresent()) {
            throw new AlreadyExistsException(reference, "Footprint " + reference + " is already on the board");
        }
        QualifiedId id = QualifiedId.parse(footprintId);
        String uuid = editor.newIdentifier();

        StringBuilder block = new StringBuilder();
        block.append("  (footprint ").append(quote(id.toString())).append(" (layer ").append(quote(layer)).append(")\n");
        block.append("    (uuid ").append(quote(uuid)).append(")\n");
        block.append("    ").append(StructuralEditor.atClause(x, y, rotation, rotation != 0)).append("\n");
        block.append("    (property \"Reference\" ").append(quote(reference)).append(" (at 0 -1.5 ").append(format(rotation)).append(")\n");
        block.append("      (layer ").append(quote(silkscreen(layer))).append(")\n");
        block.append("      ").append(TEXT_EFFECTS).append("\n");
        block.append("    )\n");
        block.append("    (property \"Value\" ").append(quote(value)).append(" (at 0 1.5 ").append(format(rotation)).append(")\n");
        block.append("      (layer ").append(quote(fabrication(layer))).append(")\n");
        block.append("      ").append(TEXT_EFFECTS).append("\n");
        block.append("    )\n");
        block.append(libraryBody(id, layer, rotation));
        block.append("  )");
        return new Edit<>(editor.insertBeforeEnd(text, block.toString()), uuid);
    }

    /**
     * Moves a footprint. Its child positions are relative to the footprint and stay as they are;
     * a rotation change is added to the orientation of pads and texts, which KiCad stores as
     * board-absolute angles.
     */
    public Edit<Placement> moveFootprint(String text, String reference, double x, double y, Double rotation) {
        Span span = requireFootprint(text, reference);
        String block = span.text(text);
        double oldRotation = BlockFinder.parseBlock(text, span).first("at").map(at -> at.number(3, 0)).orElse(0.0);
        String moved = editor.relocate(block, x, y, rotation, false);
        if (rotation != null && rotation != oldRotation) {
            moved = rotateChildren(moved, rotation - oldRotation);
        }
        SNode.SList parsed = BlockFinder.parseBlock(moved, new Span(0, moved.length()));
        return new Edit<>(editor.replace(text, span, moved), Placement.of(parsed));
    }

    public Edit<TrackSegment> addTrack(String text, Coordinate start, Coordinate end, double width, String layer, String net) {
        Edit<Integer> resolved = resolveNet(text, net);
        String uuid = editor.newIdentifier();
        String block = "  (segment (start " + format(start.x) + " " + format(start.y) + ") (end "
                + format(end.x) + " " + format(end.y) + ") (width " + format(width) + ") (layer " + quote(layer)
                + ") (net " + resolved.result() + ") (uuid " + quote(uuid) + "))";
        TrackSegment segment = new TrackSegment(start, end, width, layer, resolved.result(), uuid);
        return new Edit<>(editor.insertBeforeEnd(resolved.text(), block), segment);
    }

    public Edit<Via> addVia(String text, Coordinate position, double size, double drill, String net) {
        Edit<Integer> resolved = resolveNet(text, net);
        String uuid = editor.newIdentifier();
        String block = "  (via " + StructuralEditor.atClause(position.x, position.y, 0, false)
                + " (size " + format(size) + ") (drill " + format(drill) + ") (layers \"F.Cu\" \"B.Cu\") (net "
                + resolved.result() + ") (uuid " + quote(uuid) + "))";
        Via via = new Via(position, size, drill, List.of("F.Cu", "B.Cu"), resolved.result(), uuid);
        return new Edit<>(editor.insertBeforeEnd(resolved.text(), block), via);
    }

    /**
     * Connects a pad to a net, adding the net to the board's net table when it is new.
     */
    public Edit<BoardNet> assignNet(String text, String reference, String padNumber, String net) {
        requireFootprint(text, reference);
        Edit<Integer> resolved = resolveNet(text, net);
        String updated = resolved.text();
        Span footprint = requireFootprint(updated, reference);
        Span pad = findPad(updated, footprint, padNumber)
                .orElseThrow(() -> new NotFoundException(reference + "." + padNumber,
                        "Pad '" + padNumber + "' not found in footprint '" + reference + "'"));

        String clause = "(net " + resolved.result() + " " + quote(net) + ")";
        Optional<Span> existing = BlockFinder.child(updated, pad, "net");
        if (existing.isPresent()) {
            updated = editor.replace(updated, existing.get(), clause);
        } else if (closesOnOwnLine(updated, pad)) {
            String indent = StructuralEditor.nested(StructuralEditor.lineIndent(updated, pad.start()));
            updated = editor.insertIntoBlock(updated, pad, indent + clause);
        } else {
            updated = editor.insertAt(updated, pad.end() - 1, " " + clause);
        }
        return new Edit<>(updated, new BoardNet(resolved.result(), net));
    }

    /**
     * Number of the net called {@code name}, appending a new net table entry numbered one above the
     * current maximum when there is none. The empty name is net 0.
     */
    Edit<Integer> resolveNet(String text, String name) {
        if (name == null || name.isEmpty()) {
            return new Edit<>(text, 0);
        }
        Span root = BlockLocator.spanAt(text, text.indexOf('('));
        Optional<Span> lastNet = Optional.empty();
        Optional<Span> firstFootprint = Optional.empty();
        for (BlockFinder.Child child : BlockFinder.children(text, root)) {
            if (child.tag().equals("net")) {
                SNode.SList entry = BlockFinder.parseBlock(text, child.span());
                if (name.equals(entry.atomValue(2))) {
                    return new Edit<>(text, (int) entry.number(1, 0));
                }
                lastNet = Optional.of(child.span());
            } else if (child.tag().equals("footprint") && firstFootprint.isEmpty()) {
                firstFootprint = Optional.of(child.span());
            }
        }

        int number = StructuralEditor.nextNumber(text, NET_ENTRY);
        String entry = "(net " + number + " " + quote(name) + ")";
        log.debug("Adding net {} as {}", name, number);
        if (lastNet.isPresent()) {
            String indent = StructuralEditor.lineIndent(text, lastNet.get().start());
            return new Edit<>(editor.insertAt(text, lastNet.get().end(), "\n" + indent + entry), number);
        }
        if (firstFootprint.isPresent()) {
            int lineStart = text.lastIndexOf('\n', firstFootprint.get().start()) + 1;
            String indent = StructuralEditor.lineIndent(text, firstFootprint.get().start());
            return new Edit<>(editor.insertAt(text, lineStart, indent + entry + "\n"), number);
        }
        return new Edit<>(editor.insertBeforeEnd(text, "  " + entry), number);
    }

    private Span requireFootprint(String text, String reference) {
        return BlockFinder.findFootprintByReference(text, reference)
                .orElseThrow(() -> new NotFoundException(reference, "Footprint with reference '" + reference + "' not found"));
    }

    private static Optional<Span> findPad(String text, Span footprint, String number) {
        for (BlockFinder.Child child : BlockFinder.children(text, footprint)) {
            if (!child.tag().equals("pad")) continue;
            Optional<Span> token = BlockFinder.atomSpan(text, child.span(), 1);
            if (token.isPresent() && SExpressionWriter.unquote(token.get().text(text)).equals(number)) {
                return Optional.of(child.span());
            }
        }
        return Optional.empty();
    }

    private static boolean closesOnOwnLine(String text, Span block) {
        int i = block.end() - 1;
        while (i > block.start() && (text.charAt(i - 1) == ' ' || text.charAt(i - 1) == '\t')) i--;
        return text.charAt(i - 1) == '\n';
    }

    private String rotateChildren(String block, double delta) {
        Span whole = new Span(0, block.length());
        List<BlockFinder.Child> children = BlockFinder.children(block, whole);
        String result = block;
        for (int i = children.size() - 1; i >= 0; i--) {
            BlockFinder.Child child = children.get(i);
            if (!ROTATING_CHILDREN.contains(child.tag())) continue;
            Optional<Span> at = BlockFinder.child(result, child.span(), "at");
            if (at.isEmpty()) continue;
            SNode.SList clause = BlockFinder.parseBlock(result, at.get());
            double angle = normalize(clause.number(3, 0) + delta);
            result = editor.replace(result, at.get(),
                    StructuralEditor.atClause(clause.number(1, 0), clause.number(2, 0), angle, angle != 0 || clause.size() > 3));
        }
        return result;
    }

    /**
     * Body of the library footprint minus its own placement clauses, re-indented for the board, or
     * an empty string when it cannot be used.
     */
    private String libraryBody(QualifiedId id, String layer, double rotation) {
        Optional<String> source = footprints.read(id);
        if (source.isEmpty()) {
            log.warn("Footprint {} not found in configured libraries; placing it without pads", id);
            return "";
        }
        if (!layer.startsWith("F.")) {
            log.warn("Footprint {} placed on {}; library pads are only copied for front-side placement", id, layer);
            return "";
        }
        String library = source.get();
        Span root = BlockLocator.spanAt(library, library.indexOf('('));
        StringBuilder body = new StringBuilder();
        for (BlockFinder.Child child : BlockFinder.children(library, root)) {
            if (PLACEMENT_TAGS.contains(child.tag()) || isReferenceOrValue(library, child)) continue;
            String copied = child.span().text(library);
            if (rotation != 0 && ROTATING_CHILDREN.contains(child.tag())) {
                copied = rotateChildren("(wrap " + copied + ")", rotation);
                copied = copied.substring("(wrap ".length(), copied.length() - 1);
            }
            String indent = StructuralEditor.lineIndent(library, child.span().start());
            body.append("    ").append(StructuralEditor.reindent(copied, indent, "    ")).append("\n");
        }
        return body.toString();
    }

    private static boolean isReferenceOrValue(String text, BlockFinder.Child child) {
        if (!child.tag().equals("property") && !child.tag().equals("fp_text")) return false;
        SNode.SList parsed = BlockFinder.parseBlock(text, child.span());
        String kind = parsed.atomValue(1);
        return kind.equals("Reference") || kind.equals("Value") || kind.equals("reference") || kind.equals("value");
    }

    private static String silkscreen(String layer) {
        return layer.startsWith("B.") ? "B.SilkS" : "F.SilkS";
    }

    private static String fabrication(String layer) {
        return layer.startsWith("B.") ? "B.Fab" : "F.Fab";
    }

    private static double normalize(double angle) {
        double normalized = CoordinateFormat.round(angle % 360);
        return normalized < 0 ? normalized + 360 : normalized;
    }
}
