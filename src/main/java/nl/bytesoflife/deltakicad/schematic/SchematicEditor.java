package nl.bytesoflife.deltakicad.schematic;

import nl.bytesoflife.deltakicad.AlreadyExistsException;
import nl.bytesoflife.deltakicad.NotFoundException;
import nl.bytesoflife.deltakicad.config.EngineSettings;
import nl.bytesoflife.deltakicad.library.CacheResult;
import nl.bytesoflife.deltakicad.library.QualifiedId;
import nl.bytesoflife.deltakicad.library.SymbolCacheInjector;
import nl.bytesoflife.deltakicad.library.SymbolLibraries;
import nl.bytesoflife.deltakicad.model.Label;
import nl.bytesoflife.deltakicad.model.LabelType;
import nl.bytesoflife.deltakicad.model.Mirror;
import nl.bytesoflife.deltakicad.model.Placement;
import nl.bytesoflife.deltakicad.model.ReferenceDesignators;
import nl.bytesoflife.deltakicad.model.Wire;
import nl.bytesoflife.deltakicad.parser.SExpressionWriter;
import nl.bytesoflife.deltakicad.parser.SNode;
import nl.bytesoflife.deltakicad.text.BlockFinder;
import nl.bytesoflife.deltakicad.text.BlockLocator;
import nl.bytesoflife.deltakicad.text.CoordinateFormat;
import nl.bytesoflife.deltakicad.text.Edit;
import nl.bytesoflife.deltakicad.text.Span;
import nl.bytesoflife.deltakicad.text.StructuralEditor;
import org.locationtech.jts.geom.Coordinate;

import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.regex.Pattern;

import static nl.bytesoflife.deltakicad.parser.SExpressionWriter.quote;
import static nl.bytesoflife.deltakicad.text.CoordinateFormat.format;

/**
 * Text-level schematic mutations. Each method takes the full {@code .kicad_sch} text and returns
 * the full new text; the caller decides whether to write it.
 */
public class SchematicEditor {

    static final String FORMAT_VERSION = "20231120";
    static final String GENERATOR = "delta_kicad";

    private static final Pattern POWER_REFERENCE = Pattern.compile("\"#PWR(\\d+)\"");
    private static final String TEXT_EFFECTS = "(effects (font (size 1.27 1.27)))";
    private static final String HIDDEN_EFFECTS = "(effects (font (size 1.27 1.27)) (hide yes))";

    private final StructuralEditor editor;
    private final SymbolCacheInjector injector;
    private final double tolerance;
    private final String projectName;

    public SchematicEditor(EngineSettings settings, String projectName) {
        this.editor = new StructuralEditor(settings.getIdentifierSupplier());
        this.injector = new SymbolCacheInjector(new SymbolLibraries(settings.getSymbolLibraries()), editor);
        this.tolerance = settings.getCoordinateTolerance();
        this.projectName = projectName;
    }

    public String create(String title, String revision) {
        StringBuilder sb = new StringBuilder();
        sb.append("(kicad_sch\n");
        sb.append("  (version ").append(FORMAT_VERSION).append(")\n");
        sb.append("  (generator ").append(quote(GENERATOR)).append(")\n");
        sb.append("  (generator_version \"8.0\")\n");
        sb.append("  (uuid ").append(quote(editor.newIdentifier())).append(")\n");
        sb.append("  (paper \"A4\")\n");
        if (!title.isEmpty() || !revision.isEmpty()) {
            sb.append("  (title_block\n");
            if (!title.isEmpty()) sb.append("    (title ").append(quote(title)).append(")\n");
            if (!revision.isEmpty()) sb.append("    (rev ").append(quote(revision)).append(")\n");
            sb.append("  )\n");
        }
        sb.append("  (lib_symbols\n  )\n");
        sb.append("  (sheet_instances\n    (path \"/\" (page \"1\"))\n  )\n");
        sb.append(")\n");
        return sb.toString();
    }

    /**
     * Places a symbol instance, caching its library definition first. An unresolvable definition
     * does not stop the placement.
     *
     * @throws AlreadyExistsException when the reference (and unit) is already placed
     */
    public Edit<PlacedComponent> addComponent(String text, NewComponent component) {
        String reference = ReferenceDesignators.requireValid(component.getReference());
        QualifiedId id = QualifiedId.parse(component.getLibId());
        requireUnplaced(text, reference, component.getUnit());

        CacheResult cache = injector.ensureCached(text, id);
        String uuid = editor.newIdentifier();
        double x = component.getX();
        double y = component.getY();

        StringBuilder block = new StringBuilder();
        block.append("  (symbol (lib_id ").append(quote(id.toString())).append(") ")
                .append(StructuralEditor.atClause(x, y, component.getRotation(), true));
        if (component.getMirror() != Mirror.NONE) {
            block.append(" (mirror ").append(component.getMirror().name().toLowerCase(Locale.ROOT)).append(")");
        }
        block.append(" (unit ").append(component.getUnit()).append(")\n");
        block.append("    (in_bom yes) (on_board yes) (dnp no)\n");
        block.append("    (uuid ").append(quote(uuid)).append(")\n");
        block.append(property("Reference", reference, x, y - 2, false));
        block.append(property("Value", component.getValue(), x, y + 2, false));
        block.append(property("Footprint", component.getFootprint(), x, y + 4, true));
        double offset = 6;
        for (Map.Entry<String, String> extra : component.getProperties().entrySet()) {
            block.append(property(extra.getKey(), extra.getValue(), x, y + offset, true));
            offset += 2;
        }
        block.append(instances(cache.text(), reference, component.getUnit()));
        block.append("  )");

        String updated = editor.insertBeforeEnd(cache.text(), block.toString());
        Placement placement = new Placement(x, y, component.getRotation(), component.getMirror());
        return new Edit<>(updated, new PlacedComponent(reference, id.toString(), component.getValue(), placement,
                uuid, cache.resolved()));
    }

    /**
     * Places {@code power:<name>} with the next free {@code #PWRnnn} reference.
     */
    public Edit<PlacedComponent> addPowerSymbol(String text, String name, double x, double y, double rotation) {
        QualifiedId id = new QualifiedId("power", name);
        String reference = String.format("#PWR%03d", StructuralEditor.nextNumber(text, POWER_REFERENCE));

        CacheResult cache = injector.ensureCached(text, id);
        String uuid = editor.newIdentifier();
        String block = "  (symbol (lib_id " + quote(id.toString()) + ") " + StructuralEditor.atClause(x, y, rotation, true)
                + " (unit 1)\n"
                + "    (in_bom yes) (on_board yes) (dnp no)\n"
                + "    (uuid " + quote(uuid) + ")\n"
                + property("Reference", reference, x, y - 2, true)
                + property("Value", name, x, y + 2, false)
                + instances(cache.text(), reference, 1)
                + "  )";
        String updated = editor.insertBeforeEnd(cache.text(), block);
        return new Edit<>(updated, new PlacedComponent(reference, id.toString(), name, Placement.at(x, y, rotation),
                uuid, cache.resolved()));
    }

    public Edit<Wire> addWire(String text, Coordinate start, Coordinate end) {
        String uuid = editor.newIdentifier();
        String block = "  (wire (pts (xy " + format(start.x) + " " + format(start.y) + ") (xy "
                + format(end.x) + " " + format(end.y) + "))\n"
                + "    (stroke (width 0) (type default))\n"
                + "    (uuid " + quote(uuid) + ")\n"
                + "  )";
        return new Edit<>(editor.insertBeforeEnd(text, block), new Wire(start, end, uuid));
    }

    public Edit<Label> addLabel(String text, String name, LabelType type, Coordinate position, double angle) {
        String uuid = editor.newIdentifier();
        StringBuilder block = new StringBuilder();
        block.append("  (").append(type.getTag()).append(" ").append(quote(name));
        if (type != LabelType.LOCAL) {
            block.append(" (shape bidirectional)");
        }
        block.append(" ").append(StructuralEditor.atClause(position.x, position.y, angle, true)).append("\n");
        block.append("    ").append(TEXT_EFFECTS).append("\n");
        block.append("    (uuid ").append(quote(uuid)).append(")\n");
        block.append("  )");
        return new Edit<>(editor.insertBeforeEnd(text, block.toString()), new Label(name, type, position, angle, uuid));
    }

    public Edit<String> addNoConnect(String text, Coordinate position) {
        String uuid = editor.newIdentifier();
        String block = "  (no_connect " + StructuralEditor.atClause(position.x, position.y, 0, false)
                + " (uuid " + quote(uuid) + "))";
        return new Edit<>(editor.insertBeforeEnd(text, block), uuid);
    }

    public Edit<String> addJunction(String text, Coordinate position) {
        String uuid = editor.newIdentifier();
        String block = "  (junction " + StructuralEditor.atClause(position.x, position.y, 0, false)
                + " (diameter 0) (color 0 0 0 0)\n"
                + "    (uuid " + quote(uuid) + ")\n"
                + "  )";
        return new Edit<>(editor.insertBeforeEnd(text, block), uuid);
    }

    /**
     * Moves the first placed instance of {@code reference}, carrying its property labels along.
     *
     * @param rotation new rotation, or {@code null} to keep the current one
     */
    public Edit<Placement> moveComponent(String text, String reference, double x, double y, Double rotation) {
        return move(text, requireSymbol(text, reference), x, y, rotation);
    }

    /**
     * Moves one unit of a multi-unit part.
     */
    public Edit<Placement> moveComponent(String text, String reference, int unit, double x, double y, Double rotation) {
        Span span = requireInstances(text, reference).stream()
                .filter(candidate -> unitOf(BlockFinder.parseBlock(text, candidate)) == unit)
                .findFirst()
                .orElseThrow(() -> new NotFoundException(reference, "Unit " + unit + " of '" + reference + "' not found"));
        return move(text, span, x, y, rotation);
    }

    private Edit<Placement> move(String text, Span span, double x, double y, Double rotation) {
        String moved = editor.relocate(span.text(text), x, y, rotation, true);
        SNode.SList parsed = BlockFinder.parseBlock(moved, new Span(0, moved.length()));
        return new Edit<>(editor.replace(text, span, moved), Placement.of(parsed));
    }

    /**
     * Sets a property value on every unit placed under {@code reference}, adding a hidden property
     * where an instance has none of that name.
     */
    public String updateProperty(String text, String reference, String name, String value) {
        List<Span> instances = requireInstances(text, reference);
        String result = text;
        // Back to front so earlier spans stay valid.
        for (int i = instances.size() - 1; i >= 0; i--) {
            result = updateProperty(result, instances.get(i), reference, name, value);
        }
        return result;
    }

    private String updateProperty(String text, Span symbol, String reference, String name, String value) {
        Optional<Span> lastProperty = Optional.empty();
        for (BlockFinder.Child child : BlockFinder.children(text, symbol)) {
            if (!child.tag().equals("property")) continue;
            Optional<Span> nameToken = BlockFinder.atomSpan(text, child.span(), 1);
            if (nameToken.isPresent() && SExpressionWriter.unquote(nameToken.get().text(text)).equals(name)) {
                Span valueToken = BlockFinder.atomSpan(text, child.span(), 2)
                        .orElseThrow(() -> new NotFoundException(name, "Property " + name + " of " + reference + " has no value"));
                return editor.replace(text, valueToken, quote(value));
            }
            lastProperty = Optional.of(child.span());
        }

        SNode.SList parsed = BlockFinder.parseBlock(text, symbol);
        Placement placement = Placement.of(parsed);
        String indent = lastProperty.map(p -> StructuralEditor.lineIndent(text, p.start())).orElse("    ");
        String block = property(name, value, placement.x(), placement.y() + 6, true).stripTrailing();
        block = StructuralEditor.reindent(block.strip(), "    ", indent);
        if (lastProperty.isPresent()) {
            return editor.insertAt(text, lastProperty.get().end(), "\n" + indent + block);
        }
        return editor.insertIntoBlock(text, symbol, indent + block);
    }

    /**
     * Removes every unit placed under {@code reference}.
     */
    public String removeComponent(String text, String reference) {
        List<Span> instances = requireInstances(text, reference);
        String result = text;
        for (int i = instances.size() - 1; i >= 0; i--) {
            result = editor.delete(result, instances.get(i));
        }
        return result;
    }

    public String removeWire(String text, Coordinate start, Coordinate end) {
        return editor.delete(text, BlockFinder.findWireByEndpoints(text, start, end, tolerance),
                "Wire from " + CoordinateFormat.describe(start) + " to " + CoordinateFormat.describe(end));
    }

    public String removeNoConnect(String text, Coordinate position) {
        return editor.delete(text, BlockFinder.findMarkerByPosition(text, "no_connect", position, tolerance),
                "No-connect at " + CoordinateFormat.describe(position));
    }

    public String removeJunction(String text, Coordinate position) {
        return editor.delete(text, BlockFinder.findMarkerByPosition(text, "junction", position, tolerance),
                "Junction at " + CoordinateFormat.describe(position));
    }

    private List<Span> requireInstances(String text, String reference) {
        List<Span> instances = BlockFinder.findSymbolsByReference(text, reference);
        if (instances.isEmpty()) {
            throw new NotFoundException(reference, "Symbol with reference '" + reference + "' not found");
        }
        return instances;
    }

    private Span requireSymbol(String text, String reference) {
        return BlockFinder.findSymbolByReference(text, reference)
                .orElseThrow(() -> new NotFoundException(reference, "Symbol with reference '" + reference + "' not found"));
    }

    private static void requireUnplaced(String text, String reference, int unit) {
        for (Span candidate : BlockFinder.candidates(text, "symbol")) {
            SNode.SList block = BlockFinder.parseBlock(text, candidate);
            if (!block.first("lib_id").isPresent()) continue;
            if (!reference.equals(block.property("Reference").orElse(null))) continue;
            if (unitOf(block) == unit) {
                throw new AlreadyExistsException(reference, "Reference " + reference + " is already placed");
            }
        }
    }

    private static int unitOf(SNode.SList block) {
        return (int) block.first("unit").map(u -> u.number(1, 1)).orElse(1.0).doubleValue();
    }

    private String instances(String text, String reference, int unit) {
        return "    (instances\n"
                + "      (project " + quote(projectName) + "\n"
                + "        (path " + quote("/" + rootIdentifier(text)) + "\n"
                + "          (reference " + quote(reference) + ") (unit " + unit + ")\n"
                + "        )\n"
                + "      )\n"
                + "    )\n";
    }

    private static String rootIdentifier(String text) {
        Span root = BlockLocator.spanAt(text, text.indexOf('('));
        return BlockFinder.child(text, root, "uuid")
                .map(span -> BlockFinder.parseBlock(text, span).atomValue(1))
                .orElse("");
    }

    private static String property(String name, String value, double x, double y, boolean hidden) {
        return "    (property " + quote(name) + " " + quote(value) + " " + StructuralEditor.atClause(x, y, 0, true) + "\n"
                + "      " + (hidden ? HIDDEN_EFFECTS : TEXT_EFFECTS) + "\n"
                + "    )\n";
    }
}
