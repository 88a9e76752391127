package nl.bytesoflife.deltakicad.schematic;

import nl.bytesoflife.deltakicad.AlreadyExistsException;
import nl.bytesoflife.deltakicad.KicadDocumentException;
import nl.bytesoflife.deltakicad.NotFoundException;
import nl.bytesoflife.deltakicad.board.BoardDocument;
import nl.bytesoflife.deltakicad.config.EngineSettings;
import nl.bytesoflife.deltakicad.connectivity.ConnectivityResolver;
import nl.bytesoflife.deltakicad.connectivity.Net;
import nl.bytesoflife.deltakicad.connectivity.NetList;
import nl.bytesoflife.deltakicad.connectivity.PlacedPin;
import nl.bytesoflife.deltakicad.model.Label;
import nl.bytesoflife.deltakicad.model.LabelType;
import nl.bytesoflife.deltakicad.model.Placement;
import nl.bytesoflife.deltakicad.model.Schematic;
import nl.bytesoflife.deltakicad.model.SchematicReader;
import nl.bytesoflife.deltakicad.model.SchematicSymbol;
import nl.bytesoflife.deltakicad.model.Sheet;
import nl.bytesoflife.deltakicad.model.SheetPin;
import nl.bytesoflife.deltakicad.model.Wire;
import nl.bytesoflife.deltakicad.text.Edit;
import nl.bytesoflife.deltakicad.validation.ComparisonReport;
import nl.bytesoflife.deltakicad.validation.SchematicBoardComparator;
import nl.bytesoflife.deltakicad.validation.SchematicValidator;
import nl.bytesoflife.deltakicad.validation.ValidationReport;
import org.locationtech.jts.geom.Coordinate;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Optional;
import java.util.Set;

/**
 * File-level operations on a {@code .kicad_sch} file. Every call reads the file, computes the
 * result from that text alone and, for mutations, overwrites the file once. A failed mutation
 * leaves the file untouched.
 */
public class SchematicDocument {

    private static final Logger log = LoggerFactory.getLogger(SchematicDocument.class);

    public static final String EXTENSION = ".kicad_sch";

    private final EngineSettings settings;
    private final SchematicReader reader = new SchematicReader();
    private final ConnectivityResolver resolver;

    public SchematicDocument(EngineSettings settings) {
        this.settings = settings;
        this.resolver = new ConnectivityResolver(settings);
    }

    public void create(Path path, String title, String revision) throws IOException {
        if (Files.exists(path)) {
            throw new AlreadyExistsException(path.toString(), "Schematic " + path + " already exists");
        }
        Files.writeString(path, editor(path).create(title, revision));
        log.info("Created schematic {}", path);
    }

    public Schematic read(Path path) throws IOException {
        return reader.read(Files.readString(path));
    }

    public PlacedComponent addComponent(Path path, NewComponent component) throws IOException {
        Edit<PlacedComponent> edit = editor(path).addComponent(Files.readString(path), component);
        write(path, edit.text(), "add component", component.getReference());
        return edit.result();
    }

    public PlacedComponent addPowerSymbol(Path path, String name, double x, double y, double rotation) throws IOException {
        Edit<PlacedComponent> edit = editor(path).addPowerSymbol(Files.readString(path), name, x, y, rotation);
        write(path, edit.text(), "add power symbol", edit.result().reference());
        return edit.result();
    }

    public Wire addWire(Path path, Coordinate start, Coordinate end) throws IOException {
        Edit<Wire> edit = editor(path).addWire(Files.readString(path), start, end);
        write(path, edit.text(), "add wire", edit.result().uuid());
        return edit.result();
    }

    public Label addLabel(Path path, String name, LabelType type, Coordinate position, double angle) throws IOException {
        Edit<Label> edit = editor(path).addLabel(Files.readString(path), name, type, position, angle);
        write(path, edit.text(), "add " + type.getTag(), name);
        return edit.result();
    }

    public String addNoConnect(Path path, Coordinate position) throws IOException {
        Edit<String> edit = editor(path).addNoConnect(Files.readString(path), position);
        write(path, edit.text(), "add no-connect", edit.result());
        return edit.result();
    }

    public String addJunction(Path path, Coordinate position) throws IOException {
        Edit<String> edit = editor(path).addJunction(Files.readString(path), position);
        write(path, edit.text(), "add junction", edit.result());
        return edit.result();
    }

    public Placement moveComponent(Path path, String reference, double x, double y, Double rotation) throws IOException {
        Edit<Placement> edit = editor(path).moveComponent(Files.readString(path), reference, x, y, rotation);
        write(path, edit.text(), "move component", reference);
        return edit.result();
    }

    public Placement moveComponent(Path path, String reference, int unit, double x, double y, Double rotation) throws IOException {
        Edit<Placement> edit = editor(path).moveComponent(Files.readString(path), reference, unit, x, y, rotation);
        write(path, edit.text(), "move component", reference + " unit " + unit);
        return edit.result();
    }

    public void updateProperty(Path path, String reference, String name, String value) throws IOException {
        String updated = editor(path).updateProperty(Files.readString(path), reference, name, value);
        write(path, updated, "update " + name, reference);
    }

    public void removeComponent(Path path, String reference) throws IOException {
        write(path, editor(path).removeComponent(Files.readString(path), reference), "remove component", reference);
    }

    public void removeWire(Path path, Coordinate start, Coordinate end) throws IOException {
        write(path, editor(path).removeWire(Files.readString(path), start, end), "remove wire", start + " " + end);
    }

    public void removeNoConnect(Path path, Coordinate position) throws IOException {
        write(path, editor(path).removeNoConnect(Files.readString(path), position), "remove no-connect", position.toString());
    }

    public void removeJunction(Path path, Coordinate position) throws IOException {
        write(path, editor(path).removeJunction(Files.readString(path), position), "remove junction", position.toString());
    }

    /**
     * Document-space pins of every unit placed under {@code reference}.
     */
    public List<PlacedPin> pinPositions(Path path, String reference) throws IOException {
        Schematic schematic = read(path);
        List<SchematicSymbol> units = schematic.units(reference);
        if (units.isEmpty()) {
            throw new NotFoundException(reference, "Symbol with reference '" + reference + "' not found in " + path);
        }
        List<PlacedPin> pins = new ArrayList<>();
        for (SchematicSymbol unit : units) {
            pins.addAll(resolver.getPlacer().place(schematic, unit));
        }
        pins.sort(PlacedPin.ORDER);
        return pins;
    }

    public NetList nets(Path path) throws IOException {
        return resolver.resolve(read(path));
    }

    public Net pinNet(Path path, String reference, String pinNumber) throws IOException {
        return resolver.pinNet(read(path), reference, pinNumber);
    }

    public List<PlacedPin> netPins(Path path, String netName) throws IOException {
        return resolver.netPins(read(path), netName);
    }

    public ValidationReport validate(Path path) throws IOException {
        SchematicValidator validator = new SchematicValidator(resolver, settings.getCoordinateTolerance())
                .withDefaultChecks();
        settings.getSeverities().forEach(validator::withSeverity);
        ValidationReport report = validator.run(read(path));
        log.info("Validated {}: {} errors, {} warnings", path, report.getErrors().size(), report.getWarnings().size());
        return report;
    }

    public ComparisonReport compareWithBoard(Path schematicPath, Path boardPath) throws IOException {
        return new SchematicBoardComparator().compare(read(schematicPath), new BoardDocument(settings).read(boardPath));
    }

    /**
     * Sheet tree below {@code root}. Sheet files resolve against the directory of the schematic
     * that places them. A missing, unreadable or self-including sheet becomes a leaf carrying an
     * error; a file placed by several parents is expanded under each.
     */
    public SheetNode sheetHierarchy(Path root) throws IOException {
        Schematic schematic = read(root);
        Set<Path> ancestors = new HashSet<>();
        ancestors.add(root.toAbsolutePath().normalize());
        return expand(root, stem(root), List.of(), schematic, ancestors);
    }

    private SheetNode expand(Path path, String name, List<SheetPin> pins, Schematic schematic, Set<Path> ancestors) {
        List<SheetNode> children = new ArrayList<>();
        for (Sheet sheet : schematic.sheets()) {
            Path child = path.resolveSibling(sheet.file());
            Path key = child.toAbsolutePath().normalize();
            if (ancestors.contains(key)) {
                log.warn("Sheet {} in {} includes {} again", sheet.name(), path, child);
                children.add(SheetNode.failed(sheet.name(), child, sheet.pins(), SheetNode.CIRCULAR_REFERENCE));
                continue;
            }
            if (!Files.isRegularFile(child)) {
                log.warn("Sheet {} in {} points to missing file {}", sheet.name(), path, child);
                children.add(SheetNode.failed(sheet.name(), child, sheet.pins(), SheetNode.FILE_NOT_FOUND));
                continue;
            }
            Schematic sub;
            try {
                sub = read(child);
            } catch (IOException | KicadDocumentException e) {
                log.warn("Cannot read sheet {}: {}", child, e.getMessage());
                children.add(SheetNode.failed(sheet.name(), child, sheet.pins(), e.getMessage()));
                continue;
            }
            ancestors.add(key);
            children.add(expand(child, sheet.name(), sheet.pins(), sub, ancestors));
            ancestors.remove(key);
        }
        return new SheetNode(name, path, pins, schematic.symbols().size(), children, Optional.empty());
    }

    private static String stem(Path path) {
        String file = path.getFileName().toString();
        return file.endsWith(EXTENSION) ? file.substring(0, file.length() - EXTENSION.length()) : file;
    }

    private SchematicEditor editor(Path path) {
        return new SchematicEditor(settings, stem(path));
    }

    private static void write(Path path, String text, String operation, String identifier) throws IOException {
        Files.writeString(path, text);
        log.info("{}: {} {}", path.getFileName(), operation, identifier);
    }
}
