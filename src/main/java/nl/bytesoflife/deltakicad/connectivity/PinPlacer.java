package nl.bytesoflife.deltakicad.connectivity;

import nl.bytesoflife.deltakicad.InvalidIdentifierException;
import nl.bytesoflife.deltakicad.library.QualifiedId;
import nl.bytesoflife.deltakicad.library.SymbolLibraries;
import nl.bytesoflife.deltakicad.model.LibraryPin;
import nl.bytesoflife.deltakicad.model.Placement;
import nl.bytesoflife.deltakicad.model.Schematic;
import nl.bytesoflife.deltakicad.model.SchematicSymbol;
import nl.bytesoflife.deltakicad.model.SymbolDefinition;
import nl.bytesoflife.deltakicad.text.CoordinateFormat;
import org.locationtech.jts.geom.Coordinate;
import org.locationtech.jts.geom.util.AffineTransformation;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Computes document-space pin positions of symbol instances.
 * <p>
 * Library drawings use a Y-up frame while the sheet is Y-down. A pin offset is flipped into the
 * sheet frame, rotated counter-clockwise (as seen on the sheet) by the instance's quarter turns,
 * mirrored, then translated to the instance position. Results are rounded to 0.0001 mm.
 */
public class PinPlacer {

    private static final Logger log = LoggerFactory.getLogger(PinPlacer.class);

    private static final int MAX_INHERITANCE_DEPTH = 5;

    private static final double[] SIN = {0, 1, 0, -1};
    private static final double[] COS = {1, 0, -1, 0};

    private final SymbolLibraries fallbackLibraries;

    /**
     * @param fallbackLibraries searched when a definition is missing from the schematic's cache
     */
    public PinPlacer(SymbolLibraries fallbackLibraries) {
        this.fallbackLibraries = fallbackLibraries;
    }

    public PinPlacer() {
        this(new SymbolLibraries(List.of()));
    }

    /**
     * Pins of the instance's unit and body style. Empty when no definition can be found.
     */
    public List<PlacedPin> place(Schematic schematic, SchematicSymbol symbol) {
        Optional<SymbolDefinition> definition = resolveDefinition(schematic, symbol.libId());
        if (definition.isEmpty()) {
            log.debug("No definition for {} ({}); it contributes no pins", symbol.reference(), symbol.libId());
            return List.of();
        }
        List<LibraryPin> libraryPins = pinsOf(schematic, definition.get(), symbol.libId(), symbol.unit(), symbol.bodyStyle());
        AffineTransformation transformation = transformation(symbol.placement());
        List<PlacedPin> placed = new ArrayList<>();
        for (LibraryPin pin : libraryPins) {
            Coordinate position = apply(transformation, pin.position());
            placed.add(new PlacedPin(symbol.reference(), pin.number(), pin.name(), pin.electricalType(), position));
        }
        return placed;
    }

    public Optional<SymbolDefinition> resolveDefinition(Schematic schematic, String libId) {
        Optional<SymbolDefinition> cached = schematic.definition(libId);
        if (cached.isPresent()) {
            return cached;
        }
        try {
            return fallbackLibraries.locate(QualifiedId.parse(libId)).map(block -> new SymbolDefinition(block.parse()));
        } catch (InvalidIdentifierException e) {
            log.debug("Instance lib_id '{}' is not qualified: {}", libId, e.getMessage());
            return Optional.empty();
        }
    }

    /**
     * Transformation from library coordinates to sheet coordinates for a placement.
     */
    public static AffineTransformation transformation(Placement placement) {
        int turns = placement.quarterTurns();
        AffineTransformation t = new AffineTransformation();
        t.scale(1, -1);
        t.rotate(-SIN[turns], COS[turns]);
        switch (placement.mirror()) {
            case X -> t.scale(1, -1);
            case Y -> t.scale(-1, 1);
            default -> {
            }
        }
        t.translate(placement.x(), placement.y());
        return t;
    }

    public static Coordinate transform(Coordinate libraryPoint, Placement placement) {
        return apply(transformation(placement), libraryPoint);
    }

    private static Coordinate apply(AffineTransformation transformation, Coordinate libraryPoint) {
        Coordinate result = new Coordinate();
        transformation.transform(libraryPoint, result);
        // -0.0 from the flips would otherwise survive rounding
        return new Coordinate(CoordinateFormat.round(result.x) + 0.0, CoordinateFormat.round(result.y) + 0.0);
    }

    /**
     * Pins of a definition, following {@code extends} to the parent when the definition draws none.
     */
    private List<LibraryPin> pinsOf(Schematic schematic, SymbolDefinition definition, String libId, int unit, int bodyStyle) {
        SymbolDefinition current = definition;
        for (int depth = 0; depth <= MAX_INHERITANCE_DEPTH; depth++) {
            List<LibraryPin> pins = current.getPins(unit, bodyStyle);
            Optional<String> parent = current.getExtends();
            if (!pins.isEmpty() || parent.isEmpty()) {
                return pins;
            }
            Optional<SymbolDefinition> next = resolveParent(schematic, libId, parent.get());
            if (next.isEmpty()) {
                log.debug("Parent {} of {} not found", parent.get(), libId);
                return pins;
            }
            current = next.get();
        }
        log.warn("Inheritance chain of {} is deeper than {}", libId, MAX_INHERITANCE_DEPTH);
        return List.of();
    }

    private Optional<SymbolDefinition> resolveParent(Schematic schematic, String libId, String parent) {
        if (parent.contains(":")) {
            return resolveDefinition(schematic, parent);
        }
        int colon = libId.indexOf(':');
        if (colon > 0) {
            Optional<SymbolDefinition> qualified = resolveDefinition(schematic, libId.substring(0, colon + 1) + parent);
            if (qualified.isPresent()) {
                return qualified;
            }
        }
        return schematic.definition(parent);
    }
}
