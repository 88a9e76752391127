package nl.bytesoflife.deltakicad.connectivity;

import nl.bytesoflife.deltakicad.library.SymbolLibraries;
import nl.bytesoflife.deltakicad.model.Mirror;
import nl.bytesoflife.deltakicad.model.Placement;
import nl.bytesoflife.deltakicad.model.Schematic;
import nl.bytesoflife.deltakicad.model.SchematicReader;
import org.junit.jupiter.api.Test;
import org.locationtech.jts.geom.Coordinate;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class PinPlacerTest {

    private static final Coordinate TOP_PIN = new Coordinate(0, 3.81);

    private final PinPlacer placer = new PinPlacer(
            new SymbolLibraries(List.of(Path.of("testdata/libraries/Device.kicad_sym"))));

    private static Schematic schematic(String body) {
        return new SchematicReader().read("(kicad_sch\n" + body + "\n)");
    }

    @Test
    void libraryYAxisPointsUp() {
        assertEquals(new Coordinate(100, 41.19), PinPlacer.transform(TOP_PIN, Placement.at(100, 45, 0)));
    }

    @Test
    void rotationIsCounterClockwiseOnSheet() {
        assertEquals(new Coordinate(96.19, 45), PinPlacer.transform(TOP_PIN, Placement.at(100, 45, 90)));
        assertEquals(new Coordinate(100, 48.81), PinPlacer.transform(TOP_PIN, Placement.at(100, 45, 180)));
        assertEquals(new Coordinate(103.81, 45), PinPlacer.transform(TOP_PIN, Placement.at(100, 45, 270)));
        assertEquals(new Coordinate(96.19, 45), PinPlacer.transform(TOP_PIN, Placement.at(100, 45, -270)));
    }

    @Test
    void mirrorAfterRotation() {
        assertEquals(new Coordinate(100, 48.81), PinPlacer.transform(TOP_PIN, new Placement(100, 45, 0, Mirror.X)));
        Coordinate output = new Coordinate(7.62, 0);
        assertEquals(new Coordinate(42.38, 50), PinPlacer.transform(output, new Placement(50, 50, 0, Mirror.Y)));
        assertEquals(new Coordinate(103.81, 45), PinPlacer.transform(TOP_PIN, new Placement(100, 45, 90, Mirror.Y)));
    }

    @Test
    void resultsAreRounded() {
        assertEquals(new Coordinate(0, 0), PinPlacer.transform(new Coordinate(0.00004, -0.00004), Placement.at(0, 0, 0)));
        // assertEquals on doubles tells 0.0 and -0.0 apart
        Coordinate flipped = PinPlacer.transform(new Coordinate(0, 0), new Placement(0, 0, 0, Mirror.Y));
        assertEquals(0.0, flipped.x);
        assertEquals(0.0, flipped.y);
    }

    @Test
    void placePinsFromSchematicCache() throws IOException {
        Schematic divider = new SchematicReader().read(Files.readString(Path.of("testdata/schematics/divider.kicad_sch")));
        List<PlacedPin> pins = new PinPlacer().place(divider, divider.symbol("R2").orElseThrow());

        assertEquals(2, pins.size());
        assertEquals("R2.1", pins.get(0).id());
        assertEquals(new Coordinate(100, 56.19), pins.get(0).position());
        assertEquals(new Coordinate(100, 63.81), pins.get(1).position());
        assertEquals("passive", pins.get(1).electricalType());
    }

    @Test
    void placeOnlySelectedUnit() {
        Schematic schematic = schematic("""
                (symbol (lib_id "Device:OpAmp_Dual") (at 50 50 0) (unit 2)
                  (property "Reference" "U1" (at 0 0 0)))""");
        List<PlacedPin> pins = placer.place(schematic, schematic.symbol("U1").orElseThrow());

        assertEquals(List.of("7", "6", "5"), pins.stream().map(PlacedPin::number).toList());
        assertEquals(new Coordinate(57.62, 50), pins.get(0).position());
        assertEquals(new Coordinate(42.38, 52.54), pins.get(1).position());
        assertEquals(new Coordinate(42.38, 47.46), pins.get(2).position());
    }

    @Test
    void derivedSymbolUsesParentPins() {
        Schematic schematic = schematic("""
                (symbol (lib_id "Device:R_US") (at 10 10 0) (unit 1)
                  (property "Reference" "R5" (at 0 0 0)))""");
        List<PlacedPin> pins = placer.place(schematic, schematic.symbol("R5").orElseThrow());

        assertEquals(2, pins.size());
        assertEquals(new Coordinate(10, 6.19), pins.get(0).position());
    }

    @Test
    void unknownDefinitionHasNoPins() {
        Schematic schematic = schematic("""
                (symbol (lib_id "Device:Missing") (at 0 0 0) (property "Reference" "X1" (at 0 0 0)))
                (symbol (lib_id "R") (at 0 0 0) (property "Reference" "X2" (at 0 0 0)))""");
        assertTrue(placer.place(schematic, schematic.symbol("X1").orElseThrow()).isEmpty());
        assertTrue(placer.place(schematic, schematic.symbol("X2").orElseThrow()).isEmpty());
    }
}
