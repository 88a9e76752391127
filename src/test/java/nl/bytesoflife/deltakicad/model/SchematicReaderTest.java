package nl.bytesoflife.deltakicad.model;

import nl.bytesoflife.deltakicad.parser.MalformedDocumentException;
import org.junit.jupiter.api.BeforeAll;
import org.junit.jupiter.api.Test;
import org.locationtech.jts.geom.Coordinate;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;

class SchematicReaderTest {

    private static Schematic divider;

    @BeforeAll
    static void load() throws IOException {
        divider = new SchematicReader().read(Files.readString(Path.of("testdata/schematics/divider.kicad_sch")));
    }

    @Test
    void readHeaderAndTitleBlock() {
        assertEquals("20231120", divider.version());
        assertEquals(new TitleBlock("Divider", "2024-03-01", "A", "Bytes of Life"), divider.titleBlock());
    }

    @Test
    void readSymbolInstances() {
        assertEquals(4, divider.symbols().size());
        assertEquals(List.of("R1", "R2"), divider.components().stream().map(SchematicSymbol::reference).toList());
        assertEquals(List.of("#PWR01", "#PWR02"), divider.powerSymbols().stream().map(SchematicSymbol::reference).toList());

        SchematicSymbol r1 = divider.symbol("R1").orElseThrow();
        assertEquals("Device:R", r1.libId());
        assertEquals("10k", r1.value());
        assertEquals("Resistor_SMD:R_0603_1608Metric", r1.footprint());
        assertEquals(Placement.at(100, 45, 0), r1.placement());
        assertEquals(1, r1.unit());
        assertTrue(r1.onBoard());
        assertTrue(r1.inBom());
        assertFalse(r1.isPower());
    }

    @Test
    void readWiresLabelsAndCache() {
        assertEquals(1, divider.wires().size());
        assertEquals(new Coordinate(100, 48.81), divider.wires().get(0).start());
        assertEquals(1, divider.labels().size());
        Label label = divider.labels().get(0);
        assertEquals("MID", label.text());
        assertEquals(LabelType.LOCAL, label.type());
        assertEquals(Set.of("Device:R", "power:GND", "power:VCC"), divider.libraryDefinitions().keySet());
    }

    @Test
    void cachedDefinitionExposesPins() {
        SymbolDefinition resistor = divider.definition("Device:R").orElseThrow();
        List<LibraryPin> pins = resistor.getPins(1, 1);
        assertEquals(2, pins.size());
        assertEquals(new Coordinate(0, 3.81), pins.get(0).position());
        assertEquals(1, pins.get(0).unit());

        SymbolDefinition vcc = divider.definition("power:VCC").orElseThrow();
        assertTrue(vcc.isPower());
        assertTrue(vcc.getPins().get(0).hidden());
    }

    @Test
    void splitMultiPointWires() {
        Schematic schematic = new SchematicReader().read(
                "(kicad_sch (wire (pts (xy 0 0) (xy 10 0) (xy 10 10)) (uuid \"w\")))");
        assertEquals(2, schematic.wires().size());
        assertEquals(new Coordinate(10, 0), schematic.wires().get(1).start());
        assertEquals(new Coordinate(10, 10), schematic.wires().get(1).end());
    }

    @Test
    void readUnitBodyStyleAndBoardFlags() {
        Schematic schematic = new SchematicReader().read("""
                (kicad_sch
                  (symbol (lib_id "Device:OpAmp_Dual") (at 50 50 90) (mirror x) (unit 2) (convert 2)
                    (in_bom no) (on_board no)
                    (property "Reference" "U1" (at 0 0 0)))
                  (global_label "CLK" (shape input) (at 10 20 180))
                  (no_connect (at 5 5))
                  (junction (at 7 7))
                )
                """);
        SchematicSymbol u1 = schematic.symbol("U1").orElseThrow();
        assertEquals(2, u1.unit());
        assertEquals(2, u1.bodyStyle());
        assertEquals(Mirror.X, u1.placement().mirror());
        assertEquals(1, u1.placement().quarterTurns());
        assertFalse(u1.onBoard());
        assertFalse(u1.inBom());
        assertEquals(LabelType.GLOBAL, schematic.labels().get(0).type());
        assertEquals(180, schematic.labels().get(0).angle());
        assertEquals(List.of(new Coordinate(5, 5)), schematic.noConnects());
        assertEquals(List.of(new Coordinate(7, 7)), schematic.junctions());
    }

    @Test
    void rejectOtherDocuments() {
        assertThrows(MalformedDocumentException.class, () -> new SchematicReader().read("(kicad_pcb (version 1))"));
    }

    @Test
    void readSheets() throws IOException {
        Schematic top = new SchematicReader().read(Files.readString(Path.of("testdata/schematics/hierarchy/top.kicad_sch")));
        assertTrue(divider.sheets().isEmpty());
        assertEquals(2, top.sheets().size());

        Sheet power = top.sheets().get(0);
        assertEquals("Power", power.name());
        assertEquals("power.kicad_sch", power.file());
        assertEquals(new Coordinate(50.8, 38.1), power.position());
        assertEquals(25.4, power.width());
        assertEquals(15.24, power.height());
        assertEquals(List.of(
                new SheetPin("VIN", "input", new Coordinate(50.8, 43.18), "7a1b2c3d-0000-4000-8000-000000000102"),
                new SheetPin("3V3", "output", new Coordinate(76.2, 43.18), "7a1b2c3d-0000-4000-8000-000000000103")),
                power.pins());

        assertEquals("sensor.kicad_sch", top.sheets().get(1).file());
        assertTrue(top.sheets().get(1).pins().isEmpty());
    }

    @Test
    void skipSheetsWithoutFile() {
        Schematic schematic = new SchematicReader().read(
                "(kicad_sch (version 20231120) (sheet (at 0 0) (size 5 5) (property \"Sheetname\" \"Orphan\")))");
        assertTrue(schematic.sheets().isEmpty());
    }
}
