package nl.bytesoflife.deltakicad.validation;

import nl.bytesoflife.deltakicad.model.Board;
import nl.bytesoflife.deltakicad.model.BoardReader;
import nl.bytesoflife.deltakicad.model.Placement;
import nl.bytesoflife.deltakicad.model.Schematic;
import nl.bytesoflife.deltakicad.model.SchematicReader;
import nl.bytesoflife.deltakicad.model.SchematicSymbol;
import org.junit.jupiter.api.BeforeAll;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class SchematicBoardComparatorTest {

    private static Schematic schematic;
    private static Board board;

    private final SchematicBoardComparator comparator = new SchematicBoardComparator();

    @BeforeAll
    static void load() throws IOException {
        schematic = new SchematicReader().read(Files.readString(Path.of("testdata/schematics/divider.kicad_sch")));
        board = new BoardReader().read(Files.readString(Path.of("testdata/boards/divider.kicad_pcb")));
    }

    private static SchematicSymbol component(String reference, String value, String footprint, boolean onBoard) {
        return new SchematicSymbol(reference, value, footprint, "Device:C", Placement.at(0, 0, 0), 1, 1, onBoard, true,
                reference, Map.of());
    }

    private static Schematic withExtra(SchematicSymbol... extra) {
        List<SchematicSymbol> symbols = new ArrayList<>(schematic.symbols());
        symbols.addAll(List.of(extra));
        return new Schematic(schematic.version(), schematic.titleBlock(), symbols, schematic.wires(),
                schematic.labels(), schematic.junctions(), schematic.noConnects(), schematic.libraryDefinitions());
    }

    @Test
    void compareDividerWithBoard() {
        ComparisonReport report = comparator.compare(withExtra(component("C1", "100n", "", true)), board);

        assertEquals(List.of("R1"), report.matched());
        assertEquals(List.of("C1"), report.missingFromBoard());
        assertEquals(List.of("U1"), report.missingFromSchematic());
        assertEquals(List.of(new FieldMismatch("R2", "4k7", "4.7k")), report.valueMismatches());
        assertTrue(report.footprintMismatches().isEmpty());
        assertFalse(report.inSync());
    }

    @Test
    void powerSymbolsAndOffBoardPartsAreIgnored() {
        ComparisonReport report = comparator.compare(withExtra(component("TP1", "TestPoint", "", false)), board);
        assertFalse(report.missingFromBoard().contains("#PWR01"));
        assertFalse(report.missingFromBoard().contains("TP1"));
        assertTrue(report.missingFromBoard().isEmpty());
    }

    @Test
    void footprintMismatchIsReported() {
        Board moved = new Board(board.info(), List.of(board.footprint("R1").orElseThrow()), board.nets(),
                board.segments(), board.vias(), board.setup());
        Schematic changed = new Schematic(schematic.version(), schematic.titleBlock(),
                List.of(component("R1", "10k", "Resistor_SMD:R_0805_2012Metric", true)),
                List.of(), List.of(), List.of(), List.of(), Map.of());

        ComparisonReport report = comparator.compare(changed, moved);

        assertEquals(1, report.footprintMismatches().size());
        assertEquals("Resistor_SMD:R_0603_1608Metric", report.footprintMismatches().get(0).boardValue());
        assertTrue(report.matched().isEmpty());
    }

    @Test
    void unassignedFootprintIsNotMismatch() {
        Board single = new Board(board.info(), List.of(board.footprint("R1").orElseThrow()), board.nets(),
                board.segments(), board.vias(), board.setup());
        Schematic unassigned = new Schematic("", schematic.titleBlock(),
                List.of(component("R1", "10k", "", true)), List.of(), List.of(), List.of(), List.of(), Map.of());

        ComparisonReport report = comparator.compare(unassigned, single);
        assertTrue(report.inSync());
        assertEquals(List.of("R1"), report.matched());
    }
}
