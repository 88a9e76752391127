package nl.bytesoflife.deltakicad.board;

import nl.bytesoflife.deltakicad.AlreadyExistsException;
import nl.bytesoflife.deltakicad.NotFoundException;
import nl.bytesoflife.deltakicad.config.EngineSettings;
import nl.bytesoflife.deltakicad.model.Board;
import nl.bytesoflife.deltakicad.model.BoardNet;
import nl.bytesoflife.deltakicad.model.Placement;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import org.locationtech.jts.geom.Coordinate;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class BoardDocumentTest {

    @TempDir
    Path dir;

    private BoardDocument document;
    private Path board;

    @BeforeEach
    void setUp() throws IOException {
        document = new BoardDocument(EngineSettings.defaults()
                .withFootprintLibraries(List.of(Path.of("testdata/libraries/Resistor_SMD.pretty"))));
        board = dir.resolve("divider" + BoardDocument.EXTENSION);
        Files.copy(Path.of("testdata/boards/divider.kicad_pcb"), board);
    }

    @Test
    void editsArePersisted() throws IOException {
        String uuid = document.placeFootprint(board, "R3", "Resistor_SMD:R_0805_2012Metric", "22k", 140, 80, "F.Cu", 0);
        document.addTrack(board, new Coordinate(140, 80), new Coordinate(145, 80), 0.25, "F.Cu", "OUT");
        document.addVia(board, new Coordinate(145, 80), 0.6, 0.3, "OUT");
        BoardNet net = document.assignNet(board, "R3", "1", "OUT");
        Placement moved = document.moveFootprint(board, "U1", 135, 80, null);

        Board read = document.read(board);
        assertEquals(uuid, read.footprint("R3").orElseThrow().uuid());
        assertEquals(new BoardNet(3, "OUT"), net);
        assertEquals(3, read.net("OUT").orElseThrow().number());
        assertEquals(2, read.segments().size());
        assertEquals(2, read.vias().size());
        assertEquals(3, read.vias().get(1).net());
        assertEquals("OUT", read.footprint("R3").orElseThrow().pads().get(0).netName());
        assertEquals(Placement.at(135, 80, 90), moved);
        assertEquals(moved, read.footprint("U1").orElseThrow().placement());
    }

    @Test
    void failedEditLeavesFileUntouched() throws IOException {
        String before = Files.readString(board);
        assertThrows(AlreadyExistsException.class,
                () -> document.placeFootprint(board, "R2", "Resistor_SMD:R_0603_1608Metric", "1k", 0, 0, "F.Cu", 0));
        assertThrows(NotFoundException.class, () -> document.assignNet(board, "R1", "9", "NEW"));
        assertEquals(before, Files.readString(board));
    }
}
