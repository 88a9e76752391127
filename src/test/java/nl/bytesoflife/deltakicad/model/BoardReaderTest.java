package nl.bytesoflife.deltakicad.model;

import nl.bytesoflife.deltakicad.parser.MalformedDocumentException;
import org.junit.jupiter.api.BeforeAll;
import org.junit.jupiter.api.Test;
import org.locationtech.jts.geom.Coordinate;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class BoardReaderTest {

    private static Board board;

    @BeforeAll
    static void load() throws IOException {
        board = new BoardReader().read(Files.readString(Path.of("testdata/boards/divider.kicad_pcb")));
    }

    @Test
    void readBoardInfo() {
        BoardInfo info = board.info();
        assertEquals("20240108", info.version());
        assertEquals("pcbnew", info.generator());
        assertEquals("Divider", info.titleBlock().title());
        assertEquals("A4", info.paper());
        assertEquals(1.6, info.thickness(), 1e-9);
        assertEquals(List.of("F.Cu", "B.Cu", "B.SilkS", "F.SilkS", "Edge.Cuts"), info.layers());
    }

    @Test
    void readNetTable() {
        assertEquals(3, board.nets().size());
        assertEquals(new BoardNet(2, "MID"), board.net("MID").orElseThrow());
        assertEquals(new BoardNet(0, ""), board.nets().get(0));
    }

    @Test
    void readFootprintsAndPads() {
        assertEquals(3, board.footprints().size());

        BoardFootprint r1 = board.footprint("R1").orElseThrow();
        assertEquals("10k", r1.value());
        assertEquals("Resistor_SMD:R_0603_1608Metric", r1.footprint());
        assertEquals("F.Cu", r1.layer());
        assertEquals(Placement.at(120, 80, 0), r1.placement());
        assertEquals(new Pad("1", "smd", 1, "VCC"), r1.pad("1").orElseThrow());

        BoardFootprint r2 = board.footprint("R2").orElseThrow();
        assertEquals(Mirror.Y, r2.placement().mirror());
        assertEquals(180, r2.placement().rotation());
        assertEquals(0, r2.pad("2").orElseThrow().netNumber());
    }

    @Test
    void readLegacyFootprintText() {
        BoardFootprint u1 = board.footprint("U1").orElseThrow();
        assertEquals("LM4040", u1.value());
        assertEquals(2, u1.pads().size());
    }

    @Test
    void readTracksAndVias() {
        TrackSegment segment = board.segments().get(0);
        assertEquals(new Coordinate(119.175, 80), segment.start());
        assertEquals(0.25, segment.width());
        assertEquals(1, segment.net());
        assertEquals(4.175, segment.length(), 1e-9);

        Via via = board.vias().get(0);
        assertEquals(new Coordinate(121, 82.5), via.position());
        assertEquals(0.3, via.drill());
        assertEquals(List.of("F.Cu", "B.Cu"), via.layers());
        assertEquals(2, via.net());
    }

    @Test
    void readScalarSetupEntries() {
        assertEquals("0", board.setup().get("pad_to_mask_clearance"));
        assertEquals("no", board.setup().get("allow_soldermask_bridges_in_footprints"));
        assertFalse(board.setup().containsKey("pcbplotparams"));
    }

    @Test
    void rejectOtherDocuments() {
        assertThrows(MalformedDocumentException.class, () -> new BoardReader().read("(kicad_sch (version 1))"));
    }
}
