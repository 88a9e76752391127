package nl.bytesoflife.deltakicad.board;

import nl.bytesoflife.deltakicad.config.EngineSettings;
import nl.bytesoflife.deltakicad.model.Board;
import nl.bytesoflife.deltakicad.model.BoardNet;
import nl.bytesoflife.deltakicad.model.BoardReader;
import nl.bytesoflife.deltakicad.model.Placement;
import nl.bytesoflife.deltakicad.model.TrackSegment;
import nl.bytesoflife.deltakicad.model.Via;
import nl.bytesoflife.deltakicad.text.Edit;
import org.locationtech.jts.geom.Coordinate;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;

/**
 * File-level operations on a {@code .kicad_pcb} file, one read and at most one overwrite per call.
 */
public class BoardDocument {

    private static final Logger log = LoggerFactory.getLogger(BoardDocument.class);

    public static final String EXTENSION = ".kicad_pcb";

    private final BoardReader reader = new BoardReader();
    private final BoardEditor editor;

    public BoardDocument(EngineSettings settings) {
        this.editor = new BoardEditor(settings);
    }

    public Board read(Path path) throws IOException {
        return reader.read(Files.readString(path));
    }

    public String placeFootprint(Path path, String reference, String footprintId, String value,
                                 double x, double y, String layer, double rotation) throws IOException {
        Edit<String> edit = editor.placeFootprint(Files.readString(path), reference, footprintId, value, x, y, layer, rotation);
        write(path, edit.text(), "place footprint", reference);
        return edit.result();
    }

    public Placement moveFootprint(Path path, String reference, double x, double y, Double rotation) throws IOException {
        Edit<Placement> edit = editor.moveFootprint(Files.readString(path), reference, x, y, rotation);
        write(path, edit.text(), "move footprint", reference);
        return edit.result();
    }

    public TrackSegment addTrack(Path path, Coordinate start, Coordinate end, double width, String layer, String net) throws IOException {
        Edit<TrackSegment> edit = editor.addTrack(Files.readString(path), start, end, width, layer, net);
        write(path, edit.text(), "add track", edit.result().uuid());
        return edit.result();
    }

    public Via addVia(Path path, Coordinate position, double size, double drill, String net) throws IOException {
        Edit<Via> edit = editor.addVia(Files.readString(path), position, size, drill, net);
        write(path, edit.text(), "add via", edit.result().uuid());
        return edit.result();
    }

    public BoardNet assignNet(Path path, String reference, String pad, String net) throws IOException {
        Edit<BoardNet> edit = editor.assignNet(Files.readString(path), reference, pad, net);
        write(path, edit.text(), "assign net " + net, reference + "." + pad);
        return edit.result();
    }

    private static void write(Path path, String text, String operation, String identifier) throws IOException {
        Files.writeString(path, text);
        log.info("{}: {} {}", path.getFileName(), operation, identifier);
    }
}
