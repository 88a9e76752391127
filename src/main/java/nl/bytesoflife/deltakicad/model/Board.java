package nl.bytesoflife.deltakicad.model;

import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Snapshot of a {@code .kicad_pcb} file.
 *
 * @param setup scalar entries of the {@code (setup ...)} section, keyed by tag
 */
public record Board(BoardInfo info, List<BoardFootprint> footprints, List<BoardNet> nets,
                    List<TrackSegment> segments, List<Via> vias, Map<String, String> setup) {

    public Board {
        footprints = List.copyOf(footprints);
        nets = List.copyOf(nets);
        segments = List.copyOf(segments);
        vias = List.copyOf(vias);
        setup = Map.copyOf(setup);
    }

    public Optional<BoardFootprint> footprint(String reference) {
        return footprints.stream().filter(f -> f.reference().equals(reference)).findFirst();
    }

    public Optional<BoardNet> net(String name) {
        return nets.stream().filter(n -> n.name().equals(name)).findFirst();
    }
}
