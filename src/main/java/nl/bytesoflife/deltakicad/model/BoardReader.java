package nl.bytesoflife.deltakicad.model;

import nl.bytesoflife.deltakicad.parser.MalformedDocumentException;
import nl.bytesoflife.deltakicad.parser.SExpressionParser;
import nl.bytesoflife.deltakicad.parser.SNode;
import org.locationtech.jts.geom.Coordinate;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Derives a {@link Board} from {@code .kicad_pcb} text.
 */
public class BoardReader {

    public Board read(String text) {
        SNode.SList root = new SExpressionParser().parseDocument(text);
        if (!root.hasTag("kicad_pcb")) {
            throw new MalformedDocumentException("Expected kicad_pcb root but found '" + root.tag() + "'", 0);
        }

        List<BoardFootprint> footprints = new ArrayList<>();
        List<BoardNet> nets = new ArrayList<>();
        List<TrackSegment> segments = new ArrayList<>();
        List<Via> vias = new ArrayList<>();
        for (SNode.SList item : root.lists()) {
            switch (item.tag()) {
                case "footprint" -> footprints.add(readFootprint(item));
                case "net" -> nets.add(new BoardNet((int) item.number(1, 0), item.atomValue(2)));
                case "segment" -> segments.add(readSegment(item));
                case "via" -> vias.add(readVia(item));
                default -> {
                }
            }
        }

        List<String> layers = new ArrayList<>();
        root.first("layers").ifPresent(section -> {
            for (SNode.SList layer : section.lists()) {
                layers.add(layer.atomValue(1));
            }
        });
        BoardInfo info = new BoardInfo(
                root.first("version").map(v -> v.atomValue(1)).orElse(""),
                root.first("generator").map(v -> v.atomValue(1)).orElse(""),
                root.first("title_block").map(TitleBlock::of).orElse(TitleBlock.EMPTY),
                root.first("paper").map(v -> v.atomValue(1)).orElse(""),
                root.first("general").flatMap(g -> g.first("thickness")).map(t -> t.number(1, 0)).orElse(0.0),
                layers);

        Map<String, String> setup = new LinkedHashMap<>();
        root.first("setup").ifPresent(section -> {
            for (SNode.SList entry : section.lists()) {
                if (entry.size() == 2 && entry.get(1) instanceof SNode.SAtom atom) {
                    setup.put(entry.tag(), atom.value());
                }
            }
        });
        return new Board(info, footprints, nets, segments, vias, setup);
    }

    private static BoardFootprint readFootprint(SNode.SList item) {
        String reference = item.property("Reference").orElse("");
        String value = item.property("Value").orElse("");
        for (SNode.SList fpText : item.lists("fp_text")) {
            if ("reference".equals(fpText.atomValue(1)) && reference.isEmpty()) {
                reference = fpText.atomValue(2);
            } else if ("value".equals(fpText.atomValue(1)) && value.isEmpty()) {
                value = fpText.atomValue(2);
            }
        }
        List<Pad> pads = new ArrayList<>();
        for (SNode.SList pad : item.lists("pad")) {
            SNode.SList net = pad.first("net").orElse(new SNode.SList(List.of()));
            pads.add(new Pad(pad.atomValue(1), pad.atomValue(2), (int) net.number(1, 0), net.atomValue(2)));
        }
        String layer = item.first("layer").map(l -> l.atomValue(1)).orElse("");
        Placement placement = Placement.of(item);
        if (layer.startsWith("B.")) {
            placement = new Placement(placement.x(), placement.y(), placement.rotation(), Mirror.Y);
        }
        return new BoardFootprint(reference, value, item.atomValue(1), placement, layer,
                item.first("uuid").map(u -> u.atomValue(1)).orElse(""), pads);
    }

    private static TrackSegment readSegment(SNode.SList item) {
        return new TrackSegment(
                point(item, "start"),
                point(item, "end"),
                item.first("width").map(w -> w.number(1, 0)).orElse(0.0),
                item.first("layer").map(l -> l.atomValue(1)).orElse(""),
                (int) item.first("net").map(n -> n.number(1, 0)).orElse(0.0).doubleValue(),
                item.first("uuid").map(u -> u.atomValue(1)).orElse(""));
    }

    private static Via readVia(SNode.SList item) {
        List<String> layers = new ArrayList<>();
        item.first("layers").ifPresent(l -> {
            for (int i = 1; i < l.size(); i++) {
                layers.add(l.atomValue(i));
            }
        });
        return new Via(
                point(item, "at"),
                item.first("size").map(s -> s.number(1, 0)).orElse(0.0),
                item.first("drill").map(d -> d.number(1, 0)).orElse(0.0),
                layers,
                (int) item.first("net").map(n -> n.number(1, 0)).orElse(0.0).doubleValue(),
                item.first("uuid").map(u -> u.atomValue(1)).orElse(""));
    }

    private static Coordinate point(SNode.SList item, String tag) {
        SNode.SList p = item.first(tag).orElse(new SNode.SList(List.of()));
        return new Coordinate(p.number(1, 0), p.number(2, 0));
    }
}
