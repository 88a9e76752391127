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
 * Derives a {@link Schematic} from {@code .kicad_sch} text.
 */
public class SchematicReader {

    public Schematic read(String text) {
        SNode.SList root = new SExpressionParser().parseDocument(text);
        if (!root.hasTag("kicad_sch")) {
            throw new MalformedDocumentException("Expected kicad_sch root but found '" + root.tag() + "'", 0);
        }

        Map<String, SymbolDefinition> definitions = new LinkedHashMap<>();
        root.first("lib_symbols").ifPresent(cache -> {
            for (SNode.SList symbol : cache.lists("symbol")) {
                definitions.put(symbol.atomValue(1), new SymbolDefinition(symbol));
            }
        });

        List<SchematicSymbol> symbols = new ArrayList<>();
        List<Wire> wires = new ArrayList<>();
        List<Label> labels = new ArrayList<>();
        List<Coordinate> junctions = new ArrayList<>();
        List<Coordinate> noConnects = new ArrayList<>();
        List<Sheet> sheets = new ArrayList<>();

        for (SNode.SList item : root.lists()) {
            switch (item.tag()) {
                case "symbol" -> symbols.add(readSymbol(item));
                case "wire" -> readWire(item, wires);
                case "label", "global_label", "hierarchical_label" -> labels.add(readLabel(item));
                case "junction" -> junctions.add(anchor(item));
                case "no_connect" -> noConnects.add(anchor(item));
                case "sheet" -> Sheet.of(item).ifPresent(sheets::add);
                default -> {
                }
            }
        }

        String version = root.first("version").map(v -> v.atomValue(1)).orElse("");
        TitleBlock titleBlock = root.first("title_block").map(TitleBlock::of).orElse(TitleBlock.EMPTY);
        return new Schematic(version, titleBlock, symbols, wires, labels, junctions, noConnects, definitions, sheets);
    }

    private static SchematicSymbol readSymbol(SNode.SList item) {
        Map<String, String> properties = new LinkedHashMap<>();
        for (SNode.SList property : item.lists("property")) {
            properties.put(property.atomValue(1), property.atomValue(2));
        }
        String libId = item.first("lib_id").map(l -> l.atomValue(1)).orElse("");
        int unit = (int) item.first("unit").map(u -> u.number(1, 1)).orElse(1.0).doubleValue();
        int bodyStyle = (int) item.first("body_style").or(() -> item.first("convert"))
                .map(c -> c.number(1, 1)).orElse(1.0).doubleValue();
        boolean onBoard = item.first("on_board").map(o -> !"no".equals(o.atomValue(1))).orElse(true);
        boolean inBom = item.first("in_bom").map(o -> !"no".equals(o.atomValue(1))).orElse(true);
        String uuid = item.first("uuid").map(u -> u.atomValue(1)).orElse("");
        return new SchematicSymbol(
                properties.getOrDefault("Reference", ""),
                properties.getOrDefault("Value", ""),
                properties.getOrDefault("Footprint", ""),
                libId,
                Placement.of(item),
                unit,
                bodyStyle,
                onBoard,
                inBom,
                uuid,
                properties);
    }

    private static void readWire(SNode.SList item, List<Wire> wires) {
        List<Coordinate> points = new ArrayList<>();
        item.first("pts").ifPresent(pts -> {
            for (SNode.SList xy : pts.lists("xy")) {
                points.add(new Coordinate(xy.number(1, 0), xy.number(2, 0)));
            }
        });
        String uuid = item.first("uuid").map(u -> u.atomValue(1)).orElse("");
        // Multi-point wires are split into straight runs.
        for (int i = 1; i < points.size(); i++) {
            wires.add(new Wire(points.get(i - 1), points.get(i), uuid));
        }
    }

    private static Label readLabel(SNode.SList item) {
        SNode.SList at = item.first("at").orElse(new SNode.SList(List.of()));
        return new Label(
                item.atomValue(1),
                LabelType.fromName(item.tag()),
                new Coordinate(at.number(1, 0), at.number(2, 0)),
                at.number(3, 0),
                item.first("uuid").map(u -> u.atomValue(1)).orElse(""));
    }

    private static Coordinate anchor(SNode.SList item) {
        SNode.SList at = item.first("at").orElse(new SNode.SList(List.of()));
        return new Coordinate(at.number(1, 0), at.number(2, 0));
    }
}
