package nl.bytesoflife.deltakicad.model;

import nl.bytesoflife.deltakicad.parser.SNode;
import org.locationtech.jts.geom.Coordinate;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * A hierarchical sheet symbol: a box on the parent sheet that stands for another schematic file.
 *
 * @param file sheet file name as written, relative to the parent schematic's directory
 */
public record Sheet(String name, String file, Coordinate position, double width, double height,
                    String uuid, List<SheetPin> pins) {

    public Sheet {
        pins = List.copyOf(pins);
    }

    /**
     * Reads a {@code (sheet ...)} block; empty when it names no sheet file.
     */
    static Optional<Sheet> of(SNode.SList block) {
        Optional<String> file = block.property("Sheetfile");
        if (file.isEmpty() || file.get().isEmpty()) {
            return Optional.empty();
        }
        SNode.SList at = block.first("at").orElse(new SNode.SList(List.of()));
        SNode.SList size = block.first("size").orElse(new SNode.SList(List.of()));
        List<SheetPin> pins = new ArrayList<>();
        for (SNode.SList pin : block.lists("pin")) {
            SNode.SList pinAt = pin.first("at").orElse(new SNode.SList(List.of()));
            pins.add(new SheetPin(pin.atomValue(1), pin.atomValue(2),
                    new Coordinate(pinAt.number(1, 0), pinAt.number(2, 0)),
                    pin.first("uuid").map(u -> u.atomValue(1)).orElse("")));
        }
        return Optional.of(new Sheet(
                block.property("Sheetname").orElse(file.get()),
                file.get(),
                new Coordinate(at.number(1, 0), at.number(2, 0)),
                size.number(1, 0),
                size.number(2, 0),
                block.first("uuid").map(u -> u.atomValue(1)).orElse(""),
                pins));
    }
}
