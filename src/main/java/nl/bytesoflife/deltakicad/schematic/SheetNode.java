package nl.bytesoflife.deltakicad.schematic;

import nl.bytesoflife.deltakicad.model.SheetPin;

import java.nio.file.Path;
import java.util.List;
import java.util.Optional;

/**
 * One level of a schematic's sheet tree.
 *
 * @param name        sheet name on the parent, or the file stem for the root
 * @param pins        sheet pins on the parent's sheet symbol; empty for the root
 * @param symbolCount symbol instances on this sheet, power symbols included
 * @param error       why the sheet could not be expanded (missing file, circular reference, unreadable)
 */
public record SheetNode(String name, Path file, List<SheetPin> pins, int symbolCount,
                        List<SheetNode> children, Optional<String> error) {

    public static final String FILE_NOT_FOUND = "file not found";
    public static final String CIRCULAR_REFERENCE = "circular reference detected";

    public SheetNode {
        pins = List.copyOf(pins);
        children = List.copyOf(children);
    }

    static SheetNode failed(String name, Path file, List<SheetPin> pins, String error) {
        return new SheetNode(name, file, pins, 0, List.of(), Optional.of(error));
    }

    public boolean hasError() {
        return error.isPresent();
    }

    /**
     * This node and every node below it, depth first.
     */
    public int size() {
        return 1 + children.stream().mapToInt(SheetNode::size).sum();
    }
}
