package nl.bytesoflife.deltakicad.model;

import nl.bytesoflife.deltakicad.parser.SNode;
import org.locationtech.jts.geom.Coordinate;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Read view over a {@code (symbol ...)} library definition, cached or from a library file.
 * Unit and body style of nested drawings are taken from the {@code _<unit>_<style>} name suffix.
 */
public class SymbolDefinition {

    private static final Pattern UNIT_SUFFIX = Pattern.compile("_(\\d+)_(\\d+)$");

    private final SNode.SList node;

    public SymbolDefinition(SNode.SList node) {
        if (!node.hasTag("symbol")) {
            throw new IllegalArgumentException("Not a symbol definition: " + node.tag());
        }
        this.node = node;
    }

    public String getName() {
        return node.atomValue(1);
    }

    public SNode.SList getNode() {
        return node;
    }

    public Optional<String> property(String name) {
        return node.property(name);
    }

    public Optional<String> getExtends() {
        return node.first("extends").map(e -> e.atomValue(1));
    }

    public boolean isPower() {
        return node.first("power").isPresent();
    }

    public int getUnitCount() {
        int max = 1;
        for (SNode.SList unit : node.lists("symbol")) {
            Matcher m = UNIT_SUFFIX.matcher(unit.atomValue(1));
            if (m.find()) {
                max = Math.max(max, Integer.parseInt(m.group(1)));
            }
        }
        return max;
    }

    /**
     * Every pin of every unit and body style.
     */
    public List<LibraryPin> getPins() {
        List<LibraryPin> pins = new ArrayList<>();
        collectPins(node, 0, 0, pins);
        return pins;
    }

    public List<LibraryPin> getPins(int unit, int bodyStyle) {
        List<LibraryPin> selected = new ArrayList<>();
        for (LibraryPin pin : getPins()) {
            if (pin.appliesTo(unit, bodyStyle)) {
                selected.add(pin);
            }
        }
        return selected;
    }

    private static void collectPins(SNode.SList symbol, int unit, int bodyStyle, List<LibraryPin> pins) {
        for (SNode.SList pin : symbol.lists("pin")) {
            pins.add(toPin(pin, unit, bodyStyle));
        }
        for (SNode.SList nested : symbol.lists("symbol")) {
            Matcher m = UNIT_SUFFIX.matcher(nested.atomValue(1));
            if (m.find()) {
                collectPins(nested, Integer.parseInt(m.group(1)), Integer.parseInt(m.group(2)), pins);
            } else {
                collectPins(nested, unit, bodyStyle, pins);
            }
        }
    }

    private static LibraryPin toPin(SNode.SList pin, int unit, int bodyStyle) {
        SNode.SList at = pin.first("at").orElse(new SNode.SList(List.of()));
        String name = pin.first("name").map(n -> n.atomValue(1)).orElse("");
        String number = pin.first("number").map(n -> n.atomValue(1)).orElse("");
        double length = pin.first("length").map(l -> l.number(1, 0)).orElse(0.0);
        boolean hidden = pin.children().stream().anyMatch(c -> c instanceof SNode.SAtom a && a.value().equals("hide"))
                || pin.first("hide").map(h -> !"no".equals(h.atomValue(1))).orElse(false);
        return new LibraryPin(number, name, pin.atomValue(1), pin.atomValue(2),
                new Coordinate(at.number(1, 0), at.number(2, 0)), at.number(3, 0), length,
                unit, bodyStyle, hidden);
    }
}
