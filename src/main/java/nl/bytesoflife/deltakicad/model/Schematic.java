package nl.bytesoflife.deltakicad.model;

import org.locationtech.jts.geom.Coordinate;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Snapshot of a schematic sheet. Built fresh from the document text on every read.
 *
 * @param libraryDefinitions cached {@code lib_symbols} definitions keyed by qualified name
 * @param sheets             hierarchical sheet symbols placed on this sheet
 */
public record Schematic(String version, TitleBlock titleBlock, List<SchematicSymbol> symbols,
                        List<Wire> wires, List<Label> labels, List<Coordinate> junctions,
                        List<Coordinate> noConnects, Map<String, SymbolDefinition> libraryDefinitions,
                        List<Sheet> sheets) {

    public Schematic {
        sheets = List.copyOf(sheets);
        symbols = List.copyOf(symbols);
        wires = List.copyOf(wires);
        labels = List.copyOf(labels);
        junctions = List.copyOf(junctions);
        noConnects = List.copyOf(noConnects);
        libraryDefinitions = Map.copyOf(libraryDefinitions);
    }

    /**
     * A flat sheet without sub-sheets.
     */
    public Schematic(String version, TitleBlock titleBlock, List<SchematicSymbol> symbols,
                     List<Wire> wires, List<Label> labels, List<Coordinate> junctions,
                     List<Coordinate> noConnects, Map<String, SymbolDefinition> libraryDefinitions) {
        this(version, titleBlock, symbols, wires, labels, junctions, noConnects, libraryDefinitions, List.of());
    }

    /**
     * First instance carrying {@code reference}; multi-unit parts have one instance per unit.
     */
    public Optional<SchematicSymbol> symbol(String reference) {
        return symbols.stream().filter(s -> s.reference().equals(reference)).findFirst();
    }

    public List<SchematicSymbol> units(String reference) {
        return symbols.stream().filter(s -> s.reference().equals(reference)).toList();
    }

    public List<SchematicSymbol> components() {
        List<SchematicSymbol> components = new ArrayList<>();
        for (SchematicSymbol symbol : symbols) {
            if (!symbol.isPower()) {
                components.add(symbol);
            }
        }
        return components;
    }

    public List<SchematicSymbol> powerSymbols() {
        return symbols.stream().filter(SchematicSymbol::isPower).toList();
    }

    public Optional<SymbolDefinition> definition(String libId) {
        return Optional.ofNullable(libraryDefinitions.get(libId));
    }
}
