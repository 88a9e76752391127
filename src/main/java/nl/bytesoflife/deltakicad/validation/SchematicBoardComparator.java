package nl.bytesoflife.deltakicad.validation;

import nl.bytesoflife.deltakicad.model.Board;
import nl.bytesoflife.deltakicad.model.ReferenceDesignators;
import nl.bytesoflife.deltakicad.model.BoardFootprint;
import nl.bytesoflife.deltakicad.model.Schematic;
import nl.bytesoflife.deltakicad.model.SchematicSymbol;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;

/**
 * Compares the components of a schematic with the footprints of a board. Power symbols and
 * instances marked not-on-board are left out; the units of a multi-unit part count once.
 */
public class SchematicBoardComparator {

    public ComparisonReport compare(Schematic schematic, Board board) {
        Map<String, SchematicSymbol> components = new TreeMap<>(ReferenceDesignators::compare);
        for (SchematicSymbol symbol : schematic.components()) {
            if (!symbol.onBoard() || symbol.reference().isEmpty()) continue;
            components.putIfAbsent(symbol.reference(), symbol);
        }
        Map<String, BoardFootprint> footprints = new TreeMap<>(ReferenceDesignators::compare);
        for (BoardFootprint footprint : board.footprints()) {
            if (footprint.reference().isEmpty() || footprint.reference().startsWith("#")) continue;
            footprints.putIfAbsent(footprint.reference(), footprint);
        }

        List<String> matched = new ArrayList<>();
        List<String> missingFromBoard = new ArrayList<>();
        List<String> missingFromSchematic = new ArrayList<>();
        List<FieldMismatch> footprintMismatches = new ArrayList<>();
        List<FieldMismatch> valueMismatches = new ArrayList<>();

        for (Map.Entry<String, SchematicSymbol> entry : components.entrySet()) {
            String reference = entry.getKey();
            BoardFootprint footprint = footprints.get(reference);
            if (footprint == null) {
                missingFromBoard.add(reference);
                continue;
            }
            SchematicSymbol symbol = entry.getValue();
            boolean agrees = true;
            // An empty footprint field on either side is unassigned, not a mismatch.
            if (!symbol.footprint().isEmpty() && !footprint.footprint().isEmpty()
                    && !symbol.footprint().equals(footprint.footprint())) {
                footprintMismatches.add(new FieldMismatch(reference, symbol.footprint(), footprint.footprint()));
                agrees = false;
            }
            if (!symbol.value().equals(footprint.value())) {
                valueMismatches.add(new FieldMismatch(reference, symbol.value(), footprint.value()));
                agrees = false;
            }
            if (agrees) {
                matched.add(reference);
            }
        }
        for (String reference : footprints.keySet()) {
            if (!components.containsKey(reference)) {
                missingFromSchematic.add(reference);
            }
        }
        return new ComparisonReport(matched, missingFromBoard, missingFromSchematic, footprintMismatches, valueMismatches);
    }
}
