package nl.bytesoflife.deltakicad.validation;

import java.util.List;

/**
 * Reconciliation of schematic components against board footprints, keyed by reference.
 * A reference appears in {@code matched} only when both sides agree on footprint and value.
 */
public record ComparisonReport(List<String> matched, List<String> missingFromBoard, List<String> missingFromSchematic,
                               List<FieldMismatch> footprintMismatches, List<FieldMismatch> valueMismatches) {

    public ComparisonReport {
        matched = List.copyOf(matched);
        missingFromBoard = List.copyOf(missingFromBoard);
        missingFromSchematic = List.copyOf(missingFromSchematic);
        footprintMismatches = List.copyOf(footprintMismatches);
        valueMismatches = List.copyOf(valueMismatches);
    }

    public boolean inSync() {
        return missingFromBoard.isEmpty() && missingFromSchematic.isEmpty()
                && footprintMismatches.isEmpty() && valueMismatches.isEmpty();
    }

    @Override
    public String toString() {
        StringBuilder sb = new StringBuilder("Schematic/Board Comparison:\n");
        sb.append("  Matched: ").append(matched.size()).append("\n");
        sb.append("  Missing from board: ").append(missingFromBoard).append("\n");
        sb.append("  Missing from schematic: ").append(missingFromSchematic).append("\n");
        for (FieldMismatch m : footprintMismatches) {
            sb.append("  - footprint ").append(m.reference()).append(": ")
              .append(m.schematicValue()).append(" vs ").append(m.boardValue()).append("\n");
        }
        for (FieldMismatch m : valueMismatches) {
            sb.append("  - value ").append(m.reference()).append(": ")
              .append(m.schematicValue()).append(" vs ").append(m.boardValue()).append("\n");
        }
        return sb.toString();
    }
}
