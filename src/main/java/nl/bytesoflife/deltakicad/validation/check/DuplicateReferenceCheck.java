package nl.bytesoflife.deltakicad.validation.check;

import nl.bytesoflife.deltakicad.model.SchematicSymbol;
import nl.bytesoflife.deltakicad.validation.FindingType;
import nl.bytesoflife.deltakicad.validation.Severity;
import nl.bytesoflife.deltakicad.validation.ValidationFinding;
import nl.bytesoflife.deltakicad.validation.ValidationInput;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Flags component references used by more than one instance. Instances of different units of
 * one multi-unit part share a reference legitimately and are told apart by unit number.
 */
public class DuplicateReferenceCheck implements SchematicCheck {

    @Override
    public FindingType getSupportedType() {
        return FindingType.DUPLICATE_REFERENCE;
    }

    @Override
    public List<ValidationFinding> check(ValidationInput input, Severity severity) {
        Map<String, List<SchematicSymbol>> byKey = new LinkedHashMap<>();
        for (SchematicSymbol symbol : input.schematic().components()) {
            if (symbol.reference().isEmpty()) continue;
            byKey.computeIfAbsent(symbol.reference() + "#" + symbol.unit(), k -> new ArrayList<>()).add(symbol);
        }

        List<ValidationFinding> findings = new ArrayList<>();
        for (List<SchematicSymbol> instances : byKey.values()) {
            if (instances.size() < 2) continue;
            SchematicSymbol first = instances.get(0);
            findings.add(new ValidationFinding(
                    FindingType.DUPLICATE_REFERENCE, severity,
                    "Duplicate reference designator '" + first.reference() + "' (" + instances.size() + " instances)",
                    first.reference(), null, null, first.placement().position()));
        }
        return findings;
    }
}
