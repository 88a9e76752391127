package nl.bytesoflife.deltakicad.validation.check;

import nl.bytesoflife.deltakicad.model.SchematicSymbol;
import nl.bytesoflife.deltakicad.validation.FindingType;
import nl.bytesoflife.deltakicad.validation.Severity;
import nl.bytesoflife.deltakicad.validation.ValidationFinding;
import nl.bytesoflife.deltakicad.validation.ValidationInput;

import java.util.ArrayList;
import java.util.List;

/**
 * Flags power symbols whose net reaches no component pin.
 */
public class UnconnectedPowerCheck implements SchematicCheck {

    private static final String POWER_FLAG = "PWR_FLAG";

    @Override
    public FindingType getSupportedType() {
        return FindingType.UNCONNECTED_POWER;
    }

    @Override
    public List<ValidationFinding> check(ValidationInput input, Severity severity) {
        List<ValidationFinding> findings = new ArrayList<>();
        for (SchematicSymbol symbol : input.schematic().powerSymbols()) {
            if (POWER_FLAG.equals(symbol.value())) continue;
            boolean connected = input.nets().net(symbol.value()).map(n -> !n.pins().isEmpty()).orElse(false);
            if (connected) continue;

            findings.add(new ValidationFinding(
                    FindingType.UNCONNECTED_POWER, severity,
                    "Power symbol '" + symbol.value() + "' (" + symbol.reference() + ") is not connected to any component pins",
                    symbol.reference(), null, symbol.value(), symbol.placement().position()));
        }
        return findings;
    }
}
