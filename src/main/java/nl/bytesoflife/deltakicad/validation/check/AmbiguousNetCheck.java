package nl.bytesoflife.deltakicad.validation.check;

import nl.bytesoflife.deltakicad.connectivity.Net;
import nl.bytesoflife.deltakicad.validation.FindingType;
import nl.bytesoflife.deltakicad.validation.Severity;
import nl.bytesoflife.deltakicad.validation.ValidationFinding;
import nl.bytesoflife.deltakicad.validation.ValidationInput;

import java.util.ArrayList;
import java.util.List;

public class AmbiguousNetCheck implements SchematicCheck {

    @Override
    public FindingType getSupportedType() {
        return FindingType.AMBIGUOUS_NET;
    }

    @Override
    public List<ValidationFinding> check(ValidationInput input, Severity severity) {
        List<ValidationFinding> findings = new ArrayList<>();
        for (Net net : input.nets().ambiguous()) {
            findings.add(new ValidationFinding(
                    FindingType.AMBIGUOUS_NET, severity,
                    "Net '" + net.name() + "' is also labelled " + String.join(", ", net.conflictingNames()),
                    null, null, net.name(),
                    net.pins().isEmpty() ? null : net.pins().get(0).position()));
        }
        return findings;
    }
}
