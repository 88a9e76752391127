package nl.bytesoflife.deltakicad.validation.check;

import nl.bytesoflife.deltakicad.validation.FindingType;
import nl.bytesoflife.deltakicad.validation.Severity;
import nl.bytesoflife.deltakicad.validation.ValidationFinding;
import nl.bytesoflife.deltakicad.validation.ValidationInput;

import java.util.List;

public interface SchematicCheck {

    List<ValidationFinding> check(ValidationInput input, Severity severity);

    FindingType getSupportedType();
}
