package nl.bytesoflife.deltakicad.validation.check;

import nl.bytesoflife.deltakicad.connectivity.Net;
import nl.bytesoflife.deltakicad.connectivity.PlacedPin;
import nl.bytesoflife.deltakicad.text.CoordinateFormat;
import nl.bytesoflife.deltakicad.validation.FindingType;
import nl.bytesoflife.deltakicad.validation.Severity;
import nl.bytesoflife.deltakicad.validation.ValidationFinding;
import nl.bytesoflife.deltakicad.validation.ValidationInput;
import org.locationtech.jts.geom.Coordinate;

import java.util.ArrayList;
import java.util.List;

/**
 * A pin is floating when nothing else touches it: its net holds no other connection item and no
 * no-connect marker sits on it.
 */
public class FloatingPinCheck implements SchematicCheck {

    @Override
    public FindingType getSupportedType() {
        return FindingType.FLOATING_PIN;
    }

    @Override
    public List<ValidationFinding> check(ValidationInput input, Severity severity) {
        List<ValidationFinding> findings = new ArrayList<>();
        List<Coordinate> noConnects = input.schematic().noConnects();

        for (Net net : input.nets().nets()) {
            if (net.pins().size() != 1 || net.itemCount() > 1) continue;

            PlacedPin pin = net.pins().get(0);
            boolean marked = noConnects.stream()
                    .anyMatch(nc -> CoordinateFormat.near(nc, pin.position(), input.tolerance()));
            if (marked) continue;

            findings.add(new ValidationFinding(
                    FindingType.FLOATING_PIN, severity,
                    "Pin " + pin.number() + " of " + pin.reference() + " is not connected and has no no-connect marker",
                    pin.reference(), pin.number(), net.name(), pin.position()));
        }
        return findings;
    }
}
