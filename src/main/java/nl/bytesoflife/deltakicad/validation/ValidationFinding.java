package nl.bytesoflife.deltakicad.validation;

import org.locationtech.jts.geom.Coordinate;

import java.util.Locale;

public class ValidationFinding {

    private final FindingType type;
    private final Severity severity;
    private final String description;
    private final String reference;
    private final String pin;
    private final String net;
    private final Coordinate position;

    public ValidationFinding(FindingType type, Severity severity, String description,
                             String reference, String pin, String net, Coordinate position) {
        this.type = type;
        this.severity = severity;
        this.description = description;
        this.reference = reference;
        this.pin = pin;
        this.net = net;
        this.position = position;
    }

    public FindingType getType() { return type; }
    public Severity getSeverity() { return severity; }
    public String getDescription() { return description; }
    public String getReference() { return reference; }
    public String getPin() { return pin; }
    public String getNet() { return net; }
    public Coordinate getPosition() { return position; }

    @Override
    public String toString() {
        StringBuilder sb = new StringBuilder();
        sb.append("[").append(severity).append("] ");
        sb.append(type).append(": ");
        sb.append(description);
        if (position != null) {
            sb.append(String.format(Locale.US, " at (%.4f, %.4f)", position.x, position.y));
        }
        return sb.toString();
    }
}
