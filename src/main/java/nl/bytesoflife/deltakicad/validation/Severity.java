package nl.bytesoflife.deltakicad.validation;

import java.util.Locale;

public enum Severity {
    ERROR,
    WARNING,
    IGNORE;

    /**
     * Parses a configured severity, ignoring case.
     *
     * @throws IllegalArgumentException for anything but error, warning or ignore
     */
    public static Severity fromName(String name) {
        return switch (name.trim().toLowerCase(Locale.ROOT)) {
            case "error" -> ERROR;
            case "warning" -> WARNING;
            case "ignore" -> IGNORE;
            default -> throw new IllegalArgumentException("Unknown severity: " + name);
        };
    }
}
