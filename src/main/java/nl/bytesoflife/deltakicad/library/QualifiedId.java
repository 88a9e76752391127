package nl.bytesoflife.deltakicad.library;

import nl.bytesoflife.deltakicad.InvalidIdentifierException;

/**
 * A library symbol or footprint identifier of the form {@code Library:Name}.
 */
public record QualifiedId(String library, String name) {

    public QualifiedId {
        if (library == null || library.isBlank() || name == null || name.isBlank()) {
            throw new InvalidIdentifierException(library + ":" + name, "Library and name must both be non-empty");
        }
    }

    /**
     * Splits at the first colon. Names may themselves contain colons; library names may not.
     */
    public static QualifiedId parse(String value) {
        if (value == null) {
            throw new InvalidIdentifierException(null, "Qualified identifier is missing");
        }
        int colon = value.indexOf(':');
        if (colon <= 0 || colon == value.length() - 1) {
            throw new InvalidIdentifierException(value, "Expected Library:Name but got '" + value + "'");
        }
        return new QualifiedId(value.substring(0, colon), value.substring(colon + 1));
    }

    /**
     * Qualified form of a sub-definition name such as {@code R_0_1}.
     */
    public String qualify(String localName) {
        return library + ":" + localName;
    }

    @Override
    public String toString() {
        return library + ":" + name;
    }
}
