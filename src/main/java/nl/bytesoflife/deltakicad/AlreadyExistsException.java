package nl.bytesoflife.deltakicad;

/**
 * An insert would duplicate a reference designator, a cached library symbol, a library
 * entry or a footprint file. Nothing is written.
 */
public class AlreadyExistsException extends KicadDocumentException {

    private final String identifier;

    public AlreadyExistsException(String identifier, String message) {
        super(message);
        this.identifier = identifier;
    }

    public String getIdentifier() {
        return identifier;
    }
}
