package nl.bytesoflife.deltakicad;

public class InvalidIdentifierException extends KicadDocumentException {

    private final String identifier;

    public InvalidIdentifierException(String identifier, String message) {
        super(message);
        this.identifier = identifier;
    }

    public String getIdentifier() {
        return identifier;
    }
}
