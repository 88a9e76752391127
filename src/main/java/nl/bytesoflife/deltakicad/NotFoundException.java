package nl.bytesoflife.deltakicad;

/**
 * A search for a named or positioned block, pin or net found nothing. The document is left untouched.
 */
public class NotFoundException extends KicadDocumentException {

    private final String target;

    public NotFoundException(String target, String message) {
        super(message);
        this.target = target;
    }

    /**
     * The reference, coordinates or tag/value that was searched for.
     */
    public String getTarget() {
        return target;
    }
}
