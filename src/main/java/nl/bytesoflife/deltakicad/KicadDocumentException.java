package nl.bytesoflife.deltakicad;

/**
 * Base type for every failure raised while reading or editing a KiCad document.
 */
public class KicadDocumentException extends RuntimeException {

    public KicadDocumentException(String message) {
        super(message);
    }

    public KicadDocumentException(String message, Throwable cause) {
        super(message, cause);
    }
}
