package nl.bytesoflife.deltakicad.library;

import nl.bytesoflife.deltakicad.KicadDocumentException;

/**
 * A source or target library needed for an import does not exist or cannot be used.
 */
public class LibraryImportException extends KicadDocumentException {

    public LibraryImportException(String message) {
        super(message);
    }

    public LibraryImportException(String message, Throwable cause) {
        super(message, cause);
    }
}
