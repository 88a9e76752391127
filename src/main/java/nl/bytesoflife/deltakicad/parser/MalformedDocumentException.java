package nl.bytesoflife.deltakicad.parser;

import nl.bytesoflife.deltakicad.KicadDocumentException;

/**
 * Raised when document text has unbalanced parentheses or an unterminated quoted token.
 */
public class MalformedDocumentException extends KicadDocumentException {

    private final int position;

    public MalformedDocumentException(String message, int position) {
        super(message);
        this.position = position;
    }

    public int getPosition() {
        return position;
    }
}
