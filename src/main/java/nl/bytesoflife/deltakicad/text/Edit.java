package nl.bytesoflife.deltakicad.text;

/**
 * New document text together with what the edit produced.
 */
public record Edit<T>(String text, T result) {
}
