package nl.bytesoflife.deltakicad.model;

/**
 * Entry of the board's net table. Net 0 is the unnamed "no net".
 */
public record BoardNet(int number, String name) {
}
