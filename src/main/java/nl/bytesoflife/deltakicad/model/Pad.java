package nl.bytesoflife.deltakicad.model;

/**
 * @param netNumber 0 when the pad is unconnected
 */
public record Pad(String number, String type, int netNumber, String netName) {
}
