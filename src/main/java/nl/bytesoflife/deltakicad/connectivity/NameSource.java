package nl.bytesoflife.deltakicad.connectivity;

/**
 * Where a net's name came from, in priority order.
 */
public enum NameSource {
    LABEL,
    POWER,
    SYNTHESIZED
}
