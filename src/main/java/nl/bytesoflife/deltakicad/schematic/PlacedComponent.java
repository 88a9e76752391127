package nl.bytesoflife.deltakicad.schematic;

import nl.bytesoflife.deltakicad.model.Placement;

/**
 * @param definitionCached false when the library definition could not be found; the instance was
 *                         still placed and KiCad will show it as missing until the library is available
 */
public record PlacedComponent(String reference, String libId, String value, Placement placement,
                              String uuid, boolean definitionCached) {
}
