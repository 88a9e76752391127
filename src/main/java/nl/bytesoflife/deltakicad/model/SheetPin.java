package nl.bytesoflife.deltakicad.model;

import org.locationtech.jts.geom.Coordinate;

/**
 * Connection point on the edge of a sheet symbol, matched by name to a hierarchical label in the
 * sheet's file.
 *
 * @param direction {@code input}, {@code output}, {@code bidirectional}, {@code tri_state} or {@code passive}
 */
public record SheetPin(String name, String direction, Coordinate position, String uuid) {
}
