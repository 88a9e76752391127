package nl.bytesoflife.deltakicad.model;

import org.locationtech.jts.geom.Coordinate;

public record Wire(Coordinate start, Coordinate end, String uuid) {
}
