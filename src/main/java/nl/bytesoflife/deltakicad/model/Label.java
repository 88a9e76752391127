package nl.bytesoflife.deltakicad.model;

import org.locationtech.jts.geom.Coordinate;

public record Label(String text, LabelType type, Coordinate position, double angle, String uuid) {
}
