package nl.bytesoflife.deltakicad.model;

import org.locationtech.jts.geom.Coordinate;

public record TrackSegment(Coordinate start, Coordinate end, double width, String layer, int net, String uuid) {

    public double length() {
        return start.distance(end);
    }
}
