package nl.bytesoflife.deltakicad.model;

import org.locationtech.jts.geom.Coordinate;

import java.util.List;

public record Via(Coordinate position, double size, double drill, List<String> layers, int net, String uuid) {

    public Via {
        layers = List.copyOf(layers);
    }
}
