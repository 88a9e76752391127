package nl.bytesoflife.deltakicad.connectivity;

import nl.bytesoflife.deltakicad.model.ReferenceDesignators;
import org.locationtech.jts.geom.Coordinate;

import java.util.Comparator;

/**
 * A symbol pin at its document-space position.
 */
public record PlacedPin(String reference, String number, String name, String electricalType, Coordinate position) {

    /**
     * Orders by reference, then pin number, comparing embedded numbers numerically so that
     * {@code R2} sorts before {@code R10}.
     */
    public static final Comparator<PlacedPin> ORDER = Comparator
            .comparing(PlacedPin::reference, ReferenceDesignators::compare)
            .thenComparing(PlacedPin::number, ReferenceDesignators::compare);

    public String id() {
        return reference + "." + number;
    }
}
