package nl.bytesoflife.deltakicad.model;

import org.locationtech.jts.geom.Coordinate;

/**
 * A pin as drawn in a library definition, in library coordinates (Y up).
 *
 * @param unit      owning unit, 0 when shared by all units
 * @param bodyStyle owning body style, 0 when shared by all styles
 */
public record LibraryPin(String number, String name, String electricalType, String shape,
                         Coordinate position, double angle, double length,
                         int unit, int bodyStyle, boolean hidden) {

    public boolean appliesTo(int selectedUnit, int selectedBodyStyle) {
        return (unit == 0 || unit == selectedUnit) && (bodyStyle == 0 || bodyStyle == selectedBodyStyle);
    }
}
