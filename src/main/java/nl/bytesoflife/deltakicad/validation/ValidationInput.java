package nl.bytesoflife.deltakicad.validation;

import nl.bytesoflife.deltakicad.connectivity.NetList;
import nl.bytesoflife.deltakicad.model.Schematic;

/**
 * What a check sees: the schematic, its resolved nets and the coordinate tolerance in use.
 */
public record ValidationInput(Schematic schematic, NetList nets, double tolerance) {
}
