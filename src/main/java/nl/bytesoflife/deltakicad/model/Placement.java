package nl.bytesoflife.deltakicad.model;

import nl.bytesoflife.deltakicad.parser.SNode;
import org.locationtech.jts.geom.Coordinate;

import java.util.List;

/**
 * Position, rotation in degrees and mirroring of a placed symbol or footprint.
 */
public record Placement(double x, double y, double rotation, Mirror mirror) {

    public static Placement at(double x, double y, double rotation) {
        return new Placement(x, y, rotation, Mirror.NONE);
    }

    /**
     * Reads the {@code (at x y [angle])} and optional {@code (mirror x|y)} children of a block.
     */
    public static Placement of(SNode.SList block) {
        SNode.SList at = block.first("at").orElse(new SNode.SList(List.of()));
        Mirror mirror = block.first("mirror").map(m -> Mirror.fromToken(m.atomValue(1))).orElse(Mirror.NONE);
        return new Placement(at.number(1, 0), at.number(2, 0), at.number(3, 0), mirror);
    }

    public Coordinate position() {
        return new Coordinate(x, y);
    }

    /**
     * Rotation snapped to the nearest quarter turn, 0 to 3.
     */
    public int quarterTurns() {
        long turns = Math.round(rotation / 90.0);
        return (int) (((turns % 4) + 4) % 4);
    }
}
