package nl.bytesoflife.deltakicad.text;

import org.locationtech.jts.geom.Coordinate;

import java.math.BigDecimal;
import java.math.RoundingMode;

/**
 * Number rendering and tolerant point comparison for document coordinates (millimetres).
 */
public final class CoordinateFormat {

    /**
     * Default tolerance for treating two coordinates as the same point. Below half of the finest
     * schematic grid (1 mil = 0.0254 mm), so distinct grid points never merge.
     */
    public static final double DEFAULT_TOLERANCE = 0.01;

    private CoordinateFormat() {}

    /**
     * Renders a value with at most four decimals and no trailing zeros, e.g. {@code 48.73}, {@code 100}, {@code -2.54}.
     */
    public static String format(double value) {
        BigDecimal decimal = BigDecimal.valueOf(value).setScale(4, RoundingMode.HALF_UP).stripTrailingZeros();
        if (decimal.signum() == 0) {
            return "0";
        }
        return decimal.toPlainString();
    }

    public static String format(Coordinate point) {
        return format(point.x) + " " + format(point.y);
    }

    public static double round(double value) {
        return BigDecimal.valueOf(value).setScale(4, RoundingMode.HALF_UP).doubleValue();
    }

    public static boolean near(Coordinate a, Coordinate b, double tolerance) {
        return Math.abs(a.x - b.x) <= tolerance && Math.abs(a.y - b.y) <= tolerance;
    }

    public static String describe(Coordinate point) {
        return "(" + format(point.x) + ", " + format(point.y) + ")";
    }
}
