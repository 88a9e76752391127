package nl.bytesoflife.deltakicad.schematic;

import nl.bytesoflife.deltakicad.model.Mirror;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Description of a symbol instance to add. Built fluently:
 * <pre>
 * NewComponent.of("Device:R", "R1", "10k", 100, 50).withRotation(90).withFootprint("Resistor_SMD:R_0603")
 * </pre>
 */
public final class NewComponent {

    private final String libId;
    private final String reference;
    private final String value;
    private final double x;
    private final double y;
    private final double rotation;
    private final Mirror mirror;
    private final int unit;
    private final String footprint;
    private final Map<String, String> properties;

    private NewComponent(String libId, String reference, String value, double x, double y, double rotation,
                         Mirror mirror, int unit, String footprint, Map<String, String> properties) {
        this.libId = libId;
        this.reference = reference;
        this.value = value;
        this.x = x;
        this.y = y;
        this.rotation = rotation;
        this.mirror = mirror;
        this.unit = unit;
        this.footprint = footprint;
        this.properties = properties;
    }

    public static NewComponent of(String libId, String reference, String value, double x, double y) {
        return new NewComponent(libId, reference, value, x, y, 0, Mirror.NONE, 1, "", Map.of());
    }

    public NewComponent withRotation(double rotation) {
        return new NewComponent(libId, reference, value, x, y, rotation, mirror, unit, footprint, properties);
    }

    public NewComponent withMirror(Mirror mirror) {
        return new NewComponent(libId, reference, value, x, y, rotation, mirror, unit, footprint, properties);
    }

    public NewComponent withUnit(int unit) {
        if (unit < 1) {
            throw new IllegalArgumentException("Unit numbers start at 1, got " + unit);
        }
        return new NewComponent(libId, reference, value, x, y, rotation, mirror, unit, footprint, properties);
    }

    public NewComponent withFootprint(String footprint) {
        return new NewComponent(libId, reference, value, x, y, rotation, mirror, unit, footprint, properties);
    }

    public NewComponent withProperty(String name, String propertyValue) {
        Map<String, String> updated = new LinkedHashMap<>(properties);
        updated.put(name, propertyValue);
        return new NewComponent(libId, reference, value, x, y, rotation, mirror, unit, footprint,
                Collections.unmodifiableMap(updated));
    }

    public String getLibId() { return libId; }
    public String getReference() { return reference; }
    public String getValue() { return value; }
    public double getX() { return x; }
    public double getY() { return y; }
    public double getRotation() { return rotation; }
    public Mirror getMirror() { return mirror; }
    public int getUnit() { return unit; }
    public String getFootprint() { return footprint; }
    public Map<String, String> getProperties() { return properties; }
}
