package nl.bytesoflife.deltakicad.model;

import java.util.Map;

/**
 * A placed symbol instance.
 */
public record SchematicSymbol(String reference, String value, String footprint, String libId,
                              Placement placement, int unit, int bodyStyle,
                              boolean onBoard, boolean inBom, String uuid,
                              Map<String, String> properties) {

    public SchematicSymbol {
        properties = Map.copyOf(properties);
    }

    /**
     * Power and flag symbols carry a {@code #} reference or come from the {@code power} library.
     * Their pins name nets; they are not components.
     */
    public boolean isPower() {
        return reference.startsWith("#") || libId.startsWith("power:");
    }
}
