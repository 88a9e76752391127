package nl.bytesoflife.deltakicad.model;

public enum LabelType {
    LOCAL("label"),
    GLOBAL("global_label"),
    HIERARCHICAL("hierarchical_label");

    private final String tag;

    LabelType(String tag) {
        this.tag = tag;
    }

    public String getTag() {
        return tag;
    }

    public static LabelType fromName(String name) {
        for (LabelType type : values()) {
            if (type.name().equalsIgnoreCase(name) || type.tag.equals(name)) {
                return type;
            }
        }
        throw new IllegalArgumentException("Unknown label type: " + name);
    }
}
