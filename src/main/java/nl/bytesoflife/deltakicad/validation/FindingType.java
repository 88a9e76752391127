package nl.bytesoflife.deltakicad.validation;

public enum FindingType {
    FLOATING_PIN(Severity.WARNING),
    DUPLICATE_REFERENCE(Severity.ERROR),
    AMBIGUOUS_NET(Severity.WARNING),
    UNCONNECTED_POWER(Severity.WARNING);

    private final Severity defaultSeverity;

    FindingType(Severity defaultSeverity) {
        this.defaultSeverity = defaultSeverity;
    }

    public Severity getDefaultSeverity() {
        return defaultSeverity;
    }
}
