package nl.bytesoflife.deltakicad.validation;

import nl.bytesoflife.deltakicad.connectivity.ConnectivityResolver;
import nl.bytesoflife.deltakicad.connectivity.NetList;
import nl.bytesoflife.deltakicad.model.Schematic;
import nl.bytesoflife.deltakicad.validation.check.AmbiguousNetCheck;
import nl.bytesoflife.deltakicad.validation.check.DuplicateReferenceCheck;
import nl.bytesoflife.deltakicad.validation.check.FloatingPinCheck;
import nl.bytesoflife.deltakicad.validation.check.SchematicCheck;
import nl.bytesoflife.deltakicad.validation.check.UnconnectedPowerCheck;

import java.util.EnumMap;
import java.util.List;
import java.util.Map;

/**
 * Runs registered schematic checks over one resolution of the schematic's nets.
 */
public class SchematicValidator {

    private final Map<FindingType, SchematicCheck> checks = new EnumMap<>(FindingType.class);
    private final Map<FindingType, Severity> severities = new EnumMap<>(FindingType.class);
    private final ConnectivityResolver resolver;
    private final double tolerance;

    public SchematicValidator(ConnectivityResolver resolver, double tolerance) {
        this.resolver = resolver;
        this.tolerance = tolerance;
    }

    public SchematicValidator registerCheck(SchematicCheck check) {
        checks.put(check.getSupportedType(), check);
        return this;
    }

    public SchematicValidator withDefaultChecks() {
        return registerCheck(new FloatingPinCheck())
                .registerCheck(new DuplicateReferenceCheck())
                .registerCheck(new AmbiguousNetCheck())
                .registerCheck(new UnconnectedPowerCheck());
    }

    /**
     * Overrides the severity findings of {@code type} are reported with; {@link Severity#IGNORE}
     * skips the check.
     */
    public SchematicValidator withSeverity(FindingType type, Severity severity) {
        severities.put(type, severity);
        return this;
    }

    public ValidationReport run(Schematic schematic) {
        ValidationReport report = new ValidationReport();
        NetList nets = resolver.resolve(schematic);
        nets.unresolvedSymbols().forEach(report::addUnresolvedSymbol);
        ValidationInput input = new ValidationInput(schematic, nets, tolerance);

        for (SchematicCheck check : checks.values()) {
            Severity severity = severities.getOrDefault(check.getSupportedType(), check.getSupportedType().getDefaultSeverity());
            if (severity == Severity.IGNORE) continue;

            List<ValidationFinding> findings = check.check(input, severity);
            for (ValidationFinding finding : findings) {
                report.addFinding(finding);
            }
        }
        return report;
    }
}
