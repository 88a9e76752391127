package nl.bytesoflife.deltakicad.validation;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

public class ValidationReport {

    private final List<ValidationFinding> findings = new ArrayList<>();
    private final List<String> unresolvedSymbols = new ArrayList<>();

    public void addFinding(ValidationFinding finding) {
        findings.add(finding);
    }

    public void addUnresolvedSymbol(String reference) {
        unresolvedSymbols.add(reference);
    }

    public List<ValidationFinding> getFindings() {
        return Collections.unmodifiableList(findings);
    }

    public List<ValidationFinding> getFindings(FindingType type) {
        return findings.stream()
                .filter(f -> f.getType() == type)
                .toList();
    }

    public List<ValidationFinding> getErrors() {
        return findings.stream()
                .filter(f -> f.getSeverity() == Severity.ERROR)
                .toList();
    }

    public List<ValidationFinding> getWarnings() {
        return findings.stream()
                .filter(f -> f.getSeverity() == Severity.WARNING)
                .toList();
    }

    public boolean hasErrors() {
        return findings.stream().anyMatch(f -> f.getSeverity() == Severity.ERROR);
    }

    /**
     * Symbols whose library definition was not found, so their pins were not checked.
     */
    public List<String> getUnresolvedSymbols() {
        return Collections.unmodifiableList(unresolvedSymbols);
    }

    @Override
    public String toString() {
        StringBuilder sb = new StringBuilder("Validation Report:\n");
        sb.append("  Findings: ").append(findings.size())
          .append(" (").append(getErrors().size()).append(" errors, ")
          .append(getWarnings().size()).append(" warnings)\n");
        for (ValidationFinding f : findings) {
            sb.append("  - ").append(f).append("\n");
        }
        if (!unresolvedSymbols.isEmpty()) {
            sb.append("  Unresolved symbols: ").append(String.join(", ", unresolvedSymbols)).append("\n");
        }
        return sb.toString();
    }
}
