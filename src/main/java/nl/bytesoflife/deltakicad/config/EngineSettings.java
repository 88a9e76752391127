package nl.bytesoflife.deltakicad.config;

import nl.bytesoflife.deltakicad.text.CoordinateFormat;
import nl.bytesoflife.deltakicad.validation.FindingType;
import nl.bytesoflife.deltakicad.validation.Severity;

import java.io.File;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Collections;
import java.util.EnumMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Properties;
import java.util.UUID;
import java.util.function.Supplier;

/**
 * Settings shared by the document operations. Library locations are supplied by the caller as
 * ordered lists; the first matching library wins.
 *
 * <pre>
 * EngineSettings settings = EngineSettings.defaults()
 *     .withSymbolLibraries(List.of(Path.of("libs/Device.kicad_sym")))
 *     .withCoordinateTolerance(0.01);
 * </pre>
 */
public final class EngineSettings {

    public static final String SYMBOL_LIBRARIES = "deltakicad.symbol-libraries";
    public static final String FOOTPRINT_LIBRARIES = "deltakicad.footprint-libraries";
    public static final String COORDINATE_TOLERANCE = "deltakicad.coordinate-tolerance";
    /** Prefix of per-check severity keys, e.g. {@code deltakicad.severity.floating-pin=ignore}. */
    public static final String SEVERITY_PREFIX = "deltakicad.severity.";

    private final List<Path> symbolLibraries;
    private final List<Path> footprintLibraries;
    private final double coordinateTolerance;
    private final Supplier<UUID> identifiers;
    private final Map<FindingType, Severity> severities;

    private EngineSettings(List<Path> symbolLibraries, List<Path> footprintLibraries,
                           double coordinateTolerance, Supplier<UUID> identifiers,
                           Map<FindingType, Severity> severities) {
        this.symbolLibraries = List.copyOf(symbolLibraries);
        this.footprintLibraries = List.copyOf(footprintLibraries);
        this.coordinateTolerance = coordinateTolerance;
        this.identifiers = identifiers;
        this.severities = severities;
    }

    public static EngineSettings defaults() {
        return new EngineSettings(List.of(), List.of(), CoordinateFormat.DEFAULT_TOLERANCE, UUID::randomUUID,
                Collections.unmodifiableMap(new EnumMap<>(FindingType.class)));
    }

    /**
     * Reads {@value #SYMBOL_LIBRARIES}, {@value #FOOTPRINT_LIBRARIES} (entries separated by the
     * platform path separator), {@value #COORDINATE_TOLERANCE} and one {@value #SEVERITY_PREFIX}key
     * per finding type. Missing keys keep their defaults.
     *
     * @throws IllegalArgumentException for a malformed tolerance or an unknown severity
     */
    public static EngineSettings fromProperties(Properties properties) {
        EngineSettings settings = defaults()
                .withSymbolLibraries(splitPaths(properties.getProperty(SYMBOL_LIBRARIES)))
                .withFootprintLibraries(splitPaths(properties.getProperty(FOOTPRINT_LIBRARIES)));
        String tolerance = properties.getProperty(COORDINATE_TOLERANCE);
        if (tolerance != null && !tolerance.isBlank()) {
            settings = settings.withCoordinateTolerance(Double.parseDouble(tolerance.trim()));
        }
        for (FindingType type : FindingType.values()) {
            String severity = properties.getProperty(severityKey(type));
            if (severity != null && !severity.isBlank()) {
                settings = settings.withSeverity(type, Severity.fromName(severity));
            }
        }
        return settings;
    }

    public EngineSettings withSymbolLibraries(List<Path> libraries) {
        return new EngineSettings(libraries, footprintLibraries, coordinateTolerance, identifiers, severities);
    }

    public EngineSettings withFootprintLibraries(List<Path> libraries) {
        return new EngineSettings(symbolLibraries, libraries, coordinateTolerance, identifiers, severities);
    }

    public EngineSettings withCoordinateTolerance(double tolerance) {
        if (tolerance <= 0) {
            throw new IllegalArgumentException("Coordinate tolerance must be positive: " + tolerance);
        }
        return new EngineSettings(symbolLibraries, footprintLibraries, tolerance, identifiers, severities);
    }

    /**
     * Source of fresh block identifiers; tests install a deterministic one.
     */
    public EngineSettings withIdentifierSupplier(Supplier<UUID> supplier) {
        return new EngineSettings(symbolLibraries, footprintLibraries, coordinateTolerance, supplier, severities);
    }

    /**
     * Overrides the severity a finding type is reported with; {@link Severity#IGNORE} skips its check.
     */
    public EngineSettings withSeverity(FindingType type, Severity severity) {
        Map<FindingType, Severity> copy = new EnumMap<>(FindingType.class);
        copy.putAll(severities);
        copy.put(type, severity);
        return new EngineSettings(symbolLibraries, footprintLibraries, coordinateTolerance, identifiers,
                Collections.unmodifiableMap(copy));
    }

    public static String severityKey(FindingType type) {
        return SEVERITY_PREFIX + type.name().toLowerCase(Locale.ROOT).replace('_', '-');
    }

    public List<Path> getSymbolLibraries() {
        return symbolLibraries;
    }

    public List<Path> getFootprintLibraries() {
        return footprintLibraries;
    }

    public double getCoordinateTolerance() {
        return coordinateTolerance;
    }

    public Supplier<UUID> getIdentifierSupplier() {
        return identifiers;
    }

    /**
     * Severity overrides only; finding types without an entry keep their default.
     */
    public Map<FindingType, Severity> getSeverities() {
        return severities;
    }

    private static List<Path> splitPaths(String value) {
        List<Path> paths = new ArrayList<>();
        if (value == null || value.isBlank()) return paths;
        for (String part : value.split(File.pathSeparator)) {
            if (!part.isBlank()) {
                paths.add(Path.of(part.trim()));
            }
        }
        return paths;
    }

    @Override
    public String toString() {
        return "EngineSettings{symbolLibraries=" + symbolLibraries.size() +
                ", footprintLibraries=" + footprintLibraries.size() +
                ", coordinateTolerance=" + coordinateTolerance +
                ", severities=" + severities + "}";
    }
}
