package nl.bytesoflife.deltakicad.config;

import nl.bytesoflife.deltakicad.text.CoordinateFormat;
import nl.bytesoflife.deltakicad.validation.FindingType;
import nl.bytesoflife.deltakicad.validation.Severity;
import org.junit.jupiter.api.Test;

import java.io.File;
import java.nio.file.Path;
import java.util.List;
import java.util.Map;
import java.util.Properties;

import static org.junit.jupiter.api.Assertions.*;

class EngineSettingsTest {

    @Test
    void defaults() {
        EngineSettings settings = EngineSettings.defaults();
        assertTrue(settings.getSymbolLibraries().isEmpty());
        assertTrue(settings.getFootprintLibraries().isEmpty());
        assertEquals(CoordinateFormat.DEFAULT_TOLERANCE, settings.getCoordinateTolerance());
        assertNotEquals(settings.getIdentifierSupplier().get(), settings.getIdentifierSupplier().get());
        assertTrue(settings.getSeverities().isEmpty());
    }

    @Test
    void fromProperties() {
        Properties properties = new Properties();
        properties.setProperty(EngineSettings.SYMBOL_LIBRARIES,
                "libs/Device.kicad_sym" + File.pathSeparator + " libs/power.kicad_sym ");
        properties.setProperty(EngineSettings.FOOTPRINT_LIBRARIES, "libs/Resistor_SMD.pretty");
        properties.setProperty(EngineSettings.COORDINATE_TOLERANCE, "0.05");

        EngineSettings settings = EngineSettings.fromProperties(properties);

        assertEquals(List.of(Path.of("libs/Device.kicad_sym"), Path.of("libs/power.kicad_sym")),
                settings.getSymbolLibraries());
        assertEquals(List.of(Path.of("libs/Resistor_SMD.pretty")), settings.getFootprintLibraries());
        assertEquals(0.05, settings.getCoordinateTolerance());
    }

    @Test
    void missingPropertiesKeepDefaults() {
        EngineSettings settings = EngineSettings.fromProperties(new Properties());
        assertEquals(CoordinateFormat.DEFAULT_TOLERANCE, settings.getCoordinateTolerance());
        assertTrue(settings.getSymbolLibraries().isEmpty());
    }

    @Test
    void rejectsNonPositiveTolerance() {
        assertThrows(IllegalArgumentException.class, () -> EngineSettings.defaults().withCoordinateTolerance(0));
        Properties properties = new Properties();
        properties.setProperty(EngineSettings.COORDINATE_TOLERANCE, "-1");
        assertThrows(IllegalArgumentException.class, () -> EngineSettings.fromProperties(properties));
    }

    @Test
    void withersReturnCopies() {
        EngineSettings base = EngineSettings.defaults();
        EngineSettings tuned = base.withCoordinateTolerance(0.1);

        assertNotSame(base, tuned);
        assertEquals(CoordinateFormat.DEFAULT_TOLERANCE, base.getCoordinateTolerance());
        assertThrows(UnsupportedOperationException.class,
                () -> tuned.getSymbolLibraries().add(Path.of("x.kicad_sym")));
    }

    @Test
    void severityOverridesFromProperties() {
        Properties properties = new Properties();
        properties.setProperty("deltakicad.severity.floating-pin", "Ignore");
        properties.setProperty(EngineSettings.severityKey(FindingType.AMBIGUOUS_NET), " error ");

        EngineSettings settings = EngineSettings.fromProperties(properties);

        assertEquals(Map.of(FindingType.FLOATING_PIN, Severity.IGNORE, FindingType.AMBIGUOUS_NET, Severity.ERROR),
                settings.getSeverities());
    }

    @Test
    void unknownSeverityIsRejected() {
        Properties properties = new Properties();
        properties.setProperty("deltakicad.severity.duplicate-reference", "fatal");
        IllegalArgumentException e = assertThrows(IllegalArgumentException.class,
                () -> EngineSettings.fromProperties(properties));
        assertEquals("Unknown severity: fatal", e.getMessage());
    }

    @Test
    void severityOverridesAreCopied() {
        EngineSettings base = EngineSettings.defaults();
        EngineSettings strict = base.withSeverity(FindingType.FLOATING_PIN, Severity.ERROR);
        EngineSettings stricter = strict.withSeverity(FindingType.UNCONNECTED_POWER, Severity.ERROR);

        assertTrue(base.getSeverities().isEmpty());
        assertEquals(1, strict.getSeverities().size());
        assertEquals(2, stricter.getSeverities().size());
        assertThrows(UnsupportedOperationException.class,
                () -> stricter.getSeverities().put(FindingType.AMBIGUOUS_NET, Severity.IGNORE));
    }
}
