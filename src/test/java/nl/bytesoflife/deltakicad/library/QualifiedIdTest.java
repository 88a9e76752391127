package nl.bytesoflife.deltakicad.library;

import nl.bytesoflife.deltakicad.InvalidIdentifierException;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class QualifiedIdTest {

    @Test
    void parseSplitsAtFirstColon() {
        QualifiedId id = QualifiedId.parse("Connector:Conn_01x02:Alt");
        assertEquals("Connector", id.library());
        assertEquals("Conn_01x02:Alt", id.name());
        assertEquals("Connector:Conn_01x02:Alt", id.toString());
    }

    @Test
    void qualifySubDefinitionName() {
        assertEquals("Device:R_1_1", QualifiedId.parse("Device:R").qualify("R_1_1"));
    }

    @Test
    void rejectMalformedIdentifiers() {
        assertThrows(InvalidIdentifierException.class, () -> QualifiedId.parse("R"));
        assertThrows(InvalidIdentifierException.class, () -> QualifiedId.parse(":R"));
        assertThrows(InvalidIdentifierException.class, () -> QualifiedId.parse("Device:"));
        assertThrows(InvalidIdentifierException.class, () -> QualifiedId.parse(null));
        assertThrows(InvalidIdentifierException.class, () -> new QualifiedId(" ", "R"));
    }
}
