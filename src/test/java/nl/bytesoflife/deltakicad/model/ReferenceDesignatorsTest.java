package nl.bytesoflife.deltakicad.model;

import nl.bytesoflife.deltakicad.InvalidIdentifierException;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class ReferenceDesignatorsTest {

    @Test
    void acceptDesignators() {
        assertTrue(ReferenceDesignators.isValid("R1"));
        assertTrue(ReferenceDesignators.isValid("U3A"));
        assertTrue(ReferenceDesignators.isValid("SW12"));
        assertTrue(ReferenceDesignators.isValid("#PWR01"));
    }

    @Test
    void rejectMalformedDesignators() {
        assertFalse(ReferenceDesignators.isValid("R"));
        assertFalse(ReferenceDesignators.isValid("1R"));
        assertFalse(ReferenceDesignators.isValid("R1-2"));
        assertFalse(ReferenceDesignators.isValid("#PWR"));
        assertFalse(ReferenceDesignators.isValid(null));
        InvalidIdentifierException e = assertThrows(InvalidIdentifierException.class,
                () -> ReferenceDesignators.requireValid("R?"));
        assertEquals("R?", e.getIdentifier());
    }

    @Test
    void compareNumbersNumerically() {
        List<String> references = new ArrayList<>(List.of("R10", "C1", "R2", "R1", "U1A"));
        references.sort(ReferenceDesignators::compare);
        assertEquals(List.of("C1", "R1", "R2", "R10", "U1A"), references);
    }

    @Test
    void leadingZerosStillDistinct() {
        assertNotEquals(0, ReferenceDesignators.compare("R01", "R1"));
        assertEquals(0, ReferenceDesignators.compare("R1", "R1"));
    }
}
