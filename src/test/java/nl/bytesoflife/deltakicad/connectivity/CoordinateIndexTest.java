package nl.bytesoflife.deltakicad.connectivity;

import org.junit.jupiter.api.Test;
import org.locationtech.jts.geom.Coordinate;

import static org.junit.jupiter.api.Assertions.*;

class CoordinateIndexTest {

    @Test
    void pointsWithinToleranceShareNode() {
        CoordinateIndex index = new CoordinateIndex(0.01);
        int a = index.nodeFor(new Coordinate(100, 48.81));
        int b = index.nodeFor(new Coordinate(100.005, 48.8149));
        int c = index.nodeFor(new Coordinate(100.02, 48.81));
        assertEquals(a, b);
        assertNotEquals(a, c);
        assertEquals(2, index.size());
    }

    @Test
    void nodesDoNotChain() {
        CoordinateIndex index = new CoordinateIndex(0.01);
        int first = index.nodeFor(new Coordinate(0, 0));
        assertEquals(first, index.nodeFor(new Coordinate(0.009, 0)));
        // Within tolerance of the previous point but not of the node it was mapped to
        assertNotEquals(first, index.nodeFor(new Coordinate(0.018, 0)));
        assertEquals(new Coordinate(0, 0), index.position(first));
    }

    @Test
    void nearestNodeWins() {
        CoordinateIndex index = new CoordinateIndex(0.01);
        index.nodeFor(new Coordinate(0, 0));
        int second = index.nodeFor(new Coordinate(0.015, 0));
        assertEquals(second, index.find(new Coordinate(0.009, 0)).getAsInt());
        assertTrue(index.find(new Coordinate(1, 1)).isEmpty());
    }
}
