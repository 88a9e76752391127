package nl.bytesoflife.deltakicad.connectivity;

import nl.bytesoflife.deltakicad.text.CoordinateFormat;
import org.locationtech.jts.geom.Coordinate;
import org.locationtech.jts.geom.Envelope;
import org.locationtech.jts.index.quadtree.Quadtree;

import java.util.ArrayList;
import java.util.List;
import java.util.OptionalInt;

/**
 * Maps document coordinates to connectivity node ids. A point within {@code tolerance} of an
 * existing node reuses that node; otherwise it becomes a new node. Each node keeps the coordinate
 * it was created with, so points never chain into each other through a run of near neighbours.
 */
public class CoordinateIndex {

    private final Quadtree tree = new Quadtree();
    private final List<Coordinate> nodes = new ArrayList<>();
    private final double tolerance;

    public CoordinateIndex(double tolerance) {
        this.tolerance = tolerance;
    }

    public int nodeFor(Coordinate point) {
        OptionalInt existing = find(point);
        if (existing.isPresent()) {
            return existing.getAsInt();
        }
        int id = nodes.size();
        Coordinate canonical = point.copy();
        nodes.add(canonical);
        tree.insert(new Envelope(canonical), id);
        return id;
    }

    /**
     * Nearest node within tolerance; ties go to the older node.
     */
    @SuppressWarnings("unchecked")
    public OptionalInt find(Coordinate point) {
        Envelope search = new Envelope(point);
        search.expandBy(tolerance);
        List<Integer> candidates = (List<Integer>) tree.query(search);
        int best = -1;
        double bestDistance = Double.MAX_VALUE;
        for (int id : candidates) {
            Coordinate node = nodes.get(id);
            if (!CoordinateFormat.near(node, point, tolerance)) continue;
            double distance = node.distance(point);
            if (distance < bestDistance || (distance == bestDistance && id < best)) {
                best = id;
                bestDistance = distance;
            }
        }
        return best < 0 ? OptionalInt.empty() : OptionalInt.of(best);
    }

    public Coordinate position(int node) {
        return nodes.get(node);
    }

    public int size() {
        return nodes.size();
    }
}
