package nl.bytesoflife.deltakicad.connectivity;

import nl.bytesoflife.deltakicad.NotFoundException;
import nl.bytesoflife.deltakicad.config.EngineSettings;
import nl.bytesoflife.deltakicad.library.SymbolLibraries;
import nl.bytesoflife.deltakicad.model.Label;
import nl.bytesoflife.deltakicad.model.Schematic;
import nl.bytesoflife.deltakicad.model.SchematicSymbol;
import nl.bytesoflife.deltakicad.model.Wire;
import org.locationtech.jts.geom.Coordinate;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.TreeMap;
import java.util.TreeSet;

/**
 * Groups connection points of a schematic into nets.
 * <p>
 * Wire endpoints, label anchors, junctions, power pins and component pins are mapped to nodes by a
 * {@link CoordinateIndex}; only wires join distinct nodes. A connected group holding at least one
 * component pin becomes a net, named by its alphabetically first label, else power symbol value, else
 * {@code Net-(<ref>-Pad<pin>)} of its lowest pin. Groups sharing an explicit name are one net.
 * Nothing is cached: each call resolves the schematic it is given.
 */
public class ConnectivityResolver {

    private static final Logger log = LoggerFactory.getLogger(ConnectivityResolver.class);

    /** Power flags mark a net as driven but never name it. */
    static final String POWER_FLAG = "PWR_FLAG";

    private final double tolerance;
    private final PinPlacer placer;

    public ConnectivityResolver(EngineSettings settings) {
        this(settings.getCoordinateTolerance(), new PinPlacer(new SymbolLibraries(settings.getSymbolLibraries())));
    }

    public ConnectivityResolver(double tolerance, PinPlacer placer) {
        this.tolerance = tolerance;
        this.placer = placer;
    }

    public PinPlacer getPlacer() {
        return placer;
    }

    private record Hint(String name, NameSource source) {}

    private static final class Group {
        final List<PlacedPin> pins = new ArrayList<>();
        final List<Hint> hints = new ArrayList<>();
        int items;
    }

    public NetList resolve(Schematic schematic) {
        CoordinateIndex index = new CoordinateIndex(tolerance);
        UnionFind sets = new UnionFind();
        Map<Integer, List<Hint>> hints = new LinkedHashMap<>();
        Map<Integer, List<PlacedPin>> pinsAtNode = new LinkedHashMap<>();
        Map<Integer, Integer> itemsAtNode = new LinkedHashMap<>();
        List<String> unresolved = new ArrayList<>();

        for (Wire wire : schematic.wires()) {
            int a = node(index, sets, itemsAtNode, wire.start());
            int b = node(index, sets, itemsAtNode, wire.end());
            sets.union(a, b);
        }
        for (Coordinate junction : schematic.junctions()) {
            node(index, sets, itemsAtNode, junction);
        }
        for (Label label : schematic.labels()) {
            int n = node(index, sets, itemsAtNode, label.position());
            hints.computeIfAbsent(n, k -> new ArrayList<>()).add(new Hint(label.text(), NameSource.LABEL));
        }
        for (SchematicSymbol symbol : schematic.symbols()) {
            if (placer.resolveDefinition(schematic, symbol.libId()).isEmpty()) {
                unresolved.add(symbol.reference());
                continue;
            }
            for (PlacedPin pin : placer.place(schematic, symbol)) {
                int n = node(index, sets, itemsAtNode, pin.position());
                if (symbol.isPower()) {
                    if (!POWER_FLAG.equals(symbol.value())) {
                        hints.computeIfAbsent(n, k -> new ArrayList<>()).add(new Hint(symbol.value(), NameSource.POWER));
                    }
                } else {
                    pinsAtNode.computeIfAbsent(n, k -> new ArrayList<>()).add(pin);
                }
            }
        }

        Map<Integer, Group> groups = new TreeMap<>();
        for (int n = 0; n < index.size(); n++) {
            Group group = groups.computeIfAbsent(sets.find(n), k -> new Group());
            group.pins.addAll(pinsAtNode.getOrDefault(n, List.of()));
            group.hints.addAll(hints.getOrDefault(n, List.of()));
            group.items += itemsAtNode.getOrDefault(n, 0);
        }

        Map<String, List<Group>> byName = new TreeMap<>();
        Map<String, NameSource> sources = new LinkedHashMap<>();
        for (Group group : groups.values()) {
            if (group.pins.isEmpty()) continue;
            group.pins.sort(PlacedPin.ORDER);
            String name = nameOf(group);
            sources.merge(name, sourceOf(group), (a, b) -> a.compareTo(b) <= 0 ? a : b);
            byName.computeIfAbsent(name, k -> new ArrayList<>()).add(group);
        }

        List<Net> nets = new ArrayList<>();
        for (Map.Entry<String, List<Group>> entry : byName.entrySet()) {
            List<PlacedPin> pins = new ArrayList<>();
            Set<String> conflicting = new TreeSet<>();
            int items = 0;
            for (Group group : entry.getValue()) {
                pins.addAll(group.pins);
                items += group.items;
                for (Hint hint : group.hints) {
                    if (!hint.name().equals(entry.getKey())) {
                        conflicting.add(hint.name());
                    }
                }
            }
            pins.sort(PlacedPin.ORDER);
            nets.add(new Net(entry.getKey(), sources.get(entry.getKey()), pins, new ArrayList<>(conflicting), items));
        }
        log.debug("Resolved {} nets from {} nodes", nets.size(), index.size());
        return new NetList(nets, unresolved);
    }

    /**
     * Net the given pin belongs to.
     */
    public Net pinNet(Schematic schematic, String reference, String pinNumber) {
        NetList nets = resolve(schematic);
        return nets.netOf(reference, pinNumber).orElseThrow(() -> new NotFoundException(reference + "." + pinNumber,
                "Pin " + pinNumber + " of " + reference + " not found in schematic connectivity"));
    }

    public List<PlacedPin> netPins(Schematic schematic, String netName) {
        return resolve(schematic).net(netName)
                .orElseThrow(() -> new NotFoundException(netName, "Net '" + netName + "' not found in schematic connectivity"))
                .pins();
    }

    private static int node(CoordinateIndex index, UnionFind sets, Map<Integer, Integer> items, Coordinate point) {
        int n = index.nodeFor(point);
        sets.ensure(n);
        items.merge(n, 1, Integer::sum);
        return n;
    }

    /**
     * Highest priority source present in the group; among several hints of that source the
     * alphabetically first wins, so document order never changes the name.
     */
    private static String nameOf(Group group) {
        NameSource source = sourceOf(group);
        if (source == NameSource.SYNTHESIZED) {
            PlacedPin lowest = group.pins.get(0);
            return "Net-(" + lowest.reference() + "-Pad" + lowest.number() + ")";
        }
        return group.hints.stream()
                .filter(hint -> hint.source() == source)
                .map(Hint::name)
                .min(Comparator.naturalOrder())
                .orElseThrow();
    }

    private static NameSource sourceOf(Group group) {
        return group.hints.stream()
                .map(Hint::source)
                .min(Comparator.naturalOrder())
                .orElse(NameSource.SYNTHESIZED);
    }
}
