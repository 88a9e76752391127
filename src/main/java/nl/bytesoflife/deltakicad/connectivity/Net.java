package nl.bytesoflife.deltakicad.connectivity;

import java.util.List;
import java.util.Optional;

/**
 * A resolved net.
 *
 * @param pins             component pins on the net, in {@link PlacedPin#ORDER}
 * @param conflictingNames explicit names other than {@code name} found on the same connected items
 * @param itemCount        connection items on the net: pins, wire endpoints, labels, junctions and
 *                         power pins
 */
public record Net(String name, NameSource nameSource, List<PlacedPin> pins, List<String> conflictingNames, int itemCount) {

    public Net {
        pins = List.copyOf(pins);
        conflictingNames = List.copyOf(conflictingNames);
    }

    public boolean isAmbiguous() {
        return !conflictingNames.isEmpty();
    }

    public Optional<PlacedPin> pin(String reference, String number) {
        return pins.stream().filter(p -> p.reference().equals(reference) && p.number().equals(number)).findFirst();
    }
}
