package nl.bytesoflife.deltakicad.connectivity;

import java.util.List;
import java.util.Optional;

/**
 * All nets of a schematic, sorted by name.
 *
 * @param unresolvedSymbols references whose library definition could not be found
 */
public record NetList(List<Net> nets, List<String> unresolvedSymbols) {

    public NetList {
        nets = List.copyOf(nets);
        unresolvedSymbols = List.copyOf(unresolvedSymbols);
    }

    public Optional<Net> net(String name) {
        return nets.stream().filter(n -> n.name().equals(name)).findFirst();
    }

    public Optional<Net> netOf(String reference, String pinNumber) {
        return nets.stream().filter(n -> n.pin(reference, pinNumber).isPresent()).findFirst();
    }

    public List<Net> ambiguous() {
        return nets.stream().filter(Net::isAmbiguous).toList();
    }
}
