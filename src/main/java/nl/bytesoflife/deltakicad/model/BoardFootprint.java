package nl.bytesoflife.deltakicad.model;

import java.util.List;
import java.util.Optional;

public record BoardFootprint(String reference, String value, String footprint, Placement placement,
                             String layer, String uuid, List<Pad> pads) {

    public BoardFootprint {
        pads = List.copyOf(pads);
    }

    public Optional<Pad> pad(String number) {
        return pads.stream().filter(p -> p.number().equals(number)).findFirst();
    }
}
