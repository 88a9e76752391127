package nl.bytesoflife.deltakicad.model;

import java.util.List;

public record BoardInfo(String version, String generator, TitleBlock titleBlock, String paper,
                        double thickness, List<String> layers) {

    public BoardInfo {
        layers = List.copyOf(layers);
    }
}
