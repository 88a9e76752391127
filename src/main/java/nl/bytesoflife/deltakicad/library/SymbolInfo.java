package nl.bytesoflife.deltakicad.library;

import nl.bytesoflife.deltakicad.model.LibraryPin;

import java.nio.file.Path;
import java.util.List;

public record SymbolInfo(QualifiedId id, Path library, String description, String keywords,
                         String datasheet, List<String> footprintFilters, int unitCount,
                         boolean power, List<LibraryPin> pins) {
}
