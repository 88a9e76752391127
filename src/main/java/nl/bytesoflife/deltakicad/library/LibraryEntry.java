package nl.bytesoflife.deltakicad.library;

import java.nio.file.Path;

/**
 * A search hit: a symbol in a {@code .kicad_sym} file or a footprint in a {@code .pretty} directory.
 */
public record LibraryEntry(QualifiedId id, Path path) {
}
