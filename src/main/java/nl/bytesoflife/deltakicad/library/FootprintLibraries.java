package nl.bytesoflife.deltakicad.library;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Optional;

/**
 * Read access to an ordered list of {@code .pretty} footprint directories.
 */
public class FootprintLibraries {

    private static final Logger log = LoggerFactory.getLogger(FootprintLibraries.class);

    private final List<Path> libraries;

    public FootprintLibraries(List<Path> libraries) {
        this.libraries = List.copyOf(libraries);
    }

    /**
     * Text of the {@code .kicad_mod} file for {@code id}, looked up in the directory named after
     * the id's library first and then in every other directory in list order.
     */
    public Optional<String> read(QualifiedId id) {
        String file = id.name() + LibraryManager.FOOTPRINT_EXTENSION;
        for (boolean preferred : new boolean[] {true, false}) {
            for (Path library : libraries) {
                if (libraryName(library).equals(id.library()) != preferred) continue;
                Path footprint = library.resolve(file);
                if (!Files.isRegularFile(footprint)) continue;
                try {
                    return Optional.of(Files.readString(footprint));
                } catch (IOException e) {
                    log.warn("Cannot read footprint {}: {}", footprint, e.getMessage());
                }
            }
        }
        return Optional.empty();
    }

    public static String libraryName(Path library) {
        String name = library.getFileName().toString();
        return name.endsWith(LibraryManager.FOOTPRINT_LIBRARY_EXTENSION)
                ? name.substring(0, name.length() - LibraryManager.FOOTPRINT_LIBRARY_EXTENSION.length())
                : name;
    }
}
