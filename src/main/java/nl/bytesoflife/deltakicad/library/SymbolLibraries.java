package nl.bytesoflife.deltakicad.library;

import nl.bytesoflife.deltakicad.KicadDocumentException;
import nl.bytesoflife.deltakicad.parser.SExpressionParser;
import nl.bytesoflife.deltakicad.parser.SNode;
import nl.bytesoflife.deltakicad.text.BlockFinder;
import nl.bytesoflife.deltakicad.text.Span;
import nl.bytesoflife.deltakicad.text.StructuralEditor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Read access to an ordered list of external {@code .kicad_sym} files. Files are read on every
 * lookup; unreadable or malformed files are skipped with a warning.
 */
public class SymbolLibraries {

    private static final Logger log = LoggerFactory.getLogger(SymbolLibraries.class);

    public static final String EXTENSION = ".kicad_sym";

    /**
     * A symbol definition as it appears in its library file.
     */
    public record LibraryBlock(Path library, String source, Span span) {

        public String text() {
            return span.text(source);
        }

        /**
         * Whitespace the definition's first line is indented with in its library file.
         */
        public String indent() {
            return StructuralEditor.lineIndent(source, span.start());
        }

        public SNode.SList parse() {
            return new SExpressionParser().parseDocument(text());
        }
    }

    private final List<Path> libraries;

    public SymbolLibraries(List<Path> libraries) {
        this.libraries = List.copyOf(libraries);
    }

    public List<Path> getLibraries() {
        return libraries;
    }

    /**
     * Finds the definition for {@code id}. Files named after the id's library are searched first;
     * when none of them has the symbol every other file is tried in list order.
     */
    public Optional<LibraryBlock> locate(QualifiedId id) {
        List<Path> preferred = new ArrayList<>();
        List<Path> others = new ArrayList<>();
        for (Path library : libraries) {
            if (libraryName(library).equals(id.library())) {
                preferred.add(library);
            } else {
                others.add(library);
            }
        }
        Optional<LibraryBlock> found = locateIn(preferred, id.name());
        if (found.isPresent()) {
            return found;
        }
        return locateIn(others, id.name());
    }

    /**
     * Looks for {@code name} in one library file.
     */
    public Optional<LibraryBlock> locate(Path library, String name) {
        Optional<String> source = read(library);
        if (source.isEmpty()) {
            return Optional.empty();
        }
        try {
            return BlockFinder.findByTagValue(source.get(), "symbol", name)
                    .map(span -> new LibraryBlock(library, source.get(), span));
        } catch (KicadDocumentException e) {
            log.warn("Skipping malformed symbol library {}: {}", library, e.getMessage());
            return Optional.empty();
        }
    }

    /**
     * Top-level symbol definitions of every readable library, in list order.
     */
    public List<LibrarySymbol> definitions() {
        List<LibrarySymbol> result = new ArrayList<>();
        for (Path library : libraries) {
            Optional<String> source = read(library);
            if (source.isEmpty()) continue;
            try {
                SNode.SList root = new SExpressionParser().parseDocument(source.get());
                for (SNode.SList symbol : root.lists("symbol")) {
                    result.add(new LibrarySymbol(libraryName(library), library, symbol));
                }
            } catch (KicadDocumentException e) {
                log.warn("Skipping malformed symbol library {}: {}", library, e.getMessage());
            }
        }
        return result;
    }

    /**
     * Library nickname derived from a file name: {@code Device.kicad_sym} is {@code Device}.
     */
    public static String libraryName(Path library) {
        String file = library.getFileName().toString();
        return file.endsWith(EXTENSION) ? file.substring(0, file.length() - EXTENSION.length()) : file;
    }

    private Optional<LibraryBlock> locateIn(List<Path> candidates, String name) {
        for (Path library : candidates) {
            Optional<LibraryBlock> block = locate(library, name);
            if (block.isPresent()) {
                log.debug("Resolved {} in {}", name, library);
                return block;
            }
        }
        return Optional.empty();
    }

    private Optional<String> read(Path library) {
        if (!Files.isRegularFile(library)) {
            log.warn("Symbol library {} does not exist", library);
            return Optional.empty();
        }
        try {
            return Optional.of(Files.readString(library));
        } catch (IOException e) {
            log.warn("Cannot read symbol library {}: {}", library, e.getMessage());
            return Optional.empty();
        }
    }
}
