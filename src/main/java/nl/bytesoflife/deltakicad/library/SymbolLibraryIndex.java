package nl.bytesoflife.deltakicad.library;

import nl.bytesoflife.deltakicad.NotFoundException;
import nl.bytesoflife.deltakicad.config.EngineSettings;
import nl.bytesoflife.deltakicad.model.SymbolDefinition;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.FileSystems;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.PathMatcher;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Locale;
import java.util.function.Predicate;
import java.util.stream.Stream;

/**
 * Case-insensitive name search over the configured symbol and footprint libraries, plus
 * detailed information about a single symbol.
 */
public class SymbolLibraryIndex {

    private static final Logger log = LoggerFactory.getLogger(SymbolLibraryIndex.class);

    public static final int MAX_RESULTS = 50;

    private final SymbolLibraries symbols;
    private final List<Path> footprintLibraries;

    public SymbolLibraryIndex(EngineSettings settings) {
        this.symbols = new SymbolLibraries(settings.getSymbolLibraries());
        this.footprintLibraries = settings.getFootprintLibraries();
    }

    public List<LibraryEntry> searchSymbols(String query) {
        String needle = query.toLowerCase(Locale.ROOT);
        List<LibraryEntry> hits = new ArrayList<>();
        for (LibrarySymbol symbol : symbols.definitions()) {
            if (symbol.name().toLowerCase(Locale.ROOT).contains(needle)) {
                hits.add(new LibraryEntry(symbol.id(), symbol.path()));
                if (hits.size() == MAX_RESULTS) break;
            }
        }
        return hits;
    }

    public List<LibraryEntry> searchFootprints(String query) {
        String needle = query.toLowerCase(Locale.ROOT);
        return footprints(name -> name.toLowerCase(Locale.ROOT).contains(needle));
    }

    private List<LibraryEntry> footprints(Predicate<String> nameFilter) {
        List<LibraryEntry> hits = new ArrayList<>();
        for (Path library : footprintLibraries) {
            if (!Files.isDirectory(library)) {
                log.warn("Footprint library {} is not a directory", library);
                continue;
            }
            String libraryName = FootprintLibraries.libraryName(library);
            try (Stream<Path> files = Files.list(library)) {
                List<Path> footprints = files
                        .filter(f -> f.getFileName().toString().endsWith(LibraryManager.FOOTPRINT_EXTENSION))
                        .sorted()
                        .toList();
                for (Path footprint : footprints) {
                    String file = footprint.getFileName().toString();
                    String name = file.substring(0, file.length() - LibraryManager.FOOTPRINT_EXTENSION.length());
                    if (nameFilter.test(name)) {
                        hits.add(new LibraryEntry(new QualifiedId(libraryName, name), footprint));
                        if (hits.size() == MAX_RESULTS) return hits;
                    }
                }
            } catch (IOException e) {
                log.warn("Cannot list footprint library {}: {}", library, e.getMessage());
            }
        }
        return hits;
    }

    /**
     * Footprints whose names match one of the symbol's {@code ki_fp_filters} glob patterns.
     */
    public List<LibraryEntry> suggestFootprints(QualifiedId symbol) {
        List<PathMatcher> filters = new ArrayList<>();
        for (String pattern : symbolInfo(symbol).footprintFilters()) {
            filters.add(FileSystems.getDefault().getPathMatcher("glob:" + pattern));
        }
        if (filters.isEmpty()) {
            return List.of();
        }
        return footprints(name -> filters.stream().anyMatch(f -> f.matches(Path.of(name))));
    }

    public SymbolInfo symbolInfo(QualifiedId id) {
        SymbolLibraries.LibraryBlock block = symbols.locate(id)
                .orElseThrow(() -> new NotFoundException(id.toString(), "Symbol " + id + " not found in configured libraries"));
        SymbolDefinition definition = new SymbolDefinition(block.parse());
        String filters = definition.property("ki_fp_filters").orElse("");
        return new SymbolInfo(
                id,
                block.library(),
                definition.property("Description").or(() -> definition.property("ki_description")).orElse(""),
                definition.property("ki_keywords").orElse(""),
                definition.property("Datasheet").orElse(""),
                filters.isBlank() ? List.of() : Arrays.asList(filters.trim().split("\\s+")),
                definition.getUnitCount(),
                definition.isPower(),
                definition.getPins());
    }
}
