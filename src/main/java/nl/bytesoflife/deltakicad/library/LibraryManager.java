package nl.bytesoflife.deltakicad.library;

import nl.bytesoflife.deltakicad.AlreadyExistsException;
import nl.bytesoflife.deltakicad.NotFoundException;
import nl.bytesoflife.deltakicad.parser.SExpressionParser;
import nl.bytesoflife.deltakicad.parser.SExpressionWriter;
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
 * Project-level library housekeeping: copying symbols and footprints into project libraries,
 * creating those libraries and registering them in the project's library tables.
 */
public class LibraryManager {

    private static final Logger log = LoggerFactory.getLogger(LibraryManager.class);

    static final String FOOTPRINT_EXTENSION = ".kicad_mod";
    static final String FOOTPRINT_LIBRARY_EXTENSION = ".pretty";
    static final String PROJECT_DIR_VARIABLE = "${KIPRJMOD}";

    private final StructuralEditor editor;

    public LibraryManager(StructuralEditor editor) {
        this.editor = editor;
    }

    /**
     * Appends the definition of {@code name} from {@code sourceLibrary} to {@code targetLibrary},
     * unchanged apart from indentation.
     */
    public void importSymbol(Path sourceLibrary, String name, Path targetLibrary) throws IOException {
        requireFile(sourceLibrary, "Source library");
        requireFile(targetLibrary, "Target library");

        SymbolLibraries.LibraryBlock block = new SymbolLibraries(List.of(sourceLibrary)).locate(sourceLibrary, name)
                .orElseThrow(() -> new NotFoundException(name, "Symbol '" + name + "' not found in " + sourceLibrary));

        String target = Files.readString(targetLibrary);
        if (BlockFinder.findByTagValue(target, "symbol", name).isPresent()) {
            throw new AlreadyExistsException(name, "Symbol '" + name + "' already exists in " + targetLibrary);
        }
        String indent = topLevelIndent(target);
        String updated = editor.insertBeforeEnd(target, indent + StructuralEditor.reindent(block.text(), block.indent(), indent));
        Files.writeString(targetLibrary, updated);
        log.info("Imported symbol {} from {} into {}", name, sourceLibrary, targetLibrary);
    }

    /**
     * Copies {@code name.kicad_mod} between two {@code .pretty} directories.
     *
     * @return the created footprint file
     */
    public Path importFootprint(Path sourceLibrary, String name, Path targetLibrary) throws IOException {
        Path source = sourceLibrary.resolve(name + FOOTPRINT_EXTENSION);
        requireFile(source, "Footprint file");
        if (!Files.isDirectory(targetLibrary)) {
            throw new LibraryImportException("Target footprint library not found: " + targetLibrary);
        }
        Path target = targetLibrary.resolve(name + FOOTPRINT_EXTENSION);
        if (Files.exists(target)) {
            throw new AlreadyExistsException(name, "Footprint '" + name + "' already exists in " + targetLibrary);
        }
        Files.copy(source, target);
        log.info("Imported footprint {} from {} into {}", name, sourceLibrary, targetLibrary);
        return target;
    }

    /**
     * Creates an empty symbol library file and/or footprint directory in the project directory.
     * Existing libraries are left alone.
     *
     * @return the paths that were created
     */
    public List<Path> createProjectLibrary(Path projectDir, String name, LibraryKind kind) throws IOException {
        List<Path> created = new ArrayList<>();
        if (kind.includesSymbols()) {
            Path symbols = projectDir.resolve(name + SymbolLibraries.EXTENSION);
            if (!Files.exists(symbols)) {
                Files.writeString(symbols, """
                        (kicad_symbol_lib
                          (version 20231120)
                          (generator "delta_kicad")
                          (generator_version "8.0")
                        )
                        """);
                created.add(symbols);
            }
        }
        if (kind.includesFootprints()) {
            Path footprints = projectDir.resolve(name + FOOTPRINT_LIBRARY_EXTENSION);
            if (!Files.exists(footprints)) {
                Files.createDirectories(footprints);
                created.add(footprints);
            }
        }
        log.info("Created project library {} in {}: {}", name, projectDir, created);
        return created;
    }

    /**
     * Adds a library entry to the project's {@code sym-lib-table} or {@code fp-lib-table}, creating
     * the table when needed. Registering a name twice leaves the table untouched.
     */
    public LibraryRegistration registerProjectLibrary(Path projectDir, String name, Path library, LibraryKind kind)
            throws IOException {
        if (kind == LibraryKind.BOTH) {
            throw new IllegalArgumentException("Register symbol and footprint libraries separately");
        }
        Path table = projectDir.resolve(kind.getTableFile());
        String uri = projectRelativeUri(projectDir, library);

        String entry = "(lib (name " + SExpressionWriter.quote(name) + ")(type \"KiCad\")(uri "
                + SExpressionWriter.quote(uri) + ")(options \"\")(descr \"\"))";
        if (!Files.exists(table)) {
            Files.writeString(table, "(" + kind.getTableTag() + "\n  (version 7)\n  " + entry + "\n)\n");
            log.info("Created {} with library {}", table, name);
            return new LibraryRegistration(name, table, uri, false);
        }

        String content = Files.readString(table);
        Optional<String> existing = registeredUri(content, name);
        if (existing.isPresent()) {
            log.debug("Library {} already registered in {}", name, table);
            return new LibraryRegistration(name, table, existing.get(), true);
        }
        Files.writeString(table, editor.insertBeforeEnd(content, topLevelIndent(content) + entry));
        log.info("Registered library {} in {} as {}", name, table, uri);
        return new LibraryRegistration(name, table, uri, false);
    }

    static String projectRelativeUri(Path projectDir, Path library) {
        Path absoluteLibrary = library.toAbsolutePath().normalize();
        Path absoluteProject = projectDir.toAbsolutePath().normalize();
        if (absoluteLibrary.startsWith(absoluteProject)) {
            String relative = absoluteProject.relativize(absoluteLibrary).toString().replace('\\', '/');
            return PROJECT_DIR_VARIABLE + "/" + relative;
        }
        return absoluteLibrary.toString().replace('\\', '/');
    }

    private static Optional<String> registeredUri(String table, String name) {
        SNode.SList root = new SExpressionParser().parseDocument(table);
        for (SNode.SList lib : root.lists("lib")) {
            Optional<SNode.SList> libName = lib.first("name");
            if (libName.isPresent() && name.equals(libName.get().atomValue(1))) {
                return Optional.of(lib.first("uri").map(uri -> uri.atomValue(1)).orElse(""));
            }
        }
        return Optional.empty();
    }

    private static String topLevelIndent(String text) {
        Span root = new Span(text.indexOf('('), text.lastIndexOf(')') + 1);
        List<BlockFinder.Child> children = BlockFinder.children(text, root);
        if (children.isEmpty()) {
            return "  ";
        }
        return StructuralEditor.lineIndent(text, children.get(0).span().start());
    }

    private static void requireFile(Path path, String what) {
        if (!Files.isRegularFile(path)) {
            throw new LibraryImportException(what + " not found: " + path);
        }
    }
}
