package nl.bytesoflife.deltakicad.library;

import nl.bytesoflife.deltakicad.parser.MalformedDocumentException;
import nl.bytesoflife.deltakicad.parser.SExpressionWriter;
import nl.bytesoflife.deltakicad.parser.SNode;
import nl.bytesoflife.deltakicad.text.BlockFinder;
import nl.bytesoflife.deltakicad.text.BlockLocator;
import nl.bytesoflife.deltakicad.text.Span;
import nl.bytesoflife.deltakicad.text.StructuralEditor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.Optional;

/**
 * Copies library symbol definitions into a schematic's {@code lib_symbols} cache.
 * <p>
 * A copied definition is renamed to its qualified form, and so is every nested unit/body-style
 * sub-definition ({@code R_0_1} becomes {@code Device:R_0_1}), which keeps definitions of the same
 * local name from different libraries apart. A symbol that {@code extends} another pulls its
 * parent into the cache first.
 */
public class SymbolCacheInjector {

    private static final Logger log = LoggerFactory.getLogger(SymbolCacheInjector.class);

    private static final int MAX_INHERITANCE_DEPTH = 5;

    private final SymbolLibraries libraries;
    private final StructuralEditor editor;

    public SymbolCacheInjector(SymbolLibraries libraries, StructuralEditor editor) {
        this.libraries = libraries;
        this.editor = editor;
    }

    public CacheResult ensureCached(String text, QualifiedId id) {
        return ensureCached(text, id, 0);
    }

    /**
     * Whether {@code lib_symbols} already holds a definition named {@code id}.
     */
    public static boolean isCached(String text, QualifiedId id) {
        return BlockFinder.findSection(text, "lib_symbols")
                .map(section -> BlockFinder.findByTagValue(section.text(text), "symbol", id.toString()).isPresent())
                .orElse(false);
    }

    private CacheResult ensureCached(String text, QualifiedId id, int depth) {
        if (isCached(text, id)) {
            return new CacheResult(text, CacheResult.Status.ALREADY_CACHED);
        }
        Optional<SymbolLibraries.LibraryBlock> found = libraries.locate(id);
        if (found.isEmpty()) {
            log.warn("Symbol {} not found in {} configured libraries; instance will have no cached definition",
                    id, libraries.getLibraries().size());
            return new CacheResult(text, CacheResult.Status.UNRESOLVED);
        }
        SymbolLibraries.LibraryBlock block = found.get();

        String result = text;
        String definition = block.text();
        SNode.SList parsed = block.parse();
        Optional<SNode.SList> extendsClause = parsed.first("extends");
        if (extendsClause.isPresent()) {
            String parent = extendsClause.get().atomValue(1);
            if (depth >= MAX_INHERITANCE_DEPTH) {
                log.warn("Inheritance chain of {} is deeper than {}; parent {} not cached", id, MAX_INHERITANCE_DEPTH, parent);
            } else {
                result = ensureCached(result, new QualifiedId(id.library(), parent), depth + 1).text();
            }
        }

        definition = qualifyNames(definition, id);
        result = ensureSection(result);
        Span section = BlockFinder.findSection(result, "lib_symbols").orElseThrow();
        String childIndent = StructuralEditor.nested(StructuralEditor.lineIndent(result, section.start()));
        String insertion = childIndent + StructuralEditor.reindent(definition, block.indent(), childIndent);
        log.info("Caching {} from {}", id, block.library());
        return new CacheResult(editor.insertIntoBlock(result, section, insertion), CacheResult.Status.INSERTED);
    }

    /**
     * Renames the definition and its sub-definitions, and qualifies an {@code extends} target.
     */
    static String qualifyNames(String definition, QualifiedId id) {
        String result = definition;
        List<Span> symbols = BlockFinder.candidates(result, "symbol");
        for (int i = symbols.size() - 1; i >= 0; i--) {
            result = qualifyNameToken(result, symbols.get(i).start(), id);
        }
        List<Span> parents = BlockFinder.candidates(result, "extends");
        for (int i = parents.size() - 1; i >= 0; i--) {
            Span token = nameToken(result, parents.get(i).start());
            String parent = SExpressionWriter.unquote(token.text(result));
            result = result.substring(0, token.start()) + SExpressionWriter.quote(id.qualify(parent))
                    + result.substring(token.end());
        }
        return result;
    }

    private static String qualifyNameToken(String text, int blockStart, QualifiedId id) {
        Span token = nameToken(text, blockStart);
        String name = SExpressionWriter.unquote(token.text(text));
        if (!name.equals(id.name()) && !name.startsWith(id.name() + "_")) {
            return text;
        }
        return text.substring(0, token.start()) + SExpressionWriter.quote(id.qualify(name)) + text.substring(token.end());
    }

    private static Span nameToken(String text, int blockStart) {
        Span block = BlockLocator.spanAt(text, blockStart);
        return BlockFinder.atomSpan(text, block, 1)
                .orElseThrow(() -> new MalformedDocumentException("Definition block has no name", blockStart));
    }

    /**
     * Adds an empty {@code lib_symbols} section ahead of the first symbol instance when the
     * document has none.
     */
    private String ensureSection(String text) {
        if (BlockFinder.findSection(text, "lib_symbols").isPresent()) {
            return text;
        }
        Span root = BlockLocator.spanAt(text, text.indexOf('('));
        List<BlockFinder.Child> children = BlockFinder.children(text, root);
        String indent = children.isEmpty() ? "  " : StructuralEditor.lineIndent(text, children.get(0).span().start());
        String section = indent + "(lib_symbols\n" + indent + ")\n";
        for (BlockFinder.Child child : children) {
            if (child.tag().equals("symbol")) {
                int lineStart = text.lastIndexOf('\n', child.span().start()) + 1;
                log.debug("Creating lib_symbols before first symbol instance");
                return editor.insertAt(text, lineStart, section);
            }
        }
        return editor.insertBeforeEnd(text, section);
    }
}
