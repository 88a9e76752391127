package nl.bytesoflife.deltakicad.library;

import nl.bytesoflife.deltakicad.parser.SNode;

import java.nio.file.Path;

/**
 * A parsed top-level symbol definition together with the library it came from.
 */
public record LibrarySymbol(String library, Path path, SNode.SList definition) {

    public String name() {
        return definition.atomValue(1);
    }

    public QualifiedId id() {
        return new QualifiedId(library, name());
    }
}
