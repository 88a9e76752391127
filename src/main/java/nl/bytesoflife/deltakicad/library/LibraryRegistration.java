package nl.bytesoflife.deltakicad.library;

import java.nio.file.Path;

/**
 * Result of registering a library in a project library table.
 *
 * @param uri the URI written (or found) for the entry, {@code ${KIPRJMOD}}-relative when the
 *            library lives inside the project directory
 */
public record LibraryRegistration(String name, Path tableFile, String uri, boolean alreadyRegistered) {
}
