package nl.bytesoflife.deltakicad.library;

/**
 * Outcome of {@link SymbolCacheInjector#ensureCached}. {@code text} is the full document text
 * after the call, identical to the input unless a definition was inserted.
 */
public record CacheResult(String text, Status status) {

    public enum Status {
        ALREADY_CACHED,
        INSERTED,
        UNRESOLVED
    }

    public boolean resolved() {
        return status != Status.UNRESOLVED;
    }
}
