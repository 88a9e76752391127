package nl.bytesoflife.deltakicad.text;

/**
 * Half-open character range {@code [start, end)} into a document's text delimiting one block.
 */
public record Span(int start, int end) {

    public Span {
        if (start < 0 || end < start) {
            throw new IllegalArgumentException("Invalid span [" + start + ", " + end + ")");
        }
    }

    public String text(String source) {
        return source.substring(start, end);
    }

    public int length() {
        return end - start;
    }

    public boolean contains(int index) {
        return index >= start && index < end;
    }

    public boolean encloses(Span other) {
        return other.start >= start && other.end <= end;
    }

    public Span shift(int offset) {
        return new Span(start + offset, end + offset);
    }
}
