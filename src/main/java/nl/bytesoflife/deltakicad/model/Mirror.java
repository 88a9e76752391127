package nl.bytesoflife.deltakicad.model;

public enum Mirror {
    NONE,
    /** Flipped about the horizontal axis, {@code (mirror x)}. */
    X,
    /** Flipped about the vertical axis, {@code (mirror y)}. */
    Y;

    public static Mirror fromToken(String token) {
        return switch (token) {
            case "x" -> X;
            case "y" -> Y;
            default -> NONE;
        };
    }
}
