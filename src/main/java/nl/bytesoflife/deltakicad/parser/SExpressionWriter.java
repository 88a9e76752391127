package nl.bytesoflife.deltakicad.parser;

/**
 * Serializes a node tree back to text. Output is compact (single spaces, no line breaks);
 * re-parsing it yields an equal tree.
 */
public final class SExpressionWriter {

    private SExpressionWriter() {}

    public static String write(SNode node) {
        StringBuilder sb = new StringBuilder();
        append(sb, node);
        return sb.toString();
    }

    /**
     * Writes the children of a root list produced by {@link SExpressionParser#parse(String)}, one form per line.
     */
    public static String writeForms(SNode.SList root) {
        StringBuilder sb = new StringBuilder();
        for (SNode child : root.children()) {
            append(sb, child);
            sb.append('\n');
        }
        return sb.toString();
    }

    private static void append(StringBuilder sb, SNode node) {
        if (node instanceof SNode.SAtom atom) {
            if (atom.isString()) {
                appendQuoted(sb, atom.value());
            } else {
                sb.append(atom.value());
            }
        } else if (node instanceof SNode.SList list) {
            sb.append('(');
            for (int i = 0; i < list.size(); i++) {
                if (i > 0) sb.append(' ');
                append(sb, list.get(i));
            }
            sb.append(')');
        }
    }

    public static String quote(String value) {
        StringBuilder sb = new StringBuilder();
        appendQuoted(sb, value);
        return sb.toString();
    }

    /**
     * Inverse of {@link #quote(String)} for a raw token cut from document text. Bare tokens are
     * returned unchanged.
     */
    public static String unquote(String token) {
        if (token.length() < 2 || !token.startsWith("\"") || !token.endsWith("\"")) {
            return token;
        }
        StringBuilder sb = new StringBuilder();
        for (int i = 1; i < token.length() - 1; i++) {
            char c = token.charAt(i);
            if (c == '\\' && i + 1 < token.length() - 1) {
                char next = token.charAt(++i);
                switch (next) {
                    case 'n' -> sb.append('\n');
                    case 't' -> sb.append('\t');
                    case 'r' -> sb.append('\r');
                    case '"', '\\' -> sb.append(next);
                    default -> sb.append('\\').append(next);
                }
            } else {
                sb.append(c);
            }
        }
        return sb.toString();
    }

    private static void appendQuoted(StringBuilder sb, String value) {
        sb.append('"');
        for (int i = 0; i < value.length(); i++) {
            char c = value.charAt(i);
            switch (c) {
                case '"' -> sb.append("\\\"");
                case '\\' -> sb.append("\\\\");
                case '\n' -> sb.append("\\n");
                case '\t' -> sb.append("\\t");
                case '\r' -> sb.append("\\r");
                default -> sb.append(c);
            }
        }
        sb.append('"');
    }
}
