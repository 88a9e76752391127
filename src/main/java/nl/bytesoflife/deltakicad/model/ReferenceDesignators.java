package nl.bytesoflife.deltakicad.model;

import nl.bytesoflife.deltakicad.InvalidIdentifierException;

import java.util.regex.Pattern;

/**
 * Reference designator rules: letters, a number and an optional unit letter ({@code R1},
 * {@code U3A}). Power and flag references start with {@code #}.
 */
public final class ReferenceDesignators {

    private static final Pattern COMPONENT = Pattern.compile("^[A-Za-z]+\\d+[A-Za-z]?$");
    private static final Pattern POWER = Pattern.compile("^#[A-Za-z]+\\d+$");

    private ReferenceDesignators() {}

    public static boolean isValid(String reference) {
        return reference != null && (COMPONENT.matcher(reference).matches() || POWER.matcher(reference).matches());
    }

    public static String requireValid(String reference) {
        if (!isValid(reference)) {
            throw new InvalidIdentifierException(reference,
                    "Invalid reference designator '" + reference + "', expected letters followed by a number, e.g. R1 or U3A");
        }
        return reference;
    }

    /**
     * Orders designators and pin numbers with embedded numbers compared numerically, so that
     * {@code R2} sorts before {@code R10}.
     */
    public static int compare(String a, String b) {
        int i = 0;
        int j = 0;
        while (i < a.length() && j < b.length()) {
            char ca = a.charAt(i);
            char cb = b.charAt(j);
            if (Character.isDigit(ca) && Character.isDigit(cb)) {
                int si = i;
                int sj = j;
                while (i < a.length() && Character.isDigit(a.charAt(i))) i++;
                while (j < b.length() && Character.isDigit(b.charAt(j))) j++;
                String na = a.substring(si, i).replaceFirst("^0+(?=.)", "");
                String nb = b.substring(sj, j).replaceFirst("^0+(?=.)", "");
                int cmp = na.length() != nb.length() ? Integer.compare(na.length(), nb.length()) : na.compareTo(nb);
                if (cmp != 0) return cmp;
            } else {
                if (ca != cb) return Character.compare(ca, cb);
                i++;
                j++;
            }
        }
        int rest = Integer.compare(a.length() - i, b.length() - j);
        return rest != 0 ? rest : a.compareTo(b);
    }
}
