package de.anton.spectral.unmixer.model;

import java.util.List;
import java.util.Locale;
import java.util.Set;
import java.util.regex.Pattern;

/**
 * Strict numeric coercion for table cells.
 * Only plain decimal notation (optionally signed, optionally with exponent) is accepted;
 * Java-specific literals such as {@code 1d}, {@code 0x1p3} or {@code 1_000} are rejected.
 */
public final class NumericParser {

    // Cell contents that readers treat as "missing" rather than as text
    private static final Set<String> MISSING_TOKENS = Set.of(
            "", "#N/A", "#N/A N/A", "#NA", "-1.#IND", "-1.#QNAN", "-NaN", "-nan", "1.#IND", "1.#QNAN",
            "<NA>", "N/A", "NA", "NULL", "NaN", "None", "n/a", "nan", "null");

    private static final Pattern DECIMAL = Pattern.compile("[+-]?(\\d+(\\.\\d*)?|\\.\\d+)([eE][+-]?\\d+)?");
    private static final Pattern INFINITY = Pattern.compile("[+-]?(inf|infinity)");

    private NumericParser() { throw new IllegalStateException("Utility class"); }

    /** @return true if the raw cell text stands for a missing value. */
    public static boolean isMissingToken(String raw) {
        return raw == null || MISSING_TOKENS.contains(raw.trim());
    }

    /**
     * Parses a cell as a finite double.
     *
     * @param raw Cell text, may be null.
     * @return the parsed value, or {@code Double.NaN} for missing, non-numeric or non-finite input.
     */
    public static double parseFinite(String raw) {
        if (isMissingToken(raw)) {
            return Double.NaN;
        }
        String cleaned = raw.trim();
        if (!DECIMAL.matcher(cleaned).matches()) {
            return Double.NaN;
        }
        double value = Double.parseDouble(cleaned);
        return Double.isFinite(value) ? value : Double.NaN;
    }

    /**
     * Checks whether a cell can be coerced to a number without error.
     * Missing cells and infinities count as coercible.
     */
    public static boolean isCoercible(String raw) {
        if (isMissingToken(raw)) {
            return true;
        }
        String cleaned = raw.trim();
        return DECIMAL.matcher(cleaned).matches()
                || INFINITY.matcher(cleaned.toLowerCase(Locale.ROOT)).matches();
    }

    /** @return true if every value in the list is coercible. */
    public static boolean allCoercible(List<String> values) {
        for (String value : values) {
            if (!isCoercible(value)) {
                return false;
            }
        }
        return true;
    }

    /** Coerces a whole column; see {@link #parseFinite(String)}. */
    public static double[] parseColumn(List<String> values) {
        double[] parsed = new double[values.size()];
        for (int i = 0; i < parsed.length; i++) {
            parsed[i] = parseFinite(values.get(i));
        }
        return parsed;
    }
}
