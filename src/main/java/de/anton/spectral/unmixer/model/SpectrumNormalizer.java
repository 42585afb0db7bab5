package de.anton.spectral.unmixer.model;

import de.anton.spectral.unmixer.exception.CleaningExhaustionException;
import de.anton.spectral.unmixer.exception.SchemaException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.EnumMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;

/**
 * Maps an arbitrary raw table onto the canonical spectrum schema and cleans it.
 * <p>
 * Columns are identified by the keyword rules in {@link ColumnRole}, falling back to
 * position (0 = wavenumber, 1 = emissivity, 2 = uncertainty). Rows with missing or physically
 * invalid values are dropped, the rest is sorted by wavenumber and de-duplicated (first wins).
 * A missing uncertainty column is replaced by a relative default of 2% of |emissivity|.
 */
public class SpectrumNormalizer {

    private static final Logger logger = LoggerFactory.getLogger(SpectrumNormalizer.class);

    public static final double DEFAULT_RELATIVE_UNCERTAINTY = 0.02;
    private static final int RECOMMENDED_MIN_POINTS = 10;

    /**
     * Builds a clean spectrum from a raw table.
     *
     * @param raw The decoded input table.
     * @return The cleaned, sorted, de-duplicated spectrum.
     * @throws SchemaException              If the table is empty or has fewer than 2 columns.
     * @throws CleaningExhaustionException If no row survives cleaning.
     */
    public Spectrum normalize(RawTable raw) throws SchemaException, CleaningExhaustionException {
        Objects.requireNonNull(raw, "Raw table cannot be null.");
        if (raw.isEmpty()) {
            throw new SchemaException("File is empty: no data rows found.");
        }
        if (raw.getColumnCount() < 2) {
            throw new SchemaException("File must have at least 2 columns (wavenumber and emissivity). Found: " + raw.getColumnNames());
        }

        Map<ColumnRole, Integer> columns = identifyColumns(raw);
        int wavenumberCol = columns.get(ColumnRole.WAVENUMBER);
        int emissivityCol = columns.get(ColumnRole.EMISSIVITY);
        Integer uncertaintyCol = columns.get(ColumnRole.UNCERTAINTY);
        logger.info("Using columns - Wavenumber: '{}', Emissivity: '{}', Uncertainty: '{}'",
                raw.getColumnNames().get(wavenumberCol),
                raw.getColumnNames().get(emissivityCol),
                uncertaintyCol == null ? "<synthesized>" : raw.getColumnNames().get(uncertaintyCol));

        // --- 1. Numeric coercion ---
        double[] wavenumber = NumericParser.parseColumn(raw.getColumn(wavenumberCol));
        double[] emissivity = NumericParser.parseColumn(raw.getColumn(emissivityCol));

        // --- 2. Uncertainty: provided or synthesized ---
        double[] uncertainty = uncertaintyCol == null ? null : NumericParser.parseColumn(raw.getColumn(uncertaintyCol));
        if (uncertainty == null || !containsAnyNumber(uncertainty)) {
            if (uncertaintyCol != null) {
                logger.warn("Uncertainty column '{}' holds no numeric values, generating default values.", raw.getColumnNames().get(uncertaintyCol));
            } else {
                logger.info("No uncertainty column found, using {}% relative uncertainty.", DEFAULT_RELATIVE_UNCERTAINTY * 100);
            }
            uncertainty = new double[emissivity.length];
            for (int i = 0; i < emissivity.length; i++) {
                uncertainty[i] = DEFAULT_RELATIVE_UNCERTAINTY * Math.abs(emissivity[i]);
            }
        }

        // --- 3./4. Row validation ---
        List<Integer> validRows = new ArrayList<>(raw.getRowCount());
        for (int i = 0; i < raw.getRowCount(); i++) {
            if (Double.isNaN(wavenumber[i]) || Double.isNaN(emissivity[i])) {
                continue;
            }
            // NaN uncertainty fails the comparison and is dropped as well
            if (wavenumber[i] > 0 && uncertainty[i] >= 0) {
                validRows.add(i);
            }
        }
        int removed = raw.getRowCount() - validRows.size();
        if (removed > 0) {
            logger.info("Removed {} invalid rows during cleaning.", removed);
        }

        // --- 5. Sort (stable) and de-duplicate ---
        final double[] wn = wavenumber;
        validRows.sort(Comparator.comparingDouble(i -> wn[i]));
        List<Integer> uniqueRows = new ArrayList<>(validRows.size());
        for (int index : validRows) {
            if (uniqueRows.isEmpty() || wn[uniqueRows.get(uniqueRows.size() - 1)] != wn[index]) {
                uniqueRows.add(index);
            }
        }
        int duplicates = validRows.size() - uniqueRows.size();
        if (duplicates > 0) {
            logger.warn("Found {} duplicate wavenumber values, keeping first occurrence.", duplicates);
        }

        // --- 6. Final validation ---
        if (uniqueRows.isEmpty()) {
            throw new CleaningExhaustionException("No valid data rows remaining after cleaning.");
        }
        if (uniqueRows.size() < RECOMMENDED_MIN_POINTS) {
            logger.warn("Only {} data points after processing. This may be insufficient for analysis.", uniqueRows.size());
        }

        Spectrum spectrum = new Spectrum(
                select(wavenumber, uniqueRows),
                select(emissivity, uniqueRows),
                select(uncertainty, uniqueRows));
        logger.info("Normalized spectrum: {}", spectrum);
        return spectrum;
    }

    /**
     * Assigns table columns to roles: a single left-to-right scan over the headers,
     * each column taking the first role that is still free and whose keywords match.
     * Unmatched roles fall back to column position.
     *
     * @return Role to column index; UNCERTAINTY is absent when it has to be synthesized.
     */
    public Map<ColumnRole, Integer> identifyColumns(RawTable raw) {
        Map<ColumnRole, Integer> assigned = new EnumMap<>(ColumnRole.class);
        List<String> names = raw.getColumnNames();
        for (int c = 0; c < names.size(); c++) {
            String header = names.get(c).toLowerCase(Locale.ROOT).trim();
            for (ColumnRole role : ColumnRole.values()) {
                if (!assigned.containsKey(role) && role.matches(header)) {
                    assigned.put(role, c);
                    break;
                }
            }
        }

        if (!assigned.containsKey(ColumnRole.WAVENUMBER)) {
            logger.info("No wavenumber column detected by name, using first column: '{}'", names.get(0));
            assigned.put(ColumnRole.WAVENUMBER, 0);
        }
        if (!assigned.containsKey(ColumnRole.EMISSIVITY)) {
            logger.info("No emissivity column detected by name, using second column: '{}'", names.get(1));
            assigned.put(ColumnRole.EMISSIVITY, 1);
        }
        if (!assigned.containsKey(ColumnRole.UNCERTAINTY) && names.size() > 2) {
            logger.info("No uncertainty column detected by name, using third column: '{}'", names.get(2));
            assigned.put(ColumnRole.UNCERTAINTY, 2);
        }
        return assigned;
    }

    private static boolean containsAnyNumber(double[] values) {
        for (double value : values) {
            if (!Double.isNaN(value)) {
                return true;
            }
        }
        return false;
    }

    private static double[] select(double[] values, List<Integer> rows) {
        double[] selected = new double[rows.size()];
        for (int i = 0; i < selected.length; i++) {
            selected[i] = values[rows.get(i)];
        }
        return selected;
    }
}
