package de.anton.spectral.unmixer.model;

import de.anton.spectral.unmixer.exception.CleaningExhaustionException;
import de.anton.spectral.unmixer.exception.SchemaException;
import de.anton.spectral.unmixer.exception.TableParseException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Objects;

/**
 * Loads canonical spectrum files written by {@link SpectrumWriter}.
 * Canonical files are expected to be clean already; loading re-validates them anyway
 * (numeric coercion, invalid-row removal, sorting, de-duplication) so that every returned
 * {@link Spectrum} satisfies its invariants even for hand-edited files.
 */
public class SpectrumStore {

    private static final Logger logger = LoggerFactory.getLogger(SpectrumStore.class);
    private static final List<String> REQUIRED_COLUMNS = List.of(
            Spectrum.COLUMN_WAVENUMBER, Spectrum.COLUMN_EMISSIVITY, Spectrum.COLUMN_UNCERTAINTY);

    private final DelimitedTableReader tableReader;

    public SpectrumStore() {
        this(new DelimitedTableReader());
    }

    public SpectrumStore(DelimitedTableReader tableReader) {
        this.tableReader = Objects.requireNonNull(tableReader, "Table reader cannot be null.");
    }

    /**
     * Loads a canonical spectrum file.
     *
     * @param path The canonical tab-separated file.
     * @return The validated spectrum.
     * @throws IOException                 If the file cannot be read.
     * @throws SchemaException             If the file cannot be tokenized or a required column is missing.
     * @throws CleaningExhaustionException If no valid row remains.
     */
    public Spectrum load(Path path) throws IOException, SchemaException, CleaningExhaustionException {
        Objects.requireNonNull(path, "Spectrum path cannot be null.");
        RawTable table;
        try {
            table = tableReader.read(path, '\t', StandardCharsets.UTF_8);
        } catch (TableParseException e) {
            throw new SchemaException("File " + path + " is not a canonical spectrum file: " + e.getMessage(), e);
        }

        List<String> missing = new ArrayList<>();
        for (String column : REQUIRED_COLUMNS) {
            if (!table.getColumnNames().contains(column)) {
                missing.add(column);
            }
        }
        if (!missing.isEmpty()) {
            throw new SchemaException("File " + path + " is missing required columns: " + missing);
        }

        double[] wavenumber = NumericParser.parseColumn(table.getColumn(table.getColumnNames().indexOf(Spectrum.COLUMN_WAVENUMBER)));
        double[] emissivity = NumericParser.parseColumn(table.getColumn(table.getColumnNames().indexOf(Spectrum.COLUMN_EMISSIVITY)));
        double[] uncertainty = NumericParser.parseColumn(table.getColumn(table.getColumnNames().indexOf(Spectrum.COLUMN_UNCERTAINTY)));

        List<Integer> validRows = new ArrayList<>(table.getRowCount());
        for (int i = 0; i < table.getRowCount(); i++) {
            // parseFinite yields NaN for anything non-finite; comparisons with NaN are false
            if (wavenumber[i] > 0 && !Double.isNaN(emissivity[i]) && uncertainty[i] >= 0) {
                validRows.add(i);
            }
        }
        if (validRows.size() < table.getRowCount()) {
            logger.warn("Removed {} invalid rows from {}", table.getRowCount() - validRows.size(), path.getFileName());
        }
        if (validRows.isEmpty()) {
            throw new CleaningExhaustionException("No valid data in file " + path);
        }

        // Re-sorting is a no-op for files written by SpectrumWriter
        validRows.sort(Comparator.comparingDouble(i -> wavenumber[i]));
        List<Integer> uniqueRows = new ArrayList<>(validRows.size());
        for (int index : validRows) {
            if (uniqueRows.isEmpty() || wavenumber[uniqueRows.get(uniqueRows.size() - 1)] != wavenumber[index]) {
                uniqueRows.add(index);
            }
        }
        if (uniqueRows.size() < validRows.size()) {
            logger.warn("Dropped {} duplicate wavenumbers from {}, keeping first occurrence.",
                    validRows.size() - uniqueRows.size(), path.getFileName());
        }

        double[] wn = new double[uniqueRows.size()];
        double[] em = new double[uniqueRows.size()];
        double[] un = new double[uniqueRows.size()];
        for (int i = 0; i < wn.length; i++) {
            int row = uniqueRows.get(i);
            wn[i] = wavenumber[row];
            em[i] = emissivity[row];
            un[i] = uncertainty[row];
        }
        Spectrum spectrum = new Spectrum(wn, em, un);
        logger.debug("Loaded {} from {}", spectrum, path.getFileName());
        return spectrum;
    }
}
