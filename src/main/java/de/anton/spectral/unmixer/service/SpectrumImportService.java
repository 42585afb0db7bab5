package de.anton.spectral.unmixer.service;

import de.anton.spectral.unmixer.exception.FormatException;
import de.anton.spectral.unmixer.exception.SpectralDataException;
import de.anton.spectral.unmixer.model.DelimitedTableReader;
import de.anton.spectral.unmixer.model.FileInfo;
import de.anton.spectral.unmixer.model.FormatDetector;
import de.anton.spectral.unmixer.model.RawTable;
import de.anton.spectral.unmixer.model.Spectrum;
import de.anton.spectral.unmixer.model.SpectrumFileFormat;
import de.anton.spectral.unmixer.model.SpectrumNormalizer;
import de.anton.spectral.unmixer.model.SpectrumWriter;
import de.anton.spectral.unmixer.model.SpreadsheetReader;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Service responsible for turning raw measurement files into canonical spectrum files:
 * detect the format, read the table, normalize it and write the result.
 */
public class SpectrumImportService {

    private static final Logger logger = LoggerFactory.getLogger(SpectrumImportService.class);
    private static final int PREVIEW_ROWS = 10;
    private static final int PREVIEW_SAMPLE_ROWS = 3;

    private final FormatDetector formatDetector;
    private final DelimitedTableReader delimitedReader;
    private final SpreadsheetReader spreadsheetReader;
    private final SpectrumNormalizer normalizer;
    private final SpectrumWriter writer;

    public SpectrumImportService() {
        SpreadsheetReader spreadsheets = new SpreadsheetReader();
        this.formatDetector = new FormatDetector(spreadsheets);
        this.delimitedReader = new DelimitedTableReader();
        this.spreadsheetReader = spreadsheets;
        this.normalizer = new SpectrumNormalizer();
        this.writer = new SpectrumWriter();
    }

    public SpectrumImportService(FormatDetector formatDetector, DelimitedTableReader delimitedReader,
                                 SpreadsheetReader spreadsheetReader, SpectrumNormalizer normalizer, SpectrumWriter writer) {
        this.formatDetector = Objects.requireNonNull(formatDetector);
        this.delimitedReader = Objects.requireNonNull(delimitedReader);
        this.spreadsheetReader = Objects.requireNonNull(spreadsheetReader);
        this.normalizer = Objects.requireNonNull(normalizer);
        this.writer = Objects.requireNonNull(writer);
    }

    /**
     * Pre-processes a raw file into a canonical spectrum file.
     * The target is replaced atomically, so a failed import leaves an existing file untouched.
     *
     * @param rawFile         The measurement file (.xlsx, .xls, .csv or .txt).
     * @param canonicalTarget Where to write the canonical file.
     * @return The spectrum that was written.
     * @throws IOException           If reading or writing fails.
     * @throws SpectralDataException If the file format, table layout or content is unusable.
     */
    public Spectrum importSpectrum(Path rawFile, Path canonicalTarget) throws IOException, SpectralDataException {
        Objects.requireNonNull(rawFile, "Raw file cannot be null.");
        Objects.requireNonNull(canonicalTarget, "Target path cannot be null.");
        logger.info("Import Service: Pre-processing {} -> {}", rawFile.toAbsolutePath(), canonicalTarget);
        try {
            SpectrumFileFormat format = formatDetector.detect(rawFile);
            logger.info("Import Service: Detected file format '{}' for {}", format, rawFile.getFileName());
            RawTable table = readTable(rawFile, format, -1);
            logger.debug("Import Service: Read {}", table);

            Spectrum spectrum = normalizer.normalize(table);
            writer.write(spectrum, canonicalTarget);
            logger.info("Import Service: Saved {} points ({}-{} cm^-1) to {}", spectrum.size(),
                    spectrum.getMinWavenumber(), spectrum.getMaxWavenumber(), canonicalTarget.getFileName());
            return spectrum;
        } catch (IOException | SpectralDataException e) {
            logger.error("Import Service: Failed to import {}", rawFile.toAbsolutePath(), e);
            throw e;
        }
    }

    /** Imports a raw file under the given name and refreshes the library's name list. */
    public Spectrum importInto(SpectrumLibrary library, Path rawFile, String name) throws IOException, SpectralDataException {
        Objects.requireNonNull(library, "Library cannot be null.");
        Spectrum spectrum = importSpectrum(rawFile, library.pathOf(name));
        library.refresh();
        return spectrum;
    }

    /**
     * Previews a raw file without writing anything. Problems are reported in
     * {@link FileInfo#error()} instead of being thrown.
     */
    public FileInfo inspect(Path rawFile) {
        Objects.requireNonNull(rawFile, "Raw file cannot be null.");
        try {
            SpectrumFileFormat format = formatDetector.detect(rawFile);
            if (format == SpectrumFileFormat.UNKNOWN) {
                return FileInfo.failed("Unsupported file format");
            }
            RawTable sample = readTable(rawFile, format, PREVIEW_ROWS);

            List<Map<String, String>> firstRows = new ArrayList<>();
            for (int r = 0; r < Math.min(PREVIEW_SAMPLE_ROWS, sample.getRowCount()); r++) {
                firstRows.add(sample.getRowAsMap(r));
            }
            String shape = sample.getRowCount() + "+ rows, " + sample.getColumnCount() + " columns";
            return new FileInfo(format, sample.getColumnNames(), shape, List.copyOf(firstRows), null);
        } catch (IOException | SpectralDataException | RuntimeException e) {
            logger.warn("Import Service: Could not inspect {}: {}", rawFile.getFileName(), e.toString());
            return FileInfo.failed(e.getMessage() != null ? e.getMessage() : e.toString());
        }
    }

    /**
     * Reads the raw table for a detected format.
     *
     * @param maxRows Row limit, or a negative value for all rows.
     */
    private RawTable readTable(Path rawFile, SpectrumFileFormat format, int maxRows) throws IOException, SpectralDataException {
        RawTable table;
        switch (format) {
            case EXCEL:
                return maxRows < 0 ? spreadsheetReader.read(rawFile) : spreadsheetReader.read(rawFile, maxRows);
            case CSV_DISGUISED_AS_EXCEL:
                logger.warn("File '{}' has an Excel extension but contains delimited text; reading it as CSV. "
                        + "Consider renaming it to .csv.", rawFile.getFileName());
                table = delimitedReader.readWithDetection(rawFile);
                break;
            case CSV:
                table = delimitedReader.readWithDetection(rawFile);
                break;
            case TXT:
                table = delimitedReader.readTabOrComma(rawFile);
                break;
            default:
                throw new FormatException("Unsupported file format for '" + rawFile.getFileName()
                        + "'. Please use .csv, .txt, .xlsx, or .xls files.");
        }
        return maxRows < 0 ? table : table.head(maxRows);
    }
}
