package de.anton.spectral.unmixer.model;

import de.anton.spectral.unmixer.exception.FormatException;
import org.apache.poi.EmptyFileException;
import org.apache.poi.poifs.filesystem.NotOLE2FileException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.util.List;
import java.util.Locale;
import java.util.Objects;

/**
 * Classifies a raw input file by extension and, for spreadsheet extensions, by probing the content.
 * A file named .xlsx/.xls whose content is neither a ZIP nor an OLE2 container is reported as
 * {@link SpectrumFileFormat#CSV_DISGUISED_AS_EXCEL}; every other probe failure, a damaged
 * container included, is fatal.
 */
public class FormatDetector {

    private static final Logger logger = LoggerFactory.getLogger(FormatDetector.class);

    private static final int PROBE_ROWS = 5;
    // Lower-case fragments of POI messages meaning "neither a ZIP nor an OLE2 container".
    // A ZIP container that fails to open as OOXML is a broken workbook, not text.
    private static final List<String> NOT_A_CONTAINER_SIGNATURES = List.of(
            "unsupported file type",
            "neither an ole2 stream, nor an ooxml stream",
            "invalid header signature");

    private final SpreadsheetReader spreadsheetReader;

    public FormatDetector() {
        this(new SpreadsheetReader());
    }

    public FormatDetector(SpreadsheetReader spreadsheetReader) {
        this.spreadsheetReader = Objects.requireNonNull(spreadsheetReader, "Spreadsheet reader cannot be null.");
    }

    /**
     * Detects the format of the given file.
     *
     * @param path The raw input file.
     * @return The detected format; {@link SpectrumFileFormat#UNKNOWN} for unsupported extensions.
     * @throws IOException     If the file does not exist.
     * @throws FormatException If a spreadsheet file is empty or broken in a way other than being plain text.
     */
    public SpectrumFileFormat detect(Path path) throws IOException, FormatException {
        Objects.requireNonNull(path, "Input path cannot be null.");
        if (!Files.isRegularFile(path)) {
            throw new NoSuchFileException(path.toString());
        }

        switch (extensionOf(path)) {
            case "xlsx":
            case "xls":
                return probeWorkbook(path);
            case "csv":
                return SpectrumFileFormat.CSV;
            case "txt":
                return SpectrumFileFormat.TXT;
            default:
                return SpectrumFileFormat.UNKNOWN;
        }
    }

    private SpectrumFileFormat probeWorkbook(Path path) throws FormatException {
        try {
            spreadsheetReader.read(path, PROBE_ROWS);
            return SpectrumFileFormat.EXCEL;
        } catch (EmptyFileException e) {
            throw new FormatException("File '" + path.getFileName() + "' is empty.", e);
        } catch (IOException | RuntimeException e) {
            if (isNotAContainer(e)) {
                logger.debug("'{}' is not a workbook container: {}", path.getFileName(), e.getMessage());
                return SpectrumFileFormat.CSV_DISGUISED_AS_EXCEL;
            }
            logger.error("Could not open '{}' as a spreadsheet.", path.toAbsolutePath(), e);
            throw new FormatException("Could not open '" + path.getFileName() + "' as a spreadsheet: " + e.getMessage(), e);
        }
    }

    private static boolean isNotAContainer(Throwable error) {
        for (Throwable t = error; t != null; t = t.getCause()) {
            if (t instanceof NotOLE2FileException) {
                return true;
            }
            String message = t.getMessage();
            if (message != null) {
                String lower = message.toLowerCase(Locale.ROOT);
                for (String signature : NOT_A_CONTAINER_SIGNATURES) {
                    if (lower.contains(signature)) {
                        return true;
                    }
                }
            }
        }
        return false;
    }

    static String extensionOf(Path path) {
        Path fileName = path.getFileName();
        String name = fileName == null ? "" : fileName.toString();
        int dot = name.lastIndexOf('.');
        return dot < 0 ? "" : name.substring(dot + 1).toLowerCase(Locale.ROOT);
    }
}
