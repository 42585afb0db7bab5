package de.anton.spectral.unmixer.model;

import de.anton.spectral.unmixer.exception.TableParseException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.ByteBuffer;
import java.nio.charset.CharacterCodingException;
import java.nio.charset.Charset;
import java.nio.charset.CodingErrorAction;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Reads delimited text tables whose delimiter and encoding are not known in advance.
 * <p>
 * {@link #readWithDetection(Path)} tries every delimiter/encoding combination and keeps the
 * best-scoring parse; {@link #readTabOrComma(Path)} is the simpler fallback used for .txt files.
 * The tokenizer understands double-quoted fields ({@code ""} escapes a quote), skips blank lines,
 * treats the first record as header and pads short rows with missing cells.
 */
public class DelimitedTableReader {

    private static final Logger logger = LoggerFactory.getLogger(DelimitedTableReader.class);

    // Iteration order matters: ties keep the first candidate found (delimiter outer, encoding inner)
    private static final List<Character> CANDIDATE_DELIMITERS = List.of(',', '\t', ';', '|');
    private static final List<Charset> CANDIDATE_CHARSETS = List.of(
            StandardCharsets.UTF_8,
            StandardCharsets.ISO_8859_1,        // latin-1
            Charset.forName("windows-1252"),
            StandardCharsets.ISO_8859_1);
    private static final int SCORED_LEADING_COLUMNS = 3;
    private static final int SCORED_SAMPLE_ROWS = 10;
    private static final char QUOTE = '"';
    private static final char BYTE_ORDER_MARK = '\uFEFF';

    /**
     * Loads a delimited file by trial-and-score search over delimiters and encodings.
     * Score = columns x (leading columns whose first values are numeric) x rows.
     *
     * @param path The file to read.
     * @return The best-scoring table.
     * @throws IOException         If the file cannot be read at all.
     * @throws TableParseException If no combination yields a usable table.
     */
    public RawTable readWithDetection(Path path) throws IOException, TableParseException {
        Objects.requireNonNull(path, "Input path cannot be null.");
        byte[] bytes = Files.readAllBytes(path);

        RawTable bestTable = null;
        long bestScore = 0;
        String bestDescription = null;

        for (char delimiter : CANDIDATE_DELIMITERS) {
            for (Charset charset : CANDIDATE_CHARSETS) {
                String description = "delimiter=" + describe(delimiter) + ", encoding=" + charset.name();
                try {
                    RawTable candidate = parse(bytes, delimiter, charset);
                    if (candidate.getColumnCount() < 2) {
                        logger.trace("Rejected {} for {}: only {} column(s).", description, path.getFileName(), candidate.getColumnCount());
                        continue;
                    }
                    long score = score(candidate);
                    logger.trace("Candidate {} for {}: {} columns, {} rows, score {}",
                            description, path.getFileName(), candidate.getColumnCount(), candidate.getRowCount(), score);
                    if (score > bestScore) {
                        bestScore = score;
                        bestTable = candidate;
                        bestDescription = description;
                    }
                } catch (CharacterCodingException | TableParseException e) {
                    logger.trace("Rejected {} for {}: {}", description, path.getFileName(), e.getMessage());
                }
            }
        }

        if (bestTable == null) {
            throw new TableParseException("Could not read '" + path.getFileName()
                    + "' with any common delimiter/encoding combination.");
        }
        logger.info("Read '{}' using {} (score {}, {} columns, {} rows).",
                path.getFileName(), bestDescription, bestScore, bestTable.getColumnCount(), bestTable.getRowCount());
        return bestTable;
    }

    /**
     * Reads a UTF-8 text file as tab-delimited, falling back to comma-delimited when the
     * tab parse fails or yields a single column. No scoring is done.
     */
    public RawTable readTabOrComma(Path path) throws IOException, TableParseException {
        Objects.requireNonNull(path, "Input path cannot be null.");
        byte[] bytes = Files.readAllBytes(path);
        try {
            RawTable table = parse(bytes, '\t', StandardCharsets.UTF_8);
            if (table.getColumnCount() >= 2) {
                return table;
            }
            logger.debug("Tab-delimited parse of '{}' gave a single column, retrying comma-delimited.", path.getFileName());
        } catch (CharacterCodingException | TableParseException e) {
            logger.debug("Tab-delimited parse of '{}' failed ({}), retrying comma-delimited.", path.getFileName(), e.getMessage());
        }
        return read(bytes, ',', StandardCharsets.UTF_8, path);
    }

    /**
     * Reads a file with a fixed delimiter and encoding.
     */
    public RawTable read(Path path, char delimiter, Charset charset) throws IOException, TableParseException {
        Objects.requireNonNull(path, "Input path cannot be null.");
        return read(Files.readAllBytes(path), delimiter, charset, path);
    }

    private RawTable read(byte[] bytes, char delimiter, Charset charset, Path path) throws TableParseException {
        try {
            return parse(bytes, delimiter, charset);
        } catch (CharacterCodingException e) {
            throw new TableParseException("File '" + path.getFileName() + "' is not valid " + charset.name() + " text.", e);
        }
    }

    /**
     * Scores a candidate parse. Zero means "no numeric data found".
     */
    static long score(RawTable table) {
        int numericColumns = 0;
        int leading = Math.min(SCORED_LEADING_COLUMNS, table.getColumnCount());
        for (int c = 0; c < leading; c++) {
            List<String> column = table.getColumn(c);
            if (NumericParser.allCoercible(column.subList(0, Math.min(SCORED_SAMPLE_ROWS, column.size())))) {
                numericColumns++;
            }
        }
        return (long) table.getColumnCount() * numericColumns * table.getRowCount();
    }

    /** Decodes and tokenizes raw bytes into a table. */
    RawTable parse(byte[] bytes, char delimiter, Charset charset) throws CharacterCodingException, TableParseException {
        String text = charset.newDecoder()
                .onMalformedInput(CodingErrorAction.REPORT)
                .onUnmappableCharacter(CodingErrorAction.REPORT)
                .decode(ByteBuffer.wrap(bytes))
                .toString();
        if (!text.isEmpty() && text.charAt(0) == BYTE_ORDER_MARK) {
            text = text.substring(1);
        }

        List<List<String>> records = tokenize(text, delimiter);
        if (records.isEmpty()) {
            throw new TableParseException("No columns to parse from file.");
        }

        List<String> header = uniqueColumnNames(records.get(0));
        int width = header.size();
        String[][] rows = new String[records.size() - 1][];
        for (int r = 1; r < records.size(); r++) {
            List<String> record = records.get(r);
            if (record.size() > width) {
                throw new TableParseException("Expected " + width + " fields in record " + (r + 1) + ", saw " + record.size() + ".");
            }
            String[] cells = new String[record.size()];
            for (int c = 0; c < cells.length; c++) {
                String value = record.get(c);
                cells[c] = NumericParser.isMissingToken(value) ? null : value;
            }
            rows[r - 1] = cells;
        }
        return RawTable.of(header, rows);
    }

    private static List<List<String>> tokenize(String text, char delimiter) throws TableParseException {
        List<List<String>> records = new ArrayList<>();
        List<String> fields = new ArrayList<>();
        StringBuilder field = new StringBuilder();
        boolean inQuotes = false;
        boolean fieldWasQuoted = false;

        int i = 0;
        while (i < text.length()) {
            char c = text.charAt(i);
            if (inQuotes) {
                if (c == QUOTE) {
                    if (i + 1 < text.length() && text.charAt(i + 1) == QUOTE) {
                        field.append(QUOTE);
                        i++;
                    } else {
                        inQuotes = false;
                    }
                } else {
                    field.append(c);
                }
            } else if (c == QUOTE && field.length() == 0 && !fieldWasQuoted) {
                inQuotes = true;
                fieldWasQuoted = true;
            } else if (c == delimiter) {
                fields.add(field.toString());
                field.setLength(0);
                fieldWasQuoted = false;
            } else if (c == '\r' || c == '\n') {
                if (c == '\r' && i + 1 < text.length() && text.charAt(i + 1) == '\n') {
                    i++;
                }
                endRecord(records, fields, field, fieldWasQuoted);
                fields = new ArrayList<>();
                field.setLength(0);
                fieldWasQuoted = false;
            } else {
                field.append(c);
            }
            i++;
        }

        if (inQuotes) {
            throw new TableParseException("Unexpected end of data inside a quoted field.");
        }
        endRecord(records, fields, field, fieldWasQuoted);
        return records;
    }

    private static void endRecord(List<List<String>> records, List<String> fields, StringBuilder field, boolean fieldWasQuoted) {
        // A line holding nothing at all is a blank line, not a record with one empty field
        if (fields.isEmpty() && field.length() == 0 && !fieldWasQuoted) {
            return;
        }
        fields.add(field.toString());
        records.add(fields);
    }

    /** Blank header cells become "Unnamed: i"; repeated names get ".1", ".2" suffixes. */
    private static List<String> uniqueColumnNames(List<String> rawHeader) {
        List<String> names = new ArrayList<>(rawHeader.size());
        Map<String, Integer> seen = new HashMap<>();
        for (int c = 0; c < rawHeader.size(); c++) {
            String name = rawHeader.get(c);
            if (name == null || name.trim().isEmpty()) {
                name = "Unnamed: " + c;
            }
            int occurrences = seen.merge(name, 1, Integer::sum);
            names.add(occurrences == 1 ? name : name + "." + (occurrences - 1));
        }
        return names;
    }

    private static String describe(char delimiter) {
        return delimiter == '\t' ? "TAB" : "'" + delimiter + "'";
    }
}
