package de.anton.spectral.unmixer.model;

import org.apache.poi.ss.usermodel.*;
import org.apache.poi.ss.util.NumberToTextConverter;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Reads the first sheet of an Excel workbook (.xlsx or .xls) into a {@link RawTable}.
 * The first physical row is the header; every following row is data.
 * Numeric cells are rendered without loss of precision, formulas are evaluated.
 */
public class SpreadsheetReader {

    private static final Logger logger = LoggerFactory.getLogger(SpreadsheetReader.class);

    /**
     * Reads the whole first sheet.
     *
     * @param path The workbook file.
     * @return The sheet as a table.
     * @throws IOException If the file cannot be opened as a workbook or has no sheet.
     */
    public RawTable read(Path path) throws IOException {
        return read(path, Integer.MAX_VALUE);
    }

    /**
     * Reads at most {@code maxDataRows} data rows of the first sheet.
     */
    public RawTable read(Path path, int maxDataRows) throws IOException {
        Objects.requireNonNull(path, "Input path cannot be null.");
        logger.debug("Reading workbook: {}", path.toAbsolutePath());

        // Read-only open; the workbook is never written back
        try (Workbook workbook = WorkbookFactory.create(path.toFile(), null, true)) {
            if (workbook.getNumberOfSheets() == 0) {
                throw new IOException("Workbook '" + path.getFileName() + "' contains no sheets.");
            }
            Sheet sheet = workbook.getSheetAt(0);
            RawTable table = readSheet(sheet, maxDataRows);
            logger.debug("Read sheet '{}' of '{}': {}", sheet.getSheetName(), path.getFileName(), table);
            return table;
        }
    }

    private RawTable readSheet(Sheet sheet, int maxDataRows) {
        DataFormatter formatter = new DataFormatter();
        FormulaEvaluator evaluator = sheet.getWorkbook().getCreationHelper().createFormulaEvaluator();

        // --- Header Row ---
        Row headerRow = sheet.getRow(sheet.getFirstRowNum());
        if (headerRow == null || headerRow.getLastCellNum() <= 0) {
            logger.warn("Sheet '{}' has no header row.", sheet.getSheetName());
            return RawTable.of(List.of(), new String[0][]);
        }
        int width = headerRow.getLastCellNum();
        List<String> headers = new ArrayList<>(width);
        for (int c = 0; c < width; c++) {
            String header = getCellValueAsString(headerRow.getCell(c, Row.MissingCellPolicy.RETURN_BLANK_AS_NULL), formatter, evaluator);
            headers.add(header == null ? "Unnamed: " + c : header.trim());
        }

        // --- Data Rows ---
        List<String[]> rows = new ArrayList<>();
        for (int r = headerRow.getRowNum() + 1; r <= sheet.getLastRowNum() && rows.size() < maxDataRows; r++) {
            Row row = sheet.getRow(r);
            if (row == null) {
                logger.trace("Skipping empty row {} in '{}'", r + 1, sheet.getSheetName());
                continue;
            }
            String[] cells = new String[width];
            for (int c = 0; c < width; c++) {
                String value = getCellValueAsString(row.getCell(c, Row.MissingCellPolicy.RETURN_BLANK_AS_NULL), formatter, evaluator);
                cells[c] = NumericParser.isMissingToken(value) ? null : value;
            }
            rows.add(cells);
        }
        return RawTable.of(headers, rows.toArray(new String[0][]));
    }

    /** Gets cell value as String, evaluating formulas. Returns null for missing/blank/error cells. */
    private String getCellValueAsString(Cell cell, DataFormatter formatter, FormulaEvaluator evaluator) {
        if (cell == null) {
            return null;
        }
        CellType cellType = cell.getCellType();
        if (cellType == CellType.FORMULA) {
            CellValue evaluated = evaluator.evaluate(cell);
            if (evaluated == null) {
                return null;
            }
            switch (evaluated.getCellType()) {
                case NUMERIC:
                    return NumberToTextConverter.toText(evaluated.getNumberValue());
                case STRING:
                    return evaluated.getStringValue();
                case BOOLEAN:
                    return Boolean.toString(evaluated.getBooleanValue());
                case ERROR:
                    logger.warn("Formula in cell {} evaluated to an error: {}", cell.getAddress(),
                            FormulaError.forInt(evaluated.getErrorValue()).getString());
                    return null;
                default:
                    return null;
            }
        }

        switch (cellType) {
            case NUMERIC:
                // Date cells keep their formatted text; plain numbers must not be rounded by the display format
                if (DateUtil.isCellDateFormatted(cell)) {
                    return formatter.formatCellValue(cell);
                }
                return NumberToTextConverter.toText(cell.getNumericCellValue());
            case STRING:
                return cell.getStringCellValue();
            case BOOLEAN:
                return Boolean.toString(cell.getBooleanCellValue());
            case ERROR:
                logger.warn("Cell {} contains an error code: {}", cell.getAddress(), FormulaError.forInt(cell.getErrorCellValue()).getString());
                return null;
            case BLANK:
            default:
                return null;
        }
    }
}
