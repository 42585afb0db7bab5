package de.anton.spectral.unmixer.model;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Rectangular table as decoded from an external file, before any interpretation.
 * Cells are kept as strings; a {@code null} cell means "missing".
 * Short rows are padded with missing cells. Instances are immutable.
 */
public final class RawTable {

    private final List<String> columnNames;
    private final String[][] rows;

    private RawTable(List<String> columnNames, String[][] rows) {
        this.columnNames = columnNames;
        this.rows = rows;
    }

    /**
     * Creates a table from a header and row data.
     *
     * @param columnNames Column names (must not be null, may be empty).
     * @param rows        Row data; rows shorter than the header are padded with missing cells.
     * @throws IllegalArgumentException if a row has more cells than there are columns.
     */
    public static RawTable of(List<String> columnNames, String[][] rows) {
        Objects.requireNonNull(columnNames, "Column names cannot be null.");
        Objects.requireNonNull(rows, "Rows cannot be null.");
        int width = columnNames.size();
        String[][] copy = new String[rows.length][];
        for (int r = 0; r < rows.length; r++) {
            String[] source = rows[r] == null ? new String[0] : rows[r];
            if (source.length > width) {
                throw new IllegalArgumentException("Row " + r + " has " + source.length + " cells but the table has only " + width + " columns.");
            }
            copy[r] = new String[width];
            System.arraycopy(source, 0, copy[r], 0, source.length);
        }
        return new RawTable(List.copyOf(columnNames), copy);
    }

    public List<String> getColumnNames() { return columnNames; }
    public int getColumnCount() { return columnNames.size(); }
    public int getRowCount() { return rows.length; }
    public boolean isEmpty() { return rows.length == 0; }

    /** @return the cell value, or null if the cell is missing. */
    public String getCell(int row, int column) {
        return rows[row][column];
    }

    /** @return an unmodifiable view of one column, top to bottom (may contain nulls). */
    public List<String> getColumn(int column) {
        Objects.checkIndex(column, columnNames.size());
        List<String> values = new ArrayList<>(rows.length);
        for (String[] row : rows) {
            values.add(row[column]);
        }
        return Collections.unmodifiableList(values);
    }

    /** @return a new table holding at most the first {@code n} rows. */
    public RawTable head(int n) {
        int count = Math.max(0, Math.min(n, rows.length));
        String[][] firstRows = new String[count][];
        for (int r = 0; r < count; r++) {
            firstRows[r] = rows[r].clone();
        }
        return new RawTable(columnNames, firstRows);
    }

    /** @return the row as an ordered column-name to value map (values may be null). */
    public Map<String, String> getRowAsMap(int row) {
        Map<String, String> values = new LinkedHashMap<>();
        for (int c = 0; c < columnNames.size(); c++) {
            values.put(columnNames.get(c), rows[row][c]);
        }
        return values;
    }

    @Override
    public String toString() {
        return "RawTable{" +
               "columns=" + columnNames +
               ", rows=" + rows.length +
               '}';
    }
}
