package de.anton.spectral.unmixer.model;

/**
 * Enumeration of the raw input formats recognised by {@link FormatDetector}.
 * Includes a display name for log and preview output.
 */
public enum SpectrumFileFormat {
    EXCEL("excel"),                                    // Genuine .xlsx / .xls workbook
    CSV("csv"),                                        // Delimited text, dialect unknown
    TXT("txt"),                                        // Tab- or comma-separated text
    CSV_DISGUISED_AS_EXCEL("csv_disguised_as_excel"),  // Plain text saved with a spreadsheet extension
    UNKNOWN("unknown");                                // Unsupported extension

    private final String displayName;

    SpectrumFileFormat(String displayName) {
        this.displayName = displayName;
    }

    @Override
    public String toString() {
        return displayName;
    }
}
