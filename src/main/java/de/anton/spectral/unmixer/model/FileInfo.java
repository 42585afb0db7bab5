package de.anton.spectral.unmixer.model;

import java.util.List;
import java.util.Map;

/**
 * Preview of a raw input file, produced without writing anything.
 * Either {@code error} is null and the other fields describe the file, or {@code error}
 * holds the reason the file could not be read.
 */
public record FileInfo(
    SpectrumFileFormat format,
    List<String> columns,
    String shapePreview,          // e.g. "10+ rows, 3 columns"
    List<Map<String, String>> firstRows,
    String error
) {
    public static FileInfo failed(String error) {
        return new FileInfo(null, List.of(), null, List.of(), error);
    }

    public boolean isReadable() {
        return error == null;
    }
}
