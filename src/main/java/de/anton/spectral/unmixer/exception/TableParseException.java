package de.anton.spectral.unmixer.exception;

/**
 * No delimiter/encoding combination produced a usable table with at least two columns.
 */
public class TableParseException extends SpectralDataException {

    public TableParseException(String message) {
        super(message);
    }

    public TableParseException(String message, Throwable cause) {
        super(message, cause);
    }
}
