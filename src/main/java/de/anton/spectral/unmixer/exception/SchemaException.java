package de.anton.spectral.unmixer.exception;

/**
 * The table has fewer than two usable columns, or a canonical file lacks a required column.
 */
public class SchemaException extends SpectralDataException {

    public SchemaException(String message) {
        super(message);
    }

    public SchemaException(String message, Throwable cause) {
        super(message, cause);
    }
}
