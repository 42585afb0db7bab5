package de.anton.spectral.unmixer.exception;

/**
 * Unsupported file extension, or a spreadsheet that cannot be opened for reasons other than being a disguised CSV.
 */
public class FormatException extends SpectralDataException {

    public FormatException(String message) {
        super(message);
    }

    public FormatException(String message, Throwable cause) {
        super(message, cause);
    }
}
