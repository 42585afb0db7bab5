package de.anton.spectral.unmixer.exception;

/**
 * Base class for all recoverable failures of the ingestion and unmixing pipeline.
 * A caller receiving one of these should report the affected file or selection
 * and retry with corrected input.
 */
public class SpectralDataException extends Exception {

    public SpectralDataException(String message) {
        super(message);
    }

    public SpectralDataException(String message, Throwable cause) {
        super(message, cause);
    }
}
