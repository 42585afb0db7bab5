package de.anton.spectral.unmixer.exception;

/**
 * No valid rows survived cleaning or loading of a spectrum.
 */
public class CleaningExhaustionException extends SpectralDataException {

    public CleaningExhaustionException(String message) {
        super(message);
    }

    public CleaningExhaustionException(String message, Throwable cause) {
        super(message, cause);
    }
}
