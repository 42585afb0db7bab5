package de.anton.spectral.unmixer.exception;

/**
 * No spectral channel is valid in the mixed spectrum and in every selected end-member at the same time.
 */
public class DatasetAlignmentException extends SpectralDataException {

    public DatasetAlignmentException(String message) {
        super(message);
    }

    public DatasetAlignmentException(String message, Throwable cause) {
        super(message, cause);
    }
}
