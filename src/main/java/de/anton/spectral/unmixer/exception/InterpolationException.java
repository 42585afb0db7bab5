package de.anton.spectral.unmixer.exception;

/**
 * A spectrum cannot be resampled, typically because it has fewer than two points.
 */
public class InterpolationException extends SpectralDataException {

    public InterpolationException(String message) {
        super(message);
    }

    public InterpolationException(String message, Throwable cause) {
        super(message, cause);
    }
}
