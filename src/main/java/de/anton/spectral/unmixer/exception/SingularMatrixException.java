package de.anton.spectral.unmixer.exception;

/**
 * The weighted Gram matrix {@code E W E^T} is singular or too ill-conditioned to invert.
 * Usually caused by duplicate or collinear end-members; remove one and retry.
 */
public class SingularMatrixException extends SpectralDataException {

    public SingularMatrixException(String message) {
        super(message);
    }

    public SingularMatrixException(String message, Throwable cause) {
        super(message, cause);
    }
}
