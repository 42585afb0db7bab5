package de.anton.spectral.unmixer.exception;

/**
 * Iterative pruning of non-positive abundances removed every end-member.
 */
public class NoEndMembersRemainingException extends SpectralDataException {

    public NoEndMembersRemainingException(String message) {
        super(message);
    }

    public NoEndMembersRemainingException(String message, Throwable cause) {
        super(message, cause);
    }
}
