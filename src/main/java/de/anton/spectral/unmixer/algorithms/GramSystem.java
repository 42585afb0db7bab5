package de.anton.spectral.unmixer.algorithms;

import de.anton.spectral.unmixer.exception.SingularMatrixException;
import org.apache.commons.math3.linear.LUDecomposition;
import org.apache.commons.math3.linear.RealMatrix;
import org.apache.commons.math3.linear.RealVector;
import org.apache.commons.math3.linear.SingularValueDecomposition;

import java.util.List;

/**
 * The weighted normal equations of one solver iteration:
 * {@code Q = (E W E^T)^-1} and the unconstrained solution {@code A_wls = Q E W M}.
 * Conditioning is checked before inverting, so collinear end-members are reported
 * instead of producing meaningless abundances.
 */
final class GramSystem {

    private final RealMatrix inverse;
    private final RealVector wlsAbundances;

    private GramSystem(RealMatrix inverse, RealVector wlsAbundances) {
        this.inverse = inverse;
        this.wlsAbundances = wlsAbundances;
    }

    /**
     * @param endMembers              E, K x N
     * @param weights                 W, N x N
     * @param mixed                   M, length N
     * @param names                   Current end-member names, for the error message.
     * @param minReciprocalCondition  Smallest acceptable sigma_min / sigma_max of E W E^T.
     */
    static GramSystem solve(RealMatrix endMembers, RealMatrix weights, RealVector mixed,
                            List<String> names, double minReciprocalCondition) throws SingularMatrixException {
        // W E^T first: DiagonalMatrix multiplies this in O(N K)
        RealMatrix weightedTranspose = weights.multiply(endMembers.transpose());
        RealMatrix gram = endMembers.multiply(weightedTranspose);

        double reciprocalCondition = new SingularValueDecomposition(gram).getInverseConditionNumber();
        // Written so that NaN (all-zero Gram matrix) also fails
        if (!(reciprocalCondition >= minReciprocalCondition)) {
            throw new SingularMatrixException(String.format(
                    "Weighted Gram matrix of end-members %s is singular or ill-conditioned (reciprocal condition number %.3g < %.3g). "
                            + "Remove duplicate or collinear end-members and retry.",
                    names, reciprocalCondition, minReciprocalCondition));
        }

        RealMatrix inverse;
        try {
            inverse = new LUDecomposition(gram).getSolver().getInverse();
        } catch (org.apache.commons.math3.linear.SingularMatrixException e) {
            throw new SingularMatrixException("Weighted Gram matrix of end-members " + names + " could not be inverted.", e);
        }
        RealVector weightedMixed = endMembers.operate(weights.operate(mixed));
        return new GramSystem(inverse, inverse.operate(weightedMixed));
    }

    /** @return Q = (E W E^T)^-1 */
    RealMatrix inverse() {
        return inverse;
    }

    /** @return Q E W M */
    RealVector wlsAbundances() {
        return wlsAbundances;
    }
}
