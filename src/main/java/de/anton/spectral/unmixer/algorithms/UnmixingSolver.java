package de.anton.spectral.unmixer.algorithms;

import de.anton.spectral.unmixer.exception.NoEndMembersRemainingException;
import de.anton.spectral.unmixer.exception.SingularMatrixException;
import de.anton.spectral.unmixer.model.UnmixingAlgorithm;
import de.anton.spectral.unmixer.model.UnmixingResult;
import org.apache.commons.math3.linear.ArrayRealVector;
import org.apache.commons.math3.linear.DiagonalMatrix;
import org.apache.commons.math3.linear.MatrixUtils;
import org.apache.commons.math3.linear.RealMatrix;
import org.apache.commons.math3.linear.RealVector;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Linear spectral unmixing by weighted least squares.
 * <p>
 * Both algorithms share the same loop: solve, round the abundances, drop every end-member whose
 * rounded abundance is not positive, and solve again with the reduced set until all abundances
 * are positive. Afterwards fit, residual, 1-sigma errors {@code sqrt(diag((E W E^T)^-1))} and the
 * RMS of the residual are computed for the surviving end-members.
 * <ul>
 *   <li>{@link #runWls}: {@code A = (E W E^T)^-1 E W M}</li>
 *   <li>{@link #runSto}: the same solution projected onto {@code sum(A) = 1}</li>
 * </ul>
 * Instances hold only configuration and can be shared.
 */
public class UnmixingSolver {

    private static final Logger logger = LoggerFactory.getLogger(UnmixingSolver.class);

    /** Added to u^2 so that a zero uncertainty does not produce an infinite weight. */
    public static final double UNCERTAINTY_EPSILON = 1e-12;
    /** Abundances are rounded to this many decimals before the sign test. Tunable, not physical. */
    public static final int DEFAULT_PRUNING_DECIMALS = 2;
    public static final double DEFAULT_MIN_RECIPROCAL_CONDITION = 1e-12;
    /** Name of the pure blackbody placeholder end-member excluded from normalized STO abundances. */
    public static final String DEFAULT_BLACKBODY_NAME = "BB";

    private final int pruningDecimals;
    private final double minReciprocalCondition;
    private final String blackbodyName;

    public UnmixingSolver() {
        this(DEFAULT_PRUNING_DECIMALS, DEFAULT_MIN_RECIPROCAL_CONDITION, DEFAULT_BLACKBODY_NAME);
    }

    /**
     * @param pruningDecimals        Decimals kept before testing abundances for {@code <= 0}.
     * @param minReciprocalCondition Smallest accepted reciprocal condition number of {@code E W E^T}.
     * @param blackbodyName          Placeholder end-member name, or null if there is none.
     */
    public UnmixingSolver(int pruningDecimals, double minReciprocalCondition, String blackbodyName) {
        if (pruningDecimals < 0) {
            throw new IllegalArgumentException("Pruning decimals cannot be negative. Got: " + pruningDecimals);
        }
        if (!(minReciprocalCondition > 0 && minReciprocalCondition < 1)) {
            throw new IllegalArgumentException("Reciprocal condition threshold must be in (0, 1). Got: " + minReciprocalCondition);
        }
        this.pruningDecimals = pruningDecimals;
        this.minReciprocalCondition = minReciprocalCondition;
        this.blackbodyName = blackbodyName;
    }

    /** Builds the weight matrix {@code diag(1 / (u^2 + epsilon))}. */
    public static RealMatrix weightMatrix(double[] uncertainty) {
        double[] weights = new double[uncertainty.length];
        for (int i = 0; i < uncertainty.length; i++) {
            weights[i] = 1.0 / (uncertainty[i] * uncertainty[i] + UNCERTAINTY_EPSILON);
        }
        return new DiagonalMatrix(weights, false);
    }

    /**
     * Weighted least squares with non-positive abundance pruning.
     *
     * @param endMembers     E, one row per end-member (K x N).
     * @param mixed          M, the mixed spectrum (N).
     * @param weights        W (N x N), normally from {@link #weightMatrix(double[])}.
     * @param endMemberNames Names of the K rows of E.
     * @return Result for the surviving end-members; every abundance is positive.
     * @throws SingularMatrixException         If {@code E W E^T} cannot be inverted reliably.
     * @throws NoEndMembersRemainingException If pruning removes every end-member.
     */
    public UnmixingResult runWls(RealMatrix endMembers, RealVector mixed, RealMatrix weights, List<String> endMemberNames)
            throws SingularMatrixException, NoEndMembersRemainingException {
        return run(UnmixingAlgorithm.WLS, endMembers, mixed, weights, endMemberNames);
    }

    /**
     * Sum-to-one constrained least squares with non-positive abundance pruning.
     * Parameters and failures as for {@link #runWls}; the returned abundances sum to 1 and
     * the result carries normalized abundances without the blackbody placeholder.
     */
    public UnmixingResult runSto(RealMatrix endMembers, RealVector mixed, RealMatrix weights, List<String> endMemberNames)
            throws SingularMatrixException, NoEndMembersRemainingException {
        return run(UnmixingAlgorithm.STO, endMembers, mixed, weights, endMemberNames);
    }

    /** Dispatches to the given algorithm. */
    public UnmixingResult run(UnmixingAlgorithm algorithm, RealMatrix endMembers, RealVector mixed, RealMatrix weights,
                              List<String> endMemberNames) throws SingularMatrixException, NoEndMembersRemainingException {
        Objects.requireNonNull(algorithm, "Algorithm cannot be null.");
        validateDimensions(endMembers, mixed, weights, endMemberNames);

        RealMatrix currentEndMembers = endMembers;
        List<String> currentNames = new ArrayList<>(endMemberNames);
        GramSystem system;
        RealVector abundances;
        int iteration = 0;

        // Solve -> prune -> solve again until every rounded abundance is positive
        while (true) {
            iteration++;
            system = GramSystem.solve(currentEndMembers, weights, mixed, currentNames, minReciprocalCondition);
            abundances = algorithm == UnmixingAlgorithm.STO ? sumToOne(system) : system.wlsAbundances();

            List<Integer> nonPositive = nonPositiveIndices(abundances);
            if (nonPositive.isEmpty()) {
                break;
            }
            List<String> pruned = new ArrayList<>();
            for (int index : nonPositive) {
                pruned.add(currentNames.get(index));
            }
            logger.debug("{} iteration {}: pruning end-members with non-positive abundance {}", algorithm, iteration, pruned);
            if (nonPositive.size() == currentNames.size()) {
                throw new NoEndMembersRemainingException(algorithm + ": every end-member was pruned for non-positive abundance (last removed: " + pruned + ").");
            }
            currentEndMembers = removeRows(currentEndMembers, nonPositive);
            // By index, back to front: names need not be unique
            for (int i = nonPositive.size() - 1; i >= 0; i--) {
                currentNames.remove((int) nonPositive.get(i));
            }
        }
        logger.debug("{} converged after {} iteration(s) with end-members {}", algorithm, iteration, currentNames);

        // --- Fit & errors ---
        RealVector fit = algorithm == UnmixingAlgorithm.STO
                ? currentEndMembers.preMultiply(abundances)
                : currentEndMembers.transpose().operate(abundances);
        RealVector residual = mixed.subtract(fit);
        double rms = Math.sqrt(residual.dotProduct(residual) / residual.getDimension());

        RealMatrix inverse = system.inverse();
        double[] errors = new double[currentNames.size()];
        for (int k = 0; k < errors.length; k++) {
            errors[k] = Math.sqrt(inverse.getEntry(k, k));
        }

        logger.info("{} RMS value: {}", algorithm, rms);
        double[] normalized = algorithm == UnmixingAlgorithm.STO ? normalizeWithoutBlackbody(abundances.toArray(), currentNames) : null;
        return new UnmixingResult(algorithm, currentNames, abundances.toArray(), errors,
                fit.toArray(), residual.toArray(), rms, normalized);
    }

    /**
     * Projects the unconstrained solution onto the sum-to-one plane:
     * {@code A = (I - P1 P2 1^T) A_wls + P1 P2} with {@code P1 = Q 1}, {@code P2 = 1 / (1^T Q 1)}.
     */
    private static RealVector sumToOne(GramSystem system) {
        RealMatrix q = system.inverse();
        int k = q.getRowDimension();
        RealVector ones = new ArrayRealVector(k, 1.0);
        RealVector p1 = q.operate(ones);
        double p2 = 1.0 / ones.dotProduct(p1);
        RealMatrix projection = MatrixUtils.createRealIdentityMatrix(k)
                .subtract(p1.outerProduct(ones).scalarMultiply(p2));
        return projection.operate(system.wlsAbundances()).add(p1.mapMultiply(p2));
    }

    private List<Integer> nonPositiveIndices(RealVector abundances) {
        double scale = Math.pow(10, pruningDecimals);
        List<Integer> indices = new ArrayList<>();
        for (int i = 0; i < abundances.getDimension(); i++) {
            // rint rounds half to even
            double rounded = Math.rint(abundances.getEntry(i) * scale) / scale;
            if (!(rounded > 0)) {
                indices.add(i);
            }
        }
        return indices;
    }

    private double[] normalizeWithoutBlackbody(double[] abundances, List<String> names) {
        int blackbody = blackbodyName == null ? -1 : names.indexOf(blackbodyName);
        double[] normalized = abundances.clone();
        if (blackbody < 0) {
            return normalized;
        }
        normalized[blackbody] = 0.0;
        double sum = 0.0;
        for (double value : normalized) {
            sum += value;
        }
        if (sum == 0.0) {
            logger.warn("Only the blackbody placeholder '{}' survived; normalized abundances are all zero.", blackbodyName);
            return normalized;
        }
        for (int i = 0; i < normalized.length; i++) {
            normalized[i] /= sum;
        }
        return normalized;
    }

    private static RealMatrix removeRows(RealMatrix matrix, List<Integer> rowsToRemove) {
        int[] keptRows = new int[matrix.getRowDimension() - rowsToRemove.size()];
        int next = 0;
        for (int r = 0; r < matrix.getRowDimension(); r++) {
            if (!rowsToRemove.contains(r)) {
                keptRows[next++] = r;
            }
        }
        int[] allColumns = new int[matrix.getColumnDimension()];
        for (int c = 0; c < allColumns.length; c++) {
            allColumns[c] = c;
        }
        return matrix.getSubMatrix(keptRows, allColumns);
    }

    private static void validateDimensions(RealMatrix endMembers, RealVector mixed, RealMatrix weights, List<String> names) {
        Objects.requireNonNull(endMembers, "End-member matrix cannot be null.");
        Objects.requireNonNull(mixed, "Mixed spectrum cannot be null.");
        Objects.requireNonNull(weights, "Weight matrix cannot be null.");
        Objects.requireNonNull(names, "End-member names cannot be null.");
        if (names.isEmpty() || endMembers.getRowDimension() != names.size()) {
            throw new IllegalArgumentException("Need one name per end-member row; got " + names.size()
                    + " names for " + endMembers.getRowDimension() + " rows.");
        }
        int channels = endMembers.getColumnDimension();
        if (mixed.getDimension() != channels) {
            throw new IllegalArgumentException("Mixed spectrum has " + mixed.getDimension() + " channels, end-members have " + channels + ".");
        }
        if (weights.getRowDimension() != channels || weights.getColumnDimension() != channels) {
            throw new IllegalArgumentException("Weight matrix must be " + channels + " x " + channels + ".");
        }
    }
}
