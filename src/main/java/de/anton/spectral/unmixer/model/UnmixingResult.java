package de.anton.spectral.unmixer.model;

import java.util.List;
import java.util.Objects;

/**
 * Outcome of one solver run. Abundances, errors and (for STO) normalized abundances are
 * aligned with {@link #getEndMemberNames()}, which lists only the end-members that survived pruning.
 * Fit and residual are aligned with the channels of the solved dataset.
 * This class is immutable.
 */
public final class UnmixingResult {

    private final UnmixingAlgorithm algorithm;
    private final List<String> endMemberNames;
    private final double[] abundances;
    private final double[] errors;
    private final double[] fit;
    private final double[] residual;
    private final double rms;
    private final double[] normalizedAbundances; // STO only, null for WLS

    public UnmixingResult(UnmixingAlgorithm algorithm, List<String> endMemberNames, double[] abundances, double[] errors,
                          double[] fit, double[] residual, double rms, double[] normalizedAbundances) {
        this.algorithm = Objects.requireNonNull(algorithm, "Algorithm cannot be null.");
        this.endMemberNames = List.copyOf(endMemberNames);
        this.abundances = Objects.requireNonNull(abundances, "Abundances cannot be null.").clone();
        this.errors = Objects.requireNonNull(errors, "Errors cannot be null.").clone();
        this.fit = Objects.requireNonNull(fit, "Fit cannot be null.").clone();
        this.residual = Objects.requireNonNull(residual, "Residual cannot be null.").clone();
        this.rms = rms;
        this.normalizedAbundances = normalizedAbundances == null ? null : normalizedAbundances.clone();

        int k = this.endMemberNames.size();
        if (this.abundances.length != k || this.errors.length != k
                || (this.normalizedAbundances != null && this.normalizedAbundances.length != k)) {
            throw new IllegalArgumentException("Per end-member arrays must all have length " + k + ".");
        }
        if (this.fit.length != this.residual.length) {
            throw new IllegalArgumentException("Fit and residual must have the same length.");
        }
    }

    // --- Getters ---
    public UnmixingAlgorithm getAlgorithm() { return algorithm; }
    public List<String> getEndMemberNames() { return endMemberNames; }
    public double[] getAbundances() { return abundances.clone(); }
    public double[] getErrors() { return errors.clone(); }
    public double[] getFit() { return fit.clone(); }
    public double[] getResidual() { return residual.clone(); }
    public double getRms() { return rms; }

    /** @return true for STO results, which carry normalized abundances. */
    public boolean hasNormalizedAbundances() { return normalizedAbundances != null; }

    /** @return the normalized abundances, or null if not available (WLS). */
    public double[] getNormalizedAbundances() {
        return normalizedAbundances == null ? null : normalizedAbundances.clone();
    }

    /** @return the abundance of the named end-member, or NaN if it was pruned or never selected. */
    public double getAbundance(String endMemberName) {
        int index = endMemberNames.indexOf(endMemberName);
        return index < 0 ? Double.NaN : abundances[index];
    }

    @Override
    public String toString() {
        StringBuilder sb = new StringBuilder("UnmixingResult[").append(algorithm).append(", rms=").append(String.format("%.6g", rms));
        for (int i = 0; i < endMemberNames.size(); i++) {
            sb.append(String.format(", %s=%.4f±%.4f", endMemberNames.get(i), abundances[i], errors[i]));
        }
        return sb.append(']').toString();
    }
}
