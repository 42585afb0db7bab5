package de.anton.spectral.unmixer.model;

import java.util.List;
import java.util.Objects;

/**
 * Per-analysis working set: the mixed spectrum and every selected end-member, all on the
 * same wavenumber grid with no non-finite value left in any channel.
 * The end-member matrix has one row per end-member (K x N).
 * This class is immutable.
 */
public final class AlignedDataset {

    private final double[] wavenumber;
    private final double[] mixed;
    private final double[] uncertainty;
    private final double[][] endMembers;
    private final List<String> endMemberNames;

    public AlignedDataset(double[] wavenumber, double[] mixed, double[] uncertainty,
                          double[][] endMembers, List<String> endMemberNames) {
        Objects.requireNonNull(wavenumber, "Wavenumber grid cannot be null.");
        Objects.requireNonNull(mixed, "Mixed spectrum cannot be null.");
        Objects.requireNonNull(uncertainty, "Uncertainty cannot be null.");
        Objects.requireNonNull(endMembers, "End-member matrix cannot be null.");
        Objects.requireNonNull(endMemberNames, "End-member names cannot be null.");

        int channels = wavenumber.length;
        if (channels == 0) {
            throw new IllegalArgumentException("An aligned dataset needs at least one channel.");
        }
        if (mixed.length != channels || uncertainty.length != channels) {
            throw new IllegalArgumentException("Mixed spectrum and uncertainty must have " + channels + " channels.");
        }
        if (endMembers.length != endMemberNames.size()) {
            throw new IllegalArgumentException("Got " + endMembers.length + " end-member rows but " + endMemberNames.size() + " names.");
        }

        this.endMembers = new double[endMembers.length][];
        for (int k = 0; k < endMembers.length; k++) {
            if (endMembers[k] == null || endMembers[k].length != channels) {
                throw new IllegalArgumentException("End-member '" + endMemberNames.get(k) + "' does not have " + channels + " channels.");
            }
            this.endMembers[k] = endMembers[k].clone();
        }
        this.wavenumber = wavenumber.clone();
        this.mixed = mixed.clone();
        this.uncertainty = uncertainty.clone();
        this.endMemberNames = List.copyOf(endMemberNames);
    }

    public double[] getWavenumber() { return wavenumber.clone(); }
    public double[] getMixed() { return mixed.clone(); }
    public double[] getUncertainty() { return uncertainty.clone(); }
    public List<String> getEndMemberNames() { return endMemberNames; }
    public int getChannelCount() { return wavenumber.length; }
    public int getEndMemberCount() { return endMembers.length; }

    /** @return a deep copy of the K x N end-member matrix. */
    public double[][] getEndMembers() {
        double[][] copy = new double[endMembers.length][];
        for (int k = 0; k < endMembers.length; k++) {
            copy[k] = endMembers[k].clone();
        }
        return copy;
    }

    @Override
    public String toString() {
        return String.format("AlignedDataset[channels=%d, range=%.2f-%.2f cm^-1, endMembers=%s]",
                wavenumber.length, wavenumber[0], wavenumber[wavenumber.length - 1], endMemberNames);
    }
}
