package de.anton.spectral.unmixer.model;

import java.util.Arrays;
import java.util.List;
import java.util.Objects;

/**
 * A cleaned spectrum: wavenumber (cm^-1), emissivity and 1-sigma uncertainty per channel.
 * This class is immutable; arrays are copied on the way in and on the way out.
 * <p>
 * Invariants checked by the constructor:
 * all three arrays have the same length (at least 1), every value is finite,
 * wavenumbers are positive and strictly increasing, uncertainties are non-negative.
 */
public final class Spectrum {

    public static final String COLUMN_WAVENUMBER = "Wavenumber";
    public static final String COLUMN_EMISSIVITY = "Emissivity";
    public static final String COLUMN_UNCERTAINTY = "Uncertainty";

    private final double[] wavenumber;
    private final double[] emissivity;
    private final double[] uncertainty;

    /**
     * Constructor for Spectrum.
     *
     * @param wavenumber  Channel positions in cm^-1, strictly increasing and positive.
     * @param emissivity  Emissivity per channel.
     * @param uncertainty Non-negative uncertainty per channel.
     * @throws IllegalArgumentException if any invariant is violated.
     */
    public Spectrum(double[] wavenumber, double[] emissivity, double[] uncertainty) {
        Objects.requireNonNull(wavenumber, "Wavenumber array cannot be null.");
        Objects.requireNonNull(emissivity, "Emissivity array cannot be null.");
        Objects.requireNonNull(uncertainty, "Uncertainty array cannot be null.");
        if (wavenumber.length == 0) {
            throw new IllegalArgumentException("A spectrum needs at least one channel.");
        }
        if (emissivity.length != wavenumber.length || uncertainty.length != wavenumber.length) {
            throw new IllegalArgumentException("Column lengths differ: wavenumber=" + wavenumber.length
                    + ", emissivity=" + emissivity.length + ", uncertainty=" + uncertainty.length);
        }

        for (int i = 0; i < wavenumber.length; i++) {
            if (!Double.isFinite(wavenumber[i]) || !Double.isFinite(emissivity[i]) || !Double.isFinite(uncertainty[i])) {
                throw new IllegalArgumentException("Non-finite value at channel " + i);
            }
            if (wavenumber[i] <= 0) {
                throw new IllegalArgumentException("Wavenumber must be positive at channel " + i + ". Got: " + wavenumber[i]);
            }
            if (uncertainty[i] < 0) {
                throw new IllegalArgumentException("Uncertainty cannot be negative at channel " + i + ". Got: " + uncertainty[i]);
            }
            if (i > 0 && wavenumber[i] <= wavenumber[i - 1]) {
                throw new IllegalArgumentException("Wavenumbers must be strictly increasing (channel " + i + ": "
                        + wavenumber[i - 1] + " -> " + wavenumber[i] + ")");
            }
        }

        this.wavenumber = wavenumber.clone();
        this.emissivity = emissivity.clone();
        this.uncertainty = uncertainty.clone();
    }

    // --- Getters (defensive copies) ---
    public double[] getWavenumber() { return wavenumber.clone(); }
    public double[] getEmissivity() { return emissivity.clone(); }
    public double[] getUncertainty() { return uncertainty.clone(); }

    public int size() { return wavenumber.length; }
    public double getMinWavenumber() { return wavenumber[0]; }
    public double getMaxWavenumber() { return wavenumber[wavenumber.length - 1]; }

    /**
     * Converts the spectrum back into a table with the canonical column names,
     * e.g. to run it through the normalizer again.
     */
    public RawTable toRawTable() {
        String[][] cells = new String[wavenumber.length][];
        for (int i = 0; i < wavenumber.length; i++) {
            cells[i] = new String[] {
                    Double.toString(wavenumber[i]),
                    Double.toString(emissivity[i]),
                    Double.toString(uncertainty[i]) };
        }
        return RawTable.of(List.of(COLUMN_WAVENUMBER, COLUMN_EMISSIVITY, COLUMN_UNCERTAINTY), cells);
    }

    @Override
    public String toString() {
        return String.format("Spectrum[channels=%d, range=%.2f-%.2f cm^-1]",
                wavenumber.length, getMinWavenumber(), getMaxWavenumber());
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        Spectrum that = (Spectrum) o;
        return Arrays.equals(wavenumber, that.wavenumber)
                && Arrays.equals(emissivity, that.emissivity)
                && Arrays.equals(uncertainty, that.uncertainty);
    }

    @Override
    public int hashCode() {
        int result = Arrays.hashCode(wavenumber);
        result = 31 * result + Arrays.hashCode(emissivity);
        result = 31 * result + Arrays.hashCode(uncertainty);
        return result;
    }
}
