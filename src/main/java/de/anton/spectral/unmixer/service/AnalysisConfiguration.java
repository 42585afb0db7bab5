package de.anton.spectral.unmixer.service;

import de.anton.spectral.unmixer.algorithms.UnmixingSolver;
import de.anton.spectral.unmixer.model.UnmixingAlgorithm;

import java.util.List;
import java.util.Objects;

/**
 * Immutable configuration object holding all parameters for an unmixing run.
 */
public record AnalysisConfiguration(
    UnmixingAlgorithm algorithm,
    String mixedName,             // name in the mixed spectra library
    List<String> endMemberNames,  // names in the end-member library, at least one
    Double maxWavelength,         // µm; null = use the full grid
    String blackbodyName,         // excluded from normalized STO abundances; null = none
    int pruningDecimals
) {
    public static final double MAX_WAVELENGTH_LIMIT_UM = 100.0;

    public AnalysisConfiguration {
        Objects.requireNonNull(algorithm, "Algorithm cannot be null.");
        Objects.requireNonNull(mixedName, "Mixed spectrum name cannot be null.");
        Objects.requireNonNull(endMemberNames, "End-member names cannot be null.");
        endMemberNames = List.copyOf(endMemberNames);
        if (endMemberNames.isEmpty()) {
            throw new IllegalArgumentException("Select at least one end-member.");
        }
        if (endMemberNames.stream().distinct().count() != endMemberNames.size()) {
            throw new IllegalArgumentException("End-member names must be unique: " + endMemberNames);
        }
        validateMaxWavelength(maxWavelength);
        if (pruningDecimals < 0) {
            throw new IllegalArgumentException("Pruning decimals cannot be negative. Got: " + pruningDecimals);
        }
    }

    /** Configuration with the default blackbody name and pruning precision. */
    public static AnalysisConfiguration of(UnmixingAlgorithm algorithm, String mixedName, List<String> endMemberNames,
                                           Double maxWavelength) {
        return new AnalysisConfiguration(algorithm, mixedName, endMemberNames, maxWavelength,
                UnmixingSolver.DEFAULT_BLACKBODY_NAME, UnmixingSolver.DEFAULT_PRUNING_DECIMALS);
    }

    /**
     * @throws IllegalArgumentException If the cutoff is given and not in (0, 100] µm.
     */
    static void validateMaxWavelength(Double maxWavelength) {
        if (maxWavelength != null && !(maxWavelength > 0 && maxWavelength <= MAX_WAVELENGTH_LIMIT_UM)) {
            throw new IllegalArgumentException("Maximum wavelength must be in (0, " + MAX_WAVELENGTH_LIMIT_UM + "] µm. Got: " + maxWavelength);
        }
    }
}
