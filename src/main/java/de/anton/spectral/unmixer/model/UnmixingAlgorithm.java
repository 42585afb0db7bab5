package de.anton.spectral.unmixer.model;

/**
 * The two supported unmixing algorithms.
 */
public enum UnmixingAlgorithm {
    WLS("Weighted Least Squares"),   // Unconstrained, non-positive abundances pruned afterwards
    STO("Sum to One");               // Abundances constrained to total exactly 1

    private final String displayName;

    UnmixingAlgorithm(String displayName) {
        this.displayName = displayName;
    }

    public String getDisplayName() {
        return displayName;
    }

    /**
     * Finds an algorithm by its short name ("WLS", "STO") or display name, case-insensitive.
     *
     * @return The matching algorithm, or null if no match is found.
     */
    public static UnmixingAlgorithm fromName(String name) {
        if (name == null) {
            return null;
        }
        for (UnmixingAlgorithm algorithm : values()) {
            if (algorithm.name().equalsIgnoreCase(name.trim()) || algorithm.displayName.equalsIgnoreCase(name.trim())) {
                return algorithm;
            }
        }
        return null;
    }
}
