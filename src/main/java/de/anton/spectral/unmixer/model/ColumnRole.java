package de.anton.spectral.unmixer.model;

import java.util.List;

/**
 * Roles a raw table column can play in a spectrum, together with the header keywords
 * that identify them. Declaration order is the matching priority.
 * New heuristics are added here, not in the normalizer.
 */
public enum ColumnRole {
    WAVENUMBER(List.of("wavenumber", "wave number", "wavenum", "frequency", "freq", "cm-1", "cm^-1")),
    EMISSIVITY(List.of("emissivity", "emiss", "emit", "reflectance", "refl", "intensity", "signal")),
    UNCERTAINTY(List.of("uncertainty", "error", "uncert", "std", "sigma", "deviation"));

    private final List<String> keywords;

    ColumnRole(List<String> keywords) {
        this.keywords = keywords;
    }

    /**
     * @param normalizedHeader Lower-cased, trimmed column name.
     * @return true if any keyword occurs in the header.
     */
    public boolean matches(String normalizedHeader) {
        for (String keyword : keywords) {
            if (normalizedHeader.contains(keyword)) {
                return true;
            }
        }
        return false;
    }
}
