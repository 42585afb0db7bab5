package de.anton.spectral.unmixer.service;

import de.anton.spectral.unmixer.algorithms.CubicSplineResampler;
import de.anton.spectral.unmixer.algorithms.UnmixingSolver;
import de.anton.spectral.unmixer.exception.DatasetAlignmentException;
import de.anton.spectral.unmixer.exception.InterpolationException;
import de.anton.spectral.unmixer.exception.NoEndMembersRemainingException;
import de.anton.spectral.unmixer.exception.SingularMatrixException;
import de.anton.spectral.unmixer.exception.SpectralDataException;
import de.anton.spectral.unmixer.model.AlignedDataset;
import de.anton.spectral.unmixer.model.Spectrum;
import de.anton.spectral.unmixer.model.UnmixingAlgorithm;
import de.anton.spectral.unmixer.model.UnmixingResult;
import org.apache.commons.math3.linear.ArrayRealVector;
import org.apache.commons.math3.linear.MatrixUtils;
import org.apache.commons.math3.linear.RealMatrix;
import org.apache.commons.math3.linear.RealVector;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Service responsible for the unmixing pipeline: load the selected spectra, align them on the
 * mixed spectrum's wavenumber grid and run the configured solver.
 * Holds no per-run state; one instance can serve any number of analyses.
 */
public class UnmixingService {

    private static final Logger logger = LoggerFactory.getLogger(UnmixingService.class);
    /** wavelength [µm] = 10000 / wavenumber [cm^-1] */
    private static final double MICROMETRE_WAVENUMBER_PRODUCT = 10000.0;

    private final SpectrumLibrary endMemberLibrary;
    private final SpectrumLibrary mixedLibrary;

    /**
     * Represents the result of a full analysis run: the aligned input and the solver output.
     */
    public static class AnalysisResult {
        public final AnalysisConfiguration configuration;
        public final AlignedDataset dataset;
        public final UnmixingResult result;

        private AnalysisResult(AnalysisConfiguration configuration, AlignedDataset dataset, UnmixingResult result) {
            this.configuration = configuration;
            this.dataset = dataset;
            this.result = result;
        }
    }

    public UnmixingService(SpectrumLibrary endMemberLibrary, SpectrumLibrary mixedLibrary) {
        this.endMemberLibrary = Objects.requireNonNull(endMemberLibrary, "End-member library cannot be null.");
        this.mixedLibrary = Objects.requireNonNull(mixedLibrary, "Mixed spectra library cannot be null.");
    }

    /** Opens both libraries of the workspace, creating their directories if needed. */
    public static UnmixingService forWorkspace(WorkspaceLayout layout) throws IOException {
        return new UnmixingService(new SpectrumLibrary(layout.libraryDirectory()), new SpectrumLibrary(layout.mixedDirectory()));
    }

    /**
     * Executes the complete analysis pipeline based on the provided configuration.
     *
     * @param config The configuration naming the spectra and the algorithm.
     * @return The aligned dataset together with the unmixing result.
     * @throws IOException           If a spectrum file is missing or unreadable.
     * @throws SpectralDataException For invalid spectra, alignment or solver failures.
     */
    public AnalysisResult runAnalysis(AnalysisConfiguration config) throws IOException, SpectralDataException {
        Objects.requireNonNull(config, "Configuration cannot be null.");
        logger.info("Service: Starting {} analysis of '{}' with end-members {} (cutoff: {}).",
                config.algorithm(), config.mixedName(), config.endMemberNames(),
                config.maxWavelength() == null ? "none" : config.maxWavelength() + " µm");
        try {
            Spectrum mixed = mixedLibrary.load(config.mixedName());
            Map<String, Spectrum> endMembers = endMemberLibrary.loadAll(config.endMemberNames());
            AlignedDataset dataset = alignDataset(mixed, endMembers, config.maxWavelength());

            UnmixingSolver solver = new UnmixingSolver(config.pruningDecimals(),
                    UnmixingSolver.DEFAULT_MIN_RECIPROCAL_CONDITION, config.blackbodyName());
            UnmixingResult result = solve(dataset, config.algorithm(), solver);
            logger.info("Service: Analysis completed: {}", result);
            return new AnalysisResult(config, dataset, result);
        } catch (IOException | SpectralDataException e) {
            logger.error("Service: Error during analysis execution", e);
            throw e;
        }
    }

    /**
     * Puts the mixed spectrum and all end-members on one grid.
     * The grid is the mixed spectrum's, optionally cut at a maximum wavelength; every end-member
     * is resampled onto it and channels where any value is not finite are dropped.
     *
     * @param mixed         The mixed spectrum, whose grid is used.
     * @param endMembers    End-members by name; iteration order becomes row order.
     * @param maxWavelength Keep only channels with {@code 10000 / wavenumber <= maxWavelength}; null keeps all.
     * @throws InterpolationException     If an end-member has fewer than 2 points.
     * @throws DatasetAlignmentException If no channel survives.
     */
    public AlignedDataset alignDataset(Spectrum mixed, Map<String, Spectrum> endMembers, Double maxWavelength)
            throws InterpolationException, DatasetAlignmentException {
        Objects.requireNonNull(mixed, "Mixed spectrum cannot be null.");
        Objects.requireNonNull(endMembers, "End-members cannot be null.");
        if (endMembers.isEmpty()) {
            throw new IllegalArgumentException("At least one end-member is required.");
        }
        AnalysisConfiguration.validateMaxWavelength(maxWavelength);

        double[] wavenumber = mixed.getWavenumber();
        double[] emissivity = mixed.getEmissivity();
        double[] uncertainty = mixed.getUncertainty();

        // --- 1. Wavelength cutoff on the mixed grid ---
        if (maxWavelength != null) {
            List<Integer> kept = new ArrayList<>();
            for (int i = 0; i < wavenumber.length; i++) {
                if (MICROMETRE_WAVENUMBER_PRODUCT / wavenumber[i] <= maxWavelength) {
                    kept.add(i);
                }
            }
            logger.info("Service: Wavelength cutoff {} µm keeps {} of {} channels.", maxWavelength, kept.size(), wavenumber.length);
            if (kept.isEmpty()) {
                throw new DatasetAlignmentException("No channels of the mixed spectrum have a wavelength <= " + maxWavelength + " µm.");
            }
            wavenumber = select(wavenumber, kept);
            emissivity = select(emissivity, kept);
            uncertainty = select(uncertainty, kept);
        }

        // --- 2. Resample end-members ---
        List<String> names = new ArrayList<>(endMembers.keySet());
        double[][] rows = new double[names.size()][];
        for (int k = 0; k < names.size(); k++) {
            Spectrum endMember = Objects.requireNonNull(endMembers.get(names.get(k)), "End-member '" + names.get(k) + "' is null.");
            rows[k] = CubicSplineResampler.interpolate(endMember, wavenumber);
        }

        // --- 3. Keep channels finite everywhere ---
        List<Integer> valid = new ArrayList<>();
        for (int i = 0; i < wavenumber.length; i++) {
            boolean finite = Double.isFinite(emissivity[i]) && Double.isFinite(uncertainty[i]);
            for (int k = 0; k < rows.length && finite; k++) {
                finite = Double.isFinite(rows[k][i]);
            }
            if (finite) {
                valid.add(i);
            }
        }
        if (valid.isEmpty()) {
            throw new DatasetAlignmentException(String.format(
                    "No overlapping wavenumbers: the mixed spectrum (%.1f-%.1f cm^-1) shares no valid channel with end-members %s.",
                    wavenumber[0], wavenumber[wavenumber.length - 1], names));
        }
        if (valid.size() < wavenumber.length) {
            logger.info("Service: Dropped {} channels outside the common wavenumber range.", wavenumber.length - valid.size());
        }

        double[][] alignedRows = new double[rows.length][];
        for (int k = 0; k < rows.length; k++) {
            alignedRows[k] = select(rows[k], valid);
        }
        AlignedDataset dataset = new AlignedDataset(select(wavenumber, valid), select(emissivity, valid),
                select(uncertainty, valid), alignedRows, names);
        logger.debug("Service: {}", dataset);
        return dataset;
    }

    /** Runs the given algorithm on an aligned dataset. */
    public static UnmixingResult solve(AlignedDataset dataset, UnmixingAlgorithm algorithm, UnmixingSolver solver)
            throws SingularMatrixException, NoEndMembersRemainingException {
        Objects.requireNonNull(dataset, "Dataset cannot be null.");
        Objects.requireNonNull(solver, "Solver cannot be null.");
        RealMatrix endMembers = MatrixUtils.createRealMatrix(dataset.getEndMembers());
        RealVector mixed = new ArrayRealVector(dataset.getMixed(), false);
        return solver.run(algorithm, endMembers, mixed, weightMatrix(dataset.getUncertainty()), dataset.getEndMemberNames());
    }

    /** @return {@code diag(1 / (u^2 + 1e-12))} */
    public static RealMatrix weightMatrix(double[] uncertainty) {
        return UnmixingSolver.weightMatrix(uncertainty);
    }

    private static double[] select(double[] values, List<Integer> indices) {
        double[] selected = new double[indices.size()];
        for (int i = 0; i < selected.length; i++) {
            selected[i] = values[indices.get(i)];
        }
        return selected;
    }
}
