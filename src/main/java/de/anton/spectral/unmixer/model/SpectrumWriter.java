package de.anton.spectral.unmixer.model;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.BufferedWriter;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.util.Objects;

/**
 * Writes spectra in the canonical tab-separated format:
 * header {@code Wavenumber<TAB>Emissivity<TAB>Uncertainty}, one row per channel, '\n' line ends.
 * <p>
 * The content goes to a temporary sibling file first and is then moved over the target,
 * so readers see either the old file or the complete new one.
 */
public class SpectrumWriter {

    private static final Logger logger = LoggerFactory.getLogger(SpectrumWriter.class);
    private static final char SEPARATOR = '\t';
    private static final char LINE_END = '\n';

    /**
     * Writes the spectrum to the target path, replacing any existing file.
     *
     * @param spectrum The spectrum to persist.
     * @param target   Destination file; parent directories are created as needed.
     * @throws IOException If writing or moving fails. The target is left untouched in that case.
     */
    public void write(Spectrum spectrum, Path target) throws IOException {
        Objects.requireNonNull(spectrum, "Spectrum cannot be null.");
        Objects.requireNonNull(target, "Target path cannot be null.");

        Path absoluteTarget = target.toAbsolutePath();
        Path directory = absoluteTarget.getParent();
        Files.createDirectories(directory);

        Path temporary = Files.createTempFile(directory, "." + absoluteTarget.getFileName(), ".tmp");
        try {
            try (BufferedWriter writer = Files.newBufferedWriter(temporary, StandardCharsets.UTF_8)) {
                writer.write(toCanonicalText(spectrum));
            }
            try {
                Files.move(temporary, absoluteTarget, StandardCopyOption.REPLACE_EXISTING, StandardCopyOption.ATOMIC_MOVE);
            } catch (AtomicMoveNotSupportedException e) {
                logger.debug("Atomic move not supported in {}, falling back to a plain replace.", directory);
                Files.move(temporary, absoluteTarget, StandardCopyOption.REPLACE_EXISTING);
            }
        } finally {
            Files.deleteIfExists(temporary);
        }
        logger.info("Wrote canonical spectrum ({} channels) to {}", spectrum.size(), absoluteTarget);
    }

    /** @return the exact file content written for the spectrum. */
    public static String toCanonicalText(Spectrum spectrum) {
        double[] wavenumber = spectrum.getWavenumber();
        double[] emissivity = spectrum.getEmissivity();
        double[] uncertainty = spectrum.getUncertainty();

        StringBuilder text = new StringBuilder(32 * (wavenumber.length + 1));
        text.append(Spectrum.COLUMN_WAVENUMBER).append(SEPARATOR)
            .append(Spectrum.COLUMN_EMISSIVITY).append(SEPARATOR)
            .append(Spectrum.COLUMN_UNCERTAINTY).append(LINE_END);
        for (int i = 0; i < wavenumber.length; i++) {
            text.append(wavenumber[i]).append(SEPARATOR)
                .append(emissivity[i]).append(SEPARATOR)
                .append(uncertainty[i]).append(LINE_END);
        }
        return text.toString();
    }
}
