package de.anton.spectral.unmixer.service;

import de.anton.spectral.unmixer.exception.CleaningExhaustionException;
import de.anton.spectral.unmixer.exception.SchemaException;
import de.anton.spectral.unmixer.model.Spectrum;
import de.anton.spectral.unmixer.model.SpectrumStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.stream.Collectors;
import java.util.stream.Stream;

/**
 * A directory of canonical spectrum files addressed by name ({@code <name>.txt}).
 * The name list is a snapshot taken by {@link #refresh()}; files written by other
 * processes appear after the next refresh.
 */
public class SpectrumLibrary {

    private static final Logger logger = LoggerFactory.getLogger(SpectrumLibrary.class);
    public static final String FILE_EXTENSION = ".txt";

    private final Path directory;
    private final SpectrumStore store;
    private List<String> names = Collections.emptyList();

    public SpectrumLibrary(Path directory) throws IOException {
        this(directory, new SpectrumStore());
    }

    /**
     * Opens the library, creating the directory if it does not exist yet.
     *
     * @throws IOException If the directory cannot be created or listed.
     */
    public SpectrumLibrary(Path directory, SpectrumStore store) throws IOException {
        this.directory = Objects.requireNonNull(directory, "Library directory cannot be null.");
        this.store = Objects.requireNonNull(store, "Spectrum store cannot be null.");
        Files.createDirectories(directory);
        refresh();
    }

    public Path getDirectory() {
        return directory;
    }

    /** @return the sorted spectrum names found by the last {@link #refresh()}. */
    public List<String> names() {
        return names;
    }

    /**
     * Rescans the directory.
     *
     * @return The updated, sorted name list.
     */
    public List<String> refresh() throws IOException {
        try (Stream<Path> files = Files.list(directory)) {
            names = files
                    .filter(Files::isRegularFile)
                    .map(p -> p.getFileName().toString())
                    .filter(n -> n.endsWith(FILE_EXTENSION) && n.length() > FILE_EXTENSION.length())
                    .map(n -> n.substring(0, n.length() - FILE_EXTENSION.length()))
                    .sorted()
                    .collect(Collectors.toUnmodifiableList());
        }
        logger.debug("Library {}: {} spectra", directory.getFileName(), names.size());
        return names;
    }

    public boolean contains(String name) {
        return Files.isRegularFile(pathOf(name));
    }

    /**
     * @return the canonical file for the given name (which need not exist yet).
     * @throws IllegalArgumentException If the name is blank or contains a path separator.
     */
    public Path pathOf(String name) {
        Objects.requireNonNull(name, "Spectrum name cannot be null.");
        if (name.isBlank() || name.contains("/") || name.contains("\\") || name.equals(".") || name.equals("..")) {
            throw new IllegalArgumentException("Invalid spectrum name: '" + name + "'");
        }
        return directory.resolve(name + FILE_EXTENSION);
    }

    /**
     * Loads a spectrum by name.
     *
     * @throws NoSuchFileException If the library has no spectrum of that name.
     */
    public Spectrum load(String name) throws IOException, SchemaException, CleaningExhaustionException {
        Path path = pathOf(name);
        if (!Files.isRegularFile(path)) {
            throw new NoSuchFileException(path.toString(), null, "No spectrum named '" + name + "' in " + directory);
        }
        return store.load(path);
    }

    /** Loads several spectra, keyed by name in the given order. */
    public Map<String, Spectrum> loadAll(List<String> spectrumNames) throws IOException, SchemaException, CleaningExhaustionException {
        Map<String, Spectrum> spectra = new LinkedHashMap<>();
        for (String name : spectrumNames) {
            spectra.put(name, load(name));
        }
        return spectra;
    }

    @Override
    public String toString() {
        return "SpectrumLibrary{" + directory + ", " + names.size() + " spectra}";
    }
}
