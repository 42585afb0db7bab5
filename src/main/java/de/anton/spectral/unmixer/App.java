package de.anton.spectral.unmixer;

import de.anton.spectral.unmixer.exception.SpectralDataException;
import de.anton.spectral.unmixer.model.FileInfo;
import de.anton.spectral.unmixer.model.Spectrum;
import de.anton.spectral.unmixer.model.UnmixingAlgorithm;
import de.anton.spectral.unmixer.model.UnmixingResult;
import de.anton.spectral.unmixer.service.AnalysisConfiguration;
import de.anton.spectral.unmixer.service.SpectrumImportService;
import de.anton.spectral.unmixer.service.SpectrumLibrary;
import de.anton.spectral.unmixer.service.UnmixingService;
import de.anton.spectral.unmixer.service.WorkspaceLayout;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.PrintStream;
import java.nio.file.Paths;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * Command-line entry point. Works on the workspace named by the {@code unmixer.workspace}
 * system property (default {@code ./spectral}).
 * <pre>
 *   import &lt;raw-file&gt; &lt;name&gt; [--mixed]
 *   inspect &lt;raw-file&gt;
 *   list
 *   unmix &lt;WLS|STO&gt; &lt;mixed-name&gt; &lt;em1,em2,...&gt; [max-wavelength-um]
 * </pre>
 */
public class App {
    private static final Logger logger = LoggerFactory.getLogger(App.class);

    static final int EXIT_OK = 0;
    static final int EXIT_FAILURE = 1;

    private static final String USAGE = String.join(System.lineSeparator(),
            "Usage:",
            "  import <raw-file> <name> [--mixed]   pre-process a raw file into the end-member (or mixed) library",
            "  inspect <raw-file>                   preview a raw file without importing it",
            "  list                                 list the spectra of both libraries",
            "  unmix <WLS|STO> <mixed-name> <em1,em2,...> [max-wavelength-um]");

    public static void main(String[] args) {
        System.exit(run(args, WorkspaceLayout.fromSystemProperties(), System.out));
    }

    /**
     * Executes one command.
     *
     * @return The process exit code.
     */
    static int run(String[] args, WorkspaceLayout layout, PrintStream out) {
        if (args.length == 0) {
            out.println(USAGE);
            return EXIT_FAILURE;
        }
        String[] rest = Arrays.copyOfRange(args, 1, args.length);
        try {
            logger.debug("Command '{}' on workspace {}", args[0], layout.root().toAbsolutePath());
            switch (args[0]) {
                case "import":
                    return importFile(rest, layout, out);
                case "inspect":
                    return inspect(rest, out);
                case "list":
                    return list(layout, out);
                case "unmix":
                    return unmix(rest, layout, out);
                default:
                    out.println("Unknown command: " + args[0]);
                    out.println(USAGE);
                    return EXIT_FAILURE;
            }
        } catch (IOException | SpectralDataException e) {
            logger.error("Command '{}' failed: {}", args[0], e.getMessage(), e);
            out.println("Error: " + e.getMessage());
            return EXIT_FAILURE;
        } catch (IllegalArgumentException e) {
            logger.error("Invalid arguments for '{}': {}", args[0], e.getMessage());
            out.println("Error: " + e.getMessage());
            return EXIT_FAILURE;
        }
    }

    private static int importFile(String[] args, WorkspaceLayout layout, PrintStream out) throws IOException, SpectralDataException {
        if (args.length < 2 || args.length > 3 || (args.length == 3 && !"--mixed".equals(args[2]))) {
            throw new IllegalArgumentException("import <raw-file> <name> [--mixed]");
        }
        boolean mixed = args.length == 3;
        SpectrumLibrary library = new SpectrumLibrary(mixed ? layout.mixedDirectory() : layout.libraryDirectory());
        Spectrum spectrum = new SpectrumImportService().importInto(library, Paths.get(args[0]), args[1]);
        out.printf(Locale.ROOT, "Imported '%s' into %s: %d points, %.2f-%.2f cm^-1%n", args[1],
                mixed ? "mixed spectra" : "end-member library", spectrum.size(),
                spectrum.getMinWavenumber(), spectrum.getMaxWavenumber());
        return EXIT_OK;
    }

    private static int inspect(String[] args, PrintStream out) {
        if (args.length != 1) {
            throw new IllegalArgumentException("inspect <raw-file>");
        }
        FileInfo info = new SpectrumImportService().inspect(Paths.get(args[0]));
        if (!info.isReadable()) {
            out.println("Error: " + info.error());
            return EXIT_FAILURE;
        }
        out.println("Format:  " + info.format());
        out.println("Columns: " + info.columns());
        out.println("Shape:   " + info.shapePreview());
        for (Map<String, String> row : info.firstRows()) {
            out.println("  " + row);
        }
        return EXIT_OK;
    }

    private static int list(WorkspaceLayout layout, PrintStream out) throws IOException {
        SpectrumLibrary endMembers = new SpectrumLibrary(layout.libraryDirectory());
        SpectrumLibrary mixed = new SpectrumLibrary(layout.mixedDirectory());
        out.println("End-members (" + endMembers.getDirectory() + "):");
        endMembers.names().forEach(n -> out.println("  " + n));
        out.println("Mixed spectra (" + mixed.getDirectory() + "):");
        mixed.names().forEach(n -> out.println("  " + n));
        return EXIT_OK;
    }

    private static int unmix(String[] args, WorkspaceLayout layout, PrintStream out) throws IOException, SpectralDataException {
        if (args.length < 3 || args.length > 4) {
            throw new IllegalArgumentException("unmix <WLS|STO> <mixed-name> <em1,em2,...> [max-wavelength-um]");
        }
        UnmixingAlgorithm algorithm = UnmixingAlgorithm.fromName(args[0]);
        if (algorithm == null) {
            throw new IllegalArgumentException("Unknown algorithm '" + args[0] + "'. Use WLS or STO.");
        }
        List<String> endMemberNames = new ArrayList<>();
        for (String name : args[2].split(",")) {
            if (!name.isBlank()) {
                endMemberNames.add(name.trim());
            }
        }
        Double maxWavelength = null;
        if (args.length == 4) {
            try {
                maxWavelength = Double.valueOf(args[3]);
            } catch (NumberFormatException e) {
                throw new IllegalArgumentException("Maximum wavelength must be a number. Got: " + args[3], e);
            }
        }

        AnalysisConfiguration config = AnalysisConfiguration.of(algorithm, args[1], endMemberNames, maxWavelength);
        UnmixingService.AnalysisResult analysis = UnmixingService.forWorkspace(layout).runAnalysis(config);
        printResult(analysis, out);
        return EXIT_OK;
    }

    private static void printResult(UnmixingService.AnalysisResult analysis, PrintStream out) {
        UnmixingResult result = analysis.result;
        out.printf(Locale.ROOT, "%s (%s), %d channels, %d of %d end-members kept%n", result.getAlgorithm().getDisplayName(),
                result.getAlgorithm(), analysis.dataset.getChannelCount(), result.getEndMemberNames().size(),
                analysis.dataset.getEndMemberCount());
        double[] abundances = result.getAbundances();
        double[] errors = result.getErrors();
        double[] normalized = result.getNormalizedAbundances();
        for (int i = 0; i < abundances.length; i++) {
            String line = String.format(Locale.ROOT, "  %-24s %8.4f ± %.4f", result.getEndMemberNames().get(i), abundances[i], errors[i]);
            if (normalized != null) {
                line += String.format(Locale.ROOT, "   normalized %.4f", normalized[i]);
            }
            out.println(line);
        }
        List<String> pruned = new ArrayList<>(analysis.dataset.getEndMemberNames());
        pruned.removeAll(result.getEndMemberNames());
        if (!pruned.isEmpty()) {
            out.println("  Pruned (non-positive abundance): " + pruned);
        }
        out.printf(Locale.ROOT, "RMS: %.6g%n", result.getRms());
    }
}
