package de.anton.spectral.unmixer.service;

import de.anton.spectral.unmixer.algorithms.UnmixingSolver;
import de.anton.spectral.unmixer.exception.DatasetAlignmentException;
import de.anton.spectral.unmixer.model.AlignedDataset;
import de.anton.spectral.unmixer.model.Spectrum;
import de.anton.spectral.unmixer.model.SpectrumWriter;
import de.anton.spectral.unmixer.model.UnmixingAlgorithm;
import de.anton.spectral.unmixer.model.UnmixingResult;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

class UnmixingServiceTest {

  @TempDir
  Path tempDir;

  private UnmixingService service;

  @BeforeEach
  void setUp() throws Exception {
    service = UnmixingService.forWorkspace(WorkspaceLayout.under(tempDir));
  }

  private static double firstEndMember(double wn) {
    return 0.9 - 0.0001 * (wn - 1000);
  }

  private static double secondEndMember(double wn) {
    return 0.5 + 0.0002 * (wn - 1000) + 0.05 * Math.sin(wn / 40.0);
  }

  /** Grid from..to in steps of 10 cm^-1, emissivity from the given end-member mixture. */
  private static Spectrum spectrum(int from, int to, double first, double second) {
    int n = (to - from) / 10 + 1;
    double[] wn = new double[n];
    double[] em = new double[n];
    double[] un = new double[n];
    for (int i = 0; i < n; i++) {
      wn[i] = from + 10.0 * i;
      em[i] = first * firstEndMember(wn[i]) + second * secondEndMember(wn[i]);
      un[i] = 0.01;
    }
    return new Spectrum(wn, em, un);
  }

  private static Map<String, Spectrum> endMembers(int from, int to) {
    Map<String, Spectrum> endMembers = new LinkedHashMap<>();
    endMembers.put("quartz", spectrum(from, to, 1, 0));
    endMembers.put("olivine", spectrum(from, to, 0, 1));
    return endMembers;
  }

  @Test
  void testAlignsOnOverlappingChannels() throws Exception {
    AlignedDataset dataset = service.alignDataset(spectrum(1000, 1500, 0.6, 0.4), endMembers(1000, 1400), null);

    double[] wn = dataset.getWavenumber();
    Assertions.assertEquals(41, dataset.getChannelCount());
    Assertions.assertEquals(1000.0, wn[0]);
    Assertions.assertEquals(1400.0, wn[wn.length - 1]);
    Assertions.assertEquals(List.of("quartz", "olivine"), dataset.getEndMemberNames());

    UnmixingResult result = UnmixingService.solve(dataset, UnmixingAlgorithm.WLS, new UnmixingSolver());
    Assertions.assertArrayEquals(new double[] {0.6, 0.4}, result.getAbundances(), 1e-6);
  }

  @Test
  void testWavelengthCutoff() throws Exception {
    // 10000 / 9.5 = 1052.6 cm^-1, so the first kept channel is 1060
    AlignedDataset dataset = service.alignDataset(spectrum(1000, 1500, 0.6, 0.4), endMembers(1000, 1400), 9.5);

    Assertions.assertEquals(35, dataset.getChannelCount());
    Assertions.assertEquals(1060.0, dataset.getWavenumber()[0]);
  }

  @Test
  void testCutoffRemovingEverything() {
    Assertions.assertThrows(DatasetAlignmentException.class,
        () -> service.alignDataset(spectrum(1000, 1500, 0.6, 0.4), endMembers(1000, 1400), 5.0));
  }

  @Test
  void testCutoffOutOfRange() {
    Assertions.assertThrows(IllegalArgumentException.class,
        () -> service.alignDataset(spectrum(1000, 1500, 0.6, 0.4), endMembers(1000, 1400), 150.0));
    Assertions.assertThrows(IllegalArgumentException.class,
        () -> service.alignDataset(spectrum(1000, 1500, 0.6, 0.4), endMembers(1000, 1400), 0.0));
  }

  @Test
  void testNoOverlap() {
    Assertions.assertThrows(DatasetAlignmentException.class,
        () -> service.alignDataset(spectrum(1000, 1100, 0.6, 0.4), endMembers(2000, 2100), null));
  }

  @Test
  void testWeightMatrix() {
    double[][] w = UnmixingService.weightMatrix(new double[] {0.1, 0.0}).getData();

    Assertions.assertEquals(1.0 / (0.01 + 1e-12), w[0][0], 1e-9);
    Assertions.assertEquals(1e12, w[1][1], 1.0);
    Assertions.assertEquals(0.0, w[0][1]);
  }

  @Test
  void testRunAnalysisFromWorkspace() throws Exception {
    WorkspaceLayout layout = WorkspaceLayout.under(tempDir);
    SpectrumWriter writer = new SpectrumWriter();
    for (Map.Entry<String, Spectrum> entry : endMembers(900, 1600).entrySet()) {
      writer.write(entry.getValue(), layout.libraryDirectory().resolve(entry.getKey() + ".txt"));
    }
    writer.write(spectrum(1000, 1500, 0.7, 0.3), layout.mixedDirectory().resolve("sample.txt"));

    UnmixingService.AnalysisResult analysis = service.runAnalysis(
        AnalysisConfiguration.of(UnmixingAlgorithm.STO, "sample", List.of("quartz", "olivine"), null));

    Assertions.assertEquals(51, analysis.dataset.getChannelCount());
    Assertions.assertArrayEquals(new double[] {0.7, 0.3}, analysis.result.getAbundances(), 1e-6);
    Assertions.assertArrayEquals(new double[] {0.7, 0.3}, analysis.result.getNormalizedAbundances(), 1e-6);
  }

  @Test
  void testRunAnalysisWithUnknownSpectrum() {
    Assertions.assertThrows(NoSuchFileException.class, () -> service.runAnalysis(
        AnalysisConfiguration.of(UnmixingAlgorithm.WLS, "missing", List.of("quartz"), null)));
  }

  @Test
  void testConfigurationValidation() {
    Assertions.assertThrows(IllegalArgumentException.class,
        () -> AnalysisConfiguration.of(UnmixingAlgorithm.WLS, "m", List.of(), null));
    Assertions.assertThrows(IllegalArgumentException.class,
        () -> AnalysisConfiguration.of(UnmixingAlgorithm.WLS, "m", List.of("a", "a"), null));
    Assertions.assertThrows(IllegalArgumentException.class,
        () -> AnalysisConfiguration.of(UnmixingAlgorithm.WLS, "m", List.of("a"), 100.5));
    Assertions.assertEquals(100.0, AnalysisConfiguration.of(UnmixingAlgorithm.WLS, "m", List.of("a"), 100.0).maxWavelength());
  }
}
