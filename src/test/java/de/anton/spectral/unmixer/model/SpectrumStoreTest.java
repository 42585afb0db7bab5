package de.anton.spectral.unmixer.model;

import de.anton.spectral.unmixer.exception.CleaningExhaustionException;
import de.anton.spectral.unmixer.exception.SchemaException;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.stream.Stream;

class SpectrumStoreTest {

  @TempDir
  Path tempDir;

  private final SpectrumStore store = new SpectrumStore();
  private final SpectrumWriter writer = new SpectrumWriter();

  @Test
  void testWriteLoadWriteIsByteIdentical() throws Exception {
    Spectrum spectrum = new Spectrum(
        new double[] {1000.5, 1001.25, 1002.125},
        new double[] {0.1, 0.2 / 3, -1e-7},
        new double[] {0.002, 0.0, 1.5e-3});
    Path first = tempDir.resolve("first.txt");
    Path second = tempDir.resolve("second.txt");

    writer.write(spectrum, first);
    Spectrum loaded = store.load(first);
    writer.write(loaded, second);

    Assertions.assertEquals(spectrum, loaded);
    Assertions.assertArrayEquals(Files.readAllBytes(first), Files.readAllBytes(second));
  }

  @Test
  void testCanonicalLayout() throws Exception {
    Path file = tempDir.resolve("canonical.txt");
    writer.write(new Spectrum(new double[] {1000}, new double[] {0.5}, new double[] {0.01}), file);

    Assertions.assertEquals("Wavenumber\tEmissivity\tUncertainty\n1000.0\t0.5\t0.01\n", Files.readString(file));
  }

  @Test
  void testHandEditedFileIsSortedAndDeduplicated() throws Exception {
    Path file = Files.writeString(tempDir.resolve("edited.txt"),
        "Wavenumber\tEmissivity\tUncertainty\n"
            + "1002\t0.3\t0.01\n"
            + "1000\t0.1\t0.01\n"
            + "1000\t0.7\t0.01\n"
            + "-3\t0.5\t0.01\n"
            + "1001\t0.2\t0.01\n");

    Spectrum spectrum = store.load(file);

    Assertions.assertArrayEquals(new double[] {1000, 1001, 1002}, spectrum.getWavenumber());
    Assertions.assertArrayEquals(new double[] {0.1, 0.2, 0.3}, spectrum.getEmissivity());
  }

  @Test
  void testMissingColumn() throws Exception {
    Path file = Files.writeString(tempDir.resolve("partial.txt"), "Wavenumber\tEmissivity\n1000\t0.5\n");

    SchemaException e = Assertions.assertThrows(SchemaException.class, () -> store.load(file));
    Assertions.assertTrue(e.getMessage().contains("Uncertainty"));
  }

  @Test
  void testNoValidRows() throws Exception {
    Path file = Files.writeString(tempDir.resolve("invalid.txt"), "Wavenumber\tEmissivity\tUncertainty\n-1\t0.5\t0.01\n");

    Assertions.assertThrows(CleaningExhaustionException.class, () -> store.load(file));
  }

  @Test
  void testFailedMoveKeepsTargetAndRemovesTemporaryFile() throws Exception {
    Path target = tempDir.resolve("occupied.txt");
    Files.createDirectory(target);
    Path inner = Files.writeString(target.resolve("inner.txt"), "keep");
    Spectrum spectrum = new Spectrum(new double[] {1000}, new double[] {0.5}, new double[] {0.01});

    Assertions.assertThrows(IOException.class, () -> writer.write(spectrum, target));

    Assertions.assertTrue(Files.isDirectory(target));
    Assertions.assertEquals("keep", Files.readString(inner));
    try (Stream<Path> files = Files.list(tempDir)) {
      Assertions.assertTrue(files.noneMatch(p -> p.getFileName().toString().endsWith(".tmp")));
    }
  }
}
