package de.anton.spectral.unmixer.service;

import de.anton.spectral.unmixer.model.Spectrum;
import de.anton.spectral.unmixer.model.SpectrumWriter;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Files;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.util.List;

class SpectrumLibraryTest {

  @TempDir
  Path tempDir;

  private static final Spectrum SPECTRUM = new Spectrum(
      new double[] {1000, 1010}, new double[] {0.9, 0.8}, new double[] {0.01, 0.01});

  @Test
  void testCreatesDirectoryAndListsSortedNames() throws Exception {
    Path directory = tempDir.resolve("spectral").resolve("spectral_library");
    SpectrumLibrary library = new SpectrumLibrary(directory);
    Assertions.assertTrue(Files.isDirectory(directory));
    Assertions.assertEquals(List.of(), library.names());

    SpectrumWriter writer = new SpectrumWriter();
    writer.write(SPECTRUM, directory.resolve("quartz.txt"));
    writer.write(SPECTRUM, directory.resolve("BB.txt"));
    writer.write(SPECTRUM, directory.resolve("albite.txt"));
    Files.writeString(directory.resolve("notes.md"), "not a spectrum");
    Files.createDirectory(directory.resolve("folder.txt"));

    Assertions.assertEquals(List.of(), library.names());
    Assertions.assertEquals(List.of("BB", "albite", "quartz"), library.refresh());
    Assertions.assertEquals(List.of("BB", "albite", "quartz"), library.names());
    Assertions.assertTrue(library.contains("albite"));
    Assertions.assertFalse(library.contains("notes"));
  }

  @Test
  void testLoadByName() throws Exception {
    SpectrumLibrary library = new SpectrumLibrary(tempDir);
    new SpectrumWriter().write(SPECTRUM, library.pathOf("quartz"));

    Assertions.assertEquals(SPECTRUM, library.load("quartz"));
    Assertions.assertEquals(List.of("quartz"), List.copyOf(library.loadAll(List.of("quartz")).keySet()));
    Assertions.assertThrows(NoSuchFileException.class, () -> library.load("olivine"));
  }

  @Test
  void testRejectsPathLikeNames() throws Exception {
    SpectrumLibrary library = new SpectrumLibrary(tempDir);

    Assertions.assertThrows(IllegalArgumentException.class, () -> library.pathOf("../escape"));
    Assertions.assertThrows(IllegalArgumentException.class, () -> library.pathOf(" "));
    Assertions.assertEquals(tempDir.resolve("ok.txt"), library.pathOf("ok"));
  }
}
