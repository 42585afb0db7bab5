package de.anton.spectral.unmixer.model;

import de.anton.spectral.unmixer.exception.TableParseException;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

class DelimitedTableReaderTest {

  @TempDir
  Path tempDir;

  private final DelimitedTableReader reader = new DelimitedTableReader();

  @Test
  void testDetectsSemicolonDelimiter() throws Exception {
    Path file = Files.writeString(tempDir.resolve("semi.csv"), "Wavenumber;Emissivity\n1000;0.9\n1001;0.8\n");

    RawTable table = reader.readWithDetection(file);

    Assertions.assertEquals(List.of("Wavenumber", "Emissivity"), table.getColumnNames());
    Assertions.assertEquals(2, table.getRowCount());
    Assertions.assertEquals("0.8", table.getCell(1, 1));
  }

  @Test
  void testFallsBackToLatin1() throws Exception {
    Path file = tempDir.resolve("latin.csv");
    Files.write(file, "Wellenzahl;Emissivität\n1000;0.9\n1001;0.8\n".getBytes(StandardCharsets.ISO_8859_1));

    RawTable table = reader.readWithDetection(file);

    Assertions.assertEquals(List.of("Wellenzahl", "Emissivität"), table.getColumnNames());
    Assertions.assertEquals(2, table.getRowCount());
  }

  @Test
  void testIgnoresByteOrderMarkAndBlankLines() throws Exception {
    Path file = Files.writeString(tempDir.resolve("bom.csv"), "\uFEFFwn,em\n\n1000,0.9\r\n\r\n1001,0.8\n");

    RawTable table = reader.readWithDetection(file);

    Assertions.assertEquals(List.of("wn", "em"), table.getColumnNames());
    Assertions.assertEquals(2, table.getRowCount());
  }

  @Test
  void testQuotedFieldsAndMissingTokens() throws Exception {
    Path file = Files.writeString(tempDir.resolve("quoted.csv"), "\"wn, cm-1\",em,\n1000,NA,\n\"1001\",0.8\n");

    RawTable table = reader.read(file, ',', StandardCharsets.UTF_8);

    Assertions.assertEquals(List.of("wn, cm-1", "em", "Unnamed: 2"), table.getColumnNames());
    Assertions.assertNull(table.getCell(0, 1));
    Assertions.assertEquals("1001", table.getCell(1, 0));
    // short row padded with a missing cell
    Assertions.assertNull(table.getCell(1, 2));
  }

  @Test
  void testDuplicateHeaderNamesAreSuffixed() throws Exception {
    Path file = Files.writeString(tempDir.resolve("dup.csv"), "x,x,x\n1,2,3\n");

    RawTable table = reader.read(file, ',', StandardCharsets.UTF_8);

    Assertions.assertEquals(List.of("x", "x.1", "x.2"), table.getColumnNames());
  }

  @Test
  void testRowWiderThanHeaderIsRejected() throws Exception {
    Path file = Files.writeString(tempDir.resolve("wide.csv"), "a,b\n1,2,3\n");

    Assertions.assertThrows(TableParseException.class, () -> reader.read(file, ',', StandardCharsets.UTF_8));
  }

  @Test
  void testNoViableParse() throws Exception {
    Path file = Files.writeString(tempDir.resolve("text.csv"), "hello\nworld\n");

    Assertions.assertThrows(TableParseException.class, () -> reader.readWithDetection(file));
  }

  @Test
  void testTextColumnsOnlyScoreZero() throws Exception {
    Path file = Files.writeString(tempDir.resolve("words.csv"), "a,b\nfoo,bar\nbaz,qux\n");

    Assertions.assertThrows(TableParseException.class, () -> reader.readWithDetection(file));
  }

  @Test
  void testTabOrCommaFallsBackToComma() throws Exception {
    Path tab = Files.writeString(tempDir.resolve("tab.txt"), "wn\tem\n1000\t0.9\n");
    Path comma = Files.writeString(tempDir.resolve("comma.txt"), "wn,em\n1000,0.9\n");

    Assertions.assertEquals(2, reader.readTabOrComma(tab).getColumnCount());
    RawTable table = reader.readTabOrComma(comma);
    Assertions.assertEquals(List.of("wn", "em"), table.getColumnNames());
    Assertions.assertEquals("0.9", table.getCell(0, 1));
  }

  @Test
  void testScoreCountsNumericLeadingColumns() {
    RawTable table = RawTable.of(List.of("wn", "em", "label"), new String[][] {
        {"1000", "0.9", "a"},
        {"1001", null, "b"},
        {"1002", "inf", "c"}});

    // "label" is text: 3 columns x 2 numeric columns x 3 rows
    Assertions.assertEquals(3L * 2 * 3, DelimitedTableReader.score(table));
  }
}
