package de.anton.spectral.unmixer.algorithms;

import de.anton.spectral.unmixer.exception.NoEndMembersRemainingException;
import de.anton.spectral.unmixer.exception.SingularMatrixException;
import de.anton.spectral.unmixer.model.UnmixingAlgorithm;
import de.anton.spectral.unmixer.model.UnmixingResult;
import org.apache.commons.math3.linear.ArrayRealVector;
import org.apache.commons.math3.linear.MatrixUtils;
import org.apache.commons.math3.linear.RealMatrix;
import org.apache.commons.math3.linear.RealVector;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;

import java.util.List;

class UnmixingSolverTest {

  private final UnmixingSolver solver = new UnmixingSolver();

  private static RealMatrix matrix(double[][] rows) {
    return MatrixUtils.createRealMatrix(rows);
  }

  private static RealVector vector(double... values) {
    return new ArrayRealVector(values);
  }

  private static RealMatrix identity(int n) {
    return MatrixUtils.createRealIdentityMatrix(n);
  }

  @Test
  void testWlsPrunesNegativeAbundance() throws Exception {
    RealMatrix e = matrix(new double[][] {{1, 0, 0, 0}, {0, 1, 0, 0}, {0, 0, 1, 0}});

    UnmixingResult result = solver.runWls(e, vector(0.5, 0.3, -0.2, 0.0), identity(4), List.of("a", "b", "c"));

    Assertions.assertEquals(List.of("a", "b"), result.getEndMemberNames());
    Assertions.assertArrayEquals(new double[] {0.5, 0.3}, result.getAbundances(), 1e-12);
    Assertions.assertArrayEquals(new double[] {0.5, 0.3, 0, 0}, result.getFit(), 1e-12);
    Assertions.assertArrayEquals(new double[] {0, 0, -0.2, 0}, result.getResidual(), 1e-12);
    Assertions.assertEquals(0.1, result.getRms(), 1e-12);
    Assertions.assertArrayEquals(new double[] {1, 1}, result.getErrors(), 1e-12);
    Assertions.assertFalse(result.hasNormalizedAbundances());
    Assertions.assertTrue(Double.isNaN(result.getAbundance("c")));
  }

  @Test
  void testRepeatedNamesArePrunedByPosition() throws Exception {
    RealMatrix e = matrix(new double[][] {{1, 0, 0, 0}, {0, 1, 0, 0}, {0, 0, 1, 0}});

    UnmixingResult result = solver.runWls(e, vector(-0.2, 0.3, 0.5, 0.0), identity(4), List.of("a", "a", "b"));

    Assertions.assertEquals(List.of("a", "b"), result.getEndMemberNames());
    Assertions.assertArrayEquals(new double[] {0.3, 0.5}, result.getAbundances(), 1e-12);
    Assertions.assertArrayEquals(new double[] {1, 1}, result.getErrors(), 1e-12);
  }

  @Test
  void testAbundanceRoundingToZeroIsPruned() throws Exception {
    RealMatrix e = matrix(new double[][] {{1, 0}, {0, 1}});

    UnmixingResult defaultPrecision = solver.runWls(e, vector(0.5, 0.004), identity(2), List.of("a", "b"));
    UnmixingResult finerPrecision = new UnmixingSolver(3, 1e-12, "BB").runWls(e, vector(0.5, 0.004), identity(2), List.of("a", "b"));

    Assertions.assertEquals(List.of("a"), defaultPrecision.getEndMemberNames());
    Assertions.assertEquals(List.of("a", "b"), finerPrecision.getEndMemberNames());
  }

  @Test
  void testErrorsScaleWithUncertainty() throws Exception {
    RealMatrix e = matrix(new double[][] {{1, 0, 0}, {0, 1, 0}});
    RealMatrix w = UnmixingSolver.weightMatrix(new double[] {0.1, 0.1, 0.1});

    UnmixingResult result = solver.runWls(e, vector(0.4, 0.6, 0.0), w, List.of("a", "b"));

    Assertions.assertArrayEquals(new double[] {0.1, 0.1}, result.getErrors(), 1e-9);
  }

  @Test
  void testStoPrunesAndSumsToOne() throws Exception {
    RealMatrix e = matrix(new double[][] {{1, 0, 0}, {0, 1, 0}, {0, 0, 1}});

    UnmixingResult result = solver.runSto(e, vector(0.6, 0.5, 0.0), identity(3), List.of("a", "b", "c"));

    Assertions.assertEquals(List.of("a", "b"), result.getEndMemberNames());
    Assertions.assertArrayEquals(new double[] {0.55, 0.45}, result.getAbundances(), 1e-12);
    Assertions.assertArrayEquals(new double[] {0.55, 0.45}, result.getNormalizedAbundances(), 1e-12);
    Assertions.assertArrayEquals(new double[] {0.55, 0.45, 0.0}, result.getFit(), 1e-12);
  }

  @Test
  void testStoNormalizationExcludesBlackbody() throws Exception {
    RealMatrix e = matrix(new double[][] {{1, 0, 0}, {0, 1, 0}, {0, 0, 1}});

    UnmixingResult result = solver.runSto(e, vector(0.5, 0.3, 0.2), identity(3), List.of("quartz", "feldspar", "BB"));

    Assertions.assertArrayEquals(new double[] {0.5, 0.3, 0.2}, result.getAbundances(), 1e-12);
    Assertions.assertArrayEquals(new double[] {0.625, 0.375, 0.0}, result.getNormalizedAbundances(), 1e-12);
  }

  @Test
  void testOnlyBlackbodyLeftGivesZeroNormalization() throws Exception {
    RealMatrix e = matrix(new double[][] {{1, 0}, {0, 1}});

    UnmixingResult result = solver.runSto(e, vector(-0.5, 1.0), identity(2), List.of("quartz", "BB"));

    Assertions.assertEquals(List.of("BB"), result.getEndMemberNames());
    Assertions.assertArrayEquals(new double[] {1.0}, result.getAbundances(), 1e-12);
    Assertions.assertArrayEquals(new double[] {0.0}, result.getNormalizedAbundances());
  }

  @Test
  void testExactMixtureIsRecoveredByBothAlgorithms() throws Exception {
    double[] a = {0.9, 0.8, 0.7, 0.6, 0.75};
    double[] b = {0.3, 0.5, 0.7, 0.9, 0.2};
    double[] m = new double[a.length];
    for (int i = 0; i < m.length; i++) {
      m[i] = 0.6 * a[i] + 0.4 * b[i];
    }
    RealMatrix e = matrix(new double[][] {a, b});
    RealMatrix w = UnmixingSolver.weightMatrix(new double[] {0.01, 0.02, 0.01, 0.03, 0.01});

    UnmixingResult wls = solver.runWls(e, vector(m), w, List.of("a", "b"));
    UnmixingResult sto = solver.runSto(e, vector(m), w, List.of("a", "b"));

    Assertions.assertArrayEquals(new double[] {0.6, 0.4}, wls.getAbundances(), 1e-9);
    Assertions.assertArrayEquals(new double[] {0.6, 0.4}, sto.getAbundances(), 1e-9);
    Assertions.assertEquals(0.0, wls.getRms(), 1e-9);
  }

  @Test
  void testStoAbundancesSumToOneForInexactMixture() throws Exception {
    RealMatrix e = matrix(new double[][] {{0.9, 0.8, 0.75, 0.6}, {0.3, 0.5, 0.7, 0.9}, {1, 1, 1, 1}});

    UnmixingResult result = solver.run(UnmixingAlgorithm.STO, e, vector(0.5, 0.55, 0.7, 0.62), identity(4), List.of("a", "b", "BB"));

    double sum = 0;
    for (double abundance : result.getAbundances()) {
      Assertions.assertTrue(abundance > 0);
      sum += abundance;
    }
    Assertions.assertEquals(1.0, sum, 1e-6);
  }

  @Test
  void testDuplicateEndMembersAreSingular() {
    RealMatrix e = matrix(new double[][] {{1, 2, 3}, {1, 2, 3}});

    SingularMatrixException error = Assertions.assertThrows(SingularMatrixException.class,
        () -> solver.runWls(e, vector(1, 2, 3), identity(3), List.of("a", "a-copy")));
    Assertions.assertTrue(error.getMessage().contains("a-copy"));
  }

  @Test
  void testAllEndMembersPruned() {
    RealMatrix e = matrix(new double[][] {{1, 1}});

    Assertions.assertThrows(NoEndMembersRemainingException.class,
        () -> solver.runWls(e, vector(-1, -1), identity(2), List.of("a")));
  }

  @Test
  void testDimensionMismatch() {
    RealMatrix e = matrix(new double[][] {{1, 0}, {0, 1}});

    Assertions.assertThrows(IllegalArgumentException.class,
        () -> solver.runWls(e, vector(1, 2), identity(2), List.of("a")));
    Assertions.assertThrows(IllegalArgumentException.class,
        () -> solver.runWls(e, vector(1, 2, 3), identity(2), List.of("a", "b")));
    Assertions.assertThrows(IllegalArgumentException.class,
        () -> solver.runWls(e, vector(1, 2), identity(3), List.of("a", "b")));
  }
}
