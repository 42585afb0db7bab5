package de.anton.spectral.unmixer.algorithms;

import de.anton.spectral.unmixer.exception.InterpolationException;
import de.anton.spectral.unmixer.model.Spectrum;
import org.apache.commons.math3.analysis.interpolation.LinearInterpolator;
import org.apache.commons.math3.analysis.interpolation.SplineInterpolator;
import org.apache.commons.math3.analysis.polynomials.PolynomialSplineFunction;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Arrays;
import java.util.Objects;

/**
 * Resamples a spectrum's emissivity onto another wavenumber grid with a natural cubic spline.
 * Never extrapolates: targets outside the source range evaluate to NaN.
 * Stateless and safe to use from several threads.
 */
public final class CubicSplineResampler {

    private static final Logger logger = LoggerFactory.getLogger(CubicSplineResampler.class);

    private CubicSplineResampler() {
        throw new IllegalStateException("Utility class should not be instantiated.");
    }

    /**
     * Interpolates the source emissivity at every target wavenumber.
     *
     * @param source            The spectrum to resample (unchanged by this call).
     * @param targetWavenumbers Grid to evaluate on; any order, NaN allowed.
     * @return A new array of the target length. If the target grid equals the source grid
     *         element by element, the source emissivity is returned exactly.
     * @throws InterpolationException If the source has fewer than 2 points.
     */
    public static double[] interpolate(Spectrum source, double[] targetWavenumbers) throws InterpolationException {
        Objects.requireNonNull(source, "Source spectrum cannot be null.");
        Objects.requireNonNull(targetWavenumbers, "Target wavenumbers cannot be null.");

        double[] x = source.getWavenumber();
        double[] y = source.getEmissivity();
        if (Arrays.equals(x, targetWavenumbers)) {
            return y;
        }
        if (x.length < 2) {
            throw new InterpolationException("Need at least 2 data points for interpolation, got " + x.length + ".");
        }

        double sourceMin = x[0];
        double sourceMax = x[x.length - 1];
        double targetMin = Double.POSITIVE_INFINITY;
        double targetMax = Double.NEGATIVE_INFINITY;
        for (double t : targetWavenumbers) {
            if (!Double.isNaN(t)) {
                targetMin = Math.min(targetMin, t);
                targetMax = Math.max(targetMax, t);
            }
        }
        if (targetMin < sourceMin || targetMax > sourceMax) {
            logger.warn("Target range ({}-{}) extends beyond source range ({}-{}). Points outside range will be NaN.",
                    String.format("%.1f", targetMin), String.format("%.1f", targetMax),
                    String.format("%.1f", sourceMin), String.format("%.1f", sourceMax));
        }

        // The natural spline through two points is the straight line; SplineInterpolator needs three
        PolynomialSplineFunction spline = x.length == 2
                ? new LinearInterpolator().interpolate(x, y)
                : new SplineInterpolator().interpolate(x, y);

        double[] result = new double[targetWavenumbers.length];
        for (int i = 0; i < targetWavenumbers.length; i++) {
            double t = targetWavenumbers[i];
            result[i] = (t >= sourceMin && t <= sourceMax) ? spline.value(t) : Double.NaN;
        }
        return result;
    }
}
