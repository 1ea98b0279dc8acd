package org.lsst.fits.redshift.condition;

import org.lsst.fits.redshift.Spectrum;

/**
 * Divides the intensity by the variance. Pixels with a variance that is zero,
 * negative or not finite carry no weight and become 0.
 */
public class ErrorWeighting implements ConditioningStage {

    @Override
    public void apply(Spectrum spectrum) {
        divideByError(spectrum.getIntensity(), spectrum.getVariance());
    }

    public static void divideByError(double[] intensity, double[] variance) {
        for (int i = 0; i < intensity.length; i++) {
            double v = variance[i];
            if (v > 0 && !Double.isInfinite(v)) {
                intensity[i] /= v;
            } else {
                intensity[i] = 0;
            }
        }
    }
}
