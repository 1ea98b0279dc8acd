package org.lsst.fits.redshift.condition;

import org.lsst.fits.redshift.ProcessingConfig;
import org.lsst.fits.redshift.Spectrum;
import org.lsst.fits.redshift.lines.SpectralLine;
import org.lsst.fits.redshift.lines.SpectralLineCatalog;

/**
 * Down-weights the parts of a log-wavelength spectrum away from known lines.
 * Each pixel's weight is baseWeight plus a Gaussian bump for every catalog
 * line, and the intensity is multiplied by <code>min(1, weight)</code>.
 */
public class SpectralLineWeighting implements ConditioningStage {

    private final SpectralLineCatalog catalog;
    private final double baseWeight;
    private final double gaussianWidth;

    public SpectralLineWeighting(SpectralLineCatalog catalog, double baseWeight, double gaussianWidth) {
        this.catalog = catalog;
        this.baseWeight = baseWeight;
        this.gaussianWidth = gaussianWidth;
    }

    public SpectralLineWeighting(SpectralLineCatalog catalog, ProcessingConfig config) {
        this(catalog, config.getBaseWeight(), config.getGaussianWidth());
    }

    @Override
    public void apply(Spectrum spectrum) {
        applyWeighting(spectrum.getWavelength(), spectrum.getIntensity());
    }

    /**
     * @param logLambda log10 wavelengths
     * @param intensity multiplied in place by the clamped weights
     * @return The unclamped weights
     */
    public double[] applyWeighting(double[] logLambda, double[] intensity) {
        double[] weights = new double[logLambda.length];
        for (int k = 0; k < weights.length; k++) {
            weights[k] = baseWeight;
        }
        for (SpectralLine line : catalog.getAll()) {
            double center = line.getLogWavelength();
            for (int k = 0; k < weights.length; k++) {
                double d = logLambda[k] - center;
                weights[k] += Math.exp(-d * d / gaussianWidth);
            }
        }
        for (int m = 0; m < intensity.length; m++) {
            intensity[m] *= Math.min(1, weights[m]);
        }
        return weights;
    }
}
