package org.lsst.fits.redshift.condition;

import java.util.logging.Level;
import java.util.logging.Logger;
import org.lsst.fits.redshift.ProcessingConfig;
import org.lsst.fits.redshift.Spectrum;

/**
 * Clips outliers relative to the mean absolute deviation and then divides by
 * that deviation, so the bulk of the spectrum has unit mean absolute value.
 */
public class MeanDeviationNormalisation implements ConditioningStage {

    private static final Logger LOG = Logger.getLogger(MeanDeviationNormalisation.class.getName());

    private final double clipValue;
    private final int maxIterations;

    public MeanDeviationNormalisation(double clipValue, int maxIterations) {
        this.clipValue = clipValue;
        this.maxIterations = maxIterations;
    }

    public MeanDeviationNormalisation(ProcessingConfig config) {
        this(config.getClipValue(), config.getMaxClipIterations());
    }

    @Override
    public void apply(Spectrum spectrum) {
        normaliseMeanDev(spectrum.getIntensity());
    }

    /**
     * Repeatedly clip to <code>±(clipValue + 0.01) × meanAbsDev</code> until no
     * value exceeds the bound, then divide by the final mean absolute deviation.
     *
     * @return The divisor used, or 0 if the data was all zero and left unchanged
     */
    public double normaliseMeanDev(double[] intensity) {
        double meanDeviation = Filters.absMean(intensity);
        for (int iteration = 0;; iteration++) {
            double clipVal = (clipValue + 0.01) * meanDeviation;
            if (Filters.absMax(intensity) <= clipVal) {
                break;
            }
            if (iteration >= maxIterations) {
                LOG.log(Level.WARNING, "Clipping did not converge after {0} iterations", maxIterations);
                break;
            }
            for (int i = 0; i < intensity.length; i++) {
                if (intensity[i] > clipVal) {
                    intensity[i] = clipVal;
                } else if (intensity[i] < -clipVal) {
                    intensity[i] = -clipVal;
                }
            }
            meanDeviation = Filters.absMean(intensity);
        }
        if (meanDeviation == 0 || Double.isNaN(meanDeviation)) {
            LOG.log(Level.FINE, "Zero mean deviation, skipping normalisation");
            return 0;
        }
        for (int i = 0; i < intensity.length; i++) {
            intensity[i] /= meanDeviation;
        }
        return meanDeviation;
    }
}
