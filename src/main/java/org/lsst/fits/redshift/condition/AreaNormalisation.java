package org.lsst.fits.redshift.condition;

import java.util.logging.Level;
import java.util.logging.Logger;
import org.lsst.fits.redshift.ProcessingConfig;
import org.lsst.fits.redshift.Spectrum;

/**
 * Scales intensity and variance by the same factor so the sum of absolute
 * intensities equals the target area. Optional stage, not part of the standard
 * {@link SignalConditioner} chains.
 */
public class AreaNormalisation implements ConditioningStage {

    private static final Logger LOG = Logger.getLogger(AreaNormalisation.class.getName());

    private final double targetArea;

    public AreaNormalisation(double targetArea) {
        this.targetArea = targetArea;
    }

    public AreaNormalisation(ProcessingConfig config) {
        this(config.getNormalisedArea());
    }

    @Override
    public void apply(Spectrum spectrum) {
        normaliseViaArea(spectrum.getIntensity(), spectrum.getVariance(), targetArea);
    }

    /**
     * Normalise in place.
     *
     * @param array The values to normalise
     * @param variance Scaled by the same factor, may be null
     * @param area The target sum of absolute values
     * @return The ratio r such that normalised = original * r, or 1 when the
     * array has no area and is left unchanged
     */
    public static double normaliseViaArea(double[] array, double[] variance, double area) {
        return normaliseViaArea(array, variance, area, 0, array.length - 1);
    }

    /**
     * Normalise in place so that the area between start and end, both
     * inclusive and clamped to the array, equals the target. The whole array
     * is scaled.
     *
     * @return The ratio r such that normalised = original * r, or 1 when the
     * range has no area and the array is left unchanged
     */
    public static double normaliseViaArea(double[] array, double[] variance, double area, int start, int end) {
        double current = Filters.area(array, start, end);
        if (current == 0 || Double.isNaN(current)) {
            LOG.log(Level.FINE, "Zero area, skipping area normalisation");
            return 1;
        }
        double r = area / current;
        for (int j = 0; j < array.length; j++) {
            array[j] *= r;
            if (variance != null) {
                variance[j] *= r;
            }
        }
        return r;
    }
}
