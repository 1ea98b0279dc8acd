package org.lsst.fits.redshift.condition;

import java.util.logging.Level;
import java.util.logging.Logger;
import org.lsst.fits.redshift.ProcessingConfig;
import org.lsst.fits.redshift.Spectrum;

/**
 * Replaces bad pixels with the average of the good pixels around them.
 * <p>
 * A pixel is bad if its intensity is NaN or outside [minValue, maxValue], or
 * its variance is NaN or negative. Pixels are repaired in index order, so a
 * repaired pixel counts as good for the pixels after it. A bad pixel with no
 * good neighbour within the radius gets intensity and variance 0.
 */
public class BadPixelRepair implements ConditioningStage {

    private static final Logger LOG = Logger.getLogger(BadPixelRepair.class.getName());

    private final double minValue;
    private final double maxValue;
    private final int radius;

    public BadPixelRepair(double minValue, double maxValue, int radius) {
        this.minValue = minValue;
        this.maxValue = maxValue;
        this.radius = radius;
    }

    public BadPixelRepair(ProcessingConfig config) {
        this(config.getMinValue(), config.getMaxValue(), config.getBadPixelRadius());
    }

    @Override
    public void apply(Spectrum spectrum) {
        removeBadPixels(spectrum.getIntensity(), spectrum.getVariance());
    }

    /**
     * @return The number of pixels replaced
     */
    public int removeBadPixels(double[] intensity, double[] variance) {
        int repaired = 0;
        for (int i = 0; i < intensity.length; i++) {
            if (!isBad(intensity, variance, i)) {
                continue;
            }
            double r = 0;
            double e = 0;
            int c = 0;
            int from = Math.max(0, i - radius);
            int to = Math.min(intensity.length - 1, i + radius);
            for (int j = from; j <= to; j++) {
                if (!isBad(intensity, variance, j)) {
                    c++;
                    r += intensity[j];
                    e += variance[j];
                }
            }
            if (c != 0) {
                r /= c;
                e /= c;
            }
            intensity[i] = r;
            variance[i] = e;
            repaired++;
        }
        if (repaired > 0) {
            final int count = repaired;
            LOG.log(Level.FINE, () -> String.format("Repaired %d of %d pixels", count, intensity.length));
        }
        return repaired;
    }

    boolean isBad(double[] intensity, double[] variance, int index) {
        double i = intensity[index];
        double v = variance[index];
        return Double.isNaN(i) || Double.isNaN(v) || i > maxValue || i < minValue || v < 0;
    }
}
