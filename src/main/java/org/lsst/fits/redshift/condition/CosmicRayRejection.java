package org.lsst.fits.redshift.condition;

import java.util.logging.Level;
import java.util.logging.Logger;
import org.lsst.fits.redshift.ProcessingConfig;
import org.lsst.fits.redshift.Spectrum;

/**
 * Removes cosmic rays: isolated samples far from the mean whose jump from an
 * immediate neighbour is just as large. Broad features fail the neighbour test
 * and are left alone.
 * <p>
 * A rejected sample is replaced by the mean of the nearby samples lying within
 * one RMS of the global mean, and its variance is set to the max error
 * sentinel.
 */
public class CosmicRayRejection implements ConditioningStage {

    private static final Logger LOG = Logger.getLogger(CosmicRayRejection.class.getName());

    private final int iterations;
    private final double deviationFactor;
    private final int pointCheck;
    private final double maxError;

    public CosmicRayRejection(int iterations, double deviationFactor, int pointCheck, double maxError) {
        this.iterations = iterations;
        this.deviationFactor = deviationFactor;
        this.pointCheck = pointCheck;
        this.maxError = maxError;
    }

    public CosmicRayRejection(ProcessingConfig config) {
        this(config.getCosmicIterations(), config.getDeviationFactor(), config.getCosmicPointCheck(), config.getMaxError());
    }

    @Override
    public void apply(Spectrum spectrum) {
        removeCosmicRays(spectrum.getIntensity(), spectrum.getVariance());
    }

    /**
     * @return The number of samples replaced over all passes
     */
    public int removeCosmicRays(double[] intensity, double[] variance) {
        int n = intensity.length;
        int rejected = 0;
        for (int pass = 0; pass < iterations && n > 0; pass++) {
            double mean = Filters.mean(intensity);
            double rms = Filters.standardDeviation(intensity);
            if (rms == 0 || Double.isNaN(rms)) {
                LOG.log(Level.FINE, "Flat intensity, skipping cosmic ray pass {0}", pass);
                break;
            }
            double threshold = deviationFactor * rms;
            for (int i = 0; i < n; i++) {
                if (Math.abs(intensity[i] - mean) < threshold) {
                    continue;
                }
                double maxNeighbour = 0;
                if (i > 0) {
                    maxNeighbour = Math.abs(intensity[i - 1] - intensity[i]);
                }
                if (i < n - 1) {
                    maxNeighbour = Math.max(maxNeighbour, Math.abs(intensity[i + 1] - intensity[i]));
                }
                if (maxNeighbour > threshold) {
                    double r = 0;
                    int c = 0;
                    int from = Math.max(0, i - pointCheck);
                    int to = Math.min(n - 1, i + pointCheck);
                    for (int j = from; j <= to; j++) {
                        if (Math.abs(intensity[j] - mean) < rms) {
                            c++;
                            r += intensity[j];
                        }
                    }
                    if (c != 0) {
                        r /= c;
                    }
                    intensity[i] = r;
                    variance[i] = maxError;
                    rejected++;
                }
            }
        }
        if (rejected > 0) {
            LOG.log(Level.FINE, "Rejected {0} cosmic ray samples", rejected);
        }
        return rejected;
    }
}
