package org.lsst.fits.redshift.condition;

import org.lsst.fits.redshift.ProcessingConfig;
import org.lsst.fits.redshift.Spectrum;

/**
 * Subtracts a smooth continuum built by median filtering the intensity and then
 * box-car smoothing the medians.
 */
public class SmoothContinuumSubtraction implements ConditioningStage {

    private final int medianWidth;
    private final int smoothWidth;

    public SmoothContinuumSubtraction(int medianWidth, int smoothWidth) {
        this.medianWidth = medianWidth;
        this.smoothWidth = smoothWidth;
    }

    public SmoothContinuumSubtraction(ProcessingConfig config) {
        this(config.getMedianWidth(), config.getSmoothWidth());
    }

    @Override
    public void apply(Spectrum spectrum) {
        smoothAndSubtract(spectrum.getIntensity());
    }

    /**
     * @return The smooth continuum that was subtracted
     */
    public double[] smoothAndSubtract(double[] intensity) {
        double[] medians = Filters.medianFilter(intensity, medianWidth);
        double[] smoothed = Filters.boxCarSmooth(medians, smoothWidth);
        for (int i = 0; i < intensity.length; i++) {
            intensity[i] -= smoothed[i];
        }
        return smoothed;
    }
}
