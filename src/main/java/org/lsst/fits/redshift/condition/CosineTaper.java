package org.lsst.fits.redshift.condition;

import org.lsst.fits.redshift.ProcessingConfig;
import org.lsst.fits.redshift.Spectrum;

/**
 * Zeros the outermost pixels at both ends and rolls the next taperWidth pixels
 * in with a quarter sine wave.
 */
public class CosineTaper implements ConditioningStage {

    private final int zeroPixelWidth;
    private final int taperWidth;

    public CosineTaper(int zeroPixelWidth, int taperWidth) {
        this.zeroPixelWidth = zeroPixelWidth;
        this.taperWidth = taperWidth;
    }

    public CosineTaper(ProcessingConfig config) {
        this(config.getZeroPixelWidth(), config.getTaperWidth());
    }

    @Override
    public void apply(Spectrum spectrum) {
        taper(spectrum.getIntensity());
    }

    public void taper(double[] intensity) {
        int n = intensity.length;
        for (int i = 0; i < zeroPixelWidth && i < n; i++) {
            intensity[i] = 0;
            intensity[n - 1 - i] = 0;
        }
        if (taperWidth <= 0) {
            return;
        }
        double frac = 0.5 * Math.PI / taperWidth;
        for (int i = 0; i < taperWidth; i++) {
            int front = i + zeroPixelWidth;
            int back = n - 1 - i - zeroPixelWidth;
            if (front >= n || back < 0) {
                break;
            }
            double factor = Math.sin(i * frac);
            intensity[front] *= factor;
            intensity[back] *= factor;
        }
    }
}
