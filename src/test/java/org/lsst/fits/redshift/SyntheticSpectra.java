package org.lsst.fits.redshift;

import java.util.Random;
import org.lsst.fits.redshift.template.ReferenceSpectrum;

/**
 * Emission line spectra with known redshifts for pipeline tests.
 */
public class SyntheticSpectra {

    /**
     * Rest wavelengths of [OII], Hb, [OIII] and Ha.
     */
    public static final double[] LINES = {3728.48, 4862.69, 5008.24, 6564.61};
    private static final double[] AMPLITUDES = {40, 25, 60, 80};
    private static final double SIGMA = 0.0005;

    private SyntheticSpectra() {
    }

    /**
     * Sum of Gaussian lines in log10 wavelength, shifted to redshift z.
     */
    public static double lines(double logLambda, double z) {
        double result = 0;
        for (int i = 0; i < LINES.length; i++) {
            double d = logLambda - Math.log10(LINES[i] * (1 + z));
            result += AMPLITUDES[i] * Math.exp(-d * d / (2 * SIGMA * SIGMA));
        }
        return result;
    }

    /**
     * A rest frame reference on log10 wavelengths 3.2 to 4.1.
     */
    public static ReferenceSpectrum reference(String id, double redshift, double zMin, double zMax) {
        return reference(id, redshift, zMin, zMax, false);
    }

    public static ReferenceSpectrum reference(String id, double redshift, double zMin, double zMax, boolean quasar) {
        int n = 9001;
        double[] logLambda = LogGrid.linearScale(3.2, 4.1, n);
        double[] intensity = new double[n];
        for (int i = 0; i < n; i++) {
            intensity[i] = 5 + lines(logLambda[i], 0);
        }
        return new ReferenceSpectrum(id, "Synthetic " + id, logLambda, intensity, redshift, zMin, zMax, quasar);
    }

    /**
     * An observed spectrum at redshift z, linear wavelengths 2000 to 9900
     * Angstroms in 1 Angstrom steps, on a sloping continuum with a little noise.
     */
    public static Spectrum observed(double z, long seed) {
        Random random = new Random(seed);
        int n = 7901;
        double[] wavelength = new double[n];
        double[] intensity = new double[n];
        double[] variance = new double[n];
        for (int i = 0; i < n; i++) {
            wavelength[i] = 2000 + i;
            intensity[i] = 10 + 0.001 * wavelength[i] + lines(Math.log10(wavelength[i]), z) + 0.1 * random.nextGaussian();
            variance[i] = 1;
        }
        return new Spectrum(wavelength, intensity, variance);
    }
}
