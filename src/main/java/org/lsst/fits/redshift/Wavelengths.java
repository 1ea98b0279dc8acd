package org.lsst.fits.redshift;

/**
 * Wavelength conversions. Wavelengths are in Angstroms.
 */
public class Wavelengths {

    private Wavelengths() {
    }

    /**
     * In place converts air wavelengths to vacuum wavelengths.
     */
    public static void convertVacuumFromAir(double[] lambda) {
        for (int i = 0; i < lambda.length; i++) {
            lambda[i] = convertSingleVacuumFromAir(lambda[i]);
        }
    }

    /**
     * In place converts log10 air wavelengths to log10 vacuum wavelengths.
     */
    public static void convertVacuumFromAirWithLogLambda(double[] logLambda) {
        for (int i = 0; i < logLambda.length; i++) {
            logLambda[i] = Math.log10(convertSingleVacuumFromAir(Math.pow(10, logLambda[i])));
        }
    }

    public static double convertSingleVacuumFromAir(double lambda) {
        double l2 = lambda * lambda;
        return lambda * (1 + 2.735192e-4 + 131.4182 / l2 + 2.76249e8 / (l2 * l2));
    }

    public static double shiftWavelength(double lambda, double z) {
        return (1 + z) * lambda;
    }
}
