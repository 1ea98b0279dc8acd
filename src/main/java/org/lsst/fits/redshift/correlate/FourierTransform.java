package org.lsst.fits.redshift.correlate;

/**
 * The forward and inverse transform used for cross-correlation.
 */
public interface FourierTransform {

    TransformedSpectrum forward(double[] data);

    /**
     * @return The real part of the inverse transform, same length as the input
     */
    double[] inverse(TransformedSpectrum transform);
}
