package org.lsst.fits.redshift.correlate;

import org.apache.commons.math3.complex.Complex;
import org.apache.commons.math3.transform.DftNormalization;
import org.apache.commons.math3.transform.FastFourierTransformer;
import org.apache.commons.math3.transform.TransformType;
import org.lsst.fits.redshift.InvalidInputException;

/**
 * Fourier transform backed by the Apache Commons Math radix-2 FFT. Lengths must
 * be powers of two. The inverse carries the 1/N factor.
 */
public class CommonsMathFourierTransform implements FourierTransform {

    private final FastFourierTransformer transformer = new FastFourierTransformer(DftNormalization.STANDARD);

    @Override
    public TransformedSpectrum forward(double[] data) {
        checkLength(data.length);
        return new TransformedSpectrum(transformer.transform(data, TransformType.FORWARD));
    }

    @Override
    public double[] inverse(TransformedSpectrum transform) {
        checkLength(transform.length());
        Complex[] result = transformer.transform(transform.values(), TransformType.INVERSE);
        double[] real = new double[result.length];
        for (int i = 0; i < result.length; i++) {
            real[i] = result[i].getReal();
        }
        return real;
    }

    private static void checkLength(int length) {
        if (length == 0 || (length & (length - 1)) != 0) {
            throw new InvalidInputException("Transform length must be a power of two: " + length);
        }
    }
}
