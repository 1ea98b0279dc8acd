package org.lsst.fits.redshift.correlate;

import org.apache.commons.math3.complex.Complex;
import org.lsst.fits.redshift.InvalidInputException;

/**
 * A sequence in Fourier space. Immutable; operations return new instances.
 */
public class TransformedSpectrum {

    private final Complex[] values;

    public TransformedSpectrum(Complex[] values) {
        this.values = values.clone();
    }

    public int length() {
        return values.length;
    }

    public Complex get(int index) {
        return values[index];
    }

    Complex[] values() {
        return values.clone();
    }

    /**
     * Element-wise complex product.
     *
     * @throws InvalidInputException if the lengths differ
     */
    public TransformedSpectrum multiply(TransformedSpectrum other) {
        if (other.values.length != values.length) {
            throw new InvalidInputException(String.format("Cannot multiply transforms of length %d and %d", values.length, other.values.length));
        }
        Complex[] result = new Complex[values.length];
        for (int i = 0; i < values.length; i++) {
            result[i] = values[i].multiply(other.values[i]);
        }
        return new TransformedSpectrum(result);
    }

    public TransformedSpectrum conjugate() {
        Complex[] result = new Complex[values.length];
        for (int i = 0; i < values.length; i++) {
            result[i] = values[i].conjugate();
        }
        return new TransformedSpectrum(result);
    }
}
