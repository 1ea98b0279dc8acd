package org.lsst.fits.redshift;

import java.util.Arrays;

/**
 * A spectrum as three parallel arrays: wavelength, intensity and variance.
 * <p>
 * The arrays are owned by the spectrum and are modified in place by the
 * conditioning stages. A stage has exclusive write access to the buffers while
 * it runs; callers that need the original values must take a {@link #copy()}
 * first.
 */
public class Spectrum {

    private final double[] wavelength;
    private final double[] intensity;
    private final double[] variance;
    private final boolean logWavelength;

    /**
     * Create a spectrum from parallel arrays.
     *
     * @param wavelength The wavelengths, monotonically increasing
     * @param intensity The flux values
     * @param variance The variance of each flux value
     * @param logWavelength <code>true</code> if the wavelengths are log10 values
     * @throws InvalidInputException if the arrays are null or differ in length
     */
    public Spectrum(double[] wavelength, double[] intensity, double[] variance, boolean logWavelength) {
        if (wavelength == null || intensity == null || variance == null) {
            throw new InvalidInputException("Spectrum arrays must not be null");
        }
        if (wavelength.length != intensity.length || wavelength.length != variance.length) {
            throw new InvalidInputException(String.format("Spectrum arrays differ in length: wavelength=%d intensity=%d variance=%d",
                    wavelength.length, intensity.length, variance.length));
        }
        this.wavelength = wavelength;
        this.intensity = intensity;
        this.variance = variance;
        this.logWavelength = logWavelength;
    }

    public Spectrum(double[] wavelength, double[] intensity, double[] variance) {
        this(wavelength, intensity, variance, false);
    }

    public double[] getWavelength() {
        return wavelength;
    }

    public double[] getIntensity() {
        return intensity;
    }

    public double[] getVariance() {
        return variance;
    }

    public boolean isLogWavelength() {
        return logWavelength;
    }

    public int size() {
        return intensity.length;
    }

    public Spectrum copy() {
        return new Spectrum(wavelength.clone(), intensity.clone(), variance.clone(), logWavelength);
    }

    @Override
    public String toString() {
        return "Spectrum{" + "size=" + size() + ", logWavelength=" + logWavelength
                + (size() > 0 ? ", range=[" + wavelength[0] + "," + wavelength[size() - 1] + "]" : "") + '}';
    }

    @Override
    public int hashCode() {
        int hash = 3;
        hash = 67 * hash + Arrays.hashCode(this.wavelength);
        hash = 67 * hash + Arrays.hashCode(this.intensity);
        return hash;
    }

    @Override
    public boolean equals(Object obj) {
        if (this == obj) {
            return true;
        }
        if (obj == null || getClass() != obj.getClass()) {
            return false;
        }
        final Spectrum other = (Spectrum) obj;
        return this.logWavelength == other.logWavelength
                && Arrays.equals(this.wavelength, other.wavelength)
                && Arrays.equals(this.intensity, other.intensity)
                && Arrays.equals(this.variance, other.variance);
    }
}
