package org.lsst.fits.redshift.resample;

import java.util.logging.Level;
import java.util.logging.Logger;
import org.lsst.fits.redshift.InvalidInputException;
import org.lsst.fits.redshift.LogGrid;
import org.lsst.fits.redshift.Spectrum;

/**
 * Resamples spectra onto an equispaced log10(wavelength) grid.
 * <p>
 * Each target point owns the bin running from the midpoint with its left
 * neighbour to the midpoint with its right neighbour (the end bins are mirrored
 * about their point). Bin edges are converted to fractional indices into the
 * source wavelengths, and every source sample is treated as covering the unit
 * pixel centred on its own index. The resampled value is the average of the
 * source samples weighted by how much of their pixel lies inside the bin.
 * Targets outside the source coverage take the nearest boundary sample.
 * <p>
 * The source wavelengths must be non-decreasing; the bin search only walks
 * forward, resuming where the previous bin ended.
 */
public class Resampler {

    private static final Logger LOG = Logger.getLogger(Resampler.class.getName());

    private final LogGrid grid;

    public Resampler(LogGrid grid) {
        this.grid = grid;
    }

    public LogGrid getGrid() {
        return grid;
    }

    /**
     * Resample the intensity and variance of a spectrum onto the grid.
     *
     * @param spectrum The source spectrum, linear or log10 wavelengths
     * @return A new spectrum with log10 wavelengths; the source is not modified
     */
    public Spectrum toLogGrid(Spectrum spectrum) {
        double[] source = spectrum.isLogWavelength() ? pow10(spectrum.getWavelength()) : spectrum.getWavelength();
        double[] target = grid.getWavelengths();
        double[] intensity = interpolate(target, source, spectrum.getIntensity());
        double[] variance = interpolate(target, source, spectrum.getVariance());
        return new Spectrum(grid.getLogWavelengths(), intensity, variance, true);
    }

    /**
     * Resample a linear wavelength/intensity pair onto the grid.
     *
     * @return The intensity at each grid point
     */
    public double[] toLogGrid(double[] wavelength, double[] intensity) {
        return interpolate(grid.getWavelengths(), wavelength, intensity);
    }

    /**
     * Bin-average yvals, sampled at xvals, onto the points xinterp.
     *
     * @param xinterp The target points, at least two, increasing
     * @param xvals The source points, non-decreasing
     * @param yvals The source values
     * @return The resampled values, one per target point
     * @throws InvalidInputException if there are fewer than two target points,
     * no source points, or xvals and yvals differ in length
     */
    public static double[] interpolate(double[] xinterp, double[] xvals, double[] yvals) {
        if (xinterp == null || xinterp.length < 2) {
            LOG.log(Level.WARNING, "Cannot interpolate onto {0} points", xinterp == null ? 0 : xinterp.length);
            throw new InvalidInputException("Interpolation needs at least 2 target points");
        }
        if (xvals == null || yvals == null || xvals.length != yvals.length || xvals.length == 0) {
            LOG.log(Level.WARNING, "Cannot interpolate from mismatched or empty source arrays");
            throw new InvalidInputException("Interpolation source arrays must be non-empty and of equal length");
        }
        int n = xinterp.length;
        double[] result = new double[n];
        double previousEnd = Double.NaN;
        for (int i = 0; i < n; i++) {
            double startX = i == 0 ? Double.NaN : (xinterp[i] + xinterp[i - 1]) / 2;
            double endX = i == n - 1 ? Double.NaN : (xinterp[i + 1] + xinterp[i]) / 2;
            if (Double.isNaN(startX)) {
                startX = 2 * xinterp[i] - endX;
            }
            if (Double.isNaN(endX)) {
                endX = 2 * xinterp[i] - startX;
            }
            // Bins touch, so the previous end is this start
            double startIndex = Double.isNaN(previousEnd) ? findCorrespondingFloatIndex(xvals, startX, 0) : previousEnd;
            double endIndex = findCorrespondingFloatIndex(xvals, endX, (int) Math.floor(startIndex));
            result[i] = averageBetween(yvals, startIndex, endIndex);
            previousEnd = endIndex;
        }
        return result;
    }

    /**
     * Locate x inside xs as a linearly interpolated fractional index, scanning
     * forward from startIndex. Values before the first sample map to 0, values
     * after the last sample map to the last index.
     */
    static double findCorrespondingFloatIndex(double[] xs, double x, int startIndex) {
        for (int i = Math.max(0, startIndex); i < xs.length; i++) {
            if (xs[i] < x) {
                continue;
            }
            if (i == 0) {
                return 0;
            }
            double step = xs[i] - xs[i - 1];
            if (step <= 0) {
                return i;
            }
            return (i - 1) + (x - xs[i - 1]) / step;
        }
        return xs.length - 1;
    }

    /**
     * Average of values over the fractional index range [start, end], each
     * sample weighted by the overlap of its unit pixel with the range.
     */
    static double averageBetween(double[] values, double start, double end) {
        int last = values.length - 1;
        int first = Math.max(0, (int) Math.ceil(start - 0.5));
        int stop = Math.min(last, (int) Math.floor(end + 0.5));
        double sum = 0;
        double weight = 0;
        for (int j = first; j <= stop; j++) {
            double lo = Math.max(start, j - 0.5);
            double hi = Math.min(end, j + 0.5);
            if (hi > lo) {
                double w = hi - lo;
                sum += w * values[j];
                weight += w;
            }
        }
        if (weight == 0) {
            int nearest = (int) Math.max(0, Math.min(last, Math.round(start)));
            return values[nearest];
        }
        return sum / weight;
    }

    private static double[] pow10(double[] logValues) {
        double[] result = new double[logValues.length];
        for (int i = 0; i < logValues.length; i++) {
            result[i] = Math.pow(10, logValues[i]);
        }
        return result;
    }
}
