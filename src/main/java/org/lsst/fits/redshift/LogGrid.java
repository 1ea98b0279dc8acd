package org.lsst.fits.redshift;

import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * An equispaced grid in log10(wavelength).
 */
public class LogGrid {

    private static final Logger LOG = Logger.getLogger(LogGrid.class.getName());

    private final double startPower;
    private final double endPower;
    private final int count;

    /**
     * @param startPower log10 of the first wavelength
     * @param endPower log10 of the last wavelength
     * @param count number of grid points, at least 2
     * @throws InvalidInputException if count is less than 2
     */
    public LogGrid(double startPower, double endPower, int count) {
        if (count < 2) {
            LOG.log(Level.WARNING, "Refusing to build a log grid with {0} points", count);
            throw new InvalidInputException("A log grid needs at least 2 points, got " + count);
        }
        this.startPower = startPower;
        this.endPower = endPower;
        this.count = count;
    }

    public double getStartPower() {
        return startPower;
    }

    public double getEndPower() {
        return endPower;
    }

    public int getCount() {
        return count;
    }

    public double getGap() {
        return (endPower - startPower) / (count - 1);
    }

    public double[] getLogWavelengths() {
        return linearScale(startPower, endPower, count);
    }

    public double[] getWavelengths() {
        double[] result = getLogWavelengths();
        for (int i = 0; i < result.length; i++) {
            result[i] = Math.pow(10, result[i]);
        }
        return result;
    }

    /**
     * Creates num points running linearly from start to end inclusive.
     */
    public static double[] linearScale(double start, double end, int num) {
        double[] result = new double[num];
        if (num == 1) {
            result[0] = start;
            return result;
        }
        for (int i = 0; i < num; i++) {
            double w0 = 1 - (i / (double) (num - 1));
            double w1 = 1 - w0;
            result[i] = start * w0 + end * w1;
        }
        return result;
    }

    @Override
    public int hashCode() {
        int hash = 7;
        hash = 41 * hash + Double.hashCode(startPower);
        hash = 41 * hash + Double.hashCode(endPower);
        hash = 41 * hash + count;
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
        final LogGrid other = (LogGrid) obj;
        return Double.compare(startPower, other.startPower) == 0
                && Double.compare(endPower, other.endPower) == 0
                && count == other.count;
    }

    @Override
    public String toString() {
        return "LogGrid{" + "startPower=" + startPower + ", endPower=" + endPower + ", count=" + count + '}';
    }
}
