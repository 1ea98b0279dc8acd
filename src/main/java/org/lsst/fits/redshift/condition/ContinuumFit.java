package org.lsst.fits.redshift.condition;

import java.util.Collections;
import java.util.List;

/**
 * Result of a polynomial continuum fit with iterative rejection.
 */
public class ContinuumFit {

    private final double[] coefficients;
    private final double center;
    private final double scale;
    private final double[] continuum;
    private final List<Double> residualDeviations;
    private final int retainedPoints;

    ContinuumFit(double[] coefficients, double center, double scale, double[] continuum, List<Double> residualDeviations, int retainedPoints) {
        this.coefficients = coefficients;
        this.center = center;
        this.scale = scale;
        this.continuum = continuum;
        this.residualDeviations = Collections.unmodifiableList(residualDeviations);
        this.retainedPoints = retainedPoints;
    }

    /**
     * Polynomial coefficients, lowest order first, in the scaled variable
     * <code>(x - center) / scale</code>.
     */
    public double[] getCoefficients() {
        return coefficients.clone();
    }

    /**
     * The fitted continuum evaluated at every input wavelength.
     */
    public double[] getContinuum() {
        return continuum;
    }

    /**
     * Standard deviation of the fit residuals over the retained points, one
     * entry per rejection round.
     */
    public List<Double> getResidualDeviations() {
        return residualDeviations;
    }

    public int getRetainedPoints() {
        return retainedPoints;
    }

    public double evaluate(double x) {
        double t = (x - center) / scale;
        double result = 0;
        for (int j = coefficients.length - 1; j >= 0; j--) {
            result = result * t + coefficients[j];
        }
        return result;
    }

    @Override
    public String toString() {
        return "ContinuumFit{" + "degree=" + (coefficients.length - 1) + ", rounds=" + residualDeviations.size() + ", retainedPoints=" + retainedPoints + '}';
    }
}
