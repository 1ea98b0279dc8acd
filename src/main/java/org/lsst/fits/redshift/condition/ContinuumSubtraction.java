package org.lsst.fits.redshift.condition;

import java.util.ArrayList;
import java.util.List;
import java.util.logging.Level;
import java.util.logging.Logger;
import org.apache.commons.math3.linear.Array2DRowRealMatrix;
import org.apache.commons.math3.linear.ArrayRealVector;
import org.apache.commons.math3.linear.DecompositionSolver;
import org.apache.commons.math3.linear.RealMatrix;
import org.apache.commons.math3.linear.SingularValueDecomposition;
import org.lsst.fits.redshift.ProcessingConfig;
import org.lsst.fits.redshift.Spectrum;

/**
 * Subtracts a polynomial continuum fitted with iterative outlier rejection.
 * <p>
 * Each round fits a least squares polynomial to the retained points, computes
 * the standard deviation of the residuals and drops every point whose residual
 * exceeds rejectDeviation standard deviations. Rounds stop when nothing is
 * dropped or the round limit is reached. The last fit is evaluated on the full
 * wavelength array and subtracted from the intensity.
 */
public class ContinuumSubtraction implements ConditioningStage {

    private static final Logger LOG = Logger.getLogger(ContinuumSubtraction.class.getName());

    private final int degree;
    private final int iterations;
    private final double rejectDeviation;

    public ContinuumSubtraction(int degree, int iterations, double rejectDeviation) {
        this.degree = degree;
        this.iterations = iterations;
        this.rejectDeviation = rejectDeviation;
    }

    public ContinuumSubtraction(ProcessingConfig config) {
        this(config.getPolyDegree(), config.getPolyFitIterations(), config.getPolyFitRejectDeviation());
    }

    @Override
    public void apply(Spectrum spectrum) {
        subtract(spectrum.getWavelength(), spectrum.getIntensity());
    }

    /**
     * Fit and subtract the continuum from intensity in place.
     *
     * @return The fit, whose continuum is the curve that was subtracted
     */
    public ContinuumFit subtract(double[] wavelength, double[] intensity) {
        ContinuumFit fit = fit(wavelength, intensity);
        double[] continuum = fit.getContinuum();
        for (int i = 0; i < intensity.length; i++) {
            intensity[i] -= continuum[i];
        }
        return fit;
    }

    /**
     * Fit the continuum without modifying the inputs.
     */
    public ContinuumFit fit(double[] wavelength, double[] intensity) {
        int n = intensity.length;
        double min = Double.POSITIVE_INFINITY;
        double max = Double.NEGATIVE_INFINITY;
        for (double x : wavelength) {
            min = Math.min(min, x);
            max = Math.max(max, x);
        }
        double center = n == 0 ? 0 : (min + max) / 2;
        double scale = n == 0 || max == min ? 1 : (max - min) / 2;

        List<double[]> points = new ArrayList<>(n);
        for (int i = 0; i < n; i++) {
            points.add(new double[]{wavelength[i], intensity[i]});
        }
        List<Double> deviations = new ArrayList<>();
        double[] coefficients = null;
        for (int round = 0; round < iterations; round++) {
            coefficients = leastSquares(points, center, scale);
            double[] residuals = new double[points.size()];
            for (int j = 0; j < residuals.length; j++) {
                double[] p = points.get(j);
                residuals[j] = p[1] - evaluate(coefficients, (p[0] - center) / scale);
            }
            double stdDev = Filters.standardDeviation(residuals);
            deviations.add(stdDev);
            if (stdDev == 0 || Double.isNaN(stdDev)) {
                break;
            }
            List<double[]> kept = new ArrayList<>(points.size());
            for (int j = 0; j < residuals.length; j++) {
                if (Math.abs(residuals[j] / stdDev) <= rejectDeviation) {
                    kept.add(points.get(j));
                }
            }
            if (kept.size() == points.size()) {
                break;
            }
            final int dropped = points.size() - kept.size();
            final int r = round;
            LOG.log(Level.FINEST, () -> String.format("Continuum round %d dropped %d points", r, dropped));
            points = kept;
        }
        if (coefficients == null) {
            coefficients = leastSquares(points, center, scale);
        }
        double[] continuum = new double[n];
        for (int i = 0; i < n; i++) {
            continuum[i] = evaluate(coefficients, (wavelength[i] - center) / scale);
        }
        return new ContinuumFit(coefficients, center, scale, continuum, deviations, points.size());
    }

    /**
     * Least squares polynomial through the points, solved by SVD on the
     * Vandermonde matrix of the scaled abscissae. The degree is lowered when
     * there are too few points to determine it.
     */
    private double[] leastSquares(List<double[]> points, double center, double scale) {
        int m = points.size();
        int order = Math.min(degree, m - 1) + 1;
        if (order <= 0) {
            return new double[degree + 1];
        }
        double[][] vander = new double[m][order];
        double[] y = new double[m];
        for (int i = 0; i < m; i++) {
            double t = (points.get(i)[0] - center) / scale;
            double power = 1;
            for (int j = 0; j < order; j++) {
                vander[i][j] = power;
                power *= t;
            }
            y[i] = points.get(i)[1];
        }
        RealMatrix matrix = new Array2DRowRealMatrix(vander, false);
        DecompositionSolver solver = new SingularValueDecomposition(matrix).getSolver();
        double[] solution = solver.solve(new ArrayRealVector(y, false)).toArray();
        double[] coefficients = new double[degree + 1];
        System.arraycopy(solution, 0, coefficients, 0, solution.length);
        return coefficients;
    }

    private static double evaluate(double[] coefficients, double t) {
        double result = 0;
        for (int j = coefficients.length - 1; j >= 0; j--) {
            result = result * t + coefficients[j];
        }
        return result;
    }
}
