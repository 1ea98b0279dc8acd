package org.lsst.fits.redshift.fit;

import java.util.logging.Level;
import java.util.logging.Logger;
import org.lsst.fits.redshift.NoMatchException;
import org.lsst.fits.redshift.ProcessingConfig;
import org.lsst.fits.redshift.template.Template;

/**
 * Refines a candidate redshift to sub-pixel precision on a template's
 * correlation curve.
 */
public class RedshiftFitter {

    private static final Logger LOG = Logger.getLogger(RedshiftFitter.class.getName());

    private final int fitWindow;

    public RedshiftFitter(int fitWindow) {
        this.fitWindow = fitWindow;
    }

    public RedshiftFitter(ProcessingConfig config) {
        this(config.getFitWindow());
    }

    public int getFitWindow() {
        return fitWindow;
    }

    /**
     * Find the best redshift near a candidate.
     *
     * @param template The template the curve was computed against
     * @param xcor The pruned, normalised correlation curve, indexed like
     * <code>template.getZs()</code>
     * @param candidate The starting redshift, usually <code>zs[peak]</code>
     * @return The refined redshift
     * @throws NoMatchException If the search window holds no valid index
     */
    public double fitRedshift(Template template, double[] xcor, double candidate) throws NoMatchException {
        int[] bracket = binarySearch(template.getZs(), candidate);
        int start = bracket[0] - fitWindow / 2;
        int from = Math.max(0, start);
        int to = Math.min(xcor.length, start + fitWindow);
        int bestIndex = -1;
        double best = Double.NEGATIVE_INFINITY;
        for (int i = from; i < to; i++) {
            if (bestIndex < 0 || xcor[i] > best) {
                best = xcor[i];
                bestIndex = i;
            }
        }
        if (bestIndex < 0) {
            throw new NoMatchException(template.getId(),
                    String.format("No correlation samples in window [%d, %d) around z=%g", start, start + fitWindow, candidate));
        }
        double offset = fitAroundIndex(xcor, bestIndex);
        double z = redshiftForIndex(template, bestIndex + offset);
        LOG.log(Level.FINE, "Template {0}: candidate {1} refined to {2}", new Object[]{template.getId(), candidate, z});
        return z;
    }

    /**
     * Sub-pixel offset of the vertex of the parabola through the samples at
     * index-1, index and index+1. Zero at the array edges or when the three
     * samples are collinear.
     */
    public static double fitAroundIndex(double[] data, int index) {
        if (index <= 0 || index >= data.length - 1) {
            return 0;
        }
        double left = data[index - 1];
        double centre = data[index];
        double right = data[index + 1];
        double a = (left + right - 2 * centre) / 2;
        double b = (right - left) / 2;
        if (a == 0) {
            LOG.log(Level.FINE, "Flat correlation around index {0}, no sub-pixel offset", index);
            return 0;
        }
        return -b / (2 * a);
    }

    /**
     * Redshift of a fractional index of a template's pruned correlation curve.
     */
    public static double redshiftForIndex(Template template, double index) {
        double lag = index + template.getStartZIndex() - template.getLength() / 2;
        return Math.pow(10, lag * template.getGap()) * (1 + template.getRedshift()) - 1;
    }

    /**
     * Locate value in the ascending array zs.
     *
     * @return The pair of indices bracketing value. Both entries are equal for
     * an exact match, 0 below the range and <code>zs.length - 1</code> above it.
     */
    public static int[] binarySearch(double[] zs, double value) {
        int n = zs.length;
        if (n == 0) {
            return new int[]{0, 0};
        }
        int low = 0;
        int high = n - 1;
        if (value <= zs[low]) {
            return new int[]{low, low};
        }
        if (value >= zs[high]) {
            return new int[]{high, high};
        }
        while (high - low > 1) {
            int mid = (low + high) >>> 1;
            if (zs[mid] == value) {
                return new int[]{mid, mid};
            } else if (zs[mid] < value) {
                low = mid;
            } else {
                high = mid;
            }
        }
        return new int[]{low, high};
    }
}
