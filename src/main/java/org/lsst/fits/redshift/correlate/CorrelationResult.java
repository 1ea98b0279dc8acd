package org.lsst.fits.redshift.correlate;

import java.util.Collections;
import java.util.List;
import org.lsst.fits.redshift.Peak;

/**
 * The normalised cross-correlation of one spectrum against one template,
 * pruned to the template's valid redshift range.
 */
public class CorrelationResult {

    private final String id;
    private final double[] zs;
    private final double[] xcor;
    private final List<Peak> peaks;

    public CorrelationResult(String id, double[] zs, double[] xcor, List<Peak> peaks) {
        this.id = id;
        this.zs = zs;
        this.xcor = xcor;
        this.peaks = Collections.unmodifiableList(peaks);
    }

    public String getId() {
        return id;
    }

    /**
     * Redshift of each correlation index. The array belongs to this result.
     */
    public double[] getZs() {
        return zs;
    }

    public double[] getXcor() {
        return xcor;
    }

    /**
     * The local maxima of the correlation curve, in index order.
     */
    public List<Peak> getPeaks() {
        return peaks;
    }

    @Override
    public String toString() {
        return "CorrelationResult{" + "id=" + id + ", length=" + xcor.length + ", peaks=" + peaks.size() + '}';
    }
}
