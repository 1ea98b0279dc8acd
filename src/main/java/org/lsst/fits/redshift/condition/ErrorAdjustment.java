package org.lsst.fits.redshift.condition;

import java.util.ArrayDeque;
import java.util.Arrays;
import java.util.Iterator;
import org.lsst.fits.redshift.ProcessingConfig;
import org.lsst.fits.redshift.Spectrum;

/**
 * Makes the variance estimate more conservative. First each variance is
 * broadened to the maximum of the valid variances in a small window, then it
 * is raised to at least a weighted median of a wide window. Values at or above
 * the max error sentinel are left untouched and are never used in a window.
 * Neither step lowers a variance.
 */
public class ErrorAdjustment implements ConditioningStage {

    private final int broadenWindow;
    private final int medianWindow;
    private final double medianWeight;
    private final double maxError;

    public ErrorAdjustment(int broadenWindow, int medianWindow, double medianWeight, double maxError) {
        this.broadenWindow = broadenWindow;
        this.medianWindow = medianWindow;
        this.medianWeight = medianWeight;
        this.maxError = maxError;
    }

    public ErrorAdjustment(ProcessingConfig config) {
        this(config.getBroadenWindow(), config.getErrorMedianWindow(), config.getErrorMedianWeight(), config.getMaxError());
    }

    @Override
    public void apply(Spectrum spectrum) {
        adjustError(spectrum.getVariance());
    }

    public void adjustError(double[] variance) {
        broadenError(variance);
        maxMedianAdjust(variance);
    }

    /**
     * In place replaces each valid variance with the largest valid variance in
     * its window.
     */
    public void broadenError(double[] data) {
        double[] result = slide(data, broadenWindow, true, 1.0);
        for (int i = 0; i < data.length; i++) {
            data[i] = Math.max(data[i], result[i]);
        }
    }

    /**
     * In place raises each valid variance to at least medianWeight times the
     * median of the valid variances in its window.
     */
    public void maxMedianAdjust(double[] data) {
        double[] result = slide(data, medianWindow, false, medianWeight);
        for (int i = 0; i < data.length; i++) {
            if (result[i] > data[i]) {
                data[i] = result[i];
            }
        }
    }

    /**
     * Slide a window over the valid values. The window starts with
     * <code>window/2 + 2</code> copies of the first valid value followed by the
     * first valid values until it is full, and each step appends the next valid
     * value at least window/2 ahead (or repeats the newest entry past the end).
     */
    private double[] slide(double[] data, int window, boolean maximum, double weight) {
        int n = data.length;
        int num = (window - 1) / 2;
        double[] result = data.clone();
        ArrayDeque<Double> win = new ArrayDeque<>();
        for (int i = 0; i < n; i++) {
            if (data[i] < maxError) {
                while (win.size() < num + 2) {
                    win.addLast(data[i]);
                }
                break;
            }
        }
        if (win.isEmpty()) {
            return result;
        }
        for (int i = 0; i < n && win.size() < window; i++) {
            if (data[i] < maxError) {
                win.addLast(data[i]);
            }
        }
        double[] sorted = new double[win.size()];
        for (int i = 0; i < n; i++) {
            if (data[i] >= maxError) {
                continue;
            }
            int index = i + num;
            while (index < n && data[index] >= maxError) {
                index++;
            }
            win.addLast(index >= n ? win.peekLast() : data[index]);
            win.removeFirst();
            if (maximum) {
                double max = Double.NEGATIVE_INFINITY;
                for (double v : win) {
                    max = Math.max(max, v);
                }
                result[i] = weight * max;
            } else {
                Iterator<Double> it = win.iterator();
                for (int j = 0; j < sorted.length; j++) {
                    sorted[j] = it.next();
                }
                Arrays.sort(sorted);
                result[i] = weight * sorted[Math.min(num, sorted.length - 1)];
            }
        }
        return result;
    }
}
