package org.lsst.fits.redshift.condition;

import java.util.ArrayDeque;
import java.util.Arrays;
import java.util.Iterator;

/**
 * Sliding window filters and small array statistics shared by the
 * conditioning stages.
 * <p>
 * The median and box-car filters pad the start of the data with
 * <code>window/2 + 2</code> copies of the first sample followed by the first
 * <code>window/2 - 1</code> samples, and repeat the last sample past the end.
 * The padding is not symmetric.
 */
public class Filters {

    private Filters() {
    }

    /**
     * Sliding median of odd width window.
     *
     * @return A new array of medians, same length as data
     */
    public static double[] medianFilter(double[] data, int window) {
        int n = data.length;
        double[] result = new double[n];
        if (n == 0) {
            return result;
        }
        int num = (window - 1) / 2;
        ArrayDeque<Double> win = primeWindow(data, num);
        double[] sorted = new double[win.size()];
        for (int i = 0; i < n; i++) {
            int index = i + num;
            win.addLast(index >= n ? data[n - 1] : data[index]);
            win.removeFirst();
            copyInto(win, sorted);
            Arrays.sort(sorted);
            result[i] = sorted[Math.min(num, sorted.length - 1)];
        }
        return result;
    }

    /**
     * Moving average of width window, padded like {@link #medianFilter}.
     *
     * @return A new array of averages, same length as data
     */
    public static double[] boxCarSmooth(double[] data, int window) {
        int n = data.length;
        double[] result = new double[n];
        if (n == 0) {
            return result;
        }
        int num = (window - 1) / 2;
        ArrayDeque<Double> win = primeWindow(data, num);
        double running = 0;
        for (double v : win) {
            running += v;
        }
        for (int i = 0; i < n; i++) {
            int index = i + num;
            double next = index >= n ? data[n - 1] : data[index];
            win.addLast(next);
            running += next;
            running -= win.removeFirst();
            result[i] = running / window;
        }
        return result;
    }

    private static ArrayDeque<Double> primeWindow(double[] data, int num) {
        ArrayDeque<Double> win = new ArrayDeque<>();
        for (int i = 0; i < num + 2; i++) {
            win.addLast(data[0]);
        }
        for (int i = 0; i < num - 1; i++) {
            win.addLast(data[Math.min(i, data.length - 1)]);
        }
        return win;
    }

    private static void copyInto(ArrayDeque<Double> win, double[] target) {
        Iterator<Double> it = win.iterator();
        for (int i = 0; i < target.length; i++) {
            target[i] = it.next();
        }
    }

    /**
     * Rolling sum smooth over num+1 pixels either side of each sample, divided
     * by the window width <code>2 * (num + 1) + 1</code>. The window is
     * centred on the sample. Samples past the ends count as zero. NaNs are
     * first replaced as in {@link #removeNaNs}. Not used by the standard
     * conditioning chains.
     *
     * @param y The values, not modified
     * @param num Pixels either side, before the increment; 0 returns a copy
     * @return The smoothed values
     */
    public static double[] fastSmooth(double[] y, int num) {
        double[] data = y.clone();
        if (num == 0) {
            return data;
        }
        removeNaNs(data);
        int half = num + 1;
        int frac = 2 * half + 1;
        double rolling = 0;
        for (int i = 0; i <= Math.min(half, data.length - 1); i++) {
            rolling += data[i];
        }
        double[] result = new double[data.length];
        for (int i = 0; i < data.length; i++) {
            if (i > 0) {
                if (i - half - 1 >= 0) {
                    rolling -= data[i - half - 1];
                }
                if (i + half < data.length) {
                    rolling += data[i + half];
                }
            }
            result[i] = rolling / frac;
        }
        return result;
    }

    /**
     * In place weighted mean over numPoints either side, weights falling off as
     * <code>falloff^distance</code>. Samples past the ends contribute nothing but
     * the full weight total is still used as divisor. Not used by the standard
     * conditioning chains.
     */
    public static void rollingPointMean(double[] intensity, int numPoints, double falloff) {
        double[] weights = new double[2 * numPoints + 1];
        double total = 0;
        for (int i = 0; i < weights.length; i++) {
            weights[i] = Math.pow(falloff, Math.abs(numPoints - i));
            total += weights[i];
        }
        double[] result = new double[intensity.length];
        for (int i = 0; i < intensity.length; i++) {
            double r = 0;
            int from = Math.max(0, i - numPoints);
            int to = Math.min(intensity.length - 1, i + numPoints);
            for (int j = from; j <= to; j++) {
                r += intensity[j] * weights[j - i + numPoints];
            }
            result[i] = r / total;
        }
        System.arraycopy(result, 0, intensity, 0, result.length);
    }

    /**
     * In place replaces each NaN with the value before it, or 0 at the start.
     */
    public static void removeNaNs(double[] y) {
        for (int i = 0; i < y.length; i++) {
            if (Double.isNaN(y[i])) {
                y[i] = i == 0 ? 0 : y[i - 1];
            }
        }
    }

    /**
     * Sum of absolute values between start and end, both inclusive, clamped to
     * the array.
     */
    public static double area(double[] array, int start, int end) {
        int from = Math.max(0, start);
        int to = Math.min(array.length - 1, end);
        double area = 0;
        for (int i = from; i <= to; i++) {
            area += Math.abs(array[i]);
        }
        return area;
    }

    public static double mean(double[] data) {
        if (data.length == 0) {
            return 0;
        }
        double sum = 0;
        for (double v : data) {
            sum += v;
        }
        return sum / data.length;
    }

    public static double absMean(double[] data) {
        if (data.length == 0) {
            return 0;
        }
        double sum = 0;
        for (double v : data) {
            sum += Math.abs(v);
        }
        return sum / data.length;
    }

    public static double absMax(double[] data) {
        double max = 0;
        for (double v : data) {
            max = Math.max(max, Math.abs(v));
        }
        return max;
    }

    /**
     * Population standard deviation about the mean.
     */
    public static double standardDeviation(double[] data) {
        if (data.length == 0) {
            return 0;
        }
        double mean = mean(data);
        double squared = 0;
        for (double v : data) {
            squared += (v - mean) * (v - mean);
        }
        return Math.sqrt(squared / data.length);
    }
}
