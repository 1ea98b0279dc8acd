package org.lsst.fits.redshift.correlate;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collection;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.Executor;
import java.util.logging.Level;
import java.util.logging.Logger;
import org.lsst.fits.redshift.InvalidInputException;
import org.lsst.fits.redshift.Peak;
import org.lsst.fits.redshift.ProcessingConfig;
import org.lsst.fits.redshift.Timed;
import org.lsst.fits.redshift.template.Template;

/**
 * Cross-correlates a transformed spectrum against templates.
 * <p>
 * The product of the two transforms is inverted, circularly shifted by half its
 * length so that zero lag sits in the middle, and cut down to the template's
 * valid index range. The curve is then normalised: a trimmed mean is
 * subtracted and the result divided by the spread of its local extrema.
 */
public class CorrelationEngine {

    private static final Logger LOG = Logger.getLogger(CorrelationEngine.class.getName());

    private final FourierTransform fourier;
    private final double trimAmount;

    public CorrelationEngine(FourierTransform fourier, double trimAmount) {
        this.fourier = fourier;
        this.trimAmount = trimAmount;
    }

    public CorrelationEngine(FourierTransform fourier, ProcessingConfig config) {
        this(fourier, config.getTrimAmount());
    }

    /**
     * Correlate one template.
     *
     * @param template The template, not modified
     * @param spectrumTransform Forward transform of the conditioned spectrum
     * @return The normalised, pruned correlation and its maxima
     * @throws InvalidInputException if the transform lengths differ
     */
    public CorrelationResult matchTemplate(Template template, TransformedSpectrum spectrumTransform) {
        TransformedSpectrum templateTransform = template.getTransform();
        if (templateTransform.length() != spectrumTransform.length()) {
            throw new InvalidInputException(String.format("Template %s has transform length %d but spectrum has %d",
                    template.getId(), templateTransform.length(), spectrumTransform.length()));
        }
        double[] xcor = fourier.inverse(spectrumTransform.multiply(templateTransform));
        circShift(xcor, xcor.length / 2);
        double[] pruned = prune(xcor, template.getStartZIndex(), template.getEndZIndex());
        List<Peak> peaks = normaliseXCorr(pruned);
        return new CorrelationResult(template.getId(), template.getZs(), pruned, peaks);
    }

    /**
     * Correlate every template in parallel. A template that fails is logged and
     * left out; the others are unaffected.
     *
     * @return Results keyed by template id
     */
    public Map<String, CorrelationResult> matchAll(Collection<Template> templates, TransformedSpectrum spectrumTransform, Executor executor) {
        List<CompletableFuture<CorrelationResult>> futures = new ArrayList<>(templates.size());
        for (Template template : templates) {
            futures.add(CompletableFuture.supplyAsync(() -> {
                return Timed.execute(() -> matchTemplate(template, spectrumTransform), "Matching template %s took %dms", template.getId());
            }, executor).handle((result, x) -> {
                if (x != null) {
                    LOG.log(Level.WARNING, "Correlation failed for template " + template.getId(), x);
                    return null;
                }
                return result;
            }));
        }
        return CompletableFuture.allOf(futures.toArray(new CompletableFuture[0])).thenApply(v -> {
            Map<String, CorrelationResult> results = new HashMap<>();
            for (CompletableFuture<CorrelationResult> future : futures) {
                CorrelationResult result = future.join();
                if (result != null) {
                    results.put(result.getId(), result);
                }
            }
            return results;
        }).join();
    }

    /**
     * In place rotate so that <code>data[i]</code> becomes the old
     * <code>data[(i + num) mod length]</code>.
     */
    public static void circShift(double[] data, int num) {
        int l = data.length;
        if (l == 0) {
            return;
        }
        double[] temp = data.clone();
        for (int i = 0; i < l; i++) {
            data[i] = temp[Math.floorMod(i + num, l)];
        }
    }

    /**
     * Copy of data restricted to [start, end), clamped to the array.
     */
    public static double[] prune(double[] data, int start, int end) {
        int from = Math.max(0, Math.min(start, data.length));
        int to = Math.max(from, Math.min(end, data.length));
        return Arrays.copyOfRange(data, from, to);
    }

    /**
     * Subtract the trimmed mean in place and divide by the spread of the
     * extrema.
     *
     * @return The maxima of the normalised curve
     */
    public List<Peak> normaliseXCorr(double[] data) {
        subtractMeanReject(data, trimAmount);
        rmsNormalisePeaks(data);
        return getPeaks(data, false);
    }

    /**
     * In place subtract the mean of the values left after dropping
     * <code>floor(trimAmount * n / 2)</code> of the smallest and of the largest.
     */
    public static void subtractMeanReject(double[] data, double trimAmount) {
        int num = (int) Math.floor((trimAmount * data.length) / 2);
        if (data.length - 2 * num <= 0) {
            LOG.log(Level.FINE, "Nothing left after trimming {0} values, mean not subtracted", data.length);
            return;
        }
        double[] sorted = data.clone();
        Arrays.sort(sorted);
        double sum = 0;
        for (int i = num; i < sorted.length - num; i++) {
            sum += sorted[i];
        }
        double mean = sum / (sorted.length - 2 * num);
        for (int i = 0; i < data.length; i++) {
            data[i] -= mean;
        }
    }

    /**
     * In place divide by the standard deviation of the values of all local
     * maxima and minima. Left unchanged when there are none or they are equal.
     */
    public static void rmsNormalisePeaks(double[] data) {
        List<Peak> peaks = getPeaks(data, true);
        double rms = peakDeviation(peaks);
        if (peaks.isEmpty() || rms == 0 || Double.isNaN(rms)) {
            LOG.log(Level.FINE, "No peak spread in correlation of length {0}, not normalised", data.length);
            return;
        }
        for (int i = 0; i < data.length; i++) {
            data[i] /= rms;
        }
    }

    static double peakDeviation(List<Peak> peaks) {
        if (peaks.isEmpty()) {
            return 0;
        }
        double mean = 0;
        for (Peak peak : peaks) {
            mean += peak.getValue();
        }
        mean /= peaks.size();
        double squared = 0;
        for (Peak peak : peaks) {
            squared += (peak.getValue() - mean) * (peak.getValue() - mean);
        }
        return Math.sqrt(squared / peaks.size());
    }

    /**
     * Find local extrema using a five point window, skipping two samples at
     * each end. A maximum is at least its two right neighbours and strictly
     * greater than its two left neighbours, so a plateau yields one peak.
     *
     * @param data The values
     * @param both Whether to include minima as well as maxima
     * @return The extrema in index order
     */
    public static List<Peak> getPeaks(double[] data, boolean both) {
        List<Peak> peaks = new ArrayList<>();
        for (int i = 2; i < data.length - 2; i++) {
            double v = data[i];
            if (v >= data[i + 1] && v >= data[i + 2] && v > data[i - 1] && v > data[i - 2]) {
                peaks.add(new Peak(i, v));
            } else if (both && v <= data[i + 1] && v <= data[i + 2] && v < data[i - 1] && v < data[i - 2]) {
                peaks.add(new Peak(i, v));
            }
        }
        return peaks;
    }
}
