package org.lsst.fits.redshift.template;

import java.util.Arrays;
import java.util.logging.Level;
import java.util.logging.Logger;
import org.lsst.fits.redshift.LogGrid;
import org.lsst.fits.redshift.ProcessingConfig;
import org.lsst.fits.redshift.Spectrum;
import org.lsst.fits.redshift.condition.SignalConditioner;
import org.lsst.fits.redshift.correlate.FourierTransform;
import org.lsst.fits.redshift.correlate.TransformedSpectrum;
import org.lsst.fits.redshift.resample.Resampler;

/**
 * Turns a reference spectrum into a {@link Template}.
 * <p>
 * The reference is shifted to its baseline redshift, resampled onto the log
 * grid (the quasar grid for quasar references), conditioned, and transformed. The conjugate of the transform is kept,
 * so correlating a spectrum is a single multiplication.
 */
public class TemplateBuilder {

    private static final Logger LOG = Logger.getLogger(TemplateBuilder.class.getName());

    private final Resampler resampler;
    private final Resampler quasarResampler;
    private final SignalConditioner conditioner;
    private final FourierTransform fourier;

    public TemplateBuilder(ProcessingConfig config, FourierTransform fourier) {
        this(config.getLogGrid(), config.getQuasarLogGrid(), config, fourier);
    }

    public TemplateBuilder(LogGrid grid, LogGrid quasarGrid, ProcessingConfig config, FourierTransform fourier) {
        this.resampler = new Resampler(grid);
        this.quasarResampler = new Resampler(quasarGrid);
        this.conditioner = SignalConditioner.template(config);
        this.fourier = fourier;
    }

    public LogGrid getGrid(boolean quasar) {
        return (quasar ? quasarResampler : resampler).getGrid();
    }

    public Template build(ReferenceSpectrum reference) {
        Resampler gridResampler = reference.isQuasar() ? quasarResampler : resampler;
        LogGrid grid = gridResampler.getGrid();
        double shift = Math.log10(1 + reference.getRedshift());
        double[] rest = reference.getLogLambda();
        double[] shifted = new double[rest.length];
        for (int i = 0; i < rest.length; i++) {
            shifted[i] = rest[i] + shift;
        }
        double[] variance = new double[rest.length];
        Arrays.fill(variance, 1.0);
        Spectrum source = new Spectrum(shifted, reference.getIntensity().clone(), variance, true);
        Spectrum resampled = conditioner.apply(gridResampler.toLogGrid(source));

        TransformedSpectrum transform = fourier.forward(resampled.getIntensity()).conjugate();

        int n = grid.getCount();
        double gap = grid.getGap();
        double base = 1 + reference.getRedshift();
        int startZIndex = clamp(n / 2 + (int) Math.ceil(Math.log10((1 + reference.getZMin()) / base) / gap), n);
        int endZIndex = clamp(n / 2 + (int) Math.floor(Math.log10((1 + reference.getZMax()) / base) / gap) + 1, n);
        double[] zs = new double[Math.max(0, endZIndex - startZIndex)];
        for (int j = 0; j < zs.length; j++) {
            zs[j] = Math.pow(10, (j + startZIndex - n / 2) * gap) * base - 1;
        }
        LOG.log(Level.FINE, "Template {0} covers z {1} to {2} over indices [{3}, {4})",
                new Object[]{reference.getId(), zs.length > 0 ? zs[0] : Double.NaN, zs.length > 0 ? zs[zs.length - 1] : Double.NaN, startZIndex, endZIndex});
        return new Template(reference.getId(), reference.getName(), reference.getRedshift(), grid.getLogWavelengths(),
                resampled.getIntensity(), transform, zs, startZIndex, endZIndex, reference.isQuasar());
    }

    private static int clamp(int index, int n) {
        return Math.max(0, Math.min(n, index));
    }
}
