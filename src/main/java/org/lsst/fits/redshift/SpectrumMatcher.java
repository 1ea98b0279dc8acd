package org.lsst.fits.redshift;

import java.util.ArrayList;
import java.util.Collections;
import java.util.Comparator;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.Executor;
import java.util.concurrent.ForkJoinPool;
import java.util.logging.Level;
import java.util.logging.Logger;
import org.lsst.fits.redshift.condition.SignalConditioner;
import org.lsst.fits.redshift.correlate.CommonsMathFourierTransform;
import org.lsst.fits.redshift.correlate.CorrelationEngine;
import org.lsst.fits.redshift.correlate.CorrelationResult;
import org.lsst.fits.redshift.correlate.FourierTransform;
import org.lsst.fits.redshift.correlate.TransformedSpectrum;
import org.lsst.fits.redshift.fit.RedshiftFitter;
import org.lsst.fits.redshift.lines.SpectralLineCatalog;
import org.lsst.fits.redshift.resample.Resampler;
import org.lsst.fits.redshift.template.Template;
import org.lsst.fits.redshift.template.TemplateLibrary;

/**
 * The full pipeline for one observed spectrum: repair, resample onto the log
 * grid, condition, correlate against every template and fit the strongest
 * peaks of each.
 * <p>
 * Quasar templates live on their own grid, so when the library holds any the
 * spectrum is resampled, conditioned and transformed a second time on that
 * grid.
 */
public class SpectrumMatcher {

    private static final Logger LOG = Logger.getLogger(SpectrumMatcher.class.getName());

    private final ProcessingConfig config;
    private final TemplateLibrary library;
    private final FourierTransform fourier;
    private final Executor executor;
    private final Resampler resampler;
    private final Resampler quasarResampler;
    private final SignalConditioner repairs;
    private final SignalConditioner conditioner;
    private final CorrelationEngine engine;
    private final RedshiftFitter fitter;

    public SpectrumMatcher(ProcessingConfig config, SpectralLineCatalog catalog, TemplateLibrary library) {
        this(config, catalog, library, new CommonsMathFourierTransform(), ForkJoinPool.commonPool());
    }

    public SpectrumMatcher(ProcessingConfig config, SpectralLineCatalog catalog, TemplateLibrary library, FourierTransform fourier, Executor executor) {
        this.config = config;
        this.library = library;
        this.fourier = fourier;
        this.executor = executor;
        this.resampler = new Resampler(config.getLogGrid());
        this.quasarResampler = new Resampler(config.getQuasarLogGrid());
        this.repairs = SignalConditioner.repairs(config);
        this.conditioner = SignalConditioner.matching(config, catalog);
        this.engine = new CorrelationEngine(fourier, config);
        this.fitter = new RedshiftFitter(config);
    }

    /**
     * Produce the conditioned log grid spectrum that is transformed for
     * matching.
     *
     * @param spectrum The observed spectrum, not modified
     * @return A new spectrum on the log grid
     */
    public Spectrum prepare(Spectrum spectrum) {
        return prepare(spectrum, false);
    }

    /**
     * As {@link #prepare(Spectrum)}, on the quasar grid when quasar is set.
     */
    public Spectrum prepare(Spectrum spectrum, boolean quasar) {
        return condition(repair(spectrum), quasar);
    }

    private Spectrum repair(Spectrum spectrum) {
        Spectrum working = spectrum.copy();
        repairs.apply(working);
        if (config.isAirWavelengths()) {
            if (working.isLogWavelength()) {
                Wavelengths.convertVacuumFromAirWithLogLambda(working.getWavelength());
            } else {
                Wavelengths.convertVacuumFromAir(working.getWavelength());
            }
        }
        return working;
    }

    private Spectrum condition(Spectrum repaired, boolean quasar) {
        Spectrum resampled = (quasar ? quasarResampler : resampler).toLogGrid(repaired);
        return conditioner.apply(resampled);
    }

    private Map<String, CorrelationResult> correlate(Spectrum repaired, List<Template> templates, boolean quasar) {
        if (templates.isEmpty()) {
            return Collections.emptyMap();
        }
        Spectrum prepared = condition(repaired, quasar);
        TransformedSpectrum transform = fourier.forward(prepared.getIntensity());
        return engine.matchAll(templates, transform, executor);
    }

    /**
     * Match a spectrum against every template in the library.
     *
     * @param spectrum The observed spectrum, not modified
     * @return The correlations, candidates and failures
     */
    public MatchResults match(Spectrum spectrum) {
        Spectrum repaired = repair(spectrum);
        List<Template> templates = library.getTemplates();
        List<Template> standard = new ArrayList<>();
        List<Template> quasars = new ArrayList<>();
        for (Template template : templates) {
            (template.isQuasar() ? quasars : standard).add(template);
        }
        Map<String, CorrelationResult> correlations = new HashMap<>(correlate(repaired, standard, false));
        correlations.putAll(correlate(repaired, quasars, true));

        List<RedshiftCandidate> candidates = new ArrayList<>();
        Map<String, NoMatchException> failures = new LinkedHashMap<>();
        for (Template template : templates) {
            CorrelationResult result = correlations.get(template.getId());
            if (result == null) {
                continue;
            }
            List<Peak> peaks = new ArrayList<>(result.getPeaks());
            peaks.sort(Comparator.comparingDouble(Peak::getValue).reversed());
            int count = Math.min(config.getPeaksPerTemplate(), peaks.size());
            for (Peak peak : peaks.subList(0, count)) {
                try {
                    double z = fitter.fitRedshift(template, result.getXcor(), result.getZs()[peak.getIndex()]);
                    candidates.add(new RedshiftCandidate(template.getId(), z, peak.getValue()));
                } catch (NoMatchException x) {
                    LOG.log(Level.WARNING, "No redshift fit for template " + template.getId(), x);
                    failures.put(template.getId(), x);
                }
            }
        }
        MatchResults results = new MatchResults(correlations, candidates, failures);
        LOG.log(Level.FINE, "Matched {0}: {1}", new Object[]{spectrum, results});
        return results;
    }
}
