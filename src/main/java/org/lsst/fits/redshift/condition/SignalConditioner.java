package org.lsst.fits.redshift.condition;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import org.lsst.fits.redshift.ProcessingConfig;
import org.lsst.fits.redshift.Spectrum;
import org.lsst.fits.redshift.Timed;
import org.lsst.fits.redshift.lines.SpectralLineCatalog;

/**
 * An ordered chain of conditioning stages applied to one spectrum. Each stage
 * sees the output of the one before it.
 */
public class SignalConditioner {

    private final List<ConditioningStage> stages;

    public SignalConditioner(List<ConditioningStage> stages) {
        this.stages = Collections.unmodifiableList(new ArrayList<>(stages));
    }

    /**
     * Repairs made on the spectrum as observed, before resampling: bad pixels
     * and then cosmic rays.
     */
    public static SignalConditioner repairs(ProcessingConfig config) {
        List<ConditioningStage> stages = new ArrayList<>();
        stages.add(new BadPixelRepair(config));
        stages.add(new CosmicRayRejection(config));
        return new SignalConditioner(stages);
    }

    /**
     * Conditioning of a spectrum already on the log grid, ready for the
     * forward transform.
     */
    public static SignalConditioner matching(ProcessingConfig config, SpectralLineCatalog catalog) {
        List<ConditioningStage> stages = new ArrayList<>();
        stages.add(new ContinuumSubtraction(config));
        stages.add(new SmoothContinuumSubtraction(config));
        stages.add(new ErrorAdjustment(config));
        stages.add(new ErrorWeighting());
        stages.add(new SpectralLineWeighting(catalog, config));
        stages.add(new CosineTaper(config));
        stages.add(new MeanDeviationNormalisation(config));
        return new SignalConditioner(stages);
    }

    /**
     * Conditioning of a template reference spectrum on the log grid.
     */
    public static SignalConditioner template(ProcessingConfig config) {
        List<ConditioningStage> stages = new ArrayList<>();
        stages.add(new ContinuumSubtraction(config));
        stages.add(new CosineTaper(config));
        stages.add(new MeanDeviationNormalisation(config));
        return new SignalConditioner(stages);
    }

    /**
     * Apply every stage in order, in place.
     *
     * @return The same spectrum
     */
    public Spectrum apply(Spectrum spectrum) {
        for (ConditioningStage stage : stages) {
            Timed.run(() -> stage.apply(spectrum), "%s on %s took %dms", stage.getName(), spectrum);
        }
        return spectrum;
    }

    public List<ConditioningStage> getStages() {
        return stages;
    }
}
