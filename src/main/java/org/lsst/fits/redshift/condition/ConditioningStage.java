package org.lsst.fits.redshift.condition;

import org.lsst.fits.redshift.Spectrum;

/**
 * One step of the conditioning chain. Implementations rewrite the intensity
 * and/or variance buffers of the spectrum in place and must not throw on short
 * arrays or degenerate data.
 */
public interface ConditioningStage {

    void apply(Spectrum spectrum);

    default String getName() {
        return getClass().getSimpleName();
    }
}
