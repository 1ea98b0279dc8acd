package org.lsst.fits.redshift.template;

import org.lsst.fits.redshift.InvalidInputException;

/**
 * A template's source data: a spectrum at rest wavelengths together with the
 * baseline redshift it should be shifted to and the redshift range it is
 * allowed to match over.
 */
public class ReferenceSpectrum {

    private final String id;
    private final String name;
    private final double[] logLambda;
    private final double[] intensity;
    private final double redshift;
    private final double zMin;
    private final double zMax;
    private final boolean quasar;

    public ReferenceSpectrum(String id, String name, double[] logLambda, double[] intensity, double redshift, double zMin, double zMax) {
        this(id, name, logLambda, intensity, redshift, zMin, zMax, false);
    }

    /**
     * @param id Template identifier, used as the library key
     * @param name Human readable name
     * @param logLambda Rest frame log10 wavelengths, increasing
     * @param intensity Intensity at each wavelength
     * @param redshift Baseline redshift applied before resampling
     * @param zMin Lowest redshift to search
     * @param zMax Highest redshift to search
     * @param quasar Whether to match on the wider quasar grid
     */
    public ReferenceSpectrum(String id, String name, double[] logLambda, double[] intensity, double redshift, double zMin, double zMax, boolean quasar) {
        if (logLambda == null || intensity == null || logLambda.length != intensity.length) {
            throw new InvalidInputException("Reference spectrum " + id + " needs wavelength and intensity arrays of equal length");
        }
        if (zMax < zMin) {
            throw new InvalidInputException("Reference spectrum " + id + " has zMax " + zMax + " below zMin " + zMin);
        }
        this.id = id;
        this.name = name;
        this.logLambda = logLambda;
        this.intensity = intensity;
        this.redshift = redshift;
        this.zMin = zMin;
        this.zMax = zMax;
        this.quasar = quasar;
    }

    public String getId() {
        return id;
    }

    public String getName() {
        return name;
    }

    public double[] getLogLambda() {
        return logLambda;
    }

    public double[] getIntensity() {
        return intensity;
    }

    public double getRedshift() {
        return redshift;
    }

    public double getZMin() {
        return zMin;
    }

    public double getZMax() {
        return zMax;
    }

    public boolean isQuasar() {
        return quasar;
    }

    @Override
    public String toString() {
        return "ReferenceSpectrum{" + "id=" + id + ", name=" + name + ", redshift=" + redshift + ", z=[" + zMin + "," + zMax + "], quasar=" + quasar + '}';
    }
}
