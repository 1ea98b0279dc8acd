package org.lsst.fits.redshift.template;

import org.lsst.fits.redshift.correlate.TransformedSpectrum;

/**
 * A reference spectrum prepared for cross-correlation: its conjugated forward
 * transform on the log grid, plus the redshift of every index of the pruned
 * correlation curve.
 * <p>
 * Templates are immutable and may be shared between threads. Arrays are
 * copied on construction and the getters return copies.
 */
public class Template {

    private final String id;
    private final String name;
    private final double redshift;
    private final double[] logLambda;
    private final double[] intensity;
    private final TransformedSpectrum transform;
    private final double[] zs;
    private final int startZIndex;
    private final int endZIndex;
    private final boolean quasar;

    public Template(String id, String name, double redshift, double[] logLambda, double[] intensity,
            TransformedSpectrum transform, double[] zs, int startZIndex, int endZIndex) {
        this(id, name, redshift, logLambda, intensity, transform, zs, startZIndex, endZIndex, false);
    }

    /**
     * @param id Template identifier
     * @param name Human readable name
     * @param redshift Baseline redshift the reference was shifted by
     * @param logLambda The log10 wavelength grid, gives the gap and length
     * @param intensity The conditioned reference intensity on the grid
     * @param transform The conjugated forward transform of intensity
     * @param zs Redshift of each index in [startZIndex, endZIndex)
     * @param startZIndex First valid index of the re-centred correlation
     * @param endZIndex End (exclusive) of the valid indices
     * @param quasar Whether the template is on the quasar grid
     */
    public Template(String id, String name, double redshift, double[] logLambda, double[] intensity,
            TransformedSpectrum transform, double[] zs, int startZIndex, int endZIndex, boolean quasar) {
        this.id = id;
        this.name = name;
        this.redshift = redshift;
        this.logLambda = logLambda.clone();
        this.intensity = intensity.clone();
        this.transform = transform;
        this.zs = zs.clone();
        this.startZIndex = startZIndex;
        this.endZIndex = endZIndex;
        this.quasar = quasar;
    }

    public String getId() {
        return id;
    }

    public String getName() {
        return name;
    }

    public double getRedshift() {
        return redshift;
    }

    public double[] getLogLambda() {
        return logLambda.clone();
    }

    public double[] getIntensity() {
        return intensity.clone();
    }

    public TransformedSpectrum getTransform() {
        return transform;
    }

    public double[] getZs() {
        return zs.clone();
    }

    public int getStartZIndex() {
        return startZIndex;
    }

    public int getEndZIndex() {
        return endZIndex;
    }

    public boolean isQuasar() {
        return quasar;
    }

    /**
     * The log10 wavelength step between grid points.
     */
    public double getGap() {
        return (logLambda[logLambda.length - 1] - logLambda[0]) / (logLambda.length - 1);
    }

    /**
     * Number of grid points, which is also the transform length.
     */
    public int getLength() {
        return logLambda.length;
    }

    @Override
    public String toString() {
        return "Template{" + "id=" + id + ", name=" + name + ", redshift=" + redshift
                + ", zIndex=[" + startZIndex + "," + endZIndex + "), quasar=" + quasar + '}';
    }
}
