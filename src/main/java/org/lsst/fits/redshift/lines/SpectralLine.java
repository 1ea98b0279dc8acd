package org.lsst.fits.redshift.lines;

/**
 * A known spectral line, vacuum rest wavelength in Angstroms.
 */
public class SpectralLine {

    public enum Type {
        EMISSION, ABSORPTION
    }

    private final String id;
    private final String label;
    private final double wavelength;
    private final double logWavelength;
    private final Type type;

    public SpectralLine(String id, String label, double wavelength, Type type) {
        this.id = id;
        this.label = label;
        this.wavelength = wavelength;
        this.logWavelength = Math.log10(wavelength);
        this.type = type;
    }

    public String getId() {
        return id;
    }

    public String getLabel() {
        return label;
    }

    public double getWavelength() {
        return wavelength;
    }

    public double getLogWavelength() {
        return logWavelength;
    }

    public Type getType() {
        return type;
    }

    @Override
    public String toString() {
        return "SpectralLine{" + "id=" + id + ", wavelength=" + wavelength + ", type=" + type + '}';
    }
}
