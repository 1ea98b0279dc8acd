package org.lsst.fits.redshift;

/**
 * A fitted redshift from one peak of one template's correlation curve.
 */
public class RedshiftCandidate {

    private final String templateId;
    private final double redshift;
    private final double value;

    /**
     * @param templateId The template that produced the peak
     * @param redshift The fitted redshift
     * @param value The normalised correlation strength of the peak
     */
    public RedshiftCandidate(String templateId, double redshift, double value) {
        this.templateId = templateId;
        this.redshift = redshift;
        this.value = value;
    }

    public String getTemplateId() {
        return templateId;
    }

    public double getRedshift() {
        return redshift;
    }

    public double getValue() {
        return value;
    }

    @Override
    public String toString() {
        return "RedshiftCandidate{" + "templateId=" + templateId + ", redshift=" + redshift + ", value=" + value + '}';
    }
}
