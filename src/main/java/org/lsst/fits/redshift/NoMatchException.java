package org.lsst.fits.redshift;

/**
 * Thrown when no correlation maximum can be located for a template, so no
 * redshift can be fitted.
 */
public class NoMatchException extends Exception {

    private static final long serialVersionUID = 1L;
    private final String templateId;

    public NoMatchException(String templateId, String message) {
        super(message);
        this.templateId = templateId;
    }

    public String getTemplateId() {
        return templateId;
    }
}
