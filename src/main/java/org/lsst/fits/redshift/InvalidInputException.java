package org.lsst.fits.redshift;

/**
 * Thrown when arrays handed to the pipeline are structurally unusable, for
 * example parallel arrays of different lengths or a grid with fewer than two
 * points. Always raised before any buffer has been modified.
 */
public class InvalidInputException extends IllegalArgumentException {

    private static final long serialVersionUID = 1L;

    public InvalidInputException(String message) {
        super(message);
    }

    public InvalidInputException(String message, Throwable cause) {
        super(message, cause);
    }
}
