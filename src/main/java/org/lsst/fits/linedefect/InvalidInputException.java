package org.lsst.fits.linedefect;

/**
 * Thrown when the image handed to the inspector cannot be inspected at all.
 *
 * @author tonyj
 */
public class InvalidInputException extends IllegalArgumentException {

    private static final long serialVersionUID = 1L;

    public InvalidInputException(String message) {
        super(message);
    }
}
