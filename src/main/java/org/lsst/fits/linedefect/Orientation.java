package org.lsst.fits.linedefect;

/**
 * Direction of a line defect. A horizontal defect is a bad row, a vertical
 * defect a bad column.
 *
 * @author tonyj
 */
public enum Orientation {
    HORIZONTAL("Horizontal"), VERTICAL("Vertical");

    private final String label;

    Orientation(String label) {
        this.label = label;
    }

    @Override
    public String toString() {
        return label;
    }
}
