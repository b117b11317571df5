package org.lsst.fits.linedefect;

/**
 * Full image line profiles: per-row values of length image height and
 * per-column values of length image width. Profiles are immutable, each
 * getter returns a copy.
 *
 * @author tonyj
 */
public class LineProfiles {

    private final float[] rowDiff;
    private final float[] rowAvg;
    private final float[] colDiff;
    private final float[] colAvg;

    LineProfiles(float[] rowDiff, float[] rowAvg, float[] colDiff, float[] colAvg) {
        this.rowDiff = rowDiff;
        this.rowAvg = rowAvg;
        this.colDiff = colDiff;
        this.colAvg = colAvg;
    }

    public float[] getRowDiff() {
        return rowDiff.clone();
    }

    public float[] getRowAvg() {
        return rowAvg.clone();
    }

    public float[] getColDiff() {
        return colDiff.clone();
    }

    public float[] getColAvg() {
        return colAvg.clone();
    }

    @Override
    public String toString() {
        return "LineProfiles{" + "rows=" + rowDiff.length + ", columns=" + colDiff.length + '}';
    }
}
