package org.lsst.fits.linedefect;

import java.util.Objects;

/**
 * Identifies a line of the full image: its orientation and index.
 *
 * @author tonyj
 */
class LineKey {

    private final Orientation orientation;
    private final int index;

    LineKey(Orientation orientation, int index) {
        this.orientation = orientation;
        this.index = index;
    }

    @Override
    public int hashCode() {
        int hash = 7;
        hash = 19 * hash + Objects.hashCode(this.orientation);
        hash = 19 * hash + index;
        return hash;
    }

    @Override
    public boolean equals(Object obj) {
        if (this == obj) {
            return true;
        }
        if (obj == null || getClass() != obj.getClass()) {
            return false;
        }
        final LineKey other = (LineKey) obj;
        return orientation == other.orientation && index == other.index;
    }

    @Override
    public String toString() {
        return orientation + "[" + index + "]";
    }
}
