package org.lsst.fits.linedefect;

import java.util.Objects;

/**
 * A single line defect. The index is in full image coordinates: a row number
 * for horizontal defects, a column number for vertical ones.
 *
 * @author tonyj
 */
public class Defect {

    private final int channel;
    private final Orientation orientation;
    private final DetectionMode mode;
    private final int index;
    private final float diff;

    public Defect(int channel, Orientation orientation, DetectionMode mode, int index, float diff) {
        this.channel = channel;
        this.orientation = Objects.requireNonNull(orientation);
        this.mode = Objects.requireNonNull(mode);
        this.index = index;
        this.diff = diff;
    }

    public int getChannel() {
        return channel;
    }

    public Orientation getOrientation() {
        return orientation;
    }

    public DetectionMode getMode() {
        return mode;
    }

    public int getIndex() {
        return index;
    }

    public float getDiff() {
        return diff;
    }

    public boolean isGlobal() {
        return mode.isGlobal();
    }

    LineKey key() {
        return new LineKey(orientation, index);
    }

    @Override
    public String toString() {
        return "Defect{" + "channel=" + channel + ", orientation=" + orientation + ", mode=" + mode + ", index=" + index + ", diff=" + diff + '}';
    }

    @Override
    public int hashCode() {
        int hash = 5;
        hash = 67 * hash + channel;
        hash = 67 * hash + Objects.hashCode(this.orientation);
        hash = 67 * hash + Objects.hashCode(this.mode);
        hash = 67 * hash + index;
        hash = 67 * hash + Float.floatToIntBits(this.diff);
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
        final Defect other = (Defect) obj;
        return channel == other.channel
                && index == other.index
                && Float.floatToIntBits(diff) == Float.floatToIntBits(other.diff)
                && orientation == other.orientation
                && Objects.equals(mode, other.mode);
    }
}
