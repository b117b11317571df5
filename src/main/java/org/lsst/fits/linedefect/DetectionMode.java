package org.lsst.fits.linedefect;

/**
 * How a defect was detected: either over the profile of a whole channel
 * (global) or within one spatial block of a channel (part).
 *
 * @author tonyj
 */
public final class DetectionMode implements Comparable<DetectionMode> {

    public static final DetectionMode GLOBAL = new DetectionMode(-1, -1);

    private final int blockY;
    private final int blockX;

    private DetectionMode(int blockY, int blockX) {
        this.blockY = blockY;
        this.blockX = blockX;
    }

    /**
     * The mode for a defect detected within block (by, bx) of a channel.
     */
    public static DetectionMode part(int blockY, int blockX) {
        if (blockY < 0 || blockX < 0) {
            throw new IllegalArgumentException("Invalid block (" + blockY + "," + blockX + ")");
        }
        return new DetectionMode(blockY, blockX);
    }

    public boolean isGlobal() {
        return blockY < 0;
    }

    /**
     * @return The block row, or -1 for global detection
     */
    public int getBlockY() {
        return blockY;
    }

    /**
     * @return The block column, or -1 for global detection
     */
    public int getBlockX() {
        return blockX;
    }

    /**
     * Global sorts before any block, blocks sort by row then column.
     */
    @Override
    public int compareTo(DetectionMode o) {
        int c = Integer.compare(blockY, o.blockY);
        return c != 0 ? c : Integer.compare(blockX, o.blockX);
    }

    @Override
    public String toString() {
        return isGlobal() ? "Global" : "Part(" + blockY + "," + blockX + ")";
    }

    @Override
    public int hashCode() {
        int hash = 3;
        hash = 53 * hash + blockY;
        hash = 53 * hash + blockX;
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
        final DetectionMode other = (DetectionMode) obj;
        return blockY == other.blockY && blockX == other.blockX;
    }
}
