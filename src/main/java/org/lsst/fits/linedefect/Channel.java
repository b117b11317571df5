package org.lsst.fits.linedefect;

/**
 * One interleaved sub-grid of a sensor image, formed by taking every
 * stride'th pixel starting at (yOffset, xOffset). The channel is a view, no
 * pixel data is copied.
 *
 * @author tonyj
 */
public class Channel {

    private final SensorImage image;
    private final int index;
    private final int stride;
    private final int yOffset;
    private final int xOffset;
    private final int width;
    private final int height;

    Channel(SensorImage image, int index, int stride, int yOffset, int xOffset) {
        this.image = image;
        this.index = index;
        this.stride = stride;
        this.yOffset = yOffset;
        this.xOffset = xOffset;
        this.width = sampledLength(image.getWidth(), stride, xOffset);
        this.height = sampledLength(image.getHeight(), stride, yOffset);
    }

    private static int sampledLength(int length, int stride, int offset) {
        return offset >= length ? 0 : (length - offset + stride - 1) / stride;
    }

    public int getIndex() {
        return index;
    }

    public int getStride() {
        return stride;
    }

    public int getYOffset() {
        return yOffset;
    }

    public int getXOffset() {
        return xOffset;
    }

    public int getWidth() {
        return width;
    }

    public int getHeight() {
        return height;
    }

    public boolean isEmpty() {
        return width == 0 || height == 0;
    }

    /**
     * Get a pixel using channel-local coordinates
     */
    public int get(int x, int y) {
        return image.get(x * stride + xOffset, y * stride + yOffset);
    }

    public int globalRow(int localRow) {
        return localRow * stride + yOffset;
    }

    public int globalColumn(int localColumn) {
        return localColumn * stride + xOffset;
    }

    /**
     * Mean of each channel row over the columns [x0,x1) for rows [y0,y1).
     */
    float[] rowAverages(int y0, int y1, int x0, int x1) {
        float[] result = new float[y1 - y0];
        int n = x1 - x0;
        for (int y = y0; y < y1; y++) {
            long sum = 0;
            for (int x = x0; x < x1; x++) {
                sum += get(x, y);
            }
            result[y - y0] = (float) ((double) sum / n);
        }
        return result;
    }

    /**
     * Mean of each channel column over the rows [y0,y1) for columns [x0,x1).
     */
    float[] columnAverages(int y0, int y1, int x0, int x1) {
        float[] result = new float[x1 - x0];
        int n = y1 - y0;
        long[] sums = new long[x1 - x0];
        for (int y = y0; y < y1; y++) {
            for (int x = x0; x < x1; x++) {
                sums[x - x0] += get(x, y);
            }
        }
        for (int i = 0; i < sums.length; i++) {
            result[i] = (float) ((double) sums[i] / n);
        }
        return result;
    }

    float[] rowAverages() {
        return rowAverages(0, height, 0, width);
    }

    float[] columnAverages() {
        return columnAverages(0, height, 0, width);
    }

    @Override
    public String toString() {
        return "Channel{" + "index=" + index + ", yOffset=" + yOffset + ", xOffset=" + xOffset + ", size=" + width + "x" + height + '}';
    }
}
