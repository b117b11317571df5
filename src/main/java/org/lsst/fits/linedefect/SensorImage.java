package org.lsst.fits.linedefect;

import java.util.Arrays;

/**
 * A decoded sensor image: a row-major grid of unsigned samples together with
 * the bit depth the samples are declared to carry. Instances are never
 * modified once built, every transformation returns a fresh image.
 *
 * @author tonyj
 */
public class SensorImage {

    private final int width;
    private final int height;
    private final int bitDepth;
    private final int[] pixels;

    /**
     * Create a sensor image.
     *
     * @param width The number of columns
     * @param height The number of rows
     * @param bitDepth The declared bit depth of the samples
     * @param pixels The samples in row-major order, length must be
     * width*height. The array is not copied.
     * @throws InvalidInputException If the dimensions are not positive or do
     * not match the pixel buffer
     */
    public SensorImage(int width, int height, int bitDepth, int[] pixels) {
        if (pixels == null) {
            throw new InvalidInputException("Missing pixel data");
        }
        if (width <= 0 || height <= 0) {
            throw new InvalidInputException("Invalid image size " + width + "x" + height);
        }
        if ((long) width * height != pixels.length) {
            throw new InvalidInputException("Pixel buffer length " + pixels.length + " does not match " + width + "x" + height);
        }
        this.width = width;
        this.height = height;
        this.bitDepth = bitDepth;
        this.pixels = pixels;
    }

    /**
     * Build an image from a [row][column] array.
     *
     * @param data The sample grid, all rows must have the same length
     * @param bitDepth The declared bit depth
     * @return The image
     */
    public static SensorImage fromRows(int[][] data, int bitDepth) {
        if (data == null || data.length == 0 || data[0] == null || data[0].length == 0) {
            throw new InvalidInputException("Empty image");
        }
        int h = data.length;
        int w = data[0].length;
        int[] pixels = new int[w * h];
        for (int y = 0; y < h; y++) {
            if (data[y] == null || data[y].length != w) {
                throw new InvalidInputException("Ragged image at row " + y);
            }
            System.arraycopy(data[y], 0, pixels, y * w, w);
        }
        return new SensorImage(w, h, bitDepth, pixels);
    }

    public int getWidth() {
        return width;
    }

    public int getHeight() {
        return height;
    }

    public int getBitDepth() {
        return bitDepth;
    }

    public int get(int x, int y) {
        return pixels[x + y * width];
    }

    int[] pixels() {
        return pixels;
    }

    /**
     * Cut out a rectangular region of interest.
     *
     * @param x The first column
     * @param y The first row
     * @param w The region width
     * @param h The region height
     * @return A new image holding a copy of the region
     */
    public SensorImage crop(int x, int y, int w, int h) {
        if (x < 0 || y < 0 || w <= 0 || h <= 0 || x + w > width || y + h > height) {
            throw new InvalidInputException(String.format("Region [%d,%d %dx%d] outside image %dx%d", x, y, w, h, width, height));
        }
        int[] region = new int[w * h];
        for (int row = 0; row < h; row++) {
            System.arraycopy(pixels, x + (y + row) * width, region, row * w, w);
        }
        return new SensorImage(w, h, bitDepth, region);
    }

    SensorImage withPixels(int newBitDepth, int[] newPixels) {
        return new SensorImage(width, height, newBitDepth, newPixels);
    }

    @Override
    public String toString() {
        return "SensorImage{" + "width=" + width + ", height=" + height + ", bitDepth=" + bitDepth + '}';
    }

    @Override
    public int hashCode() {
        int hash = 7;
        hash = 41 * hash + width;
        hash = 41 * hash + height;
        hash = 41 * hash + bitDepth;
        hash = 41 * hash + Arrays.hashCode(pixels);
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
        final SensorImage other = (SensorImage) obj;
        return width == other.width && height == other.height && bitDepth == other.bitDepth
                && Arrays.equals(pixels, other.pixels);
    }
}
