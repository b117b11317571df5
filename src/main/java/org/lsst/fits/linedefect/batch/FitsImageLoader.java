package org.lsst.fits.linedefect.batch;

import java.io.IOException;
import java.nio.file.Path;
import java.util.logging.Level;
import java.util.logging.Logger;
import nom.tam.fits.BasicHDU;
import nom.tam.fits.Fits;
import nom.tam.fits.FitsException;
import nom.tam.fits.FitsFactory;
import nom.tam.fits.Header;
import nom.tam.fits.ImageHDU;
import org.lsst.fits.linedefect.SensorImage;

/**
 * Reads the first two dimensional image found in a FITS file and converts it
 * to unsigned sensor samples.
 *
 * @author tonyj
 */
public class FitsImageLoader {

    private static final Logger LOG = Logger.getLogger(FitsImageLoader.class.getName());

    static {
        FitsFactory.setUseHierarch(true);
    }

    /**
     * Load an image.
     *
     * @param path The FITS file
     * @return The decoded image
     * @throws IOException If the file cannot be read, or contains no usable
     * image
     */
    public SensorImage load(Path path) throws IOException {
        try (Fits fits = new Fits(path.toFile())) {
            for (;;) {
                BasicHDU<?> hdu = fits.readHDU();
                if (hdu == null) {
                    throw new IOException("No 2D image found in " + path);
                }
                if (!(hdu instanceof ImageHDU)) {
                    continue;
                }
                int[] axes = hdu.getAxes();
                Object kernel = hdu.getKernel();
                if (axes == null || axes.length != 2 || kernel == null) {
                    LOG.log(Level.FINE, "Skipping HDU with axes {0} in {1}", new Object[]{axes == null ? 0 : axes.length, path});
                    continue;
                }
                return toSensorImage(kernel, hdu.getHeader(), path);
            }
        } catch (FitsException x) {
            throw new IOException("Error reading FITS file " + path, x);
        }
    }

    private static SensorImage toSensorImage(Object kernel, Header header, Path path) throws IOException {
        double bzero = header.getDoubleValue("BZERO", 0.0);
        int[] clamped = new int[1];
        SensorImage image;
        if (kernel instanceof byte[][]) {
            byte[][] data = (byte[][]) kernel;
            int[][] values = new int[data.length][];
            for (int y = 0; y < data.length; y++) {
                values[y] = new int[data[y].length];
                for (int x = 0; x < data[y].length; x++) {
                    values[y][x] = data[y][x] & 0xff;
                }
            }
            image = SensorImage.fromRows(values, 8);
        } else if (kernel instanceof short[][]) {
            short[][] data = (short[][]) kernel;
            int[][] values = new int[data.length][];
            for (int y = 0; y < data.length; y++) {
                values[y] = new int[data[y].length];
                for (int x = 0; x < data[y].length; x++) {
                    values[y][x] = unsigned(data[y][x] + bzero, clamped);
                }
            }
            image = SensorImage.fromRows(values, 16);
        } else if (kernel instanceof int[][]) {
            int[][] data = (int[][]) kernel;
            int[][] values = new int[data.length][];
            for (int y = 0; y < data.length; y++) {
                values[y] = new int[data[y].length];
                for (int x = 0; x < data[y].length; x++) {
                    values[y][x] = unsigned(data[y][x] + bzero, clamped);
                }
            }
            image = SensorImage.fromRows(values, 32);
        } else {
            throw new IOException("Unsupported pixel type " + kernel.getClass().getSimpleName() + " in " + path);
        }
        if (clamped[0] > 0) {
            LOG.log(Level.WARNING, "{0} negative samples clamped to 0 in {1}", new Object[]{clamped[0], path});
        }
        return image;
    }

    /**
     * Physical values below zero are clamped to 0, values above the int range
     * saturate.
     */
    private static int unsigned(double physical, int[] clamped) {
        if (physical < 0) {
            clamped[0]++;
            return 0;
        }
        return (int) Math.min(Math.round(physical), Integer.MAX_VALUE);
    }
}
