package org.lsst.fits.linedefect.batch;

import java.io.File;
import java.io.IOException;
import nom.tam.fits.Fits;
import nom.tam.fits.FitsException;
import nom.tam.util.BufferedFile;

/**
 * Writes small FITS images for tests.
 *
 * @author tonyj
 */
class FitsTestFiles {

    private FitsTestFiles() {
    }

    static File write(File file, Object data) throws IOException, FitsException {
        Fits fits = new Fits();
        fits.addHDU(Fits.makeHDU(data));
        BufferedFile bf = new BufferedFile(file, "rw");
        try {
            fits.write(bf);
        } finally {
            bf.close();
        }
        return file;
    }

    static int[][] brightRow(int width, int height, int row) {
        int[][] data = new int[height][width];
        for (int y = 0; y < height; y++) {
            for (int x = 0; x < width; x++) {
                data[y][x] = y == row ? 255 : 50;
            }
        }
        return data;
    }
}
