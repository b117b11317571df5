package org.lsst.fits.linedefect.batch;

import static org.junit.Assert.assertEquals;
import java.io.File;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import nom.tam.fits.FitsException;
import org.junit.Rule;
import org.junit.Test;
import org.junit.rules.TemporaryFolder;
import org.lsst.fits.linedefect.SensorImage;

/**
 *
 * @author tonyj
 */
public class FitsImageLoaderTest {

    @Rule
    public TemporaryFolder folder = new TemporaryFolder();

    private final FitsImageLoader loader = new FitsImageLoader();

    @Test
    public void testIntImage() throws IOException, FitsException {
        File file = FitsTestFiles.write(folder.newFile("int.fits"), FitsTestFiles.brightRow(20, 10, 3));
        SensorImage image = loader.load(file.toPath());
        assertEquals(20, image.getWidth());
        assertEquals(10, image.getHeight());
        assertEquals(255, image.get(7, 3));
        assertEquals(50, image.get(7, 4));
    }

    @Test
    public void testByteImageIsUnsigned() throws IOException, FitsException {
        byte[][] data = new byte[4][6];
        data[2][5] = (byte) 200;
        File file = FitsTestFiles.write(folder.newFile("byte.fits"), data);
        SensorImage image = loader.load(file.toPath());
        assertEquals(8, image.getBitDepth());
        assertEquals(200, image.get(5, 2));
        assertEquals(0, image.get(0, 0));
    }

    @Test(expected = IOException.class)
    public void testNotFits() throws IOException {
        File file = folder.newFile("text.fits");
        Files.write(file.toPath(), "this is not a fits file".getBytes(StandardCharsets.US_ASCII));
        loader.load(file.toPath());
    }

    @Test
    public void testSignedShortNegativesClamped() throws IOException, FitsException {
        short[][] data = new short[4][6];
        data[1][2] = -5;
        data[3][4] = 1000;
        File file = FitsTestFiles.write(folder.newFile("short.fits"), data);
        SensorImage image = loader.load(file.toPath());
        assertEquals(16, image.getBitDepth());
        assertEquals(0, image.get(2, 1));
        assertEquals(1000, image.get(4, 3));
    }

    @Test
    public void testNegativeIntClamped() throws IOException, FitsException {
        int[][] data = FitsTestFiles.brightRow(8, 4, 2);
        data[0][0] = -70000;
        File file = FitsTestFiles.write(folder.newFile("negative.fits"), data);
        SensorImage image = loader.load(file.toPath());
        assertEquals(0, image.get(0, 0));
        assertEquals(255, image.get(0, 2));
    }
}
