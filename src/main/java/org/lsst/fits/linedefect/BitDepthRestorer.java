package org.lsst.fits.linedefect;

/**
 * Unpacks samples delivered in a 16 bit container into their natural range.
 * The bit layouts are fixed by the camera firmware.
 *
 * @author tonyj
 */
public class BitDepthRestorer {

    private BitDepthRestorer() {
    }

    /**
     * Restore an image packed in 16 bit containers.
     *
     * @param image The packed image
     * @param effectiveBits The number of significant bits (8, 10, 12, 14 or 16)
     * @return The restored image, or the input itself when no unpacking is
     * required
     */
    public static SensorImage restore(SensorImage image, int effectiveBits) {
        if (image == null) {
            throw new InvalidInputException("Missing image");
        }
        if (effectiveBits != 10 && effectiveBits != 12 && effectiveBits != 14) {
            return image;
        }
        int[] in = image.pixels();
        int[] out = new int[in.length];
        for (int i = 0; i < in.length; i++) {
            out[i] = restore(in[i], effectiveBits);
        }
        return image.withPixels(effectiveBits, out);
    }

    /**
     * Restore a single packed sample.
     *
     * @param raw The 16 bit container value
     * @param effectiveBits The number of significant bits
     * @return The unpacked value
     */
    public static int restore(int raw, int effectiveBits) {
        switch (effectiveBits) {
            case 10:
                // high byte gives 8 bits, the low 2 bits are appended
                return ((raw & 0xff00) >> 6) | (raw & 0x3);
            case 12:
                return raw >> 4;
            case 14:
                // Integer division, not a shift
                return (((raw & 0xff00) >> 2) | (raw & 0x3f)) / 16;
            default:
                return raw;
        }
    }
}
