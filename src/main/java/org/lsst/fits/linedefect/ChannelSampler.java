package org.lsst.fits.linedefect;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Splits an image into its interleaved readout channels.
 *
 * @author tonyj
 */
public class ChannelSampler {

    private static final Logger LOG = Logger.getLogger(ChannelSampler.class.getName());

    private ChannelSampler() {
    }

    /**
     * Compute the sampling stride for a channel count.
     *
     * @param channelCount The number of channels
     * @return The stride, or 0 if channelCount is not a positive perfect square
     */
    public static int stride(int channelCount) {
        if (channelCount <= 0) {
            return 0;
        }
        int stride = (int) Math.sqrt(channelCount);
        return stride * stride == channelCount ? stride : 0;
    }

    /**
     * Decompose an image into channels, ordered by (yOffset, xOffset). Channels
     * which fall entirely outside a small image are returned but are empty.
     *
     * @param image The image to decompose
     * @param channelCount The number of channels, must be a perfect square
     * @return The channels, or an empty list if channelCount is not a perfect
     * square
     */
    public static List<Channel> decompose(SensorImage image, int channelCount) {
        int stride = stride(channelCount);
        if (stride == 0) {
            LOG.log(Level.WARNING, "Channel count {0} is not a perfect square, no channels produced", channelCount);
            return Collections.emptyList();
        }
        List<Channel> channels = new ArrayList<>(channelCount);
        for (int yOffset = 0; yOffset < stride; yOffset++) {
            for (int xOffset = 0; xOffset < stride; xOffset++) {
                channels.add(new Channel(image, channels.size(), stride, yOffset, xOffset));
            }
        }
        return channels;
    }
}
