package org.lsst.fits.linedefect;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertTrue;
import java.util.List;
import org.junit.Test;

/**
 *
 * @author tonyj
 */
public class ChannelSamplerTest {

    private static SensorImage sequential(int width, int height) {
        int[] pixels = new int[width * height];
        for (int i = 0; i < pixels.length; i++) {
            pixels[i] = i;
        }
        return new SensorImage(width, height, 16, pixels);
    }

    @Test
    public void testStride() {
        assertEquals(1, ChannelSampler.stride(1));
        assertEquals(2, ChannelSampler.stride(4));
        assertEquals(4, ChannelSampler.stride(16));
        assertEquals(8, ChannelSampler.stride(64));
        assertEquals(0, ChannelSampler.stride(5));
        assertEquals(0, ChannelSampler.stride(0));
    }

    @Test
    public void testChannelsPartitionImage() {
        SensorImage image = sequential(5, 3);
        List<Channel> channels = ChannelSampler.decompose(image, 4);
        assertEquals(4, channels.size());

        Channel first = channels.get(0);
        assertEquals(3, first.getWidth());
        assertEquals(2, first.getHeight());
        Channel last = channels.get(3);
        assertEquals(1, last.getYOffset());
        assertEquals(1, last.getXOffset());
        assertEquals(2, last.getWidth());
        assertEquals(1, last.getHeight());
        assertEquals(image.get(3, 1), last.get(1, 0));

        int total = 0;
        boolean[] seen = new boolean[15];
        for (Channel channel : channels) {
            for (int y = 0; y < channel.getHeight(); y++) {
                for (int x = 0; x < channel.getWidth(); x++) {
                    int value = channel.get(x, y);
                    assertFalse(seen[value]);
                    seen[value] = true;
                    total++;
                }
            }
        }
        assertEquals(15, total);
    }

    @Test
    public void testGlobalIndex() {
        Channel channel = ChannelSampler.decompose(sequential(16, 16), 16).get(6);
        assertEquals(1, channel.getYOffset());
        assertEquals(2, channel.getXOffset());
        assertEquals(13, channel.globalRow(3));
        assertEquals(14, channel.globalColumn(3));
    }

    @Test
    public void testEmptyChannelsOnSmallImage() {
        List<Channel> channels = ChannelSampler.decompose(sequential(1, 1), 16);
        assertEquals(16, channels.size());
        assertFalse(channels.get(0).isEmpty());
        long empty = channels.stream().filter(Channel::isEmpty).count();
        assertEquals(15, empty);
    }

    @Test
    public void testNonSquareCount() {
        assertTrue(ChannelSampler.decompose(sequential(4, 4), 3).isEmpty());
    }
}
