package org.lsst.fits.linedefect;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertTrue;
import static org.junit.Assert.fail;
import java.util.Properties;
import org.junit.Test;

/**
 *
 * @author tonyj
 */
public class InspectionConfigTest {

    @Test
    public void testDefaults() {
        InspectionConfig config = InspectionConfig.defaults();
        assertEquals(InspectionConfig.builder().build(), config);
        assertEquals(16, config.getEffectiveBits());
        assertEquals(4, config.getChannelCount());
        assertTrue(config.isUseRobust());
        assertEquals(20.0, config.getThreshGlobalH(), 0);
        assertEquals(10.0, config.getThreshPartV(), 0);
        assertEquals(10, config.getBlockQty());
    }

    @Test
    public void testFromProperties() {
        Properties props = new Properties();
        props.setProperty(InspectionConfig.EFFECTIVE_BITS, "12");
        props.setProperty(InspectionConfig.CHANNEL_COUNT, "16");
        props.setProperty(InspectionConfig.USE_ROBUST, "0");
        props.setProperty(InspectionConfig.EDGE_GAIN, " 0.5 ");
        props.setProperty(InspectionConfig.STRIP_V, "12");
        InspectionConfig config = InspectionConfig.fromProperties(props);
        assertEquals(12, config.getEffectiveBits());
        assertEquals(16, config.getChannelCount());
        assertFalse(config.isUseRobust());
        assertEquals(0.5, config.getEdgeGain(), 0);
        assertEquals(12, config.getStripV());
        assertEquals(0, config.getStripH());
        assertEquals(config, InspectionConfig.fromProperties(config.toProperties()));
    }

    @Test
    public void testMalformedValue() {
        Properties props = new Properties();
        props.setProperty(InspectionConfig.BLOCK_QTY, "ten");
        try {
            InspectionConfig.fromProperties(props);
            fail("should not reach here");
        } catch (IllegalArgumentException x) {
            assertTrue(x.getMessage().contains(InspectionConfig.BLOCK_QTY));
        }
    }

    @Test(expected = IllegalArgumentException.class)
    public void testUnsupportedBits() {
        InspectionConfig.builder().effectiveBits(11).build();
    }

    @Test(expected = IllegalArgumentException.class)
    public void testNonPositiveEdgeGain() {
        InspectionConfig.builder().edgeGain(0).build();
    }

    @Test(expected = IllegalArgumentException.class)
    public void testNegativeBlockQty() {
        InspectionConfig.builder().blockQty(-1).build();
    }

    @Test(expected = IllegalArgumentException.class)
    public void testNaNThreshold() {
        InspectionConfig.builder().threshPartH(Double.NaN).build();
    }

    @Test
    public void testNonSquareChannelCountAccepted() {
        assertEquals(3, InspectionConfig.builder().channelCount(3).build().getChannelCount());
    }
}
