package org.lsst.fits.linedefect;

import java.io.IOException;
import java.io.InputStream;
import java.io.UncheckedIOException;
import java.util.Objects;
import java.util.Properties;

/**
 * The options controlling a line defect inspection. Instances are immutable
 * and are validated when built, so the engine never sees an inconsistent
 * configuration.
 *
 * @author tonyj
 */
public class InspectionConfig {

    public static final String EFFECTIVE_BITS = "effective_bits";
    public static final String CHANNEL_COUNT = "channel_count";
    public static final String USE_ROBUST = "use_robust";
    public static final String EDGE_GAIN = "edge_gain";
    public static final String THRESH_GLOBAL_H = "thresh_global_h";
    public static final String THRESH_GLOBAL_V = "thresh_global_v";
    public static final String THRESH_PART_H = "thresh_part_h";
    public static final String THRESH_PART_V = "thresh_part_v";
    public static final String BLOCK_QTY = "block_qty";
    public static final String STRIP_H = "strip_h";
    public static final String STRIP_V = "strip_v";

    private static final String DEFAULTS_RESOURCE = "default-inspection.properties";

    private final int effectiveBits;
    private final int channelCount;
    private final boolean useRobust;
    private final double edgeGain;
    private final double threshGlobalH;
    private final double threshGlobalV;
    private final double threshPartH;
    private final double threshPartV;
    private final int blockQty;
    private final int stripH;
    private final int stripV;

    private InspectionConfig(Builder builder) {
        this.effectiveBits = builder.effectiveBits;
        this.channelCount = builder.channelCount;
        this.useRobust = builder.useRobust;
        this.edgeGain = builder.edgeGain;
        this.threshGlobalH = builder.threshGlobalH;
        this.threshGlobalV = builder.threshGlobalV;
        this.threshPartH = builder.threshPartH;
        this.threshPartV = builder.threshPartV;
        this.blockQty = builder.blockQty;
        this.stripH = builder.stripH;
        this.stripV = builder.stripV;
    }

    public static Builder builder() {
        return new Builder();
    }

    /**
     * Load the configuration bundled with the inspector.
     *
     * @return The default configuration
     */
    public static InspectionConfig defaults() {
        try (InputStream in = InspectionConfig.class.getResourceAsStream(DEFAULTS_RESOURCE)) {
            if (in == null) {
                throw new IllegalStateException("Missing resource " + DEFAULTS_RESOURCE);
            }
            Properties props = new Properties();
            props.load(in);
            return fromProperties(props);
        } catch (IOException x) {
            throw new UncheckedIOException("Error reading " + DEFAULTS_RESOURCE, x);
        }
    }

    /**
     * Build a configuration from properties. Keys which are absent keep their
     * built in default.
     *
     * @param props The properties to read
     * @return The validated configuration
     * @throws IllegalArgumentException If a value cannot be parsed or is out
     * of range
     */
    public static InspectionConfig fromProperties(Properties props) {
        Builder builder = builder();
        String value;
        if ((value = props.getProperty(EFFECTIVE_BITS)) != null) {
            builder.effectiveBits(parseInt(EFFECTIVE_BITS, value));
        }
        if ((value = props.getProperty(CHANNEL_COUNT)) != null) {
            builder.channelCount(parseInt(CHANNEL_COUNT, value));
        }
        if ((value = props.getProperty(USE_ROBUST)) != null) {
            builder.useRobust(parseBoolean(USE_ROBUST, value));
        }
        if ((value = props.getProperty(EDGE_GAIN)) != null) {
            builder.edgeGain(parseDouble(EDGE_GAIN, value));
        }
        if ((value = props.getProperty(THRESH_GLOBAL_H)) != null) {
            builder.threshGlobalH(parseDouble(THRESH_GLOBAL_H, value));
        }
        if ((value = props.getProperty(THRESH_GLOBAL_V)) != null) {
            builder.threshGlobalV(parseDouble(THRESH_GLOBAL_V, value));
        }
        if ((value = props.getProperty(THRESH_PART_H)) != null) {
            builder.threshPartH(parseDouble(THRESH_PART_H, value));
        }
        if ((value = props.getProperty(THRESH_PART_V)) != null) {
            builder.threshPartV(parseDouble(THRESH_PART_V, value));
        }
        if ((value = props.getProperty(BLOCK_QTY)) != null) {
            builder.blockQty(parseInt(BLOCK_QTY, value));
        }
        if ((value = props.getProperty(STRIP_H)) != null) {
            builder.stripH(parseInt(STRIP_H, value));
        }
        if ((value = props.getProperty(STRIP_V)) != null) {
            builder.stripV(parseInt(STRIP_V, value));
        }
        return builder.build();
    }

    private static int parseInt(String key, String value) {
        try {
            return Integer.parseInt(value.trim());
        } catch (NumberFormatException x) {
            throw new IllegalArgumentException("Invalid value for " + key + ": " + value, x);
        }
    }

    private static double parseDouble(String key, String value) {
        try {
            return Double.parseDouble(value.trim());
        } catch (NumberFormatException x) {
            throw new IllegalArgumentException("Invalid value for " + key + ": " + value, x);
        }
    }

    private static boolean parseBoolean(String key, String value) {
        String v = value.trim();
        if ("true".equalsIgnoreCase(v) || "1".equals(v)) {
            return true;
        } else if ("false".equalsIgnoreCase(v) || "0".equals(v)) {
            return false;
        }
        throw new IllegalArgumentException("Invalid value for " + key + ": " + value);
    }

    public Properties toProperties() {
        Properties props = new Properties();
        props.setProperty(EFFECTIVE_BITS, String.valueOf(effectiveBits));
        props.setProperty(CHANNEL_COUNT, String.valueOf(channelCount));
        props.setProperty(USE_ROBUST, String.valueOf(useRobust));
        props.setProperty(EDGE_GAIN, String.valueOf(edgeGain));
        props.setProperty(THRESH_GLOBAL_H, String.valueOf(threshGlobalH));
        props.setProperty(THRESH_GLOBAL_V, String.valueOf(threshGlobalV));
        props.setProperty(THRESH_PART_H, String.valueOf(threshPartH));
        props.setProperty(THRESH_PART_V, String.valueOf(threshPartV));
        props.setProperty(BLOCK_QTY, String.valueOf(blockQty));
        props.setProperty(STRIP_H, String.valueOf(stripH));
        props.setProperty(STRIP_V, String.valueOf(stripV));
        return props;
    }

    public int getEffectiveBits() {
        return effectiveBits;
    }

    public int getChannelCount() {
        return channelCount;
    }

    public boolean isUseRobust() {
        return useRobust;
    }

    public double getEdgeGain() {
        return edgeGain;
    }

    public double getThreshGlobalH() {
        return threshGlobalH;
    }

    public double getThreshGlobalV() {
        return threshGlobalV;
    }

    public double getThreshPartH() {
        return threshPartH;
    }

    public double getThreshPartV() {
        return threshPartV;
    }

    public int getBlockQty() {
        return blockQty;
    }

    public int getStripH() {
        return stripH;
    }

    public int getStripV() {
        return stripV;
    }

    public Builder toBuilder() {
        return builder()
                .effectiveBits(effectiveBits)
                .channelCount(channelCount)
                .useRobust(useRobust)
                .edgeGain(edgeGain)
                .threshGlobalH(threshGlobalH)
                .threshGlobalV(threshGlobalV)
                .threshPartH(threshPartH)
                .threshPartV(threshPartV)
                .blockQty(blockQty)
                .stripH(stripH)
                .stripV(stripV);
    }

    @Override
    public String toString() {
        return "InspectionConfig{" + "effectiveBits=" + effectiveBits + ", channelCount=" + channelCount + ", useRobust=" + useRobust
                + ", edgeGain=" + edgeGain + ", threshGlobalH=" + threshGlobalH + ", threshGlobalV=" + threshGlobalV
                + ", threshPartH=" + threshPartH + ", threshPartV=" + threshPartV + ", blockQty=" + blockQty
                + ", stripH=" + stripH + ", stripV=" + stripV + '}';
    }

    @Override
    public int hashCode() {
        return Objects.hash(effectiveBits, channelCount, useRobust, edgeGain, threshGlobalH, threshGlobalV,
                threshPartH, threshPartV, blockQty, stripH, stripV);
    }

    @Override
    public boolean equals(Object obj) {
        if (this == obj) {
            return true;
        }
        if (obj == null || getClass() != obj.getClass()) {
            return false;
        }
        final InspectionConfig other = (InspectionConfig) obj;
        return effectiveBits == other.effectiveBits
                && channelCount == other.channelCount
                && useRobust == other.useRobust
                && Double.compare(edgeGain, other.edgeGain) == 0
                && Double.compare(threshGlobalH, other.threshGlobalH) == 0
                && Double.compare(threshGlobalV, other.threshGlobalV) == 0
                && Double.compare(threshPartH, other.threshPartH) == 0
                && Double.compare(threshPartV, other.threshPartV) == 0
                && blockQty == other.blockQty
                && stripH == other.stripH
                && stripV == other.stripV;
    }

    public static class Builder {

        private int effectiveBits = 16;
        private int channelCount = 4;
        private boolean useRobust = true;
        private double edgeGain = 1.0;
        private double threshGlobalH = 20;
        private double threshGlobalV = 20;
        private double threshPartH = 10;
        private double threshPartV = 10;
        private int blockQty = 10;
        private int stripH = 0;
        private int stripV = 0;

        private Builder() {
        }

        public Builder effectiveBits(int effectiveBits) {
            this.effectiveBits = effectiveBits;
            return this;
        }

        public Builder channelCount(int channelCount) {
            this.channelCount = channelCount;
            return this;
        }

        public Builder useRobust(boolean useRobust) {
            this.useRobust = useRobust;
            return this;
        }

        public Builder edgeGain(double edgeGain) {
            this.edgeGain = edgeGain;
            return this;
        }

        public Builder threshGlobalH(double threshGlobalH) {
            this.threshGlobalH = threshGlobalH;
            return this;
        }

        public Builder threshGlobalV(double threshGlobalV) {
            this.threshGlobalV = threshGlobalV;
            return this;
        }

        public Builder threshPartH(double threshPartH) {
            this.threshPartH = threshPartH;
            return this;
        }

        public Builder threshPartV(double threshPartV) {
            this.threshPartV = threshPartV;
            return this;
        }

        public Builder blockQty(int blockQty) {
            this.blockQty = blockQty;
            return this;
        }

        public Builder stripH(int stripH) {
            this.stripH = stripH;
            return this;
        }

        public Builder stripV(int stripV) {
            this.stripV = stripV;
            return this;
        }

        public InspectionConfig build() {
            switch (effectiveBits) {
                case 8:
                case 10:
                case 12:
                case 14:
                case 16:
                    break;
                default:
                    throw new IllegalArgumentException("Unsupported " + EFFECTIVE_BITS + ": " + effectiveBits);
            }
            if (channelCount <= 0) {
                throw new IllegalArgumentException(CHANNEL_COUNT + " must be positive: " + channelCount);
            }
            if (!(edgeGain > 0) || Double.isInfinite(edgeGain)) {
                throw new IllegalArgumentException(EDGE_GAIN + " must be positive: " + edgeGain);
            }
            checkThreshold(THRESH_GLOBAL_H, threshGlobalH);
            checkThreshold(THRESH_GLOBAL_V, threshGlobalV);
            checkThreshold(THRESH_PART_H, threshPartH);
            checkThreshold(THRESH_PART_V, threshPartV);
            if (blockQty < 0) {
                throw new IllegalArgumentException(BLOCK_QTY + " must not be negative: " + blockQty);
            }
            if (stripH < 0 || stripV < 0) {
                throw new IllegalArgumentException("Strip widths must not be negative: " + stripH + "," + stripV);
            }
            return new InspectionConfig(this);
        }

        private static void checkThreshold(String key, double value) {
            if (!(value >= 0) || Double.isInfinite(value)) {
                throw new IllegalArgumentException(key + " must be a non-negative number: " + value);
            }
        }
    }
}
