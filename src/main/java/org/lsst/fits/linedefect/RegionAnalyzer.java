package org.lsst.fits.linedefect;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.logging.Level;
import java.util.logging.Logger;
import java.util.stream.Collectors;

/**
 * Applies the diff kernel to every channel of an image, both over the whole
 * channel (global mode) and within a grid of spatial blocks (part mode), and
 * combines the per-channel profiles into full image profiles.
 * <p>
 * Each channel is analysed by a pure function of the image and the
 * configuration, so channels are processed in parallel and the results
 * combined afterwards by taking the element-wise maximum of the diffs.
 *
 * @author tonyj
 */
public class RegionAnalyzer {

    private static final Logger LOG = Logger.getLogger(RegionAnalyzer.class.getName());

    /**
     * Maximum number of global candidates kept per channel and orientation.
     * Candidates beyond this are dropped in scan order, not by magnitude.
     */
    static final int MAX_GLOBAL_CANDIDATES = 100;
    /**
     * Blocks must be larger than this in both dimensions to be analysed.
     */
    static final int MIN_BLOCK_SIZE = 8;

    private RegionAnalyzer() {
    }

    /**
     * Analyse a restored image.
     *
     * @param image The image, already restored to its natural bit depth
     * @param config The inspection options
     * @return The full image profiles, per-channel maxima and raw candidates
     */
    public static Analysis analyze(SensorImage image, InspectionConfig config) {
        return analyze(image, config, true);
    }

    /**
     * Compute the full image profiles only. No strip suppression or
     * thresholding is applied.
     *
     * @param image The image, already restored to its natural bit depth
     * @param config The inspection options, only the channel count, edge gain
     * and robust flag are used
     * @return The profiles
     */
    public static LineProfiles profiles(SensorImage image, InspectionConfig config) {
        return analyze(image, config, false).getProfiles();
    }

    private static Analysis analyze(SensorImage image, InspectionConfig config, boolean detect) {
        List<Channel> channels = ChannelSampler.decompose(image, config.getChannelCount());
        List<ChannelAnalysis> analyses = channels.parallelStream()
                .map(channel -> analyzeChannel(channel, config, detect))
                .collect(Collectors.toList());

        float[] rowDiff = new float[image.getHeight()];
        float[] rowAvg = new float[image.getHeight()];
        float[] colDiff = new float[image.getWidth()];
        float[] colAvg = new float[image.getWidth()];
        float[] rowMax = new float[channels.size()];
        float[] colMax = new float[channels.size()];
        List<Defect> candidates = new ArrayList<>();
        for (int i = 0; i < channels.size(); i++) {
            Channel channel = channels.get(i);
            ChannelAnalysis analysis = analyses.get(i);
            for (int r = 0; r < analysis.rowDiff.length; r++) {
                int y = channel.globalRow(r);
                rowDiff[y] = Math.max(rowDiff[y], analysis.rowDiff[r]);
                rowAvg[y] = analysis.rowAvg[r];
            }
            for (int c = 0; c < analysis.colDiff.length; c++) {
                int x = channel.globalColumn(c);
                colDiff[x] = Math.max(colDiff[x], analysis.colDiff[c]);
                colAvg[x] = analysis.colAvg[c];
            }
            rowMax[i] = max(analysis.rowDiff);
            colMax[i] = max(analysis.colDiff);
            candidates.addAll(analysis.candidates);
        }
        LineProfiles profiles = new LineProfiles(rowDiff, rowAvg, colDiff, colAvg);
        return new Analysis(profiles, rowMax, colMax, candidates);
    }

    static ChannelAnalysis analyzeChannel(Channel channel, InspectionConfig config, boolean detect) {
        if (channel.isEmpty()) {
            LOG.fine(() -> String.format("Skipping empty %s", channel));
            return ChannelAnalysis.EMPTY;
        }
        try {
            double edgeGain = config.getEdgeGain();
            boolean useRobust = config.isUseRobust();
            float[] rowAvg = sanitize(channel.rowAverages());
            float[] colAvg = sanitize(channel.columnAverages());
            float[] rowDiff = sanitize(RobustDiffKernel.computeDiff(rowAvg, edgeGain, useRobust));
            float[] colDiff = sanitize(RobustDiffKernel.computeDiff(colAvg, edgeGain, useRobust));
            if (!detect) {
                return new ChannelAnalysis(rowAvg, rowDiff, colAvg, colDiff, Collections.emptyList());
            }
            int stripH = config.getStripH() / channel.getStride();
            int stripV = config.getStripV() / channel.getStride();
            suppressStrip(rowDiff, stripH);
            suppressStrip(colDiff, stripV);

            List<Defect> candidates = new ArrayList<>();
            addGlobalCandidates(candidates, channel, Orientation.HORIZONTAL, rowDiff, config.getThreshGlobalH());
            addGlobalCandidates(candidates, channel, Orientation.VERTICAL, colDiff, config.getThreshGlobalV());
            addPartCandidates(candidates, channel, config, stripH, stripV);
            return new ChannelAnalysis(rowAvg, rowDiff, colAvg, colDiff, candidates);
        } catch (RuntimeException x) {
            LOG.log(Level.WARNING, "Analysis of " + channel + " failed, channel skipped", x);
            return ChannelAnalysis.EMPTY;
        }
    }

    static void suppressStrip(float[] diff, int strip) {
        if (strip > 0 && strip < diff.length - strip) {
            for (int i = 0; i < strip; i++) {
                diff[i] = 0;
                diff[diff.length - 1 - i] = 0;
            }
        }
    }

    private static void addGlobalCandidates(List<Defect> candidates, Channel channel, Orientation orientation, float[] diff, double threshold) {
        float limit = (float) threshold;
        int found = 0;
        for (int i = 0; i < diff.length && found < MAX_GLOBAL_CANDIDATES; i++) {
            if (diff[i] > limit) {
                int index = orientation == Orientation.HORIZONTAL ? channel.globalRow(i) : channel.globalColumn(i);
                candidates.add(new Defect(channel.getIndex(), orientation, DetectionMode.GLOBAL, index, diff[i]));
                found++;
            }
        }
    }

    private static void addPartCandidates(List<Defect> candidates, Channel channel, InspectionConfig config, int stripH, int stripV) {
        int blockQty = config.getBlockQty();
        if (blockQty <= 0) {
            return;
        }
        int height = channel.getHeight();
        int width = channel.getWidth();
        int bh = height / blockQty;
        int bw = width / blockQty;
        if (bh <= MIN_BLOCK_SIZE || bw <= MIN_BLOCK_SIZE) {
            LOG.fine(() -> String.format("Blocks of %dx%d too small in %s, part detection skipped", bw, bh, channel));
            return;
        }
        double edgeGain = config.getEdgeGain();
        boolean useRobust = config.isUseRobust();
        float limitH = (float) config.getThreshPartH();
        float limitV = (float) config.getThreshPartV();
        for (int by = 0; by < blockQty; by++) {
            int y0 = by * bh;
            int y1 = y0 + bh;
            for (int bx = 0; bx < blockQty; bx++) {
                int x0 = bx * bw;
                int x1 = x0 + bw;
                DetectionMode mode = DetectionMode.part(by, bx);
                try {
                    if (!insideStrip(y0, y1, height, stripH)) {
                        float[] avg = sanitize(channel.rowAverages(y0, y1, x0, x1));
                        float[] diff = RobustDiffKernel.computeDiff(avg, edgeGain, useRobust);
                        for (int i = 0; i < diff.length; i++) {
                            if (diff[i] > limitH) {
                                candidates.add(new Defect(channel.getIndex(), Orientation.HORIZONTAL, mode, channel.globalRow(y0 + i), diff[i]));
                            }
                        }
                    }
                    if (!insideStrip(x0, x1, width, stripV)) {
                        float[] avg = sanitize(channel.columnAverages(y0, y1, x0, x1));
                        float[] diff = RobustDiffKernel.computeDiff(avg, edgeGain, useRobust);
                        for (int i = 0; i < diff.length; i++) {
                            if (diff[i] > limitV) {
                                candidates.add(new Defect(channel.getIndex(), Orientation.VERTICAL, mode, channel.globalColumn(x0 + i), diff[i]));
                            }
                        }
                    }
                } catch (RuntimeException x) {
                    LOG.log(Level.WARNING, "Analysis of block " + mode + " in " + channel + " failed, block skipped", x);
                }
            }
        }
    }

    /**
     * True if the range [start,end) lies entirely within a suppressed band at
     * either end of a line of the given length.
     */
    static boolean insideStrip(int start, int end, int length, int strip) {
        return strip > 0 && (end <= strip || start >= length - strip);
    }

    private static float[] sanitize(float[] values) {
        for (int i = 0; i < values.length; i++) {
            if (!Float.isFinite(values[i])) {
                values[i] = 0;
            }
        }
        return values;
    }

    private static float max(float[] values) {
        float result = 0;
        for (float v : values) {
            result = Math.max(result, v);
        }
        return result;
    }

    static class ChannelAnalysis {

        static final ChannelAnalysis EMPTY = new ChannelAnalysis(new float[0], new float[0], new float[0], new float[0], Collections.emptyList());

        private final float[] rowAvg;
        private final float[] rowDiff;
        private final float[] colAvg;
        private final float[] colDiff;
        private final List<Defect> candidates;

        ChannelAnalysis(float[] rowAvg, float[] rowDiff, float[] colAvg, float[] colDiff, List<Defect> candidates) {
            this.rowAvg = rowAvg;
            this.rowDiff = rowDiff;
            this.colAvg = colAvg;
            this.colDiff = colDiff;
            this.candidates = candidates;
        }
    }

    /**
     * The combined result of analysing all channels of an image.
     */
    public static class Analysis {

        private final LineProfiles profiles;
        private final float[] rowMax;
        private final float[] colMax;
        private final List<Defect> candidates;

        Analysis(LineProfiles profiles, float[] rowMax, float[] colMax, List<Defect> candidates) {
            this.profiles = profiles;
            this.rowMax = rowMax;
            this.colMax = colMax;
            this.candidates = candidates;
        }

        public LineProfiles getProfiles() {
            return profiles;
        }

        public float[] getRowMax() {
            return rowMax.clone();
        }

        public float[] getColMax() {
            return colMax.clone();
        }

        /**
         * @return The unmerged candidates, in channel then scan order
         */
        public List<Defect> getCandidates() {
            return candidates;
        }
    }
}
