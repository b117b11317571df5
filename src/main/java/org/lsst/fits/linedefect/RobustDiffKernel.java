package org.lsst.fits.linedefect;

/**
 * Scores how far each line of a profile deviates from its neighbours.
 * <p>
 * For every index the baseline is formed from the values at offsets
 * &plusmn;2, &plusmn;4, &plusmn;6 and &plusmn;8 (only same-parity neighbours
 * are used, so that an odd/even readout pattern does not show up as a
 * defect). With robust mode enabled and more than two neighbours available
 * the smallest and largest neighbour are discarded, so that an adjacent line
 * which is itself defective neither masks nor triggers the line being scored.
 * The absolute deviation from the baseline is weighted by the fraction of
 * neighbours found, and lines with an incomplete neighbourhood are further
 * scaled by the edge gain.
 * <p>
 * The computation for each index depends only on the input, so the kernel is
 * stateless and thread safe.
 *
 * @author tonyj
 */
public class RobustDiffKernel {

    private static final int[] OFFSETS = {-8, -6, -4, -2, 2, 4, 6, 8};
    private static final double FULL_NEIGHBOURHOOD = OFFSETS.length;

    private RobustDiffKernel() {
    }

    /**
     * Compute the deviation strength of every element of a profile.
     *
     * @param signal The profile, typically per-line averages
     * @param edgeGain Multiplier applied to the weight of lines with fewer
     * than 8 neighbours
     * @param useRobust If <code>true</code> use a trimmed mean baseline
     * @return An array of the same length as signal
     */
    public static float[] computeDiff(float[] signal, double edgeGain, boolean useRobust) {
        int n = signal.length;
        float[] diff = new float[n];
        for (int i = 0; i < n; i++) {
            double sum = 0;
            double min = Double.POSITIVE_INFINITY;
            double max = Double.NEGATIVE_INFINITY;
            int count = 0;
            for (int offset : OFFSETS) {
                int j = i + offset;
                if (j >= 0 && j < n) {
                    double value = signal[j];
                    sum += value;
                    min = Math.min(min, value);
                    max = Math.max(max, value);
                    count++;
                }
            }
            if (count == 0) {
                continue;
            }
            double baseline;
            if (useRobust && count > 2) {
                baseline = (sum - min - max) / (count - 2);
            } else {
                baseline = sum / count;
            }
            double weight = count / FULL_NEIGHBOURHOOD;
            if (count < OFFSETS.length) {
                weight *= edgeGain;
            }
            diff[i] = (float) (Math.abs(signal[i] - baseline) * weight);
        }
        return diff;
    }
}
