package org.lsst.fits.linedefect;

import java.util.List;
import java.util.Objects;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Entry point of the line defect engine. Takes a decoded sensor image and a
 * configuration and produces the ordered defect list and the line profiles.
 * The inspector holds no state, a single instance may be shared between
 * threads.
 *
 * @author tonyj
 */
public class LineDefectInspector {

    private static final Logger LOG = Logger.getLogger(LineDefectInspector.class.getName());

    /**
     * Inspect an image as delivered by the camera, restoring the bit depth
     * first.
     *
     * @param image The packed image
     * @param config The inspection options
     * @return The inspection result
     * @throws InvalidInputException If image is null
     */
    public InspectionResult inspect(SensorImage image, InspectionConfig config) {
        checkImage(image);
        Objects.requireNonNull(config, "config");
        SensorImage restored = BitDepthRestorer.restore(image, config.getEffectiveBits());
        return inspectRestored(restored, config);
    }

    /**
     * Inspect an image whose bit depth has already been restored.
     *
     * @param restored The restored image
     * @param config The inspection options, the effective bits are ignored
     * @return The inspection result
     * @throws InvalidInputException If image is null
     */
    public InspectionResult inspectRestored(SensorImage restored, InspectionConfig config) {
        checkImage(restored);
        Objects.requireNonNull(config, "config");
        return Timed.execute(Level.FINE, () -> {
            RegionAnalyzer.Analysis analysis = RegionAnalyzer.analyze(restored, config);
            List<Defect> defects = DefectMerger.merge(analysis.getCandidates());
            LOG.log(Level.FINE, "{0} candidates merged into {1} defects", new Object[]{analysis.getCandidates().size(), defects.size()});
            return new InspectionResult(defects, analysis.getProfiles(), analysis.getRowMax(), analysis.getColMax());
        }, "Inspecting %s took %dms", restored);
    }

    /**
     * Compute the line profiles of an already restored image, typically a
     * region of interest cut with {@link SensorImage#crop}. No strip
     * suppression or thresholding is applied.
     *
     * @param restored The restored image
     * @param config The inspection options
     * @return The profiles
     */
    public LineProfiles computeProfiles(SensorImage restored, InspectionConfig config) {
        checkImage(restored);
        Objects.requireNonNull(config, "config");
        return RegionAnalyzer.profiles(restored, config);
    }

    private static void checkImage(SensorImage image) {
        if (image == null) {
            throw new InvalidInputException("Missing image");
        }
    }
}
