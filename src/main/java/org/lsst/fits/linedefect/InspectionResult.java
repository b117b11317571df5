package org.lsst.fits.linedefect;

import java.util.Collections;
import java.util.List;

/**
 * The outcome of inspecting one image.
 *
 * @author tonyj
 */
public class InspectionResult {

    private final List<Defect> defects;
    private final LineProfiles profiles;
    private final float[] rowMax;
    private final float[] colMax;

    InspectionResult(List<Defect> defects, LineProfiles profiles, float[] rowMax, float[] colMax) {
        this.defects = Collections.unmodifiableList(defects);
        this.profiles = profiles;
        this.rowMax = rowMax;
        this.colMax = colMax;
    }

    /**
     * @return The merged defects, global defects first, each group by
     * ascending index
     */
    public List<Defect> getDefects() {
        return defects;
    }

    public LineProfiles getProfiles() {
        return profiles;
    }

    /**
     * @return The largest row diff of each channel, in channel order
     */
    public float[] getRowMax() {
        return rowMax.clone();
    }

    /**
     * @return The largest column diff of each channel, in channel order
     */
    public float[] getColMax() {
        return colMax.clone();
    }

    public boolean isDefective() {
        return !defects.isEmpty();
    }

    @Override
    public String toString() {
        return "InspectionResult{" + "defects=" + defects.size() + ", profiles=" + profiles + '}';
    }
}
