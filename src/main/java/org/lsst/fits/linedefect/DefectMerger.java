package org.lsst.fits.linedefect;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Comparator;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * Reduces raw defect candidates to at most one defect per line.
 * <p>
 * A global candidate always beats a part candidate for the same line. Within
 * the same class the larger diff wins, remaining ties go to the lower channel
 * and then to the lower block, so the result does not depend on the order of
 * the candidates.
 *
 * @author tonyj
 */
public class DefectMerger {

    private static final Comparator<Defect> PRIORITY = Comparator
            .comparing(Defect::isGlobal)
            .thenComparingDouble(Defect::getDiff)
            .thenComparing(Comparator.comparingInt(Defect::getChannel).reversed())
            .thenComparing(Comparator.comparing(Defect::getMode).reversed());

    private static final Comparator<Defect> REPORT_ORDER = Comparator
            .comparingInt((Defect d) -> d.isGlobal() ? 0 : 1)
            .thenComparingInt(Defect::getIndex)
            .thenComparing(Defect::getOrientation);

    private DefectMerger() {
    }

    /**
     * Merge candidates into a sorted defect list: all global defects by
     * ascending index, then all part defects by ascending index.
     *
     * @param candidates The raw candidates
     * @return The merged list
     */
    public static List<Defect> merge(Collection<Defect> candidates) {
        Map<LineKey, Defect> merged = new HashMap<>();
        for (Defect candidate : candidates) {
            merged.merge(candidate.key(), candidate, (current, other) -> PRIORITY.compare(other, current) > 0 ? other : current);
        }
        List<Defect> result = new ArrayList<>(merged.values());
        result.sort(REPORT_ORDER);
        return result;
    }
}
