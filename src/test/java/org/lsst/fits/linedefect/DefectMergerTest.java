package org.lsst.fits.linedefect;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertTrue;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;
import java.util.Random;
import org.junit.Test;

/**
 *
 * @author tonyj
 */
public class DefectMergerTest {

    private static Defect global(Orientation o, int index, float diff) {
        return new Defect(0, o, DetectionMode.GLOBAL, index, diff);
    }

    private static Defect part(Orientation o, int index, float diff) {
        return new Defect(0, o, DetectionMode.part(0, 0), index, diff);
    }

    @Test
    public void testGlobalBeatsPart() {
        Defect g = global(Orientation.HORIZONTAL, 10, 5);
        Defect p = part(Orientation.HORIZONTAL, 10, 50);
        assertEquals(Collections.singletonList(g), DefectMerger.merge(Arrays.asList(g, p)));
        assertEquals(Collections.singletonList(g), DefectMerger.merge(Arrays.asList(p, g)));
    }

    @Test
    public void testLargerDiffWins() {
        Defect small = global(Orientation.HORIZONTAL, 10, 5);
        Defect large = global(Orientation.HORIZONTAL, 10, 8);
        assertEquals(Collections.singletonList(large), DefectMerger.merge(Arrays.asList(small, large)));

        Defect p1 = new Defect(1, Orientation.VERTICAL, DetectionMode.part(0, 1), 3, 12);
        Defect p2 = new Defect(2, Orientation.VERTICAL, DetectionMode.part(1, 1), 3, 15);
        assertEquals(Collections.singletonList(p2), DefectMerger.merge(Arrays.asList(p1, p2)));
    }

    @Test
    public void testEqualDiffGoesToLowerChannel() {
        Defect ch0 = new Defect(0, Orientation.HORIZONTAL, DetectionMode.GLOBAL, 30, 205);
        Defect ch1 = new Defect(1, Orientation.HORIZONTAL, DetectionMode.GLOBAL, 30, 205);
        assertEquals(Collections.singletonList(ch0), DefectMerger.merge(Arrays.asList(ch1, ch0)));
        assertEquals(Collections.singletonList(ch0), DefectMerger.merge(Arrays.asList(ch0, ch1)));
    }

    @Test
    public void testOrientationsAreSeparateLines() {
        List<Defect> merged = DefectMerger.merge(Arrays.asList(
                global(Orientation.VERTICAL, 7, 1),
                global(Orientation.HORIZONTAL, 7, 2)));
        assertEquals(2, merged.size());
        assertEquals(Orientation.HORIZONTAL, merged.get(0).getOrientation());
        assertEquals(Orientation.VERTICAL, merged.get(1).getOrientation());
    }

    @Test
    public void testSortOrder() {
        List<Defect> merged = DefectMerger.merge(Arrays.asList(
                part(Orientation.HORIZONTAL, 2, 30),
                global(Orientation.VERTICAL, 40, 25),
                part(Orientation.VERTICAL, 1, 30),
                global(Orientation.HORIZONTAL, 12, 25)));
        assertEquals(4, merged.size());
        assertTrue(merged.get(0).isGlobal());
        assertEquals(12, merged.get(0).getIndex());
        assertTrue(merged.get(1).isGlobal());
        assertEquals(40, merged.get(1).getIndex());
        assertEquals(1, merged.get(2).getIndex());
        assertEquals(2, merged.get(3).getIndex());
    }

    @Test
    public void testOrderIndependent() {
        List<Defect> candidates = new ArrayList<>();
        Random random = new Random(1234);
        for (int i = 0; i < 200; i++) {
            Orientation o = random.nextBoolean() ? Orientation.HORIZONTAL : Orientation.VERTICAL;
            DetectionMode mode = random.nextInt(3) == 0 ? DetectionMode.GLOBAL : DetectionMode.part(random.nextInt(3), random.nextInt(3));
            candidates.add(new Defect(random.nextInt(4), o, mode, random.nextInt(20), random.nextInt(5)));
        }
        List<Defect> expected = DefectMerger.merge(candidates);
        for (int i = 0; i < 10; i++) {
            Collections.shuffle(candidates, random);
            assertEquals(expected, DefectMerger.merge(candidates));
        }
    }

    @Test
    public void testEmpty() {
        assertTrue(DefectMerger.merge(Collections.<Defect>emptyList()).isEmpty());
    }
}
