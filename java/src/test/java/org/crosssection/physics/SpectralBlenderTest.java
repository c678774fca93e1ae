package org.crosssection.physics;

import org.crosssection.core.Spectrum;
import org.crosssection.core.exceptions.DomainMismatchException;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.crosssection.physics.PhysicsTestUtils.*;
import static org.junit.jupiter.api.Assertions.*;

public class SpectralBlenderTest {

    private static final double[] X = grid(900, 1000, 1);

    private static Spectrum fuchtbauer() {
        return gaussian(X, 2e-20, 980, 20);
    }

    private static Spectrum mcCumber() {
        return gaussian(X, 1.5e-20, 950, 30);
    }

    @Test
    public void testFuchtbauerNeverActiveGivesMcCumber() {
        BlendResult result = SpectralBlender.blend(fuchtbauer(), mcCumber(), 2000, 960);
        assertArrayEquals(result.getMcCumber().getValues(), result.getComposite().getValues(), 0);
    }

    @Test
    public void testMcCumberNeverActiveGivesFuchtbauer() {
        BlendResult result = SpectralBlender.blend(fuchtbauer(), mcCumber(), 950, 100);
        assertArrayEquals(result.getFuchtbauer().getValues(), result.getComposite().getValues(), 0);
    }

    @Test
    public void testSingleMaskPointsTakeSourceValue() {
        double flMin = 940;
        double mcMax = 960;
        BlendResult result = SpectralBlender.blend(fuchtbauer(), mcCumber(), flMin, mcMax);
        Spectrum composite = result.getComposite();
        double[] flWeight = result.getFuchtbauerWeight();
        double[] mcWeight = result.getMcCumberWeight();

        for (int i = 0; i < composite.size(); i++) {
            double x = composite.getWavelengthAt(i);
            boolean fl = x >= flMin;
            boolean mc = x <= mcMax;
            if (fl && !mc) {
                assertEquals(result.getFuchtbauer().getValueAt(i), composite.getValueAt(i), 0, "at " + x);
            } else if (mc && !fl) {
                assertEquals(result.getMcCumber().getValueAt(i), composite.getValueAt(i), 0, "at " + x);
            } else {
                assertEquals(1, flWeight[i] + mcWeight[i], 1e-15, "at " + x);
            }
        }
    }

    @Test
    public void testCrossfadeHandsOverFromMcCumber() {
        BlendResult result = SpectralBlender.blend(fuchtbauer(), mcCumber(), 940, 960);
        Spectrum composite = result.getComposite();
        int start = composite.findNearestWavelength(940);
        int end = composite.findNearestWavelength(960);
        double[] mcWeight = result.getMcCumberWeight();

        assertEquals(1, mcWeight[start], 1e-15);
        assertEquals(0, mcWeight[end], 1e-15);
        for (int i = start; i < end; i++) {
            assertTrue(mcWeight[i + 1] <= mcWeight[i], "weights fall monotonically");
        }
        assertEquals(1, mcWeight[start - 1]);
        assertEquals(0, mcWeight[end + 1]);
    }

    @Test
    public void testGapTakesNearestCurve() {
        BlendResult result = SpectralBlender.blend(fuchtbauer(), mcCumber(), 980, 940);
        Spectrum composite = result.getComposite();

        int nearMc = composite.findNearestWavelength(950);
        int nearFl = composite.findNearestWavelength(975);
        assertEquals(result.getMcCumber().getValueAt(nearMc), composite.getValueAt(nearMc), 0);
        assertEquals(result.getFuchtbauer().getValueAt(nearFl), composite.getValueAt(nearFl), 0);
    }

    @Test
    public void testCommonGridUsesFinerSpacing() {
        Spectrum coarse = gaussian(grid(900, 1000, 2), 1e-20, 950, 20);
        Spectrum fine = gaussian(grid(950, 1050, 1), 1e-20, 1000, 20);

        double[] common = SpectralBlender.commonGrid(coarse, fine);

        assertEquals(151, common.length);
        assertEquals(900, common[0], 0);
        assertEquals(1050, common[150], 0);
        assertEquals(1, common[1] - common[0], 1e-12);
    }

    @Test
    public void testFindRunsAndRaisedCosine() {
        List<int[]> runs = SpectralBlender.findRuns(new boolean[]{true, true, false, false, true, false, true});
        assertEquals(3, runs.size());
        assertArrayEquals(new int[]{0, 2}, runs.get(0));
        assertArrayEquals(new int[]{4, 1}, runs.get(1));
        assertArrayEquals(new int[]{6, 1}, runs.get(2));

        assertArrayEquals(new double[]{1}, SpectralBlender.raisedCosine(1), 0);
        assertArrayEquals(new double[]{1, 0.5, 0}, SpectralBlender.raisedCosine(3), 1e-15);
    }

    @Test
    public void testEmptyInput() {
        assertThrows(DomainMismatchException.class, () -> SpectralBlender.blend(Spectrum.empty(), mcCumber(), 940, 960));
    }
}
