package org.crosssection.physics;

import org.crosssection.core.ProcessingParameters;
import org.crosssection.core.RawChannelSet;
import org.crosssection.core.SmoothingBand;
import org.crosssection.core.Spectrum;
import org.crosssection.core.exceptions.NumericalException;
import org.crosssection.core.exceptions.SpectrumLoadException;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.crosssection.physics.PhysicsTestUtils.*;
import static org.junit.jupiter.api.Assertions.*;

public class FluorescenceNormalizerTest {

    private static final double[] X = {1000, 1001, 1002, 1003};

    private static final ProcessingParameters PLAIN = ProcessingParameters.builder()
        .smoothingBands(List.of())
        .fluorescenceFilterWidth(0)
        .build();

    @Test
    public void testSingleCurveSumsToOne() {
        double[] x = grid(950, 1100, 0.5);
        Spectrum emission = gaussian(x, 3500, 1030, 12);
        double[] noisy = emission.getValues();
        for (int i = 0; i < noisy.length; i++) {
            noisy[i] += (i % 3) * 7.0;
        }

        FluorescenceResult result = FluorescenceNormalizer.normalize(
            RawChannelSet.builder().fluorescence(emission.withValues(noisy)).build(),
            ProcessingParameters.defaults());

        assertFalse(result.isMerged());
        assertNull(result.getLow());
        assertEquals(1, result.getLineshape().sum(), 1e-9);
        assertTrue(result.getLineshape().hasSameGrid(emission));
    }

    @Test
    public void testMerge_keepsSmallerValueWhereCurvesDisagree() {
        Spectrum low = new Spectrum(X, new double[]{1, 1, 1, 1});
        Spectrum high = new Spectrum(X, new double[]{1, 1, 1, 2});

        FluorescenceResult result = FluorescenceNormalizer.normalize(low, high, PLAIN);

        assertTrue(result.isMerged());
        assertArrayEquals(new double[]{0.25, 0.25, 0.25, 0.25}, result.getLow().getValues(), 1e-15);
        assertArrayEquals(new double[]{0.2, 0.2, 0.2, 0.4}, result.getHigh().getValues(), 1e-15);
        assertArrayEquals(new double[]{0.2 / 0.85, 0.2 / 0.85, 0.2 / 0.85, 0.25 / 0.85},
            result.getLineshape().getValues(), 1e-12);
    }

    @Test
    public void testMerge_keepsLowCurveWithinTolerance() {
        Spectrum low = new Spectrum(X, new double[]{1, 2, 3, 4});
        Spectrum high = new Spectrum(X, new double[]{2, 4, 6, 8});

        FluorescenceResult result = FluorescenceNormalizer.normalize(low, high, PLAIN);

        assertArrayEquals(new double[]{0.1, 0.2, 0.3, 0.4}, result.getLineshape().getValues(), 1e-12);
    }

    @Test
    public void testMerge_interpolatesHighCurve() {
        Spectrum low = new Spectrum(X, new double[]{1, 1, 1, 1});
        Spectrum high = new Spectrum(new double[]{999.5, 1001.5, 1003.5}, new double[]{1, 1, 1});

        FluorescenceResult result = FluorescenceNormalizer.normalize(low, high, PLAIN);

        assertTrue(result.getHigh().hasSameGrid(low));
        assertArrayEquals(new double[]{0.25, 0.25, 0.25, 0.25}, result.getLineshape().getValues(), 1e-12);
    }

    @Test
    public void testPairThroughChannelSet() {
        double[] x = grid(980, 1080, 1);
        Spectrum low = gaussian(x, 100, 1030, 10);
        Spectrum high = gaussian(x, 150, 1032, 12);

        FluorescenceResult result = FluorescenceNormalizer.normalize(
            RawChannelSet.builder().fluorescencePair(low, high).build(), ProcessingParameters.defaults());

        assertTrue(result.isMerged());
        assertEquals(1, result.getLineshape().sum(), 1e-9);
    }

    @Test
    public void testBandSmoothing() {
        double[] x = grid(980, 1000, 1);
        double[] y = new double[x.length];
        for (int i = 0; i < y.length; i++) {
            y[i] = i % 2 == 0 ? 2 : 0;
        }
        ProcessingParameters bandOnly = PLAIN.toBuilder()
            .smoothingBands(List.of(new SmoothingBand(985, 995, 2)))
            .build();

        Spectrum lineshape = FluorescenceNormalizer.normalize(
            RawChannelSet.builder().fluorescence(new Spectrum(x, y)).build(), bandOnly).getLineshape();

        double total = 0;
        for (int i = 0; i < y.length; i++) total += y[i];
        // outside the band the raw shape survives
        assertEquals(2 / total, lineshape.getValueAt(0), 1e-12);
        assertEquals(0, lineshape.getValueAt(1), 1e-12);
        // inside the band pairs are averaged
        assertEquals(1 / total, lineshape.getValueAt(10), 1e-12);
    }

    @Test
    public void testFailures() {
        assertThrows(NumericalException.class, () -> FluorescenceNormalizer.normalize(
            RawChannelSet.builder().fluorescence(new Spectrum(X, new double[4])).build(), PLAIN));
        assertThrows(SpectrumLoadException.class, () -> FluorescenceNormalizer.normalize(
            RawChannelSet.builder().build(), PLAIN));
    }
}
