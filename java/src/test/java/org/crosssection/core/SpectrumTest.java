package org.crosssection.core;

import org.crosssection.core.exceptions.InvalidSpectrumException;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

public class SpectrumTest {

    private static final double EPS = 1e-12;

    private static Spectrum sample() {
        return new Spectrum(new double[]{900, 910, 920, 930}, new double[]{1, 2, 4, 8});
    }

    @Test
    public void testConstructor_rejectsInvalidGrids() {
        assertThrows(InvalidSpectrumException.class, () -> new Spectrum(new double[]{1, 2}, new double[]{1}));
        assertThrows(InvalidSpectrumException.class, () -> new Spectrum(new double[]{1, 1}, new double[]{1, 2}));
        assertThrows(InvalidSpectrumException.class, () -> new Spectrum(new double[]{2, 1}, new double[]{1, 2}));
        assertThrows(InvalidSpectrumException.class,
            () -> new Spectrum(new double[]{1, Double.NaN}, new double[]{1, 2}));
    }

    @Test
    public void testConstructor_copiesInput() {
        double[] x = {1, 2, 3};
        double[] y = {4, 5, 6};
        Spectrum s = new Spectrum(x, y);
        x[0] = -1;
        y[0] = -1;
        assertEquals(1, s.getWavelengthAt(0));
        assertEquals(4, s.getValueAt(0));

        s.getValues()[1] = 100;
        assertEquals(5, s.getValueAt(1));
    }

    @Test
    public void testStatistics() {
        Spectrum s = sample();
        assertEquals(4, s.size());
        assertEquals(900, s.getWavelengthMin());
        assertEquals(930, s.getWavelengthMax());
        assertEquals(15, s.sum(), EPS);
        assertEquals(10, s.meanSpacing(), EPS);
        assertTrue(Spectrum.empty().isEmpty());
        assertEquals(0, Spectrum.empty().meanSpacing());
    }

    @Test
    public void testFindNearestWavelength() {
        Spectrum s = sample();
        assertEquals(0, s.findNearestWavelength(800));
        assertEquals(1, s.findNearestWavelength(912));
        assertEquals(2, s.findNearestWavelength(918));
        assertEquals(3, s.findNearestWavelength(Double.POSITIVE_INFINITY));
        assertEquals(0, s.findNearestWavelength(Double.NEGATIVE_INFINITY));
        assertThrows(IllegalStateException.class, () -> Spectrum.empty().findNearestWavelength(1));
    }

    @Test
    public void testFindInterval_isHalfOpen() {
        assertArrayEquals(new int[]{1, 3}, sample().findInterval(909, 931));
        assertArrayEquals(new int[]{2, 2}, sample().findInterval(920, 900));
    }

    @Test
    public void testExtractRange_isInclusive() {
        Spectrum range = sample().extractRange(910, 920);
        assertArrayEquals(new double[]{910, 920}, range.getWavelengths(), EPS);
        assertArrayEquals(new double[]{2, 4}, range.getValues(), EPS);
        assertTrue(sample().extractRange(1000, 2000).isEmpty());
    }

    @Test
    public void testResample_holdsBoundaryValues() {
        Spectrum resampled = sample().resample(new double[]{890, 905, 925, 940});
        assertArrayEquals(new double[]{1, 1.5, 6, 8}, resampled.getValues(), EPS);
    }

    @Test
    public void testInterpolateOrZero_isZeroOutsideDomain() {
        Spectrum resampled = sample().interpolateOrZero(new double[]{890, 905, 925, 940});
        assertArrayEquals(new double[]{0, 1.5, 6, 0}, resampled.getValues(), EPS);
    }

    @Test
    public void testEqualityAndGrid() {
        assertEquals(sample(), sample());
        assertEquals(sample().hashCode(), sample().hashCode());
        Spectrum scaled = sample().withValues(new double[]{2, 4, 8, 16});
        assertNotEquals(sample(), scaled);
        assertTrue(sample().hasSameGrid(scaled));
    }
}
