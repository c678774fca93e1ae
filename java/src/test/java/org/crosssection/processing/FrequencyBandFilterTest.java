package org.crosssection.processing;

import org.apache.commons.math3.complex.Complex;
import org.crosssection.core.Spectrum;
import org.crosssection.core.exceptions.InvalidParameterException;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

public class FrequencyBandFilterTest {

    private static final double EPS = 1e-9;

    private static Spectrum noisy(int n) {
        double[] x = new double[n];
        double[] y = new double[n];
        for (int i = 0; i < n; i++) {
            x[i] = 900 + i;
            y[i] = 10 + Math.sin(i * 0.3) + ((i % 2 == 0) ? 0.5 : -0.5);
        }
        return new Spectrum(x, y);
    }

    @Test
    public void testZeroWidthIsIdentity() {
        Spectrum data = noisy(37);
        assertEquals(data, FrequencyBandFilter.apply(data, 0));
    }

    @Test
    public void testWidthOutOfRange() {
        assertThrows(InvalidParameterException.class, () -> FrequencyBandFilter.apply(noisy(8), 1.5));
        assertThrows(InvalidParameterException.class, () -> FrequencyBandFilter.apply(noisy(8), -0.1));
    }

    @Test
    public void testFilterPreservesSum() {
        for (int n : new int[]{64, 50, 37}) {
            Spectrum data = noisy(n);
            Spectrum filtered = FrequencyBandFilter.apply(data, 0.6);
            assertEquals(data.sum(), filtered.sum(), 1e-8, "length " + n);
            assertTrue(filtered.hasSameGrid(data));
        }
    }

    @Test
    public void testFullWidthLeavesMean() {
        for (int n : new int[]{16, 12}) {
            Spectrum data = noisy(n);
            double mean = data.sum() / n;
            double[] filtered = FrequencyBandFilter.apply(data, 1).getValues();
            for (double v : filtered) {
                assertEquals(mean, v, EPS);
            }
        }
    }

    @Test
    public void testNyquistComponentIsRemoved() {
        double[] alternating = new double[32];
        for (int i = 0; i < alternating.length; i++) {
            alternating[i] = 2 + (i % 2 == 0 ? 1 : -1);
        }
        double[] filtered = FrequencyBandFilter.filter(alternating, 0.1);
        for (double v : filtered) {
            assertEquals(2, v, EPS);
        }
    }

    @Test
    public void testBluesteinMatchesDirectDft() {
        double[] values = {3, -1, 4, 1, -5, 9, 2};
        Complex[] fast = DiscreteFourierTransform.forward(values);
        int n = values.length;
        for (int k = 0; k < n; k++) {
            double re = 0;
            double im = 0;
            for (int j = 0; j < n; j++) {
                double angle = -2 * Math.PI * j * k / n;
                re += values[j] * Math.cos(angle);
                im += values[j] * Math.sin(angle);
            }
            assertEquals(re, fast[k].getReal(), EPS, "re " + k);
            assertEquals(im, fast[k].getImaginary(), EPS, "im " + k);
        }

        Complex[] restored = DiscreteFourierTransform.inverse(fast);
        for (int i = 0; i < n; i++) {
            assertEquals(values[i], restored[i].getReal(), EPS);
            assertEquals(0, restored[i].getImaginary(), EPS);
        }
    }
}
