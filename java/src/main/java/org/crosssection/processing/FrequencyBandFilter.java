package org.crosssection.processing;

import org.apache.commons.math3.complex.Complex;
import org.crosssection.core.Spectrum;
import org.crosssection.core.exceptions.InvalidParameterException;

/**
 * Fourier-domain smoothing. Removes a band of the highest-frequency content, centred on the
 * Nyquist bin, whose width is the given fraction of half the spectrum length.
 */
public final class FrequencyBandFilter {

    private FrequencyBandFilter() {
    }

    /**
     * @param filterWidth fraction in [0, 1]; 0 returns {@code data} itself
     */
    public static Spectrum apply(Spectrum data, double filterWidth) {
        if (!(filterWidth >= 0 && filterWidth <= 1)) {
            throw new InvalidParameterException("filter width must lie in [0, 1], got " + filterWidth);
        }
        if (filterWidth == 0 || data.size() < 2) {
            return data;
        }
        return data.withValues(filter(data.getValues(), filterWidth));
    }

    static double[] filter(double[] values, double filterWidth) {
        int n = values.length;
        Complex[] spectrum = DiscreteFourierTransform.forward(values);

        int mid = n / 2;
        int half = (int) (filterWidth * mid);
        // bin 0 carries the total power and is never removed
        int from = Math.max(1, mid - half);
        int to = Math.min(n, mid + half);
        for (int k = from; k < to; k++) {
            spectrum[k] = Complex.ZERO;
        }

        Complex[] restored = DiscreteFourierTransform.inverse(spectrum);
        double[] filtered = new double[n];
        for (int i = 0; i < n; i++) {
            filtered[i] = restored[i].getReal();
        }
        return filtered;
    }
}
