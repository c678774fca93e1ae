package org.crosssection.core;

import org.crosssection.core.exceptions.InvalidParameterException;

import java.util.Locale;
import java.util.Objects;

/**
 * Wavelength band [nm] smoothed with a centred moving average of the given window.
 */
public final class SmoothingBand {
    private final double lower;
    private final double upper;
    private final int window;

    public SmoothingBand(double lower, double upper, int window) {
        if (!Double.isFinite(lower) || !Double.isFinite(upper) || lower >= upper) {
            throw new InvalidParameterException("smoothing band needs finite lower < upper");
        }
        if (window < 1) {
            throw new InvalidParameterException("smoothing window must be at least 1, got " + window);
        }
        this.lower = lower;
        this.upper = upper;
        this.window = window;
    }

    public double getLower() { return lower; }
    public double getUpper() { return upper; }
    public int getWindow() { return window; }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof SmoothingBand)) return false;
        SmoothingBand b = (SmoothingBand) o;
        return lower == b.lower && upper == b.upper && window == b.window;
    }

    @Override
    public int hashCode() {
        return Objects.hash(lower, upper, window);
    }

    @Override
    public String toString() {
        return String.format(Locale.ROOT, "SmoothingBand(%.1f-%.1f nm, window=%d)", lower, upper, window);
    }
}
