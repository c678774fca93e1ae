package org.crosssection.core;

import org.apache.commons.math3.analysis.interpolation.LinearInterpolator;
import org.apache.commons.math3.analysis.polynomials.PolynomialSplineFunction;
import org.crosssection.core.exceptions.InvalidSpectrumException;

import java.util.*;

/**
 * Immutable spectrum of (wavelength [nm], value) samples with strictly increasing wavelengths.
 * Every transform returns a new instance.
 */
public final class Spectrum {
    private static final Spectrum EMPTY = new Spectrum(new double[0], new double[0]);

    private final double[] wavelength;
    private final double[] value;

    // Cached statistics
    private final double wavelengthMin;
    private final double wavelengthMax;
    private final double sum;

    public Spectrum(double[] wavelength, double[] value) {
        if (wavelength.length != value.length) {
            throw new InvalidSpectrumException("wavelength and value arrays must have same length ("
                + wavelength.length + " != " + value.length + ")");
        }
        for (int i = 0; i < wavelength.length; i++) {
            if (!Double.isFinite(wavelength[i])) {
                throw new InvalidSpectrumException("non-finite wavelength at index " + i);
            }
            if (i > 0 && wavelength[i] <= wavelength[i - 1]) {
                throw new InvalidSpectrumException(String.format(Locale.ROOT,
                    "wavelengths not strictly increasing at index %d (%.6g after %.6g)",
                    i, wavelength[i], wavelength[i - 1]));
            }
        }
        this.wavelength = wavelength.clone();
        this.value = value.clone();

        double total = 0;
        for (double v : value) total += v;
        this.sum = total;
        this.wavelengthMin = wavelength.length == 0 ? 0 : wavelength[0];
        this.wavelengthMax = wavelength.length == 0 ? 0 : wavelength[wavelength.length - 1];
    }

    public static Spectrum empty() { return EMPTY; }

    public int size() { return wavelength.length; }
    public boolean isEmpty() { return wavelength.length == 0; }

    public double[] getWavelengths() { return wavelength.clone(); }
    public double[] getValues() { return value.clone(); }

    public double getWavelengthAt(int i) { return wavelength[i]; }
    public double getValueAt(int i) { return value[i]; }

    public double getWavelengthMin() { return wavelengthMin; }
    public double getWavelengthMax() { return wavelengthMax; }
    public double sum() { return sum; }

    /**
     * Average distance between neighbouring samples, 0 for fewer than two samples.
     */
    public double meanSpacing() {
        if (wavelength.length < 2) return 0;
        return (wavelengthMax - wavelengthMin) / (wavelength.length - 1);
    }

    /**
     * Same wavelength grid, new values.
     */
    public Spectrum withValues(double[] newValues) {
        return new Spectrum(wavelength, newValues);
    }

    public boolean hasSameGrid(Spectrum other) {
        return Arrays.equals(wavelength, other.wavelength);
    }

    /**
     * Find index of the sample closest to the target wavelength. Infinite targets select
     * the first or last sample.
     */
    public int findNearestWavelength(double target) {
        if (wavelength.length == 0) {
            throw new IllegalStateException("Cannot find sample in empty spectrum");
        }
        if (target == Double.POSITIVE_INFINITY) return wavelength.length - 1;
        if (target == Double.NEGATIVE_INFINITY) return 0;

        int nearest = 0;
        double minDist = Math.abs(wavelength[0] - target);

        for (int i = 1; i < wavelength.length; i++) {
            double dist = Math.abs(wavelength[i] - target);
            if (dist < minDist) {
                minDist = dist;
                nearest = i;
            }
        }
        return nearest;
    }

    /**
     * Half-open index range {from, to} running from the sample nearest {@code lower} up to,
     * but excluding, the sample nearest {@code upper}.
     */
    public int[] findInterval(double lower, double upper) {
        int from = findNearestWavelength(lower);
        int to = findNearestWavelength(upper);
        return new int[]{from, Math.max(from, to)};
    }

    /**
     * Extract samples within the closed wavelength range.
     */
    public Spectrum extractRange(double low, double high) {
        List<Double> newWavelength = new ArrayList<>();
        List<Double> newValue = new ArrayList<>();

        for (int i = 0; i < wavelength.length; i++) {
            if (wavelength[i] >= low && wavelength[i] <= high) {
                newWavelength.add(wavelength[i]);
                newValue.add(value[i]);
            }
        }

        return new Spectrum(
            newWavelength.stream().mapToDouble(Double::doubleValue).toArray(),
            newValue.stream().mapToDouble(Double::doubleValue).toArray()
        );
    }

    /**
     * Linear interpolation onto {@code grid}; outside this spectrum's domain the boundary
     * values are held constant.
     */
    public Spectrum resample(double[] grid) {
        requireData();
        double[] resampled = new double[grid.length];
        if (wavelength.length == 1) {
            Arrays.fill(resampled, value[0]);
            return new Spectrum(grid, resampled);
        }
        PolynomialSplineFunction interpolant = interpolant();
        for (int i = 0; i < grid.length; i++) {
            double x = Math.min(Math.max(grid[i], wavelengthMin), wavelengthMax);
            resampled[i] = interpolant.value(x);
        }
        return new Spectrum(grid, resampled);
    }

    /**
     * Linear interpolation onto {@code grid}; zero outside this spectrum's domain.
     */
    public Spectrum interpolateOrZero(double[] grid) {
        requireData();
        double[] resampled = new double[grid.length];
        if (wavelength.length == 1) {
            for (int i = 0; i < grid.length; i++) {
                resampled[i] = grid[i] == wavelength[0] ? value[0] : 0;
            }
            return new Spectrum(grid, resampled);
        }
        PolynomialSplineFunction interpolant = interpolant();
        for (int i = 0; i < grid.length; i++) {
            if (grid[i] >= wavelengthMin && grid[i] <= wavelengthMax) {
                resampled[i] = interpolant.value(grid[i]);
            }
        }
        return new Spectrum(grid, resampled);
    }

    private PolynomialSplineFunction interpolant() {
        return new LinearInterpolator().interpolate(wavelength, value);
    }

    private void requireData() {
        if (wavelength.length == 0) {
            throw new IllegalStateException("Cannot interpolate an empty spectrum");
        }
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof Spectrum)) return false;
        Spectrum other = (Spectrum) o;
        return Arrays.equals(wavelength, other.wavelength) && Arrays.equals(value, other.value);
    }

    @Override
    public int hashCode() {
        return 31 * Arrays.hashCode(wavelength) + Arrays.hashCode(value);
    }

    @Override
    public String toString() {
        return String.format(Locale.ROOT, "Spectrum(size=%d, wavelength=[%.2f, %.2f] nm)",
            size(), wavelengthMin, wavelengthMax);
    }
}
