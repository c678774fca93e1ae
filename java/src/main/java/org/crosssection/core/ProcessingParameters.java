package org.crosssection.core;

import org.crosssection.core.exceptions.InvalidParameterException;

import java.util.*;

/**
 * Scalar processing settings of one recompute. Value-based equality makes instances usable
 * as memoization keys together with the raw data identity.
 */
public final class ProcessingParameters {
    public static final double DEFAULT_FLUORESCENCE_FILTER_WIDTH = 0.6;
    public static final int DEFAULT_SAVGOL_WINDOW = 20;
    public static final int DEFAULT_SAVGOL_ORDER = 3;
    public static final double DEFAULT_RECONCILIATION_TOLERANCE = 1e-5;
    public static final List<SmoothingBand> DEFAULT_SMOOTHING_BANDS = List.of(
        new SmoothingBand(990, 1150, 4),
        new SmoothingBand(1000, 1060, 6));

    private final double filterWidth;
    private final int savgolWindow;
    private final int savgolOrder;
    private final double fluorescenceFilterWidth;
    private final double reconciliationTolerance;
    private final List<SmoothingBand> smoothingBands;
    private final boolean useMcCumber;
    private final boolean useFuchtbauer;

    private ProcessingParameters(Builder b) {
        this.filterWidth = filterWidth("filter_width", b.filterWidth);
        this.fluorescenceFilterWidth = filterWidth("fluorescence_filter_width", b.fluorescenceFilterWidth);
        if (b.savgolWindow < 0 || b.savgolOrder < 0) {
            throw new InvalidParameterException("Savitzky-Golay window and order must be non-negative");
        }
        this.savgolWindow = b.savgolWindow;
        this.savgolOrder = b.savgolOrder;
        if (!Double.isFinite(b.reconciliationTolerance) || b.reconciliationTolerance < 0) {
            throw new InvalidParameterException("reconciliation tolerance must be non-negative");
        }
        this.reconciliationTolerance = b.reconciliationTolerance;
        this.smoothingBands = List.copyOf(b.smoothingBands);
        this.useMcCumber = b.useMcCumber;
        this.useFuchtbauer = b.useFuchtbauer;
    }

    public static ProcessingParameters defaults() { return builder().build(); }

    public static Builder builder() { return new Builder(); }

    public Builder toBuilder() {
        return new Builder()
            .filterWidth(filterWidth)
            .savgol(savgolWindow, savgolOrder)
            .fluorescenceFilterWidth(fluorescenceFilterWidth)
            .reconciliationTolerance(reconciliationTolerance)
            .smoothingBands(smoothingBands)
            .useMcCumber(useMcCumber)
            .useFuchtbauer(useFuchtbauer);
    }

    /** Fraction of the frequency band zeroed in the absorption and reference channels. */
    public double getFilterWidth() { return filterWidth; }
    public int getSavgolWindow() { return savgolWindow; }
    public int getSavgolOrder() { return savgolOrder; }
    public double getFluorescenceFilterWidth() { return fluorescenceFilterWidth; }
    public double getReconciliationTolerance() { return reconciliationTolerance; }
    public List<SmoothingBand> getSmoothingBands() { return smoothingBands; }
    public boolean isUseMcCumber() { return useMcCumber; }
    public boolean isUseFuchtbauer() { return useFuchtbauer; }

    private static double filterWidth(String key, double v) {
        if (!(v >= 0 && v <= 1)) {
            throw new InvalidParameterException(key + " must lie in [0, 1], got " + v);
        }
        return v;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof ProcessingParameters)) return false;
        ProcessingParameters p = (ProcessingParameters) o;
        return filterWidth == p.filterWidth && savgolWindow == p.savgolWindow
            && savgolOrder == p.savgolOrder && fluorescenceFilterWidth == p.fluorescenceFilterWidth
            && reconciliationTolerance == p.reconciliationTolerance
            && smoothingBands.equals(p.smoothingBands)
            && useMcCumber == p.useMcCumber && useFuchtbauer == p.useFuchtbauer;
    }

    @Override
    public int hashCode() {
        return Objects.hash(filterWidth, savgolWindow, savgolOrder, fluorescenceFilterWidth,
            reconciliationTolerance, smoothingBands, useMcCumber, useFuchtbauer);
    }

    @Override
    public String toString() {
        return String.format(Locale.ROOT,
            "ProcessingParameters(filter=%.2f, savgol=%d/%d, fluoFilter=%.2f, mcCumber=%b, fuchtbauer=%b)",
            filterWidth, savgolWindow, savgolOrder, fluorescenceFilterWidth, useMcCumber, useFuchtbauer);
    }

    public static final class Builder {
        private double filterWidth = 0;
        private int savgolWindow = DEFAULT_SAVGOL_WINDOW;
        private int savgolOrder = DEFAULT_SAVGOL_ORDER;
        private double fluorescenceFilterWidth = DEFAULT_FLUORESCENCE_FILTER_WIDTH;
        private double reconciliationTolerance = DEFAULT_RECONCILIATION_TOLERANCE;
        private List<SmoothingBand> smoothingBands = DEFAULT_SMOOTHING_BANDS;
        private boolean useMcCumber = true;
        private boolean useFuchtbauer = true;

        private Builder() {
        }

        public Builder filterWidth(double width) { this.filterWidth = width; return this; }

        public Builder savgol(int window, int order) {
            this.savgolWindow = window;
            this.savgolOrder = order;
            return this;
        }

        public Builder fluorescenceFilterWidth(double width) { this.fluorescenceFilterWidth = width; return this; }
        public Builder reconciliationTolerance(double tolerance) { this.reconciliationTolerance = tolerance; return this; }

        public Builder smoothingBands(List<SmoothingBand> bands) {
            this.smoothingBands = Objects.requireNonNull(bands, "bands");
            return this;
        }

        public Builder useMcCumber(boolean use) { this.useMcCumber = use; return this; }
        public Builder useFuchtbauer(boolean use) { this.useFuchtbauer = use; return this; }

        public ProcessingParameters build() {
            return new ProcessingParameters(this);
        }
    }
}
