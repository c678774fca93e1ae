package org.crosssection.physics;

import org.crosssection.core.ProcessingParameters;
import org.crosssection.core.RawChannelSet;
import org.crosssection.core.SmoothingBand;
import org.crosssection.core.Spectrum;
import org.crosssection.core.exceptions.NumericalException;
import org.crosssection.processing.FrequencyBandFilter;
import org.crosssection.processing.LocalSmoother;

import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Turns one fluorescence curve, or a low/high-temperature pair, into a lineshape whose values
 * sum to one.
 */
public final class FluorescenceNormalizer {

    private static final Logger logger = Logger.getLogger(FluorescenceNormalizer.class.getName());

    private FluorescenceNormalizer() {
    }

    public static FluorescenceResult normalize(RawChannelSet raw, ProcessingParameters processing) {
        raw.requireFluorescence();
        if (raw.isTemperatureCorrected()) {
            return normalize(raw.getFluorescenceLow(), raw.getFluorescenceHigh(), processing);
        }
        return new FluorescenceResult(postProcess(raw.getFluorescence(), processing), null, null);
    }

    /**
     * Merge a low/high-temperature pair. Where the normalized curves differ by more than the
     * reconciliation tolerance the smaller value is kept, elsewhere the low-temperature one.
     */
    public static FluorescenceResult normalize(Spectrum low, Spectrum high, ProcessingParameters processing) {
        Spectrum lowNorm = toUnitSum(low);
        Spectrum highNorm = toUnitSum(high);
        if (!highNorm.hasSameGrid(lowNorm)) {
            logger.fine("Interpolating high-temperature fluorescence onto the low-temperature grid");
            highNorm = toUnitSum(high.resample(low.getWavelengths()));
        }

        double tolerance = processing.getReconciliationTolerance();
        double[] merged = lowNorm.getValues();
        int replaced = 0;
        for (int i = 0; i < merged.length; i++) {
            double l = lowNorm.getValueAt(i);
            double h = highNorm.getValueAt(i);
            if (Math.abs(h - l) > tolerance) {
                merged[i] = Math.min(l, h);
                replaced++;
            }
        }
        logger.log(Level.FINE, "Fluorescence merge replaced {0} of {1} samples", new Object[]{replaced, merged.length});

        Spectrum lineshape = postProcess(lowNorm.withValues(merged), processing);
        return new FluorescenceResult(lineshape, lowNorm, highNorm);
    }

    static Spectrum postProcess(Spectrum fluorescence, ProcessingParameters processing) {
        double[] values = fluorescence.getValues();
        for (SmoothingBand band : processing.getSmoothingBands()) {
            int[] interval = fluorescence.findInterval(band.getLower(), band.getUpper());
            int from = interval[0];
            int to = interval[1];
            if (to - from < 1) continue;
            double[] section = new double[to - from];
            System.arraycopy(values, from, section, 0, section.length);
            double[] smoothed = LocalSmoother.movingAverage(section, band.getWindow());
            System.arraycopy(smoothed, 0, values, from, smoothed.length);
        }
        Spectrum normalized = toUnitSum(fluorescence.withValues(values));
        return FrequencyBandFilter.apply(normalized, processing.getFluorescenceFilterWidth());
    }

    /**
     * Scale values so that they sum to one.
     */
    static Spectrum toUnitSum(Spectrum spectrum) {
        double total = spectrum.sum();
        if (total == 0 || !Double.isFinite(total)) {
            throw new NumericalException("cannot normalize fluorescence with total intensity " + total);
        }
        double[] values = spectrum.getValues();
        for (int i = 0; i < values.length; i++) {
            values[i] /= total;
        }
        return spectrum.withValues(values);
    }
}
