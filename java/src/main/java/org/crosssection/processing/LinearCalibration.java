package org.crosssection.processing;

import org.crosssection.core.Spectrum;
import org.crosssection.core.exceptions.DomainMismatchException;
import org.crosssection.core.exceptions.NumericalException;

import java.util.Locale;

/**
 * Baseline ratio interpolated linearly in sample index through the point ratios at the two
 * calibration wavelengths.
 */
public final class LinearCalibration implements BaselineCalibrator {

    @Override
    public Spectrum ratio(Spectrum absorption, Spectrum reference, double lambda1, double lambda2) {
        checkGrids(absorption, reference);
        int idx1 = absorption.findNearestWavelength(lambda1);
        int idx2 = absorption.findNearestWavelength(lambda2);
        double y1 = pointRatio(absorption, reference, idx1);
        double y2 = pointRatio(absorption, reference, idx2);

        double[] ratio = new double[absorption.size()];
        for (int i = 0; i < ratio.length; i++) {
            ratio[i] = idx1 == idx2 ? y1 : y1 + (i - idx1) * (y2 - y1) / (idx2 - idx1);
        }
        return absorption.withValues(ratio);
    }

    private static double pointRatio(Spectrum absorption, Spectrum reference, int index) {
        double ratio = absorption.getValueAt(index) / reference.getValueAt(index);
        if (!Double.isFinite(ratio)) {
            throw new NumericalException(String.format(Locale.ROOT,
                "absorption/reference ratio at %.3f nm is not finite", absorption.getWavelengthAt(index)));
        }
        return ratio;
    }

    static void checkGrids(Spectrum absorption, Spectrum reference) {
        if (absorption.isEmpty()) {
            throw new DomainMismatchException("no samples to calibrate");
        }
        if (!absorption.hasSameGrid(reference)) {
            throw new DomainMismatchException("absorption and reference must share one grid");
        }
    }
}
