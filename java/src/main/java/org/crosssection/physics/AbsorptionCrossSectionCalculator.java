package org.crosssection.physics;

import org.crosssection.core.MaterialParameters;
import org.crosssection.core.ProcessingParameters;
import org.crosssection.core.RawChannelSet;
import org.crosssection.core.Spectrum;
import org.crosssection.core.exceptions.DomainMismatchException;
import org.crosssection.core.exceptions.NumericalException;
import org.crosssection.processing.BaselineCalibrator;
import org.crosssection.processing.FrequencyBandFilter;
import org.crosssection.processing.LocalSmoother;
import org.crosssection.processing.SpectralStitcher;

import java.util.List;
import java.util.Locale;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Absorption cross section σa(λ) = |ln(reference/absorption)| / (N_dop · L) from the
 * absorption and reference channels of a transmission measurement.
 */
public final class AbsorptionCrossSectionCalculator {

    private static final Logger logger = Logger.getLogger(AbsorptionCrossSectionCalculator.class.getName());

    private AbsorptionCrossSectionCalculator() {
    }

    public static AbsorptionResult calculate(RawChannelSet raw, MaterialParameters material,
                                             ProcessingParameters processing) {
        List<Spectrum> absorptionSegments = raw.requireAbsorption();
        List<Spectrum> referenceSegments = raw.requireReference();
        Spectrum absorption = absorptionSegments.size() > 1
            ? SpectralStitcher.stitch(absorptionSegments) : absorptionSegments.get(0);
        Spectrum reference = referenceSegments.size() > 1
            ? SpectralStitcher.stitch(referenceSegments) : referenceSegments.get(0);
        return calculate(absorption, reference, material, processing);
    }

    public static AbsorptionResult calculate(Spectrum absorption, Spectrum reference,
                                             MaterialParameters material, ProcessingParameters processing) {
        double low = Math.max(absorption.getWavelengthMin(), reference.getWavelengthMin());
        double high = Math.min(absorption.getWavelengthMax(), reference.getWavelengthMax());
        absorption = absorption.extractRange(low, high);
        reference = reference.extractRange(low, high);
        if (absorption.isEmpty() || reference.isEmpty()) {
            throw new DomainMismatchException(String.format(Locale.ROOT,
                "absorption and reference share no samples in %.2f-%.2f nm", low, high));
        }
        if (!absorption.hasSameGrid(reference)) {
            reference = reference.resample(absorption.getWavelengths());
        }

        absorption = FrequencyBandFilter.apply(absorption, processing.getFilterWidth());
        reference = FrequencyBandFilter.apply(reference, processing.getFilterWidth());

        BaselineCalibrator calibrator = BaselineCalibrator.forWindowWidth(material.getZeroAbsorptionWidth());
        Spectrum ratio = calibrator.ratio(absorption, reference,
            material.getZeroAbsorptionLambda1(), material.getZeroAbsorptionLambda2());

        double[] scaled = new double[reference.size()];
        for (int i = 0; i < scaled.length; i++) {
            scaled[i] = reference.getValueAt(i) * ratio.getValueAt(i);
        }
        reference = reference.withValues(scaled);

        double columnDensity = material.getDopingPerCm3() * material.getLengthCm();
        double[] sigma = new double[absorption.size()];
        for (int i = 0; i < sigma.length; i++) {
            sigma[i] = Math.abs(Math.log(scaled[i] / absorption.getValueAt(i))) / columnDensity;
            if (!Double.isFinite(sigma[i])) {
                throw new NumericalException(String.format(Locale.ROOT,
                    "absorption cross section at %.3f nm is not finite (reference %.4g, absorption %.4g)",
                    absorption.getWavelengthAt(i), scaled[i], absorption.getValueAt(i)));
            }
        }
        sigma = LocalSmoother.savitzkyGolay(sigma, processing.getSavgolWindow(), processing.getSavgolOrder());

        logger.log(Level.FINE, "Absorption cross section on {0} samples, calibration {1}",
            new Object[]{sigma.length, calibrator.getClass().getSimpleName()});
        return new AbsorptionResult(absorption.withValues(sigma), absorption, reference, ratio);
    }
}
