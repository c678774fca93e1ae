package org.crosssection.processing;

import org.crosssection.core.Spectrum;
import org.crosssection.core.exceptions.InvalidParameterException;

/**
 * Estimates the absorption/reference ratio of the baseline across the whole wavelength
 * domain from regions where the sample is known not to absorb. The reference channel is
 * multiplied by this ratio before the cross section is computed.
 */
public interface BaselineCalibrator {

    /**
     * @param absorption absorption channel
     * @param reference  reference channel on the same wavelength grid
     * @param lambda1    centre [nm] of the lower calibration region
     * @param lambda2    centre [nm] of the upper calibration region
     * @return ratio(λ) on the absorption grid
     */
    Spectrum ratio(Spectrum absorption, Spectrum reference, double lambda1, double lambda2);

    /**
     * Calibration strategy for a zero-absorption window width [nm]: two-point linear for 0,
     * cubic through four window averages otherwise.
     */
    static BaselineCalibrator forWindowWidth(double width) {
        if (!Double.isFinite(width) || width < 0) {
            throw new InvalidParameterException("zero absorption width must be non-negative, got " + width);
        }
        return width == 0 ? new LinearCalibration() : new CubicCalibration(width);
    }
}
