package org.crosssection.physics;

import org.apache.commons.math3.analysis.UnivariateFunction;
import org.apache.commons.math3.analysis.integration.SimpsonIntegrator;
import org.apache.commons.math3.analysis.integration.UnivariateIntegrator;
import org.apache.commons.math3.analysis.interpolation.LinearInterpolator;
import org.apache.commons.math3.exception.MaxCountExceededException;
import org.crosssection.core.MaterialParameters;
import org.crosssection.core.PhysicalConstants;
import org.crosssection.core.Spectrum;
import org.crosssection.core.exceptions.NumericalException;

import java.util.Arrays;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Füchtbauer-Ladenburg emission cross section
 * <pre>
 *   σe(λ) = λ² / (8π n² τ) · λ³/c · I(λ)·A(λ) / ∫ I·λ·A dλ
 * </pre>
 * from a normalized fluorescence lineshape I. A(λ) = exp(N_dop · σa(λ) · depth) undoes the
 * reabsorption on the way out of the crystal; without σa it is 1.
 */
public final class FuchtbauerLadenburgCalculator {

    private static final Logger logger = Logger.getLogger(FuchtbauerLadenburgCalculator.class.getName());

    static final double RELATIVE_ACCURACY = 1e-6;
    static final double ABSOLUTE_ACCURACY = 0;
    static final int MIN_ITERATIONS = 3;
    static final int MAX_ITERATIONS = 24;

    private FuchtbauerLadenburgCalculator() {
    }

    /**
     * @param lineshape    normalized fluorescence, wavelengths in nm
     * @param material     refractive index, lifetime, doping and reabsorption depth
     * @param absorptionCs σa [cm²] on any grid, or null to skip the reabsorption correction
     */
    public static Spectrum calculate(Spectrum lineshape, MaterialParameters material, Spectrum absorptionCs) {
        int n = lineshape.size();
        if (n < 2) {
            throw new NumericalException("fluorescence lineshape needs at least two samples");
        }

        double[] correction = reabsorptionCorrection(lineshape, material, absorptionCs);
        double[] lambda = new double[n];
        double[] integrand = new double[n];
        for (int i = 0; i < n; i++) {
            lambda[i] = lineshape.getWavelengthAt(i) * PhysicalConstants.NM_TO_CM;
            integrand[i] = lineshape.getValueAt(i) * lambda[i] * correction[i];
        }

        double integral = integrate(lambda, integrand);
        if (integral == 0 || !Double.isFinite(integral)) {
            throw new NumericalException("lineshape integral is " + integral);
        }

        double refractive = material.getRefractiveIndex();
        double prefactor = 1 / (8 * Math.PI * refractive * refractive * material.getLifetime());
        double[] sigma = new double[n];
        for (int i = 0; i < n; i++) {
            double l = lambda[i];
            double g = l * l * l / PhysicalConstants.SPEED_OF_LIGHT
                * lineshape.getValueAt(i) * correction[i] / integral;
            sigma[i] = l * l * prefactor * g;
        }
        return lineshape.withValues(sigma);
    }

    static double[] reabsorptionCorrection(Spectrum lineshape, MaterialParameters material, Spectrum absorptionCs) {
        double[] correction = new double[lineshape.size()];
        if (absorptionCs == null || absorptionCs.isEmpty()) {
            Arrays.fill(correction, 1.0);
            return correction;
        }
        double[] sigmaA = absorptionCs.interpolateOrZero(lineshape.getWavelengths()).getValues();
        double attenuation = material.getDopingPerCm3() * material.getAbsorptionDepthCm();
        for (int i = 0; i < correction.length; i++) {
            correction[i] = Math.exp(attenuation * sigmaA[i]);
        }
        return correction;
    }

    /**
     * Adaptive Simpson quadrature of the piecewise-linear interpolant through the samples.
     */
    static double integrate(double[] x, double[] y) {
        UnivariateFunction interpolant = new LinearInterpolator().interpolate(x, y);
        UnivariateIntegrator integrator = new SimpsonIntegrator(
            RELATIVE_ACCURACY, ABSOLUTE_ACCURACY, MIN_ITERATIONS, MAX_ITERATIONS);
        try {
            double result = integrator.integrate(Integer.MAX_VALUE, interpolant, x[0], x[x.length - 1]);
            logger.log(Level.FINE, "Lineshape integral {0} after {1} evaluations",
                new Object[]{result, integrator.getEvaluations()});
            return result;
        } catch (MaxCountExceededException e) {
            throw new NumericalException("lineshape integral did not converge", e);
        }
    }
}
