package org.crosssection.processing;

import org.apache.commons.math3.analysis.polynomials.PolynomialFunction;
import org.apache.commons.math3.linear.Array2DRowRealMatrix;
import org.apache.commons.math3.linear.ArrayRealVector;
import org.apache.commons.math3.linear.DecompositionSolver;
import org.apache.commons.math3.linear.LUDecomposition;
import org.apache.commons.math3.linear.RealMatrix;
import org.apache.commons.math3.linear.RealVector;
import org.crosssection.core.Spectrum;
import org.crosssection.core.exceptions.CalibrationException;
import org.crosssection.core.exceptions.NumericalException;

import java.util.Arrays;
import java.util.Locale;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Baseline ratio given by the cubic through four averaged points, two from each calibration
 * window. Each window is cut into five sub-segments and the first and last of them are
 * averaged.
 */
public final class CubicCalibration implements BaselineCalibrator {

    private static final Logger logger = Logger.getLogger(CubicCalibration.class.getName());

    static final int SUB_SEGMENTS = 5;

    private final double width;

    /**
     * @param width calibration window width [nm], converted to samples with the mean spacing
     */
    public CubicCalibration(double width) {
        if (!(width > 0) || Double.isInfinite(width)) {
            throw new IllegalArgumentException("cubic calibration needs a positive window width, got " + width);
        }
        this.width = width;
    }

    public double getWidth() { return width; }

    @Override
    public Spectrum ratio(Spectrum absorption, Spectrum reference, double lambda1, double lambda2) {
        LinearCalibration.checkGrids(absorption, reference);
        int n = absorption.size();
        double spacing = absorption.meanSpacing();
        int pixels = spacing > 0 ? (int) Math.round(width / spacing) : 0;
        int idx1 = absorption.findNearestWavelength(lambda1);
        int idx2 = absorption.findNearestWavelength(lambda2);

        double[][] lower = windowPoints(absorption, reference, idx1, pixels, n);
        double[][] upper = windowPoints(absorption, reference, idx2, pixels, n);
        double[] x = {lower[0][0], lower[1][0], upper[0][0], upper[1][0]};
        double[] y = {lower[0][1], lower[1][1], upper[0][1], upper[1][1]};

        logger.log(Level.FINE, "Calibration points x={0} y={1}",
            new Object[]{Arrays.toString(x), Arrays.toString(y)});

        PolynomialFunction cubic = solveCubic(x, y);

        double centre = (x[0] + x[1] + x[2] + x[3]) / 4;
        double scale = scale(x, centre);
        double[] ratio = new double[n];
        for (int i = 0; i < n; i++) {
            ratio[i] = cubic.value((absorption.getWavelengthAt(i) - centre) / scale);
        }
        return absorption.withValues(ratio);
    }

    /**
     * Averaged (λ, absorption/reference) of the first and last fifth of the window of
     * {@code pixels} samples around {@code centre}.
     */
    private static double[][] windowPoints(Spectrum absorption, Spectrum reference, int centre, int pixels, int n) {
        int start = Math.max(0, centre - pixels / 2);
        int stop = Math.min(n, centre + pixels / 2);
        int length = stop - start;
        if (length <= 0) {
            throw new CalibrationException(String.format(Locale.ROOT,
                "empty averaging window around %.3f nm (width %d samples)",
                absorption.getWavelengthAt(centre), pixels));
        }
        int subLength = Math.max(1, length / SUB_SEGMENTS);
        return new double[][]{
            average(absorption, reference, start, start + subLength),
            average(absorption, reference, stop - subLength, stop)
        };
    }

    private static double[] average(Spectrum absorption, Spectrum reference, int from, int to) {
        double sumX = 0;
        double sumAbs = 0;
        double sumRef = 0;
        for (int i = from; i < to; i++) {
            sumX += absorption.getWavelengthAt(i);
            sumAbs += absorption.getValueAt(i);
            sumRef += reference.getValueAt(i);
        }
        int count = to - from;
        double ratio = (sumAbs / count) / (sumRef / count);
        if (!Double.isFinite(ratio)) {
            throw new NumericalException(String.format(Locale.ROOT,
                "absorption/reference ratio over %.3f-%.3f nm is not finite",
                absorption.getWavelengthAt(from), absorption.getWavelengthAt(to - 1)));
        }
        return new double[]{sumX / count, ratio};
    }

    /**
     * Unique cubic through four points. The abscissae are centred and scaled to [-1, 1] before
     * the Vandermonde system is solved; the returned polynomial takes scaled arguments.
     */
    static PolynomialFunction solveCubic(double[] x, double[] y) {
        for (int i = 0; i < x.length; i++) {
            for (int j = i + 1; j < x.length; j++) {
                if (x[i] == x[j]) {
                    throw new CalibrationException(String.format(Locale.ROOT,
                        "calibration points are not distinct (x=%s)", Arrays.toString(x)));
                }
            }
        }
        double centre = (x[0] + x[1] + x[2] + x[3]) / 4;
        double scale = scale(x, centre);

        double[][] vandermonde = new double[4][4];
        for (int i = 0; i < 4; i++) {
            double t = (x[i] - centre) / scale;
            double power = 1.0;
            for (int k = 0; k < 4; k++) {
                vandermonde[i][k] = power;
                power *= t;
            }
        }
        RealMatrix matrix = new Array2DRowRealMatrix(vandermonde);
        DecompositionSolver solver = new LUDecomposition(matrix).getSolver();
        if (!solver.isNonSingular()) {
            throw new CalibrationException("calibration system is singular (x=" + Arrays.toString(x) + ")");
        }
        RealVector coefficients = solver.solve(new ArrayRealVector(y));
        return new PolynomialFunction(coefficients.toArray());
    }

    private static double scale(double[] x, double centre) {
        double scale = 0;
        for (double v : x) {
            scale = Math.max(scale, Math.abs(v - centre));
        }
        return scale == 0 ? 1 : scale;
    }
}
