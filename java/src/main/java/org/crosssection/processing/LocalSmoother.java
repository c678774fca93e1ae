package org.crosssection.processing;

import org.apache.commons.math3.linear.Array2DRowRealMatrix;
import org.apache.commons.math3.linear.RealMatrix;
import org.apache.commons.math3.linear.SingularValueDecomposition;

import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Local smoothing primitives: centred moving average and Savitzky-Golay polynomial filter.
 */
public final class LocalSmoother {

    private static final Logger logger = Logger.getLogger(LocalSmoother.class.getName());

    private LocalSmoother() {
    }

    /**
     * Centred moving average. The first and last {@code window / 2} samples keep the first and
     * last raw value; the output has the input's length.
     */
    public static double[] movingAverage(double[] x, int window) {
        if (window <= 1 || x.length == 0) {
            return x.clone();
        }
        int n = x.length;
        int half = window / 2;

        double[] cumsum = new double[n + 1];
        for (int i = 0; i < n; i++) {
            cumsum[i + 1] = cumsum[i] + x[i];
        }

        double[] smoothed = new double[n];
        for (int i = 0; i < n; i++) {
            if (i < half) {
                smoothed[i] = x[0];
            } else if (i >= n - half) {
                smoothed[i] = x[n - 1];
            } else {
                int start = i - half;
                int end = Math.min(n, start + window);
                smoothed[i] = (cumsum[end] - cumsum[start]) / window;
            }
        }
        return smoothed;
    }

    /**
     * Savitzky-Golay smoothing. Skipped unless {@code window > order}. Even windows are widened
     * to the next odd length, windows longer than the data shrunk to fit. Edge samples are
     * taken from the polynomial fitted to the first or last full window.
     */
    public static double[] savitzkyGolay(double[] y, int window, int order) {
        if (window <= order) {
            return y.clone();
        }
        int length = window % 2 == 0 ? window + 1 : window;
        if (length > y.length) {
            length = y.length % 2 == 0 ? y.length - 1 : y.length;
        }
        if (length <= order) {
            logger.log(Level.WARNING, "Savitzky-Golay window {0} does not fit {1} samples at order {2}, skipped",
                new Object[]{window, y.length, order});
            return y.clone();
        }
        if (length != window) {
            logger.log(Level.FINE, "Savitzky-Golay window adjusted from {0} to {1}", new Object[]{window, length});
        }

        int half = length / 2;
        RealMatrix fit = fitOperator(half, order);
        double[] smoothingRow = fit.getRow(0);

        int n = y.length;
        double[] smoothed = new double[n];
        for (int i = half; i < n - half; i++) {
            double acc = 0;
            for (int j = 0; j < length; j++) {
                acc += smoothingRow[j] * y[i - half + j];
            }
            smoothed[i] = acc;
        }

        double[] head = fit.operate(slice(y, 0, length));
        double[] tail = fit.operate(slice(y, n - length, length));
        for (int i = 0; i < half; i++) {
            smoothed[i] = evaluate(head, i - half);
            smoothed[n - half + i] = evaluate(tail, i + 1);
        }
        return smoothed;
    }

    /**
     * Least-squares operator mapping a window of 2*half+1 samples to the coefficients of the
     * local polynomial, with offsets measured from the window centre.
     */
    private static RealMatrix fitOperator(int half, int order) {
        int length = 2 * half + 1;
        double[][] vandermonde = new double[length][order + 1];
        for (int i = 0; i < length; i++) {
            double offset = i - half;
            double power = 1.0;
            for (int k = 0; k <= order; k++) {
                vandermonde[i][k] = power;
                power *= offset;
            }
        }
        SingularValueDecomposition svd = new SingularValueDecomposition(new Array2DRowRealMatrix(vandermonde));
        return svd.getSolver().getInverse();
    }

    private static double evaluate(double[] coefficients, double offset) {
        double result = 0;
        for (int k = coefficients.length - 1; k >= 0; k--) {
            result = result * offset + coefficients[k];
        }
        return result;
    }

    private static double[] slice(double[] values, int from, int length) {
        double[] out = new double[length];
        System.arraycopy(values, from, out, 0, length);
        return out;
    }
}
