package org.crosssection.processing;

import org.apache.commons.math3.complex.Complex;
import org.apache.commons.math3.transform.DftNormalization;
import org.apache.commons.math3.transform.FastFourierTransformer;
import org.apache.commons.math3.transform.TransformType;
import org.apache.commons.math3.util.ArithmeticUtils;

/**
 * DFT of arbitrary length. Power-of-two lengths go straight to the radix-2 FFT of
 * commons-math3; other lengths are evaluated with Bluestein's chirp-z algorithm, which
 * rewrites the DFT as a convolution computed with zero-padded power-of-two FFTs.
 * Forward transforms are unnormalized, inverse transforms divide by n.
 */
final class DiscreteFourierTransform {

    private static final FastFourierTransformer FFT = new FastFourierTransformer(DftNormalization.STANDARD);

    private DiscreteFourierTransform() {
    }

    static Complex[] forward(double[] values) {
        Complex[] input = new Complex[values.length];
        for (int i = 0; i < values.length; i++) {
            input[i] = new Complex(values[i], 0);
        }
        return transform(input);
    }

    static Complex[] inverse(Complex[] spectrum) {
        int n = spectrum.length;
        // ifft(X) = conj(fft(conj(X))) / n
        Complex[] conjugated = new Complex[n];
        for (int i = 0; i < n; i++) {
            conjugated[i] = spectrum[i].conjugate();
        }
        Complex[] transformed = transform(conjugated);
        Complex[] result = new Complex[n];
        for (int i = 0; i < n; i++) {
            result[i] = transformed[i].conjugate().divide(n);
        }
        return result;
    }

    private static Complex[] transform(Complex[] input) {
        int n = input.length;
        if (n <= 1) {
            return input.clone();
        }
        if (ArithmeticUtils.isPowerOfTwo(n)) {
            return FFT.transform(input, TransformType.FORWARD);
        }
        return bluestein(input);
    }

    private static Complex[] bluestein(Complex[] input) {
        int n = input.length;
        int m = Integer.highestOneBit(2 * n - 1);
        if (m < 2 * n - 1) m <<= 1;

        // w[k] = exp(-i pi k^2 / n); k^2 reduced mod 2n keeps the angle small
        Complex[] chirp = new Complex[n];
        for (int k = 0; k < n; k++) {
            long kk = ((long) k * k) % (2L * n);
            double angle = Math.PI * kk / n;
            chirp[k] = new Complex(Math.cos(angle), -Math.sin(angle));
        }

        Complex[] a = new Complex[m];
        Complex[] b = new Complex[m];
        for (int i = 0; i < m; i++) {
            a[i] = Complex.ZERO;
            b[i] = Complex.ZERO;
        }
        for (int k = 0; k < n; k++) {
            a[k] = input[k].multiply(chirp[k]);
        }
        b[0] = chirp[0].conjugate();
        for (int k = 1; k < n; k++) {
            b[k] = chirp[k].conjugate();
            b[m - k] = chirp[k].conjugate();
        }

        Complex[] fa = FFT.transform(a, TransformType.FORWARD);
        Complex[] fb = FFT.transform(b, TransformType.FORWARD);
        Complex[] product = new Complex[m];
        for (int i = 0; i < m; i++) {
            product[i] = fa[i].multiply(fb[i]);
        }
        Complex[] convolution = FFT.transform(product, TransformType.INVERSE);

        Complex[] result = new Complex[n];
        for (int k = 0; k < n; k++) {
            result[k] = convolution[k].multiply(chirp[k]);
        }
        return result;
    }
}
