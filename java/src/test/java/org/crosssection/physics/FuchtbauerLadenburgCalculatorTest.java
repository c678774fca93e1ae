package org.crosssection.physics;

import org.crosssection.core.MaterialParameters;
import org.crosssection.core.PhysicalConstants;
import org.crosssection.core.Spectrum;
import org.crosssection.core.exceptions.NumericalException;
import org.junit.jupiter.api.Test;

import java.util.Arrays;

import static org.crosssection.physics.PhysicsTestUtils.*;
import static org.junit.jupiter.api.Assertions.*;

public class FuchtbauerLadenburgCalculatorTest {

    private static Spectrum flatLineshape() {
        double[] x = grid(1000, 1100, 1);
        double[] y = new double[x.length];
        Arrays.fill(y, 1.0 / x.length);
        return new Spectrum(x, y);
    }

    @Test
    public void testFlatLineshapeMatchesClosedForm() {
        Spectrum lineshape = flatLineshape();
        MaterialParameters material = material();

        Spectrum sigma = FuchtbauerLadenburgCalculator.calculate(lineshape, material, null);

        double intensity = lineshape.getValueAt(0);
        double a = 1000e-7;
        double b = 1100e-7;
        double integral = intensity * (b * b - a * a) / 2;
        double prefactor = 1 / (8 * Math.PI * 1.8 * 1.8 * 1e-3);
        for (int i = 0; i < sigma.size(); i++) {
            double l = lineshape.getWavelengthAt(i) * 1e-7;
            double expected = l * l * prefactor * l * l * l / PhysicalConstants.SPEED_OF_LIGHT * intensity / integral;
            assertEquals(expected, sigma.getValueAt(i), 1e-5 * expected, "index " + i);
        }
    }

    @Test
    public void testScalesInverselyWithLifetime() {
        Spectrum lineshape = gaussian(grid(980, 1080, 0.5), 1, 1030, 8);
        Spectrum shortLived = FuchtbauerLadenburgCalculator.calculate(lineshape, material(), null);
        Spectrum longLived = FuchtbauerLadenburgCalculator.calculate(lineshape,
            material().toBuilder().lifetime(2e-3).build(), null);

        for (int i = 0; i < lineshape.size(); i++) {
            assertEquals(shortLived.getValueAt(i) / 2, longLived.getValueAt(i), 1e-12 * shortLived.getValueAt(i));
        }
    }

    @Test
    public void testUniformReabsorptionCancels() {
        Spectrum lineshape = gaussian(grid(980, 1080, 0.5), 1, 1030, 8);
        Spectrum uniform = new Spectrum(new double[]{950, 1100}, new double[]{1e-20, 1e-20});
        MaterialParameters deep = material().toBuilder().absorptionDepth(1).build();

        Spectrum plain = FuchtbauerLadenburgCalculator.calculate(lineshape, deep, null);
        Spectrum corrected = FuchtbauerLadenburgCalculator.calculate(lineshape, deep, uniform);

        assertArrayEquals(plain.getValues(), corrected.getValues(), 1e-6 * max(plain));
    }

    @Test
    public void testReabsorptionCorrection() {
        Spectrum lineshape = flatLineshape();
        // absorbs only below 1050 nm
        Spectrum partial = new Spectrum(new double[]{900, 1050}, new double[]{1e-20, 1e-20});
        MaterialParameters deep = material().toBuilder().absorptionDepth(1).build();

        double[] correction = FuchtbauerLadenburgCalculator.reabsorptionCorrection(lineshape, deep, partial);
        assertEquals(Math.exp(0.1), correction[0], 1e-12);
        assertEquals(Math.exp(0.1), correction[50], 1e-12);
        assertEquals(1, correction[51], 0);

        Spectrum plain = FuchtbauerLadenburgCalculator.calculate(lineshape, deep, null);
        Spectrum corrected = FuchtbauerLadenburgCalculator.calculate(lineshape, deep, partial);
        assertTrue(corrected.getValueAt(10) > plain.getValueAt(10));
        assertTrue(corrected.getValueAt(90) < plain.getValueAt(90));
    }

    @Test
    public void testIntegrateLinearFunction() {
        double[] x = {0, 1, 3};
        double[] y = {0, 2, 2};
        assertEquals(5, FuchtbauerLadenburgCalculator.integrate(x, y), 1e-5);
    }

    @Test
    public void testFailures() {
        assertThrows(NumericalException.class, () -> FuchtbauerLadenburgCalculator.calculate(
            new Spectrum(new double[]{1000}, new double[]{1}), material(), null));
        assertThrows(NumericalException.class, () -> FuchtbauerLadenburgCalculator.calculate(
            new Spectrum(new double[]{1000, 1001}, new double[]{0, 0}), material(), null));
    }

    private static double max(Spectrum s) {
        double m = 0;
        for (double v : s.getValues()) m = Math.max(m, Math.abs(v));
        return m;
    }
}
