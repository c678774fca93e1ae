package org.crosssection.physics;

import org.crosssection.core.Spectrum;
import org.crosssection.core.exceptions.DomainMismatchException;

import java.util.*;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Crossfades the Füchtbauer-Ladenburg emission curve, used above {@code flMin}, with the
 * McCumber emission curve, used below {@code mcMax}. Where both apply the curves are blended
 * with raised-cosine weights so that the composite has no step at the handover. A gap
 * between the cutoffs is filled from the nearest covered wavelength.
 */
public final class SpectralBlender {

    private static final Logger logger = Logger.getLogger(SpectralBlender.class.getName());

    private SpectralBlender() {
    }

    public static BlendResult blend(Spectrum fuchtbauer, Spectrum mcCumber, double flMin, double mcMax) {
        if (fuchtbauer.isEmpty() || mcCumber.isEmpty()) {
            throw new DomainMismatchException("cannot blend an empty emission curve");
        }
        double[] grid = commonGrid(fuchtbauer, mcCumber);
        Spectrum fl = fuchtbauer.resample(grid);
        Spectrum mc = mcCumber.resample(grid);
        int n = grid.length;

        boolean[] flActive = new boolean[n];
        boolean[] mcActive = new boolean[n];
        boolean[] overlap = new boolean[n];
        for (int i = 0; i < n; i++) {
            flActive[i] = grid[i] >= flMin;
            mcActive[i] = grid[i] <= mcMax;
            overlap[i] = flActive[i] && mcActive[i];
        }

        double[] flWeight = new double[n];
        double[] mcWeight = new double[n];
        for (int i = 0; i < n; i++) {
            if (flActive[i] && !mcActive[i]) flWeight[i] = 1;
            if (mcActive[i] && !flActive[i]) mcWeight[i] = 1;
        }

        for (int[] run : findRuns(overlap)) {
            int start = run[0];
            int length = run[1];
            boolean mcDeparts = mcDeparts(start, length, flActive, mcActive);
            double[] fade = raisedCosine(length);
            for (int j = 0; j < length; j++) {
                mcWeight[start + j] = mcDeparts ? fade[j] : 1 - fade[j];
                flWeight[start + j] = 1 - mcWeight[start + j];
            }
            logger.log(Level.FINE, "Crossfade over {0} samples from {1} nm, {2} departing",
                new Object[]{length, grid[start], mcDeparts ? "McCumber" : "Fuchtbauer"});
        }

        fillUncovered(flWeight, mcWeight, flActive, mcActive);

        double[] composite = new double[n];
        for (int i = 0; i < n; i++) {
            composite[i] = flWeight[i] * fl.getValueAt(i) + mcWeight[i] * mc.getValueAt(i);
        }
        return new BlendResult(new Spectrum(grid, composite), fl, mc, flWeight, mcWeight);
    }

    /**
     * Samples covered by neither cutoff copy the weights of the nearest covered sample (the
     * lower one on ties). Without any covered sample all weights stay zero.
     */
    static void fillUncovered(double[] flWeight, double[] mcWeight, boolean[] flActive, boolean[] mcActive) {
        int n = flWeight.length;
        int[] left = new int[n];
        int last = -1;
        for (int i = 0; i < n; i++) {
            if (flActive[i] || mcActive[i]) last = i;
            left[i] = last;
        }
        int next = -1;
        for (int i = n - 1; i >= 0; i--) {
            if (flActive[i] || mcActive[i]) {
                next = i;
                continue;
            }
            int source = left[i];
            if (source < 0 || (next >= 0 && next - i < i - source)) {
                source = next;
            }
            if (source >= 0) {
                flWeight[i] = flWeight[source];
                mcWeight[i] = mcWeight[source];
            }
        }
    }

    /**
     * Uniform grid from the smallest to the largest wavelength of both curves with a step no
     * coarser than the finer of their mean spacings.
     */
    static double[] commonGrid(Spectrum a, Spectrum b) {
        double start = Math.min(a.getWavelengthMin(), b.getWavelengthMin());
        double end = Math.max(a.getWavelengthMax(), b.getWavelengthMax());
        double step = finerSpacing(a.meanSpacing(), b.meanSpacing());
        if (end == start || step == 0) {
            return end == start ? new double[]{start} : new double[]{start, end};
        }
        int intervals = (int) Math.ceil((end - start) / step - 1e-9);
        double[] grid = new double[intervals + 1];
        for (int i = 0; i <= intervals; i++) {
            grid[i] = start + (end - start) * i / intervals;
        }
        grid[intervals] = end;
        return grid;
    }

    private static double finerSpacing(double a, double b) {
        if (a == 0) return b;
        if (b == 0) return a;
        return Math.min(a, b);
    }

    /**
     * Contiguous true runs as {start, length}, located from the rising and falling edges of the
     * zero-padded indicator.
     */
    static List<int[]> findRuns(boolean[] indicator) {
        List<int[]> runs = new ArrayList<>();
        int start = -1;
        for (int i = 0; i <= indicator.length; i++) {
            int previous = i > 0 && indicator[i - 1] ? 1 : 0;
            int current = i < indicator.length && indicator[i] ? 1 : 0;
            int edge = current - previous;
            if (edge == 1) {
                start = i;
            } else if (edge == -1) {
                runs.add(new int[]{start, i - start});
            }
        }
        return runs;
    }

    /**
     * Weight of the departing curve: 0.5·(1 + cos(π·i/(L−1))), falling from 1 to 0.
     */
    static double[] raisedCosine(int length) {
        double[] weight = new double[length];
        if (length == 1) {
            weight[0] = 1;
            return weight;
        }
        for (int i = 0; i < length; i++) {
            weight[i] = 0.5 * (1 + Math.cos(Math.PI * i / (length - 1)));
        }
        return weight;
    }

    /**
     * The departing curve is the one active just before the run; failing that, the one not
     * active just after it. A run covering the whole grid hands over from McCumber.
     */
    private static boolean mcDeparts(int start, int length, boolean[] flActive, boolean[] mcActive) {
        int before = start - 1;
        int after = start + length;
        if (before >= 0 && flActive[before] != mcActive[before]) {
            return mcActive[before];
        }
        if (after < flActive.length && flActive[after] != mcActive[after]) {
            return flActive[after];
        }
        return true;
    }
}
