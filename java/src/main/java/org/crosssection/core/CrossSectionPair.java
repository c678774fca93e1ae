package org.crosssection.core;

import org.crosssection.core.exceptions.DomainMismatchException;

/**
 * Absorption and emission cross sections [cm²] on one wavelength grid [nm].
 */
public final class CrossSectionPair {
    private final Spectrum absorption;
    private final Spectrum emission;

    public CrossSectionPair(Spectrum absorption, Spectrum emission) {
        if (!absorption.hasSameGrid(emission)) {
            throw new DomainMismatchException("absorption and emission cross sections must share one grid");
        }
        this.absorption = absorption;
        this.emission = emission;
    }

    public Spectrum getAbsorption() { return absorption; }
    public Spectrum getEmission() { return emission; }
    public int size() { return absorption.size(); }

    /**
     * Inversion fraction β(λ) = σa / (σa + σe) at which the crystal becomes transparent.
     */
    public Spectrum equilibriumInversion() {
        double[] beta = new double[size()];
        for (int i = 0; i < beta.length; i++) {
            double a = absorption.getValueAt(i);
            double e = emission.getValueAt(i);
            beta[i] = a + e == 0 ? 0 : a / (a + e);
        }
        return absorption.withValues(beta);
    }

    /**
     * Effective gain cross section β·σe − (1 − β)·σa for the inversion fraction β.
     */
    public Spectrum gainCrossSection(double beta) {
        if (!(beta >= 0 && beta <= 1)) {
            throw new IllegalArgumentException("inversion fraction must lie in [0, 1], got " + beta);
        }
        double[] gain = new double[size()];
        for (int i = 0; i < gain.length; i++) {
            gain[i] = beta * emission.getValueAt(i) - (1 - beta) * absorption.getValueAt(i);
        }
        return absorption.withValues(gain);
    }

    @Override
    public String toString() {
        return "CrossSectionPair(" + absorption + ")";
    }
}
