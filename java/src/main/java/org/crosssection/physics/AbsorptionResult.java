package org.crosssection.physics;

import org.crosssection.core.Spectrum;

/**
 * Absorption cross section together with the intermediate curves it was derived from.
 */
public final class AbsorptionResult {
    private final Spectrum crossSection;
    private final Spectrum absorption;
    private final Spectrum reference;
    private final Spectrum ratio;

    public AbsorptionResult(Spectrum crossSection, Spectrum absorption, Spectrum reference, Spectrum ratio) {
        this.crossSection = crossSection;
        this.absorption = absorption;
        this.reference = reference;
        this.ratio = ratio;
    }

    /** σa(λ) [cm²]. */
    public Spectrum getCrossSection() { return crossSection; }

    /** Trimmed and filtered absorption channel. */
    public Spectrum getAbsorption() { return absorption; }

    /** Reference channel after filtering and rescaling by the baseline ratio. */
    public Spectrum getReference() { return reference; }

    public Spectrum getRatio() { return ratio; }

    /**
     * Reference channel before rescaling.
     */
    public Spectrum getRawReference() {
        double[] raw = new double[reference.size()];
        for (int i = 0; i < raw.length; i++) {
            raw[i] = reference.getValueAt(i) / ratio.getValueAt(i);
        }
        return reference.withValues(raw);
    }
}
