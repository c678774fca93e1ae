package org.crosssection.physics;

import org.crosssection.core.Spectrum;

/**
 * Composite emission cross section with the resampled source curves and the weight each
 * source received at every grid point.
 */
public final class BlendResult {
    private final Spectrum composite;
    private final Spectrum fuchtbauer;
    private final Spectrum mcCumber;
    private final double[] fuchtbauerWeight;
    private final double[] mcCumberWeight;

    BlendResult(Spectrum composite, Spectrum fuchtbauer, Spectrum mcCumber,
                double[] fuchtbauerWeight, double[] mcCumberWeight) {
        this.composite = composite;
        this.fuchtbauer = fuchtbauer;
        this.mcCumber = mcCumber;
        this.fuchtbauerWeight = fuchtbauerWeight;
        this.mcCumberWeight = mcCumberWeight;
    }

    public Spectrum getComposite() { return composite; }

    /** Füchtbauer-Ladenburg curve resampled onto the common grid. */
    public Spectrum getFuchtbauer() { return fuchtbauer; }

    /** McCumber curve resampled onto the common grid. */
    public Spectrum getMcCumber() { return mcCumber; }

    public double[] getFuchtbauerWeight() { return fuchtbauerWeight.clone(); }
    public double[] getMcCumberWeight() { return mcCumberWeight.clone(); }
}
