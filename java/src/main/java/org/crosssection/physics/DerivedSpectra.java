package org.crosssection.physics;

import org.crosssection.core.CrossSectionPair;
import org.crosssection.core.Spectrum;

/**
 * Everything one pipeline run produces. Stages that were disabled or had no input are null.
 */
public final class DerivedSpectra {
    private final AbsorptionResult absorption;
    private final FluorescenceResult fluorescence;
    private final Spectrum fuchtbauerEmission;
    private final Spectrum mcCumberEmission;
    private final BlendResult blend;
    private final Spectrum compositeAbsorption;

    DerivedSpectra(AbsorptionResult absorption, FluorescenceResult fluorescence,
                   Spectrum fuchtbauerEmission, Spectrum mcCumberEmission,
                   BlendResult blend, Spectrum compositeAbsorption) {
        this.absorption = absorption;
        this.fluorescence = fluorescence;
        this.fuchtbauerEmission = fuchtbauerEmission;
        this.mcCumberEmission = mcCumberEmission;
        this.blend = blend;
        this.compositeAbsorption = compositeAbsorption;
    }

    public AbsorptionResult getAbsorption() { return absorption; }
    public FluorescenceResult getFluorescence() { return fluorescence; }
    public Spectrum getFuchtbauerEmission() { return fuchtbauerEmission; }
    public Spectrum getMcCumberEmission() { return mcCumberEmission; }
    public BlendResult getBlend() { return blend; }
    public Spectrum getCompositeAbsorption() { return compositeAbsorption; }

    public boolean hasBlend() { return blend != null; }

    /**
     * σa from the transmission measurement, or null without absorption channels.
     */
    public Spectrum getAbsorptionCrossSection() {
        return absorption == null ? null : absorption.getCrossSection();
    }

    /**
     * Best available emission cross section: the composite when both methods ran, otherwise
     * whichever one did.
     */
    public Spectrum getEmissionCrossSection() {
        if (blend != null) return blend.getComposite();
        return fuchtbauerEmission != null ? fuchtbauerEmission : mcCumberEmission;
    }

    /**
     * Composite absorption and emission on the blend grid, or null without a blend.
     */
    public CrossSectionPair getCompositePair() {
        if (blend == null) return null;
        return new CrossSectionPair(compositeAbsorption, blend.getComposite());
    }
}
