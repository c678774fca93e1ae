package org.crosssection.physics;

import org.crosssection.core.MaterialParameters;
import org.crosssection.core.ProcessingParameters;
import org.crosssection.core.RawChannelSet;
import org.crosssection.core.Spectrum;
import org.crosssection.core.exceptions.SpectrumLoadException;

import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Full recomputation of every derived spectrum from raw channels and frozen parameters.
 * Holds no state; the same inputs always give the same output.
 */
public final class CrossSectionPipeline {

    private static final Logger logger = Logger.getLogger(CrossSectionPipeline.class.getName());

    private CrossSectionPipeline() {
    }

    /**
     * Runs absorption, Füchtbauer-Ladenburg, McCumber and the blend as far as the channels and
     * {@code processing} flags allow. McCumber needs the absorption channels; Füchtbauer-Ladenburg
     * runs without them and then skips the reabsorption correction. Absorption segments without
     * reference segments, or the reverse, are rejected.
     */
    public static DerivedSpectra derive(RawChannelSet raw, MaterialParameters material,
                                        ProcessingParameters processing) {
        logger.log(Level.FINE, "Deriving cross sections for {0}", material.getName());

        if (raw.getAbsorption().isEmpty() != raw.getReference().isEmpty()) {
            throw new SpectrumLoadException(raw.getAbsorption().isEmpty()
                ? "reference segments supplied without absorption segments"
                : "absorption segments supplied without reference segments");
        }

        AbsorptionResult absorption = null;
        if (raw.hasAbsorption() || processing.isUseMcCumber()) {
            absorption = AbsorptionCrossSectionCalculator.calculate(raw, material, processing);
            logger.log(Level.FINE, "Absorption cross section: {0}", absorption.getCrossSection());
        }
        Spectrum sigmaA = absorption == null ? null : absorption.getCrossSection();

        FluorescenceResult fluorescence = null;
        Spectrum fuchtbauer = null;
        if (processing.isUseFuchtbauer()) {
            fluorescence = FluorescenceNormalizer.normalize(raw, processing);
            fuchtbauer = FuchtbauerLadenburgCalculator.calculate(fluorescence.getLineshape(), material, sigmaA);
            logger.log(Level.FINE, "Fuchtbauer-Ladenburg emission: {0}", fuchtbauer);
        }

        Spectrum mcCumber = null;
        McCumberConverter converter = null;
        if (processing.isUseMcCumber()) {
            converter = McCumberConverter.forMaterial(material);
            mcCumber = converter.convert(sigmaA, false);
            logger.log(Level.FINE, "McCumber emission with {0}", converter);
        }

        BlendResult blend = null;
        Spectrum compositeAbsorption = null;
        if (fuchtbauer != null && mcCumber != null) {
            blend = SpectralBlender.blend(fuchtbauer, mcCumber, material.getFuchtbauerMin(), material.getMcCumberMax());
            compositeAbsorption = converter.convert(blend.getComposite(), true);
            logger.log(Level.FINE, "Blended emission on {0} samples, FL_min={1} nm, MC_max={2} nm",
                new Object[]{blend.getComposite().size(), material.getFuchtbauerMin(), material.getMcCumberMax()});
        }

        return new DerivedSpectra(absorption, fluorescence, fuchtbauer, mcCumber, blend, compositeAbsorption);
    }
}
