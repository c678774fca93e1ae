package org.crosssection.tools;

import org.crosssection.core.MaterialParameters;
import org.crosssection.core.ProcessingParameters;
import org.crosssection.core.RawChannelSet;
import org.crosssection.core.exceptions.CrossSectionException;
import org.crosssection.io.MaterialRecord;
import org.crosssection.io.SpectrumTableWriter;
import org.crosssection.io.SpectrumTextReader;
import org.crosssection.physics.CrossSectionPipeline;
import org.crosssection.physics.DerivedSpectra;
import picocli.CommandLine.Command;
import picocli.CommandLine.Mixin;
import picocli.CommandLine.Option;
import picocli.CommandLine.Parameters;

import java.io.File;
import java.io.IOException;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.concurrent.Callable;

/**
 * Run the full pipeline: absorption, Füchtbauer-Ladenburg and McCumber emission, blend.
 */
@Command(
    name = "cross-sections",
    description = "Derive absorption and emission cross sections and export every curve"
)
public class CrossSectionCommand implements Callable<Integer> {

    @Parameters(index = "0", description = "Material record (JSON)")
    private File materialFile;

    @Parameters(index = "1", description = "Output file (TSV)")
    private File outputFile;

    @Mixin
    private AbsorptionOptions absorption;

    @Option(names = {"-f", "--fluorescence"}, description = "Single fluorescence measurement")
    private File fluorescenceFile;

    @Option(names = {"--low"}, description = "Low temperature fluorescence measurement")
    private File lowFile;

    @Option(names = {"--high"}, description = "High temperature fluorescence measurement")
    private File highFile;

    @Option(names = {"--fluorescence-filter-width"}, description = "Fourier filter width for fluorescence (default: 0.6)", defaultValue = "0.6")
    private double fluorescenceFilterWidth;

    @Option(names = {"--no-mccumber"}, description = "Skip the McCumber emission cross section")
    private boolean noMcCumber;

    @Option(names = {"--no-fuchtbauer"}, description = "Skip the Fuchtbauer-Ladenburg emission cross section")
    private boolean noFuchtbauer;

    @Option(names = {"--depth"}, description = "Effective reabsorption depth in mm")
    private Double depth;

    @Option(names = {"--fl-min"}, description = "Lower wavelength limit of the Fuchtbauer-Ladenburg curve (nm)")
    private Double flMin;

    @Option(names = {"--mc-max"}, description = "Upper wavelength limit of the McCumber curve (nm)")
    private Double mcMax;

    @Option(names = {"--header-lines"}, description = "Header lines per measurement file (default: 2)", defaultValue = "2")
    private int headerLines;

    @Override
    public Integer call() throws Exception {
        if (noMcCumber && noFuchtbauer) {
            System.err.println("Error: Nothing to do with both --no-mccumber and --no-fuchtbauer");
            return 1;
        }
        if (!noMcCumber && (absorption.absorptionFiles.isEmpty() || absorption.referenceFiles.isEmpty())) {
            System.err.println("Error: McCumber needs absorption (-a) and reference (-r) files");
            return 1;
        }
        if (absorption.absorptionFiles.isEmpty() != absorption.referenceFiles.isEmpty()) {
            System.err.println("Error: Absorption (-a) and reference (-r) files must be given together");
            return 1;
        }
        List<File> inputs = new ArrayList<>(Arrays.asList(materialFile, fluorescenceFile, lowFile, highFile));
        inputs.addAll(absorption.absorptionFiles);
        inputs.addAll(absorption.referenceFiles);
        File missing = CommandSupport.firstMissing(inputs);
        if (missing != null) {
            System.err.println("Error: Input file not found: " + missing);
            return 1;
        }

        DerivedSpectra derived;
        try {
            MaterialRecord record = CommandSupport.readMaterial(materialFile);
            if (!noFuchtbauer) {
                String problem = CommandSupport.checkFluorescenceOptions(fluorescenceFile, lowFile, highFile, record);
                if (problem != null) {
                    System.err.println("Error: " + problem);
                    return 1;
                }
            }
            MaterialParameters base = record.toParameters();
            MaterialParameters.Builder builder = absorption.applyTo(base, base.toBuilder());
            if (depth != null) builder.absorptionDepth(depth);
            if (flMin != null) builder.fuchtbauerMin(flMin);
            if (mcMax != null) builder.mcCumberMax(mcMax);
            MaterialParameters material = builder.build();
            CommandSupport.printMaterialLine(material);

            ProcessingParameters processing = absorption.applyTo(ProcessingParameters.defaults().toBuilder())
                .fluorescenceFilterWidth(fluorescenceFilterWidth)
                .useMcCumber(!noMcCumber)
                .useFuchtbauer(!noFuchtbauer)
                .build();

            SpectrumTextReader reader = new SpectrumTextReader(headerLines);
            RawChannelSet.Builder channels = RawChannelSet.builder();
            CommandSupport.addAbsorption(channels, reader, absorption.absorptionFiles, absorption.referenceFiles);
            if (!noFuchtbauer) {
                CommandSupport.addFluorescence(channels, reader, fluorescenceFile, lowFile, highFile);
            }

            derived = CrossSectionPipeline.derive(channels.build(), material, processing);
        } catch (CrossSectionException e) {
            System.err.println("Error: " + e.getMessage());
            return 1;
        }

        if (derived.getAbsorptionCrossSection() != null) {
            System.out.printf("Absorption cross section: %d points%n", derived.getAbsorptionCrossSection().size());
        }
        if (derived.getFuchtbauerEmission() != null) {
            System.out.printf("Fuchtbauer-Ladenburg emission: %d points%n", derived.getFuchtbauerEmission().size());
        }
        if (derived.getMcCumberEmission() != null) {
            System.out.printf("McCumber emission: %d points%n", derived.getMcCumberEmission().size());
        }
        if (derived.hasBlend()) {
            System.out.printf("Blended emission: %d points%n", derived.getBlend().getComposite().size());
        }

        try {
            new SpectrumTableWriter()
                .add("sigma_a", derived.getAbsorptionCrossSection())
                .add("sigma_e_FL", derived.getFuchtbauerEmission())
                .add("sigma_e_MC", derived.getMcCumberEmission())
                .add("sigma_e", derived.hasBlend() ? derived.getBlend().getComposite() : null)
                .add("sigma_a_MC", derived.getCompositeAbsorption())
                .write(outputFile.toPath());
        } catch (IOException e) {
            System.err.println("Error writing file: " + e.getMessage());
            return 1;
        }

        System.out.println("Results written to: " + outputFile);
        return 0;
    }
}
