package org.crosssection.tools;

import org.crosssection.core.MaterialParameters;
import org.crosssection.core.ProcessingParameters;
import org.crosssection.core.RawChannelSet;
import org.crosssection.core.exceptions.CrossSectionException;
import org.crosssection.io.SpectrumTableWriter;
import org.crosssection.io.SpectrumTextReader;
import org.crosssection.physics.AbsorptionCrossSectionCalculator;
import org.crosssection.physics.AbsorptionResult;
import picocli.CommandLine.Command;
import picocli.CommandLine.Mixin;
import picocli.CommandLine.Option;
import picocli.CommandLine.Parameters;

import java.io.File;
import java.io.IOException;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.Callable;

/**
 * Calculate the absorption cross section from transmission measurements.
 */
@Command(
    name = "absorption",
    description = "Calculate the absorption cross section and export it with its intermediates"
)
public class AbsorptionCommand implements Callable<Integer> {

    @Parameters(index = "0", description = "Material record (JSON)")
    private File materialFile;

    @Parameters(index = "1", description = "Output file (TSV)")
    private File outputFile;

    @Mixin
    private AbsorptionOptions absorption;

    @Option(names = {"--header-lines"}, description = "Header lines per measurement file (default: 2)", defaultValue = "2")
    private int headerLines;

    @Override
    public Integer call() throws Exception {
        if (absorption.absorptionFiles.isEmpty() || absorption.referenceFiles.isEmpty()) {
            System.err.println("Error: At least one absorption (-a) and one reference (-r) file is required");
            return 1;
        }
        List<File> inputs = new ArrayList<>();
        inputs.add(materialFile);
        inputs.addAll(absorption.absorptionFiles);
        inputs.addAll(absorption.referenceFiles);
        File missing = CommandSupport.firstMissing(inputs);
        if (missing != null) {
            System.err.println("Error: Input file not found: " + missing);
            return 1;
        }

        AbsorptionResult result;
        try {
            MaterialParameters record = CommandSupport.readMaterial(materialFile).toParameters();
            MaterialParameters material = absorption.applyTo(record, record.toBuilder()).build();
            ProcessingParameters processing = absorption.applyTo(ProcessingParameters.defaults().toBuilder()).build();
            CommandSupport.printMaterialLine(material);

            SpectrumTextReader reader = new SpectrumTextReader(headerLines);
            RawChannelSet.Builder channels = RawChannelSet.builder();
            CommandSupport.addAbsorption(channels, reader, absorption.absorptionFiles, absorption.referenceFiles);
            System.out.printf("Read %d absorption and %d reference segments%n",
                absorption.absorptionFiles.size(), absorption.referenceFiles.size());

            result = AbsorptionCrossSectionCalculator.calculate(channels.build(), material, processing);
        } catch (CrossSectionException e) {
            System.err.println("Error: " + e.getMessage());
            return 1;
        }

        System.out.printf("Absorption cross section: %d points, %.2f - %.2f nm%n",
            result.getCrossSection().size(),
            result.getCrossSection().getWavelengthMin(), result.getCrossSection().getWavelengthMax());

        try {
            new SpectrumTableWriter()
                .add("sigma_a", result.getCrossSection())
                .add("absorption", result.getAbsorption())
                .add("reference", result.getReference())
                .add("ratio", result.getRatio())
                .write(outputFile.toPath());
        } catch (IOException e) {
            System.err.println("Error writing file: " + e.getMessage());
            return 1;
        }

        System.out.println("Results written to: " + outputFile);
        return 0;
    }
}
