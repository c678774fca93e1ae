package org.crosssection.tools;

import org.crosssection.core.ProcessingParameters;
import org.crosssection.core.RawChannelSet;
import org.crosssection.core.exceptions.CrossSectionException;
import org.crosssection.io.MaterialRecord;
import org.crosssection.io.SpectrumTableWriter;
import org.crosssection.io.SpectrumTextReader;
import org.crosssection.physics.FluorescenceNormalizer;
import org.crosssection.physics.FluorescenceResult;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;
import picocli.CommandLine.Parameters;

import java.io.File;
import java.io.IOException;
import java.util.Arrays;
import java.util.concurrent.Callable;

/**
 * Normalize a fluorescence measurement into a lineshape.
 */
@Command(
    name = "fluorescence",
    description = "Normalize fluorescence, merging low/high temperature measurements"
)
public class FluorescenceCommand implements Callable<Integer> {

    @Parameters(index = "0", description = "Material record (JSON)")
    private File materialFile;

    @Parameters(index = "1", description = "Output file (TSV)")
    private File outputFile;

    @Option(names = {"-f", "--fluorescence"}, description = "Single fluorescence measurement")
    private File fluorescenceFile;

    @Option(names = {"--low"}, description = "Low temperature fluorescence measurement")
    private File lowFile;

    @Option(names = {"--high"}, description = "High temperature fluorescence measurement")
    private File highFile;

    @Option(names = {"--filter-width"}, description = "Fourier filter width, fraction in [0, 1] (default: 0.6)", defaultValue = "0.6")
    private double filterWidth;

    @Option(names = {"--tolerance"}, description = "Low/high merge tolerance (default: 1e-5)", defaultValue = "1e-5")
    private double tolerance;

    @Option(names = {"--header-lines"}, description = "Header lines per measurement file (default: 2)", defaultValue = "2")
    private int headerLines;

    @Override
    public Integer call() throws Exception {
        File missing = CommandSupport.firstMissing(Arrays.asList(materialFile, fluorescenceFile, lowFile, highFile));
        if (missing != null) {
            System.err.println("Error: Input file not found: " + missing);
            return 1;
        }

        FluorescenceResult result;
        try {
            MaterialRecord record = CommandSupport.readMaterial(materialFile);
            String problem = CommandSupport.checkFluorescenceOptions(fluorescenceFile, lowFile, highFile, record);
            if (problem != null) {
                System.err.println("Error: " + problem);
                return 1;
            }
            CommandSupport.printMaterialLine(record.toParameters());
            ProcessingParameters processing = ProcessingParameters.defaults().toBuilder()
                .fluorescenceFilterWidth(filterWidth)
                .reconciliationTolerance(tolerance)
                .build();

            RawChannelSet.Builder channels = RawChannelSet.builder();
            CommandSupport.addFluorescence(channels, new SpectrumTextReader(headerLines), fluorescenceFile, lowFile, highFile);
            result = FluorescenceNormalizer.normalize(channels.build(), processing);
        } catch (CrossSectionException e) {
            System.err.println("Error: " + e.getMessage());
            return 1;
        }

        System.out.printf("Lineshape: %d points%s%n", result.getLineshape().size(),
            result.isMerged() ? " (merged from low/high temperature)" : "");

        try {
            new SpectrumTableWriter()
                .add("fluorescence", result.getLineshape())
                .add("low", result.getLow())
                .add("high", result.getHigh())
                .write(outputFile.toPath());
        } catch (IOException e) {
            System.err.println("Error writing file: " + e.getMessage());
            return 1;
        }

        System.out.println("Results written to: " + outputFile);
        return 0;
    }
}
