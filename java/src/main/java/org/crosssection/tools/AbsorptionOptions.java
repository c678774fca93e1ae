package org.crosssection.tools;

import org.crosssection.core.MaterialParameters;
import org.crosssection.core.ProcessingParameters;
import picocli.CommandLine.Option;

import java.io.File;
import java.util.ArrayList;
import java.util.List;

/**
 * Absorption inputs and processing options shared by the absorption and cross-section commands.
 */
public class AbsorptionOptions {

    @Option(names = {"-a", "--absorption"}, arity = "1..*",
        description = "Absorption measurement files, one per wavelength segment")
    List<File> absorptionFiles = new ArrayList<>();

    @Option(names = {"-r", "--reference"}, arity = "1..*",
        description = "Reference measurement files, one per wavelength segment")
    List<File> referenceFiles = new ArrayList<>();

    @Option(names = {"--filter-width"}, description = "Fourier filter width, fraction in [0, 1] (default: 0)", defaultValue = "0")
    double filterWidth;

    @Option(names = {"--savgol-window"}, description = "Savitzky-Golay window in samples (default: 20)", defaultValue = "20")
    int savgolWindow;

    @Option(names = {"--savgol-order"}, description = "Savitzky-Golay polynomial order (default: 3)", defaultValue = "3")
    int savgolOrder;

    @Option(names = {"--zero-width"}, description = "Zero absorption window width in nm (0 = linear baseline)")
    Double zeroWidth;

    @Option(names = {"--zero-lambda1"}, description = "Centre of the lower zero absorption window (nm)")
    Double zeroLambda1;

    @Option(names = {"--zero-lambda2"}, description = "Centre of the upper zero absorption window (nm)")
    Double zeroLambda2;

    MaterialParameters.Builder applyTo(MaterialParameters material, MaterialParameters.Builder builder) {
        if (zeroWidth != null) builder.zeroAbsorptionWidth(zeroWidth);
        if (zeroLambda1 != null || zeroLambda2 != null) {
            builder.zeroAbsorptionWavelengths(
                zeroLambda1 != null ? zeroLambda1 : material.getZeroAbsorptionLambda1(),
                zeroLambda2 != null ? zeroLambda2 : material.getZeroAbsorptionLambda2());
        }
        return builder;
    }

    ProcessingParameters.Builder applyTo(ProcessingParameters.Builder builder) {
        return builder
            .filterWidth(filterWidth)
            .savgol(savgolWindow, savgolOrder);
    }
}
