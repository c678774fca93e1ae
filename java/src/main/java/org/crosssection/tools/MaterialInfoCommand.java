package org.crosssection.tools;

import org.crosssection.core.MaterialParameters;
import org.crosssection.core.exceptions.CrossSectionException;
import org.crosssection.io.MaterialRecord;
import org.crosssection.physics.McCumberConverter;
import picocli.CommandLine.Command;
import picocli.CommandLine.Parameters;

import java.io.File;
import java.util.Arrays;
import java.util.concurrent.Callable;

/**
 * Display the parameters of a material record.
 */
@Command(
    name = "material",
    description = "Display material parameters and derived quantities"
)
public class MaterialInfoCommand implements Callable<Integer> {

    @Parameters(index = "0", description = "Material record (JSON)")
    private File materialFile;

    @Override
    public Integer call() throws Exception {
        if (!materialFile.exists()) {
            System.err.println("Error: File not found: " + materialFile);
            return 1;
        }

        MaterialRecord record;
        MaterialParameters material;
        McCumberConverter converter;
        try {
            record = CommandSupport.readMaterial(materialFile);
            material = record.toParameters();
            converter = McCumberConverter.forMaterial(material);
        } catch (CrossSectionException e) {
            System.err.println("Error: " + e.getMessage());
            return 1;
        }

        System.out.println("=== Material ===");
        System.out.println("Name: " + material.getName());
        if (material.getDate() != null) {
            System.out.println("Date: " + material.getDate());
        }
        System.out.printf("Doping: %.3e cm^-3%n", material.getDopingPerCm3());
        System.out.printf("Length: %.3f mm%n", material.getLength() * 1e3);
        System.out.printf("Lifetime: %.3f ms%n", material.getLifetime() * 1e3);
        System.out.printf("Refractive index: %.4f%n", material.getRefractiveIndex());
        System.out.printf("Temperature: %.1f K%n", material.getTemperature());
        System.out.println("Temperature corrected fluorescence: " + (record.isCorrectTemp() ? "yes" : "no"));

        System.out.println();
        System.out.println("=== Energy Levels ===");
        System.out.println("Lower manifold: " + Arrays.toString(material.getEnergyLowerLevel()) + " cm^-1");
        System.out.println("Upper manifold: " + Arrays.toString(material.getEnergyUpperLevel()) + " cm^-1");
        System.out.printf("ZPL: %.2f nm (%.4f eV)%n", material.getZeroPhononLineNm(), converter.getZeroPhononEnergy());
        System.out.printf("kT: %.5f eV%n", converter.getThermalEnergy());
        System.out.printf("Partition functions: Z_l = %.4f, Z_u = %.4f%n",
            converter.getPartitionLower(), converter.getPartitionUpper());

        System.out.println();
        System.out.println("=== Processing ===");
        System.out.printf("Zero absorption window: %.1f nm around %.1f and %.1f nm%n",
            material.getZeroAbsorptionWidth(), material.getZeroAbsorptionLambda1(), material.getZeroAbsorptionLambda2());
        System.out.printf("Reabsorption depth: %.3f mm%n", material.getAbsorptionDepth());
        System.out.printf("Crossfade: FL from %.2f nm, MC up to %.2f nm%n",
            material.getFuchtbauerMin(), material.getMcCumberMax());
        return 0;
    }
}
