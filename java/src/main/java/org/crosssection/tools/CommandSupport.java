package org.crosssection.tools;

import org.crosssection.core.MaterialParameters;
import org.crosssection.core.RawChannelSet;
import org.crosssection.core.Spectrum;
import org.crosssection.io.MaterialRecord;
import org.crosssection.io.MaterialRecordReader;
import org.crosssection.io.SpectrumTextReader;

import java.io.File;
import java.util.List;

/**
 * Input handling shared by the subcommands.
 */
final class CommandSupport {

    private CommandSupport() {
    }

    /**
     * Returns the first missing file, or null when all exist.
     */
    static File firstMissing(List<File> files) {
        for (File file : files) {
            if (file != null && !file.exists()) return file;
        }
        return null;
    }

    static MaterialRecord readMaterial(File file) {
        return new MaterialRecordReader().read(file.toPath());
    }

    static void addAbsorption(RawChannelSet.Builder builder, SpectrumTextReader reader,
                              List<File> absorption, List<File> reference) {
        for (File file : absorption) {
            builder.addAbsorption(reader.read(file.toPath()));
        }
        for (File file : reference) {
            builder.addReference(reader.read(file.toPath()));
        }
    }

    static void addFluorescence(RawChannelSet.Builder builder, SpectrumTextReader reader,
                                File single, File low, File high) {
        if (single != null) {
            builder.fluorescence(reader.read(single.toPath()));
        } else {
            Spectrum lowCurve = reader.read(low.toPath());
            Spectrum highCurve = reader.read(high.toPath());
            builder.fluorescencePair(lowCurve, highCurve);
        }
    }

    /**
     * Checks the fluorescence options: either one curve or a complete low/high pair.
     *
     * @return an error message, or null when the combination is usable
     */
    static String checkFluorescenceOptions(File single, File low, File high, MaterialRecord record) {
        if (single != null && (low != null || high != null)) {
            return "Use either -f or --low/--high, not both";
        }
        if (single == null && (low == null || high == null)) {
            return "Fluorescence needs -f <file> or both --low and --high";
        }
        if (record.isCorrectTemp() && single != null) {
            return "Material " + record.getName() + " is temperature corrected, use --low and --high";
        }
        return null;
    }

    static void printMaterialLine(MaterialParameters material) {
        System.out.printf("Material: %s (ZPL %.2f nm, T %.1f K)%n",
            material.getName(), material.getZeroPhononLineNm(), material.getTemperature());
    }
}
