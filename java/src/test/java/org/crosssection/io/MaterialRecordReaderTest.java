package org.crosssection.io;

import org.crosssection.core.MaterialParameters;
import org.crosssection.core.exceptions.InvalidParameterException;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.ByteArrayInputStream;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;

import static org.junit.jupiter.api.Assertions.*;

public class MaterialRecordReaderTest {

    static final String YB_YAG = "{\n"
        + "  \"name\": \"Yb:YAG\",\n"
        + "  \"date\": \"2024-03-01\",\n"
        + "  \"N_dop\": 1.38e26,\n"
        + "  \"length\": 0.002,\n"
        + "  \"tau_f\": 0.00095,\n"
        + "  \"n\": 1.82,\n"
        + "  \"ZPL\": 9.688e-7,\n"
        + "  \"energy_lower_level\": [0, 565, 612, 785],\n"
        + "  \"energy_upper_level\": [10327, 10624, 10679],\n"
        + "  \"zero_absorption_width\": 10,\n"
        + "  \"zero_absorption_wavelength\": [880, Infinity],\n"
        + "  \"absorption_depth\": 0.3,\n"
        + "  \"correct_temp\": true\n"
        + "}\n";

    @TempDir Path tempDir;

    private static MaterialRecord parse(String json) throws IOException {
        return new MaterialRecordReader().read(new ByteArrayInputStream(json.getBytes(StandardCharsets.UTF_8)));
    }

    @Test
    public void testReadsRecord() throws IOException {
        Path file = tempDir.resolve("basedata.json");
        Files.writeString(file, YB_YAG);

        MaterialRecord record = new MaterialRecordReader().read(file);
        MaterialParameters material = record.toParameters();

        assertTrue(record.isCorrectTemp());
        assertEquals("Yb:YAG", material.getName());
        assertEquals("2024-03-01", material.getDate());
        assertEquals(1.38e26, material.getDoping());
        assertArrayEquals(new double[]{0, 565, 612, 785}, material.getEnergyLowerLevel());
        assertArrayEquals(new double[]{2, 2, 2, 2}, material.getDegeneracyLower());
        assertEquals(10, material.getZeroAbsorptionWidth());
        assertEquals(880, material.getZeroAbsorptionLambda1());
        assertEquals(Double.POSITIVE_INFINITY, material.getZeroAbsorptionLambda2());
        assertEquals(0.3, material.getAbsorptionDepth());
        assertEquals(295, material.getTemperature());
        assertEquals(958.8, material.getFuchtbauerMin(), 1e-9);
    }

    @Test
    public void testOptionalOverrides() throws IOException {
        MaterialRecord record = parse("{\"N_dop\": 1e26, \"length\": 1e-3, \"tau_f\": 1e-3, \"n\": 1.8,"
            + " \"ZPL\": 9.7e-7, \"temperature\": 77, \"FL_min\": 950, \"MC_max\": 990}");

        MaterialParameters material = record.toParameters();

        assertFalse(record.isCorrectTemp());
        assertEquals(77, material.getTemperature());
        assertEquals(950, material.getFuchtbauerMin());
        assertEquals(990, material.getMcCumberMax());
        assertEquals("unnamed", material.getName());
    }

    @Test
    public void testRejectsBadRecords() {
        assertThrows(InvalidParameterException.class, () -> parse("{\"N_dop\": 1e26, \"colour\": \"blue\"}"));
        assertThrows(InvalidParameterException.class, () -> parse("{\"N_dop\": "));
        assertThrows(InvalidParameterException.class,
            () -> parse("{\"N_dop\": 1e26, \"length\": 1e-3, \"n\": 1.8, \"ZPL\": 9.7e-7}").toParameters());
        assertThrows(InvalidParameterException.class, () -> parse("{\"N_dop\": 1e26, \"length\": 1e-3,"
            + " \"tau_f\": 1e-3, \"n\": 1.8, \"ZPL\": 9.7e-7, \"zero_absorption_wavelength\": [900]}").toParameters());
        assertThrows(InvalidParameterException.class,
            () -> new MaterialRecordReader().read(tempDir.resolve("missing.json")));
    }
}
