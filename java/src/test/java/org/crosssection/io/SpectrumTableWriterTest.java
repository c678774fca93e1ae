package org.crosssection.io;

import org.crosssection.core.Spectrum;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.io.StringWriter;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

public class SpectrumTableWriterTest {

    @TempDir Path tempDir;

    @Test
    public void testPairedColumnsWithPadding() {
        StringWriter out = new StringWriter();
        new SpectrumTableWriter()
            .add("sigma_a", new Spectrum(new double[]{900, 901}, new double[]{1e-20, 2.5e-20}))
            .add("skipped", null)
            .add("ratio", new Spectrum(new double[]{900}, new double[]{0.5}))
            .write(out);

        String[] lines = out.toString().split("\n", -1);
        assertEquals("X_sigma_a\tY_sigma_a\tX_ratio\tY_ratio", lines[0]);
        assertEquals("9.00000e+02\t1.00000e-20\t9.00000e+02\t5.00000e-01", lines[1]);
        assertEquals("9.01000e+02\t2.50000e-20\t\t", lines[2]);
        assertEquals("", lines[3]);
    }

    @Test
    public void testWritesFile() throws IOException {
        Path file = tempDir.resolve("out.tsv");
        SpectrumTableWriter writer = new SpectrumTableWriter()
            .add("a", new Spectrum(new double[]{1, 2, 3}, new double[]{4, 5, 6}));
        writer.write(file);

        List<String> lines = Files.readAllLines(file);
        assertEquals(4, lines.size());
        assertEquals(1, writer.getColumnCount());
        assertEquals("3.00000e+00\t6.00000e+00", lines.get(3));
    }

    @Test
    public void testDuplicateLabel() {
        Spectrum s = new Spectrum(new double[]{1}, new double[]{1});
        assertThrows(IllegalArgumentException.class, () -> new SpectrumTableWriter().add("a", s).add("a", s));
    }
}
