package org.crosssection.io;

import org.crosssection.core.Spectrum;

import java.io.IOException;
import java.io.PrintWriter;
import java.io.Writer;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.*;

/**
 * Writes labelled spectra side by side as tab-separated X/Y column pairs. Shorter curves are
 * padded with empty cells.
 */
public class SpectrumTableWriter {

    private final Map<String, Spectrum> columns = new LinkedHashMap<>();

    /**
     * Adds a curve; null curves are skipped so optional pipeline outputs can be passed as is.
     */
    public SpectrumTableWriter add(String label, Spectrum spectrum) {
        if (spectrum != null) {
            if (columns.containsKey(label)) {
                throw new IllegalArgumentException("duplicate column label: " + label);
            }
            columns.put(label, spectrum);
        }
        return this;
    }

    public int getColumnCount() {
        return columns.size();
    }

    public void write(Path path) throws IOException {
        try (Writer out = Files.newBufferedWriter(path, StandardCharsets.UTF_8)) {
            write(out);
        }
    }

    public void write(Writer out) {
        PrintWriter writer = new PrintWriter(out);
        List<String> header = new ArrayList<>();
        int rows = 0;
        for (Map.Entry<String, Spectrum> entry : columns.entrySet()) {
            header.add("X_" + entry.getKey());
            header.add("Y_" + entry.getKey());
            rows = Math.max(rows, entry.getValue().size());
        }
        writer.print(String.join("\t", header));
        writer.print('\n');

        for (int i = 0; i < rows; i++) {
            StringBuilder row = new StringBuilder();
            boolean first = true;
            for (Spectrum spectrum : columns.values()) {
                if (!first) row.append('\t');
                first = false;
                if (i < spectrum.size()) {
                    row.append(format(spectrum.getWavelengthAt(i))).append('\t').append(format(spectrum.getValueAt(i)));
                } else {
                    row.append('\t');
                }
            }
            writer.print(row);
            writer.print('\n');
        }
        writer.flush();
    }

    static String format(double value) {
        return String.format(Locale.ROOT, "%.5e", value);
    }
}
